package com.diplomacy.faction;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum DiplomaticStatus {
    ALLIED("allied"),
    FRIENDLY("friendly"),
    NEUTRAL("neutral"),
    HOSTILE("hostile"),
    AT_WAR("at_war");

    private final String value;

    DiplomaticStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static DiplomaticStatus fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown diplomatic status: " + raw));
    }
}
