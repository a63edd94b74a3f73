package com.diplomacy.betrayal;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum BetrayalType {
    MILITARY("military"),
    ECONOMIC("economic"),
    DIPLOMATIC("diplomatic"),
    TERRITORIAL("territorial");

    private final String value;

    BetrayalType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static BetrayalType fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown betrayal type: " + raw));
    }
}
