package com.diplomacy.alliance;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Domain of a negotiated alliance; selects the default term template.
 */
public enum AllianceType {
    MILITARY("military"),
    ECONOMIC("economic"),
    DIPLOMATIC("diplomatic");

    private final String value;

    AllianceType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static AllianceType fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown alliance type: " + raw));
    }
}
