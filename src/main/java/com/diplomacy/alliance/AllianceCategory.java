package com.diplomacy.alliance;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Kinds of alliance recommended by opportunity evaluation.
 */
public enum AllianceCategory {
    DEFENSIVE("defensive"),
    MUTUAL_PROTECTION("mutual_protection"),
    EXPANSIONIST("expansionist"),
    TRADE("trade"),
    FORMAL("formal"),
    COOPERATION("cooperation");

    private final String value;

    AllianceCategory(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static AllianceCategory fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown alliance category: " + raw));
    }
}
