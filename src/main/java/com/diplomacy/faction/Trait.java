package com.diplomacy.faction;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Hidden personality dimensions. Values are integers on a 0-10 scale and are
 * never shown to players; every score in the engine is derived from them.
 */
public enum Trait {
    PRAGMATISM("pragmatism"),
    INTEGRITY("integrity"),
    AMBITION("ambition"),
    IMPULSIVITY("impulsivity"),
    DISCIPLINE("discipline"),
    RESILIENCE("resilience");

    private final String value;

    Trait(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static Trait fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        String normalized = raw.startsWith("hidden_") ? raw.substring("hidden_".length()) : raw;
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(normalized))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown trait: " + raw));
    }
}
