package com.diplomacy.network;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TensionLevel {
    HIGH("high"),
    MODERATE("moderate");

    private final String value;

    TensionLevel(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
