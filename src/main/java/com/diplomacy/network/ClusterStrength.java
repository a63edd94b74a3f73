package com.diplomacy.network;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ClusterStrength {
    STRONG("strong"),
    MODERATE("moderate");

    private final String value;

    ClusterStrength(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
