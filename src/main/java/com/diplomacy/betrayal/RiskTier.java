package com.diplomacy.betrayal;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RiskTier {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private final String value;

    RiskTier(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
