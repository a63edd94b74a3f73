package com.diplomacy.alliance;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DurationEstimate {
    LONG_TERM("Long-term (5+ years)"),
    MEDIUM_TERM("Medium-term (2-5 years)"),
    SHORT_TERM("Short-term (6 months - 2 years)"),
    VERY_SHORT_TERM("Very short-term (< 6 months)");

    private final String description;

    DurationEstimate(String description) {
        this.description = description;
    }

    @JsonValue
    public String getDescription() {
        return description;
    }
}
