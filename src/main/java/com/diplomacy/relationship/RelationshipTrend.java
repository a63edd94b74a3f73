package com.diplomacy.relationship;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RelationshipTrend {
    RAPIDLY_IMPROVING("rapidly_improving"),
    IMPROVING("improving"),
    STABLE("stable"),
    DECLINING("declining"),
    RAPIDLY_DECLINING("rapidly_declining"),
    VOLATILE("volatile");

    private final String value;

    RelationshipTrend(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isImproving() {
        return this == IMPROVING || this == RAPIDLY_IMPROVING;
    }

    public boolean isDeclining() {
        return this == DECLINING || this == RAPIDLY_DECLINING;
    }
}
