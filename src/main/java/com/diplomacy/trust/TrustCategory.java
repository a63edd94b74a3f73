package com.diplomacy.trust;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Qualitative bands over mutual trust, highest first.
 */
public enum TrustCategory {
    ABSOLUTE_TRUST("absolute_trust", 0.9),
    HIGH_TRUST("high_trust", 0.7),
    MODERATE_TRUST("moderate_trust", 0.5),
    LOW_TRUST("low_trust", 0.3),
    DISTRUST("distrust", 0.1),
    DEEP_MISTRUST("deep_mistrust", Double.NEGATIVE_INFINITY);

    private final String value;
    private final double floor;

    TrustCategory(String value, double floor) {
        this.value = value;
        this.floor = floor;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static TrustCategory of(double mutualTrust) {
        for (TrustCategory category : values()) {
            if (mutualTrust >= category.floor) {
                return category;
            }
        }
        return DEEP_MISTRUST;
    }
}
