package com.diplomacy.relationship;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Standing of a faction among all factions it has dealt with, by overall reputation.
 */
public enum ReputationStanding {
    TRUSTED("trusted", 0.8),
    RESPECTED("respected", 0.6),
    NEUTRAL("neutral", 0.4),
    DISTRUSTED("distrusted", 0.2),
    PARIAH("pariah", Double.NEGATIVE_INFINITY);

    private final String value;
    private final double floor;

    ReputationStanding(String value, double floor) {
        this.value = value;
        this.floor = floor;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static ReputationStanding of(double reputation) {
        for (ReputationStanding standing : values()) {
            if (reputation >= standing.floor) {
                return standing;
            }
        }
        return PARIAH;
    }
}
