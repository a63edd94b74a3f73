package com.diplomacy.negotiation;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * A faction's disposition toward one negotiation, ordered from most opposed
 * to most keen.
 */
public enum NegotiationStance {
    HOSTILE("hostile", 0.0, ResponseKind.REJECT),
    RELUCTANT("reluctant", 0.2, ResponseKind.CONDITIONAL_INTEREST),
    CAUTIOUS("cautious", 0.5, ResponseKind.REQUEST_DETAILS),
    INTERESTED("interested", 0.8, ResponseKind.COUNTER_PROPOSAL),
    EAGER("eager", 1.0, ResponseKind.ACCEPT);

    private final String value;
    private final double successScore;
    private final ResponseKind defaultResponse;

    NegotiationStance(String value, double successScore, ResponseKind defaultResponse) {
        this.value = value;
        this.successScore = successScore;
        this.defaultResponse = defaultResponse;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /** Contribution of this stance to a session's success probability. */
    public double getSuccessScore() {
        return successScore;
    }

    /** Auto-response used while the faction has not acted yet. */
    public ResponseKind getDefaultResponse() {
        return defaultResponse;
    }

    public boolean supportsConsensus() {
        return this == EAGER || this == INTERESTED;
    }

    public NegotiationStance cooler() {
        return this == HOSTILE ? HOSTILE : values()[ordinal() - 1];
    }

    public NegotiationStance atLeast(NegotiationStance floor) {
        return compareTo(floor) >= 0 ? this : floor;
    }
}
