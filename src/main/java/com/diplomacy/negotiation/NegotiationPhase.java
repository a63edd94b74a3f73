package com.diplomacy.negotiation;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Phases of a multi-party alliance negotiation.
 *
 * Edges: each open phase may step to its successor, and any open phase may
 * end in {@link #REJECTED} or {@link #EXPIRED}. {@link #RATIFICATION}'s
 * successor is {@link #COMPLETED}. Terminal phases have no outgoing edges.
 */
public enum NegotiationPhase {
    PROPOSAL("proposal"),
    COUNTER_PROPOSAL("counter_proposal"),
    TERMS_DISCUSSION("terms_discussion"),
    FINAL_REVIEW("final_review"),
    RATIFICATION("ratification"),
    COMPLETED("completed"),
    REJECTED("rejected"),
    EXPIRED("expired");

    private final String value;

    NegotiationPhase(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == REJECTED || this == EXPIRED;
    }

    public NegotiationPhase next() {
        return switch (this) {
            case PROPOSAL -> COUNTER_PROPOSAL;
            case COUNTER_PROPOSAL -> TERMS_DISCUSSION;
            case TERMS_DISCUSSION -> FINAL_REVIEW;
            case FINAL_REVIEW -> RATIFICATION;
            case RATIFICATION -> COMPLETED;
            case COMPLETED, REJECTED, EXPIRED -> throw new IllegalStateException(this + " is terminal");
        };
    }

    public boolean canTransitionTo(NegotiationPhase target) {
        if (isTerminal()) {
            return false;
        }
        return target == REJECTED || target == EXPIRED || target == next();
    }
}
