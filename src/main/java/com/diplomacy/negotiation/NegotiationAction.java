package com.diplomacy.negotiation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum NegotiationAction {
    /** Put a new terms version on the table; the proposer accepts it. */
    PROPOSE_TERMS("propose_terms"),
    /** Ask for changes; with overrides the terms are revised, without them it is a request for detail. */
    REQUEST_MODIFICATION("request_modification"),
    ACCEPT_TERMS("accept_terms"),
    REJECT_TERMS("reject_terms"),
    WITHDRAW("withdraw");

    private final String value;

    NegotiationAction(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /** Rejections and withdrawals hold the phase even when the remaining stances still agree. */
    public boolean canAdvancePhase() {
        return this == PROPOSE_TERMS || this == REQUEST_MODIFICATION || this == ACCEPT_TERMS;
    }

    @JsonCreator
    public static NegotiationAction fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown negotiation action: " + raw));
    }
}
