package com.diplomacy.negotiation;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ResponseKind {
    ACCEPT("accept", "We are very interested in this alliance"),
    COUNTER_PROPOSAL("counter_proposal", "We're interested but have some concerns"),
    REQUEST_DETAILS("request_details", "We need more information before proceeding"),
    CONDITIONAL_INTEREST("conditional_interest", "We might consider under certain conditions"),
    REJECT("reject", "We are not interested in this alliance");

    private final String value;
    private final String message;

    ResponseKind(String value, String message) {
        this.value = value;
        this.message = message;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getMessage() {
        return message;
    }
}
