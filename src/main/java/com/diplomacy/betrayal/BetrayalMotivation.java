package com.diplomacy.betrayal;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Most likely reason a faction would break an alliance.
 */
public enum BetrayalMotivation {
    /** Power grab: high ambition without the integrity to restrain it. */
    AMBITION("ambition"),
    PRESSURE("pressure"),
    OPPORTUNITY("opportunity"),
    IDEOLOGY("ideology");

    private final String value;

    BetrayalMotivation(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
