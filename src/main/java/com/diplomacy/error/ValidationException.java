package com.diplomacy.error;

/**
 * Malformed term overrides, out-of-range scalars and other structurally
 * invalid input.
 */
public class ValidationException extends DiplomacyException {

    public ValidationException(String message) {
        super(message);
    }

    @Override
    public String errorCode() {
        return "VALIDATION_ERROR";
    }
}
