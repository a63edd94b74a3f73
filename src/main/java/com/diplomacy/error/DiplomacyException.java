package com.diplomacy.error;

/**
 * Base type for every failure the diplomacy engines report to callers.
 * Subclasses map one-to-one onto the error codes returned at the HTTP boundary.
 */
public abstract class DiplomacyException extends RuntimeException {

    protected DiplomacyException(String message) {
        super(message);
    }

    /** Machine-readable code, e.g. "NOT_FOUND". */
    public abstract String errorCode();
}
