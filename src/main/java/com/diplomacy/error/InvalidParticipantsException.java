package com.diplomacy.error;

/**
 * Thrown when a negotiation is initiated with a participant count outside
 * the configured bounds.
 */
public class InvalidParticipantsException extends DiplomacyException {

    public enum Reason {
        INSUFFICIENT_PARTICIPANTS,
        TOO_MANY_PARTICIPANTS
    }

    private final Reason reason;

    public InvalidParticipantsException(Reason reason, int count, int min, int max) {
        super(reason == Reason.INSUFFICIENT_PARTICIPANTS
            ? "not enough participants for alliance: " + count + " (minimum " + min + ")"
            : "too many participants for single alliance: " + count + " (maximum " + max + ")");
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    @Override
    public String errorCode() {
        return reason.name();
    }
}
