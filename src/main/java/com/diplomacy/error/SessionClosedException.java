package com.diplomacy.error;

import com.diplomacy.negotiation.NegotiationPhase;

import java.util.UUID;

/**
 * Thrown for any action against a negotiation that reached a terminal phase.
 */
public class SessionClosedException extends DiplomacyException {

    private final NegotiationPhase phase;

    public SessionClosedException(UUID sessionId, NegotiationPhase phase) {
        super("negotiation " + sessionId + " is no longer active (phase " + phase.getValue() + ")");
        this.phase = phase;
    }

    public NegotiationPhase getPhase() {
        return phase;
    }

    @Override
    public String errorCode() {
        return "SESSION_CLOSED";
    }
}
