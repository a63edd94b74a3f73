package com.diplomacy.error;

import java.util.UUID;

public class NotAParticipantException extends DiplomacyException {

    public NotAParticipantException(String factionId, UUID sessionId) {
        super("faction " + factionId + " is not part of negotiation " + sessionId);
    }

    @Override
    public String errorCode() {
        return "NOT_A_PARTICIPANT";
    }
}
