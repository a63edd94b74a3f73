package com.diplomacy.error;

import java.util.UUID;

public class SessionNotFoundException extends NotFoundException {

    public SessionNotFoundException(UUID sessionId) {
        super("negotiation not found: " + sessionId);
    }

    @Override
    public String errorCode() {
        return "SESSION_NOT_FOUND";
    }
}
