package com.diplomacy.error;

/**
 * Thrown when a faction, negotiation session or faction pair cannot be resolved.
 * Nothing is computed or stored when this is raised.
 */
public class NotFoundException extends DiplomacyException {

    public NotFoundException(String message) {
        super(message);
    }

    @Override
    public String errorCode() {
        return "NOT_FOUND";
    }
}
