package com.diplomacy.error;

public class FactionNotFoundException extends NotFoundException {

    private final String factionId;

    public FactionNotFoundException(String factionId) {
        super("faction not found: " + factionId);
        this.factionId = factionId;
    }

    public String getFactionId() {
        return factionId;
    }

    @Override
    public String errorCode() {
        return "FACTION_NOT_FOUND";
    }
}
