package com.diplomacy.negotiation;

import com.fasterxml.jackson.annotation.JsonProperty;

public record FactionResponse(
    @JsonProperty("faction_id") String factionId,
    @JsonProperty("response") ResponseKind response,
    @JsonProperty("message") String message
) {
    public static FactionResponse from(NegotiationPosition position) {
        ResponseKind kind = position.stance().getDefaultResponse();
        return new FactionResponse(position.factionId(), kind, kind.getMessage());
    }
}
