package com.diplomacy.negotiation;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * Entry in a session's append-only log.
 */
public record NegotiationEvent(
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("event_type") String eventType,
    @JsonProperty("faction_id") String factionId,
    @JsonProperty("phase") NegotiationPhase phase,
    @JsonProperty("round") int round,
    @JsonProperty("data") Map<String, Object> data
) {
    public NegotiationEvent {
        data = Map.copyOf(data);
    }
}
