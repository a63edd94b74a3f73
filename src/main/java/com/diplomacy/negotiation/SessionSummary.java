package com.diplomacy.negotiation;

import com.diplomacy.alliance.AllianceType;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record SessionSummary(
    @JsonProperty("negotiation_id") UUID sessionId,
    @JsonProperty("current_phase") NegotiationPhase phase,
    @JsonProperty("participants") List<String> participants,
    @JsonProperty("alliance_type") AllianceType allianceType,
    @JsonProperty("deadline") Instant deadline,
    @JsonProperty("rounds_completed") int roundsCompleted
) {}
