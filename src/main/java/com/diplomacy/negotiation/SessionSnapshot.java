package com.diplomacy.negotiation;

import com.diplomacy.alliance.AllianceTerms;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Read-only projection of a session. Contains nothing derived from the
 * current time, so repeated reads without an intervening action are equal.
 */
public record SessionSnapshot(
    @JsonProperty("negotiation_id") UUID sessionId,
    @JsonProperty("initiator_id") String initiatorId,
    @JsonProperty("current_phase") NegotiationPhase phase,
    @JsonProperty("participants") List<String> participants,
    @JsonProperty("faction_stances") Map<String, NegotiationStance> stances,
    @JsonProperty("positions") List<NegotiationPosition> positions,
    @JsonProperty("rounds_completed") int roundsCompleted,
    @JsonProperty("max_rounds") int maxRounds,
    @JsonProperty("consensus_threshold") double consensusThreshold,
    @JsonProperty("success_probability") double successProbability,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("deadline") Instant deadline,
    @JsonProperty("terms") AllianceTerms terms,
    @JsonProperty("history") List<NegotiationEvent> history
) {}
