package com.diplomacy.negotiation;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.UUID;

public record ActionResult(
    @JsonProperty("negotiation_id") UUID sessionId,
    @JsonProperty("faction_id") String factionId,
    @JsonProperty("action") NegotiationAction action,
    @JsonProperty("effect") String effect,
    @JsonProperty("previous_phase") NegotiationPhase previousPhase,
    @JsonProperty("current_phase") NegotiationPhase phase,
    @JsonProperty("rounds_completed") int roundsCompleted,
    @JsonProperty("terms_version") int termsVersion,
    @JsonProperty("success_probability") double successProbability,
    @JsonProperty("available_actions") List<NegotiationAction> availableActions
) {}
