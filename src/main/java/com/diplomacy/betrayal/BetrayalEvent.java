package com.diplomacy.betrayal;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Assessed outcome of a betrayal that actually happened. Built, not persisted.
 */
public record BetrayalEvent(
    @JsonProperty("betrayer_faction_id") String betrayerFactionId,
    @JsonProperty("betrayal_type") BetrayalType betrayalType,
    @JsonProperty("motivation") BetrayalMotivation motivation,
    @JsonProperty("description") String description,
    @JsonProperty("occurred_at") Instant occurredAt,
    @JsonProperty("impact_severity") double impactSeverity,
    @JsonProperty("trust_damage") double trustDamage,
    @JsonProperty("consequences") List<String> consequences
) {}
