package com.diplomacy.trust;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * One recorded interaction between two factions. Immutable; the history of a
 * pair is append-only.
 *
 * @param trustImpact      -1..+1
 * @param reputationImpact -1..+1
 * @param tensionImpact    trust impact scaled by the kind's tension multiplier
 * @param severity         0..1
 */
public record InteractionRecord(
    @JsonProperty("interaction_id") UUID interactionId,
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("interaction_kind") InteractionKind kind,
    @JsonProperty("initiator_faction_id") String initiatorId,
    @JsonProperty("target_faction_id") String targetId,
    @JsonProperty("description") String description,
    @JsonProperty("trust_impact") double trustImpact,
    @JsonProperty("reputation_impact") double reputationImpact,
    @JsonProperty("tension_impact") double tensionImpact,
    @JsonProperty("severity") double severity,
    @JsonProperty("consequences") List<String> consequences
) {
    public InteractionRecord {
        consequences = List.copyOf(consequences);
        description = description != null ? description : "";
    }

    @JsonIgnore
    public PairKey pair() {
        return PairKey.of(initiatorId, targetId);
    }

    @JsonIgnore
    public boolean isPositive() {
        return trustImpact > 0;
    }

    @JsonIgnore
    public boolean isNegative() {
        return trustImpact < 0;
    }
}
