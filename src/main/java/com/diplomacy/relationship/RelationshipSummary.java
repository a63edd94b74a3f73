package com.diplomacy.relationship;

import com.diplomacy.faction.DiplomaticStatus;
import com.diplomacy.trust.InteractionRecord;
import com.diplomacy.trust.TrustCategory;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Read-only projection of one pair's history. Recomputed on every request.
 */
public record RelationshipSummary(
    @JsonProperty("faction_a_id") String factionAId,
    @JsonProperty("faction_b_id") String factionBId,
    @JsonProperty("faction_a_name") String factionAName,
    @JsonProperty("faction_b_name") String factionBName,
    @JsonProperty("current_trust_level") TrustCategory currentTrustLevel,
    @JsonProperty("mutual_trust_score") double mutualTrustScore,
    @JsonProperty("a_trusts_b") double aTrustsB,
    @JsonProperty("b_trusts_a") double bTrustsA,
    @JsonProperty("relationship_trend") RelationshipTrend relationshipTrend,
    @JsonProperty("diplomatic_status") DiplomaticStatus diplomaticStatus,
    @JsonProperty("relationship_duration_days") long relationshipDurationDays,
    @JsonProperty("total_interactions") int totalInteractions,
    @JsonProperty("positive_interactions") int positiveInteractions,
    @JsonProperty("negative_interactions") int negativeInteractions,
    @JsonProperty("predicted_trajectory") RelationshipTrend predictedTrajectory,
    @JsonProperty("alliance_probability") double allianceProbability,
    @JsonProperty("conflict_probability") double conflictProbability,
    @JsonProperty("stability_score") double stabilityScore,
    @JsonProperty("last_interaction_date") Instant lastInteractionDate,
    @JsonProperty("most_significant_positive_event") InteractionRecord mostSignificantPositiveEvent,
    @JsonProperty("most_significant_negative_event") InteractionRecord mostSignificantNegativeEvent,
    @JsonProperty("turning_points") List<InteractionRecord> turningPoints
) {
    public RelationshipSummary {
        turningPoints = List.copyOf(turningPoints);
    }
}
