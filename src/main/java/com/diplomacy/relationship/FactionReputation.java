package com.diplomacy.relationship;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * @param overallReputation mean trust other factions place in this one
 * @param reliability       share of the faction's own initiatives that did not harm trust
 */
public record FactionReputation(
    @JsonProperty("faction_id") String factionId,
    @JsonProperty("faction_name") String factionName,
    @JsonProperty("overall_reputation") double overallReputation,
    @JsonProperty("reliability") double reliability,
    @JsonProperty("diplomatic_standing") ReputationStanding standing,
    @JsonProperty("relationship_count") int relationshipCount,
    @JsonProperty("notable_alliances") List<String> notableAlliances,
    @JsonProperty("notable_conflicts") List<String> notableConflicts
) {
    public FactionReputation {
        notableAlliances = List.copyOf(notableAlliances);
        notableConflicts = List.copyOf(notableConflicts);
    }
}
