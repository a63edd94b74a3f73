package com.diplomacy.alliance;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Outcome of evaluating whether two factions should ally.
 */
public record AllianceOpportunity(
    @JsonProperty("faction_a") String factionA,
    @JsonProperty("faction_b") String factionB,
    @JsonProperty("compatible") boolean compatible,
    @JsonProperty("compatibility_score") double compatibilityScore,
    @JsonProperty("threat_level") double threatLevel,
    @JsonProperty("willingness_score") double willingnessScore,
    @JsonProperty("willingness_breakdown") WillingnessBreakdown willingnessBreakdown,
    @JsonProperty("recommended_alliance_types") List<AllianceCategory> recommendedCategories,
    @JsonProperty("risks") List<String> risks,
    @JsonProperty("benefits") List<String> benefits,
    @JsonProperty("estimated_duration") DurationEstimate estimatedDuration
) {

    public record WillingnessBreakdown(
        @JsonProperty("faction_a") double factionA,
        @JsonProperty("faction_b") double factionB
    ) {}
}
