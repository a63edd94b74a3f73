package com.diplomacy.betrayal;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Circumstances outside a faction's personality that push it toward betrayal.
 */
public record ExternalFactors(
    @JsonProperty("under_pressure") boolean underPressure,
    @JsonProperty("recent_defeats") int recentDefeats,
    @JsonProperty("resource_shortage") boolean resourceShortage,
    @JsonProperty("better_opportunity") boolean betterOpportunity
) {
    public static final ExternalFactors NONE = new ExternalFactors(false, 0, false, false);
}
