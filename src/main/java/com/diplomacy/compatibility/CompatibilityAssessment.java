package com.diplomacy.compatibility;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CompatibilityAssessment(
    @JsonProperty("faction_a") String factionA,
    @JsonProperty("faction_b") String factionB,
    @JsonProperty("compatibility") double compatibility,
    @JsonProperty("threat_level") double threatLevel,
    @JsonProperty("compatible") boolean compatible
) {}
