package com.diplomacy.network;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A low-trust pair.
 *
 * @param conflictRisk conflict probability of a neutral-compatibility, zero-volatility pair at this trust
 */
public record TensionHotspot(
    @JsonProperty("factions") List<String> factions,
    @JsonProperty("trust_level") double trustLevel,
    @JsonProperty("tension_level") TensionLevel tensionLevel,
    @JsonProperty("conflict_risk") double conflictRisk
) {
    public TensionHotspot {
        factions = List.copyOf(factions);
    }
}
