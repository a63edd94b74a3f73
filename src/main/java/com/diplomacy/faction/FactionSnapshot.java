package com.diplomacy.faction;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Read-only view of a faction supplied by an {@link AttributeProvider}.
 */
public record FactionSnapshot(
    @JsonProperty("faction_id") String factionId,
    @JsonProperty("name") String name,
    @JsonProperty("traits") TraitVector traits
) {
    public FactionSnapshot {
        Objects.requireNonNull(factionId, "factionId");
        name = name != null ? name : "Faction_" + factionId;
        traits = traits != null ? traits : TraitVector.empty();
    }
}
