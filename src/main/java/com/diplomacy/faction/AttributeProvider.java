package com.diplomacy.faction;

import com.diplomacy.error.FactionNotFoundException;

import java.util.Optional;

/**
 * Read-only faction lookup. Implemented by whatever persistence layer owns
 * factions; the engines never depend on a concrete store.
 */
public interface AttributeProvider {

    Optional<FactionSnapshot> findFaction(String factionId);

    /**
     * @throws FactionNotFoundException if the faction does not exist
     */
    default FactionSnapshot getFaction(String factionId) {
        return findFaction(factionId).orElseThrow(() -> new FactionNotFoundException(factionId));
    }

    /**
     * @throws FactionNotFoundException if the faction does not exist
     */
    default TraitVector getHiddenAttributes(String factionId) {
        return getFaction(factionId).traits();
    }
}
