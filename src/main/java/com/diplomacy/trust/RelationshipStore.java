package com.diplomacy.trust;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for interaction history and trust state, keyed by unordered pair.
 * Implementations must accept reads concurrently with writes and never expose
 * a partially written record.
 */
public interface RelationshipStore {

    void storeInteraction(InteractionRecord record);

    /** History of the pair in insertion order; empty if none. */
    List<InteractionRecord> getInteractions(String factionA, String factionB);

    /** Every interaction the faction initiated or was targeted by. */
    List<InteractionRecord> getInteractionsInvolving(String factionId);

    void storeTrustEvolution(TrustEvolution evolution);

    Optional<TrustEvolution> getTrustEvolution(String factionA, String factionB);

    /** Every trust record the faction is part of. */
    List<TrustEvolution> getTrustEvolutionsInvolving(String factionId);
}
