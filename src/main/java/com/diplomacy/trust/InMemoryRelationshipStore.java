package com.diplomacy.trust;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

@Component
public class InMemoryRelationshipStore implements RelationshipStore {

    private final ConcurrentHashMap<PairKey, CopyOnWriteArrayList<InteractionRecord>> interactions = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<PairKey, TrustEvolution> evolutions = new ConcurrentHashMap<>();

    @Override
    public void storeInteraction(InteractionRecord record) {
        interactions.computeIfAbsent(record.pair(), k -> new CopyOnWriteArrayList<>()).add(record);
    }

    @Override
    public List<InteractionRecord> getInteractions(String factionA, String factionB) {
        List<InteractionRecord> history = interactions.get(PairKey.of(factionA, factionB));
        if (history == null) {
            return Collections.emptyList();
        }
        return List.copyOf(history);
    }

    @Override
    public List<InteractionRecord> getInteractionsInvolving(String factionId) {
        return interactions.entrySet().stream()
            .filter(e -> e.getKey().contains(factionId))
            .flatMap(e -> e.getValue().stream())
            .sorted(Comparator.comparing(InteractionRecord::timestamp))
            .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public void storeTrustEvolution(TrustEvolution evolution) {
        evolutions.put(evolution.pair(), evolution);
    }

    @Override
    public Optional<TrustEvolution> getTrustEvolution(String factionA, String factionB) {
        return Optional.ofNullable(evolutions.get(PairKey.of(factionA, factionB)));
    }

    @Override
    public List<TrustEvolution> getTrustEvolutionsInvolving(String factionId) {
        return evolutions.values().stream()
            .filter(e -> e.pair().contains(factionId))
            .sorted(Comparator.comparing(e -> e.pair().toString()))
            .collect(Collectors.toCollection(ArrayList::new));
    }
}
