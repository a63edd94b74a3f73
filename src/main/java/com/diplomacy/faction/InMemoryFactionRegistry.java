package com.diplomacy.faction;

import com.diplomacy.trust.PairKey;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Default in-process faction registry. Serves as both the attribute lookup and
 * the diplomatic status lookup when no external persistence layer is wired in.
 */
@Component
public class InMemoryFactionRegistry implements AttributeProvider, DiplomacyStatusProvider {

    private final ConcurrentHashMap<String, FactionSnapshot> factions = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<PairKey, DiplomaticStatus> statuses = new ConcurrentHashMap<>();

    public FactionSnapshot register(FactionSnapshot faction) {
        factions.put(faction.factionId(), faction);
        return faction;
    }

    public void setStatus(String factionA, String factionB, DiplomaticStatus status) {
        statuses.put(PairKey.of(factionA, factionB), status);
    }

    @Override
    public Optional<FactionSnapshot> findFaction(String factionId) {
        if (factionId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(factions.get(factionId));
    }

    @Override
    public DiplomaticStatus getStatus(String factionA, String factionB) {
        return statuses.getOrDefault(PairKey.of(factionA, factionB), DiplomaticStatus.NEUTRAL);
    }
}
