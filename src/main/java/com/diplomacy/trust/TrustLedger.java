package com.diplomacy.trust;

import com.diplomacy.compatibility.CompatibilityEngine;
import com.diplomacy.config.DiplomacyProperties;
import com.diplomacy.error.ValidationException;
import com.diplomacy.faction.AttributeProvider;
import com.diplomacy.faction.TraitVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns the trust state of every faction pair.
 *
 * Writes for one pair are serialized on a per-pair monitor; writes for
 * different pairs proceed in parallel. Each write computes the complete next
 * state before touching the store, so a failed call leaves nothing behind.
 */
public class TrustLedger {

    private static final Logger log = LoggerFactory.getLogger(TrustLedger.class);

    private final DiplomacyProperties.Trust config;
    private final CompatibilityEngine compatibilityEngine;
    private final AttributeProvider attributes;
    private final RelationshipStore store;
    private final Clock clock;
    private final ConcurrentHashMap<PairKey, Object> pairLocks = new ConcurrentHashMap<>();

    public TrustLedger(DiplomacyProperties.Trust config,
                       CompatibilityEngine compatibilityEngine,
                       AttributeProvider attributes,
                       RelationshipStore store,
                       Clock clock) {
        this.config = config;
        this.compatibilityEngine = compatibilityEngine;
        this.attributes = attributes;
        this.store = store;
        this.clock = clock;
    }

    /**
     * Returns the pair's trust record, seeding and storing it first if the pair
     * has none. Seed trust is {@code 0.5 + (compatibility - 0.5) * spread} in
     * both directions.
     *
     * @throws com.diplomacy.error.FactionNotFoundException if either faction is unknown
     */
    public TrustEvolution initialize(String factionA, String factionB) {
        PairKey pair = PairKey.of(factionA, factionB);
        synchronized (lockFor(pair)) {
            Optional<TrustEvolution> existing = store.getTrustEvolution(pair.first(), pair.second());
            if (existing.isPresent()) {
                return existing.get();
            }
            TrustEvolution seeded = seed(pair);
            store.storeTrustEvolution(seeded);
            log.debug("Seeded trust for {} at {} (compatibility {})",
                pair, seeded.aTrustsB(), seeded.baselineCompatibility());
            return seeded;
        }
    }

    public Optional<TrustEvolution> find(String factionA, String factionB) {
        return store.getTrustEvolution(factionA, factionB);
    }

    /**
     * Records one interaction and moves the pair's trust.
     *
     * The step is {@code min(maxDeltaPerEvent, |trustImpact|)} with the sign of
     * the impact. The target's trust in the initiator moves by the full step,
     * the initiator's trust in the target by {@code reciprocalFactor} of it.
     *
     * @throws ValidationException if initiator and target coincide or a scalar is out of range
     * @throws com.diplomacy.error.FactionNotFoundException if either faction is unknown
     */
    public RecordedInteraction recordInteraction(String initiatorId, String targetId, InteractionKind kind,
                                                 String description, double trustImpact,
                                                 double reputationImpact, double severity) {
        Objects.requireNonNull(kind, "kind");
        PairKey pair = PairKey.of(initiatorId, targetId);
        requireRange("trust_impact", trustImpact, -1.0, 1.0);
        requireRange("reputation_impact", reputationImpact, -1.0, 1.0);
        requireRange("severity", severity, 0.0, 1.0);
        attributes.getFaction(initiatorId);
        attributes.getFaction(targetId);

        synchronized (lockFor(pair)) {
            Instant now = Instant.now(clock);
            InteractionRecord record = new InteractionRecord(
                UUID.randomUUID(),
                now,
                kind,
                initiatorId,
                targetId,
                description,
                trustImpact,
                reputationImpact,
                kind.tensionImpact(trustImpact),
                severity,
                consequences(kind, trustImpact, severity));

            TrustEvolution current = store.getTrustEvolution(pair.first(), pair.second())
                .orElseGet(() -> seed(pair));
            TrustEvolution next = applyDelta(current, initiatorId, trustImpact, now);

            store.storeInteraction(record);
            store.storeTrustEvolution(next);

            log.info("Recorded {} from {} to {}: mutual trust {} -> {}",
                kind.getValue(), initiatorId, targetId, current.mutualTrust(), next.mutualTrust());
            return new RecordedInteraction(record, next, TrustCategory.of(next.mutualTrust()));
        }
    }

    public static TrustCategory categorize(double mutualTrust) {
        return TrustCategory.of(mutualTrust);
    }

    TrustEvolution applyDelta(TrustEvolution current, String initiatorId, double trustImpact, Instant at) {
        double step = Math.min(config.getMaxDeltaPerEvent(), Math.abs(trustImpact));
        if (trustImpact < 0) {
            step = -step;
        }
        double reciprocal = step * config.getReciprocalFactor();

        double aTrustsB = current.aTrustsB();
        double bTrustsA = current.bTrustsA();
        if (current.pair().first().equals(initiatorId)) {
            bTrustsA += step;
            aTrustsB += reciprocal;
        } else {
            aTrustsB += step;
            bTrustsA += reciprocal;
        }
        return current.apply(aTrustsB, bTrustsA, at, config.getVolatilityWindow());
    }

    List<String> consequences(InteractionKind kind, double trustImpact, double severity) {
        List<String> consequences = new ArrayList<>();
        double strong = config.getStrongImpactThreshold();
        if (trustImpact > strong) {
            consequences.add("Strengthened diplomatic ties");
        } else if (trustImpact < -strong) {
            consequences.add("Damaged diplomatic relations");
        }
        if (severity > config.getRegionalSeverityThreshold()) {
            consequences.add("Regional diplomatic impact");
        }
        switch (kind) {
            case BETRAYAL -> {
                consequences.add("Trust penalty with other factions");
                consequences.add("Reputation damage");
            }
            case ALLIANCE_PROPOSAL -> consequences.add("Formal diplomatic process initiated");
            default -> {
            }
        }
        return consequences;
    }

    private TrustEvolution seed(PairKey pair) {
        TraitVector a = attributes.getHiddenAttributes(pair.first());
        TraitVector b = attributes.getHiddenAttributes(pair.second());
        double compatibility = compatibilityEngine.compatibility(a, b);
        double initial = 0.5 + (compatibility - 0.5) * config.getInitialSpread();
        return TrustEvolution.seeded(pair, initial, compatibility, Instant.now(clock));
    }

    private Object lockFor(PairKey pair) {
        return pairLocks.computeIfAbsent(pair, k -> new Object());
    }

    private static void requireRange(String field, double value, double min, double max) {
        if (Double.isNaN(value) || value < min || value > max) {
            throw new ValidationException(field + " must be within [" + min + ", " + max + "], got " + value);
        }
    }
}
