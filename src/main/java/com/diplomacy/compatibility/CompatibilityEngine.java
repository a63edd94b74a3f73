package com.diplomacy.compatibility;

import com.diplomacy.config.DiplomacyProperties;
import com.diplomacy.faction.AttributeProvider;
import com.diplomacy.faction.Scores;
import com.diplomacy.faction.Trait;
import com.diplomacy.faction.TraitVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.random.RandomGenerator;

/**
 * Scores how well two factions suit cooperation and how much outside pressure
 * pushes them together.
 *
 * Compatibility is a weighted sum of per-trait closeness, where closeness is
 * {@code 1 - |a - b|} on normalized values. Ambition is the exception: a wide
 * gap scores a flat complement bonus because a leader/follower pairing works.
 *
 * Threat estimation draws from a caller-supplied {@link RandomGenerator}; the
 * engine holds no random state of its own.
 */
public class CompatibilityEngine {

    private static final Logger log = LoggerFactory.getLogger(CompatibilityEngine.class);

    private final DiplomacyProperties.Compatibility config;
    private final AttributeProvider attributes;

    public CompatibilityEngine(DiplomacyProperties.Compatibility config, AttributeProvider attributes) {
        this.config = config;
        this.attributes = attributes;
    }

    /**
     * Resolves both factions and scores them.
     *
     * @param sharedEnemyIds factions hostile to both; duplicates and the pair itself are ignored
     * @throws com.diplomacy.error.FactionNotFoundException if either faction is unknown
     */
    public CompatibilityAssessment assess(String factionA, String factionB,
                                          Collection<String> sharedEnemyIds,
                                          RandomGenerator random) {
        TraitVector traitsA = attributes.getHiddenAttributes(factionA);
        TraitVector traitsB = attributes.getHiddenAttributes(factionB);

        double compatibility = compatibility(traitsA, traitsB);
        double threat = threatLevel(distinctEnemies(factionA, factionB, sharedEnemyIds), random);
        boolean compatible = isCompatible(compatibility, threat);

        log.debug("Compatibility {}<->{}: compatibility={} threat={} compatible={}",
            factionA, factionB, compatibility, threat, compatible);
        return new CompatibilityAssessment(factionA, factionB, compatibility, threat, compatible);
    }

    public double compatibility(TraitVector a, TraitVector b) {
        double integrity = closeness(a, b, Trait.INTEGRITY);
        double pragmatism = closeness(a, b, Trait.PRAGMATISM);
        double discipline = closeness(a, b, Trait.DISCIPLINE);

        double ambitionGap = Math.abs(a.normalized(Trait.AMBITION) - b.normalized(Trait.AMBITION));
        double ambition = ambitionGap > config.getAmbitionComplementThreshold()
            ? config.getAmbitionComplementScore()
            : 1.0 - ambitionGap;

        return Scores.clamp01(
            integrity * config.getIntegrityWeight()
                + pragmatism * config.getPragmatismWeight()
                + discipline * config.getDisciplineWeight()
                + ambition * config.getAmbitionWeight());
    }

    public double threatLevel(int sharedEnemyCount, RandomGenerator random) {
        Objects.requireNonNull(random, "random source is required for threat estimation");
        double base = sharedEnemyCount * config.getThreatPerSharedEnemy();
        double stochastic = random.nextDouble() * config.getMaxStochasticThreat();
        return Scores.clamp01(base + stochastic);
    }

    /** High external threat can override a poor personality match. */
    public boolean isCompatible(double compatibility, double threatLevel) {
        return compatibility > config.getCompatibleThreshold()
            || threatLevel > config.getThreatOverrideThreshold();
    }

    private static double closeness(TraitVector a, TraitVector b, Trait trait) {
        return 1.0 - Math.abs(a.normalized(trait) - b.normalized(trait));
    }

    private static int distinctEnemies(String factionA, String factionB, Collection<String> enemies) {
        if (enemies == null) {
            return 0;
        }
        Set<String> distinct = new LinkedHashSet<>(enemies);
        distinct.remove(factionA);
        distinct.remove(factionB);
        distinct.remove(null);
        return distinct.size();
    }
}
