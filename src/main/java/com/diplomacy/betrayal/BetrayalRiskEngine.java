package com.diplomacy.betrayal;

import com.diplomacy.config.DiplomacyProperties;
import com.diplomacy.error.ValidationException;
import com.diplomacy.faction.AttributeProvider;
import com.diplomacy.faction.Scores;
import com.diplomacy.faction.Trait;
import com.diplomacy.faction.TraitVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Estimates how likely a faction is to break an alliance.
 *
 * Risk = base constant + per-trait table modifiers + external increments,
 * capped below certainty. The cap keeps betrayal a risk, never a given.
 */
public class BetrayalRiskEngine {

    private static final Logger log = LoggerFactory.getLogger(BetrayalRiskEngine.class);

    /** Key used for the trust damage estimate when no alliance members are named. */
    public static final String ALL_MEMBERS = "all_members";

    private final DiplomacyProperties.Betrayal config;
    private final TraitRiskTable riskTable;
    private final AttributeProvider attributes;
    private final Clock clock;

    public BetrayalRiskEngine(DiplomacyProperties.Betrayal config, AttributeProvider attributes, Clock clock) {
        this.config = config;
        this.riskTable = new TraitRiskTable(config);
        this.attributes = attributes;
        this.clock = clock;
    }

    /**
     * @param allianceMembers the other members whose trust would be damaged; the faction itself is skipped
     * @throws com.diplomacy.error.FactionNotFoundException if the faction is unknown
     */
    public BetrayalAssessment evaluate(String factionId, ExternalFactors factors, Collection<String> allianceMembers) {
        TraitVector traits = attributes.getHiddenAttributes(factionId);
        List<String> others = new ArrayList<>();
        if (allianceMembers != null) {
            allianceMembers.stream()
                .filter(m -> m != null && !m.equals(factionId))
                .distinct()
                .forEach(others::add);
        }
        BetrayalAssessment assessment = evaluate(traits, factors, others);
        log.debug("Betrayal risk for {}: probability={} tier={} motivation={}",
            factionId, assessment.betrayalProbability(), assessment.riskTier(), assessment.primaryMotivation());
        return assessment;
    }

    /**
     * @throws ValidationException if {@code recent_defeats} is negative
     */
    public BetrayalAssessment evaluate(TraitVector traits, ExternalFactors factors, Collection<String> allianceMembers) {
        ExternalFactors effective = factors != null ? factors : ExternalFactors.NONE;
        if (effective.recentDefeats() < 0) {
            throw new ValidationException("recent_defeats must not be negative, got " + effective.recentDefeats());
        }

        double baseRisk = baseRisk(traits);
        double externalModifier = externalModifier(effective);
        double probability = Math.min(config.getMaxProbability(), baseRisk + externalModifier);

        double damage = expectedTrustDamage(traits);
        Map<String, Double> damageByMember = new LinkedHashMap<>();
        if (allianceMembers == null || allianceMembers.isEmpty()) {
            damageByMember.put(ALL_MEMBERS, damage);
        } else {
            allianceMembers.forEach(member -> damageByMember.put(member, damage));
        }

        return new BetrayalAssessment(
            probability,
            baseRisk,
            externalModifier,
            primaryMotivation(traits, effective),
            tierOf(probability),
            Map.copyOf(damageByMember));
    }

    public double baseRisk(TraitVector traits) {
        return Scores.clamp01(config.getBaseRisk() + riskTable.totalModifier(traits));
    }

    public double externalModifier(ExternalFactors factors) {
        double modifier = 0.0;
        if (factors.underPressure()) {
            modifier += config.getPressureIncrement();
        }
        if (factors.recentDefeats() > config.getDefeatsThreshold()) {
            modifier += config.getDefeatsIncrement();
        }
        if (factors.resourceShortage()) {
            modifier += config.getResourceShortageIncrement();
        }
        if (factors.betterOpportunity()) {
            modifier += config.getBetterOpportunityIncrement();
        }
        return modifier;
    }

    /**
     * Priority order: power grab, then outside pressure, then opportunism.
     * Anything else is read as an ideological split.
     */
    public BetrayalMotivation primaryMotivation(TraitVector traits, ExternalFactors factors) {
        if (traits.get(Trait.AMBITION) > config.getAmbitionMotivationThreshold()
            && traits.get(Trait.INTEGRITY) < config.getLowIntegrityThreshold()) {
            return BetrayalMotivation.AMBITION;
        }
        if (factors != null && factors.underPressure()) {
            return BetrayalMotivation.PRESSURE;
        }
        if (traits.get(Trait.PRAGMATISM) > config.getOpportunityPragmatismThreshold()) {
            return BetrayalMotivation.OPPORTUNITY;
        }
        return BetrayalMotivation.IDEOLOGY;
    }

    public RiskTier tierOf(double probability) {
        if (probability > config.getHighTierThreshold()) {
            return RiskTier.HIGH;
        }
        if (probability > config.getMediumTierThreshold()) {
            return RiskTier.MEDIUM;
        }
        return RiskTier.LOW;
    }

    /**
     * Builds the record of a betrayal that took place, scoring how badly it
     * lands from the betrayer's temperament.
     *
     * @throws com.diplomacy.error.FactionNotFoundException if the betrayer is unknown
     */
    public BetrayalEvent assessBetrayal(String betrayerId, BetrayalType type,
                                        BetrayalMotivation motivation, String description) {
        TraitVector traits = attributes.getHiddenAttributes(betrayerId);
        double severity = severity(traits);
        double trustDamage = Math.min(1.0, config.getTrustDamageBase()
            + (1.0 - traits.normalized(Trait.INTEGRITY)) * config.getTrustDamageIntegrityWeight());

        List<String> consequences = new ArrayList<>(List.of("Alliance dissolution", "Trust penalty with other factions"));
        if (severity > config.getIsolationSeverityThreshold()) {
            consequences.add("Diplomatic isolation");
        }
        if (type == BetrayalType.MILITARY) {
            consequences.add("Military retaliation risk");
        }

        log.info("Betrayal by {} assessed: type={} severity={} trust_damage={}",
            betrayerId, type, severity, trustDamage);
        return new BetrayalEvent(betrayerId, type, motivation, description, Instant.now(clock),
            severity, trustDamage, List.copyOf(consequences));
    }

    private double severity(TraitVector traits) {
        return Math.min(1.0, config.getSeverityBase()
            + traits.normalized(Trait.AMBITION) * config.getSeverityAmbitionWeight()
            + traits.normalized(Trait.IMPULSIVITY) * config.getSeverityImpulsivityWeight());
    }

    private double expectedTrustDamage(TraitVector traits) {
        return config.getMemberDamageBase() + traits.normalized(Trait.AMBITION) * config.getMemberDamageAmbitionWeight();
    }
}
