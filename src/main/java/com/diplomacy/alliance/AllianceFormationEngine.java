package com.diplomacy.alliance;

import com.diplomacy.compatibility.CompatibilityAssessment;
import com.diplomacy.compatibility.CompatibilityEngine;
import com.diplomacy.config.DiplomacyProperties;
import com.diplomacy.faction.AttributeProvider;
import com.diplomacy.faction.Scores;
import com.diplomacy.faction.Trait;
import com.diplomacy.faction.TraitVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.random.RandomGenerator;

/**
 * Turns compatibility and threat into a concrete alliance recommendation:
 * per-faction willingness, suitable alliance categories, the risks and
 * benefits worth flagging, and how long such an alliance would likely hold.
 *
 * Also owns the default term templates negotiations start from.
 */
public class AllianceFormationEngine {

    private static final Logger log = LoggerFactory.getLogger(AllianceFormationEngine.class);

    private final DiplomacyProperties.Alliance config;
    private final CompatibilityEngine compatibilityEngine;
    private final AttributeProvider attributes;

    public AllianceFormationEngine(DiplomacyProperties.Alliance config, CompatibilityEngine compatibilityEngine,
                                   AttributeProvider attributes) {
        this.config = config;
        this.compatibilityEngine = compatibilityEngine;
        this.attributes = attributes;
    }

    /**
     * @param requested when present, replaces the recommended categories
     * @throws com.diplomacy.error.FactionNotFoundException if either faction is unknown
     */
    public AllianceOpportunity evaluate(String factionA, String factionB,
                                        Collection<String> sharedEnemyIds,
                                        AllianceCategory requested,
                                        RandomGenerator random) {
        CompatibilityAssessment assessment = compatibilityEngine.assess(factionA, factionB, sharedEnemyIds, random);
        TraitVector a = attributes.getHiddenAttributes(factionA);
        TraitVector b = attributes.getHiddenAttributes(factionB);

        double threat = assessment.threatLevel();
        double compatibility = assessment.compatibility();
        double willingnessA = willingness(a, threat, compatibility);
        double willingnessB = willingness(b, threat, compatibility);

        List<AllianceCategory> categories = requested != null
            ? List.of(requested)
            : recommendCategories(a, b, threat);

        AllianceOpportunity opportunity = new AllianceOpportunity(
            factionA,
            factionB,
            assessment.compatible(),
            compatibility,
            threat,
            (willingnessA + willingnessB) / 2.0,
            new AllianceOpportunity.WillingnessBreakdown(willingnessA, willingnessB),
            categories,
            risks(a, b),
            benefits(a, b, threat),
            estimateDuration(a, b));

        log.info("Evaluated alliance opportunity {}<->{}: compatible={} willingness={}",
            factionA, factionB, opportunity.compatible(), opportunity.willingnessScore());
        return opportunity;
    }

    /**
     * Pragmatists lean in, principled factions weigh fit, and threat pushes
     * everyone. Ambition cuts against alliances until the threat gets serious.
     */
    double willingness(TraitVector traits, double threat, double compatibility) {
        double pragmatism = traits.normalized(Trait.PRAGMATISM);
        double integrity = traits.normalized(Trait.INTEGRITY);
        double ambition = traits.normalized(Trait.AMBITION);

        double base = pragmatism * config.getWillingnessPragmatismWeight();
        double fromCompatibility = compatibility * (integrity * config.getWillingnessIntegrityWeight());
        double fromThreat = threat * config.getWillingnessThreatWeight();
        double ambitionShift = ambition * config.getWillingnessAmbitionWeight();
        double ambitionModifier = threat < config.getSeriousThreatThreshold() ? -ambitionShift : ambitionShift;

        return Scores.clamp01(base + fromCompatibility + fromThreat + ambitionModifier);
    }

    List<AllianceCategory> recommendCategories(TraitVector a, TraitVector b, double threat) {
        List<AllianceCategory> recommended = new ArrayList<>();
        if (threat > config.getDefensiveThreatThreshold()) {
            recommended.add(AllianceCategory.DEFENSIVE);
            recommended.add(AllianceCategory.MUTUAL_PROTECTION);
        }
        if (pairMean(a, b, Trait.AMBITION) > config.getExpansionistAmbitionThreshold()) {
            recommended.add(AllianceCategory.EXPANSIONIST);
        }
        if (pairMean(a, b, Trait.PRAGMATISM) > config.getTradePragmatismThreshold()) {
            recommended.add(AllianceCategory.TRADE);
        }
        if (pairMean(a, b, Trait.INTEGRITY) > config.getFormalIntegrityThreshold()) {
            recommended.add(AllianceCategory.FORMAL);
        }
        if (recommended.isEmpty()) {
            recommended.add(AllianceCategory.COOPERATION);
        }
        return List.copyOf(recommended);
    }

    List<String> risks(TraitVector a, TraitVector b) {
        List<String> risks = new ArrayList<>();
        if (gap(a, b, Trait.AMBITION) > config.getRiskAmbitionGap()) {
            risks.add("Significant ambition mismatch may lead to power struggles");
        }
        if (Math.min(a.get(Trait.INTEGRITY), b.get(Trait.INTEGRITY)) < config.getRiskLowIntegrity()) {
            risks.add("Low integrity partner increases betrayal risk");
        }
        if (Math.max(a.get(Trait.IMPULSIVITY), b.get(Trait.IMPULSIVITY)) > config.getRiskHighImpulsivity()) {
            risks.add("High impulsivity may lead to rash decisions");
        }
        if (Math.min(a.get(Trait.DISCIPLINE), b.get(Trait.DISCIPLINE)) < config.getRiskLowDiscipline()) {
            risks.add("Poor discipline may affect alliance reliability");
        }
        return List.copyOf(risks);
    }

    List<String> benefits(TraitVector a, TraitVector b, double threat) {
        List<String> benefits = new ArrayList<>();
        if (gap(a, b, Trait.AMBITION) > config.getBenefitAmbitionGap()) {
            benefits.add("Complementary ambition levels provide balance");
        }
        if (Math.min(a.get(Trait.INTEGRITY), b.get(Trait.INTEGRITY)) > config.getBenefitHighIntegrity()) {
            benefits.add("High mutual integrity ensures reliability");
        }
        if (threat > config.getBenefitThreatThreshold()) {
            benefits.add("Mutual protection against external threats");
        }
        if ((a.get(Trait.PRAGMATISM) + b.get(Trait.PRAGMATISM)) / 2.0 > config.getBenefitPragmatism()) {
            benefits.add("Strong economic cooperation potential");
        }
        return List.copyOf(benefits);
    }

    DurationEstimate estimateDuration(TraitVector a, TraitVector b) {
        double integrity = (a.get(Trait.INTEGRITY) + b.get(Trait.INTEGRITY)) / 2.0;
        double discipline = (a.get(Trait.DISCIPLINE) + b.get(Trait.DISCIPLINE)) / 2.0;
        double stability = (integrity + discipline) / 2.0;

        if (stability > config.getLongTermStability()) {
            return DurationEstimate.LONG_TERM;
        } else if (stability > config.getMediumTermStability()) {
            return DurationEstimate.MEDIUM_TERM;
        } else if (stability > config.getShortTermStability()) {
            return DurationEstimate.SHORT_TERM;
        }
        return DurationEstimate.VERY_SHORT_TERM;
    }

    /**
     * Default terms for a negotiation of the given type, with any caller
     * overrides layered on top.
     *
     * @throws com.diplomacy.error.ValidationException if an override is malformed
     */
    public AllianceTerms initialTerms(AllianceType type, Map<String, ?> proposedOverrides) {
        AllianceTerms.Builder builder = AllianceTerms.builder(type);
        switch (type) {
            case MILITARY -> builder
                .enable(AllianceTerm.MUTUAL_DEFENSE)
                .enable(AllianceTerm.SHARED_INTELLIGENCE)
                .militarySupportLevel(0.5);
            case ECONOMIC -> builder
                .enable(AllianceTerm.TRADE_PREFERENCES)
                .enable(AllianceTerm.SHARED_INFRASTRUCTURE)
                .economicSupportLevel(0.6);
            case DIPLOMATIC -> builder
                .enable(AllianceTerm.DIPLOMATIC_COORDINATION)
                .enable(AllianceTerm.CULTURAL_EXCHANGE)
                .enable(AllianceTerm.SHARED_EMBASSIES);
        }
        AllianceTerms template = builder.build();
        if (proposedOverrides == null || proposedOverrides.isEmpty()) {
            return template;
        }
        // overrides on the opening offer stay version 1
        AllianceTerms overridden = template.withOverrides(proposedOverrides);
        return overridden.toBuilder().version(1).build();
    }

    private static double pairMean(TraitVector a, TraitVector b, Trait trait) {
        return (a.get(trait) + b.get(trait)) / 20.0;
    }

    private static int gap(TraitVector a, TraitVector b, Trait trait) {
        return Math.abs(a.get(trait) - b.get(trait));
    }
}
