package com.diplomacy.relationship;

import com.diplomacy.config.DiplomacyProperties;
import com.diplomacy.faction.Scores;
import com.diplomacy.trust.TrustEvolution;

/**
 * Forward-looking scores for a pair: where the trend goes next, how likely an
 * alliance or a conflict is, and how steady the relationship has been.
 */
public class RelationshipForecast {

    private final DiplomacyProperties.Relationship config;

    public RelationshipForecast(DiplomacyProperties.Relationship config) {
        this.config = config;
    }

    /** Classifies a change in mean trust over the analysis window. */
    public RelationshipTrend trendOf(double change) {
        if (change > config.getRapidChangeThreshold()) {
            return RelationshipTrend.RAPIDLY_IMPROVING;
        } else if (change > config.getChangeThreshold()) {
            return RelationshipTrend.IMPROVING;
        } else if (change < -config.getRapidChangeThreshold()) {
            return RelationshipTrend.RAPIDLY_DECLINING;
        } else if (change < -config.getChangeThreshold()) {
            return RelationshipTrend.DECLINING;
        }
        return RelationshipTrend.STABLE;
    }

    /** Compatible pairs recover from declines; incompatible ones relapse from improvements. */
    public RelationshipTrend predictTrajectory(RelationshipTrend current, double baselineCompatibility) {
        if (baselineCompatibility > config.getRecoveryCompatibility() && current.isDeclining()) {
            return RelationshipTrend.IMPROVING;
        }
        if (baselineCompatibility < config.getRelapseCompatibility() && current.isImproving()) {
            return RelationshipTrend.DECLINING;
        }
        return current;
    }

    public double allianceProbability(double mutualTrust, double baselineCompatibility, double volatility) {
        double fromTrust = Math.max(0.0, (mutualTrust - config.getAllianceTrustBaseline()) * config.getAllianceTrustWeight());
        double fromCompatibility = baselineCompatibility * config.getAllianceCompatibilityWeight();
        double stabilityFactor = Math.max(config.getMinStabilityFactor(), 1.0 - volatility);
        return Scores.clamp01((fromTrust + fromCompatibility) * stabilityFactor);
    }

    public double conflictProbability(double mutualTrust, double baselineCompatibility, double volatility) {
        double fromDistrust = Math.max(0.0, (config.getConflictTrustCeiling() - mutualTrust) * config.getConflictDistrustWeight());
        double fromVolatility = volatility * config.getConflictVolatilityWeight();
        double fromIncompatibility = (1.0 - baselineCompatibility) * config.getConflictIncompatibilityWeight();
        return Scores.clamp01(fromDistrust + fromVolatility + fromIncompatibility);
    }

    public double stabilityScore(TrustEvolution trust) {
        double calm = Math.max(0.0, 1.0 - trust.volatility() * config.getStabilityVolatilityWeight());
        double narrowRange = Math.max(0.0, 1.0 - (trust.peakTrust() - trust.lowestTrust()));
        return Scores.clamp01((calm + narrowRange + trust.baselineCompatibility()) / 3.0);
    }
}
