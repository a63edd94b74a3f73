package com.diplomacy.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Calibration constants for every engine, bound from {@code diplomacy.*}.
 * Defaults reproduce the tuned values the engines were balanced against.
 */
@ConfigurationProperties(prefix = "diplomacy")
public class DiplomacyProperties {

    private final Compatibility compatibility = new Compatibility();
    private final Betrayal betrayal = new Betrayal();
    private final Negotiation negotiation = new Negotiation();
    private final Trust trust = new Trust();
    private final Network network = new Network();
    private final Alliance alliance = new Alliance();
    private final Relationship relationship = new Relationship();

    public Compatibility getCompatibility() {
        return compatibility;
    }

    public Betrayal getBetrayal() {
        return betrayal;
    }

    public Negotiation getNegotiation() {
        return negotiation;
    }

    public Trust getTrust() {
        return trust;
    }

    public Network getNetwork() {
        return network;
    }

    public Alliance getAlliance() {
        return alliance;
    }

    public Relationship getRelationship() {
        return relationship;
    }

    public static class Compatibility {
        private double integrityWeight = 0.35;
        private double pragmatismWeight = 0.25;
        private double disciplineWeight = 0.25;
        private double ambitionWeight = 0.15;
        /** Normalized ambition gap above which the pair is treated as leader/follower. */
        private double ambitionComplementThreshold = 0.3;
        private double ambitionComplementScore = 0.8;
        private double threatPerSharedEnemy = 0.2;
        private double maxStochasticThreat = 0.3;
        private double compatibleThreshold = 0.4;
        private double threatOverrideThreshold = 0.8;

        public double getIntegrityWeight() {
            return integrityWeight;
        }

        public void setIntegrityWeight(double integrityWeight) {
            this.integrityWeight = integrityWeight;
        }

        public double getPragmatismWeight() {
            return pragmatismWeight;
        }

        public void setPragmatismWeight(double pragmatismWeight) {
            this.pragmatismWeight = pragmatismWeight;
        }

        public double getDisciplineWeight() {
            return disciplineWeight;
        }

        public void setDisciplineWeight(double disciplineWeight) {
            this.disciplineWeight = disciplineWeight;
        }

        public double getAmbitionWeight() {
            return ambitionWeight;
        }

        public void setAmbitionWeight(double ambitionWeight) {
            this.ambitionWeight = ambitionWeight;
        }

        public double getAmbitionComplementThreshold() {
            return ambitionComplementThreshold;
        }

        public void setAmbitionComplementThreshold(double ambitionComplementThreshold) {
            this.ambitionComplementThreshold = ambitionComplementThreshold;
        }

        public double getAmbitionComplementScore() {
            return ambitionComplementScore;
        }

        public void setAmbitionComplementScore(double ambitionComplementScore) {
            this.ambitionComplementScore = ambitionComplementScore;
        }

        public double getThreatPerSharedEnemy() {
            return threatPerSharedEnemy;
        }

        public void setThreatPerSharedEnemy(double threatPerSharedEnemy) {
            this.threatPerSharedEnemy = threatPerSharedEnemy;
        }

        public double getMaxStochasticThreat() {
            return maxStochasticThreat;
        }

        public void setMaxStochasticThreat(double maxStochasticThreat) {
            this.maxStochasticThreat = maxStochasticThreat;
        }

        public double getCompatibleThreshold() {
            return compatibleThreshold;
        }

        public void setCompatibleThreshold(double compatibleThreshold) {
            this.compatibleThreshold = compatibleThreshold;
        }

        public double getThreatOverrideThreshold() {
            return threatOverrideThreshold;
        }

        public void setThreatOverrideThreshold(double threatOverrideThreshold) {
            this.threatOverrideThreshold = threatOverrideThreshold;
        }
    }

    public static class Betrayal {
        private double baseRisk = 0.05;
        private double pressureIncrement = 0.15;
        private double defeatsIncrement = 0.10;
        /** Defeat count that must be exceeded before defeats add risk. */
        private int defeatsThreshold = 2;
        private double resourceShortageIncrement = 0.08;
        private double betterOpportunityIncrement = 0.12;
        private double maxProbability = 0.8;
        private double mediumTierThreshold = 0.3;
        private double highTierThreshold = 0.6;
        /** Ambition above this, with integrity below the next threshold, reads as a power grab. */
        private int ambitionMotivationThreshold = 7;
        private int lowIntegrityThreshold = 4;
        private int opportunityPragmatismThreshold = 7;
        private double severityBase = 0.3;
        private double severityAmbitionWeight = 0.4;
        private double severityImpulsivityWeight = 0.3;
        /** Severity above which a betrayal also isolates the betrayer. */
        private double isolationSeverityThreshold = 0.7;
        private double trustDamageBase = 0.2;
        private double trustDamageIntegrityWeight = 0.6;
        private double memberDamageBase = 0.3;
        private double memberDamageAmbitionWeight = 0.2;
        /** Risk modifiers indexed by trait value 0-10. */
        private List<Double> ambitionModifiers = new ArrayList<>(List.of(
            -0.02, -0.01, 0.0, 0.01, 0.02, 0.04, 0.06, 0.08, 0.10, 0.12, 0.15));
        private List<Double> integrityModifiers = new ArrayList<>(List.of(
            0.15, 0.12, 0.08, 0.04, 0.02, 0.0, -0.02, -0.04, -0.06, -0.08, -0.10));
        private List<Double> impulsivityModifiers = new ArrayList<>(List.of(
            -0.02, -0.01, 0.0, 0.01, 0.02, 0.04, 0.06, 0.08, 0.10, 0.12, 0.15));
        private List<Double> pragmatismModifiers = new ArrayList<>(List.of(
            0.08, 0.06, 0.04, 0.02, 0.0, -0.01, -0.02, -0.03, -0.04, -0.05, -0.06));

        public double getBaseRisk() {
            return baseRisk;
        }

        public void setBaseRisk(double baseRisk) {
            this.baseRisk = baseRisk;
        }

        public double getPressureIncrement() {
            return pressureIncrement;
        }

        public void setPressureIncrement(double pressureIncrement) {
            this.pressureIncrement = pressureIncrement;
        }

        public double getDefeatsIncrement() {
            return defeatsIncrement;
        }

        public void setDefeatsIncrement(double defeatsIncrement) {
            this.defeatsIncrement = defeatsIncrement;
        }

        public int getDefeatsThreshold() {
            return defeatsThreshold;
        }

        public void setDefeatsThreshold(int defeatsThreshold) {
            this.defeatsThreshold = defeatsThreshold;
        }

        public double getResourceShortageIncrement() {
            return resourceShortageIncrement;
        }

        public void setResourceShortageIncrement(double resourceShortageIncrement) {
            this.resourceShortageIncrement = resourceShortageIncrement;
        }

        public double getBetterOpportunityIncrement() {
            return betterOpportunityIncrement;
        }

        public void setBetterOpportunityIncrement(double betterOpportunityIncrement) {
            this.betterOpportunityIncrement = betterOpportunityIncrement;
        }

        public double getMaxProbability() {
            return maxProbability;
        }

        public void setMaxProbability(double maxProbability) {
            this.maxProbability = maxProbability;
        }

        public double getMediumTierThreshold() {
            return mediumTierThreshold;
        }

        public void setMediumTierThreshold(double mediumTierThreshold) {
            this.mediumTierThreshold = mediumTierThreshold;
        }

        public double getHighTierThreshold() {
            return highTierThreshold;
        }

        public void setHighTierThreshold(double highTierThreshold) {
            this.highTierThreshold = highTierThreshold;
        }

        public int getAmbitionMotivationThreshold() {
            return ambitionMotivationThreshold;
        }

        public void setAmbitionMotivationThreshold(int ambitionMotivationThreshold) {
            this.ambitionMotivationThreshold = ambitionMotivationThreshold;
        }

        public int getLowIntegrityThreshold() {
            return lowIntegrityThreshold;
        }

        public void setLowIntegrityThreshold(int lowIntegrityThreshold) {
            this.lowIntegrityThreshold = lowIntegrityThreshold;
        }

        public int getOpportunityPragmatismThreshold() {
            return opportunityPragmatismThreshold;
        }

        public void setOpportunityPragmatismThreshold(int opportunityPragmatismThreshold) {
            this.opportunityPragmatismThreshold = opportunityPragmatismThreshold;
        }

        public double getSeverityBase() {
            return severityBase;
        }

        public void setSeverityBase(double severityBase) {
            this.severityBase = severityBase;
        }

        public double getSeverityAmbitionWeight() {
            return severityAmbitionWeight;
        }

        public void setSeverityAmbitionWeight(double severityAmbitionWeight) {
            this.severityAmbitionWeight = severityAmbitionWeight;
        }

        public double getSeverityImpulsivityWeight() {
            return severityImpulsivityWeight;
        }

        public void setSeverityImpulsivityWeight(double severityImpulsivityWeight) {
            this.severityImpulsivityWeight = severityImpulsivityWeight;
        }

        public double getIsolationSeverityThreshold() {
            return isolationSeverityThreshold;
        }

        public void setIsolationSeverityThreshold(double isolationSeverityThreshold) {
            this.isolationSeverityThreshold = isolationSeverityThreshold;
        }

        public double getTrustDamageBase() {
            return trustDamageBase;
        }

        public void setTrustDamageBase(double trustDamageBase) {
            this.trustDamageBase = trustDamageBase;
        }

        public double getTrustDamageIntegrityWeight() {
            return trustDamageIntegrityWeight;
        }

        public void setTrustDamageIntegrityWeight(double trustDamageIntegrityWeight) {
            this.trustDamageIntegrityWeight = trustDamageIntegrityWeight;
        }

        public double getMemberDamageBase() {
            return memberDamageBase;
        }

        public void setMemberDamageBase(double memberDamageBase) {
            this.memberDamageBase = memberDamageBase;
        }

        public double getMemberDamageAmbitionWeight() {
            return memberDamageAmbitionWeight;
        }

        public void setMemberDamageAmbitionWeight(double memberDamageAmbitionWeight) {
            this.memberDamageAmbitionWeight = memberDamageAmbitionWeight;
        }

        public List<Double> getAmbitionModifiers() {
            return ambitionModifiers;
        }

        public void setAmbitionModifiers(List<Double> ambitionModifiers) {
            this.ambitionModifiers = ambitionModifiers;
        }

        public List<Double> getIntegrityModifiers() {
            return integrityModifiers;
        }

        public void setIntegrityModifiers(List<Double> integrityModifiers) {
            this.integrityModifiers = integrityModifiers;
        }

        public List<Double> getImpulsivityModifiers() {
            return impulsivityModifiers;
        }

        public void setImpulsivityModifiers(List<Double> impulsivityModifiers) {
            this.impulsivityModifiers = impulsivityModifiers;
        }

        public List<Double> getPragmatismModifiers() {
            return pragmatismModifiers;
        }

        public void setPragmatismModifiers(List<Double> pragmatismModifiers) {
            this.pragmatismModifiers = pragmatismModifiers;
        }
    }

    public static class Negotiation {
        private int minParticipants = 2;
        private int maxParticipants = 8;
        private Duration duration = Duration.ofDays(30);
        private int maxRounds = 15;
        private double consensusThreshold = 0.75;

        public int getMinParticipants() {
            return minParticipants;
        }

        public void setMinParticipants(int minParticipants) {
            this.minParticipants = minParticipants;
        }

        public int getMaxParticipants() {
            return maxParticipants;
        }

        public void setMaxParticipants(int maxParticipants) {
            this.maxParticipants = maxParticipants;
        }

        public Duration getDuration() {
            return duration;
        }

        public void setDuration(Duration duration) {
            this.duration = duration;
        }

        public int getMaxRounds() {
            return maxRounds;
        }

        public void setMaxRounds(int maxRounds) {
            this.maxRounds = maxRounds;
        }

        public double getConsensusThreshold() {
            return consensusThreshold;
        }

        public void setConsensusThreshold(double consensusThreshold) {
            this.consensusThreshold = consensusThreshold;
        }
    }

    public static class Trust {
        private double maxDeltaPerEvent = 0.2;
        /** Share of the delta applied to the initiator's trust in the target. */
        private double reciprocalFactor = 0.5;
        private double initialSpread = 0.2;
        private int volatilityWindow = 5;
        private double volatilityThreshold = 0.2;
        private double significanceThreshold = 0.3;
        private Duration analysisWindow = Duration.ofDays(90);
        private int turningPointLimit = 5;
        /** Absolute impact above which an interaction strengthens or damages ties. */
        private double strongImpactThreshold = 0.3;
        private double regionalSeverityThreshold = 0.7;

        public double getMaxDeltaPerEvent() {
            return maxDeltaPerEvent;
        }

        public void setMaxDeltaPerEvent(double maxDeltaPerEvent) {
            this.maxDeltaPerEvent = maxDeltaPerEvent;
        }

        public double getReciprocalFactor() {
            return reciprocalFactor;
        }

        public void setReciprocalFactor(double reciprocalFactor) {
            this.reciprocalFactor = reciprocalFactor;
        }

        public double getInitialSpread() {
            return initialSpread;
        }

        public void setInitialSpread(double initialSpread) {
            this.initialSpread = initialSpread;
        }

        public int getVolatilityWindow() {
            return volatilityWindow;
        }

        public void setVolatilityWindow(int volatilityWindow) {
            this.volatilityWindow = volatilityWindow;
        }

        public double getVolatilityThreshold() {
            return volatilityThreshold;
        }

        public void setVolatilityThreshold(double volatilityThreshold) {
            this.volatilityThreshold = volatilityThreshold;
        }

        public double getSignificanceThreshold() {
            return significanceThreshold;
        }

        public void setSignificanceThreshold(double significanceThreshold) {
            this.significanceThreshold = significanceThreshold;
        }

        public Duration getAnalysisWindow() {
            return analysisWindow;
        }

        public void setAnalysisWindow(Duration analysisWindow) {
            this.analysisWindow = analysisWindow;
        }

        public int getTurningPointLimit() {
            return turningPointLimit;
        }

        public void setTurningPointLimit(int turningPointLimit) {
            this.turningPointLimit = turningPointLimit;
        }

        public double getStrongImpactThreshold() {
            return strongImpactThreshold;
        }

        public void setStrongImpactThreshold(double strongImpactThreshold) {
            this.strongImpactThreshold = strongImpactThreshold;
        }

        public double getRegionalSeverityThreshold() {
            return regionalSeverityThreshold;
        }

        public void setRegionalSeverityThreshold(double regionalSeverityThreshold) {
            this.regionalSeverityThreshold = regionalSeverityThreshold;
        }
    }

    public static class Network {
        private double highTrustThreshold = 0.7;
        private double strongClusterThreshold = 0.8;
        private double lowTrustThreshold = 0.3;
        private double highTensionThreshold = 0.1;

        public double getHighTrustThreshold() {
            return highTrustThreshold;
        }

        public void setHighTrustThreshold(double highTrustThreshold) {
            this.highTrustThreshold = highTrustThreshold;
        }

        public double getStrongClusterThreshold() {
            return strongClusterThreshold;
        }

        public void setStrongClusterThreshold(double strongClusterThreshold) {
            this.strongClusterThreshold = strongClusterThreshold;
        }

        public double getLowTrustThreshold() {
            return lowTrustThreshold;
        }

        public void setLowTrustThreshold(double lowTrustThreshold) {
            this.lowTrustThreshold = lowTrustThreshold;
        }

        public double getHighTensionThreshold() {
            return highTensionThreshold;
        }

        public void setHighTensionThreshold(double highTensionThreshold) {
            this.highTensionThreshold = highTensionThreshold;
        }
    }

    public static class Alliance {
        private double willingnessPragmatismWeight = 0.4;
        /** Scales compatibility by the faction's integrity. */
        private double willingnessIntegrityWeight = 0.3;
        private double willingnessThreatWeight = 0.4;
        private double willingnessAmbitionWeight = 0.1;
        /** Below this threat ambition lowers willingness, at or above it raises it. */
        private double seriousThreatThreshold = 0.5;
        private double defensiveThreatThreshold = 0.7;
        private double expansionistAmbitionThreshold = 0.6;
        private double tradePragmatismThreshold = 0.6;
        private double formalIntegrityThreshold = 0.7;
        private int riskAmbitionGap = 4;
        private int riskLowIntegrity = 3;
        private int riskHighImpulsivity = 7;
        private int riskLowDiscipline = 4;
        private int benefitAmbitionGap = 3;
        private int benefitHighIntegrity = 6;
        private double benefitThreatThreshold = 0.5;
        private double benefitPragmatism = 6.0;
        /** Mean of integrity and discipline above which an alliance is expected to last long term. */
        private double longTermStability = 7.0;
        private double mediumTermStability = 5.0;
        private double shortTermStability = 3.0;

        public double getWillingnessPragmatismWeight() {
            return willingnessPragmatismWeight;
        }

        public void setWillingnessPragmatismWeight(double willingnessPragmatismWeight) {
            this.willingnessPragmatismWeight = willingnessPragmatismWeight;
        }

        public double getWillingnessIntegrityWeight() {
            return willingnessIntegrityWeight;
        }

        public void setWillingnessIntegrityWeight(double willingnessIntegrityWeight) {
            this.willingnessIntegrityWeight = willingnessIntegrityWeight;
        }

        public double getWillingnessThreatWeight() {
            return willingnessThreatWeight;
        }

        public void setWillingnessThreatWeight(double willingnessThreatWeight) {
            this.willingnessThreatWeight = willingnessThreatWeight;
        }

        public double getWillingnessAmbitionWeight() {
            return willingnessAmbitionWeight;
        }

        public void setWillingnessAmbitionWeight(double willingnessAmbitionWeight) {
            this.willingnessAmbitionWeight = willingnessAmbitionWeight;
        }

        public double getSeriousThreatThreshold() {
            return seriousThreatThreshold;
        }

        public void setSeriousThreatThreshold(double seriousThreatThreshold) {
            this.seriousThreatThreshold = seriousThreatThreshold;
        }

        public double getDefensiveThreatThreshold() {
            return defensiveThreatThreshold;
        }

        public void setDefensiveThreatThreshold(double defensiveThreatThreshold) {
            this.defensiveThreatThreshold = defensiveThreatThreshold;
        }

        public double getExpansionistAmbitionThreshold() {
            return expansionistAmbitionThreshold;
        }

        public void setExpansionistAmbitionThreshold(double expansionistAmbitionThreshold) {
            this.expansionistAmbitionThreshold = expansionistAmbitionThreshold;
        }

        public double getTradePragmatismThreshold() {
            return tradePragmatismThreshold;
        }

        public void setTradePragmatismThreshold(double tradePragmatismThreshold) {
            this.tradePragmatismThreshold = tradePragmatismThreshold;
        }

        public double getFormalIntegrityThreshold() {
            return formalIntegrityThreshold;
        }

        public void setFormalIntegrityThreshold(double formalIntegrityThreshold) {
            this.formalIntegrityThreshold = formalIntegrityThreshold;
        }

        public int getRiskAmbitionGap() {
            return riskAmbitionGap;
        }

        public void setRiskAmbitionGap(int riskAmbitionGap) {
            this.riskAmbitionGap = riskAmbitionGap;
        }

        public int getRiskLowIntegrity() {
            return riskLowIntegrity;
        }

        public void setRiskLowIntegrity(int riskLowIntegrity) {
            this.riskLowIntegrity = riskLowIntegrity;
        }

        public int getRiskHighImpulsivity() {
            return riskHighImpulsivity;
        }

        public void setRiskHighImpulsivity(int riskHighImpulsivity) {
            this.riskHighImpulsivity = riskHighImpulsivity;
        }

        public int getRiskLowDiscipline() {
            return riskLowDiscipline;
        }

        public void setRiskLowDiscipline(int riskLowDiscipline) {
            this.riskLowDiscipline = riskLowDiscipline;
        }

        public int getBenefitAmbitionGap() {
            return benefitAmbitionGap;
        }

        public void setBenefitAmbitionGap(int benefitAmbitionGap) {
            this.benefitAmbitionGap = benefitAmbitionGap;
        }

        public int getBenefitHighIntegrity() {
            return benefitHighIntegrity;
        }

        public void setBenefitHighIntegrity(int benefitHighIntegrity) {
            this.benefitHighIntegrity = benefitHighIntegrity;
        }

        public double getBenefitThreatThreshold() {
            return benefitThreatThreshold;
        }

        public void setBenefitThreatThreshold(double benefitThreatThreshold) {
            this.benefitThreatThreshold = benefitThreatThreshold;
        }

        public double getBenefitPragmatism() {
            return benefitPragmatism;
        }

        public void setBenefitPragmatism(double benefitPragmatism) {
            this.benefitPragmatism = benefitPragmatism;
        }

        public double getLongTermStability() {
            return longTermStability;
        }

        public void setLongTermStability(double longTermStability) {
            this.longTermStability = longTermStability;
        }

        public double getMediumTermStability() {
            return mediumTermStability;
        }

        public void setMediumTermStability(double mediumTermStability) {
            this.mediumTermStability = mediumTermStability;
        }

        public double getShortTermStability() {
            return shortTermStability;
        }

        public void setShortTermStability(double shortTermStability) {
            this.shortTermStability = shortTermStability;
        }
    }

    public static class Relationship {
        /** Trust change over the analysis window that counts as rapid. */
        private double rapidChangeThreshold = 0.15;
        private double changeThreshold = 0.05;
        /** Compatibility above which a declining pair is predicted to recover. */
        private double recoveryCompatibility = 0.7;
        private double relapseCompatibility = 0.3;
        private double allianceTrustBaseline = 0.5;
        private double allianceTrustWeight = 1.5;
        private double allianceCompatibilityWeight = 0.3;
        private double minStabilityFactor = 0.5;
        private double conflictTrustCeiling = 0.3;
        private double conflictDistrustWeight = 2.0;
        private double conflictVolatilityWeight = 1.5;
        private double conflictIncompatibilityWeight = 0.4;
        private double stabilityVolatilityWeight = 2.0;

        public double getRapidChangeThreshold() {
            return rapidChangeThreshold;
        }

        public void setRapidChangeThreshold(double rapidChangeThreshold) {
            this.rapidChangeThreshold = rapidChangeThreshold;
        }

        public double getChangeThreshold() {
            return changeThreshold;
        }

        public void setChangeThreshold(double changeThreshold) {
            this.changeThreshold = changeThreshold;
        }

        public double getRecoveryCompatibility() {
            return recoveryCompatibility;
        }

        public void setRecoveryCompatibility(double recoveryCompatibility) {
            this.recoveryCompatibility = recoveryCompatibility;
        }

        public double getRelapseCompatibility() {
            return relapseCompatibility;
        }

        public void setRelapseCompatibility(double relapseCompatibility) {
            this.relapseCompatibility = relapseCompatibility;
        }

        public double getAllianceTrustBaseline() {
            return allianceTrustBaseline;
        }

        public void setAllianceTrustBaseline(double allianceTrustBaseline) {
            this.allianceTrustBaseline = allianceTrustBaseline;
        }

        public double getAllianceTrustWeight() {
            return allianceTrustWeight;
        }

        public void setAllianceTrustWeight(double allianceTrustWeight) {
            this.allianceTrustWeight = allianceTrustWeight;
        }

        public double getAllianceCompatibilityWeight() {
            return allianceCompatibilityWeight;
        }

        public void setAllianceCompatibilityWeight(double allianceCompatibilityWeight) {
            this.allianceCompatibilityWeight = allianceCompatibilityWeight;
        }

        public double getMinStabilityFactor() {
            return minStabilityFactor;
        }

        public void setMinStabilityFactor(double minStabilityFactor) {
            this.minStabilityFactor = minStabilityFactor;
        }

        public double getConflictTrustCeiling() {
            return conflictTrustCeiling;
        }

        public void setConflictTrustCeiling(double conflictTrustCeiling) {
            this.conflictTrustCeiling = conflictTrustCeiling;
        }

        public double getConflictDistrustWeight() {
            return conflictDistrustWeight;
        }

        public void setConflictDistrustWeight(double conflictDistrustWeight) {
            this.conflictDistrustWeight = conflictDistrustWeight;
        }

        public double getConflictVolatilityWeight() {
            return conflictVolatilityWeight;
        }

        public void setConflictVolatilityWeight(double conflictVolatilityWeight) {
            this.conflictVolatilityWeight = conflictVolatilityWeight;
        }

        public double getConflictIncompatibilityWeight() {
            return conflictIncompatibilityWeight;
        }

        public void setConflictIncompatibilityWeight(double conflictIncompatibilityWeight) {
            this.conflictIncompatibilityWeight = conflictIncompatibilityWeight;
        }

        public double getStabilityVolatilityWeight() {
            return stabilityVolatilityWeight;
        }

        public void setStabilityVolatilityWeight(double stabilityVolatilityWeight) {
            this.stabilityVolatilityWeight = stabilityVolatilityWeight;
        }
    }
}
