package com.diplomacy.betrayal;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public record BetrayalAssessment(
    @JsonProperty("betrayal_probability") double betrayalProbability,
    @JsonProperty("base_risk") double baseRisk,
    @JsonProperty("external_modifier") double externalModifier,
    @JsonProperty("primary_motivation") BetrayalMotivation primaryMotivation,
    @JsonProperty("risk_tier") RiskTier riskTier,
    @JsonProperty("expected_trust_damage") Map<String, Double> expectedTrustDamage
) {}
