package com.diplomacy.api;

import com.diplomacy.alliance.AllianceCategory;
import com.diplomacy.alliance.AllianceFormationEngine;
import com.diplomacy.alliance.AllianceOpportunity;
import com.diplomacy.betrayal.BetrayalAssessment;
import com.diplomacy.betrayal.BetrayalEvent;
import com.diplomacy.betrayal.BetrayalMotivation;
import com.diplomacy.betrayal.BetrayalRiskEngine;
import com.diplomacy.betrayal.BetrayalType;
import com.diplomacy.betrayal.ExternalFactors;
import com.diplomacy.error.ValidationException;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.SplittableRandom;
import java.util.random.RandomGenerator;

/**
 * Alliance opportunity and betrayal risk evaluation.
 *
 * POST /v1/alliances/opportunities
 * POST /v1/alliances/betrayal-risk
 * POST /v1/alliances/betrayals
 */
@RestController
@RequestMapping("/v1/alliances")
public class AllianceController {

    private final AllianceFormationEngine formationEngine;
    private final BetrayalRiskEngine betrayalRiskEngine;

    public AllianceController(AllianceFormationEngine formationEngine, BetrayalRiskEngine betrayalRiskEngine) {
        this.formationEngine = formationEngine;
        this.betrayalRiskEngine = betrayalRiskEngine;
    }

    /** A request without a seed draws the threat component from a fresh generator. */
    public record OpportunityRequest(
        @JsonProperty("faction_a") String factionA,
        @JsonProperty("faction_b") String factionB,
        @JsonProperty("shared_enemies") List<String> sharedEnemies,
        @JsonProperty("category") AllianceCategory category,
        @JsonProperty("seed") Long seed
    ) {}

    public record BetrayalRiskRequest(
        @JsonProperty("faction_id") String factionId,
        @JsonProperty("external_factors") ExternalFactors externalFactors,
        @JsonProperty("alliance_members") List<String> allianceMembers
    ) {}

    public record BetrayalRequest(
        @JsonProperty("betrayer_id") String betrayerId,
        @JsonProperty("betrayal_type") BetrayalType betrayalType,
        @JsonProperty("motivation") BetrayalMotivation motivation,
        @JsonProperty("description") String description
    ) {}

    @PostMapping("/opportunities")
    public AllianceOpportunity evaluateOpportunity(@RequestBody OpportunityRequest request) {
        requireId("faction_a", request.factionA());
        requireId("faction_b", request.factionB());
        RandomGenerator random = request.seed() != null
            ? new SplittableRandom(request.seed())
            : new SplittableRandom();
        return formationEngine.evaluate(request.factionA(), request.factionB(),
            request.sharedEnemies() != null ? request.sharedEnemies() : List.of(),
            request.category(), random);
    }

    @PostMapping("/betrayal-risk")
    public BetrayalAssessment evaluateBetrayalRisk(@RequestBody BetrayalRiskRequest request) {
        requireId("faction_id", request.factionId());
        return betrayalRiskEngine.evaluate(request.factionId(),
            request.externalFactors() != null ? request.externalFactors() : ExternalFactors.NONE,
            request.allianceMembers() != null ? request.allianceMembers() : List.of());
    }

    @PostMapping("/betrayals")
    public BetrayalEvent assessBetrayal(@RequestBody BetrayalRequest request) {
        requireId("betrayer_id", request.betrayerId());
        if (request.betrayalType() == null) {
            throw new ValidationException("betrayal_type is required");
        }
        BetrayalMotivation motivation = request.motivation() != null
            ? request.motivation()
            : BetrayalMotivation.OPPORTUNITY;
        return betrayalRiskEngine.assessBetrayal(request.betrayerId(), request.betrayalType(),
            motivation, request.description());
    }

    static void requireId(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field + " is required");
        }
    }
}
