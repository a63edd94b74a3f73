package com.diplomacy.api;

import com.diplomacy.error.ValidationException;
import com.diplomacy.relationship.RelationshipAnalyzer;
import com.diplomacy.relationship.RelationshipSummary;
import com.diplomacy.trust.InteractionKind;
import com.diplomacy.trust.RecordedInteraction;
import com.diplomacy.trust.TrustLedger;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * Interaction recording and pairwise relationship queries.
 *
 * POST /v1/relationships/interactions
 * GET  /v1/relationships/{factionA}/{factionB}
 */
@RestController
@RequestMapping("/v1/relationships")
public class RelationshipController {

    private final TrustLedger trustLedger;
    private final RelationshipAnalyzer relationshipAnalyzer;

    public RelationshipController(TrustLedger trustLedger, RelationshipAnalyzer relationshipAnalyzer) {
        this.trustLedger = trustLedger;
        this.relationshipAnalyzer = relationshipAnalyzer;
    }

    /** Omitted impacts default to 0, omitted severity to 0.5. */
    public record InteractionRequest(
        @JsonProperty("initiator_id") String initiatorId,
        @JsonProperty("target_id") String targetId,
        @JsonProperty("interaction_kind") InteractionKind kind,
        @JsonProperty("description") String description,
        @JsonProperty("trust_impact") Double trustImpact,
        @JsonProperty("reputation_impact") Double reputationImpact,
        @JsonProperty("severity") Double severity
    ) {}

    @PostMapping("/interactions")
    @ResponseStatus(HttpStatus.CREATED)
    public RecordedInteraction record(@RequestBody InteractionRequest request) {
        AllianceController.requireId("initiator_id", request.initiatorId());
        AllianceController.requireId("target_id", request.targetId());
        if (request.kind() == null) {
            throw new ValidationException("interaction_kind is required");
        }
        return trustLedger.recordInteraction(
            request.initiatorId(),
            request.targetId(),
            request.kind(),
            request.description(),
            request.trustImpact() != null ? request.trustImpact() : 0.0,
            request.reputationImpact() != null ? request.reputationImpact() : 0.0,
            request.severity() != null ? request.severity() : 0.5);
    }

    @GetMapping("/{factionA}/{factionB}")
    public RelationshipSummary summary(@PathVariable String factionA, @PathVariable String factionB) {
        return relationshipAnalyzer.summarize(factionA, factionB);
    }
}
