package com.diplomacy.api;

import com.diplomacy.alliance.AllianceType;
import com.diplomacy.error.ValidationException;
import com.diplomacy.negotiation.ActionResult;
import com.diplomacy.negotiation.InitiationResult;
import com.diplomacy.negotiation.NegotiationAction;
import com.diplomacy.negotiation.NegotiationEngine;
import com.diplomacy.negotiation.SessionSnapshot;
import com.diplomacy.negotiation.SessionSummary;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Multi-party alliance negotiations.
 *
 * POST /v1/negotiations
 * POST /v1/negotiations/{sessionId}/actions
 * GET  /v1/negotiations/{sessionId}
 * GET  /v1/negotiations?factionId=
 */
@RestController
@RequestMapping("/v1/negotiations")
public class NegotiationController {

    private final NegotiationEngine negotiationEngine;

    public NegotiationController(NegotiationEngine negotiationEngine) {
        this.negotiationEngine = negotiationEngine;
    }

    public record InitiateRequest(
        @JsonProperty("initiator_id") String initiatorId,
        @JsonProperty("target_ids") List<String> targetIds,
        @JsonProperty("alliance_type") AllianceType allianceType,
        @JsonProperty("proposed_terms") Map<String, Object> proposedTerms
    ) {}

    public record ActionRequest(
        @JsonProperty("faction_id") String factionId,
        @JsonProperty("action") NegotiationAction action,
        @JsonProperty("params") Map<String, Object> params
    ) {}

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public InitiationResult initiate(@RequestBody InitiateRequest request) {
        AllianceController.requireId("initiator_id", request.initiatorId());
        return negotiationEngine.initiate(request.initiatorId(),
            request.targetIds() != null ? request.targetIds() : List.of(),
            request.allianceType(),
            request.proposedTerms());
    }

    @PostMapping("/{sessionId}/actions")
    public ActionResult advance(@PathVariable UUID sessionId, @RequestBody ActionRequest request) {
        AllianceController.requireId("faction_id", request.factionId());
        if (request.action() == null) {
            throw new ValidationException("action is required");
        }
        return negotiationEngine.advance(sessionId, request.factionId(), request.action(), request.params());
    }

    @GetMapping("/{sessionId}")
    public SessionSnapshot status(@PathVariable UUID sessionId) {
        return negotiationEngine.status(sessionId);
    }

    @GetMapping
    public List<SessionSummary> listActive(@RequestParam(required = false) String factionId) {
        return negotiationEngine.listActive(factionId);
    }
}
