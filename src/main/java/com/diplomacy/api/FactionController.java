package com.diplomacy.api;

import com.diplomacy.error.ValidationException;
import com.diplomacy.faction.DiplomaticStatus;
import com.diplomacy.faction.FactionSnapshot;
import com.diplomacy.faction.InMemoryFactionRegistry;
import com.diplomacy.faction.TraitVector;
import com.diplomacy.relationship.FactionReputation;
import com.diplomacy.relationship.RelationshipAnalyzer;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * Faction registration and diplomatic status in the bundled registry, and reputation.
 *
 * PUT /v1/factions/{factionId}
 * PUT /v1/factions/{factionId}/status/{otherId}
 * GET /v1/factions/{factionId}/reputation
 */
@RestController
@RequestMapping("/v1/factions")
public class FactionController {

    private static final Logger log = LoggerFactory.getLogger(FactionController.class);

    private final InMemoryFactionRegistry registry;
    private final RelationshipAnalyzer relationshipAnalyzer;

    public FactionController(InMemoryFactionRegistry registry, RelationshipAnalyzer relationshipAnalyzer) {
        this.registry = registry;
        this.relationshipAnalyzer = relationshipAnalyzer;
    }

    public record FactionRequest(
        @JsonProperty("name") String name,
        @JsonProperty("traits") TraitVector traits
    ) {}

    @PutMapping("/{factionId}")
    public FactionSnapshot register(@PathVariable String factionId, @RequestBody FactionRequest request) {
        FactionSnapshot faction = registry.register(new FactionSnapshot(factionId, request.name(), request.traits()));
        log.info("Registered faction {} ({})", faction.factionId(), faction.name());
        return faction;
    }

    public record StatusRequest(@JsonProperty("status") DiplomaticStatus status) {}

    @PutMapping("/{factionId}/status/{otherId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void setStatus(@PathVariable String factionId, @PathVariable String otherId,
                          @RequestBody StatusRequest request) {
        if (request.status() == null) {
            throw new ValidationException("status is required");
        }
        registry.getFaction(factionId);
        registry.getFaction(otherId);
        registry.setStatus(factionId, otherId, request.status());
        log.info("Diplomatic status {}<->{} set to {}", factionId, otherId, request.status().getValue());
    }

    @GetMapping("/{factionId}/reputation")
    public FactionReputation reputation(@PathVariable String factionId) {
        return relationshipAnalyzer.reputation(factionId);
    }
}
