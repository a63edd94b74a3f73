package com.diplomacy.negotiation;

import com.diplomacy.alliance.AllianceTerm;
import com.diplomacy.alliance.AllianceTerms;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Set;

/**
 * One faction's view inside one negotiation.
 *
 * @param acceptedCurrentTerms whether the faction has accepted the terms version now on the table
 */
public record NegotiationPosition(
    @JsonProperty("faction_id") String factionId,
    @JsonProperty("faction_name") String factionName,
    @JsonProperty("stance") NegotiationStance stance,
    @JsonProperty("priority_terms") Set<AllianceTerm> priorityTerms,
    @JsonProperty("deal_breakers") Set<AllianceTerm> dealBreakers,
    @JsonProperty("trust_requirement") double trustRequirement,
    @JsonProperty("minimum_benefit_threshold") double minimumBenefitThreshold,
    @JsonProperty("flexibility") double flexibility,
    @JsonProperty("accepted_current_terms") boolean acceptedCurrentTerms
) {
    public NegotiationPosition {
        priorityTerms = Set.copyOf(priorityTerms);
        dealBreakers = Set.copyOf(dealBreakers);
    }

    public boolean isViolatedBy(AllianceTerms terms) {
        return dealBreakers.stream().anyMatch(terms::isEnabled);
    }

    public NegotiationPosition withStance(NegotiationStance newStance) {
        return new NegotiationPosition(factionId, factionName, newStance, priorityTerms, dealBreakers,
            trustRequirement, minimumBenefitThreshold, flexibility, acceptedCurrentTerms);
    }

    public NegotiationPosition withAccepted(boolean accepted) {
        return new NegotiationPosition(factionId, factionName, stance, priorityTerms, dealBreakers,
            trustRequirement, minimumBenefitThreshold, flexibility, accepted);
    }
}
