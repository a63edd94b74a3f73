package com.diplomacy.trust;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Closed set of inter-faction interactions. Each kind scales the trust impact
 * into a tension impact; negative multipliers mean the interaction eases tension.
 */
public enum InteractionKind {
    ALLIANCE_PROPOSAL("alliance_proposal", 1.0),
    ALLIANCE_ACCEPTANCE("alliance_acceptance", 1.0),
    ALLIANCE_REJECTION("alliance_rejection", 1.0),
    TREATY_SIGNED("treaty_signed", 1.0),
    TREATY_VIOLATED("treaty_violated", 1.8),
    TRADE_AGREEMENT("trade_agreement", -0.4),
    MILITARY_SUPPORT("military_support", -0.8),
    BETRAYAL("betrayal", 2.0),
    DIPLOMATIC_INSULT("diplomatic_insult", 1.5),
    TERRITORIAL_DISPUTE("territorial_dispute", 1.7),
    RESOURCE_CONFLICT("resource_conflict", 1.4),
    CULTURAL_EXCHANGE("cultural_exchange", -0.3),
    HUMANITARIAN_AID("humanitarian_aid", -0.5),
    ESPIONAGE_DETECTED("espionage_detected", 1.6),
    BORDER_INCIDENT("border_incident", 1.3),
    SUCCESSION_SUPPORT("succession_support", 1.0),
    MEDIATION_ATTEMPT("mediation_attempt", 1.0);

    private final String value;
    private final double tensionMultiplier;

    InteractionKind(String value, double tensionMultiplier) {
        this.value = value;
        this.tensionMultiplier = tensionMultiplier;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public double tensionImpact(double trustImpact) {
        return trustImpact * tensionMultiplier;
    }

    @JsonCreator
    public static InteractionKind fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw) || v.name().equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown interaction kind: " + raw));
    }
}
