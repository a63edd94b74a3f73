package com.diplomacy.alliance;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Switchable provisions of an alliance. Negotiation priorities and
 * deal-breakers are expressed in these terms.
 */
public enum AllianceTerm {
    MUTUAL_DEFENSE("mutual_defense"),
    OFFENSIVE_COORDINATION("offensive_coordination"),
    SHARED_INTELLIGENCE("shared_intelligence"),
    JOINT_MILITARY_EXERCISES("joint_military_exercises"),
    TRADE_PREFERENCES("trade_preferences"),
    SHARED_INFRASTRUCTURE("shared_infrastructure"),
    JOINT_ECONOMIC_PROJECTS("joint_economic_projects"),
    DIPLOMATIC_COORDINATION("diplomatic_coordination"),
    SHARED_EMBASSIES("shared_embassies"),
    CULTURAL_EXCHANGE("cultural_exchange"),
    JOINT_DIPLOMATIC_MISSIONS("joint_diplomatic_missions"),
    SHARED_BORDERS("shared_borders"),
    TERRITORIAL_GUARANTEES("territorial_guarantees"),
    AUTO_RENEW("auto_renew");

    private final String key;

    AllianceTerm(String key) {
        this.key = key;
    }

    @JsonValue
    public String getKey() {
        return key;
    }

    public static Optional<AllianceTerm> byKey(String key) {
        return Arrays.stream(values())
            .filter(t -> t.key.equals(key))
            .findFirst();
    }

    @JsonCreator
    public static AllianceTerm fromKey(String key) {
        return byKey(key).orElseThrow(() -> new IllegalArgumentException("Unknown alliance term: " + key));
    }
}
