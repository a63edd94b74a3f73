package com.diplomacy.config;

import com.diplomacy.alliance.AllianceFormationEngine;
import com.diplomacy.betrayal.BetrayalRiskEngine;
import com.diplomacy.compatibility.CompatibilityEngine;
import com.diplomacy.faction.AttributeProvider;
import com.diplomacy.faction.DiplomacyStatusProvider;
import com.diplomacy.negotiation.NegotiationEngine;
import com.diplomacy.negotiation.NegotiationStore;
import com.diplomacy.negotiation.PositionEvaluator;
import com.diplomacy.network.NetworkAnalyzer;
import com.diplomacy.relationship.RelationshipAnalyzer;
import com.diplomacy.relationship.RelationshipForecast;
import com.diplomacy.trust.RelationshipStore;
import com.diplomacy.trust.TrustLedger;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the engines. They are plain classes so they can be built directly in
 * unit tests; here they receive their slice of {@link DiplomacyProperties}
 * and whichever store/provider beans are present.
 */
@Configuration
@EnableConfigurationProperties(DiplomacyProperties.class)
public class DiplomacyConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CompatibilityEngine compatibilityEngine(DiplomacyProperties properties, AttributeProvider attributes) {
        return new CompatibilityEngine(properties.getCompatibility(), attributes);
    }

    @Bean
    public BetrayalRiskEngine betrayalRiskEngine(DiplomacyProperties properties, AttributeProvider attributes,
                                                 Clock clock) {
        return new BetrayalRiskEngine(properties.getBetrayal(), attributes, clock);
    }

    @Bean
    public AllianceFormationEngine allianceFormationEngine(DiplomacyProperties properties,
                                                           CompatibilityEngine compatibilityEngine,
                                                           AttributeProvider attributes) {
        return new AllianceFormationEngine(properties.getAlliance(), compatibilityEngine, attributes);
    }

    @Bean
    public PositionEvaluator positionEvaluator() {
        return new PositionEvaluator();
    }

    @Bean
    public NegotiationEngine negotiationEngine(DiplomacyProperties properties,
                                               AttributeProvider attributes,
                                               AllianceFormationEngine formationEngine,
                                               PositionEvaluator positionEvaluator,
                                               NegotiationStore store,
                                               Clock clock) {
        return new NegotiationEngine(properties.getNegotiation(), attributes, formationEngine,
            positionEvaluator, store, clock);
    }

    @Bean
    public TrustLedger trustLedger(DiplomacyProperties properties,
                                   CompatibilityEngine compatibilityEngine,
                                   AttributeProvider attributes,
                                   RelationshipStore store,
                                   Clock clock) {
        return new TrustLedger(properties.getTrust(), compatibilityEngine, attributes, store, clock);
    }

    @Bean
    public RelationshipForecast relationshipForecast(DiplomacyProperties properties) {
        return new RelationshipForecast(properties.getRelationship());
    }

    @Bean
    public RelationshipAnalyzer relationshipAnalyzer(DiplomacyProperties properties,
                                                     RelationshipForecast forecast,
                                                     TrustLedger ledger,
                                                     RelationshipStore store,
                                                     AttributeProvider attributes,
                                                     DiplomacyStatusProvider statusProvider,
                                                     Clock clock) {
        return new RelationshipAnalyzer(properties.getTrust(), properties.getNetwork(), forecast, ledger, store,
            attributes, statusProvider, clock);
    }

    @Bean
    public NetworkAnalyzer networkAnalyzer(DiplomacyProperties properties, RelationshipForecast forecast,
                                           RelationshipStore store) {
        return new NetworkAnalyzer(properties.getNetwork(), forecast, store);
    }
}
