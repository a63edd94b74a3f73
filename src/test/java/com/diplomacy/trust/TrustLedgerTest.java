package com.diplomacy.trust;

import com.diplomacy.compatibility.CompatibilityEngine;
import com.diplomacy.config.DiplomacyProperties;
import com.diplomacy.error.FactionNotFoundException;
import com.diplomacy.error.ValidationException;
import com.diplomacy.faction.InMemoryFactionRegistry;
import com.diplomacy.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static com.diplomacy.faction.Trait.*;
import static com.diplomacy.support.TestFactions.*;
import static org.junit.jupiter.api.Assertions.*;

class TrustLedgerTest {

    private static final double EPS = 1e-9;

    private InMemoryFactionRegistry registry;
    private InMemoryRelationshipStore store;
    private CompatibilityEngine compatibilityEngine;
    private MutableClock clock;
    private TrustLedger ledger;

    @BeforeEach
    void setUp() {
        registry = registry(
            faction("a", PRAGMATISM, 7, INTEGRITY, 6, AMBITION, 5),
            faction("b", PRAGMATISM, 6, INTEGRITY, 7, AMBITION, 4),
            faction("c", PRAGMATISM, 2, INTEGRITY, 1, AMBITION, 9, IMPULSIVITY, 9));
        DiplomacyProperties properties = new DiplomacyProperties();
        store = new InMemoryRelationshipStore();
        compatibilityEngine = new CompatibilityEngine(properties.getCompatibility(), registry);
        clock = MutableClock.startingAt("2026-03-01T00:00:00Z");
        ledger = new TrustLedger(properties.getTrust(), compatibilityEngine, registry, store, clock);
    }

    private void seedNeutral(String x, String y) {
        store.storeTrustEvolution(TrustEvolution.seeded(PairKey.of(x, y), 0.5, 0.5, clock.instant()));
    }

    @Nested
    @DisplayName("Recording interactions")
    class Recording {

        @Test
        @DisplayName("A betrayal moves the victim's trust by the capped step and the betrayer's by half")
        void betrayal_isCappedAndAsymmetric() {
            seedNeutral("a", "b");

            RecordedInteraction recorded = ledger.recordInteraction("a", "b", InteractionKind.BETRAYAL,
                "broke the pact", -0.9, -0.5, 0.9);
            TrustEvolution trust = recorded.trust();

            assertEquals(0.3, trust.trustFrom("b"), EPS);
            assertEquals(0.4, trust.trustFrom("a"), EPS);
            assertEquals(0.35, trust.mutualTrust(), EPS);
            assertEquals(TrustCategory.LOW_TRUST, recorded.trustCategory());
            assertEquals(-1.8, recorded.interaction().tensionImpact(), EPS);
            assertEquals(0.3, trust.lowestTrust(), EPS);
            assertEquals(0.5, trust.peakTrust(), EPS);
            assertEquals(2, trust.history().size());
        }

        @Test
        void directionFollowsInitiator_notPairOrder() {
            seedNeutral("a", "b");
            TrustEvolution trust = ledger.recordInteraction("b", "a", InteractionKind.MILITARY_SUPPORT,
                "sent troops", 0.1, 0.1, 0.4).trust();

            assertEquals(0.6, trust.trustFrom("a"), EPS);
            assertEquals(0.55, trust.trustFrom("b"), EPS);
        }

        @Test
        void trustClampsAtBounds() {
            store.storeTrustEvolution(TrustEvolution.seeded(PairKey.of("a", "b"), 0.05, 0.5, clock.instant()));
            TrustEvolution trust = ledger.recordInteraction("a", "b", InteractionKind.BETRAYAL,
                null, -1.0, -1.0, 1.0).trust();

            assertEquals(0.0, trust.trustFrom("b"), EPS);
            assertEquals(0.0, trust.trustFrom("a"), EPS);
            assertEquals(TrustCategory.DEEP_MISTRUST, TrustLedger.categorize(trust.mutualTrust()));
        }

        @Test
        @DisplayName("History is append-only and readable from either side")
        void history_isAppendOnly() {
            ledger.recordInteraction("a", "b", InteractionKind.TRADE_AGREEMENT, "grain", 0.3, 0.1, 0.3);
            ledger.recordInteraction("b", "a", InteractionKind.CULTURAL_EXCHANGE, "festival", 0.2, 0.1, 0.2);

            List<InteractionRecord> history = store.getInteractions("b", "a");
            assertEquals(2, history.size());
            assertEquals(InteractionKind.TRADE_AGREEMENT, history.get(0).kind());
            assertEquals(InteractionKind.CULTURAL_EXCHANGE, history.get(1).kind());
            assertEquals(2, store.getInteractionsInvolving("a").size());
            assertTrue(store.getInteractionsInvolving("c").isEmpty());
        }

        @Test
        void consequences_reflectImpactSeverityAndKind() {
            List<String> betrayal = ledger.consequences(InteractionKind.BETRAYAL, -0.8, 0.9);
            assertEquals(List.of("Damaged diplomatic relations", "Regional diplomatic impact",
                "Trust penalty with other factions", "Reputation damage"), betrayal);

            assertEquals(List.of("Strengthened diplomatic ties", "Formal diplomatic process initiated"),
                ledger.consequences(InteractionKind.ALLIANCE_PROPOSAL, 0.4, 0.2));
            assertTrue(ledger.consequences(InteractionKind.BORDER_INCIDENT, -0.1, 0.3).isEmpty());
        }

        @Test
        @DisplayName("Consequence thresholds come from configuration")
        void consequences_followConfiguredThresholds() {
            DiplomacyProperties.Trust strict = new DiplomacyProperties.Trust();
            strict.setStrongImpactThreshold(0.5);
            strict.setRegionalSeverityThreshold(0.95);
            TrustLedger strictLedger = new TrustLedger(strict, compatibilityEngine, registry, store, clock);

            assertEquals(List.of("Formal diplomatic process initiated"),
                strictLedger.consequences(InteractionKind.ALLIANCE_PROPOSAL, 0.4, 0.9));
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        void selfInteraction_isRejected() {
            assertThrows(ValidationException.class, () -> ledger.recordInteraction("a", "a",
                InteractionKind.TRADE_AGREEMENT, "", 0.1, 0.0, 0.1));
        }

        @Test
        @DisplayName("Out-of-range scalars are rejected and nothing is stored")
        void outOfRange_storesNothing() {
            assertThrows(ValidationException.class, () -> ledger.recordInteraction("a", "b",
                InteractionKind.TRADE_AGREEMENT, "", 1.5, 0.0, 0.1));
            assertThrows(ValidationException.class, () -> ledger.recordInteraction("a", "b",
                InteractionKind.TRADE_AGREEMENT, "", 0.1, -2.0, 0.1));
            assertThrows(ValidationException.class, () -> ledger.recordInteraction("a", "b",
                InteractionKind.TRADE_AGREEMENT, "", 0.1, 0.0, 1.01));

            assertTrue(store.getInteractions("a", "b").isEmpty());
            assertTrue(store.getTrustEvolution("a", "b").isEmpty());
        }

        @Test
        void unknownFaction_storesNothing() {
            assertThrows(FactionNotFoundException.class, () -> ledger.recordInteraction("a", "ghost",
                InteractionKind.TRADE_AGREEMENT, "", 0.1, 0.0, 0.1));
            assertTrue(store.getInteractionsInvolving("a").isEmpty());
        }
    }

    @Nested
    @DisplayName("Seeding and volatility")
    class Seeding {

        @Test
        @DisplayName("First contact seeds trust around 0.5 by compatibility")
        void initialize_usesCompatibilitySpread() {
            double compatibility = compatibilityEngine.compatibility(
                registry.getHiddenAttributes("a"), registry.getHiddenAttributes("c"));

            TrustEvolution trust = ledger.initialize("c", "a");

            assertEquals(0.5 + (compatibility - 0.5) * 0.2, trust.aTrustsB(), EPS);
            assertEquals(trust.aTrustsB(), trust.bTrustsA(), EPS);
            assertEquals(compatibility, trust.baselineCompatibility(), EPS);
            assertEquals(PairKey.of("a", "c"), trust.pair());
            assertEquals(trust, ledger.initialize("a", "c"));
        }

        @Test
        void firstInteraction_seedsBeforeApplying() {
            TrustEvolution seed = ledger.initialize("a", "b");
            TrustEvolution trust = ledger.recordInteraction("a", "b", InteractionKind.HUMANITARIAN_AID,
                "relief", 0.15, 0.1, 0.3).trust();
            assertEquals(seed.bTrustsA() + 0.15, trust.trustFrom("b"), EPS);
        }

        @Test
        @DisplayName("Volatility stays zero until the window holds five samples")
        void volatility_needsFullWindow() {
            seedNeutral("a", "b");
            double[] impacts = {0.2, -0.2, 0.2};
            for (double impact : impacts) {
                clock.advance(Duration.ofHours(1));
                ledger.recordInteraction("a", "b", InteractionKind.BORDER_INCIDENT, "", impact, 0.0, 0.2);
            }
            assertEquals(0.0, ledger.find("a", "b").orElseThrow().volatility(), EPS);

            clock.advance(Duration.ofHours(1));
            TrustEvolution trust = ledger.recordInteraction("a", "b", InteractionKind.BORDER_INCIDENT,
                "", -0.2, 0.0, 0.2).trust();

            assertEquals(5, trust.history().size());
            // per-sample max: 0.5, 0.7, 0.5, 0.7, 0.5
            assertEquals(0.0096, trust.volatility(), EPS);
        }
    }
}
