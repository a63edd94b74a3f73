package com.diplomacy.negotiation;

import com.diplomacy.alliance.AllianceFormationEngine;
import com.diplomacy.alliance.AllianceTerm;
import com.diplomacy.alliance.AllianceType;
import com.diplomacy.compatibility.CompatibilityEngine;
import com.diplomacy.config.DiplomacyProperties;
import com.diplomacy.error.FactionNotFoundException;
import com.diplomacy.error.InvalidParticipantsException;
import com.diplomacy.error.NotAParticipantException;
import com.diplomacy.error.SessionClosedException;
import com.diplomacy.error.SessionNotFoundException;
import com.diplomacy.error.ValidationException;
import com.diplomacy.faction.InMemoryFactionRegistry;
import com.diplomacy.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.IntStream;

import static com.diplomacy.faction.Trait.*;
import static com.diplomacy.support.TestFactions.*;
import static org.junit.jupiter.api.Assertions.*;

class NegotiationEngineTest {

    private MutableClock clock;
    private InMemoryNegotiationStore store;
    private DiplomacyProperties properties;
    private NegotiationEngine engine;

    @BeforeEach
    void setUp() {
        InMemoryFactionRegistry registry = registry(
            faction("a", AMBITION, 8, PRAGMATISM, 7),
            faction("b", AMBITION, 5, PRAGMATISM, 7),
            faction("c", AMBITION, 6, PRAGMATISM, 2),
            faction("paladin", AMBITION, 2, PRAGMATISM, 8, INTEGRITY, 9),
            faction("warlord", AMBITION, 9, PRAGMATISM, 6));
        clock = MutableClock.startingAt("2026-05-01T12:00:00Z");
        store = new InMemoryNegotiationStore();
        properties = new DiplomacyProperties();
        engine = newEngine(registry, properties.getNegotiation());
    }

    private NegotiationEngine newEngine(InMemoryFactionRegistry registry, DiplomacyProperties.Negotiation config) {
        AllianceFormationEngine formation = new AllianceFormationEngine(properties.getAlliance(),
            new CompatibilityEngine(properties.getCompatibility(), registry), registry);
        return new NegotiationEngine(config, registry, formation, new PositionEvaluator(), store, clock);
    }

    private UUID startThreeWay() {
        return engine.initiate("a", List.of("b", "c"), AllianceType.MILITARY, null).session().sessionId();
    }

    @Nested
    @DisplayName("Initiation")
    class Initiation {

        @Test
        @DisplayName("Eager, interested and hostile participants start at 0.6 success")
        void threeWaySession() {
            InitiationResult result = engine.initiate("a", List.of("b", "c"), AllianceType.MILITARY, null);
            SessionSnapshot session = result.session();

            assertEquals(NegotiationPhase.PROPOSAL, session.phase());
            assertEquals(List.of("a", "b", "c"), session.participants());
            assertEquals(NegotiationStance.EAGER, session.stances().get("a"));
            assertEquals(NegotiationStance.INTERESTED, session.stances().get("b"));
            assertEquals(NegotiationStance.HOSTILE, session.stances().get("c"));
            assertEquals(0.6, session.successProbability(), 1e-9);
            assertEquals(clock.instant().plus(Duration.ofDays(30)), session.deadline());
            assertEquals(15, session.maxRounds());
            assertEquals(0, session.roundsCompleted());
            assertTrue(session.terms().isEnabled(AllianceTerm.MUTUAL_DEFENSE));

            assertEquals(List.of(ResponseKind.ACCEPT, ResponseKind.COUNTER_PROPOSAL, ResponseKind.REJECT),
                result.initialResponses().stream().map(FactionResponse::response).toList());
        }

        @Test
        void duplicateTargets_areCollapsed() {
            SessionSnapshot session = engine.initiate("a", List.of("b", "b", "a"), AllianceType.ECONOMIC, null).session();
            assertEquals(List.of("a", "b"), session.participants());
        }

        @Test
        void tooFewParticipants() {
            InvalidParticipantsException ex = assertThrows(InvalidParticipantsException.class,
                () -> engine.initiate("a", List.of("a"), AllianceType.MILITARY, null));
            assertEquals("INSUFFICIENT_PARTICIPANTS", ex.errorCode());
        }

        @Test
        void tooManyParticipants() {
            List<String> targets = IntStream.range(0, 8).mapToObj(i -> "t" + i).toList();
            InvalidParticipantsException ex = assertThrows(InvalidParticipantsException.class,
                () -> engine.initiate("a", targets, AllianceType.MILITARY, null));
            assertEquals("TOO_MANY_PARTICIPANTS", ex.errorCode());
        }

        @Test
        @DisplayName("Unknown participant fails without creating a session")
        void unknownParticipant_createsNothing() {
            assertThrows(FactionNotFoundException.class,
                () -> engine.initiate("a", List.of("ghost"), AllianceType.MILITARY, null));
            assertTrue(store.findAll().isEmpty());
        }

        @Test
        void malformedOverride_createsNothing() {
            assertThrows(ValidationException.class,
                () -> engine.initiate("a", List.of("b"), AllianceType.MILITARY, Map.of("nonsense", true)));
            assertTrue(store.findAll().isEmpty());
        }
    }

    @Nested
    @DisplayName("Consensus and phases")
    class Phases {

        @Test
        @DisplayName("Two of three supporters is below a 0.75 threshold")
        void noConsensus_staysInProposal() {
            UUID id = startThreeWay();
            ActionResult result = engine.advance(id, "a", NegotiationAction.ACCEPT_TERMS, null);

            assertEquals(NegotiationPhase.PROPOSAL, result.phase());
            assertEquals(1, result.roundsCompleted());
            assertEquals(0.6, result.successProbability(), 1e-9);
        }

        @Test
        @DisplayName("The hostile faction accepting resolves the block and moves the session on")
        void hostileAccepts_reachesConsensus() {
            UUID id = startThreeWay();
            ActionResult result = engine.advance(id, "c", NegotiationAction.ACCEPT_TERMS, null);

            assertEquals(NegotiationPhase.PROPOSAL, result.previousPhase());
            assertEquals(NegotiationPhase.COUNTER_PROPOSAL, result.phase());
            assertEquals((1.0 + 0.8 + 0.8) / 3, result.successProbability(), 1e-9);
        }

        @Test
        @DisplayName("With consensus every round steps one phase until ratification completes")
        void fullLifecycle_completes() {
            UUID id = startThreeWay();
            assertEquals(NegotiationPhase.COUNTER_PROPOSAL,
                engine.advance(id, "c", NegotiationAction.ACCEPT_TERMS, null).phase());
            assertEquals(NegotiationPhase.TERMS_DISCUSSION,
                engine.advance(id, "a", NegotiationAction.ACCEPT_TERMS, null).phase());
            assertEquals(NegotiationPhase.FINAL_REVIEW,
                engine.advance(id, "b", NegotiationAction.ACCEPT_TERMS, null).phase());

            ActionResult ratification = engine.advance(id, "c", NegotiationAction.ACCEPT_TERMS, null);
            assertEquals(NegotiationPhase.RATIFICATION, ratification.phase());
            assertFalse(ratification.availableActions().contains(NegotiationAction.PROPOSE_TERMS));

            ActionResult completed = engine.advance(id, "a", NegotiationAction.ACCEPT_TERMS, null);
            assertEquals(NegotiationPhase.COMPLETED, completed.phase());
            assertTrue(completed.availableActions().isEmpty());

            assertThrows(SessionClosedException.class,
                () -> engine.advance(id, "b", NegotiationAction.ACCEPT_TERMS, null));
            assertTrue(engine.listActive(null).isEmpty());
        }

        @Test
        @DisplayName("Ratification waits until every participant accepts the current terms")
        void ratification_requiresUnanimousAcceptance() {
            UUID id = startThreeWay();
            engine.advance(id, "c", NegotiationAction.ACCEPT_TERMS, null);
            engine.advance(id, "a", NegotiationAction.ACCEPT_TERMS, null);
            engine.advance(id, "b", NegotiationAction.ACCEPT_TERMS, null);
            // revising terms in final review clears every acceptance
            ActionResult revised = engine.advance(id, "b", NegotiationAction.REQUEST_MODIFICATION,
                Map.of("military_support_level", 0.6));
            assertEquals(NegotiationPhase.RATIFICATION, revised.phase());
            assertEquals(2, revised.termsVersion());

            assertEquals(NegotiationPhase.RATIFICATION,
                engine.advance(id, "a", NegotiationAction.ACCEPT_TERMS, null).phase());
            assertEquals(NegotiationPhase.RATIFICATION,
                engine.advance(id, "b", NegotiationAction.ACCEPT_TERMS, null).phase());
            assertEquals(NegotiationPhase.COMPLETED,
                engine.advance(id, "c", NegotiationAction.ACCEPT_TERMS, null).phase());
        }

        @Test
        @DisplayName("A counter-offer moves an opening phase forward even without consensus")
        void proposal_advancesOpeningPhase() {
            UUID id = startThreeWay();
            ActionResult result = engine.advance(id, "b", NegotiationAction.PROPOSE_TERMS,
                Map.of("joint_military_exercises", true));

            assertEquals(NegotiationPhase.COUNTER_PROPOSAL, result.phase());
            assertEquals(2, result.termsVersion());
            SessionSnapshot snapshot = engine.status(id);
            assertTrue(snapshot.terms().isEnabled(AllianceTerm.JOINT_MILITARY_EXERCISES));
            assertFalse(snapshot.positions().stream()
                .filter(p -> p.factionId().equals("a")).findFirst().orElseThrow().acceptedCurrentTerms());
        }

        @Test
        @DisplayName("Terms that violate a deal-breaker reject the session")
        void dealBreaker_rejects() {
            UUID id = engine.initiate("a", List.of("paladin"), AllianceType.MILITARY, null).session().sessionId();
            ActionResult result = engine.advance(id, "a", NegotiationAction.PROPOSE_TERMS,
                Map.of("offensive_coordination", true));
            assertEquals(NegotiationPhase.REJECTED, result.phase());
        }

        @Test
        void rejecting_coolsStance() {
            UUID id = startThreeWay();
            engine.advance(id, "b", NegotiationAction.REJECT_TERMS, null);
            assertEquals(NegotiationStance.CAUTIOUS, engine.status(id).stances().get("b"));
        }

        @Test
        void initiatorWithdrawal_rejects() {
            UUID id = startThreeWay();
            assertEquals(NegotiationPhase.REJECTED, engine.advance(id, "a", NegotiationAction.WITHDRAW, null).phase());
        }

        @Test
        void participantWithdrawal_turnsHostile() {
            UUID id = startThreeWay();
            ActionResult result = engine.advance(id, "b", NegotiationAction.WITHDRAW, null);
            assertEquals(NegotiationPhase.PROPOSAL, result.phase());
            assertEquals(NegotiationStance.HOSTILE, engine.status(id).stances().get("b"));
        }

        @Test
        @DisplayName("Reaching the round cap without completion expires the session")
        void roundCap_expires() {
            DiplomacyProperties.Negotiation tight = new DiplomacyProperties.Negotiation();
            tight.setMaxRounds(3);
            NegotiationEngine capped = newEngine(registry(
                faction("a", AMBITION, 8, PRAGMATISM, 7),
                faction("b", AMBITION, 5, PRAGMATISM, 7),
                faction("c", AMBITION, 6, PRAGMATISM, 2)), tight);
            UUID id = capped.initiate("a", List.of("b", "c"), AllianceType.MILITARY, null).session().sessionId();

            capped.advance(id, "c", NegotiationAction.REJECT_TERMS, null);
            capped.advance(id, "c", NegotiationAction.REJECT_TERMS, null);
            ActionResult last = capped.advance(id, "c", NegotiationAction.REJECT_TERMS, null);

            assertEquals(NegotiationPhase.EXPIRED, last.phase());
            assertEquals(3, last.roundsCompleted());
        }
    }

    @Nested
    @DisplayName("Rejected actions")
    class Rejections {

        @Test
        void unknownSession() {
            assertThrows(SessionNotFoundException.class,
                () -> engine.advance(UUID.randomUUID(), "a", NegotiationAction.ACCEPT_TERMS, null));
            assertThrows(SessionNotFoundException.class, () -> engine.status(UUID.randomUUID()));
        }

        @Test
        void nonParticipant() {
            UUID id = startThreeWay();
            assertThrows(NotAParticipantException.class,
                () -> engine.advance(id, "paladin", NegotiationAction.ACCEPT_TERMS, null));
        }

        @Test
        @DisplayName("A failed action leaves the session exactly as it was")
        void failedAction_isAllOrNothing() {
            UUID id = startThreeWay();
            SessionSnapshot before = engine.status(id);

            assertThrows(ValidationException.class,
                () -> engine.advance(id, "a", NegotiationAction.PROPOSE_TERMS, Map.of()));
            assertThrows(ValidationException.class,
                () -> engine.advance(id, "a", NegotiationAction.PROPOSE_TERMS, Map.of("mutual_defense", "maybe")));

            assertEquals(before, engine.status(id));
        }

        @Test
        @DisplayName("Rejecting terms holds the phase even while the cooled stances still agree")
        void rejection_neverAdvancesPhase() {
            UUID id = engine.initiate("a", List.of("warlord"), AllianceType.MILITARY, null).session().sessionId();

            ActionResult first = engine.advance(id, "a", NegotiationAction.REJECT_TERMS, null);
            assertEquals(NegotiationPhase.PROPOSAL, first.phase());
            assertEquals(NegotiationStance.INTERESTED, engine.status(id).stances().get("a"));

            ActionResult second = engine.advance(id, "warlord", NegotiationAction.REJECT_TERMS, null);
            assertEquals(NegotiationPhase.PROPOSAL, second.phase());
            assertEquals(2, second.roundsCompleted());

            // the same consensus carried by an acceptance does move the session on
            assertEquals(NegotiationPhase.COUNTER_PROPOSAL,
                engine.advance(id, "warlord", NegotiationAction.ACCEPT_TERMS, null).phase());
        }
    }

    @Nested
    @DisplayName("Deadlines and read projections")
    class Reads {

        @Test
        @DisplayName("A session untouched past its deadline reads as expired")
        void untouchedPastDeadline_expires() {
            UUID id = startThreeWay();
            clock.advance(Duration.ofDays(31));

            assertEquals(NegotiationPhase.EXPIRED, engine.status(id).phase());
            assertThrows(SessionClosedException.class,
                () -> engine.advance(id, "a", NegotiationAction.ACCEPT_TERMS, null));
            assertTrue(engine.listActive("a").isEmpty());
        }

        @Test
        void advancePastDeadline_persistsExpiry() {
            UUID id = startThreeWay();
            clock.advance(Duration.ofDays(30).plusSeconds(1));

            SessionClosedException ex = assertThrows(SessionClosedException.class,
                () -> engine.advance(id, "b", NegotiationAction.ACCEPT_TERMS, null));
            assertEquals(NegotiationPhase.EXPIRED, ex.getPhase());
            assertEquals(NegotiationPhase.EXPIRED, store.find(id).orElseThrow().phase());
        }

        @Test
        void status_isIdempotent() {
            UUID id = startThreeWay();
            engine.advance(id, "a", NegotiationAction.ACCEPT_TERMS, null);
            assertEquals(engine.status(id), engine.status(id));
        }

        @Test
        void listActive_filtersByFaction() {
            UUID threeWay = startThreeWay();
            engine.initiate("b", List.of("paladin"), AllianceType.DIPLOMATIC, null);

            assertEquals(2, engine.listActive(null).size());
            List<SessionSummary> forC = engine.listActive("c");
            assertEquals(1, forC.size());
            assertEquals(threeWay, forC.get(0).sessionId());
            assertEquals(AllianceType.MILITARY, forC.get(0).allianceType());
        }
    }
}
