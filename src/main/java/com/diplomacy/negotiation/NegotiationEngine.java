package com.diplomacy.negotiation;

import com.diplomacy.alliance.AllianceFormationEngine;
import com.diplomacy.alliance.AllianceTerms;
import com.diplomacy.alliance.AllianceType;
import com.diplomacy.config.DiplomacyProperties;
import com.diplomacy.error.InvalidParticipantsException;
import com.diplomacy.error.NotAParticipantException;
import com.diplomacy.error.SessionClosedException;
import com.diplomacy.error.SessionNotFoundException;
import com.diplomacy.error.ValidationException;
import com.diplomacy.faction.AttributeProvider;
import com.diplomacy.faction.FactionSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Runs multi-party alliance negotiations.
 *
 * A session starts in {@link NegotiationPhase#PROPOSAL} and changes only
 * through {@link #advance}. Each accepted action is one round:
 * <ol>
 *   <li>the action updates the terms and/or the actor's position</li>
 *   <li>the event is logged and the round counter increments</li>
 *   <li>a violated deal-breaker rejects the session</li>
 *   <li>consensus (share of Eager/Interested factions at or above the threshold)
 *       steps the phase forward; in Ratification it completes the session
 *       once every participant has accepted the current terms</li>
 *   <li>without consensus, a terms change moves an opening phase forward</li>
 *   <li>the last allowed round without completion expires the session</li>
 * </ol>
 *
 * Deadlines are checked lazily whenever a session is read or advanced.
 */
public class NegotiationEngine {

    private static final Logger log = LoggerFactory.getLogger(NegotiationEngine.class);

    private static final Set<NegotiationAction> OPEN_ACTIONS = EnumSet.allOf(NegotiationAction.class);
    private static final Set<NegotiationAction> REVIEW_ACTIONS = EnumSet.of(
        NegotiationAction.REQUEST_MODIFICATION, NegotiationAction.ACCEPT_TERMS,
        NegotiationAction.REJECT_TERMS, NegotiationAction.WITHDRAW);
    private static final Set<NegotiationAction> RATIFICATION_ACTIONS = EnumSet.of(
        NegotiationAction.ACCEPT_TERMS, NegotiationAction.REJECT_TERMS, NegotiationAction.WITHDRAW);

    private final DiplomacyProperties.Negotiation config;
    private final AttributeProvider attributes;
    private final AllianceFormationEngine formationEngine;
    private final PositionEvaluator positionEvaluator;
    private final NegotiationStore store;
    private final Clock clock;

    public NegotiationEngine(DiplomacyProperties.Negotiation config,
                             AttributeProvider attributes,
                             AllianceFormationEngine formationEngine,
                             PositionEvaluator positionEvaluator,
                             NegotiationStore store,
                             Clock clock) {
        this.config = config;
        this.attributes = attributes;
        this.formationEngine = formationEngine;
        this.positionEvaluator = positionEvaluator;
        this.store = store;
        this.clock = clock;
    }

    /**
     * Opens a negotiation between the initiator and the targets.
     *
     * @param proposedTerms optional overrides on the type's default terms
     * @throws InvalidParticipantsException if the distinct participant count is out of bounds
     * @throws com.diplomacy.error.FactionNotFoundException if any participant is unknown
     * @throws ValidationException if a term override is malformed
     */
    public InitiationResult initiate(String initiatorId, List<String> targetIds,
                                     AllianceType type, Map<String, ?> proposedTerms) {
        Objects.requireNonNull(initiatorId, "initiatorId");
        AllianceType allianceType = type != null ? type : AllianceType.MILITARY;

        Set<String> participants = new LinkedHashSet<>();
        participants.add(initiatorId);
        if (targetIds != null) {
            targetIds.stream().filter(Objects::nonNull).forEach(participants::add);
        }
        checkParticipantCount(participants.size());

        List<FactionSnapshot> factions = new ArrayList<>();
        for (String factionId : participants) {
            factions.add(attributes.getFaction(factionId));
        }

        AllianceTerms terms = formationEngine.initialTerms(allianceType, proposedTerms);

        Map<String, NegotiationPosition> positions = new LinkedHashMap<>();
        for (FactionSnapshot faction : factions) {
            positions.put(faction.factionId(), positionEvaluator.evaluate(faction, allianceType));
        }

        Instant now = Instant.now(clock);
        UUID sessionId = UUID.randomUUID();
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("initiator", initiatorId);
        data.put("targets", List.copyOf(participants).subList(1, participants.size()));
        data.put("alliance_type", allianceType.getValue());

        NegotiationSession session = new NegotiationSession(
            sessionId,
            initiatorId,
            List.copyOf(participants),
            NegotiationPhase.PROPOSAL,
            terms,
            positions,
            List.of(new NegotiationEvent(now, "negotiation_initiated", initiatorId,
                NegotiationPhase.PROPOSAL, 0, data)),
            0,
            config.getMaxRounds(),
            config.getConsensusThreshold(),
            now,
            now.plus(config.getDuration()));

        List<FactionResponse> responses = positions.values().stream()
            .map(FactionResponse::from)
            .toList();

        store.save(session);
        log.info("Negotiation {} initiated by {} with {} participants, type={}",
            sessionId, initiatorId, participants.size(), allianceType.getValue());
        return new InitiationResult(snapshot(session), responses);
    }

    /**
     * Applies one faction's action as a single round. All-or-nothing: a
     * rejected action leaves the session untouched.
     *
     * @param params term overrides for {@link NegotiationAction#PROPOSE_TERMS} and
     *               {@link NegotiationAction#REQUEST_MODIFICATION}; ignored otherwise
     * @throws SessionNotFoundException if the session does not exist
     * @throws NotAParticipantException if the faction is not in the session
     * @throws SessionClosedException if the session is terminal, including one that just expired
     * @throws ValidationException if the action is not available in the current phase or params are malformed
     */
    public ActionResult advance(UUID sessionId, String factionId, NegotiationAction action, Map<String, ?> params) {
        Objects.requireNonNull(action, "action");
        NegotiationSession current = expireIfOverdue(sessionId);
        if (!current.isParticipant(factionId)) {
            throw new NotAParticipantException(factionId, sessionId);
        }

        AtomicReference<ActionResult> result = new AtomicReference<>();
        store.update(sessionId, session -> applyRound(session, factionId, action, params, result::set));

        ActionResult outcome = result.get();
        if (outcome.previousPhase() != outcome.phase()) {
            log.info("Negotiation {} moved {} -> {} after {} by {}",
                sessionId, outcome.previousPhase().getValue(), outcome.phase().getValue(),
                action.getValue(), factionId);
        }
        return outcome;
    }

    /**
     * @throws SessionNotFoundException if the session does not exist
     */
    public SessionSnapshot status(UUID sessionId) {
        return snapshot(expireIfOverdue(sessionId));
    }

    /**
     * Open sessions, oldest first, optionally only those the faction takes part in.
     */
    public List<SessionSummary> listActive(String factionId) {
        List<SessionSummary> summaries = new ArrayList<>();
        for (NegotiationSession stored : store.findAll()) {
            if (factionId != null && !stored.isParticipant(factionId)) {
                continue;
            }
            NegotiationSession session = expireIfOverdue(stored.sessionId());
            if (session.phase().isTerminal()) {
                continue;
            }
            summaries.add(new SessionSummary(session.sessionId(), session.phase(), session.participants(),
                session.terms().allianceType(), session.deadline(), session.roundsCompleted()));
        }
        return summaries;
    }

    public static double successProbability(NegotiationSession session) {
        if (session.positions().isEmpty()) {
            return 0.0;
        }
        double total = 0.0;
        for (NegotiationPosition position : session.positions().values()) {
            total += position.stance().getSuccessScore();
        }
        return total / session.positions().size();
    }

    public static List<NegotiationAction> availableActions(NegotiationPhase phase) {
        Set<NegotiationAction> actions = switch (phase) {
            case PROPOSAL, COUNTER_PROPOSAL, TERMS_DISCUSSION -> OPEN_ACTIONS;
            case FINAL_REVIEW -> REVIEW_ACTIONS;
            case RATIFICATION -> RATIFICATION_ACTIONS;
            case COMPLETED, REJECTED, EXPIRED -> EnumSet.noneOf(NegotiationAction.class);
        };
        return List.copyOf(actions);
    }

    private NegotiationSession applyRound(NegotiationSession session, String factionId,
                                          NegotiationAction action, Map<String, ?> params,
                                          Consumer<ActionResult> resultSink) {
        if (session.phase().isTerminal()) {
            throw new SessionClosedException(session.sessionId(), session.phase());
        }
        if (!availableActions(session.phase()).contains(action)) {
            throw new ValidationException(action.getValue() + " is not available in phase "
                + session.phase().getValue());
        }

        NegotiationPhase previousPhase = session.phase();
        int previousVersion = session.terms().version();
        NegotiationPosition actor = session.position(factionId);
        NegotiationSession next = session;
        String effect;
        boolean initiatorWithdrew = false;

        switch (action) {
            case PROPOSE_TERMS -> {
                if (params == null || params.isEmpty()) {
                    throw new ValidationException("propose_terms requires at least one term override");
                }
                next = replaceTerms(next, session.terms().withOverrides(params));
                next = next.withPosition(next.position(factionId).withAccepted(true));
                effect = "terms_proposed";
            }
            case REQUEST_MODIFICATION -> {
                if (params == null || params.isEmpty()) {
                    effect = "details_requested";
                } else {
                    next = replaceTerms(next, session.terms().withOverrides(params));
                    effect = "terms_modified";
                }
            }
            case ACCEPT_TERMS -> {
                next = next.withPosition(actor.withStance(actor.stance().atLeast(NegotiationStance.INTERESTED))
                    .withAccepted(true));
                effect = "terms_accepted";
            }
            case REJECT_TERMS -> {
                next = next.withPosition(actor.withStance(actor.stance().cooler()).withAccepted(false));
                effect = "terms_rejected";
            }
            case WITHDRAW -> {
                initiatorWithdrew = factionId.equals(session.initiatorId());
                next = next.withPosition(actor.withStance(NegotiationStance.HOSTILE).withAccepted(false));
                effect = initiatorWithdrew ? "initiator_withdrew" : "participant_withdrew";
            }
            default -> throw new IllegalStateException("unhandled action " + action);
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("action", action.getValue());
        data.put("effect", effect);
        data.put("terms_version", next.terms().version());
        next = next.withEvent(new NegotiationEvent(Instant.now(clock), "action_" + action.getValue(),
            factionId, previousPhase, session.roundsCompleted() + 1, data));
        next = next.withRoundCompleted();

        boolean termsChanged = next.terms().version() != previousVersion;
        NegotiationPhase target = initiatorWithdrew
            ? NegotiationPhase.REJECTED
            : nextPhase(next, action, termsChanged);
        if (target != next.phase()) {
            next = transition(next, target, factionId);
        }

        resultSink.accept(new ActionResult(
            next.sessionId(),
            factionId,
            action,
            effect,
            previousPhase,
            next.phase(),
            next.roundsCompleted(),
            next.terms().version(),
            successProbability(next),
            availableActions(next.phase())));
        return next;
    }

    private NegotiationPhase nextPhase(NegotiationSession session, NegotiationAction action, boolean termsChanged) {
        NegotiationPhase phase = session.phase();
        boolean violated = session.positions().values().stream()
            .anyMatch(p -> p.isViolatedBy(session.terms()));
        if (violated) {
            return NegotiationPhase.REJECTED;
        }

        NegotiationPhase target = phase;
        if (action.canAdvancePhase()) {
            if (consensusReached(session)) {
                if (phase != NegotiationPhase.RATIFICATION) {
                    target = phase.next();
                } else if (allAccepted(session)) {
                    target = NegotiationPhase.COMPLETED;
                }
            } else if (termsChanged
                && (phase == NegotiationPhase.PROPOSAL || phase == NegotiationPhase.COUNTER_PROPOSAL)) {
                target = phase.next();
            }
        }

        if (!target.isTerminal() && session.roundsCompleted() >= session.maxRounds()) {
            return NegotiationPhase.EXPIRED;
        }
        return target;
    }

    private static boolean consensusReached(NegotiationSession session) {
        long supporting = session.positions().values().stream()
            .filter(p -> p.stance().supportsConsensus())
            .filter(p -> !p.isViolatedBy(session.terms()))
            .count();
        return (double) supporting / session.positions().size() >= session.consensusThreshold();
    }

    private static boolean allAccepted(NegotiationSession session) {
        return session.positions().values().stream().allMatch(NegotiationPosition::acceptedCurrentTerms);
    }

    /** New terms void every earlier acceptance. */
    private static NegotiationSession replaceTerms(NegotiationSession session, AllianceTerms terms) {
        Map<String, NegotiationPosition> reset = new LinkedHashMap<>();
        session.positions().forEach((id, position) -> reset.put(id, position.withAccepted(false)));
        return session.withTerms(terms).withPositions(reset);
    }

    private NegotiationSession transition(NegotiationSession session, NegotiationPhase target, String cause) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("from", session.phase().getValue());
        data.put("to", target.getValue());
        NegotiationSession moved = session.withPhase(target);
        return moved.withEvent(new NegotiationEvent(Instant.now(clock), "phase_changed", cause,
            target, moved.roundsCompleted(), data));
    }

    private NegotiationSession expireIfOverdue(UUID sessionId) {
        NegotiationSession session = store.find(sessionId)
            .orElseThrow(() -> new SessionNotFoundException(sessionId));
        if (!isOverdue(session)) {
            return session;
        }
        NegotiationSession expired = store.update(sessionId, current -> isOverdue(current)
            ? transition(current, NegotiationPhase.EXPIRED, current.initiatorId())
            : current);
        log.info("Negotiation {} expired at deadline {}", sessionId, expired.deadline());
        return expired;
    }

    private boolean isOverdue(NegotiationSession session) {
        return !session.phase().isTerminal() && Instant.now(clock).isAfter(session.deadline());
    }

    private void checkParticipantCount(int count) {
        if (count < config.getMinParticipants()) {
            throw new InvalidParticipantsException(InvalidParticipantsException.Reason.INSUFFICIENT_PARTICIPANTS,
                count, config.getMinParticipants(), config.getMaxParticipants());
        }
        if (count > config.getMaxParticipants()) {
            throw new InvalidParticipantsException(InvalidParticipantsException.Reason.TOO_MANY_PARTICIPANTS,
                count, config.getMinParticipants(), config.getMaxParticipants());
        }
    }

    private static SessionSnapshot snapshot(NegotiationSession session) {
        Map<String, NegotiationStance> stances = new LinkedHashMap<>();
        session.positions().forEach((id, position) -> stances.put(id, position.stance()));
        return new SessionSnapshot(
            session.sessionId(),
            session.initiatorId(),
            session.phase(),
            session.participants(),
            stances,
            List.copyOf(session.positions().values()),
            session.roundsCompleted(),
            session.maxRounds(),
            session.consensusThreshold(),
            successProbability(session),
            session.createdAt(),
            session.deadline(),
            session.terms(),
            session.events());
    }
}
