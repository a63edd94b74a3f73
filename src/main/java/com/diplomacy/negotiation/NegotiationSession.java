package com.diplomacy.negotiation;

import com.diplomacy.alliance.AllianceTerms;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Immutable state of one negotiation. Every change produces a new instance,
 * so readers holding a reference always see a consistent snapshot.
 */
public record NegotiationSession(
    UUID sessionId,
    String initiatorId,
    List<String> participants,
    NegotiationPhase phase,
    AllianceTerms terms,
    Map<String, NegotiationPosition> positions,
    List<NegotiationEvent> events,
    int roundsCompleted,
    int maxRounds,
    double consensusThreshold,
    Instant createdAt,
    Instant deadline
) {
    public NegotiationSession {
        participants = List.copyOf(participants);
        positions = Collections.unmodifiableMap(new LinkedHashMap<>(positions));
        events = List.copyOf(events);
    }

    public boolean isParticipant(String factionId) {
        return positions.containsKey(factionId);
    }

    public NegotiationPosition position(String factionId) {
        return positions.get(factionId);
    }

    /**
     * @throws IllegalStateException if the edge is not part of the phase graph
     */
    public NegotiationSession withPhase(NegotiationPhase target) {
        if (target == phase) {
            return this;
        }
        if (!phase.canTransitionTo(target)) {
            throw new IllegalStateException("illegal phase transition " + phase + " -> " + target);
        }
        return new NegotiationSession(sessionId, initiatorId, participants, target, terms, positions,
            events, roundsCompleted, maxRounds, consensusThreshold, createdAt, deadline);
    }

    public NegotiationSession withTerms(AllianceTerms newTerms) {
        return new NegotiationSession(sessionId, initiatorId, participants, phase, newTerms, positions,
            events, roundsCompleted, maxRounds, consensusThreshold, createdAt, deadline);
    }

    public NegotiationSession withPosition(NegotiationPosition position) {
        Map<String, NegotiationPosition> updated = new LinkedHashMap<>(positions);
        updated.put(position.factionId(), position);
        return new NegotiationSession(sessionId, initiatorId, participants, phase, terms, updated,
            events, roundsCompleted, maxRounds, consensusThreshold, createdAt, deadline);
    }

    public NegotiationSession withPositions(Map<String, NegotiationPosition> newPositions) {
        return new NegotiationSession(sessionId, initiatorId, participants, phase, terms, newPositions,
            events, roundsCompleted, maxRounds, consensusThreshold, createdAt, deadline);
    }

    public NegotiationSession withEvent(NegotiationEvent event) {
        List<NegotiationEvent> appended = new ArrayList<>(events);
        appended.add(event);
        return new NegotiationSession(sessionId, initiatorId, participants, phase, terms, positions,
            appended, roundsCompleted, maxRounds, consensusThreshold, createdAt, deadline);
    }

    public NegotiationSession withRoundCompleted() {
        if (roundsCompleted >= maxRounds) {
            throw new IllegalStateException("rounds exhausted for negotiation " + sessionId);
        }
        return new NegotiationSession(sessionId, initiatorId, participants, phase, terms, positions,
            events, roundsCompleted + 1, maxRounds, consensusThreshold, createdAt, deadline);
    }
}
