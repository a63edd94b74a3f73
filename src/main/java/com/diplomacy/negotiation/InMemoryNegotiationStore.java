package com.diplomacy.negotiation;

import com.diplomacy.error.SessionNotFoundException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

@Component
public class InMemoryNegotiationStore implements NegotiationStore {

    private final ConcurrentHashMap<UUID, NegotiationSession> sessions = new ConcurrentHashMap<>();

    @Override
    public NegotiationSession save(NegotiationSession session) {
        sessions.put(session.sessionId(), session);
        return session;
    }

    @Override
    public Optional<NegotiationSession> find(UUID sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(sessions.get(sessionId));
    }

    @Override
    public NegotiationSession update(UUID sessionId, UnaryOperator<NegotiationSession> change) {
        // computeIfPresent serializes writers per key and keeps the old value if change throws
        NegotiationSession updated = sessions.computeIfPresent(sessionId, (id, current) -> change.apply(current));
        if (updated == null) {
            throw new SessionNotFoundException(sessionId);
        }
        return updated;
    }

    @Override
    public List<NegotiationSession> findAll() {
        List<NegotiationSession> all = new ArrayList<>(sessions.values());
        all.sort(Comparator.comparing(NegotiationSession::createdAt));
        return all;
    }
}
