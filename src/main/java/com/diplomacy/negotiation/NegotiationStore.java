package com.diplomacy.negotiation;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Session registry keyed by id.
 *
 * {@link #update} is the only mutation path for an existing session and must
 * run updates for the same id one at a time. If the update function throws,
 * the stored session is left unchanged.
 */
public interface NegotiationStore {

    NegotiationSession save(NegotiationSession session);

    Optional<NegotiationSession> find(UUID sessionId);

    /**
     * @throws com.diplomacy.error.SessionNotFoundException if no session has this id
     */
    NegotiationSession update(UUID sessionId, UnaryOperator<NegotiationSession> change);

    List<NegotiationSession> findAll();
}
