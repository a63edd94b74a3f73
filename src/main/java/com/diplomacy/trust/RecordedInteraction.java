package com.diplomacy.trust;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of {@link TrustLedger#recordInteraction}: the stored interaction and
 * the pair's trust state after it.
 */
public record RecordedInteraction(
    @JsonProperty("interaction") InteractionRecord interaction,
    @JsonProperty("trust") TrustEvolution trust,
    @JsonProperty("trust_category") TrustCategory trustCategory
) {}
