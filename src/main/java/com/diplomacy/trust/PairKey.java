package com.diplomacy.trust;

import com.diplomacy.error.ValidationException;

import java.util.Objects;

/**
 * Unordered faction pair. {@code of("b", "a")} equals {@code of("a", "b")};
 * {@link #first()} is always the lexicographically smaller id.
 */
public record PairKey(String first, String second) {

    public PairKey {
        Objects.requireNonNull(first, "first");
        Objects.requireNonNull(second, "second");
        if (first.compareTo(second) > 0) {
            throw new IllegalArgumentException("pair ids must be ordered: " + first + ", " + second);
        }
    }

    /**
     * @throws ValidationException if both ids are the same faction
     */
    public static PairKey of(String factionA, String factionB) {
        Objects.requireNonNull(factionA, "factionA");
        Objects.requireNonNull(factionB, "factionB");
        if (factionA.equals(factionB)) {
            throw new ValidationException("a faction cannot form a pair with itself: " + factionA);
        }
        return factionA.compareTo(factionB) < 0
            ? new PairKey(factionA, factionB)
            : new PairKey(factionB, factionA);
    }

    public boolean contains(String factionId) {
        return first.equals(factionId) || second.equals(factionId);
    }

    public String other(String factionId) {
        if (first.equals(factionId)) {
            return second;
        }
        if (second.equals(factionId)) {
            return first;
        }
        throw new IllegalArgumentException(factionId + " is not part of " + this);
    }

    @Override
    public String toString() {
        return first + "_" + second;
    }
}
