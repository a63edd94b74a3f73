package com.diplomacy.faction;

import com.diplomacy.error.ValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable map of trait to 0-10 value. Traits that were never recorded for a
 * faction read as {@link #NEUTRAL}.
 */
public final class TraitVector {

    public static final int MIN = 0;
    public static final int MAX = 10;
    public static final int NEUTRAL = 5;

    private static final TraitVector EMPTY = new TraitVector(new EnumMap<>(Trait.class));

    private final Map<Trait, Integer> values;

    private TraitVector(EnumMap<Trait, Integer> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static TraitVector of(Map<Trait, Integer> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        EnumMap<Trait, Integer> copy = new EnumMap<>(Trait.class);
        values.forEach((trait, value) -> {
            if (trait == null || value == null) {
                throw new ValidationException("trait vector entries must be non-null");
            }
            copy.put(trait, checkRange(trait, value));
        });
        return new TraitVector(copy);
    }

    /** Accepts both "integrity" and "hidden_integrity" style keys. */
    @JsonCreator
    public static TraitVector fromJson(Map<String, Integer> raw) {
        if (raw == null) {
            return EMPTY;
        }
        EnumMap<Trait, Integer> parsed = new EnumMap<>(Trait.class);
        raw.forEach((key, value) -> {
            try {
                parsed.put(Trait.fromValue(key), value);
            } catch (IllegalArgumentException ex) {
                throw new ValidationException(ex.getMessage());
            }
        });
        return of(parsed);
    }

    public static TraitVector empty() {
        return EMPTY;
    }

    public int get(Trait trait) {
        return values.getOrDefault(trait, NEUTRAL);
    }

    /** Trait value scaled onto [0, 1]. */
    public double normalized(Trait trait) {
        return get(trait) / 10.0;
    }

    public TraitVector with(Trait trait, int value) {
        EnumMap<Trait, Integer> copy = new EnumMap<>(Trait.class);
        copy.putAll(values);
        copy.put(trait, checkRange(trait, value));
        return new TraitVector(copy);
    }

    @JsonValue
    public Map<String, Integer> toJson() {
        Map<String, Integer> json = new LinkedHashMap<>();
        values.forEach((trait, value) -> json.put(trait.getValue(), value));
        return json;
    }

    private static int checkRange(Trait trait, int value) {
        if (value < MIN || value > MAX) {
            throw new ValidationException(
                "trait " + trait.getValue() + " must be within [" + MIN + ", " + MAX + "], got " + value);
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TraitVector other)) {
            return false;
        }
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return "TraitVector" + values;
    }
}
