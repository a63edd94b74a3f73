package com.diplomacy.compatibility;

import com.diplomacy.config.DiplomacyProperties;
import com.diplomacy.faction.InMemoryFactionRegistry;
import com.diplomacy.faction.Trait;
import com.diplomacy.faction.TraitVector;
import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;

import java.util.EnumMap;
import java.util.Map;
import java.util.SplittableRandom;

import static org.assertj.core.api.Assertions.*;

/**
 * Property-based tests for compatibility scoring.
 */
class CompatibilityPropertyTest {

    private final CompatibilityEngine engine =
        new CompatibilityEngine(new DiplomacyProperties().getCompatibility(), new InMemoryFactionRegistry());

    @Property(tries = 300)
    @Label("Compatibility is symmetric")
    void compatibility_isSymmetric(@ForAll("traitVectors") TraitVector a, @ForAll("traitVectors") TraitVector b) {
        assertThat(engine.compatibility(a, b))
            .as("compatibility(A,B) == compatibility(B,A)")
            .isEqualTo(engine.compatibility(b, a));
    }

    @Property(tries = 300)
    @Label("Compatibility stays within [0, 1]")
    void compatibility_isBounded(@ForAll("traitVectors") TraitVector a, @ForAll("traitVectors") TraitVector b) {
        assertThat(engine.compatibility(a, b)).isBetween(0.0, 1.0);
    }

    @Property(tries = 300)
    @Label("Threat stays within [0, 1] for any enemy count and seed")
    void threat_isBounded(@ForAll @IntRange(min = 0, max = 50) int sharedEnemies, @ForAll long seed) {
        assertThat(engine.threatLevel(sharedEnemies, new SplittableRandom(seed))).isBetween(0.0, 1.0);
    }

    @Provide
    Arbitrary<TraitVector> traitVectors() {
        Arbitrary<Integer> value = Arbitraries.integers().between(TraitVector.MIN, TraitVector.MAX);
        return Combinators.combine(value, value, value, value, value).as((p, i, a, im, d) -> {
            Map<Trait, Integer> values = new EnumMap<>(Trait.class);
            values.put(Trait.PRAGMATISM, p);
            values.put(Trait.INTEGRITY, i);
            values.put(Trait.AMBITION, a);
            values.put(Trait.IMPULSIVITY, im);
            values.put(Trait.DISCIPLINE, d);
            return TraitVector.of(values);
        });
    }
}
