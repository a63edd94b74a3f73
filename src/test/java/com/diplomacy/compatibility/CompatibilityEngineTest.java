package com.diplomacy.compatibility;

import com.diplomacy.config.DiplomacyProperties;
import com.diplomacy.error.FactionNotFoundException;
import com.diplomacy.faction.InMemoryFactionRegistry;
import com.diplomacy.faction.TraitVector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.SplittableRandom;

import static com.diplomacy.faction.Trait.*;
import static com.diplomacy.support.TestFactions.*;
import static org.junit.jupiter.api.Assertions.*;

class CompatibilityEngineTest {

    private InMemoryFactionRegistry registry;
    private CompatibilityEngine engine;

    @BeforeEach
    void setUp() {
        registry = registry(
            faction("north", PRAGMATISM, 7, INTEGRITY, 9, AMBITION, 5, IMPULSIVITY, 3),
            faction("south", PRAGMATISM, 6, INTEGRITY, 7, AMBITION, 4, IMPULSIVITY, 4),
            faction("raiders", PRAGMATISM, 2, INTEGRITY, 1, AMBITION, 10, DISCIPLINE, 1));
        engine = new CompatibilityEngine(new DiplomacyProperties().getCompatibility(), registry);
    }

    @Nested
    @DisplayName("Assessment")
    class Assessment {

        @Test
        @DisplayName("Principled neighbours with one shared enemy are compatible")
        void principledNeighbours_areCompatible() {
            CompatibilityAssessment result = engine.assess("north", "south", List.of("raiders"),
                new SplittableRandom(42));

            assertTrue(result.compatibility() > 0.6, "compatibility " + result.compatibility());
            assertTrue(result.threatLevel() >= 0.2 && result.threatLevel() <= 0.5,
                "threat " + result.threatLevel());
            assertTrue(result.compatible());
        }

        @Test
        void sameSeed_sameThreat() {
            double first = engine.assess("north", "south", List.of("raiders"), new SplittableRandom(7)).threatLevel();
            double second = engine.assess("north", "south", List.of("raiders"), new SplittableRandom(7)).threatLevel();
            assertEquals(first, second);
        }

        @Test
        @DisplayName("Duplicate enemies and the pair itself are not counted")
        void enemiesAreDeduplicated() {
            CompatibilityAssessment once = engine.assess("north", "south", List.of("raiders"), new SplittableRandom(3));
            CompatibilityAssessment noisy = engine.assess("north", "south",
                List.of("raiders", "raiders", "north", "south"), new SplittableRandom(3));
            assertEquals(once.threatLevel(), noisy.threatLevel());
        }

        @Test
        void unknownFaction_isNotFound() {
            FactionNotFoundException ex = assertThrows(FactionNotFoundException.class,
                () -> engine.assess("north", "ghost", List.of(), new SplittableRandom(1)));
            assertEquals("ghost", ex.getFactionId());
        }
    }

    @Nested
    @DisplayName("Scoring")
    class Scoring {

        @Test
        @DisplayName("Weighted closeness matches the hand-computed value")
        void weightedCloseness() {
            // integrity .8*.35 + pragmatism .9*.25 + discipline 1*.25 + ambition .9*.15
            double score = engine.compatibility(
                traits(PRAGMATISM, 7, INTEGRITY, 9, AMBITION, 5, IMPULSIVITY, 3),
                traits(PRAGMATISM, 6, INTEGRITY, 7, AMBITION, 4, IMPULSIVITY, 4));
            assertEquals(0.89, score, 1e-9);
        }

        @Test
        @DisplayName("A wide ambition gap scores the complement bonus")
        void ambitionGap_scoresComplement() {
            double leaderFollower = engine.compatibility(traits(AMBITION, 9), traits(AMBITION, 2));
            // other traits identical: .35 + .25 + .25 + .8*.15
            assertEquals(0.97, leaderFollower, 1e-9);
        }

        @Test
        void identicalFactions_scoreOne() {
            assertEquals(1.0, engine.compatibility(TraitVector.empty(), TraitVector.empty()), 1e-9);
        }

        @Test
        void threat_growsWithSharedEnemies_andIsCapped() {
            assertEquals(0.0, engine.threatLevel(0, new FixedRandom(0.0)), 1e-9);
            assertEquals(0.4 + 0.15, engine.threatLevel(2, new FixedRandom(0.5)), 1e-9);
            assertEquals(1.0, engine.threatLevel(9, new FixedRandom(0.99)), 1e-9);
        }

        @Test
        @DisplayName("Overwhelming threat makes an incompatible pair compatible")
        void threatOverride() {
            assertFalse(engine.isCompatible(0.3, 0.5));
            assertTrue(engine.isCompatible(0.3, 0.81));
            assertTrue(engine.isCompatible(0.41, 0.0));
        }
    }

    /** Generator that always returns the same double. */
    static final class FixedRandom implements java.util.random.RandomGenerator {
        private final double value;

        FixedRandom(double value) {
            this.value = value;
        }

        @Override
        public long nextLong() {
            return 0L;
        }

        @Override
        public double nextDouble() {
            return value;
        }
    }
}
