package com.diplomacy.network;

import com.diplomacy.config.DiplomacyProperties;
import com.diplomacy.error.ValidationException;
import com.diplomacy.relationship.RelationshipForecast;
import com.diplomacy.trust.InMemoryRelationshipStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.diplomacy.support.TrustFixtures.mutual;
import static org.junit.jupiter.api.Assertions.*;

class NetworkAnalyzerTest {

    private static final double EPS = 1e-9;

    private InMemoryRelationshipStore store;
    private NetworkAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        store = new InMemoryRelationshipStore();
        DiplomacyProperties properties = new DiplomacyProperties();
        analyzer = new NetworkAnalyzer(properties.getNetwork(),
            new RelationshipForecast(properties.getRelationship()), store);

        store.storeTrustEvolution(mutual("a", "b", 0.9));
        store.storeTrustEvolution(mutual("a", "c", 0.75));
        store.storeTrustEvolution(mutual("b", "c", 0.75));
        store.storeTrustEvolution(mutual("b", "d", 0.25));
        store.storeTrustEvolution(mutual("c", "d", 0.05));
    }

    @Test
    @DisplayName("Pairs without a trust record count as neutral in the matrix")
    void matrix_usesNeutralForUnknownPairs() {
        NetworkAnalysis analysis = analyzer.analyze(List.of("a", "b", "c", "d"));

        assertEquals(6, analysis.relationshipMatrix().size());
        assertEquals(0.9, analysis.relationshipMatrix().get("a_b"), EPS);
        assertEquals(0.5, analysis.relationshipMatrix().get("a_d"), EPS);
        assertEquals(0.05, analysis.relationshipMatrix().get("c_d"), EPS);
    }

    @Test
    @DisplayName("Clusters seed from pairs and never absorb a faction twice")
    void clusters_areNotTransitive() {
        List<AllianceCluster> clusters = analyzer.analyze(List.of("a", "b", "c", "d")).allianceClusters();

        assertEquals(1, clusters.size());
        assertEquals(List.of("a", "b"), clusters.get(0).members());
        assertEquals(ClusterStrength.STRONG, clusters.get(0).strength());
    }

    @Test
    void cluster_belowStrongThresholdIsModerate() {
        List<AllianceCluster> clusters = analyzer.analyze(List.of("b", "c")).allianceClusters();

        assertEquals(1, clusters.size());
        assertEquals(ClusterStrength.MODERATE, clusters.get(0).strength());
        assertEquals(0.75, clusters.get(0).averageTrust(), EPS);
    }

    @Test
    @DisplayName("Hotspots are the low-trust pairs, most strained first")
    void hotspots_sortedByTrust() {
        List<TensionHotspot> hotspots = analyzer.analyze(List.of("a", "b", "c", "d")).tensionHotspots();

        assertEquals(2, hotspots.size());
        assertEquals(List.of("c", "d"), hotspots.get(0).factions());
        assertEquals(TensionLevel.HIGH, hotspots.get(0).tensionLevel());
        assertEquals(0.7, hotspots.get(0).conflictRisk(), EPS);
        assertEquals(List.of("b", "d"), hotspots.get(1).factions());
        assertEquals(TensionLevel.MODERATE, hotspots.get(1).tensionLevel());
        assertEquals(0.3, hotspots.get(1).conflictRisk(), EPS);
    }

    @Test
    void influence_isRankedByAverageTrust() {
        NetworkAnalysis analysis = analyzer.analyze(List.of("d", "c", "b", "a"));

        assertEquals(List.of("a", "b", "c", "d"), new ArrayList<>(analysis.influenceRankings().keySet()));
        assertEquals((0.9 + 0.75 + 0.5) / 3, analysis.influenceRankings().get("a"), EPS);
        assertEquals((0.5 + 0.25 + 0.05) / 3, analysis.influenceRankings().get("d"), EPS);
    }

    @Test
    void stabilityAndConflictRisk() {
        NetworkAnalysis analysis = analyzer.analyze(List.of("a", "b", "c", "d"));

        double[] trust = {0.9, 0.75, 0.5, 0.75, 0.25, 0.05};
        double mean = 0.0;
        for (double t : trust) {
            mean += t / trust.length;
        }
        double variance = 0.0;
        for (double t : trust) {
            variance += (t - mean) * (t - mean) / trust.length;
        }
        assertEquals(mean * (1.0 - variance), analysis.networkStability(), EPS);
        assertEquals(2.0 / 6.0, analysis.conflictRisk(), EPS);
    }

    @Test
    @DisplayName("Unknown factions are analysed at neutral trust")
    void unknownFactions_areNeutral() {
        NetworkAnalysis analysis = analyzer.analyze(List.of("x", "y"));

        assertEquals(0.5, analysis.relationshipMatrix().get("x_y"), EPS);
        assertTrue(analysis.allianceClusters().isEmpty());
        assertTrue(analysis.tensionHotspots().isEmpty());
        assertEquals(0.5, analysis.networkStability(), EPS);
        assertEquals(0.0, analysis.conflictRisk(), EPS);
    }

    @Test
    void fewerThanTwoDistinctFactions_isRejected() {
        assertThrows(ValidationException.class, () -> analyzer.analyze(List.of("a", "a")));
        assertThrows(ValidationException.class, () -> analyzer.analyze(List.of()));
        assertThrows(ValidationException.class, () -> analyzer.analyze(null));
    }
}
