package com.diplomacy.network;

import com.diplomacy.config.DiplomacyProperties;
import com.diplomacy.error.ValidationException;
import com.diplomacy.faction.Scores;
import com.diplomacy.relationship.RelationshipForecast;
import com.diplomacy.trust.RelationshipStore;
import com.diplomacy.trust.TrustEvolution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Network-level picture over a set of factions, built from the current mean
 * trust of every pair. Pairs without a trust record count as neutral 0.5.
 *
 * Alliance clusters are pair seeds only: a faction already placed in a
 * cluster is not considered again, and overlapping high-trust pairs are not
 * merged into larger clusters.
 */
public class NetworkAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(NetworkAnalyzer.class);

    private static final double NEUTRAL = 0.5;

    private final DiplomacyProperties.Network config;
    private final RelationshipForecast forecast;
    private final RelationshipStore store;

    public NetworkAnalyzer(DiplomacyProperties.Network config, RelationshipForecast forecast, RelationshipStore store) {
        this.config = config;
        this.forecast = forecast;
        this.store = store;
    }

    /**
     * @throws ValidationException if fewer than two distinct factions are given
     */
    public NetworkAnalysis analyze(List<String> factionIds) {
        Set<String> distinct = new LinkedHashSet<>();
        if (factionIds != null) {
            factionIds.stream().filter(Objects::nonNull).forEach(distinct::add);
        }
        List<String> factions = List.copyOf(distinct);
        if (factions.size() < 2) {
            throw new ValidationException("network analysis needs at least 2 distinct factions, got " + factions.size());
        }

        List<Edge> edges = new ArrayList<>();
        for (int i = 0; i < factions.size(); i++) {
            for (int j = i + 1; j < factions.size(); j++) {
                String a = factions.get(i);
                String b = factions.get(j);
                double trust = store.getTrustEvolution(a, b)
                    .map(TrustEvolution::mutualTrust)
                    .orElse(NEUTRAL);
                edges.add(new Edge(a, b, trust));
            }
        }

        Map<String, Double> matrix = new LinkedHashMap<>();
        edges.forEach(e -> matrix.put(e.a() + "_" + e.b(), e.trust()));

        NetworkAnalysis analysis = new NetworkAnalysis(
            factions,
            Collections.unmodifiableMap(matrix),
            clusters(edges),
            hotspots(edges),
            influence(factions, edges),
            stability(edges),
            conflictRisk(edges));
        log.debug("Network of {} factions: stability={}, conflictRisk={}, clusters={}, hotspots={}",
            factions.size(), analysis.networkStability(), analysis.conflictRisk(),
            analysis.allianceClusters().size(), analysis.tensionHotspots().size());
        return analysis;
    }

    List<AllianceCluster> clusters(List<Edge> edges) {
        List<AllianceCluster> clusters = new ArrayList<>();
        Set<String> placed = new HashSet<>();
        for (Edge edge : edges) {
            if (edge.trust() < config.getHighTrustThreshold()) {
                continue;
            }
            if (placed.contains(edge.a()) || placed.contains(edge.b())) {
                continue;
            }
            ClusterStrength strength = edge.trust() > config.getStrongClusterThreshold()
                ? ClusterStrength.STRONG
                : ClusterStrength.MODERATE;
            clusters.add(new AllianceCluster(List.of(edge.a(), edge.b()), edge.trust(), strength));
            placed.add(edge.a());
            placed.add(edge.b());
        }
        return clusters;
    }

    List<TensionHotspot> hotspots(List<Edge> edges) {
        return edges.stream()
            .filter(e -> e.trust() <= config.getLowTrustThreshold())
            .sorted(Comparator.comparingDouble(Edge::trust))
            .map(e -> new TensionHotspot(
                List.of(e.a(), e.b()),
                e.trust(),
                e.trust() < config.getHighTensionThreshold() ? TensionLevel.HIGH : TensionLevel.MODERATE,
                forecast.conflictProbability(e.trust(), NEUTRAL, 0.0)))
            .toList();
    }

    Map<String, Double> influence(List<String> factions, List<Edge> edges) {
        Map<String, Double> scores = new LinkedHashMap<>();
        for (String faction : factions) {
            List<Double> trust = edges.stream()
                .filter(e -> e.a().equals(faction) || e.b().equals(faction))
                .map(Edge::trust)
                .toList();
            scores.put(faction, trust.isEmpty() ? NEUTRAL : Scores.mean(trust));
        }
        Map<String, Double> ranked = new LinkedHashMap<>();
        scores.entrySet().stream()
            .sorted(Map.Entry.<String, Double>comparingByValue().reversed())
            .forEach(e -> ranked.put(e.getKey(), e.getValue()));
        return Collections.unmodifiableMap(ranked);
    }

    static double stability(List<Edge> edges) {
        if (edges.isEmpty()) {
            return 1.0;
        }
        List<Double> trust = edges.stream().map(Edge::trust).toList();
        return Scores.clamp01(Scores.mean(trust) * (1.0 - Scores.variance(trust)));
    }

    double conflictRisk(List<Edge> edges) {
        if (edges.isEmpty()) {
            return 0.0;
        }
        long low = edges.stream().filter(e -> e.trust() < config.getLowTrustThreshold()).count();
        return (double) low / edges.size();
    }

    record Edge(String a, String b, double trust) {}
}
