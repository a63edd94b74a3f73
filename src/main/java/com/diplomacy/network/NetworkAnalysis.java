package com.diplomacy.network;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * @param relationshipMatrix mean trust per pair, keyed {@code "<idA>_<idB>"} in input order
 * @param influenceRankings  average trust across each faction's pairs, highest first
 */
public record NetworkAnalysis(
    @JsonProperty("analyzed_factions") List<String> analyzedFactions,
    @JsonProperty("relationship_matrix") Map<String, Double> relationshipMatrix,
    @JsonProperty("alliance_clusters") List<AllianceCluster> allianceClusters,
    @JsonProperty("tension_hotspots") List<TensionHotspot> tensionHotspots,
    @JsonProperty("influence_rankings") Map<String, Double> influenceRankings,
    @JsonProperty("network_stability") double networkStability,
    @JsonProperty("conflict_risk") double conflictRisk
) {}
