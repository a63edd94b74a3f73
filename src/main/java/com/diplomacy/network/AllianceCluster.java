package com.diplomacy.network;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record AllianceCluster(
    @JsonProperty("members") List<String> members,
    @JsonProperty("average_trust") double averageTrust,
    @JsonProperty("cluster_strength") ClusterStrength strength
) {
    public AllianceCluster {
        members = List.copyOf(members);
    }
}
