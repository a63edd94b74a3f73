package com.diplomacy.api;

import com.diplomacy.network.NetworkAnalysis;
import com.diplomacy.network.NetworkAnalyzer;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * POST /v1/network/analysis
 */
@RestController
@RequestMapping("/v1/network")
public class NetworkController {

    private final NetworkAnalyzer networkAnalyzer;

    public NetworkController(NetworkAnalyzer networkAnalyzer) {
        this.networkAnalyzer = networkAnalyzer;
    }

    public record NetworkRequest(@JsonProperty("faction_ids") List<String> factionIds) {}

    @PostMapping("/analysis")
    public NetworkAnalysis analyze(@RequestBody NetworkRequest request) {
        return networkAnalyzer.analyze(request.factionIds());
    }
}
