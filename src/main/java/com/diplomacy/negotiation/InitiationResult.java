package com.diplomacy.negotiation;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record InitiationResult(
    @JsonProperty("session") SessionSnapshot session,
    @JsonProperty("initial_responses") List<FactionResponse> initialResponses
) {}
