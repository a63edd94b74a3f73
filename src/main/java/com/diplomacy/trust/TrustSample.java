package com.diplomacy.trust;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record TrustSample(
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("a_trusts_b") double aTrustsB,
    @JsonProperty("b_trusts_a") double bTrustsA
) {
    public double mean() {
        return (aTrustsB + bTrustsA) / 2.0;
    }

    public double max() {
        return Math.max(aTrustsB, bTrustsA);
    }
}
