package com.diplomacy.trust;

import com.diplomacy.faction.Scores;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Bidirectional trust between the two factions of {@link #pair()}.
 * {@code aTrustsB} is the trust {@code pair.first()} places in {@code pair.second()}.
 *
 * Instances are immutable; {@link #apply} returns the next state.
 */
public record TrustEvolution(
    @JsonProperty("pair") PairKey pair,
    @JsonProperty("a_trusts_b") double aTrustsB,
    @JsonProperty("b_trusts_a") double bTrustsA,
    @JsonProperty("trust_history") List<TrustSample> history,
    @JsonProperty("trust_volatility") double volatility,
    @JsonProperty("peak_trust") double peakTrust,
    @JsonProperty("lowest_trust") double lowestTrust,
    @JsonProperty("baseline_compatibility") double baselineCompatibility
) {
    public TrustEvolution {
        history = List.copyOf(history);
    }

    /** Fresh relationship: both directions at {@code initialTrust}, one sample. */
    public static TrustEvolution seeded(PairKey pair, double initialTrust, double baselineCompatibility, Instant at) {
        return new TrustEvolution(pair, initialTrust, initialTrust,
            List.of(new TrustSample(at, initialTrust, initialTrust)),
            0.0, initialTrust, initialTrust, baselineCompatibility);
    }

    @JsonProperty("mutual_trust")
    public double mutualTrust() {
        return (aTrustsB + bTrustsA) / 2.0;
    }

    /** Trust {@code truster} places in the other member of the pair. */
    public double trustFrom(String truster) {
        if (pair.first().equals(truster)) {
            return aTrustsB;
        }
        if (pair.second().equals(truster)) {
            return bTrustsA;
        }
        throw new IllegalArgumentException(truster + " is not part of " + pair);
    }

    /**
     * Moves the directional trust values to the given ones (clamped), appends a
     * sample, widens peak/low and recomputes volatility over the last
     * {@code volatilityWindow} samples once that many exist.
     */
    public TrustEvolution apply(double newATrustsB, double newBTrustsA, Instant at, int volatilityWindow) {
        double a = Scores.clamp01(newATrustsB);
        double b = Scores.clamp01(newBTrustsA);

        List<TrustSample> samples = new ArrayList<>(history);
        samples.add(new TrustSample(at, a, b));

        double nextVolatility = volatility;
        if (samples.size() >= volatilityWindow) {
            List<Double> recent = samples.subList(samples.size() - volatilityWindow, samples.size()).stream()
                .map(TrustSample::max)
                .toList();
            nextVolatility = Scores.variance(recent);
        }

        return new TrustEvolution(pair, a, b, samples, nextVolatility,
            Math.max(peakTrust, Math.max(a, b)),
            Math.min(lowestTrust, Math.min(a, b)),
            baselineCompatibility);
    }
}
