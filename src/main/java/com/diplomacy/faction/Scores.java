package com.diplomacy.faction;

import java.util.Collection;

/**
 * Numeric helpers shared by the scoring engines.
 */
public final class Scores {

    private Scores() {
    }

    public static double clamp01(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    public static double mean(Collection<Double> values) {
        if (values.isEmpty()) {
            return 0.0;
        }
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.size();
    }

    /** Population variance; zero for fewer than two values. */
    public static double variance(Collection<Double> values) {
        if (values.size() < 2) {
            return 0.0;
        }
        double mean = mean(values);
        double sum = 0.0;
        for (double v : values) {
            sum += (v - mean) * (v - mean);
        }
        return sum / values.size();
    }
}
