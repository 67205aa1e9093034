package com.wellbeingplatform.analysis.indicator;

import com.wellbeingplatform.common.model.SessionData;

import java.util.OptionalDouble;

/**
 * Pure helpers shared by the Algorithm Units.
 */
public final class ScoreMath {

    private ScoreMath() {}

    public static double clamp(double v) {
        if (Double.isNaN(v)) return 0.0;
        return Math.max(0.0, Math.min(1.0, v));
    }

    /** {@code numerator / denominator}, or 0 when the denominator is not positive. */
    public static double ratio(double numerator, double denominator) {
        return denominator > 0.0 ? numerator / denominator : 0.0;
    }

    public static double average(double... values) {
        if (values.length == 0) return 0.0;
        double sum = 0.0;
        for (double v : values) sum += v;
        return sum / values.length;
    }

    /**
     * Scales a unit's base confidence by how much of its expected evidence was present:
     * {@code base × (0.6 + 0.4 × present / expected)}.
     */
    public static double evidenceConfidence(double base, int present, int expected) {
        if (expected <= 0) return clamp(base);
        double coverage = Math.min(1.0, (double) present / expected);
        return clamp(base * (0.6 + 0.4 * coverage));
    }

    /** Counts how many of {@code metrics} the data carries. */
    public static int present(SessionData data, String... metrics) {
        int n = 0;
        for (String m : metrics) {
            if (data.hasMetric(m)) n++;
        }
        return n;
    }

    /** Latest explicit reading, then window/session mean, then empty. */
    public static OptionalDouble reading(SessionData data, String field) {
        OptionalDouble latest = data.latestReading(field);
        return latest.isPresent() ? latest : data.metric(field);
    }
}
