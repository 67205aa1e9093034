package com.wellbeingplatform.common.trend;

import com.wellbeingplatform.common.integration.IndicatorCalculator;
import com.wellbeingplatform.common.model.AlgorithmFamily;
import com.wellbeingplatform.common.model.IntegratedAnalysis;
import com.wellbeingplatform.common.model.TrendDirection;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Pure trend interpreter over an analysis history.
 *
 * <h3>Classification</h3>
 * Split the series (oldest first) into an older half {@code [0, n/2)} and a recent half
 * {@code [n/2, n)} and compare their means:
 * <pre>
 *   recent − older >  tolerance → IMPROVING
 *   recent − older < −tolerance → DECLINING
 *   otherwise                   → STABLE
 * </pre>
 * Fewer than {@value #MIN_WINDOW} points is always STABLE.
 *
 * <p>Classifications are wellbeing-oriented: for risk-type series ({@code risk} and the
 * risk signals) a rising value means DECLINING.
 *
 * <p>No Spring dependencies. No I/O.
 */
public final class TrendClassifier {

    public static final String OVERALL     = "overall";
    public static final String RISK        = "risk";
    public static final String OPPORTUNITY = "opportunity";

    /** Minimum number of points required for a non-STABLE classification. */
    private static final int MIN_WINDOW = 2;

    private TrendClassifier() { /* utility class */ }

    /**
     * @param series    values ordered oldest first
     * @param tolerance dead band around zero difference
     */
    public static TrendDirection classify(List<Double> series, double tolerance) {
        if (series == null || series.size() < MIN_WINDOW) {
            return TrendDirection.STABLE;
        }
        int half = series.size() / 2;
        double older  = mean(series.subList(0, half));
        double recent = mean(series.subList(half, series.size()));
        double delta  = recent - older;
        if (delta > tolerance)  return TrendDirection.IMPROVING;
        if (delta < -tolerance) return TrendDirection.DECLINING;
        return TrendDirection.STABLE;
    }

    /**
     * Classifies every tracked series of the history: overall, risk, opportunity, each
     * family score and each signal seen at least once.
     *
     * @param history analyses ordered oldest first
     */
    public static Map<String, TrendDirection> classifyHistory(List<IntegratedAnalysis> history,
                                                              double tolerance) {
        Map<String, TrendDirection> trends = new LinkedHashMap<>();
        if (history == null || history.isEmpty()) {
            return trends;
        }
        trends.put(OVERALL, classify(present(history, IntegratedAnalysis::overallScore), tolerance));
        trends.put(RISK, invert(classify(present(history, IntegratedAnalysis::riskScore), tolerance)));
        trends.put(OPPORTUNITY, classify(present(history, IntegratedAnalysis::opportunityScore), tolerance));

        for (AlgorithmFamily family : AlgorithmFamily.values()) {
            List<Double> familySeries = present(history, a -> a.familyScores().get(family));
            if (!familySeries.isEmpty()) {
                trends.put(family.name().toLowerCase(Locale.ROOT), classify(familySeries, tolerance));
            }
        }

        Set<String> signalNames = new LinkedHashSet<>();
        history.forEach(a -> signalNames.addAll(a.signals().keySet()));
        for (String signal : signalNames) {
            TrendDirection raw = classify(present(history, a -> a.signals().get(signal)), tolerance);
            trends.put(signal, IndicatorCalculator.isRiskSignal(signal) ? invert(raw) : raw);
        }
        return trends;
    }

    static TrendDirection invert(TrendDirection direction) {
        return switch (direction) {
            case IMPROVING -> TrendDirection.DECLINING;
            case DECLINING -> TrendDirection.IMPROVING;
            case STABLE    -> TrendDirection.STABLE;
        };
    }

    private static List<Double> present(List<IntegratedAnalysis> history,
                                        Function<IntegratedAnalysis, Double> extractor) {
        List<Double> values = new ArrayList<>();
        for (IntegratedAnalysis a : history) {
            Double v = extractor.apply(a);
            if (v != null && Double.isFinite(v)) values.add(v);
        }
        return values;
    }

    private static double mean(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }
}
