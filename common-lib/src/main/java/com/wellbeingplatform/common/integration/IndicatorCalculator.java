package com.wellbeingplatform.common.integration;

import com.wellbeingplatform.common.model.QueuePriority;
import com.wellbeingplatform.common.model.Recommendation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Risk and opportunity composites over named signal levels.
 *
 * <pre>
 *   risk        = weighted(frustrationLevel 0.4, anxietyLevel 0.3, cognitiveOverload 0.3)
 *   opportunity = weighted(engagementLevel 0.4, motivationLevel 0.3, improvementPotential 0.3)
 * </pre>
 * Each composite averages over whichever of its signals are present; with none present
 * it is 0. Raising any single input never lowers its composite.
 *
 * <p>Stateless; no Spring dependency.
 */
public final class IndicatorCalculator {

    public static final String FRUSTRATION           = "frustrationLevel";
    public static final String ANXIETY               = "anxietyLevel";
    public static final String COGNITIVE_OVERLOAD    = "cognitiveOverload";
    public static final String ENGAGEMENT            = "engagementLevel";
    public static final String MOTIVATION            = "motivationLevel";
    public static final String IMPROVEMENT_POTENTIAL = "improvementPotential";

    static final Map<String, Double> RISK_WEIGHTS        = ordered(FRUSTRATION, 0.4, ANXIETY, 0.3, COGNITIVE_OVERLOAD, 0.3);
    static final Map<String, Double> OPPORTUNITY_WEIGHTS = ordered(ENGAGEMENT, 0.4, MOTIVATION, 0.3, IMPROVEMENT_POTENTIAL, 0.3);

    private static final double LOW_RISK_CEILING       = 0.3;
    private static final double ENHANCEMENT_FLOOR      = 0.5;

    private IndicatorCalculator() {}

    public static double riskScore(Map<String, Double> signals) {
        return composite(signals, RISK_WEIGHTS);
    }

    public static double opportunityScore(Map<String, Double> signals) {
        return composite(signals, OPPORTUNITY_WEIGHTS);
    }

    /** Highest individual risk-contributing signal, or 0 when none is present. */
    public static double peakRiskSignal(Map<String, Double> signals) {
        double peak = 0.0;
        for (String name : RISK_WEIGHTS.keySet()) {
            Double v = signals.get(name);
            if (v != null && v > peak) peak = v;
        }
        return peak;
    }

    /** Name of the highest risk-contributing signal, or {@code "risk"} when none is present. */
    public static String peakRiskSignalName(Map<String, Double> signals) {
        String name = "risk";
        double peak = -1.0;
        for (String candidate : RISK_WEIGHTS.keySet()) {
            Double v = signals.get(candidate);
            if (v != null && v > peak) {
                peak = v;
                name = candidate;
            }
        }
        return name;
    }

    public static Set<String> riskSignals() {
        return RISK_WEIGHTS.keySet();
    }

    public static boolean isRiskSignal(String name) {
        return RISK_WEIGHTS.containsKey(name);
    }

    /**
     * Action recommendations for one real-time pass.
     */
    public static List<Recommendation> realtimeRecommendations(double risk, double opportunity,
                                                               double riskThreshold,
                                                               double opportunityThreshold) {
        List<Recommendation> recs = new ArrayList<>();
        if (risk > riskThreshold) {
            recs.add(Recommendation.of("intervention", "immediate_support",
                "Provide immediate support: high risk detected", QueuePriority.HIGH));
        }
        if (opportunity > opportunityThreshold) {
            recs.add(Recommendation.of("optimization", "increase_challenge",
                "Raise the challenge: strong growth opportunity", QueuePriority.MEDIUM));
        }
        if (risk < LOW_RISK_CEILING && opportunity > ENHANCEMENT_FLOOR) {
            recs.add(Recommendation.of("enhancement", "introduce_complexity",
                "Introduce more complexity gradually", QueuePriority.LOW));
        }
        return recs;
    }

    private static double composite(Map<String, Double> signals, Map<String, Double> weights) {
        if (signals == null || signals.isEmpty()) return 0.0;
        double weighted = 0.0;
        double factors  = 0.0;
        for (Map.Entry<String, Double> w : weights.entrySet()) {
            Double level = signals.get(w.getKey());
            if (level != null && Double.isFinite(level)) {
                weighted += level * w.getValue();
                factors  += w.getValue();
            }
        }
        return factors > 0.0 ? Math.max(0.0, Math.min(1.0, weighted / factors)) : 0.0;
    }

    private static Map<String, Double> ordered(String k1, double v1, String k2, double v2, String k3, double v3) {
        Map<String, Double> m = new LinkedHashMap<>();
        m.put(k1, v1);
        m.put(k2, v2);
        m.put(k3, v3);
        return m;
    }
}
