package com.wellbeingplatform.analysis.algorithm.emotional;

import com.wellbeingplatform.analysis.algorithm.AlgorithmUnit;
import com.wellbeingplatform.common.model.AlgorithmFamily;
import com.wellbeingplatform.common.model.AlgorithmResult;
import com.wellbeingplatform.common.model.Insight;
import com.wellbeingplatform.common.model.Recommendation;
import com.wellbeingplatform.common.model.SessionData;
import com.wellbeingplatform.common.model.UserProfile;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.wellbeingplatform.analysis.collector.SessionMetrics.*;
import static com.wellbeingplatform.analysis.indicator.ScoreMath.*;

/**
 * Reads the palette the user chose. A varied palette scores well; a palette dominated by
 * dark tones lowers the score and raises an attention insight. Without any colour choices
 * the unit returns a neutral 0.5 at low confidence.
 */
@Component
public class ColorPsychologicalAnalysis implements AlgorithmUnit {

    public static final String NAME = "ColorPsychologicalAnalysis";

    private static final double DARK_DOMINANCE = 0.6;
    private static final double FULL_VARIETY   = 6.0;

    @Override
    public String algorithmName() { return NAME; }

    @Override
    public AlgorithmFamily family() { return AlgorithmFamily.EMOTIONAL; }

    @Override
    public AlgorithmResult execute(UserProfile profile, SessionData data) {
        double warm = data.metricOr(WARM_COLORS, 0.0);
        double cool = data.metricOr(COOL_COLORS, 0.0);
        double dark = data.metricOr(DARK_COLORS, 0.0);
        double total = warm + cool + dark;
        if (total <= 0.0) {
            return AlgorithmResult.of(NAME, AlgorithmFamily.EMOTIONAL, 0.5, 0.3,
                List.of(), List.of(), Map.of());
        }

        double variety   = clamp(data.metricOr(DISTINCT_COLORS, 1.0) / FULL_VARIETY);
        double darkShare = dark / total;
        double warmth    = ratio(warm, warm + cool);
        double score     = clamp(0.5 * variety + 0.5 * (1.0 - darkShare));
        double confidence = clamp(0.5 + 0.05 * Math.min(total, 8.0));

        List<Insight> insights = new ArrayList<>();
        List<Recommendation> recs = new ArrayList<>();
        if (darkShare > DARK_DOMINANCE) {
            insights.add(Insight.of("color", "Palette dominated by dark tones", confidence));
            recs.add(Recommendation.of("color", "mood_check_in", "Check in on the user's mood"));
        } else if (variety > 0.7) {
            insights.add(Insight.of("color", "Broad, expressive palette", confidence));
        }
        return AlgorithmResult.of(NAME, AlgorithmFamily.EMOTIONAL, score, confidence,
            insights, recs, Map.of("colorWarmth", warmth, "colorVariety", variety));
    }
}
