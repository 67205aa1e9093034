package com.wellbeingplatform.analysis.algorithm.emotional;

import com.wellbeingplatform.common.model.AlgorithmResult;
import com.wellbeingplatform.common.model.SessionData;
import com.wellbeingplatform.common.model.UserProfile;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ColorPsychologicalAnalysisTest {

    private final ColorPsychologicalAnalysis unit = new ColorPsychologicalAnalysis();

    private AlgorithmResult run(Map<String, Double> metrics) {
        return unit.execute(UserProfile.of("u"), new SessionData("s", "u", "drawing", "easy", List.of(), null, metrics));
    }

    @Test
    @DisplayName("no colour choices → neutral score at low confidence")
    void noColours() {
        AlgorithmResult r = run(Map.of());
        assertEquals(0.5, r.score());
        assertEquals(0.3, r.confidence());
    }

    @Test
    @DisplayName("dark-dominated palette raises a mood check-in")
    void darkPalette() {
        AlgorithmResult r = run(Map.of("darkColors", 8.0, "warmColors", 1.0, "distinctColors", 2.0));
        assertEquals("mood_check_in", r.recommendations().get(0).action());
        assertTrue(r.score() < 0.3);
    }

    @Test
    @DisplayName("varied bright palette scores above a dark one")
    void variedPalette() {
        double bright = run(Map.of("warmColors", 4.0, "coolColors", 4.0, "distinctColors", 6.0)).score();
        double dark   = run(Map.of("darkColors", 8.0, "distinctColors", 1.0)).score();
        assertTrue(bright > dark);
    }
}
