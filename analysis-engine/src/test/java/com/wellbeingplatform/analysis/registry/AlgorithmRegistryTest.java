package com.wellbeingplatform.analysis.registry;

import com.wellbeingplatform.analysis.algorithm.AlgorithmUnit;
import com.wellbeingplatform.common.exception.WeightConfigurationException;
import com.wellbeingplatform.common.integration.WeightTable;
import com.wellbeingplatform.common.model.AlgorithmFamily;
import com.wellbeingplatform.common.model.AlgorithmResult;
import com.wellbeingplatform.common.model.SessionData;
import com.wellbeingplatform.common.model.UserProfile;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AlgorithmRegistryTest {

    private static final UserProfile PROFILE = UserProfile.of("user-1");
    private static final SessionData DATA = new SessionData("s-1", "user-1", "drawing", "easy",
        List.of(), null, Map.of());

    /** Test unit with a fixed score, an optional delay and an optional failure. */
    private record StubUnit(String algorithmName, AlgorithmFamily family, double score,
                            long delayMs, boolean fails) implements AlgorithmUnit {

        static StubUnit ok(String name, double score) {
            return new StubUnit(name, AlgorithmFamily.EMOTIONAL, score, 0, false);
        }

        @Override
        public AlgorithmResult execute(UserProfile profile, SessionData data) {
            if (delayMs > 0) {
                try {
                    Thread.sleep(delayMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            if (fails) throw new IllegalStateException(algorithmName + " exploded");
            return AlgorithmResult.of(algorithmName, family, score, 0.9, List.of(), List.of(), Map.of());
        }
    }

    private static WeightTable table(String... names) {
        Map<String, Double> w = new LinkedHashMap<>();
        for (String n : names) w.put(n, 1.0 / names.length);
        return WeightTable.of("emotional", w);
    }

    private static AlgorithmRegistry registry(List<AlgorithmUnit> units, WeightTable weights, List<String> realtime) {
        return new AlgorithmRegistry(AlgorithmFamily.EMOTIONAL, units, weights, realtime, Duration.ofMillis(100));
    }

    @Nested
    @DisplayName("construction")
    class Construction {

        @Test
        @DisplayName("units are ordered by the weight table, not by registration")
        void orderedByTable() {
            AlgorithmRegistry r = registry(List.of(StubUnit.ok("B", 0.5), StubUnit.ok("A", 0.5)),
                table("A", "B"), List.of("A"));

            assertEquals(List.of("A", "B"), r.units().stream().map(AlgorithmUnit::algorithmName).toList());
            assertEquals(List.of("A"), r.realtimeUnits().stream().map(AlgorithmUnit::algorithmName).toList());
            assertEquals(1.0, r.weights(true).weight("A"), 1e-9);
        }

        @Test
        @DisplayName("weighted name without a unit is rejected")
        void missingUnit() {
            assertThrows(WeightConfigurationException.class,
                () -> registry(List.of(StubUnit.ok("A", 0.5)), table("A", "B"), List.of("A")));
        }

        @Test
        @DisplayName("unit without a weight is rejected")
        void unweightedUnit() {
            assertThrows(WeightConfigurationException.class,
                () -> registry(List.of(StubUnit.ok("A", 0.5), StubUnit.ok("X", 0.5)), table("A"), List.of("A")));
        }

        @Test
        @DisplayName("unit of another family is rejected")
        void wrongFamily() {
            AlgorithmUnit neuro = new StubUnit("A", AlgorithmFamily.NEUROPLASTICITY, 0.5, 0, false);
            assertThrows(WeightConfigurationException.class,
                () -> registry(List.of(neuro), table("A"), List.of("A")));
        }
    }

    @Nested
    @DisplayName("dispatchAll()")
    class Dispatch {

        @Test
        @DisplayName("results keep declaration order even when earlier units are slower")
        void declarationOrder() {
            AlgorithmRegistry r = registry(List.of(
                    new StubUnit("A", AlgorithmFamily.EMOTIONAL, 0.1, 60, false),
                    StubUnit.ok("B", 0.2), StubUnit.ok("C", 0.3)),
                table("A", "B", "C"), List.of("A"));

            StepVerifier.create(r.dispatchAll(PROFILE, DATA, false))
                .assertNext(run -> {
                    assertEquals(List.of("A", "B", "C"),
                        run.results().stream().map(AlgorithmResult::algorithmName).toList());
                    assertFalse(run.hasFailures());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("a failing unit becomes a failure record; the rest still run")
        void failureIsolated() {
            AlgorithmRegistry r = registry(List.of(
                    StubUnit.ok("A", 0.4),
                    new StubUnit("B", AlgorithmFamily.EMOTIONAL, 0.0, 0, true),
                    StubUnit.ok("C", 0.6)),
                table("A", "B", "C"), List.of("A"));

            RegistryRun run = r.runAll(PROFILE, DATA, false);

            assertEquals(2, run.results().size());
            assertEquals(1, run.failures().size());
            assertEquals("B", run.failures().get(0).algorithmName());
            assertTrue(run.failures().get(0).reason().contains("exploded"));
        }

        @Test
        @DisplayName("real-time pass runs only the priority subset")
        void realtimeSubset() {
            AlgorithmRegistry r = registry(List.of(StubUnit.ok("A", 0.4), StubUnit.ok("B", 0.6)),
                table("A", "B"), List.of("B"));

            RegistryRun run = r.runAll(PROFILE, DATA, true);

            assertEquals(List.of("B"), run.results().stream().map(AlgorithmResult::algorithmName).toList());
        }

        @Test
        @DisplayName("real-time unit over budget is recorded as failed")
        void realtimeBudget() {
            AlgorithmRegistry r = registry(List.of(
                    new StubUnit("Slow", AlgorithmFamily.EMOTIONAL, 0.5, 1000, false),
                    StubUnit.ok("Fast", 0.5)),
                table("Slow", "Fast"), List.of("Slow", "Fast"));

            RegistryRun run = r.runAll(PROFILE, DATA, true);

            assertEquals(List.of("Fast"), run.results().stream().map(AlgorithmResult::algorithmName).toList());
            assertEquals("Slow", run.failures().get(0).algorithmName());
        }

        @Test
        @DisplayName("full pass is not bound by the real-time budget")
        void fullPassUnbounded() {
            AlgorithmRegistry r = registry(List.of(new StubUnit("Slow", AlgorithmFamily.EMOTIONAL, 0.5, 300, false)),
                table("Slow"), List.of("Slow"));

            assertEquals(1, r.runAll(PROFILE, DATA, false).results().size());
        }
    }
}
