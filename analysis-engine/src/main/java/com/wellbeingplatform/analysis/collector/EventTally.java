package com.wellbeingplatform.analysis.collector;

import com.wellbeingplatform.analysis.collector.EventClassifier.ColorTone;
import com.wellbeingplatform.common.model.InteractionEvent;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;

import static com.wellbeingplatform.analysis.collector.SessionMetrics.*;

/**
 * Running statistics over a stream of events: counts by classification, per-field means
 * of numeric fields, colour tones and the performance series. Not thread-safe; owners
 * guard it.
 */
public final class EventTally {

    private static final double IMPROVEMENT_STEP = 1.1;

    private long total;
    private long errors;
    private long helpRequests;
    private long retries;
    private long clickBursts;
    private long hesitations;
    private long backtracks;
    private long improvements;
    private Instant first;
    private Instant last;
    private InteractionEvent previous;

    private final Map<ColorTone, Long> tones = new EnumMap<>(ColorTone.class);
    private final Set<String> colors = new HashSet<>();
    private final Set<String> types  = new HashSet<>();
    private final Map<String, double[]> fieldSums = new LinkedHashMap<>();
    private final List<Double> performance = new ArrayList<>();

    public static EventTally over(List<InteractionEvent> events) {
        EventTally tally = new EventTally();
        events.forEach(tally::accept);
        return tally;
    }

    public void accept(InteractionEvent e) {
        total++;
        if (first == null || e.timestamp().isBefore(first)) first = e.timestamp();
        if (last == null || e.timestamp().isAfter(last))    last = e.timestamp();
        if (e.type() != null) types.add(e.type());

        if (EventClassifier.isError(e))        errors++;
        if (EventClassifier.isHelpRequest(e))  helpRequests++;
        if (EventClassifier.isRetry(e))        retries++;
        if (EventClassifier.isHesitation(e))   hesitations++;
        if (EventClassifier.isBacktrack(e))    backtracks++;
        if (EventClassifier.isBurst(previous, e)) clickBursts++;

        ColorTone tone = EventClassifier.colorTone(e);
        if (tone != null) {
            tones.merge(tone, 1L, Long::sum);
            colors.add(e.text(COLOR).trim().toLowerCase());
        }

        e.fields().forEach((field, value) -> {
            if (value instanceof Number n && Double.isFinite(n.doubleValue())) {
                double[] acc = fieldSums.computeIfAbsent(field, k -> new double[2]);
                acc[0] += n.doubleValue();
                acc[1] += 1;
            }
        });

        OptionalDouble perf = e.number(PERFORMANCE);
        if (perf.isPresent()) {
            double p = perf.getAsDouble();
            if (!performance.isEmpty() && p > performance.get(performance.size() - 1) * IMPROVEMENT_STEP) {
                improvements++;
            }
            performance.add(p);
        }
        previous = e;
    }

    public long total()  { return total; }
    public long errors() { return errors; }

    public long durationMs() {
        return first == null ? 0L : last.toEpochMilli() - first.toEpochMilli();
    }

    public double avgIntervalMs() {
        return total < 2 ? 0.0 : (double) durationMs() / (total - 1);
    }

    public Map<String, Double> fieldMeans() {
        Map<String, Double> means = new LinkedHashMap<>();
        fieldSums.forEach((field, acc) -> means.put(field, acc[0] / acc[1]));
        return means;
    }

    /** Mean of the later half of the performance series minus the mean of the earlier half. */
    public OptionalDouble performanceTrend() {
        int n = performance.size();
        if (n < 2) return OptionalDouble.empty();
        int mid = n / 2;
        double older = performance.subList(0, mid).stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double recent = performance.subList(mid, n).stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        return OptionalDouble.of(recent - older);
    }

    public Map<String, Long> counts() {
        Map<String, Long> counts = new LinkedHashMap<>();
        counts.put(HELP_REQUESTS, helpRequests);
        counts.put(RETRY_ATTEMPTS, retries);
        counts.put(CLICK_BURSTS, clickBursts);
        counts.put(HESITATIONS, hesitations);
        counts.put(BACKTRACKS, backtracks);
        counts.put(IMPROVEMENTS, improvements);
        counts.put(WARM_COLORS, tones.getOrDefault(ColorTone.WARM, 0L));
        counts.put(COOL_COLORS, tones.getOrDefault(ColorTone.COOL, 0L));
        counts.put(DARK_COLORS, tones.getOrDefault(ColorTone.DARK, 0L));
        counts.put(DISTINCT_COLORS, (long) colors.size());
        counts.put(DISTINCT_EVENT_TYPES, (long) types.size());
        return counts;
    }

    /**
     * Field means plus every count, event totals, error rate, time spent and, when at
     * least two performance readings exist, the performance trend.
     */
    public Map<String, Double> metrics() {
        Map<String, Double> metrics = new LinkedHashMap<>(fieldMeans());
        counts().forEach((name, count) -> metrics.put(name, count.doubleValue()));
        metrics.put(EVENT_COUNT, (double) total);
        metrics.put(ERROR_COUNT, (double) errors);
        metrics.put(ERROR_RATE, total == 0 ? 0.0 : (double) errors / total);
        metrics.put(TIME_SPENT_MS, (double) durationMs());
        if (durationMs() > 0) {
            metrics.put(EVENTS_PER_SECOND, total / (durationMs() / 1000.0));
        }
        performanceTrend().ifPresent(t -> metrics.put(PERFORMANCE_TREND, t));
        return metrics;
    }
}
