package com.wellbeingplatform.analysis.registry;

import com.wellbeingplatform.analysis.algorithm.AlgorithmUnit;
import com.wellbeingplatform.common.exception.WeightConfigurationException;
import com.wellbeingplatform.common.integration.WeightTable;
import com.wellbeingplatform.common.model.AlgorithmFamily;
import com.wellbeingplatform.common.model.AlgorithmResult;
import com.wellbeingplatform.common.model.SessionData;
import com.wellbeingplatform.common.model.UserProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered set of Algorithm Units for one family, with its weight table and real-time
 * priority subset.
 *
 * <p>Dispatch runs every selected unit in parallel on {@code boundedElastic} and keeps
 * results in declaration order. A unit that throws, times out (real-time passes only) or
 * returns nothing becomes a {@link UnitFailure}; other units are unaffected and the run
 * itself never errors.
 */
public class AlgorithmRegistry {

    private static final Logger log = LoggerFactory.getLogger(AlgorithmRegistry.class);

    private final AlgorithmFamily family;
    private final WeightTable weights;
    private final WeightTable realtimeWeights;
    private final List<AlgorithmUnit> units;
    private final List<AlgorithmUnit> realtimeUnits;
    private final Duration realtimeBudget;

    /**
     * @throws WeightConfigurationException if a weighted name has no unit, a unit has no
     *         weight or belongs to another family, or the real-time subset is empty
     */
    public AlgorithmRegistry(AlgorithmFamily family, Collection<? extends AlgorithmUnit> available,
                             WeightTable weights, Collection<String> realtimeSubset,
                             Duration realtimeBudget) {
        this.family         = family;
        this.weights        = weights;
        this.realtimeBudget = realtimeBudget;

        Map<String, AlgorithmUnit> byName = new LinkedHashMap<>();
        for (AlgorithmUnit unit : available) {
            if (unit.family() != family) {
                throw new WeightConfigurationException(
                    "Unit " + unit.algorithmName() + " belongs to " + unit.family() + ", not " + family);
            }
            if (!weights.contains(unit.algorithmName())) {
                throw new WeightConfigurationException(
                    "Unit " + unit.algorithmName() + " has no weight in table " + weights.label());
            }
            if (byName.put(unit.algorithmName(), unit) != null) {
                throw new WeightConfigurationException("Duplicate unit " + unit.algorithmName());
            }
        }

        List<AlgorithmUnit> ordered = new ArrayList<>();
        for (String name : weights.names()) {
            AlgorithmUnit unit = byName.get(name);
            if (unit == null) {
                throw new WeightConfigurationException(
                    "No unit registered for weight entry " + name + " in table " + weights.label());
            }
            ordered.add(unit);
        }
        this.units           = List.copyOf(ordered);
        this.realtimeWeights = weights.restrictTo(realtimeSubset);
        this.realtimeUnits   = ordered.stream()
            .filter(u -> realtimeWeights.contains(u.algorithmName()))
            .toList();

        log.info("[AlgorithmRegistry] family={} units={} realtime={} budgetMs={}",
            family, units.size(), realtimeUnits.size(), realtimeBudget.toMillis());
    }

    public AlgorithmFamily family() { return family; }

    public List<AlgorithmUnit> units() { return units; }

    public List<AlgorithmUnit> realtimeUnits() { return realtimeUnits; }

    /** Weight table for a full pass, or the renormalised priority subset for a real-time pass. */
    public WeightTable weights(boolean realtime) {
        return realtime ? realtimeWeights : weights;
    }

    public Mono<RegistryRun> dispatchAll(UserProfile profile, SessionData data, boolean realtime) {
        List<AlgorithmUnit> selected = realtime ? realtimeUnits : units;
        log.debug("[AlgorithmRegistry] Dispatching family={} units={} realtime={} session={}",
            family, selected.size(), realtime, data.sessionId());

        return Flux.fromIterable(selected)
            .flatMapSequential(unit -> invoke(unit, profile, data, realtime))
            .collectList()
            .map(this::toRun);
    }

    /** Blocking convenience around {@link #dispatchAll}. */
    public RegistryRun runAll(UserProfile profile, SessionData data, boolean realtime) {
        RegistryRun run = dispatchAll(profile, data, realtime).block();
        return run == null ? RegistryRun.empty(family) : run;
    }

    private Mono<Outcome> invoke(AlgorithmUnit unit, UserProfile profile, SessionData data, boolean realtime) {
        Mono<Outcome> call = Mono.fromCallable(() -> realtime
                ? unit.executeRealtime(profile, data)
                : unit.execute(profile, data))
            .map(Outcome::success)
            .switchIfEmpty(Mono.fromSupplier(() ->
                Outcome.failed(new UnitFailure(unit.algorithmName(), "returned no result"))))
            .subscribeOn(Schedulers.boundedElastic());
        if (realtime) {
            call = call.timeout(realtimeBudget);
        }
        return call.onErrorResume(e -> {
            log.warn("[AlgorithmRegistry] Unit={} failed family={} session={} error={}",
                unit.algorithmName(), family, data.sessionId(), e.toString());
            return Mono.just(Outcome.failed(new UnitFailure(unit.algorithmName(), describe(e))));
        });
    }

    private RegistryRun toRun(List<Outcome> outcomes) {
        List<AlgorithmResult> results = new ArrayList<>();
        List<UnitFailure> failures = new ArrayList<>();
        for (Outcome o : outcomes) {
            if (o.result() != null) results.add(o.result());
            else failures.add(o.failure());
        }
        return new RegistryRun(family, results, failures);
    }

    private static String describe(Throwable e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }

    private record Outcome(AlgorithmResult result, UnitFailure failure) {
        static Outcome success(AlgorithmResult result) { return new Outcome(result, null); }
        static Outcome failed(UnitFailure failure)      { return new Outcome(null, failure); }
    }
}
