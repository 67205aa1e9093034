package com.wellbeingplatform.orchestrator.aggregator;

import com.wellbeingplatform.analysis.collector.SessionDataAssembler;
import com.wellbeingplatform.common.collector.DataCollectorAdapter;
import com.wellbeingplatform.common.model.AlgorithmFamily;
import com.wellbeingplatform.common.model.AnalysisMode;
import com.wellbeingplatform.common.model.CollectorSummary;
import com.wellbeingplatform.common.model.IntegratedAnalysis;
import com.wellbeingplatform.common.model.InteractionEvent;
import com.wellbeingplatform.common.model.QueueItem;
import com.wellbeingplatform.common.model.QueuePriority;
import com.wellbeingplatform.common.model.Session;
import com.wellbeingplatform.common.model.SessionData;
import com.wellbeingplatform.common.model.TrendDirection;
import com.wellbeingplatform.common.store.AnalysisRecordStore;
import com.wellbeingplatform.orchestrator.config.OrchestratorSettings;
import com.wellbeingplatform.orchestrator.lifecycle.SessionState;
import com.wellbeingplatform.orchestrator.logger.AnalysisFlowLogger;
import com.wellbeingplatform.orchestrator.pipeline.DualFamilyAnalyzer;
import com.wellbeingplatform.orchestrator.pipeline.FamilyCollectors;
import com.wellbeingplatform.orchestrator.pipeline.QueueDecisionPolicy;
import com.wellbeingplatform.orchestrator.publisher.SnapshotPublisher;
import com.wellbeingplatform.orchestrator.queue.InterventionQueueManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fixed-cadence full pass over the events buffered since the previous tick.
 *
 * <pre>
 *   interval → drain window → full pass (both families) → history + trends → decide → store → publish
 * </pre>
 *
 * <p>The tick loop is a {@link Flux#interval} whose {@link Disposable} is held by
 * {@link SessionState} as the session's cancellation token. Ticks are serialised with
 * {@code concatMap}; a failed tick is logged and the loop continues. A tick that finds
 * the session no longer active disarms the loop and does nothing else, and a pass that
 * finishes after the session ended is discarded.
 */
@Component
public class PeriodicAggregator {

    private static final Logger log = LoggerFactory.getLogger(PeriodicAggregator.class);

    private final SessionState state;
    private final FamilyCollectors collectors;
    private final DualFamilyAnalyzer analyzer;
    private final QueueDecisionPolicy policy;
    private final InterventionQueueManager queues;
    private final AnalysisRecordStore recordStore;
    private final AnalysisFlowLogger flowLogger;
    private final SnapshotPublisher publisher;
    private final OrchestratorSettings settings;

    public PeriodicAggregator(SessionState state,
                              FamilyCollectors collectors,
                              DualFamilyAnalyzer analyzer,
                              QueueDecisionPolicy policy,
                              InterventionQueueManager queues,
                              AnalysisRecordStore recordStore,
                              AnalysisFlowLogger flowLogger,
                              SnapshotPublisher publisher,
                              OrchestratorSettings settings) {
        this.state       = state;
        this.collectors  = collectors;
        this.analyzer    = analyzer;
        this.policy      = policy;
        this.queues      = queues;
        this.recordStore = recordStore;
        this.flowLogger  = flowLogger;
        this.publisher   = publisher;
        this.settings    = settings;
    }

    /** Arms the tick loop for {@code session}, replacing any previous loop. */
    public void start(Session session) {
        Duration interval = Duration.ofMillis(settings.intervalFor(session.config().analysisIntervalMs()));
        String sessionId = session.id();

        Disposable token = Flux.interval(interval)
            .concatMap(n -> Mono.fromRunnable(() -> tick(sessionId))
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorResume(e -> {
                    log.error("[PeriodicAggregator] Tick failed, continuing. sessionId={}", sessionId, e);
                    return Mono.empty();
                }))
            .subscribe();
        state.armTicks(token);
        log.info("[PeriodicAggregator] Armed. sessionId={} intervalMs={}", sessionId, interval.toMillis());
    }

    public void stop() {
        state.disarmTicks();
    }

    /**
     * Runs one aggregation tick for {@code sessionId}.
     *
     * @return the appended analysis, or empty when the session is not active, nothing was
     *         buffered since the last tick, or the session ended during the pass
     */
    public Optional<IntegratedAnalysis> tick(String sessionId) {
        Optional<Session> active = state.activeSession().filter(s -> s.id().equals(sessionId));
        if (active.isEmpty()) {
            log.info("[PeriodicAggregator] Session no longer active, disarming. sessionId={}", sessionId);
            state.disarmTicks();
            return Optional.empty();
        }
        Session session = active.get();

        List<InteractionEvent> window = state.drainWindow(sessionId);
        if (window.isEmpty()) {
            log.debug("[PeriodicAggregator] Nothing buffered since last tick. sessionId={}", sessionId);
            return Optional.empty();
        }

        state.passStarted();
        IntegratedAnalysis analysis;
        try {
            analysis = analyzer.analyzeNow(sessionId, state.profile(), windows(session, window),
                AnalysisMode.PERIODIC, state.degradedFamilies());
        } finally {
            state.passFinished();
        }
        if (analysis == null) {
            return Optional.empty();
        }

        Optional<Map<String, TrendDirection>> trends = state.appendHistory(sessionId, analysis);
        if (trends.isEmpty()) {
            log.info("[PeriodicAggregator] Session ended during pass, tick discarded. sessionId={}", sessionId);
            return Optional.empty();
        }
        log.info("[PeriodicAggregator] Tick complete. sessionId={} events={} overall={} trends={}",
            sessionId, window.size(), String.format("%.3f", analysis.overallScore()), trends.get());

        for (QueueItem item : policy.decide(sessionId, analysis, QueuePriority.HIGH, QueuePriority.LOW)) {
            if (queues.enqueue(item)) {
                flowLogger.logQueued(item);
            }
        }
        try {
            recordStore.storeTick(session, analysis);
        } catch (RuntimeException e) {
            log.warn("[PeriodicAggregator] Failed to store tick. sessionId={} error={}", sessionId, e.getMessage());
        }
        publisher.publish();
        return Optional.of(analysis);
    }

    private Map<AlgorithmFamily, SessionData> windows(Session session, List<InteractionEvent> window) {
        Map<AlgorithmFamily, SessionData> data = new EnumMap<>(AlgorithmFamily.class);
        for (DataCollectorAdapter collector : collectors.all()) {
            CollectorSummary summary = null;
            try {
                summary = collector.currentSummary();
            } catch (RuntimeException e) {
                log.warn("[PeriodicAggregator] Collector summary unavailable. collector={} error={}",
                    collector.collectorName(), e.getMessage());
                state.markDegraded(collector.family());
            }
            data.put(collector.family(), SessionDataAssembler.forWindow(session, window, summary));
        }
        return data;
    }
}
