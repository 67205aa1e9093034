package com.wellbeingplatform.orchestrator.lifecycle;

import com.wellbeingplatform.analysis.collector.SessionDataAssembler;
import com.wellbeingplatform.common.collector.DataCollectorAdapter;
import com.wellbeingplatform.common.exception.InvalidStateException;
import com.wellbeingplatform.common.exception.NoActiveSessionException;
import com.wellbeingplatform.common.model.AlgorithmFamily;
import com.wellbeingplatform.common.model.AnalysisMode;
import com.wellbeingplatform.common.model.CollectorSummary;
import com.wellbeingplatform.common.model.IntegratedAnalysis;
import com.wellbeingplatform.common.model.LifecycleState;
import com.wellbeingplatform.common.model.Recommendation;
import com.wellbeingplatform.common.model.Session;
import com.wellbeingplatform.common.model.SessionConfig;
import com.wellbeingplatform.common.model.SessionData;
import com.wellbeingplatform.common.model.SessionOutcome;
import com.wellbeingplatform.common.model.SessionReport;
import com.wellbeingplatform.common.store.AnalysisRecordStore;
import com.wellbeingplatform.orchestrator.aggregator.PeriodicAggregator;
import com.wellbeingplatform.orchestrator.config.OrchestratorSettings;
import com.wellbeingplatform.orchestrator.logger.AnalysisFlowLogger;
import com.wellbeingplatform.orchestrator.pipeline.DualFamilyAnalyzer;
import com.wellbeingplatform.orchestrator.pipeline.FamilyCollectors;
import com.wellbeingplatform.orchestrator.pipeline.SessionOutcomeEvaluator;
import com.wellbeingplatform.orchestrator.publisher.SnapshotPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Session state machine: {@code IDLE → ACTIVE → COMPLETED}, and {@code COMPLETED → ACTIVE}
 * when the instance hosts a new session.
 *
 * <p>{@link #end()} stops the ticks, then closes real-time admission and waits for
 * admitted passes so their interventions are queued before the session completes. A
 * tick still running at that point discards its result. It then stops the collectors,
 * runs the final full pass over their terminal summaries and builds the report.
 * Transitions are serialised on this instance.
 */
@Component
public class SessionLifecycleManager {

    private static final Logger log = LoggerFactory.getLogger(SessionLifecycleManager.class);

    static final String NO_EVENTS = "Session ended without any collected events";

    private final SessionState state;
    private final FamilyCollectors collectors;
    private final PeriodicAggregator aggregator;
    private final DualFamilyAnalyzer analyzer;
    private final SessionOutcomeEvaluator outcomeEvaluator;
    private final AnalysisRecordStore recordStore;
    private final AnalysisFlowLogger flowLogger;
    private final SnapshotPublisher publisher;
    private final OrchestratorSettings settings;

    public SessionLifecycleManager(SessionState state,
                                   FamilyCollectors collectors,
                                   PeriodicAggregator aggregator,
                                   DualFamilyAnalyzer analyzer,
                                   SessionOutcomeEvaluator outcomeEvaluator,
                                   AnalysisRecordStore recordStore,
                                   AnalysisFlowLogger flowLogger,
                                   SnapshotPublisher publisher,
                                   OrchestratorSettings settings) {
        this.state            = state;
        this.collectors       = collectors;
        this.aggregator       = aggregator;
        this.analyzer         = analyzer;
        this.outcomeEvaluator = outcomeEvaluator;
        this.recordStore      = recordStore;
        this.flowLogger       = flowLogger;
        this.publisher        = publisher;
        this.settings         = settings;
    }

    public synchronized Session start(SessionConfig config) {
        LifecycleState current = state.lifecycle();
        if (current == LifecycleState.ACTIVE) {
            throw new InvalidStateException(current, "A session is already active");
        }
        if (!state.isInitialized()) {
            throw new InvalidStateException(current, "Orchestrator not initialized with a user profile");
        }
        if (config == null) {
            throw new IllegalArgumentException("Session config is required");
        }

        Session session = Session.start(UUID.randomUUID().toString(), config, Instant.now());
        state.begin(session);

        for (DataCollectorAdapter collector : collectors.all()) {
            try {
                collector.startCollection(session.id(), session.userId());
            } catch (RuntimeException e) {
                log.warn("[SessionLifecycle] Collector failed to start, family degraded. collector={} error={}",
                    collector.collectorName(), e.getMessage());
                state.markDegraded(collector.family());
            }
        }
        aggregator.start(session);

        flowLogger.logWithSessionId(AnalysisFlowLogger.SESSION_STARTED, session.id());
        log.info("[SessionLifecycle] Session started. sessionId={} userId={} activity={} realtime={}",
            session.id(), session.userId(), config.activityType(), config.realtimeEnabled());
        publisher.publish();
        return session;
    }

    public synchronized SessionReport end() {
        Session active = state.activeSession()
            .orElseThrow(() -> new NoActiveSessionException("No active session to end"));

        aggregator.stop();
        if (!state.drainRealtime(settings.realtimeDrainTimeout())) {
            log.warn("[SessionLifecycle] Real-time pass still running at end, it will commit late. sessionId={} waitedMs={}",
                active.id(), settings.realtimeDrainTimeout().toMillis());
        }
        Session completed = active.complete(Instant.now());
        state.complete(completed);

        Map<AlgorithmFamily, CollectorSummary> summaries = stopCollectors(completed);
        IntegratedAnalysis finalAnalysis = finalPass(completed, summaries);

        SessionOutcome outcome = outcomeEvaluator.evaluate(finalAnalysis);
        List<Recommendation> recommendations = outcomeEvaluator.merge(outcome, finalAnalysis);
        SessionReport report = new SessionReport(completed, finalAnalysis, state.history(),
            recommendations, outcome, state.trends(), summaries);

        try {
            recordStore.storeReport(report);
        } catch (RuntimeException e) {
            log.warn("[SessionLifecycle] Failed to store session report. sessionId={} error={}",
                completed.id(), e.getMessage());
        }

        flowLogger.logWithSessionId(AnalysisFlowLogger.SESSION_ENDED, completed.id());
        log.info("[SessionLifecycle] Session ended. sessionId={} ticks={} wellbeing={} effectiveness={}",
            completed.id(), report.history().size(),
            String.format("%.3f", outcome.overallWellbeing()),
            String.format("%.3f", outcome.learningEffectiveness()));
        publisher.publish();
        return report;
    }

    private Map<AlgorithmFamily, CollectorSummary> stopCollectors(Session session) {
        Map<AlgorithmFamily, CollectorSummary> summaries = new EnumMap<>(AlgorithmFamily.class);
        for (DataCollectorAdapter collector : collectors.all()) {
            try {
                summaries.put(collector.family(), collector.stopCollection());
            } catch (RuntimeException e) {
                log.warn("[SessionLifecycle] Collector failed to stop, using empty summary. collector={} error={}",
                    collector.collectorName(), e.getMessage());
                state.markDegraded(collector.family());
                summaries.put(collector.family(),
                    CollectorSummary.empty(collector.collectorName(), collector.family(), session.id()));
            }
        }
        return summaries;
    }

    private IntegratedAnalysis finalPass(Session session, Map<AlgorithmFamily, CollectorSummary> summaries) {
        Map<AlgorithmFamily, SessionData> data = new EnumMap<>(AlgorithmFamily.class);
        summaries.forEach((family, summary) -> {
            if (summary.totalEvents() > 0) {
                data.put(family, SessionDataAssembler.forSummary(session, summary));
            }
        });
        if (data.isEmpty()) {
            log.info("[SessionLifecycle] No events collected, final pass skipped. sessionId={}", session.id());
            IntegratedAnalysis empty = IntegratedAnalysis.noData(AnalysisMode.FINAL, NO_EVENTS);
            flowLogger.logWithSessionId(AnalysisFlowLogger.FINAL_PASS_COMPLETED, session.id());
            return empty;
        }
        return analyzer.analyzeNow(session.id(), state.profile(), data, AnalysisMode.FINAL, state.degradedFamilies());
    }
}
