package com.wellbeingplatform.orchestrator.realtime;

import com.wellbeingplatform.analysis.collector.SessionDataAssembler;
import com.wellbeingplatform.common.collector.DataCollectorAdapter;
import com.wellbeingplatform.common.model.AlgorithmFamily;
import com.wellbeingplatform.common.model.AnalysisMode;
import com.wellbeingplatform.common.model.IntegratedAnalysis;
import com.wellbeingplatform.common.model.InteractionEvent;
import com.wellbeingplatform.common.model.QueueItem;
import com.wellbeingplatform.common.model.QueuePriority;
import com.wellbeingplatform.common.model.Session;
import com.wellbeingplatform.common.model.SessionData;
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

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Event-driven path. Each event is offered to every collector and appended to the
 * periodic window; when the session has real-time analysis enabled, the priority
 * subset of both families runs over the collectors' rolling buffers and the result is
 * checked against the queue thresholds.
 *
 * <pre>
 *   collect → buffer → subset pass → realtime recommendations → decide → enqueue → publish
 * </pre>
 *
 * <p>A pass admitted while the session is active always commits its interventions,
 * even if {@code end()} runs meanwhile; {@code end()} waits for it.
 *
 * <p>Never waits on the periodic pass: the shared window is touched only through
 * {@link SessionState}'s short critical sections, and each unit runs under the
 * registry's real-time budget.
 */
@Component
public class RealtimeEventProcessor {

    private static final Logger log = LoggerFactory.getLogger(RealtimeEventProcessor.class);

    private final SessionState state;
    private final FamilyCollectors collectors;
    private final DualFamilyAnalyzer analyzer;
    private final QueueDecisionPolicy policy;
    private final InterventionQueueManager queues;
    private final AnalysisFlowLogger flowLogger;
    private final SnapshotPublisher publisher;
    private final OrchestratorSettings settings;

    public RealtimeEventProcessor(SessionState state,
                                  FamilyCollectors collectors,
                                  DualFamilyAnalyzer analyzer,
                                  QueueDecisionPolicy policy,
                                  InterventionQueueManager queues,
                                  AnalysisFlowLogger flowLogger,
                                  SnapshotPublisher publisher,
                                  OrchestratorSettings settings) {
        this.state      = state;
        this.collectors = collectors;
        this.analyzer   = analyzer;
        this.policy     = policy;
        this.queues     = queues;
        this.flowLogger = flowLogger;
        this.publisher  = publisher;
        this.settings   = settings;
    }

    /**
     * @return the real-time analysis, or {@code null} when no session is active, the
     *         session is being ended or has real-time analysis disabled
     */
    public IntegratedAnalysis process(InteractionEvent event) {
        Optional<Session> active = state.activeSession();
        if (active.isEmpty()) {
            log.debug("[RealtimeEventProcessor] No active session, event ignored. type={}",
                event == null ? null : event.type());
            return null;
        }
        if (event == null) {
            return null;
        }
        Session session = active.get();
        flowLogger.logWithSessionId(AnalysisFlowLogger.EVENT_RECEIVED, session.id());

        for (DataCollectorAdapter collector : collectors.all()) {
            try {
                collector.collect(event);
            } catch (RuntimeException e) {
                log.warn("[RealtimeEventProcessor] Collector failed, family degraded. collector={} error={}",
                    collector.collectorName(), e.getMessage());
                state.markDegraded(collector.family());
            }
        }
        if (!state.bufferEvent(session.id(), event)) {
            return null;
        }
        if (!session.config().realtimeEnabled()) {
            return null;
        }

        if (!state.realtimePassStarted(session.id())) {
            log.debug("[RealtimeEventProcessor] Session ending, real-time pass skipped. sessionId={}", session.id());
            return null;
        }
        try {
            return runPass(session);
        } finally {
            state.realtimePassFinished();
        }
    }

    private IntegratedAnalysis runPass(Session session) {
        long startNanos = System.nanoTime();
        IntegratedAnalysis analysis = analyzer.analyzeNow(session.id(), state.profile(), windows(session),
            AnalysisMode.REALTIME, state.degradedFamilies());
        long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000;
        if (elapsedMs > settings.realtimeBudgetMs()) {
            log.warn("[RealtimeEventProcessor] Pass over budget. sessionId={} elapsedMs={} budgetMs={}",
                session.id(), elapsedMs, settings.realtimeBudgetMs());
        }
        if (analysis == null) {
            return null;
        }
        analysis = analysis.withRecommendations(policy.realtimeRecommendations(analysis));

        if (!state.recordRealtime(session.id(), analysis)) {
            log.info("[RealtimeEventProcessor] Another session started during pass, result discarded. sessionId={}",
                session.id());
            return null;
        }
        for (QueueItem item : policy.decide(session.id(), analysis, QueuePriority.IMMEDIATE, QueuePriority.MEDIUM)) {
            if (queues.enqueue(item)) {
                flowLogger.logQueued(item);
            }
        }
        publisher.publish();
        return analysis;
    }

    private Map<AlgorithmFamily, SessionData> windows(Session session) {
        Map<AlgorithmFamily, SessionData> data = new EnumMap<>(AlgorithmFamily.class);
        for (DataCollectorAdapter collector : collectors.all()) {
            try {
                data.put(collector.family(), SessionDataAssembler.forWindow(session, collector.recentEvents(), null));
            } catch (RuntimeException e) {
                log.warn("[RealtimeEventProcessor] Collector buffer unavailable. collector={} error={}",
                    collector.collectorName(), e.getMessage());
                state.markDegraded(collector.family());
            }
        }
        return data;
    }
}
