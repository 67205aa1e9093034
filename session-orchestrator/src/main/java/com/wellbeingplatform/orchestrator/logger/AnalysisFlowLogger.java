package com.wellbeingplatform.orchestrator.logger;

import com.wellbeingplatform.common.model.IntegratedAnalysis;
import com.wellbeingplatform.common.model.QueueItem;
import com.wellbeingplatform.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Logs each stage of a session's analysis lifecycle. Pure side effects; no state.
 *
 * <p>Stages:
 * <ol>
 *   <li>{@link #SESSION_STARTED}</li>
 *   <li>{@link #EVENT_RECEIVED}, {@link #REALTIME_ANALYZED}</li>
 *   <li>{@link #INTERVENTION_QUEUED}, {@link #OPTIMIZATION_QUEUED}</li>
 *   <li>{@link #TICK_AGGREGATED}</li>
 *   <li>{@link #FINAL_PASS_COMPLETED}, {@link #SESSION_ENDED}</li>
 * </ol>
 *
 * <p>Inside a reactive pipeline the session id comes from the Reactor Context:
 * <pre>
 *     .doOnEach(flowLogger.stage(AnalysisFlowLogger.REALTIME_ANALYZED))
 * </pre>
 */
@Component
public class AnalysisFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(AnalysisFlowLogger.class);

    public static final String SESSION_STARTED      = "SESSION_STARTED";
    public static final String EVENT_RECEIVED       = "EVENT_RECEIVED";
    public static final String REALTIME_ANALYZED    = "REALTIME_ANALYZED";
    public static final String INTERVENTION_QUEUED  = "INTERVENTION_QUEUED";
    public static final String OPTIMIZATION_QUEUED  = "OPTIMIZATION_QUEUED";
    public static final String TICK_AGGREGATED      = "TICK_AGGREGATED";
    public static final String FINAL_PASS_COMPLETED = "FINAL_PASS_COMPLETED";
    public static final String SESSION_ENDED        = "SESSION_ENDED";

    /**
     * {@code doOnEach} consumer logging {@code stageName} with the analysis scores.
     * Fires on {@code onNext} only.
     */
    public Consumer<Signal<IntegratedAnalysis>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String sessionId = TraceContextUtil.getSessionId(signal.getContextView());
            IntegratedAnalysis a = signal.get();
            TraceContextUtil.withMdc(sessionId, () ->
                log.info("[AnalysisFlow] stage={} sessionId={} overall={} confidence={} risk={} opportunity={} degraded={}",
                    stageName, sessionId, fmt(a.overallScore()), fmt(a.confidenceScore()),
                    fmt(a.riskScore()), fmt(a.opportunityScore()), a.degraded())
            );
        };
    }

    public void logWithSessionId(String stageName, String sessionId) {
        TraceContextUtil.withMdc(sessionId, () ->
            log.info("[AnalysisFlow] stage={} sessionId={}", stageName, sessionId)
        );
    }

    public void logQueued(QueueItem item) {
        String stageName = switch (item.kind()) {
            case INTERVENTION -> INTERVENTION_QUEUED;
            case OPTIMIZATION -> OPTIMIZATION_QUEUED;
        };
        TraceContextUtil.withMdc(item.sessionId(), () ->
            log.info("[AnalysisFlow] stage={} sessionId={} id={} priority={} action={} reason={}",
                stageName, item.sessionId(), item.id(), item.priority(), item.action(), item.reason())
        );
    }

    private static String fmt(double v) {
        return String.format("%.3f", v);
    }
}
