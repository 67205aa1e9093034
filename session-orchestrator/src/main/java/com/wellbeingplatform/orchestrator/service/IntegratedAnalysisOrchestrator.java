package com.wellbeingplatform.orchestrator.service;

import com.wellbeingplatform.common.exception.InvalidStateException;
import com.wellbeingplatform.common.model.IntegratedAnalysis;
import com.wellbeingplatform.common.model.InteractionEvent;
import com.wellbeingplatform.common.model.LifecycleState;
import com.wellbeingplatform.common.model.OrchestratorSnapshot;
import com.wellbeingplatform.common.model.OrchestratorStatus;
import com.wellbeingplatform.common.model.QueueKind;
import com.wellbeingplatform.common.model.QueueSnapshot;
import com.wellbeingplatform.common.model.Session;
import com.wellbeingplatform.common.model.SessionConfig;
import com.wellbeingplatform.common.model.SessionReport;
import com.wellbeingplatform.common.model.UserProfile;
import com.wellbeingplatform.orchestrator.lifecycle.SessionLifecycleManager;
import com.wellbeingplatform.orchestrator.lifecycle.SessionState;
import com.wellbeingplatform.orchestrator.publisher.SnapshotPublisher;
import com.wellbeingplatform.orchestrator.queue.InterventionQueueManager;
import com.wellbeingplatform.orchestrator.realtime.RealtimeEventProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.function.Consumer;

/**
 * Public operation set consumed by the surrounding application.
 *
 * <pre>
 *   orchestrator.initialize(profile);
 *   Session s = orchestrator.startSession(config);
 *   orchestrator.processEvent(event);          // per interaction
 *   QueueSnapshot q = orchestrator.getQueues();
 *   orchestrator.markIntervention(id);
 *   SessionReport r = orchestrator.endSession();
 * </pre>
 */
@Service
public class IntegratedAnalysisOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(IntegratedAnalysisOrchestrator.class);

    private final SessionState state;
    private final SessionLifecycleManager lifecycle;
    private final RealtimeEventProcessor realtime;
    private final InterventionQueueManager queues;
    private final SnapshotPublisher publisher;

    public IntegratedAnalysisOrchestrator(SessionState state,
                                          SessionLifecycleManager lifecycle,
                                          RealtimeEventProcessor realtime,
                                          InterventionQueueManager queues,
                                          SnapshotPublisher publisher) {
        this.state     = state;
        this.lifecycle = lifecycle;
        this.realtime  = realtime;
        this.queues    = queues;
        this.publisher = publisher;
    }

    /**
     * Installs the user profile every subsequent pass reads.
     *
     * @return {@code false} if {@code profile} is missing
     * @throws InvalidStateException while a session is active
     */
    public boolean initialize(UserProfile profile) {
        if (profile == null || profile.userId() == null) {
            log.warn("[Orchestrator] initialize called without a user profile");
            return false;
        }
        LifecycleState current = state.lifecycle();
        if (current == LifecycleState.ACTIVE) {
            throw new InvalidStateException(current, "Cannot re-initialize during an active session");
        }
        state.initialize(profile);
        log.info("[Orchestrator] Initialized. userId={} parameters={}", profile.userId(), profile.parameters().size());
        return true;
    }

    public Session startSession(SessionConfig config) {
        return lifecycle.start(config);
    }

    public SessionReport endSession() {
        return lifecycle.end();
    }

    /** @return the real-time analysis, or {@code null} when none was produced */
    public IntegratedAnalysis processEvent(InteractionEvent event) {
        return realtime.process(event);
    }

    public QueueSnapshot getQueues() {
        return queues.snapshot();
    }

    /** Idempotent; {@code false} when the id is unknown or already processed. */
    public boolean markIntervention(String id) {
        return mark(QueueKind.INTERVENTION, id);
    }

    public boolean markOptimization(String id) {
        return mark(QueueKind.OPTIMIZATION, id);
    }

    private boolean mark(QueueKind kind, String id) {
        boolean changed = queues.markProcessed(kind, id);
        if (changed) {
            publisher.publish();
        }
        return changed;
    }

    public OrchestratorStatus getStatus() {
        Session session = state.currentSession();
        return new OrchestratorStatus(
            state.lifecycle(),
            state.lifecycle() == LifecycleState.ACTIVE,
            state.isAnalyzing(),
            session == null ? null : session.id(),
            queues.depth(QueueKind.INTERVENTION),
            queues.depth(QueueKind.OPTIMIZATION));
    }

    /** Merges {@code update}'s parameters into the current profile. */
    public UserProfile updateUserProfile(UserProfile update) {
        if (update == null) {
            return state.profile();
        }
        UserProfile merged = state.mergeProfile(update);
        log.info("[Orchestrator] Profile updated. userId={} parameters={}", merged.userId(), merged.parameters().size());
        return merged;
    }

    public void clearProcessedQueues() {
        queues.clearProcessed();
    }

    public void addSnapshotListener(Consumer<OrchestratorSnapshot> listener) {
        publisher.addListener(listener);
    }

    public OrchestratorSnapshot snapshot() {
        return publisher.snapshot();
    }

    public List<IntegratedAnalysis> getAnalysisHistory() {
        return state.history();
    }
}
