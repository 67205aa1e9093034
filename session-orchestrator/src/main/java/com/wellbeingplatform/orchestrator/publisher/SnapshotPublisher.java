package com.wellbeingplatform.orchestrator.publisher;

import com.wellbeingplatform.common.model.LifecycleState;
import com.wellbeingplatform.common.model.OrchestratorSnapshot;
import com.wellbeingplatform.common.model.QueueSnapshot;
import com.wellbeingplatform.orchestrator.lifecycle.SessionState;
import com.wellbeingplatform.orchestrator.queue.InterventionQueueManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Pushes read-only {@link OrchestratorSnapshot}s to the presentation layer after each
 * update. A listener that throws is logged and skipped; the remaining listeners still
 * receive the snapshot.
 */
@Component
public class SnapshotPublisher {

    private static final Logger log = LoggerFactory.getLogger(SnapshotPublisher.class);

    private final SessionState state;
    private final InterventionQueueManager queues;
    private final List<Consumer<OrchestratorSnapshot>> listeners = new CopyOnWriteArrayList<>();

    public SnapshotPublisher(SessionState state, InterventionQueueManager queues) {
        this.state  = state;
        this.queues = queues;
    }

    public void addListener(Consumer<OrchestratorSnapshot> listener) {
        listeners.add(listener);
    }

    public OrchestratorSnapshot snapshot() {
        QueueSnapshot q = queues.snapshot();
        return new OrchestratorSnapshot(
            state.currentSession(),
            state.lifecycle() == LifecycleState.ACTIVE,
            state.latestRealtime(),
            state.trends(),
            q.interventions(),
            q.optimizations(),
            Instant.now());
    }

    public void publish() {
        if (listeners.isEmpty()) return;
        OrchestratorSnapshot current = snapshot();
        for (Consumer<OrchestratorSnapshot> listener : listeners) {
            try {
                listener.accept(current);
            } catch (RuntimeException e) {
                log.warn("[SnapshotPublisher] listener failed, skipping. listener={} error={}",
                    listener.getClass().getSimpleName(), e.getMessage());
            }
        }
    }
}
