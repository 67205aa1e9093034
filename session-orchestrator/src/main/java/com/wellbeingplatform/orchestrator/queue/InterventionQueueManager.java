package com.wellbeingplatform.orchestrator.queue;

import com.wellbeingplatform.common.model.QueueItem;
import com.wellbeingplatform.common.model.QueueKind;
import com.wellbeingplatform.common.model.QueueSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Intervention and optimization queues. Safe for concurrent use from the real-time and
 * periodic paths; every read returns a copy.
 */
@Component
public class InterventionQueueManager {

    private static final Logger log = LoggerFactory.getLogger(InterventionQueueManager.class);

    private final Map<QueueKind, QueueLane> lanes = new EnumMap<>(QueueKind.class);

    public InterventionQueueManager() {
        for (QueueKind kind : QueueKind.values()) {
            lanes.put(kind, new QueueLane(kind));
        }
    }

    /** @return {@code false} if an item with the same id was already admitted */
    public boolean enqueue(QueueItem item) {
        boolean added = lanes.get(item.kind()).enqueue(item);
        if (!added) {
            log.debug("[QueueManager] Duplicate ignored kind={} id={}", item.kind(), item.id());
        }
        return added;
    }

    public List<QueueItem> peekAll(QueueKind kind) {
        return lanes.get(kind).active();
    }

    public List<QueueItem> processed(QueueKind kind) {
        return lanes.get(kind).processed();
    }

    public QueueSnapshot snapshot() {
        return new QueueSnapshot(peekAll(QueueKind.INTERVENTION), peekAll(QueueKind.OPTIMIZATION));
    }

    public int depth(QueueKind kind) {
        return lanes.get(kind).depth();
    }

    /** Idempotent: unknown or already processed ids return {@code false}. */
    public boolean markProcessed(QueueKind kind, String id) {
        boolean moved = lanes.get(kind).markProcessed(id, Instant.now());
        if (moved) {
            log.info("[QueueManager] Processed kind={} id={}", kind, id);
        }
        return moved;
    }

    public void clearProcessed() {
        lanes.values().forEach(QueueLane::clearProcessed);
    }
}
