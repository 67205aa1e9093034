package com.wellbeingplatform.orchestrator.queue;

import com.wellbeingplatform.common.model.QueueItem;
import com.wellbeingplatform.common.model.QueueKind;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/**
 * One append-only queue: an active view in admission order and a processed view kept
 * for audit. An id is remembered while its item is active or in the audit view, so a
 * queued or processed item is never admitted again. {@link #clearProcessed()} forgets
 * the cleared ids along with the items, which keeps the id set bounded by what the lane
 * still holds.
 */
class QueueLane {

    private final QueueKind kind;
    private final List<QueueItem> active = new ArrayList<>();
    private final List<QueueItem> processed = new ArrayList<>();
    private final Set<String> admitted = new HashSet<>();

    QueueLane(QueueKind kind) {
        this.kind = kind;
    }

    QueueKind kind() {
        return kind;
    }

    synchronized boolean enqueue(QueueItem item) {
        if (!admitted.add(item.id())) {
            return false;
        }
        active.add(item);
        return true;
    }

    synchronized List<QueueItem> active() {
        return List.copyOf(active);
    }

    synchronized List<QueueItem> processed() {
        return List.copyOf(processed);
    }

    synchronized int depth() {
        return active.size();
    }

    /** @return {@code true} if the item moved from active to processed by this call */
    synchronized boolean markProcessed(String id, Instant at) {
        Iterator<QueueItem> it = active.iterator();
        while (it.hasNext()) {
            QueueItem item = it.next();
            if (item.id().equals(id)) {
                it.remove();
                processed.add(item.markProcessed(at));
                return true;
            }
        }
        return false;
    }

    synchronized void clearProcessed() {
        for (QueueItem item : processed) {
            admitted.remove(item.id());
        }
        processed.clear();
    }

    synchronized int rememberedIds() {
        return admitted.size();
    }
}
