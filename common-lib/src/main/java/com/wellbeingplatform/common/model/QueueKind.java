package com.wellbeingplatform.common.model;

/**
 * Which of the two work queues an item belongs to.
 * Interventions are urgent; optimizations are enhancements that can wait.
 */
public enum QueueKind {
    INTERVENTION("intervention"),
    OPTIMIZATION("optimization");

    private final String idPrefix;

    QueueKind(String idPrefix) {
        this.idPrefix = idPrefix;
    }

    public String idPrefix() {
        return idPrefix;
    }
}
