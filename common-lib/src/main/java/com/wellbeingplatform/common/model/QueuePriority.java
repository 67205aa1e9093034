package com.wellbeingplatform.common.model;

public enum QueuePriority {
    LOW,
    MEDIUM,
    HIGH,
    IMMEDIATE
}
