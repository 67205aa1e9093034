package com.wellbeingplatform.common.model;

public enum LifecycleState {
    IDLE,
    ACTIVE,
    COMPLETED
}
