package com.wellbeingplatform.common.model;

public enum SessionStatus {
    ACTIVE,
    COMPLETED
}
