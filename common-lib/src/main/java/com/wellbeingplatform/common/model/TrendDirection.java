package com.wellbeingplatform.common.model;

public enum TrendDirection {
    IMPROVING,
    STABLE,
    DECLINING
}
