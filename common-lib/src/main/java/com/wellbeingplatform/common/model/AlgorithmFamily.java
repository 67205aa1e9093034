package com.wellbeingplatform.common.model;

/**
 * The two families of pluggable Algorithm Units. Each family owns its own
 * weight table and registry.
 */
public enum AlgorithmFamily {
    EMOTIONAL,
    NEUROPLASTICITY
}
