package com.wellbeingplatform.common.model;

/** Which processing path produced an {@link IntegratedAnalysis}. */
public enum AnalysisMode {
    REALTIME,
    PERIODIC,
    FINAL
}
