package com.wellbeingplatform.analysis.collector;

/**
 * Names of the metrics {@link SessionDataAssembler} derives and of the event fields the
 * collectors aggregate. Units read metrics by these names.
 */
public final class SessionMetrics {

    private SessionMetrics() {}

    // derived counts and rates
    public static final String EVENT_COUNT          = "eventCount";
    public static final String ERROR_COUNT          = "errorCount";
    public static final String ERROR_RATE           = "errorRate";
    public static final String HELP_REQUESTS        = "helpRequests";
    public static final String RETRY_ATTEMPTS       = "retryAttempts";
    public static final String TIME_SPENT_MS        = "timeSpentMs";
    public static final String EVENTS_PER_SECOND    = "eventsPerSecond";
    public static final String CLICK_BURSTS         = "clickBursts";
    public static final String HESITATIONS          = "hesitations";
    public static final String BACKTRACKS           = "backtracks";
    public static final String DISTINCT_EVENT_TYPES = "distinctEventTypes";
    public static final String WARM_COLORS          = "warmColors";
    public static final String COOL_COLORS          = "coolColors";
    public static final String DARK_COLORS          = "darkColors";
    public static final String DISTINCT_COLORS      = "distinctColors";
    public static final String PERFORMANCE_TREND    = "performanceTrend";
    public static final String IMPROVEMENTS         = "improvements";

    // event fields
    public static final String RESPONSE_TIME        = "responseTime";
    public static final String PAUSE_DURATION       = "pauseDuration";
    public static final String CLICKS_PER_SECOND    = "clicksPerSecond";
    public static final String ACTIONS_PER_SECOND   = "actionsPerSecond";
    public static final String COMPLETION_RATE      = "completionRate";
    public static final String PROGRESS_SCORE       = "progressScore";
    public static final String PERFORMANCE          = "performance";
    public static final String ACCURACY             = "accuracy";
    public static final String COGNITIVE_LOAD       = "cognitiveLoad";
    public static final String ATTENTION_LEVEL      = "attentionLevel";
    public static final String ERROR_RECOVERY_TIME  = "errorRecoveryTime";
    public static final String COLOR                = "color";
    public static final String TASK_ID              = "taskId";
}
