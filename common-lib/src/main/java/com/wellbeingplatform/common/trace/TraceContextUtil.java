package com.wellbeingplatform.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

/**
 * Lightweight session tracing utility.
 *
 * <p>Inside reactive pipelines the Reactor Context is the single source of truth for the
 * session id. MDC is only ever written as a temporary bridge during a log statement,
 * never as a persistent ThreadLocal store.
 *
 * <pre>
 *     return TraceContextUtil.withSessionId(pipeline, session.id());
 * </pre>
 */
public final class TraceContextUtil {

    public static final String SESSION_ID_KEY = "sessionId";

    private TraceContextUtil() {}

    /**
     * Stores {@code sessionId} in the Reactor Context of {@code mono}. Call at the end of
     * pipeline assembly: {@code contextWrite} propagates upstream during subscription.
     */
    public static <T> Mono<T> withSessionId(Mono<T> mono, String sessionId) {
        return mono.contextWrite(ctx -> ctx.put(SESSION_ID_KEY, sessionId == null ? "none" : sessionId));
    }

    /** Session id from the context, or {@code "none"}. Never {@code null}. */
    public static String getSessionId(ContextView ctx) {
        return ctx.getOrDefault(SESSION_ID_KEY, "none");
    }

    /**
     * Bridges {@code sessionId} into MDC for the duration of {@code logAction}, then
     * removes it. Only for logging side effects.
     */
    public static void withMdc(String sessionId, Runnable logAction) {
        MDC.put(SESSION_ID_KEY, sessionId == null ? "none" : sessionId);
        try {
            logAction.run();
        } finally {
            MDC.remove(SESSION_ID_KEY);
        }
    }
}
