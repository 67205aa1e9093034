package com.wellbeingplatform.orchestrator.lifecycle;

import com.wellbeingplatform.common.model.AlgorithmFamily;
import com.wellbeingplatform.common.model.IntegratedAnalysis;
import com.wellbeingplatform.common.model.InteractionEvent;
import com.wellbeingplatform.common.model.LifecycleState;
import com.wellbeingplatform.common.model.Session;
import com.wellbeingplatform.common.model.TrendDirection;
import com.wellbeingplatform.common.model.UserProfile;
import com.wellbeingplatform.common.trend.TrendClassifier;
import com.wellbeingplatform.orchestrator.config.OrchestratorSettings;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Shared state of the orchestrator instance: current session, user profile, pending
 * event window, analysis history, latest real-time analysis and trend classifications.
 *
 * <p>Every mutation and compound read happens under one {@link ReentrantLock}, so a
 * real-time admission and a periodic drain never interleave on the same window. Writes
 * tagged with a session id are dropped once that session is no longer active, except
 * for a real-time pass admitted while it was active: that pass still commits, and
 * {@link #drainRealtime(Duration)} lets {@code end()} wait for it.
 */
@Component
public class SessionState {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition realtimeDrained = lock.newCondition();
    private final OrchestratorSettings settings;

    private LifecycleState lifecycle = LifecycleState.IDLE;
    private UserProfile profile;
    private Session session;
    private final List<InteractionEvent> window = new ArrayList<>();
    private final Deque<IntegratedAnalysis> history = new ArrayDeque<>();
    private final Set<AlgorithmFamily> degradedFamilies = EnumSet.noneOf(AlgorithmFamily.class);
    private IntegratedAnalysis latestRealtime;
    private Map<String, TrendDirection> trends = Map.of();
    private Disposable tickToken;
    private int realtimeInFlight;
    private boolean closing;

    private final AtomicInteger passesInFlight = new AtomicInteger();

    public SessionState(OrchestratorSettings settings) {
        this.settings = settings;
    }

    private <T> T guarded(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private void guarded(Runnable action) {
        lock.lock();
        try {
            action.run();
        } finally {
            lock.unlock();
        }
    }

    // ── profile ───────────────────────────────────────────────────────────────

    public void initialize(UserProfile userProfile) {
        guarded(() -> { profile = userProfile; });
    }

    public boolean isInitialized() {
        return guarded(() -> profile != null);
    }

    public UserProfile profile() {
        return guarded(() -> profile);
    }

    public UserProfile mergeProfile(UserProfile update) {
        return guarded(() -> {
            profile = profile == null ? update : profile.merge(update);
            return profile;
        });
    }

    // ── lifecycle ─────────────────────────────────────────────────────────────

    public LifecycleState lifecycle() {
        return guarded(() -> lifecycle);
    }

    /** Installs a freshly started session and resets every per-session structure. */
    public void begin(Session started) {
        guarded(() -> {
            session = started;
            lifecycle = LifecycleState.ACTIVE;
            window.clear();
            history.clear();
            degradedFamilies.clear();
            latestRealtime = null;
            trends = Map.of();
            closing = false;
        });
    }

    /** Marks the session completed; later writes for it are ignored. */
    public void complete(Session completed) {
        guarded(() -> {
            session = completed;
            lifecycle = LifecycleState.COMPLETED;
            window.clear();
        });
    }

    public Optional<Session> activeSession() {
        return guarded(() -> lifecycle == LifecycleState.ACTIVE ? Optional.ofNullable(session) : Optional.empty());
    }

    public Session currentSession() {
        return guarded(() -> session);
    }

    private boolean isActive(String sessionId) {
        return lifecycle == LifecycleState.ACTIVE && session != null && session.id().equals(sessionId);
    }

    private boolean isCurrent(String sessionId) {
        return session != null && session.id().equals(sessionId);
    }

    // ── collector degradation ─────────────────────────────────────────────────

    public void markDegraded(AlgorithmFamily family) {
        guarded(() -> { degradedFamilies.add(family); });
    }

    public Set<AlgorithmFamily> degradedFamilies() {
        return guarded(() -> degradedFamilies.isEmpty()
            ? EnumSet.noneOf(AlgorithmFamily.class)
            : EnumSet.copyOf(degradedFamilies));
    }

    // ── event window ──────────────────────────────────────────────────────────

    /** @return {@code false} if {@code sessionId} is not the active session */
    public boolean bufferEvent(String sessionId, InteractionEvent event) {
        return guarded(() -> {
            if (!isActive(sessionId)) return false;
            window.add(event);
            return true;
        });
    }

    /** Removes and returns the events buffered since the last drain. */
    public List<InteractionEvent> drainWindow(String sessionId) {
        return guarded(() -> {
            if (!isActive(sessionId) || window.isEmpty()) return List.of();
            List<InteractionEvent> drained = List.copyOf(window);
            window.clear();
            return drained;
        });
    }

    // ── analyses ──────────────────────────────────────────────────────────────

    /**
     * Appends to history (evicting the oldest beyond the configured limit) and
     * reclassifies trends.
     *
     * @return the new trends, or empty if the session is no longer active
     */
    public Optional<Map<String, TrendDirection>> appendHistory(String sessionId, IntegratedAnalysis analysis) {
        return guarded(() -> {
            if (!isActive(sessionId)) return Optional.<Map<String, TrendDirection>>empty();
            history.addLast(analysis);
            while (history.size() > settings.historyLimit()) {
                history.removeFirst();
            }
            trends = TrendClassifier.classifyHistory(List.copyOf(history), settings.trendTolerance());
            return Optional.of(trends);
        });
    }

    /**
     * Accepted for the current session even after it completed, since only admitted
     * real-time passes call this.
     *
     * @return {@code false} if a different session has started since
     */
    public boolean recordRealtime(String sessionId, IntegratedAnalysis analysis) {
        return guarded(() -> {
            if (!isCurrent(sessionId)) return false;
            latestRealtime = analysis;
            return true;
        });
    }

    public List<IntegratedAnalysis> history() {
        return guarded(() -> List.copyOf(history));
    }

    public Map<String, TrendDirection> trends() {
        return guarded(() -> trends);
    }

    public IntegratedAnalysis latestRealtime() {
        return guarded(() -> latestRealtime);
    }

    // ── periodic cancellation token ───────────────────────────────────────────

    /** Installs the aggregator subscription, disposing any previous one. */
    public void armTicks(Disposable token) {
        guarded(() -> {
            if (tickToken != null) tickToken.dispose();
            tickToken = token;
        });
    }

    public void disarmTicks() {
        guarded(() -> {
            if (tickToken != null) {
                tickToken.dispose();
                tickToken = null;
            }
        });
    }

    public boolean ticksArmed() {
        return guarded(() -> tickToken != null && !tickToken.isDisposed());
    }

    // ── real-time drain ───────────────────────────────────────────────────────

    /**
     * Admits a real-time pass for {@code sessionId}. Every admitted pass must be paired
     * with {@link #realtimePassFinished()}.
     *
     * @return {@code false} if the session is not active or is being ended
     */
    public boolean realtimePassStarted(String sessionId) {
        return guarded(() -> {
            if (!isActive(sessionId) || closing) return false;
            realtimeInFlight++;
            passesInFlight.incrementAndGet();
            return true;
        });
    }

    public void realtimePassFinished() {
        guarded(() -> {
            realtimeInFlight--;
            passesInFlight.decrementAndGet();
            if (realtimeInFlight == 0) {
                realtimeDrained.signalAll();
            }
        });
    }

    /**
     * Stops admitting real-time passes and waits for the admitted ones to finish.
     *
     * @return {@code false} if passes were still running when {@code timeout} elapsed
     */
    public boolean drainRealtime(Duration timeout) {
        lock.lock();
        try {
            closing = true;
            long remaining = timeout.toNanos();
            while (realtimeInFlight > 0) {
                if (remaining <= 0) {
                    return false;
                }
                remaining = realtimeDrained.awaitNanos(remaining);
            }
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } finally {
            lock.unlock();
        }
    }

    // ── analyzing flag ────────────────────────────────────────────────────────

    public void passStarted() {
        passesInFlight.incrementAndGet();
    }

    public void passFinished() {
        passesInFlight.decrementAndGet();
    }

    public boolean isAnalyzing() {
        return passesInFlight.get() > 0;
    }
}
