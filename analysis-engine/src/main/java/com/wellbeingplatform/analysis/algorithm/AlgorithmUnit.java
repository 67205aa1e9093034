package com.wellbeingplatform.analysis.algorithm;

import com.wellbeingplatform.common.model.AlgorithmFamily;
import com.wellbeingplatform.common.model.AlgorithmResult;
import com.wellbeingplatform.common.model.SessionData;
import com.wellbeingplatform.common.model.UserProfile;

/**
 * A stateless scorer: user profile + session data → bounded score, confidence, insights.
 *
 * <p>Implementations hold no mutable state and may be invoked concurrently. A unit that
 * cannot score its input throws; the registry isolates the failure to that unit.
 */
public interface AlgorithmUnit {

    String algorithmName();

    AlgorithmFamily family();

    /** Full analysis over a tick window or a whole-session summary. */
    AlgorithmResult execute(UserProfile profile, SessionData data);

    /**
     * Low-latency analysis over the rolling window of recent events. Units in the
     * real-time priority subset override this to favour the latest event.
     */
    default AlgorithmResult executeRealtime(UserProfile profile, SessionData window) {
        return execute(profile, window);
    }
}
