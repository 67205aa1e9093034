package com.wellbeingplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record Session(
    @JsonProperty("id") String id,
    @JsonProperty("userId") String userId,
    @JsonProperty("startTime") Instant startTime,
    @JsonProperty("endTime") Instant endTime,
    @JsonProperty("status") SessionStatus status,
    @JsonProperty("config") SessionConfig config
) {
    public static Session start(String id, SessionConfig config, Instant startTime) {
        return new Session(id, config.userId(), startTime, null, SessionStatus.ACTIVE, config);
    }

    public Session complete(Instant at) {
        return new Session(id, userId, startTime, at, SessionStatus.COMPLETED, config);
    }

    public boolean isActive() {
        return status == SessionStatus.ACTIVE;
    }
}
