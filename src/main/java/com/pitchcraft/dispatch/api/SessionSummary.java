package com.pitchcraft.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.pitchcraft.core.model.Session;

import java.time.Instant;

/**
 * One row of GET /api/v1/pitches.
 */
public record SessionSummary(
    @JsonProperty("session_id") String sessionId,
    String phase,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("updated_at") Instant updatedAt,
    @JsonProperty("total_iteration_count") int totalIterationCount
) {

    public static SessionSummary from(Session session) {
        return new SessionSummary(session.id(), session.phase().name(), session.createdAt(),
                session.updatedAt(), session.state().totalIterationCount());
    }
}
