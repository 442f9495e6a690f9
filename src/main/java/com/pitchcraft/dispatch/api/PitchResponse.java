package com.pitchcraft.dispatch.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.pitchcraft.core.model.Critique;
import com.pitchcraft.core.model.FinalPackage;
import com.pitchcraft.core.model.PitchState;
import com.pitchcraft.core.model.Session;

import java.time.Instant;

/**
 * JSON snapshot of a pitch session.
 */
public record PitchResponse(
    @JsonProperty("session_id") String sessionId,
    String phase,
    String description,
    String pitch,
    Critique critique,
    String decision,
    @JsonProperty("auto_refine_count") int autoRefineCount,
    @JsonProperty("total_iteration_count") int totalIterationCount,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("updated_at") Instant updatedAt,
    @JsonProperty("final_package") @JsonInclude(JsonInclude.Include.NON_NULL) FinalPackage finalPackage
) {

    public static PitchResponse from(Session session) {
        PitchState state = session.state();
        Critique critique = state.critique();
        return new PitchResponse(
                session.id(),
                state.phase().name(),
                state.description(),
                state.pitch(),
                critique,
                critique != null ? critique.decision().name() : null,
                state.autoRefineCount(),
                state.totalIterationCount(),
                session.createdAt(),
                session.updatedAt(),
                state.finalPackage());
    }
}
