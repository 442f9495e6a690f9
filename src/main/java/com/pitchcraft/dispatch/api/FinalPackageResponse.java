package com.pitchcraft.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.pitchcraft.core.model.FinalPackage;
import com.pitchcraft.core.model.Session;

/**
 * JSON body of GET /api/v1/pitches/{id}/final: the package plus how it was reached.
 */
public record FinalPackageResponse(
    @JsonProperty("session_id") String sessionId,
    String phase,
    String pitch,
    @JsonProperty("overall_score") Double overallScore,
    @JsonProperty("total_iteration_count") int totalIterationCount,
    @JsonProperty("final_package") FinalPackage finalPackage
) {

    public static FinalPackageResponse from(Session session, FinalPackage finalPackage) {
        var critique = session.state().critique();
        return new FinalPackageResponse(session.id(), session.phase().name(), session.state().pitch(),
                critique != null ? critique.overall() : null,
                session.state().totalIterationCount(), finalPackage);
    }
}
