package com.pitchcraft.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Structured evaluation of one pitch draft.
 * <p>
 * {@code degraded} marks a critique synthesised locally because the backend
 * was unavailable or returned something that could not be parsed; such a
 * critique always carries the lowest scores and a FAIL decision.
 */
public record Critique(
    CritiqueScores scores,
    @JsonProperty("overall_score") double overall,
    String feedback,
    List<String> strengths,
    List<String> weaknesses,
    Decision decision,
    boolean degraded
) implements Serializable {

    public Critique {
        feedback = feedback != null ? feedback : "";
        strengths = strengths != null ? List.copyOf(strengths) : List.of();
        weaknesses = weaknesses != null ? List.copyOf(weaknesses) : List.of();
    }

    public static Critique fallback(String reason) {
        return new Critique(CritiqueScores.lowest(), 0.0,
                "Automatic critique unavailable: " + reason,
                List.of(), List.of("Critique could not be produced; review the draft manually"),
                Decision.FAIL, true);
    }

    public boolean passed() {
        return decision == Decision.PASS;
    }
}
