package com.pitchcraft.core.model;

import java.io.Serializable;

/**
 * Typed, immutable state of one pitch workflow run.
 * <p>
 * Every agent step receives a {@code PitchState} and returns a new one; nothing
 * is mutated in place. Fields that only exist from a given phase onward are read
 * through {@link #requirePitch()} and {@link #requireCritique()}, which fail fast
 * when a step runs out of order.
 */
public record PitchState(
    String description,
    String context,
    String pitch,
    Critique critique,
    int autoRefineCount,
    int totalIterationCount,
    String humanFeedback,
    FinalPackage finalPackage,
    Phase phase
) implements Serializable {

    public PitchState {
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("description must not be blank");
        }
        if (phase == null) {
            phase = Phase.START;
        }
    }

    public static PitchState initial(String description) {
        return new PitchState(description, null, null, null, 0, 0, null, null, Phase.START);
    }

    // ── Phase-gated accessors ────────────────────────────────────────

    public String requirePitch() {
        if (pitch == null || pitch.isBlank()) {
            throw new IllegalStateException("No pitch draft available in phase " + phase);
        }
        return pitch;
    }

    public Critique requireCritique() {
        if (critique == null) {
            throw new IllegalStateException("No critique available in phase " + phase);
        }
        return critique;
    }

    public String contextOrEmpty() {
        return context != null ? context : "";
    }

    public boolean hasHumanFeedback() {
        return humanFeedback != null && !humanFeedback.isBlank();
    }

    // ── Copy-on-write updates ────────────────────────────────────────

    public PitchState withContext(String newContext) {
        return new PitchState(description, newContext, pitch, critique,
                autoRefineCount, totalIterationCount, humanFeedback, finalPackage, phase);
    }

    public PitchState withPitch(String newPitch) {
        return new PitchState(description, context, newPitch, critique,
                autoRefineCount, totalIterationCount, humanFeedback, finalPackage, phase);
    }

    public PitchState withCritique(Critique newCritique) {
        return new PitchState(description, context, pitch, newCritique,
                autoRefineCount, totalIterationCount, humanFeedback, finalPackage, phase);
    }

    public PitchState withPhase(Phase newPhase) {
        return new PitchState(description, context, pitch, critique,
                autoRefineCount, totalIterationCount, humanFeedback, finalPackage, newPhase);
    }

    public PitchState withHumanFeedback(String feedback) {
        return new PitchState(description, context, pitch, critique,
                autoRefineCount, totalIterationCount, feedback, finalPackage, phase);
    }

    public PitchState withFinalPackage(FinalPackage pkg) {
        return new PitchState(description, context, pitch, critique,
                autoRefineCount, totalIterationCount, humanFeedback, pkg, phase);
    }

    /** Counts one automatic refinement against both budgets. */
    public PitchState withAutoRefine() {
        return new PitchState(description, context, pitch, critique,
                autoRefineCount + 1, totalIterationCount + 1, humanFeedback, finalPackage, phase);
    }

    /** Counts one human-requested refinement against the total budget only. */
    public PitchState withHumanRefinement() {
        return new PitchState(description, context, pitch, critique,
                autoRefineCount, totalIterationCount + 1, humanFeedback, finalPackage, phase);
    }
}
