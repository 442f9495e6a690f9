package com.pitchcraft.core.model;

/**
 * Position of a pitch session in the workflow state machine.
 */
public enum Phase {
    START,
    CONTEXT_DONE,
    GENERATED,
    CRITIQUED,
    AUTO_REFINING,
    AWAITING_APPROVAL,
    REFINING,          // Human-triggered refinement in flight
    READY_FOR_FINAL,
    DONE,
    CAPPED;            // Total iteration budget spent; best-effort package produced

    public boolean isTerminal() {
        return this == DONE || this == CAPPED;
    }

    /**
     * True for every phase at which a pitch draft must exist.
     */
    public boolean hasPitch() {
        return this != START && this != CONTEXT_DONE;
    }
}
