package com.pitchcraft.core.workflow;

/**
 * Events that drive the pitch workflow from one phase to the next.
 */
public enum WorkflowEvent {
    CONTEXT_GATHERED,
    PITCH_GENERATED,
    CRITIQUE_COMPLETED,
    AUTO_REFINE,
    SUSPEND,
    REJECTED,
    APPROVED,
    FINALIZED,
    CAP_REACHED
}
