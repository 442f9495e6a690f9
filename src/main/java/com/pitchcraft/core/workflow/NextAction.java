package com.pitchcraft.core.workflow;

/**
 * Outcome of the iteration policy after a critique.
 */
public enum NextAction {
    AUTO_REFINE,
    SUSPEND_FOR_APPROVAL,
    TERMINATE_MAX_ITER
}
