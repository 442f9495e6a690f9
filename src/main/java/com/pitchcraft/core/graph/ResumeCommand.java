package com.pitchcraft.core.graph;

/**
 * Tells the graph's entry node where a run picks up.
 */
public enum ResumeCommand {
    /** Fresh session: gather context, draft, critique. */
    START,
    /** Human rejected the draft: refine with feedback, then critique. */
    REFINE,
    /** Human approved the draft: build the final package. */
    FINALIZE,
    /** Rejection arrived with the total budget spent: build a capped package. */
    CAP
}
