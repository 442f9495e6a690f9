package com.pitchcraft.core.nodes;

import com.pitchcraft.core.model.PitchState;

/**
 * One content-producing step of the pitch workflow.
 * <p>
 * A step never mutates its input and never throws because the text-generation
 * backend misbehaved; it returns degraded content instead. Phase changes are
 * applied by the graph around the step, not by the step itself.
 */
public interface AgentStep {

    String name();

    PitchState execute(PitchState state);
}
