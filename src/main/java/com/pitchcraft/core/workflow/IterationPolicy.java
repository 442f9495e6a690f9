package com.pitchcraft.core.workflow;

import com.pitchcraft.core.model.Decision;
import com.pitchcraft.core.model.PitchState;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Decides what happens after each critique.
 * <p>
 * Rules are applied in order:
 * <ol>
 *   <li>total iterations at or above the total budget: terminate</li>
 *   <li>critique failed and automatic budget remains: refine automatically</li>
 *   <li>otherwise: suspend for human approval</li>
 * </ol>
 * Exhausted-FAIL and PASS both end up in front of a human.
 */
@Component
public class IterationPolicy {

    private final int autoRefineMax;
    private final int totalIterationMax;

    @Autowired
    public IterationPolicy(WorkflowProperties properties) {
        this(properties.getAutoRefineMax(), properties.getTotalIterationMax());
    }

    public IterationPolicy(int autoRefineMax, int totalIterationMax) {
        if (autoRefineMax < 0 || totalIterationMax < 1) {
            throw new IllegalArgumentException("Invalid iteration budgets: auto=" + autoRefineMax
                    + ", total=" + totalIterationMax);
        }
        this.autoRefineMax = autoRefineMax;
        this.totalIterationMax = totalIterationMax;
    }

    public NextAction nextAction(PitchState state) {
        if (state.totalIterationCount() >= totalIterationMax) {
            return NextAction.TERMINATE_MAX_ITER;
        }
        if (state.requireCritique().decision() == Decision.FAIL && state.autoRefineCount() < autoRefineMax) {
            return NextAction.AUTO_REFINE;
        }
        return NextAction.SUSPEND_FOR_APPROVAL;
    }

    /** A human rejection may only trigger another refinement while the total budget lasts. */
    public boolean canAcceptHumanRefinement(PitchState state) {
        return state.totalIterationCount() < totalIterationMax;
    }

    public int autoRefineMax() {
        return autoRefineMax;
    }

    public int totalIterationMax() {
        return totalIterationMax;
    }
}
