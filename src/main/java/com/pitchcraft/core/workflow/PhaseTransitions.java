package com.pitchcraft.core.workflow;

import com.pitchcraft.core.model.Phase;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * The workflow state machine expressed as data.
 * <p>
 * Every phase change in the engine goes through {@link #next(Phase, WorkflowEvent)}.
 * Pairs missing from the table are rejected with {@link InvalidTransitionException}.
 */
public final class PhaseTransitions {

    private static final Map<Phase, Map<WorkflowEvent, Phase>> TABLE = new EnumMap<>(Phase.class);

    static {
        on(Phase.START,             WorkflowEvent.CONTEXT_GATHERED,   Phase.CONTEXT_DONE);
        on(Phase.CONTEXT_DONE,      WorkflowEvent.PITCH_GENERATED,    Phase.GENERATED);
        on(Phase.GENERATED,         WorkflowEvent.CRITIQUE_COMPLETED, Phase.CRITIQUED);
        on(Phase.AUTO_REFINING,     WorkflowEvent.CRITIQUE_COMPLETED, Phase.CRITIQUED);
        on(Phase.REFINING,          WorkflowEvent.CRITIQUE_COMPLETED, Phase.CRITIQUED);
        on(Phase.CRITIQUED,         WorkflowEvent.AUTO_REFINE,        Phase.AUTO_REFINING);
        on(Phase.CRITIQUED,         WorkflowEvent.SUSPEND,            Phase.AWAITING_APPROVAL);
        on(Phase.CRITIQUED,         WorkflowEvent.CAP_REACHED,        Phase.CAPPED);
        on(Phase.AWAITING_APPROVAL, WorkflowEvent.REJECTED,           Phase.REFINING);
        on(Phase.AWAITING_APPROVAL, WorkflowEvent.APPROVED,           Phase.READY_FOR_FINAL);
        on(Phase.AWAITING_APPROVAL, WorkflowEvent.CAP_REACHED,        Phase.CAPPED);
        on(Phase.READY_FOR_FINAL,   WorkflowEvent.FINALIZED,          Phase.DONE);
    }

    private PhaseTransitions() {}

    private static void on(Phase from, WorkflowEvent event, Phase to) {
        TABLE.computeIfAbsent(from, p -> new EnumMap<>(WorkflowEvent.class)).put(event, to);
    }

    /**
     * Returns the phase reached from {@code from} on {@code event}.
     *
     * @throws InvalidTransitionException if the pair is not part of the table
     */
    public static Phase next(Phase from, WorkflowEvent event) {
        return lookup(from, event).orElseThrow(() -> new InvalidTransitionException(
                "Event " + event + " is not allowed in phase " + from));
    }

    public static boolean allows(Phase from, WorkflowEvent event) {
        return lookup(from, event).isPresent();
    }

    private static Optional<Phase> lookup(Phase from, WorkflowEvent event) {
        var row = TABLE.get(from);
        return row == null ? Optional.empty() : Optional.ofNullable(row.get(event));
    }
}
