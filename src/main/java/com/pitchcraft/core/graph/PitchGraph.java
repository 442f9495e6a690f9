package com.pitchcraft.core.graph;

import com.pitchcraft.core.logging.MdcContext;
import com.pitchcraft.core.metrics.PitchMetrics;
import com.pitchcraft.core.model.Phase;
import com.pitchcraft.core.model.PitchState;
import com.pitchcraft.core.nodes.AgentStep;
import com.pitchcraft.core.nodes.ContextAgentStep;
import com.pitchcraft.core.nodes.CriticAgentStep;
import com.pitchcraft.core.nodes.GeneratorAgentStep;
import com.pitchcraft.core.nodes.ReadinessAgentStep;
import com.pitchcraft.core.nodes.RefinerAgentStep;
import com.pitchcraft.core.state.PitchGraphState;
import com.pitchcraft.core.workflow.IterationPolicy;
import com.pitchcraft.core.workflow.PhaseTransitions;
import com.pitchcraft.core.workflow.WorkflowEvent;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.RunnableConfig;
import org.bsc.langgraph4j.StateGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;
import static org.bsc.langgraph4j.action.AsyncEdgeAction.edge_async;
import static org.bsc.langgraph4j.action.AsyncNodeAction.node_async;

/**
 * Builds and holds the compiled LangGraph4j {@link StateGraph} that drives
 * the pitch workflow.
 * <p>
 * Topology:
 * <pre>
 *   START -> dispatch -> [routeFromDispatch]
 *      -> context -> generator -> critic
 *      -> human_refine -> critic
 *      -> readiness -> END                 (approved)
 *      -> capped -> END                    (rejected with the budget spent)
 *   critic -> [routeAfterCritique]
 *      -> auto_refine -> critic
 *      -> await_approval -> END
 *      -> capped -> END
 * </pre>
 * Each run stops at a human checkpoint or a terminal phase. Every node moves the
 * phase through {@link PhaseTransitions}; an undefined move aborts the run.
 */
@Component
public class PitchGraph {

    private static final Logger log = LoggerFactory.getLogger(PitchGraph.class);

    private final CompiledGraph<PitchGraphState> compiledGraph;
    private final IterationPolicy iterationPolicy;
    private final PitchMetrics metrics;

    public PitchGraph(ContextAgentStep contextStep,
                      GeneratorAgentStep generatorStep,
                      CriticAgentStep criticStep,
                      RefinerAgentStep refinerStep,
                      ReadinessAgentStep readinessStep,
                      IterationPolicy iterationPolicy,
                      PitchMetrics metrics) throws Exception {
        this.iterationPolicy = iterationPolicy;
        this.metrics = metrics;

        var graph = new StateGraph<>(PitchGraphState.SCHEMA, PitchGraphState::new)
                .addNode("dispatch", node_async(state -> Map.of()))
                .addNode("context", node_async(state ->
                        advance(state, contextStep, WorkflowEvent.CONTEXT_GATHERED)))
                .addNode("generator", node_async(state ->
                        advance(state, generatorStep, WorkflowEvent.PITCH_GENERATED)))
                .addNode("critic", node_async(state ->
                        advance(state, criticStep, WorkflowEvent.CRITIQUE_COMPLETED)))
                .addNode("auto_refine", node_async(state -> {
                    PitchState next = transition(state.pitchState(), WorkflowEvent.AUTO_REFINE).withAutoRefine();
                    return PitchGraphState.update(timed(refinerStep, next));
                }))
                .addNode("human_refine", node_async(state -> {
                    PitchState next = transition(state.pitchState(), WorkflowEvent.REJECTED).withHumanRefinement();
                    return PitchGraphState.update(timed(refinerStep, next));
                }))
                .addNode("await_approval", node_async(state -> PitchGraphState.update(
                        transition(state.pitchState(), WorkflowEvent.SUSPEND).withHumanFeedback(null))))
                .addNode("capped", node_async(state -> {
                    PitchState next = transition(state.pitchState(), WorkflowEvent.CAP_REACHED);
                    log.info("Iteration budget spent after {} refinements, building capped package",
                            next.totalIterationCount());
                    return PitchGraphState.update(timed(readinessStep, next));
                }))
                .addNode("readiness", node_async(state -> {
                    PitchState next = transition(state.pitchState(), WorkflowEvent.APPROVED);
                    next = timed(readinessStep, next);
                    return PitchGraphState.update(transition(next, WorkflowEvent.FINALIZED));
                }))
                .addEdge(START, "dispatch")
                .addConditionalEdges("dispatch",
                        edge_async(this::routeFromDispatch),
                        Map.of("context", "context",
                                "human_refine", "human_refine",
                                "readiness", "readiness",
                                "capped", "capped"))
                .addEdge("context", "generator")
                .addEdge("generator", "critic")
                .addConditionalEdges("critic",
                        edge_async(this::routeAfterCritique),
                        Map.of("auto_refine", "auto_refine",
                                "await_approval", "await_approval",
                                "capped", "capped"))
                .addEdge("auto_refine", "critic")
                .addEdge("human_refine", "critic")
                .addEdge("await_approval", END)
                .addEdge("capped", END)
                .addEdge("readiness", END);

        this.compiledGraph = graph.compile();
        log.info("Pitch graph compiled (auto-refine max {}, total max {})",
                iterationPolicy.autoRefineMax(), iterationPolicy.totalIterationMax());
    }

    /**
     * Runs the graph from the given state until the next human checkpoint or terminal phase.
     *
     * @param threadId identifies the run in LangGraph4j logs; the session id
     */
    public PitchState run(String threadId, PitchState state, ResumeCommand command) {
        var config = RunnableConfig.builder()
                .threadId(threadId)
                .build();
        var result = compiledGraph.invoke(PitchGraphState.inputs(state, command), config);
        return result.orElseThrow(() ->
                new IllegalStateException("Graph execution returned empty state for " + threadId))
                .pitchState();
    }

    String routeFromDispatch(PitchGraphState state) {
        return switch (state.command()) {
            case START -> "context";
            case REFINE -> "human_refine";
            case FINALIZE -> "readiness";
            case CAP -> "capped";
        };
    }

    String routeAfterCritique(PitchGraphState state) {
        return switch (iterationPolicy.nextAction(state.pitchState())) {
            case AUTO_REFINE -> "auto_refine";
            case SUSPEND_FOR_APPROVAL -> "await_approval";
            case TERMINATE_MAX_ITER -> "capped";
        };
    }

    private Map<String, Object> advance(PitchGraphState state, AgentStep step, WorkflowEvent completed) {
        PitchState next = timed(step, state.pitchState());
        return PitchGraphState.update(transition(next, completed));
    }

    private PitchState timed(AgentStep step, PitchState state) {
        MdcContext.setStep(step.name());
        long start = System.currentTimeMillis();
        try {
            return step.execute(state);
        } finally {
            metrics.recordStepDuration(step.name(), System.currentTimeMillis() - start);
            MdcContext.clearStep();
        }
    }

    private static PitchState transition(PitchState state, WorkflowEvent event) {
        Phase next = PhaseTransitions.next(state.phase(), event);
        log.debug("Phase {} --{}--> {}", state.phase(), event, next);
        return state.withPhase(next);
    }
}
