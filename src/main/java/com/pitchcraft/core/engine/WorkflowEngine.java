package com.pitchcraft.core.engine;

import com.pitchcraft.core.events.EventBus;
import com.pitchcraft.core.events.PitchEvent;
import com.pitchcraft.core.graph.PitchGraph;
import com.pitchcraft.core.graph.ResumeCommand;
import com.pitchcraft.core.logging.MdcContext;
import com.pitchcraft.core.metrics.PitchMetrics;
import com.pitchcraft.core.model.FinalPackage;
import com.pitchcraft.core.model.Phase;
import com.pitchcraft.core.model.PitchState;
import com.pitchcraft.core.model.Session;
import com.pitchcraft.core.session.SessionConflictException;
import com.pitchcraft.core.session.SessionLocks;
import com.pitchcraft.core.session.SessionNotFoundException;
import com.pitchcraft.core.session.SessionStore;
import com.pitchcraft.core.workflow.InvalidTransitionException;
import com.pitchcraft.core.workflow.IterationPolicy;
import com.pitchcraft.core.workflow.PhaseTransitions;
import com.pitchcraft.core.workflow.WorkflowEvent;
import com.pitchcraft.core.workflow.WorkflowException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;

/**
 * Entry points of the pitch workflow: start a session, answer its approval
 * checkpoint, inspect it, list and delete sessions.
 * <p>
 * Each mutating call holds the session's lock for the whole transition, runs the
 * graph on a copy of the state, and writes the session back only when the run
 * completed. A failed run leaves the stored session untouched.
 */
@Service
public class WorkflowEngine {

    private static final Logger log = LoggerFactory.getLogger(WorkflowEngine.class);

    static final String APPROVAL_NOTE = "Approved for final preparation";

    private final PitchGraph pitchGraph;
    private final SessionStore sessionStore;
    private final SessionLocks sessionLocks;
    private final IterationPolicy iterationPolicy;
    private final EventBus eventBus;
    private final PitchMetrics metrics;

    public WorkflowEngine(PitchGraph pitchGraph,
                          SessionStore sessionStore,
                          SessionLocks sessionLocks,
                          IterationPolicy iterationPolicy,
                          EventBus eventBus,
                          PitchMetrics metrics) {
        this.pitchGraph = pitchGraph;
        this.sessionStore = sessionStore;
        this.sessionLocks = sessionLocks;
        this.iterationPolicy = iterationPolicy;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    /**
     * Creates a session and runs it to its first approval checkpoint (or to
     * CAPPED when the budget is spent first). The session is stored only once
     * that run completes; a failed start leaves nothing behind.
     *
     * @throws IllegalArgumentException if the description is blank
     */
    public Session start(String description) {
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("description must not be blank");
        }
        PitchState initial = PitchState.initial(description.trim());
        String id = sessionStore.create();
        MdcContext.setSession(id);
        try (var lease = acquire(id)) {
            log.info("Starting pitch session {}", id);
            Session pending = Session.create(id, initial, Instant.now());
            Session started = run(pending, initial, ResumeCommand.START);
            sessionStore.put(id, started);
            eventBus.publish(new PitchEvent(PitchEvent.SESSION_CREATED, id, started.phase().name(),
                    Map.of("description", initial.description()), Instant.now()));
            recordTransition(Phase.START, started);
            return started;
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Answers the approval checkpoint of a suspended session.
     * <p>
     * Approval builds the final package. Rejection feeds {@code feedback} to one
     * more refine-and-critique cycle, or caps the session when the total budget is
     * already spent.
     *
     * @throws SessionNotFoundException    if the id is unknown
     * @throws InvalidTransitionException  if the session is not awaiting approval
     */
    public Session submitApproval(String sessionId, boolean approved, String feedback) {
        MdcContext.setSession(sessionId);
        try (var lease = acquire(sessionId)) {
            Session session = load(sessionId);
            PitchState state = session.state();
            WorkflowEvent event = approved ? WorkflowEvent.APPROVED : WorkflowEvent.REJECTED;
            if (!PhaseTransitions.allows(state.phase(), event)) {
                throw new InvalidTransitionException("Session " + sessionId + " is in phase " + state.phase()
                        + " and cannot accept " + (approved ? "an approval" : "a rejection"));
            }

            boolean hasFeedback = feedback != null && !feedback.isBlank();
            if (approved) {
                log.info("Session {} approved", sessionId);
                return runAndPersist(session, state.withHumanFeedback(hasFeedback ? feedback.trim() : APPROVAL_NOTE),
                        ResumeCommand.FINALIZE);
            }
            if (!iterationPolicy.canAcceptHumanRefinement(state)) {
                log.info("Session {} rejected with the iteration budget spent, capping", sessionId);
                return runAndPersist(session, state, ResumeCommand.CAP);
            }
            log.info("Session {} rejected, refining with feedback", sessionId);
            return runAndPersist(session, state.withHumanFeedback(hasFeedback ? feedback.trim() : null),
                    ResumeCommand.REFINE);
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Current snapshot of a session. Never changes the session.
     */
    public Session status(String sessionId) {
        return load(sessionId);
    }

    public List<Session> list() {
        return sessionStore.list();
    }

    /**
     * The final package of a finished session.
     *
     * @throws InvalidTransitionException if the session has not reached DONE or CAPPED
     */
    public FinalPackage finalPackage(String sessionId) {
        Session session = load(sessionId);
        if (!session.phase().isTerminal() || session.state().finalPackage() == null) {
            throw new InvalidTransitionException("Session " + sessionId + " is in phase " + session.phase()
                    + "; the final package is not ready");
        }
        return session.state().finalPackage();
    }

    /**
     * Deletes a session. Deleting an unknown id succeeds.
     */
    public void delete(String sessionId) {
        try (var lease = acquire(sessionId)) {
            boolean existed = sessionStore.get(sessionId).isPresent();
            sessionStore.delete(sessionId);
            if (existed) {
                log.info("Deleted session {}", sessionId);
                eventBus.publish(new PitchEvent(PitchEvent.SESSION_DELETED, sessionId, null, Map.of(), Instant.now()));
            }
            eventBus.forget(sessionId);
        }
    }

    private SessionLocks.Lease acquire(String sessionId) {
        try {
            return sessionLocks.tryAcquire(sessionId);
        } catch (SessionConflictException e) {
            metrics.recordSessionConflict();
            log.warn("Rejected concurrent operation on session {}", sessionId);
            throw e;
        }
    }

    private Session load(String sessionId) {
        return sessionStore.get(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    private Session runAndPersist(Session session, PitchState input, ResumeCommand command) {
        Session updated = run(session, input, command);
        sessionStore.put(session.id(), updated);
        recordTransition(session.phase(), updated);
        return updated;
    }

    private Session run(Session session, PitchState input, ResumeCommand command) {
        PitchState result;
        try {
            result = pitchGraph.run(session.id(), input, command);
        } catch (RuntimeException e) {
            Throwable cause = unwrap(e);
            log.error("Workflow run {} failed in phase {}: {}", command, session.phase(), cause.getMessage(), cause);
            if (cause instanceof WorkflowException we) {
                throw we;
            }
            throw new WorkflowExecutionException("Workflow run failed for session " + session.id(), cause);
        }
        return session.advance(result, Instant.now());
    }

    private void recordTransition(Phase before, Session updated) {
        PitchState result = updated.state();
        log.info("Session {} moved {} -> {} (auto {}, total {})", updated.id(), before, result.phase(),
                result.autoRefineCount(), result.totalIterationCount());
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("from", before.name());
        payload.put("autoRefineCount", result.autoRefineCount());
        payload.put("totalIterationCount", result.totalIterationCount());
        if (result.critique() != null) {
            payload.put("overallScore", result.critique().overall());
            payload.put("decision", result.critique().decision().name());
        }
        eventBus.publish(new PitchEvent(PitchEvent.SESSION_TRANSITIONED, updated.id(), result.phase().name(),
                payload, Instant.now()));
        if (result.phase().isTerminal()) {
            metrics.recordSessionOutcome(result.phase().name());
            metrics.recordIterationDepth(result.totalIterationCount());
        }
    }

    // LangGraph4j may surface node failures wrapped in CompletionException or RuntimeException.
    private static Throwable unwrap(Throwable e) {
        Throwable current = e;
        while ((current instanceof CompletionException || current.getClass() == RuntimeException.class)
                && current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current;
    }
}
