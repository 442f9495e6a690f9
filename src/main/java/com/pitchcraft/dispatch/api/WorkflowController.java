package com.pitchcraft.dispatch.api;

import com.pitchcraft.core.engine.WorkflowEngine;
import com.pitchcraft.core.engine.WorkflowExecutionException;
import com.pitchcraft.core.model.FinalPackage;
import com.pitchcraft.core.model.Session;
import com.pitchcraft.core.session.SessionConflictException;
import com.pitchcraft.core.session.SessionNotFoundException;
import com.pitchcraft.core.workflow.InvalidTransitionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * REST controller for pitch session lifecycle operations.
 * <p>
 * Calls are synchronous: each returns once the session reaches its next human
 * checkpoint or terminal phase.
 */
@RestController
@RequestMapping("/api/v1/pitches")
public class WorkflowController {

    private static final Logger log = LoggerFactory.getLogger(WorkflowController.class);

    private final WorkflowEngine workflowEngine;
    private final SessionEventStreamService eventStreams;

    public WorkflowController(WorkflowEngine workflowEngine, SessionEventStreamService eventStreams) {
        this.workflowEngine = workflowEngine;
        this.eventStreams = eventStreams;
    }

    /**
     * POST /api/v1/pitches. Starts a session and runs it to the first approval checkpoint.
     */
    @PostMapping
    public ResponseEntity<?> start(@RequestBody(required = false) PitchRequest request) {
        if (request == null || request.description() == null || request.description().isBlank()) {
            return error(HttpStatus.BAD_REQUEST, "description is required");
        }
        return handle(() -> {
            Session session = workflowEngine.start(request.description());
            return ResponseEntity.status(HttpStatus.CREATED).body(PitchResponse.from(session));
        });
    }

    /**
     * POST /api/v1/pitches/{id}/approval. Approves or rejects the current draft.
     */
    @PostMapping("/{id}/approval")
    public ResponseEntity<?> approval(@PathVariable String id,
                                      @RequestBody(required = false) ApprovalRequest request) {
        if (request == null || request.approved() == null) {
            return error(HttpStatus.BAD_REQUEST, "approved is required");
        }
        return handle(() -> ResponseEntity.ok(PitchResponse.from(
                workflowEngine.submitApproval(id, request.approved(), request.feedback()))));
    }

    @GetMapping("/{id}")
    public ResponseEntity<?> status(@PathVariable String id) {
        return handle(() -> ResponseEntity.ok(PitchResponse.from(workflowEngine.status(id))));
    }

    @GetMapping("/{id}/final")
    public ResponseEntity<?> finalPackage(@PathVariable String id) {
        return handle(() -> {
            FinalPackage pkg = workflowEngine.finalPackage(id);
            return ResponseEntity.ok(FinalPackageResponse.from(workflowEngine.status(id), pkg));
        });
    }

    /**
     * GET /api/v1/pitches/{id}/events. Server-sent events for one session.
     */
    @GetMapping("/{id}/events")
    public ResponseEntity<?> events(@PathVariable String id) {
        Session session;
        try {
            session = workflowEngine.status(id);
        } catch (SessionNotFoundException e) {
            return error(HttpStatus.NOT_FOUND, e.getMessage());
        }
        return ResponseEntity.ok(eventStreams.open(session));
    }

    @GetMapping
    public ResponseEntity<List<SessionSummary>> list() {
        return ResponseEntity.ok(workflowEngine.list().stream()
                .map(SessionSummary::from)
                .toList());
    }

    /**
     * DELETE /api/v1/pitches/{id}. Idempotent: unknown ids also return 200.
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<?> delete(@PathVariable String id) {
        return handle(() -> {
            workflowEngine.delete(id);
            return ResponseEntity.ok(Map.of("deleted", id));
        });
    }

    private ResponseEntity<?> handle(Supplier<ResponseEntity<?>> action) {
        try {
            return action.get();
        } catch (SessionNotFoundException e) {
            return error(HttpStatus.NOT_FOUND, e.getMessage());
        } catch (InvalidTransitionException | IllegalArgumentException e) {
            return error(HttpStatus.BAD_REQUEST, e.getMessage());
        } catch (SessionConflictException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(Map.of("error", e.getMessage(), "retryable", true));
        } catch (WorkflowExecutionException e) {
            log.error("Workflow execution failed: {}", e.getMessage(), e);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
        }
    }

    private static ResponseEntity<?> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of("error", message != null ? message : status.getReasonPhrase()));
    }
}
