package com.pitchcraft.dispatch.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pitchcraft.core.engine.WorkflowEngine;
import com.pitchcraft.core.engine.WorkflowExecutionException;
import com.pitchcraft.core.model.Phase;
import com.pitchcraft.core.model.Session;
import com.pitchcraft.core.parsing.FinalPackageParser;
import com.pitchcraft.core.session.SessionConflictException;
import com.pitchcraft.core.session.SessionNotFoundException;
import com.pitchcraft.core.workflow.InvalidTransitionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;

import static com.pitchcraft.core.model.PitchFixtures.DESCRIPTION;
import static com.pitchcraft.core.model.PitchFixtures.awaiting;
import static com.pitchcraft.core.model.PitchFixtures.session;
import static org.hamcrest.Matchers.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(WorkflowController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class WorkflowControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockitoBean
    private WorkflowEngine workflowEngine;

    @MockitoBean
    private SessionEventStreamService eventStreams;

    private static Session doneSession() {
        var state = awaiting().withPhase(Phase.DONE)
                .withFinalPackage(FinalPackageParser.fallback("Home-cooked dinners from your street.", false));
        return session("s-1", state);
    }

    // ── POST /api/v1/pitches ─────────────────────────────────────────

    @Test
    @DisplayName("POST /pitches returns 201 with the session snapshot")
    void startSession() throws Exception {
        when(workflowEngine.start(DESCRIPTION)).thenReturn(session("s-1", awaiting()));

        mockMvc.perform(post("/api/v1/pitches")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new PitchRequest(DESCRIPTION))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.session_id").value("s-1"))
                .andExpect(jsonPath("$.phase").value("AWAITING_APPROVAL"))
                .andExpect(jsonPath("$.decision").value("PASS"))
                .andExpect(jsonPath("$.critique.overall_score").value(8.0))
                .andExpect(jsonPath("$.total_iteration_count").value(0))
                .andExpect(jsonPath("$.final_package").doesNotExist());
    }

    @Test
    @DisplayName("POST /pitches without a description returns 400")
    void startWithoutDescription() throws Exception {
        mockMvc.perform(post("/api/v1/pitches")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"description\": \"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("description is required"));
        verifyNoInteractions(workflowEngine);
    }

    // ── POST /api/v1/pitches/{id}/approval ───────────────────────────

    @Test
    @DisplayName("approval returns the finished snapshot with its package")
    void approve() throws Exception {
        when(workflowEngine.submitApproval("s-1", true, null)).thenReturn(doneSession());

        mockMvc.perform(post("/api/v1/pitches/s-1/approval")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new ApprovalRequest(true, null))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.phase").value("DONE"))
                .andExpect(jsonPath("$.final_package.elevator_pitch").value("Home-cooked dinners from your street."))
                .andExpect(jsonPath("$.final_package.capped").value(false));
    }

    @Test
    @DisplayName("rejection passes the feedback through")
    void reject() throws Exception {
        when(workflowEngine.submitApproval("s-1", false, "More numbers")).thenReturn(session("s-1", awaiting()));

        mockMvc.perform(post("/api/v1/pitches/s-1/approval")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"approved\": false, \"feedback\": \"More numbers\"}"))
                .andExpect(status().isOk());
        verify(workflowEngine).submitApproval("s-1", false, "More numbers");
    }

    @Test
    @DisplayName("approval without the approved flag returns 400")
    void approvalWithoutFlag() throws Exception {
        mockMvc.perform(post("/api/v1/pitches/s-1/approval")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"feedback\": \"hm\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("approval in the wrong phase returns 400")
    void approvalWrongPhase() throws Exception {
        when(workflowEngine.submitApproval(eq("s-1"), anyBoolean(), any()))
                .thenThrow(new InvalidTransitionException("Session s-1 is in phase DONE"));

        mockMvc.perform(post("/api/v1/pitches/s-1/approval")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"approved\": true}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", containsString("DONE")));
    }

    @Test
    @DisplayName("a busy session returns 409 marked retryable")
    void busySession() throws Exception {
        when(workflowEngine.submitApproval(eq("s-1"), anyBoolean(), any()))
                .thenThrow(new SessionConflictException("s-1"));

        mockMvc.perform(post("/api/v1/pitches/s-1/approval")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"approved\": true}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.retryable").value(true));
    }

    @Test
    @DisplayName("a failed run returns 500")
    void failedRun() throws Exception {
        when(workflowEngine.submitApproval(eq("s-1"), anyBoolean(), any()))
                .thenThrow(new WorkflowExecutionException("Workflow run failed for session s-1",
                        new IllegalStateException("boom")));

        mockMvc.perform(post("/api/v1/pitches/s-1/approval")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"approved\": true}"))
                .andExpect(status().isInternalServerError());
    }

    // ── GET ───────────────────────────────────────────────────────────

    @Test
    @DisplayName("GET /pitches/{id} returns 404 for an unknown session")
    void statusUnknown() throws Exception {
        when(workflowEngine.status("missing")).thenThrow(new SessionNotFoundException("missing"));

        mockMvc.perform(get("/api/v1/pitches/missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error", containsString("missing")));
    }

    @Test
    @DisplayName("GET /pitches/{id}/final returns the package with its metadata")
    void finalPackage() throws Exception {
        Session done = doneSession();
        when(workflowEngine.finalPackage("s-1")).thenReturn(done.state().finalPackage());
        when(workflowEngine.status("s-1")).thenReturn(done);

        mockMvc.perform(get("/api/v1/pitches/s-1/final"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.phase").value("DONE"))
                .andExpect(jsonPath("$.overall_score").value(8.0))
                .andExpect(jsonPath("$.final_package.executive_summary").value("Home-cooked dinners from your street."));
    }

    @Test
    @DisplayName("GET /pitches/{id}/final before completion returns 400")
    void finalPackageNotReady() throws Exception {
        when(workflowEngine.finalPackage("s-1")).thenThrow(new InvalidTransitionException("not ready"));

        mockMvc.perform(get("/api/v1/pitches/s-1/final"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("GET /pitches lists session summaries")
    void listSessions() throws Exception {
        when(workflowEngine.list()).thenReturn(List.of(session("s-1", awaiting()), doneSession()));

        mockMvc.perform(get("/api/v1/pitches"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].session_id").value("s-1"))
                .andExpect(jsonPath("$[1].phase").value("DONE"));
    }

    // ── GET /api/v1/pitches/{id}/events ──────────────────────────────

    @Test
    @DisplayName("GET /pitches/{id}/events returns 404 for an unknown session")
    void eventsNotFound() throws Exception {
        when(workflowEngine.status("missing")).thenThrow(new SessionNotFoundException("missing"));

        mockMvc.perform(get("/api/v1/pitches/missing/events"))
                .andExpect(status().isNotFound());
        verifyNoInteractions(eventStreams);
    }

    @Test
    @DisplayName("GET /pitches/{id}/events opens a stream for a known session")
    void eventsStream() throws Exception {
        Session session = session("s-1", awaiting());
        when(workflowEngine.status("s-1")).thenReturn(session);
        when(eventStreams.open(session)).thenReturn(new SseEmitter(0L));

        mockMvc.perform(get("/api/v1/pitches/s-1/events"))
                .andExpect(status().isOk())
                .andExpect(request().asyncStarted());
        verify(eventStreams).open(session);
    }

    // ── DELETE ────────────────────────────────────────────────────────

    @Test
    @DisplayName("DELETE /pitches/{id} returns 200 even for unknown ids")
    void deleteSession() throws Exception {
        mockMvc.perform(delete("/api/v1/pitches/anything"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deleted").value("anything"));
        verify(workflowEngine).delete("anything");
    }
}
