package com.dirgen.orchestrator.api;

import com.dirgen.orchestrator.model.GateKind;
import com.dirgen.orchestrator.model.RunState;
import com.dirgen.orchestrator.model.RunView;
import com.dirgen.orchestrator.repository.RunNotFoundException;
import com.dirgen.orchestrator.service.InvalidStateException;
import com.dirgen.orchestrator.service.RunWorkflowService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Slice test for RunController: web layer only, the workflow is a mock.
 */
@WebMvcTest(RunController.class)
class RunControllerTest {

    static final String RUN = "run-123";

    @Autowired   MockMvc            mockMvc;
    @MockitoBean RunWorkflowService workflow;

    // ------------------------------------------------------------------
    // POST /run/from-input
    // ------------------------------------------------------------------

    @Test
    void submit_document_returns201WithRunId() throws Exception {
        when(workflow.submit(eq("requirements.md"), eq("# Build a todo app"))).thenReturn(RUN);
        when(workflow.find(RUN)).thenReturn(view(RunState.REQUIREMENTS_PROCESSING, null));

        mockMvc.perform(multipart("/run/from-input")
                        .file(new MockMultipartFile("file", "requirements.md", "text/markdown",
                                "# Build a todo app".getBytes())))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.runId").value(RUN))
                .andExpect(jsonPath("$.state").value("REQUIREMENTS_PROCESSING"));
    }

    @Test
    void submit_emptyFile_returns400() throws Exception {
        mockMvc.perform(multipart("/run/from-input")
                        .file(new MockMultipartFile("file", "empty.md", "text/markdown", new byte[0])))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("protocol_error"));

        verifyNoInteractions(workflow);
    }

    // ------------------------------------------------------------------
    // GET /run, GET /run/{id}
    // ------------------------------------------------------------------

    @Test
    void get_existingRun_returnsStateAndPendingGate() throws Exception {
        when(workflow.find(RUN)).thenReturn(view(RunState.DESIGN_WAITING_APPROVAL, GateKind.EXECUTE_PLAN));

        mockMvc.perform(get("/run/{id}", RUN))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("DESIGN_WAITING_APPROVAL"))
                .andExpect(jsonPath("$.pendingGate").value("execute-plan"))
                .andExpect(jsonPath("$.terminal").value(false))
                .andExpect(jsonPath("$.metadata.message").value("Design ready"));
    }

    @Test
    void get_unknownRun_returns404() throws Exception {
        when(workflow.find("nope")).thenThrow(new RunNotFoundException("nope"));

        mockMvc.perform(get("/run/{id}", "nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("not_found"));
    }

    @Test
    void list_returnsEveryRun() throws Exception {
        when(workflow.findAll()).thenReturn(List.of(
                view(RunState.CANCELLED, null),
                view(RunState.REQUIREMENTS_WAITING_APPROVAL, GateKind.START_DESIGN)));

        mockMvc.perform(get("/run"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].terminal").value(true))
                .andExpect(jsonPath("$[1].pendingGate").value("start-design"));
    }

    // ------------------------------------------------------------------
    // POST /run/{id}/approve
    // ------------------------------------------------------------------

    @Test
    void approve_withGate_passesDecodedGateToWorkflow() throws Exception {
        when(workflow.approve(RUN, true, "looks good", GateKind.START_DESIGN))
                .thenReturn(view(RunState.DESIGN_PROCESSING, null));

        mockMvc.perform(post("/run/{id}/approve", RUN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"approved":true,"userResponse":"looks good","gate":"start-design"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("DESIGN_PROCESSING"));
    }

    @Test
    void approve_withoutGate_passesNull() throws Exception {
        when(workflow.approve(eq(RUN), eq(false), isNull(), isNull()))
                .thenReturn(view(RunState.REQUIREMENTS_REJECTED, null));

        mockMvc.perform(post("/run/{id}/approve", RUN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"approved\":false}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("REQUIREMENTS_REJECTED"));

        verify(workflow).approve(RUN, false, null, null);
    }

    @Test
    void approve_missingDecision_returns400() throws Exception {
        mockMvc.perform(post("/run/{id}/approve", RUN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userResponse\":\"hm\"}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(workflow);
    }

    @Test
    void approve_unknownGate_returns400() throws Exception {
        mockMvc.perform(post("/run/{id}/approve", RUN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"approved\":true,\"gate\":\"deploy\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Unknown approval gate: 'deploy'"));
    }

    @Test
    void approve_noPendingGate_returns409() throws Exception {
        when(workflow.approve(anyString(), anyBoolean(), any(), any()))
                .thenThrow(new InvalidStateException("Run run-123 has no pending approval"));

        mockMvc.perform(post("/run/{id}/approve", RUN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"approved\":true}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("invalid_state"));
    }

    // ------------------------------------------------------------------
    // POST /run/{id}/cancel
    // ------------------------------------------------------------------

    @Test
    void cancel_returnsCancelledRun() throws Exception {
        when(workflow.cancel(RUN)).thenReturn(view(RunState.CANCELLED, null));

        mockMvc.perform(post("/run/{id}/cancel", RUN))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("CANCELLED"))
                .andExpect(jsonPath("$.terminal").value(true));
    }

    // ------------------------------------------------------------------

    private static RunView view(RunState state, GateKind gate) {
        Instant now = Instant.parse("2026-01-05T09:00:00Z");
        return new RunView(RUN, state, now, now, 0, 0, gate, Map.of("message", "Design ready"));
    }
}
