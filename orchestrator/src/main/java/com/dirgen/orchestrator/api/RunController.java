package com.dirgen.orchestrator.api;

import com.dirgen.orchestrator.api.dto.ApproveRequest;
import com.dirgen.orchestrator.api.dto.RunCreatedResponse;
import com.dirgen.orchestrator.api.dto.RunResponse;
import com.dirgen.orchestrator.model.GateKind;
import com.dirgen.orchestrator.model.ProtocolException;
import com.dirgen.orchestrator.service.RunWorkflowService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * REST API for the user side of a run.
 *
 * POST /run/from-input      : upload a requirements document, start a run
 * GET  /run                 : all runs, newest first
 * GET  /run/{id}            : current state of a run
 * POST /run/{id}/approve    : answer the pending approval gate
 * POST /run/{id}/cancel     : cooperative cancel
 */
@RestController
@RequestMapping("/run")
public class RunController {

    private final RunWorkflowService workflow;

    public RunController(RunWorkflowService workflow) {
        this.workflow = workflow;
    }

    /**
     * Example:
     *   curl -F "file=@requirements.md" http://localhost:8000/run/from-input
     */
    @PostMapping(value = "/from-input", consumes = "multipart/form-data")
    public ResponseEntity<RunCreatedResponse> submit(@RequestParam("file") MultipartFile file) throws IOException {
        if (file.isEmpty()) {
            throw new ProtocolException("Uploaded document is empty");
        }
        String document = new String(file.getBytes(), StandardCharsets.UTF_8);
        String runId = workflow.submit(file.getOriginalFilename(), document);
        String state = workflow.find(runId).state().name();
        return ResponseEntity.status(HttpStatus.CREATED).body(new RunCreatedResponse(runId, state));
    }

    @GetMapping
    public List<RunResponse> list() {
        return workflow.findAll().stream().map(RunResponse::from).toList();
    }

    /** 404 if the run id is unknown. */
    @GetMapping("/{runId}")
    public RunResponse get(@PathVariable String runId) {
        return RunResponse.from(workflow.find(runId));
    }

    /**
     * 409 if the run has no pending gate (or a different one than {@code gate}).
     */
    @PostMapping("/{runId}/approve")
    public RunResponse approve(@PathVariable String runId, @RequestBody ApproveRequest req) {
        if (req.approved() == null) {
            throw new ProtocolException("Field 'approved' is required");
        }
        GateKind expected = (req.gate() == null || req.gate().isBlank()) ? null : GateKind.fromWire(req.gate());
        return RunResponse.from(workflow.approve(runId, req.approved(), req.userResponse(), expected));
    }

    @PostMapping("/{runId}/cancel")
    public RunResponse cancel(@PathVariable String runId) {
        return RunResponse.from(workflow.cancel(runId));
    }
}
