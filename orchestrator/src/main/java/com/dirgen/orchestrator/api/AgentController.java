package com.dirgen.orchestrator.api;

import com.dirgen.orchestrator.api.dto.AckResponse;
import com.dirgen.orchestrator.api.dto.AgentReportRequest;
import com.dirgen.orchestrator.api.dto.TaskCompleteRequest;
import com.dirgen.orchestrator.api.dto.ValidationResultRequest;
import com.dirgen.orchestrator.model.ProtocolException;
import com.dirgen.orchestrator.model.Stage;
import com.dirgen.orchestrator.model.StageStatus;
import com.dirgen.orchestrator.service.RunWorkflowService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.web.bind.annotation.*;

/**
 * Ingress for worker processes.
 *
 * POST /agent/{id}/report             : progress message, forwarded to the run's subscriber
 * POST /agent/{id}/task_complete      : stage completion report
 * POST /agent/{id}/validation_result  : validator verdict
 *
 * Wire strings (role, status) are decoded here; anything malformed is a 400
 * and leaves the run untouched.
 */
@RestController
@RequestMapping("/agent/{runId}")
public class AgentController {

    private final RunWorkflowService workflow;
    private final ObjectMapper       objectMapper;

    public AgentController(RunWorkflowService workflow, ObjectMapper objectMapper) {
        this.workflow     = workflow;
        this.objectMapper = objectMapper;
    }

    @PostMapping("/report")
    public AckResponse report(@PathVariable String runId, @RequestBody AgentReportRequest req) {
        workflow.forwardWorkerMessage(runId, req.toMessage(objectMapper));
        return AckResponse.of(true, runId);
    }

    @PostMapping("/task_complete")
    public AckResponse taskComplete(@PathVariable String runId, @RequestBody TaskCompleteRequest req) {
        Stage       stage  = Stage.fromWire(req.role());
        StageStatus status = StageStatus.fromWire(req.status());
        boolean applied = workflow.reportStageOutcome(runId, stage, status, req.reason(), req.summary());
        return AckResponse.of(applied, runId);
    }

    @PostMapping("/validation_result")
    public AckResponse validationResult(@PathVariable String runId, @RequestBody ValidationResultRequest req) {
        if (req.success() == null) {
            throw new ProtocolException("Field 'success' is required");
        }
        boolean applied = workflow.reportValidation(runId, req.success(), req.message());
        return AckResponse.of(applied, runId);
    }
}
