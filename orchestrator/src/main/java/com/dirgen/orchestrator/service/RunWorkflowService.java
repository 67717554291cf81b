package com.dirgen.orchestrator.service;

import com.dirgen.orchestrator.config.PipelineProperties;
import com.dirgen.orchestrator.events.EventBroadcaster;
import com.dirgen.orchestrator.fs.FilesystemGateway;
import com.dirgen.orchestrator.fs.SandboxViolationException;
import com.dirgen.orchestrator.model.*;
import com.dirgen.orchestrator.repository.RunRegistry;
import com.dirgen.orchestrator.worker.ProcessLaunchException;
import com.dirgen.orchestrator.worker.WorkerInvocation;
import com.dirgen.orchestrator.worker.WorkerSupervisor;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Drives every run through its state machine.
 *
 * Pipeline:
 *   requirements ──[start-design gate]──▶ design ──[execute-plan gate]──▶ validation [──▶ execution]
 *
 * Inputs come from three directions: the user (submit, approve, cancel), the
 * workers (task reports, validation results) and the supervisor (launch
 * failures, workers that exit non-zero without reporting). All of them run inside {@link RunRegistry#withRun}, so reports
 * for one run are applied one at a time and every transition, event and
 * launch for that run happens in order.
 *
 * Backtracking: an incomplete design or a failed validation re-launches the
 * design worker with accumulated feedback, at most {@code maxRetries} times
 * per run. The budget is shared by both paths and reset once validation passes.
 */
@Service
public class RunWorkflowService {

    private static final Logger log = LoggerFactory.getLogger(RunWorkflowService.class);

    public static final String META_USER_RESPONSE = "userResponse";

    private final RunRegistry        registry;
    private final WorkerSupervisor   supervisor;
    private final EventBroadcaster   events;
    private final FilesystemGateway  gateway;
    private final PipelineProperties props;
    private final Set<GateKind>      humanGates;
    private final Clock              clock;
    private final MeterRegistry      meterRegistry;

    public RunWorkflowService(RunRegistry registry,
                              WorkerSupervisor supervisor,
                              EventBroadcaster events,
                              FilesystemGateway gateway,
                              PipelineProperties props,
                              Clock clock,
                              MeterRegistry meterRegistry) {
        this.registry      = registry;
        this.supervisor    = supervisor;
        this.events        = events;
        this.gateway       = gateway;
        this.props         = props;
        this.humanGates    = props.humanGates();
        this.clock         = clock;
        this.meterRegistry = meterRegistry;
        supervisor.addExitListener(this::onWorkerExit);
    }

    // ------------------------------------------------------------------
    // Submission
    // ------------------------------------------------------------------

    /**
     * Accept a requirements document and start the pipeline.
     *
     * Steps:
     *  1. Store the document through the gateway as the requirements input
     *  2. Register a Run in INITIAL
     *  3. Move to REQUIREMENTS_PROCESSING and launch the requirements worker
     *
     * @return the new run id
     */
    public String submit(String filename, String document) {
        String runId     = "run-" + UUID.randomUUID();
        String inputPath = props.requirementsInputPath(runId);
        gateway.write(inputPath, document);

        Run run = new Run(runId, inputPath, clock.instant());
        registry.add(run);
        log.info("Run {} created from '{}' ({} chars)", runId, filename, document.length());

        registry.withRun(runId, r -> {
            transition(r, RunState.REQUIREMENTS_PROCESSING, "Input document received");
            launchStage(r, Stage.REQUIREMENTS, null);
            return null;
        });
        return runId;
    }

    public RunView find(String runId) {
        return registry.withRun(runId, Run::snapshot);
    }

    public List<RunView> findAll() {
        return registry.findAll();
    }

    // ------------------------------------------------------------------
    // Worker reports
    // ------------------------------------------------------------------

    /**
     * Apply a worker's completion report.
     *
     * @return false if the run already finished and the report was ignored
     * @throws InvalidStateException if the run is not currently running {@code stage}
     */
    public boolean reportStageOutcome(String runId, Stage stage, StageStatus status,
                                      String reason, String summary) {
        return registry.withRun(runId, run -> {
            try (MDC.MDCCloseable ignored = MDC.putCloseable("stage", stage.wireName())) {
                if (isFinished(run)) {
                    log.info("Ignoring {} report ({}) for finished run {} in {}",
                            stage.wireName(), status.wireName(), runId, run.getState());
                    return false;
                }
                RunState expected = processingStateOf(stage);
                if (run.getState() != expected) {
                    throw new InvalidStateException("Run %s is in %s; a %s report is only accepted in %s"
                            .formatted(runId, run.getState(), stage.wireName(), expected));
                }
                log.info("Run {} {} reported {}{}", runId, stage.wireName(), status.wireName(),
                        reason == null ? "" : ": " + reason);

                switch (stage) {
                    case REQUIREMENTS -> onRequirementsOutcome(run, status, reason, summary);
                    case DESIGN       -> onDesignOutcome(run, status, reason, summary);
                    case VALIDATION   -> onValidationResult(run, status == StageStatus.SUCCESS,
                                                            reason == null ? status.wireName() : reason);
                    case EXECUTION    -> onExecutionOutcome(run, status, reason);
                }
                return true;
            }
        });
    }

    /**
     * Apply the validator's verdict.
     *
     * @return false if the run already finished and the result was ignored
     */
    public boolean reportValidation(String runId, boolean success, String message) {
        return registry.withRun(runId, run -> {
            if (isFinished(run)) {
                log.info("Ignoring validation result for finished run {} in {}", runId, run.getState());
                return false;
            }
            if (run.getState() != RunState.VALIDATION_PROCESSING) {
                throw new InvalidStateException("Run %s is in %s; validation results are only accepted in %s"
                        .formatted(runId, run.getState(), RunState.VALIDATION_PROCESSING));
            }
            onValidationResult(run, success, message);
            return true;
        });
    }

    /**
     * A worker exited with {@code exitCode != 0}. If the run is still waiting for
     * that stage's report, none will come: the stage fails as if it never started.
     */
    private void onWorkerExit(String runId, Stage stage, int exitCode) {
        registry.withRun(runId, run -> {
            if (isFinished(run) || run.getState() != processingStateOf(stage)) {
                log.debug("Run {} in {}; {} worker exit code {} needs no action",
                        runId, run.getState(), stage.wireName(), exitCode);
                return null;
            }
            String why = "%s worker exited with code %d before reporting".formatted(stage.displayName(), exitCode);
            log.error("Run {}: {}", runId, why);
            failStage(run, stage, why);
            return null;
        });
    }

    /**
     * Forward a free-form worker message (thought, action, info...) to the
     * run's subscriber. Nothing is forwarded once the run was cancelled.
     */
    public void forwardWorkerMessage(String runId, BroadcastMessage message) {
        registry.withRun(runId, run -> {
            if (run.getState() != RunState.CANCELLED) {
                events.publish(runId, message);
            }
            return null;
        });
    }

    // ------------------------------------------------------------------
    // User decisions
    // ------------------------------------------------------------------

    /**
     * Approve or reject the run's open gate.
     *
     * @param expected the gate the caller means to answer, or null for "whichever is open"
     * @throws InvalidStateException if no gate is open or a different one is
     */
    public RunView approve(String runId, boolean approved, String userResponse, GateKind expected) {
        return registry.withRun(runId, run -> {
            ApprovalGate gate = run.getApprovalGate().orElseThrow(() -> new InvalidStateException(
                    "Run %s has no pending approval (state %s)".formatted(runId, run.getState())));
            GateKind kind = gate.kind();
            if (expected != null && expected != kind) {
                throw new InvalidStateException("Run %s is waiting for '%s', not '%s'"
                        .formatted(runId, kind.wireName(), expected.wireName()));
            }

            run.consumeGate();
            run.putMetadata(META_USER_RESPONSE, userResponse);
            Map<String, Object> decision = new LinkedHashMap<>();
            decision.put("gate", kind.wireName());
            decision.put("userResponse", userResponse == null ? "" : userResponse);

            Stage gated = gatedStage(kind);
            if (approved) {
                publish(run, EventType.APPROVAL_GRANTED, decision);
                publish(run, EventType.STAGE_END, Map.of("stage", gated.wireName(), "status", "APPROVED"));
                transition(run, kind.approvedState(), "Approved by user");
                continueAfter(run, kind);
            } else {
                String reason = "Rejected by user" + (isBlank(userResponse) ? "" : ": " + userResponse);
                publish(run, EventType.APPROVAL_REJECTED, decision);
                publish(run, EventType.STAGE_END,
                        Map.of("stage", gated.wireName(), "status", "REJECTED", "reason", reason));
                transition(run, kind.rejectedState(), reason);
            }
            return run.snapshot();
        });
    }

    /**
     * Cooperative cancel: the run moves to CANCELLED and later reports are
     * ignored. Workers already running are left alone.
     */
    public RunView cancel(String runId) {
        return registry.withRun(runId, run -> {
            if (run.getState() == RunState.CANCELLED) {
                return run.snapshot();
            }
            if (isFinished(run)) {
                throw new InvalidStateException("Run %s already finished in %s".formatted(runId, run.getState()));
            }
            transition(run, RunState.CANCELLED, "Cancelled by user");
            return run.snapshot();
        });
    }

    // ------------------------------------------------------------------
    // Stage outcomes
    // ------------------------------------------------------------------

    private void onRequirementsOutcome(Run run, StageStatus status, String reason, String summary) {
        if (status == StageStatus.SUCCESS) {
            publishSummary(run, Stage.REQUIREMENTS, summary);
            reachGate(run, GateKind.START_DESIGN, "Requirements analysis complete");
            return;
        }
        String why = describe(Stage.REQUIREMENTS, status, reason);
        run.putMetadata(Run.META_LAST_ERROR, why);
        publish(run, EventType.STAGE_END, Map.of("stage", Stage.REQUIREMENTS.wireName(), "status", "REJECTED", "reason", why));
        transition(run, RunState.REQUIREMENTS_REJECTED, why);
    }

    private void onDesignOutcome(Run run, StageStatus status, String reason, String summary) {
        switch (status) {
            case SUCCESS -> {
                publishSummary(run, Stage.DESIGN, summary);
                reachGate(run, GateKind.EXECUTE_PLAN, "Design plan complete");
            }
            case INCOMPLETE -> retryDesign(run, describe(Stage.DESIGN, status, reason));
            case FAILED, IMPOSSIBLE -> {
                String why = describe(Stage.DESIGN, status, reason);
                run.putMetadata(Run.META_LAST_ERROR, why);
                run.discardRetryRecord();
                publish(run, EventType.STAGE_END, Map.of("stage", Stage.DESIGN.wireName(), "status", "REJECTED", "reason", why));
                transition(run, RunState.DESIGN_REJECTED, why);
            }
        }
    }

    private void onValidationResult(Run run, boolean success, String message) {
        String text = message == null ? "" : message;
        publish(run, EventType.VALIDATION_RESULT, Map.of("success", success, "message", text));
        if (!success) {
            transition(run, RunState.VALIDATION_FAILED, "Validation failed: " + text);
            retryDesign(run, "Validation failed: " + text);
            return;
        }

        run.discardRetryRecord();
        run.putMetadata(Run.META_LAST_ERROR, null);
        transition(run, RunState.VALIDATION_PASSED, "Validation passed");
        if (props.executionStageEnabled()) {
            transition(run, RunState.EXECUTION_PROCESSING, "Plan execution started");
            launchStage(run, Stage.EXECUTION, null);
        } else {
            publish(run, EventType.RUN_COMPLETED, Map.of("state", run.getState().name()));
            supervisor.release(run.getId());
        }
    }

    private void onExecutionOutcome(Run run, StageStatus status, String reason) {
        if (status == StageStatus.SUCCESS) {
            transition(run, RunState.EXECUTION_COMPLETED, "Plan executed");
            publish(run, EventType.RUN_COMPLETED, Map.of("state", run.getState().name()));
        } else {
            String why = describe(Stage.EXECUTION, status, reason);
            run.putMetadata(Run.META_LAST_ERROR, why);
            transition(run, RunState.EXECUTION_FAILED, why);
        }
    }

    // ------------------------------------------------------------------
    // Retry
    // ------------------------------------------------------------------

    /**
     * Take one retry from the run's budget and re-launch the design worker
     * with feedback, or reject the design if the budget is spent.
     * Called only from DESIGN_PROCESSING or VALIDATION_FAILED.
     */
    private void retryDesign(Run run, String reason) {
        run.putMetadata(Run.META_LAST_ERROR, reason);
        RetryRecord record = run.retryRecord(props.maxRetries());

        if (!record.recordFailure(reason)) {
            String why = "Design rejected after exhausting %d retries. Last error: %s"
                    .formatted(record.maxRetries(), reason);
            log.error("Run {}: {}", run.getId(), why);
            publish(run, EventType.ERROR, Map.of("message", why));
            transition(run, RunState.DESIGN_REJECTED, why);
            return;
        }

        String feedback = record.feedback();
        run.incrementRetryCount();
        log.warn("Run {} retrying design ({}/{}): {}", run.getId(), record.attempts(), record.maxRetries(), reason);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("attempt",     record.attempts());
        data.put("maxAttempts", record.maxRetries());
        data.put("reason",      reason);
        data.put("feedback",    feedback);
        publish(run, EventType.RETRY_ATTEMPT, data);

        transition(run, RunState.DESIGN_PROCESSING,
                "Retrying design (attempt %d/%d)".formatted(record.attempts(), record.maxRetries()));
        launchStage(run, Stage.DESIGN, feedback);
    }

    // ------------------------------------------------------------------
    // Gates
    // ------------------------------------------------------------------

    /** Enter the gate's waiting state; either ask the user or pass it straight through. */
    private void reachGate(Run run, GateKind kind, String reason) {
        transition(run, kind.waitingState(), reason);
        if (humanGates.contains(kind)) {
            run.openGate(kind, clock.instant());
            publish(run, EventType.APPROVAL_REQUEST, Map.of(
                    "gate",   kind.wireName(),
                    "stage",  gatedStage(kind).wireName(),
                    "prompt", kind.prompt()));
            return;
        }
        log.info("Run {} gate '{}' passes automatically", run.getId(), kind.wireName());
        publish(run, EventType.STAGE_END, Map.of("stage", gatedStage(kind).wireName(), "status", "APPROVED"));
        transition(run, kind.approvedState(), "Approved automatically");
        continueAfter(run, kind);
    }

    private void continueAfter(Run run, GateKind kind) {
        switch (kind) {
            case START_DESIGN -> {
                transition(run, RunState.DESIGN_PROCESSING, "Design planning started");
                launchStage(run, Stage.DESIGN, null);
            }
            case EXECUTE_PLAN -> {
                transition(run, RunState.VALIDATION_PROCESSING, "Design validation started");
                publish(run, EventType.VALIDATION_START, Map.of("stage", Stage.VALIDATION.wireName()));
                launchStage(run, Stage.VALIDATION, null);
            }
        }
    }

    private static Stage gatedStage(GateKind kind) {
        return switch (kind) {
            case START_DESIGN -> Stage.REQUIREMENTS;
            case EXECUTE_PLAN -> Stage.DESIGN;
        };
    }

    // ------------------------------------------------------------------
    // Launching
    // ------------------------------------------------------------------

    /**
     * Launch the worker for {@code stage}. A launch that fails, including one
     * whose input artifact is missing, fails the stage at once.
     */
    private void launchStage(Run run, Stage stage, String feedback) {
        publish(run, EventType.STAGE_START, Map.of("stage", stage.wireName(), "name", stage.displayName()));
        String input = stage == Stage.REQUIREMENTS ? run.getInputPath() : props.designInputPath(run.getId());
        try {
            if (!gateway.exists(input)) {
                throw new ProcessLaunchException("Input artifact for %s not found: %s"
                        .formatted(stage.displayName(), input));
            }
            Path inputPath = gateway.resolve(input);
            WorkerInvocation invocation = supervisor.launch(run.getId(), stage, inputPath, feedback);
            publish(run, EventType.INFO, Map.of(
                    "message", "%s worker started (pid %d)".formatted(stage.displayName(), invocation.pid()),
                    "pid",     invocation.pid()));
        } catch (ProcessLaunchException | SandboxViolationException e) {
            log.error("Run {}: could not launch {} worker: {}", run.getId(), stage.wireName(), e.getMessage());
            onLaunchFailure(run, stage, e.getMessage());
        }
    }

    private void onLaunchFailure(Run run, Stage stage, String message) {
        failStage(run, stage, "Could not start %s: %s".formatted(stage.displayName(), message));
    }

    /** The stage's worker will never report: end the stage without a retry. */
    private void failStage(Run run, Stage stage, String why) {
        run.putMetadata(Run.META_LAST_ERROR, why);
        publish(run, EventType.ERROR, Map.of("message", why));
        switch (stage) {
            case REQUIREMENTS -> transition(run, RunState.REQUIREMENTS_REJECTED, why);
            case DESIGN       -> transition(run, RunState.DESIGN_REJECTED, why);
            case VALIDATION   -> {
                transition(run, RunState.VALIDATION_FAILED, why);
                transition(run, RunState.DESIGN_REJECTED, why);
            }
            case EXECUTION    -> transition(run, RunState.EXECUTION_FAILED, why);
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /** Apply one edge: log it, count it, broadcast it, clean up on terminal states. */
    private void transition(Run run, RunState next, String reason) {
        RunState from = run.getState();
        run.transitionTo(next, clock.instant());
        run.putMetadata(Run.META_MESSAGE, reason);
        log.info("Run {} {} -> {} ({})", run.getId(), from, next, reason);
        meterRegistry.counter("dirgen.runs.transitions", "to", next.name()).increment();

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("from",   from.name());
        data.put("to",     next.name());
        data.put("reason", reason == null ? "" : reason);
        publish(run, EventType.STATE_TRANSITION, data);

        if (next.isTerminal()) {
            run.consumeGate();
            run.discardRetryRecord();
            supervisor.release(run.getId());
        }
    }

    private void publishSummary(Run run, Stage stage, String summary) {
        if (!isBlank(summary)) {
            publish(run, EventType.EXECUTIVE_SUMMARY, Map.of("summary", summary, "agentRole", stage.wireName()));
        }
    }

    private void publish(Run run, EventType type, Map<String, Object> data) {
        events.publish(run.getId(), type, data);
    }

    /** Terminal, or at the end of the pipeline when there is no execution stage. */
    private boolean isFinished(Run run) {
        return run.getState().isTerminal()
            || (run.getState() == RunState.VALIDATION_PASSED && !props.executionStageEnabled());
    }

    private static RunState processingStateOf(Stage stage) {
        return switch (stage) {
            case REQUIREMENTS -> RunState.REQUIREMENTS_PROCESSING;
            case DESIGN       -> RunState.DESIGN_PROCESSING;
            case VALIDATION   -> RunState.VALIDATION_PROCESSING;
            case EXECUTION    -> RunState.EXECUTION_PROCESSING;
        };
    }

    private static String describe(Stage stage, StageStatus status, String reason) {
        String base = "%s reported '%s'".formatted(stage.displayName(), status.wireName());
        return isBlank(reason) ? base : base + ": " + reason;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
