package com.dirgen.orchestrator.service;

import com.dirgen.orchestrator.config.PipelineProperties;
import com.dirgen.orchestrator.events.EventBroadcaster;
import com.dirgen.orchestrator.fs.FilesystemGateway;
import com.dirgen.orchestrator.model.*;
import com.dirgen.orchestrator.repository.RunNotFoundException;
import com.dirgen.orchestrator.repository.RunRegistry;
import com.dirgen.orchestrator.worker.ProcessLaunchException;
import com.dirgen.orchestrator.worker.WorkerExitListener;
import com.dirgen.orchestrator.worker.WorkerInvocation;
import com.dirgen.orchestrator.worker.WorkerSupervisor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

/**
 * Unit tests for RunWorkflowService.
 *
 * The registry and the filesystem gateway are real (on a temp dir); worker
 * launches and event delivery are mocked. No Spring context.
 */
@ExtendWith(MockitoExtension.class)
class RunWorkflowServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);

    @Mock WorkerSupervisor supervisor;
    @Mock EventBroadcaster events;

    @TempDir Path sandbox;

    FilesystemGateway   gateway;
    RunRegistry         registry;
    SimpleMeterRegistry meters;
    RunWorkflowService  service;

    @BeforeEach
    void setUp() {
        gateway  = new FilesystemGateway(sandbox);
        registry = new RunRegistry();
        meters   = new SimpleMeterRegistry();
        lenient().when(supervisor.launch(anyString(), any(), any(), any()))
                .thenAnswer(inv -> new WorkerInvocation(inv.getArgument(0), inv.getArgument(1),
                        4242L, CLOCK.instant(), null));
        service = newService(List.of("start-design", "execute-plan"), false);
    }

    private RunWorkflowService newService(List<String> gates, boolean executionEnabled) {
        PipelineProperties props = new PipelineProperties(
                sandbox.toString(), "temp", "_pcce.yml", 3, gates, executionEnabled);
        return new RunWorkflowService(registry, supervisor, events, gateway, props, CLOCK, meters);
    }

    // ------------------------------------------------------------------
    // End-to-end
    // ------------------------------------------------------------------

    @Test
    void fullPipeline_withDesignRetriesAndOneValidationFailure_endsValidationPassed() {
        String runId = service.submit("requirements.md", "A todo app with users");
        assertThat(state(runId)).isEqualTo(RunState.REQUIREMENTS_PROCESSING);
        verify(supervisor).launch(eq(runId), eq(Stage.REQUIREMENTS),
                eq(gateway.resolve("temp/" + runId + "_input.md")), isNull());

        // requirements worker writes the structured input and reports success
        writeDesignInput(runId);
        service.reportStageOutcome(runId, Stage.REQUIREMENTS, StageStatus.SUCCESS, null, "Two actors, five use cases");
        RunView waiting = service.find(runId);
        assertThat(waiting.state()).isEqualTo(RunState.REQUIREMENTS_WAITING_APPROVAL);
        assertThat(waiting.openGate()).isEqualTo(GateKind.START_DESIGN);
        verify(events).publish(eq(runId), eq(EventType.EXECUTIVE_SUMMARY), any());

        service.approve(runId, true, "looks good", null);
        assertThat(state(runId)).isEqualTo(RunState.DESIGN_PROCESSING);

        service.reportStageOutcome(runId, Stage.DESIGN, StageStatus.INCOMPLETE, "missing diagram", null);
        service.reportStageOutcome(runId, Stage.DESIGN, StageStatus.INCOMPLETE, "bad yaml", null);
        verify(supervisor).launch(eq(runId), eq(Stage.DESIGN), any(),
                eq("Attempt 2/3. Error: Design Planning reported 'incomplete': bad yaml"
                   + " Previous errors: Design Planning reported 'incomplete': missing diagram"));

        service.reportStageOutcome(runId, Stage.DESIGN, StageStatus.SUCCESS, null, null);
        RunView designDone = service.find(runId);
        assertThat(designDone.state()).isEqualTo(RunState.DESIGN_WAITING_APPROVAL);
        assertThat(designDone.activeRetries()).isEqualTo(2);
        assertThat(designDone.retryCount()).isEqualTo(2);

        service.approve(runId, true, "", GateKind.EXECUTE_PLAN);
        assertThat(state(runId)).isEqualTo(RunState.VALIDATION_PROCESSING);

        service.reportValidation(runId, false, "design/architecture.puml not found");
        assertThat(state(runId)).isEqualTo(RunState.DESIGN_PROCESSING);
        assertThat(service.find(runId).activeRetries()).isEqualTo(3);

        service.reportStageOutcome(runId, Stage.DESIGN, StageStatus.SUCCESS, null, null);
        service.approve(runId, true, "", null);
        service.reportValidation(runId, true, "All artifacts present");

        RunView done = service.find(runId);
        assertThat(done.state()).isEqualTo(RunState.VALIDATION_PASSED);
        assertThat(done.activeRetries()).isZero();
        assertThat(done.openGate()).isNull();
        verify(events).publish(eq(runId), eq(EventType.RUN_COMPLETED), any());

        assertThat(transitionTargets(runId)).containsSubsequence(
                "REQUIREMENTS_PROCESSING", "REQUIREMENTS_WAITING_APPROVAL", "REQUIREMENTS_APPROVED",
                "DESIGN_PROCESSING", "DESIGN_PROCESSING", "DESIGN_PROCESSING", "DESIGN_WAITING_APPROVAL",
                "DESIGN_APPROVED", "VALIDATION_PROCESSING", "VALIDATION_FAILED", "DESIGN_PROCESSING",
                "DESIGN_WAITING_APPROVAL", "DESIGN_APPROVED", "VALIDATION_PROCESSING", "VALIDATION_PASSED");
        assertThat(meters.counter("dirgen.runs.transitions", "to", "VALIDATION_PASSED").count()).isEqualTo(1.0);
    }

    // ------------------------------------------------------------------
    // Retry budget
    // ------------------------------------------------------------------

    @Test
    void designIncomplete_beyondMaxRetries_rejectsDesign() {
        String runId = runInDesign();

        for (int i = 1; i <= 3; i++) {
            service.reportStageOutcome(runId, Stage.DESIGN, StageStatus.INCOMPLETE, "try " + i, null);
            assertThat(state(runId)).isEqualTo(RunState.DESIGN_PROCESSING);
            assertThat(service.find(runId).activeRetries()).isEqualTo(i);
        }
        service.reportStageOutcome(runId, Stage.DESIGN, StageStatus.INCOMPLETE, "try 4", null);

        RunView view = service.find(runId);
        assertThat(view.state()).isEqualTo(RunState.DESIGN_REJECTED);
        assertThat(view.activeRetries()).isZero();
        assertThat(view.metadata().get(Run.META_MESSAGE)).contains("exhausting 3 retries").contains("try 4");
        // initial launch + 3 retries
        verify(supervisor, times(4)).launch(eq(runId), eq(Stage.DESIGN), any(), any());
        verify(supervisor, atLeastOnce()).release(runId);
    }

    @Test
    void validationFailures_beyondMaxRetries_rejectDesignThroughValidationFailed() {
        String runId = runInDesign();

        for (int i = 1; i <= 3; i++) {
            service.reportStageOutcome(runId, Stage.DESIGN, StageStatus.SUCCESS, null, null);
            service.approve(runId, true, "", GateKind.EXECUTE_PLAN);
            service.reportValidation(runId, false, "missing artifact " + i);
            assertThat(state(runId)).isEqualTo(RunState.DESIGN_PROCESSING);
            assertThat(service.find(runId).activeRetries()).isEqualTo(i);
        }
        service.reportStageOutcome(runId, Stage.DESIGN, StageStatus.SUCCESS, null, null);
        service.approve(runId, true, "", GateKind.EXECUTE_PLAN);
        service.reportValidation(runId, false, "missing artifact 4");

        RunView view = service.find(runId);
        assertThat(view.state()).isEqualTo(RunState.DESIGN_REJECTED);
        assertThat(view.retryCount()).isEqualTo(3);
        assertThat(view.metadata().get(Run.META_MESSAGE)).contains("exhausting 3 retries").contains("missing artifact 4");
        List<String> targets = transitionTargets(runId);
        assertThat(targets.subList(targets.size() - 2, targets.size()))
                .containsExactly("VALIDATION_FAILED", "DESIGN_REJECTED");
        verify(supervisor, times(4)).launch(eq(runId), eq(Stage.DESIGN), any(), any());
        verify(supervisor, times(4)).launch(eq(runId), eq(Stage.VALIDATION), any(), isNull());
    }

    @Test
    void incompleteAndValidationFailures_shareOneBudget() {
        String runId = runInDesign();

        service.reportStageOutcome(runId, Stage.DESIGN, StageStatus.INCOMPLETE, "no diagram", null);
        service.reportStageOutcome(runId, Stage.DESIGN, StageStatus.INCOMPLETE, "bad yaml", null);
        service.reportStageOutcome(runId, Stage.DESIGN, StageStatus.SUCCESS, null, null);
        service.approve(runId, true, "", null);
        service.reportValidation(runId, false, "file missing");
        assertThat(service.find(runId).activeRetries()).isEqualTo(3);

        service.reportStageOutcome(runId, Stage.DESIGN, StageStatus.INCOMPLETE, "still no diagram", null);

        assertThat(state(runId)).isEqualTo(RunState.DESIGN_REJECTED);
        verify(supervisor, times(4)).launch(eq(runId), eq(Stage.DESIGN), any(), any());
    }

    @Test
    void concurrentIncompleteReports_spendBudgetExactlyOnceEach() throws Exception {
        String runId = runInDesign();
        int reporters = 8;
        ExecutorService pool = Executors.newFixedThreadPool(reporters);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> outcomes = new ArrayList<>();
        try {
            for (int i = 0; i < reporters; i++) {
                String reason = "worker " + i;
                outcomes.add(pool.submit(() -> {
                    start.await();
                    return service.reportStageOutcome(runId, Stage.DESIGN, StageStatus.INCOMPLETE, reason, null);
                }));
            }
            start.countDown();

            int applied = 0;
            for (Future<Boolean> outcome : outcomes) {
                if (outcome.get(10, TimeUnit.SECONDS)) {
                    applied++;
                }
            }
            // three retries plus the one that exhausts the budget; the rest arrive after the end
            assertThat(applied).isEqualTo(4);
        } finally {
            pool.shutdownNow();
        }

        RunView view = service.find(runId);
        assertThat(view.state()).isEqualTo(RunState.DESIGN_REJECTED);
        assertThat(view.retryCount()).isEqualTo(3);
        verify(supervisor, times(4)).launch(eq(runId), eq(Stage.DESIGN), any(), any());
        assertThat(meters.counter("dirgen.runs.transitions", "to", "DESIGN_REJECTED").count()).isEqualTo(1.0);
    }

    @Test
    void designFailedOrImpossible_isTerminalWithoutRetry() {
        String runId = runInDesign();
        service.reportStageOutcome(runId, Stage.DESIGN, StageStatus.IMPOSSIBLE, "contradictory requirements", null);

        assertThat(state(runId)).isEqualTo(RunState.DESIGN_REJECTED);
        verify(supervisor, times(1)).launch(eq(runId), eq(Stage.DESIGN), any(), any());
    }

    @Test
    void requirementsFailed_rejectsRun() {
        String runId = service.submit("r.md", "text");
        service.reportStageOutcome(runId, Stage.REQUIREMENTS, StageStatus.FAILED, "not a requirements document", null);

        RunView view = service.find(runId);
        assertThat(view.state()).isEqualTo(RunState.REQUIREMENTS_REJECTED);
        assertThat(view.metadata().get(Run.META_LAST_ERROR)).contains("not a requirements document");
    }

    // ------------------------------------------------------------------
    // Approvals
    // ------------------------------------------------------------------

    @Test
    void approve_withoutOpenGate_failsAndChangesNothing() {
        String runId = service.submit("r.md", "text");
        RunView before = service.find(runId);

        for (int i = 0; i < 2; i++) {
            assertThatThrownBy(() -> service.approve(runId, true, "yes", null))
                    .isInstanceOf(InvalidStateException.class)
                    .hasMessageContaining("no pending approval");
        }
        assertThat(service.find(runId)).isEqualTo(before);
    }

    @Test
    void approve_wrongGateKind_failsAndKeepsGate() {
        String runId = service.submit("r.md", "text");
        service.reportStageOutcome(runId, Stage.REQUIREMENTS, StageStatus.SUCCESS, null, null);

        assertThatThrownBy(() -> service.approve(runId, true, "", GateKind.EXECUTE_PLAN))
                .isInstanceOf(InvalidStateException.class);
        assertThat(service.find(runId).openGate()).isEqualTo(GateKind.START_DESIGN);
    }

    @Test
    void reject_closesGate_andEndsRun() {
        String runId = service.submit("r.md", "text");
        service.reportStageOutcome(runId, Stage.REQUIREMENTS, StageStatus.SUCCESS, null, null);

        RunView view = service.approve(runId, false, "wrong scope", null);

        assertThat(view.state()).isEqualTo(RunState.REQUIREMENTS_REJECTED);
        assertThat(view.openGate()).isNull();
        assertThat(view.metadata().get(Run.META_MESSAGE)).isEqualTo("Rejected by user: wrong scope");
        verify(events).publish(eq(runId), eq(EventType.APPROVAL_REJECTED), any());
    }

    @Test
    void gateNotConfigured_passesAutomatically() {
        service = newService(List.of("execute-plan"), false);
        String runId = service.submit("r.md", "text");
        writeDesignInput(runId);

        service.reportStageOutcome(runId, Stage.REQUIREMENTS, StageStatus.SUCCESS, null, null);

        assertThat(state(runId)).isEqualTo(RunState.DESIGN_PROCESSING);
        assertThat(transitionTargets(runId)).containsSubsequence(
                "REQUIREMENTS_WAITING_APPROVAL", "REQUIREMENTS_APPROVED", "DESIGN_PROCESSING");
        verify(events, never()).publish(eq(runId), eq(EventType.APPROVAL_REQUEST), any());
    }

    // ------------------------------------------------------------------
    // Reports in the wrong state / after the end
    // ------------------------------------------------------------------

    @Test
    void reportForOtherStage_isInvalidState() {
        String runId = service.submit("r.md", "text");

        assertThatThrownBy(() ->
                service.reportStageOutcome(runId, Stage.DESIGN, StageStatus.SUCCESS, null, null))
                .isInstanceOf(InvalidStateException.class);
        assertThat(state(runId)).isEqualTo(RunState.REQUIREMENTS_PROCESSING);
    }

    @Test
    void cancel_thenLateReportsAreIgnored() {
        String runId = runInDesign();

        assertThat(service.cancel(runId).state()).isEqualTo(RunState.CANCELLED);
        assertThat(service.reportStageOutcome(runId, Stage.DESIGN, StageStatus.SUCCESS, null, null)).isFalse();
        assertThat(service.reportValidation(runId, true, "ok")).isFalse();
        assertThat(service.cancel(runId).state()).isEqualTo(RunState.CANCELLED);
        assertThat(state(runId)).isEqualTo(RunState.CANCELLED);
    }

    @Test
    void cancel_finishedRun_isInvalidState() {
        String runId = service.submit("r.md", "text");
        service.reportStageOutcome(runId, Stage.REQUIREMENTS, StageStatus.FAILED, null, null);

        assertThatThrownBy(() -> service.cancel(runId)).isInstanceOf(InvalidStateException.class);
    }

    @Test
    void unknownRun_isNotFound() {
        assertThatThrownBy(() -> service.find("run-missing")).isInstanceOf(RunNotFoundException.class);
        assertThatThrownBy(() -> service.approve("run-missing", true, "", null))
                .isInstanceOf(RunNotFoundException.class);
    }

    @Test
    void workerMessages_areForwardedUntilCancelled() {
        String runId = service.submit("r.md", "text");
        BroadcastMessage thought = new BroadcastMessage("Planner", "thought", Map.of("text", "thinking"));

        service.forwardWorkerMessage(runId, thought);
        service.cancel(runId);
        service.forwardWorkerMessage(runId, thought);

        verify(events, times(1)).publish(runId, thought);
    }

    // ------------------------------------------------------------------
    // Launch failures
    // ------------------------------------------------------------------

    @Test
    void requirementsLaunchFailure_rejectsRun() {
        doThrow(new ProcessLaunchException("python: not found"))
                .when(supervisor).launch(anyString(), eq(Stage.REQUIREMENTS), any(), any());

        String runId = service.submit("r.md", "text");

        RunView view = service.find(runId);
        assertThat(view.state()).isEqualTo(RunState.REQUIREMENTS_REJECTED);
        assertThat(view.metadata().get(Run.META_LAST_ERROR)).contains("python: not found");
        verify(events).publish(eq(runId), eq(EventType.ERROR), any());
    }

    @Test
    void missingDesignInput_failsDesignLaunch() {
        String runId = service.submit("r.md", "text");
        service.reportStageOutcome(runId, Stage.REQUIREMENTS, StageStatus.SUCCESS, null, null);

        service.approve(runId, true, "", null);   // no _pcce.yml was produced

        assertThat(state(runId)).isEqualTo(RunState.DESIGN_REJECTED);
        assertThat(service.find(runId).metadata().get(Run.META_LAST_ERROR)).contains(runId + "_pcce.yml");
        verify(supervisor, never()).launch(anyString(), eq(Stage.DESIGN), any(), any());
    }

    @Test
    void validationLaunchFailure_rejectsDesignThroughValidationFailed() {
        doThrow(new ProcessLaunchException("python: not found"))
                .when(supervisor).launch(anyString(), eq(Stage.VALIDATION), any(), any());
        String runId = runInDesign();

        service.reportStageOutcome(runId, Stage.DESIGN, StageStatus.SUCCESS, null, null);
        service.approve(runId, true, "", GateKind.EXECUTE_PLAN);

        RunView view = service.find(runId);
        assertThat(view.state()).isEqualTo(RunState.DESIGN_REJECTED);
        assertThat(view.metadata().get(Run.META_LAST_ERROR)).contains("python: not found");
        List<String> targets = transitionTargets(runId);
        assertThat(targets.subList(targets.size() - 3, targets.size()))
                .containsExactly("VALIDATION_PROCESSING", "VALIDATION_FAILED", "DESIGN_REJECTED");
    }

    // ------------------------------------------------------------------
    // Worker exits
    // ------------------------------------------------------------------

    @Test
    void workerExitsNonZeroBeforeReporting_failsStage() {
        String runId = service.submit("r.md", "text");

        exitListener().workerFailed(runId, Stage.REQUIREMENTS, 2);

        RunView view = service.find(runId);
        assertThat(view.state()).isEqualTo(RunState.REQUIREMENTS_REJECTED);
        assertThat(view.metadata().get(Run.META_LAST_ERROR)).contains("exited with code 2");
        verify(events).publish(eq(runId), eq(EventType.ERROR), any());
    }

    @Test
    void validationWorkerExitsNonZero_rejectsDesign() {
        String runId = runInDesign();
        service.reportStageOutcome(runId, Stage.DESIGN, StageStatus.SUCCESS, null, null);
        service.approve(runId, true, "", null);

        exitListener().workerFailed(runId, Stage.VALIDATION, 1);

        assertThat(state(runId)).isEqualTo(RunState.DESIGN_REJECTED);
        assertThat(transitionTargets(runId)).containsSubsequence("VALIDATION_FAILED", "DESIGN_REJECTED");
    }

    @Test
    void workerExitAfterStageMovedOn_isIgnored() {
        String runId = service.submit("r.md", "text");
        service.reportStageOutcome(runId, Stage.REQUIREMENTS, StageStatus.SUCCESS, null, null);

        exitListener().workerFailed(runId, Stage.REQUIREMENTS, 1);

        RunView view = service.find(runId);
        assertThat(view.state()).isEqualTo(RunState.REQUIREMENTS_WAITING_APPROVAL);
        assertThat(view.openGate()).isEqualTo(GateKind.START_DESIGN);
        verify(events, never()).publish(eq(runId), eq(EventType.ERROR), any());
    }

    @Test
    void workerExitForCancelledRun_isIgnored() {
        String runId = runInDesign();
        service.cancel(runId);

        exitListener().workerFailed(runId, Stage.DESIGN, 137);

        assertThat(state(runId)).isEqualTo(RunState.CANCELLED);
    }

    // ------------------------------------------------------------------
    // Execution stage
    // ------------------------------------------------------------------

    @Test
    void executionStageEnabled_runsToExecutionCompleted() {
        service = newService(List.of(), true);
        String runId = service.submit("r.md", "text");
        writeDesignInput(runId);

        service.reportStageOutcome(runId, Stage.REQUIREMENTS, StageStatus.SUCCESS, null, null);
        service.reportStageOutcome(runId, Stage.DESIGN, StageStatus.SUCCESS, null, null);
        service.reportValidation(runId, true, "ok");
        assertThat(state(runId)).isEqualTo(RunState.EXECUTION_PROCESSING);
        verify(supervisor).launch(eq(runId), eq(Stage.EXECUTION), any(), isNull());

        service.reportStageOutcome(runId, Stage.EXECUTION, StageStatus.SUCCESS, null, null);
        assertThat(state(runId)).isEqualTo(RunState.EXECUTION_COMPLETED);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /** Submit a run and drive it to DESIGN_PROCESSING. */
    private String runInDesign() {
        String runId = service.submit("r.md", "text");
        writeDesignInput(runId);
        service.reportStageOutcome(runId, Stage.REQUIREMENTS, StageStatus.SUCCESS, null, null);
        service.approve(runId, true, "", null);
        assertThat(state(runId)).isEqualTo(RunState.DESIGN_PROCESSING);
        return runId;
    }

    /** The listener registered by the most recently built service. */
    private WorkerExitListener exitListener() {
        ArgumentCaptor<WorkerExitListener> captor = ArgumentCaptor.forClass(WorkerExitListener.class);
        verify(supervisor, atLeastOnce()).addExitListener(captor.capture());
        return captor.getValue();
    }

    private void writeDesignInput(String runId) {
        gateway.write("temp/" + runId + "_pcce.yml", "system: todo\n");
    }

    private RunState state(String runId) {
        return service.find(runId).state();
    }

    @SuppressWarnings("unchecked")
    private List<String> transitionTargets(String runId) {
        ArgumentCaptor<Map<String, Object>> captor = ArgumentCaptor.forClass(Map.class);
        verify(events, atLeastOnce()).publish(eq(runId), eq(EventType.STATE_TRANSITION), captor.capture());
        return captor.getAllValues().stream().map(d -> (String) d.get("to")).toList();
    }
}
