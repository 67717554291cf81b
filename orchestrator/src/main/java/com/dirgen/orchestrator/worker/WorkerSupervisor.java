package com.dirgen.orchestrator.worker;

import com.dirgen.orchestrator.model.Stage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Spawns one OS process per pipeline stage and tracks it until it exits.
 *
 * Command-line contract for every worker:
 * <pre>
 *   &lt;command...&gt; --run-id &lt;runId&gt; &lt;inputFlag&gt; &lt;absolute input path&gt; [--feedback &lt;text&gt;]
 * </pre>
 * plus {@code DIRGEN_ORCHESTRATOR_URL} in the environment so the worker knows
 * where to report back. launch() never waits for the worker; its outcome
 * arrives later through the agent report endpoints. A tracked worker that exits
 * with a non-zero code is passed to the registered {@link WorkerExitListener}s.
 */
public class WorkerSupervisor {

    private static final Logger log = LoggerFactory.getLogger(WorkerSupervisor.class);

    public static final String ORCHESTRATOR_URL_ENV = "DIRGEN_ORCHESTRATOR_URL";

    private record Key(String runId, Stage stage) {}

    private final ConcurrentMap<Key, WorkerInvocation> invocations = new ConcurrentHashMap<>();
    private final List<WorkerExitListener>             listeners   = new CopyOnWriteArrayList<>();

    private final WorkerProperties props;
    private final ProcessLauncher  launcher;
    private final Clock            clock;

    public WorkerSupervisor(WorkerProperties props, ProcessLauncher launcher, Clock clock) {
        this.props    = props;
        this.launcher = launcher;
        this.clock    = clock;
    }

    // ------------------------------------------------------------------
    // Launch
    // ------------------------------------------------------------------

    /**
     * Start the worker for {@code stage}.
     *
     * A previous invocation of the same stage for the same run (a design retry)
     * is replaced in the bookkeeping; its process is left to finish on its own.
     *
     * @throws ProcessLaunchException if the stage has no command or the OS refuses to start it
     */
    public WorkerInvocation launch(String runId, Stage stage, Path inputPath, String feedback) {
        List<String> command = buildCommand(runId, stage, inputPath, feedback);
        Process process;
        try {
            process = launcher.start(command, Map.of(ORCHESTRATOR_URL_ENV, props.orchestratorUrl()));
        } catch (IOException | RuntimeException e) {
            throw new ProcessLaunchException(
                    "Could not start %s worker: %s".formatted(stage.displayName(), e.getMessage()), e);
        }

        WorkerInvocation invocation = new WorkerInvocation(runId, stage, process.pid(), clock.instant(), process);
        Key key = new Key(runId, stage);
        invocations.put(key, invocation);
        log.info("Launched {} worker for run {} (pid={}, feedback={})",
                stage.wireName(), runId, invocation.pid(), feedback != null);

        process.onExit().thenAccept(p -> {
            // Only drop the entry if it still belongs to this process (a retry may have replaced it).
            boolean tracked = invocations.remove(key, invocation);
            int exitCode = p.exitValue();
            log.info("{} worker for run {} exited (pid={}, exitCode={})",
                    stage.wireName(), runId, p.pid(), exitCode);
            if (tracked && exitCode != 0) {
                notifyFailed(runId, stage, exitCode);
            }
        });
        return invocation;
    }

    public void addExitListener(WorkerExitListener listener) {
        listeners.add(listener);
    }

    private void notifyFailed(String runId, Stage stage, int exitCode) {
        for (WorkerExitListener listener : listeners) {
            try {
                listener.workerFailed(runId, stage, exitCode);
            } catch (RuntimeException e) {
                log.error("Exit listener failed for {} worker of run {}", stage.wireName(), runId, e);
            }
        }
    }

    List<String> buildCommand(String runId, Stage stage, Path inputPath, String feedback) {
        WorkerProperties.StageCommand stageCommand = props.stages().get(stage.wireName());
        if (stageCommand == null || stageCommand.command().isEmpty()) {
            throw new ProcessLaunchException("No worker command configured for stage '" + stage.wireName() + "'");
        }
        List<String> command = new ArrayList<>(stageCommand.command());
        command.add("--run-id");
        command.add(runId);
        command.add(stageCommand.inputFlag());
        command.add(inputPath.toAbsolutePath().toString());
        if (feedback != null && !feedback.isBlank()) {
            command.add("--feedback");
            command.add(feedback);
        }
        return command;
    }

    // ------------------------------------------------------------------
    // Bookkeeping
    // ------------------------------------------------------------------

    /**
     * Forget every invocation of a run that reached a terminal state.
     * Processes are not killed: cancellation is cooperative.
     */
    public void release(String runId) {
        int removed = 0;
        for (Key key : List.copyOf(invocations.keySet())) {
            if (key.runId().equals(runId) && invocations.remove(key) != null) {
                removed++;
            }
        }
        if (removed > 0) {
            log.info("Released {} worker invocation(s) for run {}", removed, runId);
        }
    }

    public Optional<WorkerInvocation> find(String runId, Stage stage) {
        return Optional.ofNullable(invocations.get(new Key(runId, stage)));
    }

    /** Live invocations, oldest first. */
    public List<WorkerInvocation> active() {
        return invocations.values().stream()
                .sorted(Comparator.comparing(WorkerInvocation::startedAt))
                .toList();
    }
}
