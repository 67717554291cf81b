package com.dirgen.orchestrator.worker;

import com.dirgen.orchestrator.model.Stage;

/**
 * Told when a tracked worker exits with a non-zero code. Exits of invocations that
 * were released or replaced by a retry are not reported.
 */
@FunctionalInterface
public interface WorkerExitListener {

    void workerFailed(String runId, Stage stage, int exitCode);
}
