package com.dirgen.orchestrator.llm.local;

import java.io.IOException;
import java.util.Set;

/**
 * The execution environment that actually hosts local models. Kept behind an
 * interface so the lifecycle logic can be tested without a container runtime.
 */
public interface ModelRuntime {

    /** Ids of the models currently running. Empty if the environment can't be queried. */
    Set<String> runningModels();

    default boolean isRunning(String modelId) {
        return runningModels().contains(modelId);
    }

    /** Begin loading {@code modelId}; returns immediately. */
    ModelHandle start(String modelId) throws IOException;

    /** Unload {@code modelId}. Failures are logged, not thrown. */
    void stop(String modelId);
}
