package com.dirgen.orchestrator.worker;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Starts an OS process. Separated from {@link WorkerSupervisor} so tests can
 * substitute a fake instead of spawning real workers.
 */
@FunctionalInterface
public interface ProcessLauncher {

    Process start(List<String> command, Map<String, String> environment) throws IOException;

    /** The default: a ProcessBuilder whose output goes to the orchestrator's console. */
    static ProcessLauncher system() {
        return (command, environment) -> {
            ProcessBuilder pb = new ProcessBuilder(command).inheritIO();
            pb.environment().putAll(environment);
            return pb.start();
        };
    }
}
