package com.dirgen.orchestrator.worker;

/**
 * A stage worker could not be started (missing executable, bad command
 * configuration, OS resource exhaustion). The workflow treats this as an
 * immediate stage failure.
 */
public class ProcessLaunchException extends RuntimeException {
    public ProcessLaunchException(String message) {
        super(message);
    }

    public ProcessLaunchException(String message, Throwable cause) {
        super(message, cause);
    }
}
