package com.dirgen.orchestrator.repository;

public class RunNotFoundException extends RuntimeException {
    public RunNotFoundException(String runId) {
        super("Run not found: " + runId);
    }
}
