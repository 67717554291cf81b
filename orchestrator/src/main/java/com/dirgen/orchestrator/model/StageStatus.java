package com.dirgen.orchestrator.model;

import java.util.Arrays;

/**
 * Completion status carried by a worker's task report.
 *
 *   SUCCESS    → the stage produced its artifacts
 *   FAILED     → the stage rejected its input (terminal, no retry)
 *   INCOMPLETE → the stage ran out of turns or left work undone (retryable)
 *   IMPOSSIBLE → the worker decided the task cannot be done (terminal, no retry)
 */
public enum StageStatus {
    SUCCESS,
    FAILED,
    INCOMPLETE,
    IMPOSSIBLE;

    public String wireName() {
        return name().toLowerCase();
    }

    public static StageStatus fromWire(String status) {
        if (status == null || status.isBlank()) {
            throw new ProtocolException("Field 'status' is required");
        }
        String normalized = status.strip().toLowerCase();
        return Arrays.stream(values())
                .filter(s -> s.wireName().equals(normalized))
                .findFirst()
                .orElseThrow(() -> new ProtocolException("Unknown status: '" + status + "'"));
    }
}
