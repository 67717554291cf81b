package com.dirgen.orchestrator.api.dto;

import com.dirgen.orchestrator.model.RunView;

import java.time.Instant;
import java.util.Map;

/**
 * Response body for GET /run/{id}, approve and cancel.
 *
 * @param pendingGate wire name of the open approval gate, or null
 */
public record RunResponse(
        String              runId,
        String              state,
        boolean             terminal,
        int                 retryCount,
        int                 activeRetries,
        String              pendingGate,
        Map<String, String> metadata,
        Instant             createdAt,
        Instant             updatedAt
) {
    public static RunResponse from(RunView run) {
        return new RunResponse(
                run.id(),
                run.state().name(),
                run.state().isTerminal(),
                run.retryCount(),
                run.activeRetries(),
                run.openGate() == null ? null : run.openGate().wireName(),
                run.metadata(),
                run.createdAt(),
                run.updatedAt()
        );
    }
}
