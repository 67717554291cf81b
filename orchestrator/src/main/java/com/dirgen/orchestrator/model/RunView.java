package com.dirgen.orchestrator.model;

import java.time.Instant;
import java.util.Map;

/**
 * Immutable copy of a {@link Run}, safe to hand outside the run's lock.
 *
 * @param activeRetries counter of the active retry record (0 when none is open)
 * @param openGate      the pending approval gate, or null
 */
public record RunView(
        String              id,
        RunState            state,
        Instant             createdAt,
        Instant             updatedAt,
        int                 retryCount,
        int                 activeRetries,
        GateKind            openGate,
        Map<String, String> metadata
) {}
