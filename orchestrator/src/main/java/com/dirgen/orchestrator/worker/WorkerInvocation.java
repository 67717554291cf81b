package com.dirgen.orchestrator.worker;

import com.dirgen.orchestrator.model.Stage;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;

/**
 * One spawned stage worker. Owned by {@link WorkerSupervisor}.
 */
public record WorkerInvocation(
        String  runId,
        Stage   stage,
        long    pid,
        Instant startedAt,
        @JsonIgnore Process process
) {}
