package com.dirgen.orchestrator.api;

import com.dirgen.orchestrator.worker.WorkerInvocation;
import com.dirgen.orchestrator.worker.WorkerSupervisor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * GET /health  : liveness probe
 * GET /workers : worker processes currently tracked by the supervisor
 */
@RestController
public class HealthController {

    private final WorkerSupervisor supervisor;

    public HealthController(WorkerSupervisor supervisor) {
        this.supervisor = supervisor;
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        return Map.of("status", "ok", "activeWorkers", supervisor.active().size());
    }

    @GetMapping("/workers")
    public List<WorkerInvocation> workers() {
        return supervisor.active();
    }
}
