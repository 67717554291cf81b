package com.dirgen.orchestrator.repository;

import com.dirgen.orchestrator.model.Run;
import com.dirgen.orchestrator.model.RunView;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * In-memory owner of every Run.
 *
 * Each run carries its own fair lock, so operations on the same run are
 * applied one at a time in arrival order while different runs progress in
 * parallel. Runs are only reachable through {@link #withRun}; callers that
 * just want to look get a {@link RunView} snapshot.
 *
 * Nothing is persisted: runs live as long as the process.
 */
@Component
public class RunRegistry {

    private final ConcurrentMap<String, Slot> runs = new ConcurrentHashMap<>();

    private record Slot(Run run, ReentrantLock lock) {}

    /** Register a new run; the id must be unique. */
    public void add(Run run) {
        Slot previous = runs.putIfAbsent(run.getId(), new Slot(run, new ReentrantLock(true)));
        if (previous != null) {
            throw new IllegalStateException("Duplicate run id: " + run.getId());
        }
    }

    /**
     * Apply {@code op} to the run while holding its lock.
     *
     * The run id is placed in the MDC for the duration of the call so every
     * log line written by {@code op} carries it.
     *
     * @throws RunNotFoundException if no run has this id
     */
    public <T> T withRun(String runId, Function<Run, T> op) {
        Slot slot = runs.get(runId);
        if (slot == null) {
            throw new RunNotFoundException(runId);
        }
        String previousMdc = MDC.get("runId");
        slot.lock().lock();
        MDC.put("runId", runId);
        try {
            return op.apply(slot.run());
        } finally {
            if (previousMdc == null) {
                MDC.remove("runId");
            } else {
                MDC.put("runId", previousMdc);
            }
            slot.lock().unlock();
        }
    }

    public Optional<RunView> find(String runId) {
        if (!runs.containsKey(runId)) {
            return Optional.empty();
        }
        return Optional.of(withRun(runId, Run::snapshot));
    }

    public boolean exists(String runId) {
        return runs.containsKey(runId);
    }

    /** Snapshots of all runs, newest first. */
    public List<RunView> findAll() {
        return runs.keySet().stream()
                .map(id -> withRun(id, Run::snapshot))
                .sorted(Comparator.comparing(RunView::createdAt).reversed())
                .toList();
    }
}
