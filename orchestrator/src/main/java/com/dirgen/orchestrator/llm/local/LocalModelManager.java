package com.dirgen.orchestrator.llm.local;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Starts, health-checks and unloads locally hosted models.
 *
 * At most {@code maxConcurrent} managed models run at once: asking for one
 * more evicts the least recently used first. Models nobody used for
 * {@code idleTimeout} are unloaded by the periodic sweep.
 *
 * Every check-then-act sequence (count, evict, start) holds one lock, so two
 * concurrent callers can never both decide there is room for one more model.
 * A start can take a minute; other callers wait for it.
 */
public class LocalModelManager {

    private static final Logger log = LoggerFactory.getLogger(LocalModelManager.class);

    /** What GET /llm/models shows. */
    public record Status(List<ModelLease.View> leases, Set<String> running,
                         int maxConcurrent, Duration idleTimeout) {}

    private final Map<String, ModelLease> leases = new LinkedHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    private final ModelRuntime         runtime;
    private final LocalModelProperties props;
    private final Clock                clock;

    public LocalModelManager(ModelRuntime runtime, LocalModelProperties props, Clock clock) {
        this.runtime = runtime;
        this.props   = props;
        this.clock   = clock;
    }

    // ------------------------------------------------------------------
    // Demand
    // ------------------------------------------------------------------

    /**
     * Make sure {@code backendId} is loaded, starting it if necessary.
     *
     * @return true if the backend is running, false if it could not be started
     */
    public boolean ensureRunning(String backendId) {
        lock.lock();
        try {
            Instant now = clock.instant();
            ModelLease lease = leases.get(backendId);

            if (runtime.isRunning(backendId)) {
                if (lease != null) {
                    if (lease.getState() != LeaseState.RUNNING) {
                        lease.running(null, now);
                    }
                    lease.touch(now);
                }
                return true;
            }
            if (lease != null) {
                // We thought it was up, but the runtime disagrees.
                log.warn("Managed model {} is no longer running; restarting", backendId);
                leases.remove(backendId).stopped();
            }

            makeRoomFor(backendId);
            return start(backendId);
        } finally {
            lock.unlock();
        }
    }

    private void makeRoomFor(String backendId) {
        while (leases.size() >= props.maxConcurrent() && !leases.isEmpty()) {
            ModelLease lru = leases.values().stream()
                    .min(Comparator.comparing(ModelLease::getLastUsed))
                    .orElseThrow();
            log.info("Model ceiling ({}) reached; evicting least recently used {} to make room for {}",
                    props.maxConcurrent(), lru.getBackendId(), backendId);
            stop(lru);
        }
    }

    private boolean start(String backendId) {
        ModelLease lease = new ModelLease(backendId, clock.instant());
        leases.put(backendId, lease);

        ModelHandle handle;
        try {
            handle = runtime.start(backendId);
        } catch (IOException e) {
            log.error("Could not start local model {}: {}", backendId, e.getMessage());
            leases.remove(backendId).stopped();
            return false;
        }

        sleep(props.startupGrace());
        for (int check = 1; check <= props.startChecks(); check++) {
            if (runtime.isRunning(backendId)) {
                lease.running(handle, clock.instant());
                lease.touch(clock.instant());
                log.info("Local model {} running after {} check(s)", backendId, check);
                return true;
            }
            if (check < props.startChecks()) {
                sleep(props.startCheckInterval());
            }
        }

        log.error("Local model {} not running after {} checks; giving up", backendId, props.startChecks());
        handle.terminate();
        leases.remove(backendId).stopped();
        return false;
    }

    // ------------------------------------------------------------------
    // Eviction
    // ------------------------------------------------------------------

    /** Unload every managed model idle for longer than the idle timeout. */
    public List<String> evictIdle() {
        lock.lock();
        try {
            Instant cutoff = clock.instant().minus(props.idleTimeout());
            List<ModelLease> idle = leases.values().stream()
                    .filter(l -> l.getState() == LeaseState.RUNNING && l.getLastUsed().isBefore(cutoff))
                    .toList();
            List<String> evicted = new ArrayList<>();
            for (ModelLease lease : idle) {
                log.info("Unloading idle model {} (last used {})", lease.getBackendId(), lease.getLastUsed());
                stop(lease);
                evicted.add(lease.getBackendId());
            }
            return evicted;
        } finally {
            lock.unlock();
        }
    }

    /** Unload every managed model, whatever its state. Runs on shutdown. */
    @PreDestroy
    public void forceStopAll() {
        lock.lock();
        try {
            if (!leases.isEmpty()) {
                log.info("Stopping all {} managed local model(s)", leases.size());
            }
            for (ModelLease lease : List.copyOf(leases.values())) {
                stop(lease);
            }
        } finally {
            lock.unlock();
        }
    }

    public Status status() {
        lock.lock();
        try {
            List<ModelLease.View> views = leases.values().stream().map(ModelLease::view).toList();
            return new Status(views, runtime.runningModels(), props.maxConcurrent(), props.idleTimeout());
        } finally {
            lock.unlock();
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void stop(ModelLease lease) {
        leases.remove(lease.getBackendId());
        lease.stopped();
        runtime.stop(lease.getBackendId());
    }

    private static void sleep(Duration d) {
        if (d.isZero() || d.isNegative()) {
            return;
        }
        try {
            Thread.sleep(d.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
