package com.dirgen.orchestrator.llm.local;

import java.time.Instant;

/**
 * A locally hosted backend the manager started and is responsible for.
 * Mutated only under the {@link LocalModelManager} lock.
 */
public class ModelLease {

    /** Read-only copy for the API. */
    public record View(String backendId, LeaseState state, Instant startedAt,
                       Instant lastUsed, long totalRequests) {}

    private final String backendId;

    private LeaseState  state = LeaseState.STARTING;
    private Instant     startedAt;
    private Instant     lastUsed;
    private long        totalRequests;
    private ModelHandle handle;

    ModelLease(String backendId, Instant now) {
        this.backendId = backendId;
        this.startedAt = now;
        this.lastUsed  = now;
    }

    void running(ModelHandle handle, Instant now) {
        this.state     = LeaseState.RUNNING;
        this.handle    = handle;
        this.startedAt = now;
        this.lastUsed  = now;
    }

    void touch(Instant now) {
        this.lastUsed = now;
        this.totalRequests++;
    }

    void stopped() {
        this.state = LeaseState.STOPPED;
        if (handle != null) {
            handle.terminate();
            handle = null;
        }
    }

    public String     getBackendId()     { return backendId; }
    public LeaseState getState()         { return state; }
    public Instant    getStartedAt()     { return startedAt; }
    public Instant    getLastUsed()      { return lastUsed; }
    public long       getTotalRequests() { return totalRequests; }

    public View view() {
        return new View(backendId, state, startedAt, lastUsed, totalRequests);
    }
}
