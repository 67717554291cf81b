package com.dirgen.orchestrator.model;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One end-to-end execution of the pipeline for one submitted document.
 *
 * A Run is mutable but never shared raw: the RunRegistry hands it out only
 * inside a per-run lock, and readers get a {@link RunView} snapshot.
 * Runs are kept for the lifetime of the process and never deleted.
 */
public class Run {

    public static final String META_MESSAGE    = "message";
    public static final String META_LAST_ERROR = "lastError";

    private final String  id;
    private final String  inputPath;
    private final Instant createdAt;

    private RunState     state = RunState.INITIAL;
    private Instant      updatedAt;

    // Total design retries granted over the run's lifetime (informational).
    private int          retryCount;

    // At most one of each at any time.
    private ApprovalGate approvalGate;
    private RetryRecord  retryRecord;

    private final Map<String, String> metadata = new LinkedHashMap<>();

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    public Run(String id, String inputPath, Instant createdAt) {
        this.id        = id;
        this.inputPath = inputPath;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    // ------------------------------------------------------------------
    // State machine
    // ------------------------------------------------------------------

    /**
     * Move to {@code next}.
     *
     * @throws IllegalStateException if the edge is not part of the run graph
     */
    public void transitionTo(RunState next, Instant at) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException(
                    "Illegal transition for run %s: %s -> %s".formatted(id, state, next));
        }
        this.state     = next;
        this.updatedAt = at;
    }

    // ------------------------------------------------------------------
    // Gates and retries
    // ------------------------------------------------------------------

    public void openGate(GateKind kind, Instant at) {
        if (approvalGate != null) {
            throw new IllegalStateException("Run " + id + " already has an open gate: " + approvalGate.kind());
        }
        this.approvalGate = new ApprovalGate(kind, at);
    }

    public ApprovalGate consumeGate() {
        ApprovalGate gate = approvalGate;
        approvalGate = null;
        return gate;
    }

    /** The active retry record, created on first use. */
    public RetryRecord retryRecord(int maxRetries) {
        if (retryRecord == null) {
            retryRecord = new RetryRecord(maxRetries);
        }
        return retryRecord;
    }

    public void discardRetryRecord()    { this.retryRecord = null; }
    public void incrementRetryCount()   { this.retryCount++; }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public String     getId()          { return id; }
    public String     getInputPath()   { return inputPath; }
    public RunState   getState()       { return state; }
    public Instant    getCreatedAt()   { return createdAt; }
    public Instant    getUpdatedAt()   { return updatedAt; }
    public int        getRetryCount()  { return retryCount; }

    public Optional<ApprovalGate> getApprovalGate() { return Optional.ofNullable(approvalGate); }
    public Optional<RetryRecord>  getRetryRecord()  { return Optional.ofNullable(retryRecord); }

    public Map<String, String> getMetadata()           { return metadata; }
    public void putMetadata(String key, String value) {
        if (value == null) {
            metadata.remove(key);
        } else {
            metadata.put(key, value);
        }
    }

    public RunView snapshot() {
        return new RunView(id, state, createdAt, updatedAt, retryCount,
                retryRecord == null ? 0 : retryRecord.attempts(),
                approvalGate == null ? null : approvalGate.kind(),
                Map.copyOf(metadata));
    }
}
