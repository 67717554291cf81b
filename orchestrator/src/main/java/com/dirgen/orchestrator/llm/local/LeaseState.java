package com.dirgen.orchestrator.llm.local;

/**
 * Lifecycle of a managed backend. A backend with no lease is unmanaged.
 *
 *   STARTING → RUNNING → STOPPED   (idle timeout, eviction, explicit stop, shutdown)
 *   STARTING → STOPPED             (never confirmed running)
 */
public enum LeaseState {
    STARTING,
    RUNNING,
    STOPPED
}
