package com.dirgen.orchestrator.llm.local;

/**
 * The process (or whatever else) that keeps one local model loaded.
 */
public interface ModelHandle {

    boolean isAlive();

    /** Stop the start attempt / serving process. Safe to call more than once. */
    void terminate();
}
