package com.dirgen.orchestrator.fs;

/**
 * Thrown when a gateway path is absolute, contains a parent-directory segment,
 * or resolves (after following symlinks) outside the sandbox root.
 */
public class SandboxViolationException extends RuntimeException {
    public SandboxViolationException(String message) {
        super(message);
    }
}
