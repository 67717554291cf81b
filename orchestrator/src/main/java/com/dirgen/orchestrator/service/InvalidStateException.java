package com.dirgen.orchestrator.service;

/**
 * An approval, report or cancel arrived for a run that is not in a matching
 * state. Thrown before any mutation, so the run is left untouched.
 */
public class InvalidStateException extends RuntimeException {
    public InvalidStateException(String message) {
        super(message);
    }
}
