package com.dirgen.orchestrator.model;

/**
 * A malformed message from a worker or client: missing envelope fields, a
 * non-object {@code data}, or an unknown role/status/gate value.
 *
 * Raised at the API boundary before anything touches a run, so the run's
 * state is always left unchanged.
 */
public class ProtocolException extends RuntimeException {

    public ProtocolException(String message) {
        super(message);
    }
}
