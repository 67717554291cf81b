package com.dirgen.orchestrator.model;

/**
 * Event types the orchestrator itself publishes on a run's event stream.
 * Workers may publish any other type; those are forwarded verbatim.
 */
public enum EventType {
    STATE_TRANSITION ("state_transition"),
    STAGE_START      ("stage_start"),
    STAGE_END        ("stage_end"),
    APPROVAL_REQUEST ("approval_request"),
    APPROVAL_GRANTED ("approval_granted"),
    APPROVAL_REJECTED("approval_rejected"),
    RETRY_ATTEMPT    ("retry_attempt"),
    VALIDATION_START ("validation_start"),
    VALIDATION_RESULT("validation_result"),
    EXECUTIVE_SUMMARY("executive_summary"),
    RUN_COMPLETED    ("run_completed"),
    INFO             ("info"),
    ERROR            ("error");

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
