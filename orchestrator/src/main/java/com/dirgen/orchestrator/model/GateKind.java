package com.dirgen.orchestrator.model;

import java.util.Arrays;

/**
 * The human approval points of the pipeline.
 *
 * Each kind knows which waiting/approved/rejected states surround it so the
 * workflow can handle both gates with the same code.
 */
public enum GateKind {
    START_DESIGN("start-design",
            RunState.REQUIREMENTS_WAITING_APPROVAL,
            RunState.REQUIREMENTS_APPROVED,
            RunState.REQUIREMENTS_REJECTED,
            "Requirements are ready. Start design planning?"),
    EXECUTE_PLAN("execute-plan",
            RunState.DESIGN_WAITING_APPROVAL,
            RunState.DESIGN_APPROVED,
            RunState.DESIGN_REJECTED,
            "The design plan is ready. Proceed with validation and execution?");

    private final String   wireName;
    private final RunState waitingState;
    private final RunState approvedState;
    private final RunState rejectedState;
    private final String   prompt;

    GateKind(String wireName, RunState waitingState, RunState approvedState,
             RunState rejectedState, String prompt) {
        this.wireName      = wireName;
        this.waitingState  = waitingState;
        this.approvedState = approvedState;
        this.rejectedState = rejectedState;
        this.prompt        = prompt;
    }

    public String   wireName()      { return wireName; }
    public RunState waitingState()  { return waitingState; }
    public RunState approvedState() { return approvedState; }
    public RunState rejectedState() { return rejectedState; }
    public String   prompt()        { return prompt; }

    public static GateKind fromWire(String value) {
        String normalized = value == null ? "" : value.strip().toLowerCase().replace('_', '-');
        return Arrays.stream(values())
                .filter(g -> g.wireName.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new ProtocolException("Unknown approval gate: '" + value + "'"));
    }
}
