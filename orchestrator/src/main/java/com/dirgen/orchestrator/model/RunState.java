package com.dirgen.orchestrator.model;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * States of one pipeline run.
 *
 * Transitions (happy path):
 *   INITIAL → REQUIREMENTS_PROCESSING → REQUIREMENTS_WAITING_APPROVAL → REQUIREMENTS_APPROVED
 *   → DESIGN_PROCESSING → DESIGN_WAITING_APPROVAL → DESIGN_APPROVED
 *   → VALIDATION_PROCESSING → VALIDATION_PASSED [→ EXECUTION_PROCESSING → EXECUTION_COMPLETED]
 *
 * The only cycles are the two retry paths back into DESIGN_PROCESSING
 * (DESIGN_PROCESSING itself on an incomplete design, VALIDATION_FAILED on a
 * failed validation). Every non-terminal state may move to CANCELLED.
 */
public enum RunState {
    INITIAL,
    REQUIREMENTS_PROCESSING,
    REQUIREMENTS_WAITING_APPROVAL,
    REQUIREMENTS_APPROVED,
    REQUIREMENTS_REJECTED,
    DESIGN_PROCESSING,
    DESIGN_WAITING_APPROVAL,
    DESIGN_APPROVED,
    DESIGN_REJECTED,
    VALIDATION_PROCESSING,
    VALIDATION_PASSED,
    VALIDATION_FAILED,
    EXECUTION_PROCESSING,
    EXECUTION_COMPLETED,
    EXECUTION_FAILED,
    CANCELLED;

    private static final Set<RunState> TERMINAL = EnumSet.of(
            REQUIREMENTS_REJECTED, DESIGN_REJECTED, EXECUTION_COMPLETED, EXECUTION_FAILED, CANCELLED);

    private static final Map<RunState, Set<RunState>> EDGES = new EnumMap<>(RunState.class);

    static {
        EDGES.put(INITIAL,                       EnumSet.of(REQUIREMENTS_PROCESSING));
        EDGES.put(REQUIREMENTS_PROCESSING,       EnumSet.of(REQUIREMENTS_WAITING_APPROVAL, REQUIREMENTS_REJECTED));
        EDGES.put(REQUIREMENTS_WAITING_APPROVAL, EnumSet.of(REQUIREMENTS_APPROVED, REQUIREMENTS_REJECTED));
        EDGES.put(REQUIREMENTS_APPROVED,         EnumSet.of(DESIGN_PROCESSING));
        EDGES.put(DESIGN_PROCESSING,             EnumSet.of(DESIGN_PROCESSING, DESIGN_WAITING_APPROVAL, DESIGN_REJECTED));
        EDGES.put(DESIGN_WAITING_APPROVAL,       EnumSet.of(DESIGN_APPROVED, DESIGN_REJECTED));
        EDGES.put(DESIGN_APPROVED,               EnumSet.of(VALIDATION_PROCESSING));
        EDGES.put(VALIDATION_PROCESSING,         EnumSet.of(VALIDATION_PASSED, VALIDATION_FAILED));
        EDGES.put(VALIDATION_FAILED,             EnumSet.of(DESIGN_PROCESSING, DESIGN_REJECTED));
        EDGES.put(VALIDATION_PASSED,             EnumSet.of(EXECUTION_PROCESSING));
        EDGES.put(EXECUTION_PROCESSING,          EnumSet.of(EXECUTION_COMPLETED, EXECUTION_FAILED));
        for (RunState s : values()) {
            EDGES.putIfAbsent(s, EnumSet.noneOf(RunState.class));
            if (!TERMINAL.contains(s)) {
                EDGES.get(s).add(CANCELLED);
            }
        }
    }

    /** True once no further transition is possible. */
    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    public boolean canTransitionTo(RunState next) {
        return EDGES.get(this).contains(next);
    }

    /** The outgoing edges of this state (read-only copy). */
    public Set<RunState> successors() {
        Set<RunState> out = EDGES.get(this);
        return out.isEmpty() ? EnumSet.noneOf(RunState.class) : EnumSet.copyOf(out);
    }
}
