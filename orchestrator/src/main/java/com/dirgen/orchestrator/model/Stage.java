package com.dirgen.orchestrator.model;

import java.util.Arrays;

/**
 * The pipeline stages, each backed by one worker process type.
 *
 * The wire name is the {@code role} a worker reports itself as, and the key of
 * its command line under {@code dirgen.workers.stages}.
 */
public enum Stage {
    REQUIREMENTS("requirements", "Requirements Analysis"),   // natural-language document -> structured input
    DESIGN      ("planner",      "Design Planning"),         // writes the design artifacts
    VALIDATION  ("validator",    "Design Validation"),       // checks the expected artifacts exist
    EXECUTION   ("executor",     "Plan Execution");          // optional, see dirgen.pipeline.execution-stage-enabled

    private final String wireName;
    private final String displayName;

    Stage(String wireName, String displayName) {
        this.wireName    = wireName;
        this.displayName = displayName;
    }

    public String wireName()    { return wireName; }
    public String displayName() { return displayName; }

    /** Decode a worker-supplied role; unknown roles are a protocol error. */
    public static Stage fromWire(String role) {
        if (role == null || role.isBlank()) {
            throw new ProtocolException("Field 'role' is required");
        }
        String normalized = role.strip().toLowerCase();
        return Arrays.stream(values())
                .filter(s -> s.wireName.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new ProtocolException("Unknown role: '" + role + "'"));
    }
}
