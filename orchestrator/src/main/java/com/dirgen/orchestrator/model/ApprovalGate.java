package com.dirgen.orchestrator.model;

import java.time.Instant;

/**
 * An open approval point on a run. Created when a stage reports success,
 * consumed by exactly one approve/reject call.
 */
public record ApprovalGate(GateKind kind, Instant openedAt) {}
