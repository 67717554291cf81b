package com.dirgen.orchestrator.api.dto;

/**
 * Request body for POST /agent/{id}/task_complete.
 * role and status are required; unknown values are rejected with 400.
 */
public record TaskCompleteRequest(String role, String status, String reason, String summary) {}
