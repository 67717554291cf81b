package com.dirgen.orchestrator.api.dto;

/**
 * Request body for POST /run/{id}/approve.
 *
 * Required: approved
 * Optional: userResponse (free text kept in the run metadata),
 *           gate ("start-design" | "execute-plan") to guard against answering the wrong question
 */
public record ApproveRequest(Boolean approved, String userResponse, String gate) {}
