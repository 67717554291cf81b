package com.dirgen.orchestrator.api.dto;

/** Request body for POST /agent/{id}/validation_result. */
public record ValidationResultRequest(Boolean success, String message) {}
