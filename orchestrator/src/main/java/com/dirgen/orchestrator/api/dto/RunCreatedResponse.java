package com.dirgen.orchestrator.api.dto;

/** Response body for POST /run/from-input. */
public record RunCreatedResponse(String runId, String state) {}
