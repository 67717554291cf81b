package com.dirgen.orchestrator.api.dto;

/** Error body written by ApiExceptionHandler. */
public record ApiError(String error, String message) {}
