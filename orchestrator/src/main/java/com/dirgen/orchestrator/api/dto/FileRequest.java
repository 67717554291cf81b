package com.dirgen.orchestrator.api.dto;

/**
 * Request body for the filesystem tool endpoints.
 * content is only read by write.
 */
public record FileRequest(String path, String content) {}
