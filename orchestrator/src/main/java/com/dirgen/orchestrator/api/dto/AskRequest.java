package com.dirgen.orchestrator.api.dto;

/**
 * Request body for POST /llm/ask.
 *
 * taskClass defaults to "general"; useCache defaults to true (only
 * cacheable task classes are ever cached).
 */
public record AskRequest(String modelId, String systemPrompt, String userPrompt,
                         String taskClass, Boolean useCache) {

    public AskRequest {
        if (useCache == null) useCache = Boolean.TRUE;
    }
}
