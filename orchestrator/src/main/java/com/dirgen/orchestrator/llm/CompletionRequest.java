package com.dirgen.orchestrator.llm;

/**
 * One single-turn prompt for a provider.
 *
 * @param modelId model the caller asked for; remote providers use their configured model,
 *                the local backend uses this one when set
 */
public record CompletionRequest(
        String modelId,
        String systemPrompt,
        String userPrompt,
        double temperature,
        int    maxTokens
) {
    public static final double DEFAULT_TEMPERATURE = 0.1;
    public static final int    DEFAULT_MAX_TOKENS  = 4096;

    public CompletionRequest {
        systemPrompt = systemPrompt == null ? "" : systemPrompt;
        userPrompt   = userPrompt == null ? "" : userPrompt;
    }

    public static CompletionRequest of(String modelId, String systemPrompt, String userPrompt) {
        return new CompletionRequest(modelId, systemPrompt, userPrompt, DEFAULT_TEMPERATURE, DEFAULT_MAX_TOKENS);
    }
}
