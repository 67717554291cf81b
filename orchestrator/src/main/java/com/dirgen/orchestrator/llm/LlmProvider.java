package com.dirgen.orchestrator.llm;

/**
 * A callable language-model backend.
 */
public interface LlmProvider {

    /** The name this provider is listed under in the priority order. */
    String name();

    /**
     * @return the model's text reply
     * @throws ProviderException on any failure, classified
     */
    String complete(CompletionRequest request);
}
