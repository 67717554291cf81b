package com.dirgen.orchestrator.llm.provider;

import com.dirgen.orchestrator.llm.CompletionRequest;
import com.dirgen.orchestrator.llm.LlmProperties.ProviderConfig;
import com.dirgen.orchestrator.llm.credential.CredentialPool;
import com.dirgen.orchestrator.llm.credential.ProviderCredential;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.util.List;
import java.util.Map;

/**
 * Google Gemini {@code generateContent}. System and user prompts go out as a
 * single text part, separated by a blank line.
 */
public class GeminiProvider extends HttpLlmProvider {

    private static final String DEFAULT_BASE_URL = "https://generativelanguage.googleapis.com/v1beta";
    private static final String DEFAULT_MODEL    = "gemini-2.0-flash";

    public GeminiProvider(String name, ProviderConfig config, HttpClient http,
                          ObjectMapper json, CredentialPool credentials) {
        super(name, config, http, json, credentials);
    }

    @Override
    protected String endpoint(CompletionRequest request) {
        return baseUrl(DEFAULT_BASE_URL) + "/models/" + model(request) + ":generateContent";
    }

    @Override
    protected String model(CompletionRequest request) {
        return config.model() == null ? DEFAULT_MODEL : config.model();
    }

    @Override
    protected Object requestBody(CompletionRequest request) {
        String text = request.systemPrompt().isEmpty()
                ? request.userPrompt()
                : request.systemPrompt() + "\n\n" + request.userPrompt();
        return Map.of(
                "contents", List.of(Map.of("parts", List.of(Map.of("text", text)))),
                "generationConfig", Map.of(
                        "temperature",     request.temperature(),
                        "maxOutputTokens", request.maxTokens()));
    }

    @Override
    protected void authorize(HttpRequest.Builder builder, ProviderCredential credential) {
        builder.header("X-goog-api-key", credential.getSecret());
    }

    @Override
    protected String extractText(JsonNode reply) {
        // { candidates: [ { content: { parts: [ { text } ] } } ] }
        return reply.path("candidates").path(0).path("content").path("parts").path(0).path("text").asText(null);
    }
}
