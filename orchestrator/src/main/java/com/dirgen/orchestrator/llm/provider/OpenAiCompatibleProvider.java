package com.dirgen.orchestrator.llm.provider;

import com.dirgen.orchestrator.llm.CompletionRequest;
import com.dirgen.orchestrator.llm.LlmProperties.ProviderConfig;
import com.dirgen.orchestrator.llm.credential.CredentialPool;
import com.dirgen.orchestrator.llm.credential.ProviderCredential;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Any {@code /chat/completions} endpoint: OpenAI, Groq, xAI, or a local
 * runner speaking the same dialect. Point {@code base-url} at the vendor.
 */
public class OpenAiCompatibleProvider extends HttpLlmProvider {

    private static final String DEFAULT_BASE_URL = "https://api.openai.com/v1";

    public OpenAiCompatibleProvider(String name, ProviderConfig config, HttpClient http,
                                    ObjectMapper json, CredentialPool credentials) {
        super(name, config, http, json, credentials);
    }

    protected String defaultBaseUrl() {
        return DEFAULT_BASE_URL;
    }

    @Override
    protected String endpoint(CompletionRequest request) {
        return baseUrl(defaultBaseUrl()) + "/chat/completions";
    }

    @Override
    protected Object requestBody(CompletionRequest request) {
        List<Map<String, String>> messages = new ArrayList<>();
        if (!request.systemPrompt().isEmpty()) {
            messages.add(Map.of("role", "system", "content", request.systemPrompt()));
        }
        messages.add(Map.of("role", "user", "content", request.userPrompt()));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model",       model(request));
        body.put("messages",    messages);
        body.put("temperature", request.temperature());
        body.put("max_tokens",  request.maxTokens());
        return body;
    }

    @Override
    protected void authorize(HttpRequest.Builder builder, ProviderCredential credential) {
        if (credential != null) {
            builder.header("Authorization", "Bearer " + credential.getSecret());
        }
    }

    @Override
    protected String extractText(JsonNode reply) {
        // { choices: [ { message: { content } } ] }
        return reply.path("choices").path(0).path("message").path("content").asText(null);
    }
}
