package com.dirgen.orchestrator.llm.provider;

import com.dirgen.orchestrator.llm.CompletionRequest;
import com.dirgen.orchestrator.llm.LlmProperties.ProviderConfig;
import com.dirgen.orchestrator.llm.credential.CredentialPool;
import com.dirgen.orchestrator.llm.credential.ProviderCredential;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Anthropic Messages API, single turn.
 */
public class AnthropicProvider extends HttpLlmProvider {

    /**
     * The subset of the Messages API reply we read.
     * Unknown fields are skipped.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MessagesResponse(List<ContentBlock> content) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        public record ContentBlock(String type, String text) {}

        /** Text of the first text block, or null when there is none. */
        public String firstText() {
            if (content == null) {
                return null;
            }
            return content.stream()
                    .filter(b -> "text".equals(b.type()))
                    .map(ContentBlock::text)
                    .findFirst()
                    .orElse(null);
        }
    }

    private static final String DEFAULT_BASE_URL = "https://api.anthropic.com/v1";
    private static final String DEFAULT_MODEL    = "claude-sonnet-4-5";
    private static final String API_VERSION      = "2023-06-01";

    public AnthropicProvider(String name, ProviderConfig config, HttpClient http,
                             ObjectMapper json, CredentialPool credentials) {
        super(name, config, http, json, credentials);
    }

    @Override
    protected String endpoint(CompletionRequest request) {
        return baseUrl(DEFAULT_BASE_URL) + "/messages";
    }

    @Override
    protected String model(CompletionRequest request) {
        return config.model() == null ? DEFAULT_MODEL : config.model();
    }

    @Override
    protected Object requestBody(CompletionRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model",       model(request));
        body.put("max_tokens",  request.maxTokens());
        body.put("temperature", request.temperature());
        if (!request.systemPrompt().isEmpty()) {
            body.put("system", request.systemPrompt());
        }
        body.put("messages", List.of(Map.of("role", "user", "content", request.userPrompt())));
        return body;
    }

    @Override
    protected void authorize(HttpRequest.Builder builder, ProviderCredential credential) {
        builder.header("x-api-key",         credential.getSecret())
               .header("anthropic-version", API_VERSION);
    }

    @Override
    protected String extractText(JsonNode reply) {
        return json.convertValue(reply, MessagesResponse.class).firstText();
    }
}
