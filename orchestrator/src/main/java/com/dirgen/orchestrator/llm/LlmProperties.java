package com.dirgen.orchestrator.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Binds {@code dirgen.llm.*}.
 *
 * <pre>
 * dirgen:
 *   llm:
 *     priority-order: [gemini, local]
 *     local-fallback: local
 *     providers:
 *       gemini:
 *         type: gemini
 *         model: gemini-2.0-flash
 *         api-keys: ${GEMINI_API_KEYS:}
 * </pre>
 *
 * @param localFallback      provider used as the emergency path on rate limits (blank: none)
 * @param credentialCooldown how long a rate-limited credential sits out
 */
@ConfigurationProperties(prefix = "dirgen.llm")
public record LlmProperties(
        @DefaultValue({"gemini", "local"}) List<String> priorityOrder,
        @DefaultValue("local")             String       localFallback,
        @DefaultValue                      Cache        cache,
        @DefaultValue("5m")                Duration     credentialCooldown,
        Map<String, ProviderConfig> providers
) {

    public LlmProperties {
        priorityOrder = priorityOrder == null ? List.of() : List.copyOf(priorityOrder);
        providers     = providers == null ? Map.of() : Map.copyOf(providers);
    }

    public record Cache(
            @DefaultValue("50")  int capacity,
            @DefaultValue("200") int promptPrefixChars
    ) {}

    public enum ProviderType { GEMINI, ANTHROPIC, OPENAI, LOCAL }

    /**
     * @param baseUrl API root; each type has a sensible default
     * @param timeout per-request timeout; null means the type's default
     */
    public record ProviderConfig(
            ProviderType type,
            String       baseUrl,
            String       model,
            List<String> apiKeys,
            Duration     timeout
    ) {
        public ProviderConfig {
            apiKeys = apiKeys == null ? List.of()
                    : apiKeys.stream().map(String::strip).filter(k -> !k.isEmpty()).toList();
        }
    }
}
