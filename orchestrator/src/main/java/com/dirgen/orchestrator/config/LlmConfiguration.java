package com.dirgen.orchestrator.config;

import com.dirgen.orchestrator.llm.LlmProperties;
import com.dirgen.orchestrator.llm.LlmProperties.ProviderConfig;
import com.dirgen.orchestrator.llm.LlmProperties.ProviderType;
import com.dirgen.orchestrator.llm.LlmProvider;
import com.dirgen.orchestrator.llm.ProviderFailoverEngine;
import com.dirgen.orchestrator.llm.ResponseCache;
import com.dirgen.orchestrator.llm.credential.CredentialPool;
import com.dirgen.orchestrator.llm.credential.CredentialPools;
import com.dirgen.orchestrator.llm.local.DockerModelRuntime;
import com.dirgen.orchestrator.llm.local.LocalModelManager;
import com.dirgen.orchestrator.llm.local.LocalModelProperties;
import com.dirgen.orchestrator.llm.local.ModelRuntime;
import com.dirgen.orchestrator.llm.provider.AnthropicProvider;
import com.dirgen.orchestrator.llm.provider.GeminiProvider;
import com.dirgen.orchestrator.llm.provider.LocalModelProvider;
import com.dirgen.orchestrator.llm.provider.OpenAiCompatibleProvider;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Wires the LLM resilience layer: one explicitly built instance of each
 * shared structure (cache, credential pools, local model manager) handed to
 * the failover engine.
 */
@Configuration
@EnableConfigurationProperties({LlmProperties.class, LocalModelProperties.class})
public class LlmConfiguration {

    @Bean
    public ResponseCache responseCache(LlmProperties props) {
        return new ResponseCache(props.cache().capacity(), props.cache().promptPrefixChars());
    }

    @Bean
    public CredentialPools credentialPools(LlmProperties props, Clock clock) {
        List<CredentialPool> pools = new ArrayList<>();
        props.providers().forEach((name, cfg) -> {
            if (cfg.type() != ProviderType.LOCAL) {
                pools.add(new CredentialPool(name, cfg.apiKeys(), props.credentialCooldown(), clock));
            }
        });
        return new CredentialPools(pools);
    }

    @Bean
    public ModelRuntime modelRuntime(LocalModelProperties props) {
        return new DockerModelRuntime(props);
    }

    @Bean
    public LocalModelManager localModelManager(ModelRuntime runtime, LocalModelProperties props, Clock clock) {
        return new LocalModelManager(runtime, props, clock);
    }

    @Bean
    public ProviderFailoverEngine providerFailoverEngine(LlmProperties props,
                                                         ResponseCache cache,
                                                         CredentialPools pools,
                                                         LocalModelManager localModels,
                                                         ObjectMapper objectMapper,
                                                         MeterRegistry meterRegistry) {
        HttpClient http = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)   // local runners don't do h2c upgrade
                .connectTimeout(Duration.ofSeconds(10))
                .build();

        List<LlmProvider> providers = new ArrayList<>();
        for (Map.Entry<String, ProviderConfig> e : props.providers().entrySet()) {
            String name = e.getKey();
            ProviderConfig cfg = e.getValue();
            if (cfg.type() == null) {
                throw new IllegalStateException("dirgen.llm.providers." + name + ".type is required");
            }
            providers.add(switch (cfg.type()) {
                case GEMINI    -> new GeminiProvider(name, cfg, http, objectMapper, pools.get(name).orElseThrow());
                case ANTHROPIC -> new AnthropicProvider(name, cfg, http, objectMapper, pools.get(name).orElseThrow());
                case OPENAI    -> new OpenAiCompatibleProvider(name, cfg, http, objectMapper, pools.get(name).orElseThrow());
                case LOCAL     -> new LocalModelProvider(name, cfg, http, objectMapper, localModels);
            });
        }
        return new ProviderFailoverEngine(providers, props.priorityOrder(), props.localFallback(), cache, meterRegistry);
    }
}
