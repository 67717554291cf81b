package com.dirgen.orchestrator.llm.provider;

import com.dirgen.orchestrator.llm.CompletionRequest;
import com.dirgen.orchestrator.llm.LlmProperties.ProviderConfig;
import com.dirgen.orchestrator.llm.ProviderException;
import com.dirgen.orchestrator.llm.local.LocalModelManager;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * The self-hosted backend: an OpenAI-compatible endpoint in front of locally
 * run models. The model is started on demand through the
 * {@link LocalModelManager} before each call. Local inference is slow, hence
 * the long default timeout.
 */
public class LocalModelProvider extends OpenAiCompatibleProvider {

    private static final String   DEFAULT_BASE_URL = "http://localhost:12434/engines/v1";
    private static final Duration DEFAULT_TIMEOUT  = Duration.ofMinutes(15);

    private final LocalModelManager models;

    public LocalModelProvider(String name, ProviderConfig config, HttpClient http,
                              ObjectMapper json, LocalModelManager models) {
        super(name, config, http, json, null);
        this.models = models;
    }

    @Override
    public String complete(CompletionRequest request) {
        String model = model(request);
        if (model == null || model.isBlank()) {
            throw new ProviderException(ProviderException.Kind.GENERIC, name, "No local model configured or requested");
        }
        if (!models.ensureRunning(model)) {
            throw new ProviderException(ProviderException.Kind.GENERIC, name,
                    "Local model " + model + " could not be started");
        }
        return super.complete(request);
    }

    @Override
    protected String model(CompletionRequest request) {
        String requested = request.modelId();
        return (requested == null || requested.isBlank()) ? config.model() : requested;
    }

    @Override
    protected String defaultBaseUrl() {
        return DEFAULT_BASE_URL;
    }

    @Override
    protected Duration defaultTimeout() {
        return DEFAULT_TIMEOUT;
    }
}
