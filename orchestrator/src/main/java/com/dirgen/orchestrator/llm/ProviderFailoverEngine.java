package com.dirgen.orchestrator.llm;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * One call surface over every configured backend.
 *
 * ask() flow:
 *   1. Cacheable task class: answer from the cache if possible
 *   2. Order the candidates for the task class
 *   3. Try each in turn; the first success wins (and is cached if eligible)
 *   4. A rate-limited cloud provider trips the breaker: the local fallback
 *      is tried right away, once per ask, before moving on
 *   5. Credential, connectivity and any other errors just move on
 *   6. Nobody answered: ProvidersExhaustedException
 *
 * Metrics:
 * <pre>
 *   dirgen.llm.calls{provider, status="success|rate_limit|credential|connectivity|generic"}
 *   dirgen.llm.duration{provider}
 *   dirgen.llm.cache{result="hit|miss"}
 * </pre>
 */
public class ProviderFailoverEngine {

    private static final Logger log = LoggerFactory.getLogger(ProviderFailoverEngine.class);

    private final Map<String, LlmProvider> providers = new LinkedHashMap<>();
    private final List<String>  priorityOrder;
    private final String        localFallback;
    private final ResponseCache cache;
    private final MeterRegistry meterRegistry;

    /**
     * @param localFallback name of the local provider used as the emergency path, or null for none
     */
    public ProviderFailoverEngine(List<LlmProvider> providers,
                                  List<String> priorityOrder,
                                  String localFallback,
                                  ResponseCache cache,
                                  MeterRegistry meterRegistry) {
        providers.forEach(p -> this.providers.put(p.name(), p));
        this.priorityOrder = List.copyOf(priorityOrder);
        this.localFallback = (localFallback == null || localFallback.isBlank()) ? null : localFallback;
        this.cache         = cache;
        this.meterRegistry = meterRegistry;
        log.info("LLM providers: {} (priority {}, local fallback {})",
                this.providers.keySet(), this.priorityOrder, this.localFallback);
    }

    // ------------------------------------------------------------------
    // Public API
    // ------------------------------------------------------------------

    /**
     * @throws ProvidersExhaustedException if every candidate failed
     */
    public String ask(String modelId, String systemPrompt, String userPrompt,
                      TaskClass taskClass, boolean useCache) {
        String cacheKey = null;
        if (useCache && taskClass.cacheable()) {
            cacheKey = cache.key(systemPrompt, userPrompt);
            Optional<String> hit = cache.get(cacheKey);
            meterRegistry.counter("dirgen.llm.cache", "result", hit.isPresent() ? "hit" : "miss").increment();
            if (hit.isPresent()) {
                log.debug("Cache hit for task '{}'", taskClass.wireName());
                return hit.get();
            }
        }

        CompletionRequest request = CompletionRequest.of(modelId, systemPrompt, userPrompt);
        Set<String> attempted      = new HashSet<>();
        boolean     rateLimited    = false;
        boolean     emergencyTried = false;
        ProviderException lastError = null;

        for (String name : candidateOrder(taskClass)) {
            LlmProvider provider = providers.get(name);
            if (provider == null) {
                log.warn("Provider '{}' is in the priority order but not configured", name);
                continue;
            }
            if (!attempted.add(name)) {
                continue;   // already tried as the emergency fallback
            }
            try {
                return remember(cacheKey, call(provider, request));
            } catch (ProviderException e) {
                lastError = e;
                switch (e.getKind()) {
                    case RATE_LIMIT -> {
                        rateLimited = true;
                        log.warn("Provider '{}' is rate limited: {}", name, e.getMessage());
                        if (!emergencyTried && localFallback != null
                                && !name.equals(localFallback) && !attempted.contains(localFallback)) {
                            emergencyTried = true;
                            LlmProvider local = providers.get(localFallback);
                            if (local != null) {
                                attempted.add(localFallback);
                                log.warn("Rate limit on '{}', trying local fallback '{}'", name, localFallback);
                                try {
                                    // not cached: a cloud provider should answer next time
                                    return call(local, request);
                                } catch (ProviderException fallbackError) {
                                    lastError = fallbackError;
                                    log.warn("Local fallback failed: {}", fallbackError.getMessage());
                                }
                            }
                        }
                    }
                    case CREDENTIAL   -> log.warn("Provider '{}' credential/configuration error: {}", name, e.getMessage());
                    case CONNECTIVITY -> log.warn("Provider '{}' unreachable: {}", name, e.getMessage());
                    case GENERIC      -> log.warn("Provider '{}' failed: {}", name, e.getMessage());
                }
            }
        }

        ProvidersExhaustedException exhausted = new ProvidersExhaustedException(taskClass, rateLimited, lastError);
        log.error(exhausted.getMessage());
        throw exhausted;
    }

    /**
     * Providers to try for a task class, in order. Local-first classes move the
     * local fallback to the front; every other class keeps the base order.
     */
    public List<String> candidateOrder(TaskClass taskClass) {
        if (!taskClass.localFirst() || localFallback == null) {
            return priorityOrder;
        }
        List<String> order = new ArrayList<>();
        order.add(localFallback);
        priorityOrder.stream().filter(p -> !p.equals(localFallback)).forEach(order::add);
        return order;
    }

    public ResponseCache cache() {
        return cache;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private String call(LlmProvider provider, CompletionRequest request) {
        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "success";
        try {
            return provider.complete(request);
        } catch (ProviderException e) {
            status = e.getKind().name().toLowerCase();
            throw e;
        } catch (RuntimeException e) {
            ProviderException.Kind kind = ProviderErrorClassifier.classify(e.getMessage());
            status = kind.name().toLowerCase();
            throw new ProviderException(kind, provider.name(), String.valueOf(e.getMessage()), e);
        } finally {
            sample.stop(meterRegistry.timer("dirgen.llm.duration", "provider", provider.name()));
            meterRegistry.counter("dirgen.llm.calls", "provider", provider.name(), "status", status).increment();
        }
    }

    private String remember(String cacheKey, String text) {
        if (cacheKey != null) {
            cache.put(cacheKey, text);
        }
        return text;
    }
}
