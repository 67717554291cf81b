package com.dirgen.orchestrator.llm.provider;

import com.dirgen.orchestrator.llm.CompletionRequest;
import com.dirgen.orchestrator.llm.LlmProperties.ProviderConfig;
import com.dirgen.orchestrator.llm.LlmProvider;
import com.dirgen.orchestrator.llm.ProviderErrorClassifier;
import com.dirgen.orchestrator.llm.ProviderException;
import com.dirgen.orchestrator.llm.credential.CredentialPool;
import com.dirgen.orchestrator.llm.credential.ProviderCredential;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

/**
 * Shared plumbing for providers reached over JSON/HTTP.
 *
 * Uses java.net.http.HttpClient directly: every provider is a plain REST
 * endpoint, and we want to see each header and status code ourselves.
 *
 * Subclasses supply the endpoint, request body, auth headers and reply
 * extraction. This class maps transport problems onto ProviderException kinds:
 *   429           → RATE_LIMIT
 *   401 / 403     → CREDENTIAL
 *   other non-2xx → classified from the body text
 *   timeout / I/O → CONNECTIVITY
 * and reports every outcome to the credential pool, when there is one.
 */
public abstract class HttpLlmProvider implements LlmProvider {

    protected final String         name;
    protected final ProviderConfig config;
    protected final HttpClient     http;
    protected final ObjectMapper   json;
    private   final CredentialPool credentials;

    protected HttpLlmProvider(String name, ProviderConfig config, HttpClient http,
                              ObjectMapper json, CredentialPool credentials) {
        this.name        = name;
        this.config      = config;
        this.http        = http;
        this.json        = json;
        this.credentials = credentials;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String complete(CompletionRequest request) {
        ProviderCredential credential = credentials == null ? null : credentials.current();
        try {
            String text = send(request, credential);
            if (credential != null) {
                credentials.report(credential, true, null);
            }
            return text;
        } catch (ProviderException e) {
            if (credential != null) {
                credentials.report(credential, e.getKind(), e.getMessage());
            }
            throw e;
        }
    }

    // ------------------------------------------------------------------
    // Subclass hooks
    // ------------------------------------------------------------------

    protected abstract String endpoint(CompletionRequest request);

    protected abstract Object requestBody(CompletionRequest request);

    /** Add auth headers; {@code credential} is null for providers without a pool. */
    protected abstract void authorize(HttpRequest.Builder builder, ProviderCredential credential);

    protected abstract String extractText(JsonNode reply);

    protected Duration defaultTimeout() {
        return Duration.ofSeconds(60);
    }

    protected String model(CompletionRequest request) {
        return config.model();
    }

    protected String baseUrl(String fallback) {
        String url = (config.baseUrl() == null || config.baseUrl().isBlank()) ? fallback : config.baseUrl();
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    // ------------------------------------------------------------------
    // Transport
    // ------------------------------------------------------------------

    private String send(CompletionRequest request, ProviderCredential credential) {
        Duration timeout = config.timeout() != null ? config.timeout() : defaultTimeout();
        try {
            HttpRequest.Builder builder = HttpRequest.newBuilder()
                    .uri(URI.create(endpoint(request)))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .header("Accept",       "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(json.writeValueAsString(requestBody(request))));
            authorize(builder, credential);

            HttpResponse<String> resp = http.send(builder.build(), HttpResponse.BodyHandlers.ofString());
            int status = resp.statusCode();
            if (status < 200 || status >= 300) {
                throw new ProviderException(kindForStatus(status, resp.body()), name,
                        "HTTP %d: %s".formatted(status, truncate(resp.body())));
            }

            String text = extractText(json.readTree(resp.body()));
            if (text == null || text.isBlank()) {
                throw new ProviderException(ProviderException.Kind.GENERIC, name, "Empty reply");
            }
            return text;
        } catch (ProviderException e) {
            throw e;
        } catch (HttpTimeoutException e) {
            throw new ProviderException(ProviderException.Kind.CONNECTIVITY, name,
                    "Request timeout after " + timeout.toSeconds() + "s", e);
        } catch (JsonProcessingException e) {
            throw new ProviderException(ProviderException.Kind.GENERIC, name,
                    "Unreadable reply: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ProviderException(ProviderException.Kind.CONNECTIVITY, name,
                    "Connection failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException(ProviderException.Kind.CONNECTIVITY, name, "Interrupted", e);
        } catch (RuntimeException e) {
            throw new ProviderException(ProviderErrorClassifier.classify(e.getMessage()), name,
                    String.valueOf(e.getMessage()), e);
        }
    }

    static ProviderException.Kind kindForStatus(int status, String body) {
        if (status == 429) {
            return ProviderException.Kind.RATE_LIMIT;
        }
        if (status == 401 || status == 403) {
            return ProviderException.Kind.CREDENTIAL;
        }
        return ProviderErrorClassifier.classify(body);
    }

    private static String truncate(String s) {
        if (s == null) {
            return "";
        }
        return s.length() <= 500 ? s : s.substring(0, 500) + "...";
    }
}
