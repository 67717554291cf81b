package com.dirgen.orchestrator.llm;

import java.util.List;
import java.util.Locale;

/**
 * Classifies provider error text. Providers don't agree on error formats (or
 * languages), so this matches a fixed list of textual indicators.
 */
public final class ProviderErrorClassifier {

    static final List<String> RATE_LIMIT_INDICATORS = List.of(
            "rate limit",
            "too many requests",
            "quota exceeded",
            "demasiadas peticiones",
            "límite excedido",
            "429",
            "quota_exceeded",
            "rate_limit_exceeded",
            "usage_limit");

    private static final List<String> CONNECTIVITY_INDICATORS = List.of("timeout", "timed out", "connection", "network");

    private ProviderErrorClassifier() {}

    public static boolean isRateLimit(String errorText) {
        if (errorText == null) {
            return false;
        }
        String lower = errorText.toLowerCase(Locale.ROOT);
        return RATE_LIMIT_INDICATORS.stream().anyMatch(lower::contains);
    }

    public static ProviderException.Kind classify(String errorText) {
        if (errorText == null || errorText.isBlank()) {
            return ProviderException.Kind.GENERIC;
        }
        if (isRateLimit(errorText)) {
            return ProviderException.Kind.RATE_LIMIT;
        }
        String lower = errorText.toLowerCase(Locale.ROOT);
        if (lower.contains("api") && lower.contains("key")) {
            return ProviderException.Kind.CREDENTIAL;
        }
        if (CONNECTIVITY_INDICATORS.stream().anyMatch(lower::contains)) {
            return ProviderException.Kind.CONNECTIVITY;
        }
        return ProviderException.Kind.GENERIC;
    }
}
