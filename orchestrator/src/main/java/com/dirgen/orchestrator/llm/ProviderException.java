package com.dirgen.orchestrator.llm;

/**
 * A single provider call failed. Never fatal on its own: the failover engine
 * moves on to the next candidate.
 */
public class ProviderException extends RuntimeException {

    public enum Kind { RATE_LIMIT, CREDENTIAL, CONNECTIVITY, GENERIC }

    private final Kind   kind;
    private final String provider;

    public ProviderException(Kind kind, String provider, String message) {
        super("[" + provider + "] " + message);
        this.kind     = kind;
        this.provider = provider;
    }

    public ProviderException(Kind kind, String provider, String message, Throwable cause) {
        super("[" + provider + "] " + message, cause);
        this.kind     = kind;
        this.provider = provider;
    }

    public Kind   getKind()     { return kind; }
    public String getProvider() { return provider; }
}
