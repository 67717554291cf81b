package com.dirgen.orchestrator.llm.credential;

import java.time.Instant;

/**
 * One API key of a provider and its health. Mutated only by
 * {@link CredentialPool}, under its lock.
 */
public class ProviderCredential {

    private final String id;
    private final String secret;

    private boolean active = true;
    private Instant lastUsed;
    private int     consecutiveFailures;
    private Instant cooldownUntil;
    private long    totalRequests;
    private long    successfulRequests;

    public ProviderCredential(String id, String secret) {
        this.id     = id;
        this.secret = secret;
    }

    public boolean isAvailable(Instant now) {
        return active && (cooldownUntil == null || !now.isBefore(cooldownUntil));
    }

    // ------------------------------------------------------------------
    // Package-private mutators (CredentialPool only)
    // ------------------------------------------------------------------

    void markUsed(Instant at)            { this.lastUsed = at; }
    void recordSuccess() {
        totalRequests++;
        successfulRequests++;
        consecutiveFailures = 0;
    }
    void recordFailure() {
        totalRequests++;
        consecutiveFailures++;
    }
    void coolDownUntil(Instant until)    { this.cooldownUntil = until; }
    void deactivate()                    { this.active = false; }
    void restore() {
        this.active              = true;
        this.cooldownUntil       = null;
        this.consecutiveFailures = 0;
    }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    public String  getId()                  { return id; }
    public String  getSecret()              { return secret; }
    public boolean isActive()               { return active; }
    public Instant getLastUsed()            { return lastUsed; }
    public int     getConsecutiveFailures() { return consecutiveFailures; }
    public Instant getCooldownUntil()       { return cooldownUntil; }
    public long    getTotalRequests()       { return totalRequests; }
    public long    getSuccessfulRequests()  { return successfulRequests; }

    /** Last four characters of the secret, for logs and stats. */
    public String maskedSecret() {
        if (secret == null || secret.length() <= 4) {
            return "****";
        }
        return "..." + secret.substring(secret.length() - 4);
    }

    @Override
    public String toString() {
        return id + "(" + maskedSecret() + ")";
    }
}
