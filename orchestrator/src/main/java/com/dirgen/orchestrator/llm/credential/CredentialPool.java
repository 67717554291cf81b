package com.dirgen.orchestrator.llm.credential;

import com.dirgen.orchestrator.llm.ProviderErrorClassifier;
import com.dirgen.orchestrator.llm.ProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Rotates among the equivalent API keys of one provider.
 *
 * Selection (current()):
 *   - one key configured: always that key
 *   - otherwise round-robin over the available keys (active, not cooling down)
 *   - none available: the key whose cooldown ends soonest
 *
 * A failure whose text looks like a rate limit puts the key in cooldown;
 * a credential error (rejected key) deactivates it until reset(). Selection
 * and reporting share one lock because both read-modify-write the same state.
 */
public class CredentialPool {

    private static final Logger log = LoggerFactory.getLogger(CredentialPool.class);

    private final String                   provider;
    private final List<ProviderCredential> credentials;
    private final Duration                 cooldown;
    private final Clock                    clock;
    private final ReentrantLock            lock = new ReentrantLock();

    private int index;

    public CredentialPool(String provider, List<String> secrets, Duration cooldown, Clock clock) {
        this.provider = provider;
        this.cooldown = cooldown;
        this.clock    = clock;
        List<ProviderCredential> creds = new ArrayList<>();
        for (int i = 0; i < secrets.size(); i++) {
            creds.add(new ProviderCredential(provider + "-key-" + (i + 1), secrets.get(i)));
        }
        this.credentials = List.copyOf(creds);
        log.info("Credential pool for '{}': {} key(s)", provider, credentials.size());
    }

    public String provider() {
        return provider;
    }

    public int size() {
        return credentials.size();
    }

    // ------------------------------------------------------------------
    // Selection and reporting
    // ------------------------------------------------------------------

    /**
     * @throws ProviderException (CREDENTIAL) if no key is configured
     */
    public ProviderCredential current() {
        lock.lock();
        try {
            if (credentials.isEmpty()) {
                throw new ProviderException(ProviderException.Kind.CREDENTIAL, provider,
                        "No API key configured for provider " + provider);
            }
            Instant now = clock.instant();
            ProviderCredential chosen;
            if (credentials.size() == 1) {
                chosen = credentials.get(0);
            } else {
                List<ProviderCredential> available = credentials.stream()
                        .filter(c -> c.isAvailable(now))
                        .toList();
                if (available.isEmpty()) {
                    chosen = credentials.stream()
                            .min(Comparator.comparing(ProviderCredential::getCooldownUntil,
                                    Comparator.nullsFirst(Comparator.naturalOrder())))
                            .orElseThrow();
                    log.warn("All {} keys of '{}' are unavailable; using {} (cooldown until {})",
                            credentials.size(), provider, chosen, chosen.getCooldownUntil());
                } else {
                    if (index >= available.size()) {
                        index = 0;
                    }
                    chosen = available.get(index);
                    index  = (index + 1) % available.size();
                }
            }
            chosen.markUsed(now);
            return chosen;
        } finally {
            lock.unlock();
        }
    }

    public void report(ProviderCredential credential, boolean success, String errorText) {
        if (success) {
            report(credential, null, null);
        } else {
            report(credential, ProviderErrorClassifier.classify(errorText), errorText);
        }
    }

    /**
     * Record the outcome of a call made with {@code credential}. A {@code null} kind means success.
     * The kind wins over the error text, so an HTTP 401/403 deactivates the key even when the
     * body says nothing recognisable.
     */
    public void report(ProviderCredential credential, ProviderException.Kind failure, String errorText) {
        lock.lock();
        try {
            if (failure == null) {
                credential.recordSuccess();
                return;
            }
            credential.recordFailure();
            if (failure == ProviderException.Kind.RATE_LIMIT || ProviderErrorClassifier.isRateLimit(errorText)) {
                Instant until = clock.instant().plus(cooldown);
                credential.coolDownUntil(until);
                log.warn("Key {} of '{}' rate limited; cooling down until {}", credential, provider, until);
            } else if (credentials.size() > 1 && failure == ProviderException.Kind.CREDENTIAL) {
                credential.deactivate();
                log.warn("Key {} of '{}' rejected; deactivated until reset", credential, provider);
            } else {
                log.debug("Key {} of '{}' failed ({} in a row)", credential, provider,
                        credential.getConsecutiveFailures());
            }
        } finally {
            lock.unlock();
        }
    }

    /** Clear every cooldown, failure streak and deactivation. */
    public void reset() {
        lock.lock();
        try {
            credentials.forEach(ProviderCredential::restore);
            log.info("Credential pool for '{}' reset", provider);
        } finally {
            lock.unlock();
        }
    }

    public CredentialStats stats() {
        lock.lock();
        try {
            Instant now = clock.instant();
            List<CredentialStats.CredentialView> views = credentials.stream()
                    .map(c -> new CredentialStats.CredentialView(
                            c.getId(),
                            c.maskedSecret(),
                            c.isActive(),
                            c.isAvailable(now),
                            c.getTotalRequests(),
                            c.getSuccessfulRequests(),
                            c.getTotalRequests() == 0 ? 0.0
                                    : (double) c.getSuccessfulRequests() / c.getTotalRequests(),
                            c.getConsecutiveFailures(),
                            c.getLastUsed(),
                            c.getCooldownUntil()))
                    .toList();
            int available = (int) views.stream().filter(CredentialStats.CredentialView::available).count();
            return new CredentialStats(provider, credentials.size(), available, views);
        } finally {
            lock.unlock();
        }
    }
}
