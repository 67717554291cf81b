package com.dirgen.orchestrator.llm.credential;

import com.dirgen.orchestrator.llm.ProviderException;
import com.dirgen.orchestrator.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CredentialPoolTest {

    private static final Duration COOLDOWN = Duration.ofMinutes(5);

    MutableClock clock;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-01-05T09:00:00Z");
    }

    @Test
    void current_rotatesRoundRobinOverAvailableKeys() {
        CredentialPool pool = pool("k1-aaaa", "k2-bbbb", "k3-cccc");

        assertThat(ids(pool, 4)).containsExactly("gemini-key-1", "gemini-key-2", "gemini-key-3", "gemini-key-1");
    }

    @Test
    void rateLimitedKey_isSkippedUntilCooldownEnds() {
        CredentialPool pool = pool("k1-aaaa", "k2-bbbb", "k3-cccc");
        ProviderCredential first = pool.current();
        pool.report(first, false, "429 Resource has been exhausted");

        assertThat(ids(pool, 6)).doesNotContain("gemini-key-1");

        clock.advance(COOLDOWN);
        assertThat(ids(pool, 3)).contains("gemini-key-1");
    }

    @Test
    void allKeysCoolingDown_returnsTheOneWhoseCooldownEndsFirst() {
        CredentialPool pool = pool("k1-aaaa", "k2-bbbb");
        ProviderCredential k1 = pool.current();
        pool.report(k1, false, "rate limit exceeded");
        clock.advance(Duration.ofMinutes(1));
        ProviderCredential k2 = pool.current();
        pool.report(k2, false, "quota exceeded");

        assertThat(k2.getId()).isEqualTo("gemini-key-2");
        assertThat(pool.current().getId()).isEqualTo("gemini-key-1");
        assertThat(pool.stats().availableCredentials()).isZero();
    }

    @Test
    void singleKey_isAlwaysReturnedEvenWhileCoolingDown() {
        CredentialPool pool = pool("only-key-1234");
        ProviderCredential key = pool.current();
        pool.report(key, false, "HTTP 429");

        assertThat(pool.current()).isSameAs(key);
        assertThat(key.isAvailable(clock.instant())).isFalse();
    }

    @Test
    void rejectedKey_isDeactivatedUntilReset() {
        CredentialPool pool = pool("bad-key-0000", "good-key-1111");
        ProviderCredential bad = pool.current();
        pool.report(bad, false, "API key not valid. Please pass a valid API key.");

        assertThat(bad.isActive()).isFalse();
        assertThat(ids(pool, 3)).containsOnly("gemini-key-2");

        pool.reset();
        assertThat(bad.isActive()).isTrue();
        assertThat(ids(pool, 2)).contains("gemini-key-1");
    }

    @Test
    void credentialKind_deactivatesEvenWithoutRecognisableText() {
        CredentialPool pool = pool("bad-key-0000", "good-key-1111");
        ProviderCredential bad = pool.current();
        pool.report(bad, ProviderException.Kind.CREDENTIAL, "[gemini] HTTP 403: {\"error\":\"status 403\"}");

        assertThat(bad.isActive()).isFalse();
        assertThat(ids(pool, 2)).containsOnly("gemini-key-2");
    }

    @Test
    void rateLimitKind_coolsDownEvenWithoutRecognisableText() {
        CredentialPool pool = pool("k1-aaaa", "k2-bbbb");
        ProviderCredential first = pool.current();
        pool.report(first, ProviderException.Kind.RATE_LIMIT, "[gemini] HTTP 429: {}");

        assertThat(first.isActive()).isTrue();
        assertThat(first.isAvailable(clock.instant())).isFalse();
    }

    @Test
    void credentialKind_singleKey_staysActive() {
        CredentialPool pool = pool("only-key-1234");
        ProviderCredential key = pool.current();
        pool.report(key, ProviderException.Kind.CREDENTIAL, "HTTP 401");

        assertThat(key.isActive()).isTrue();
        assertThat(key.getConsecutiveFailures()).isEqualTo(1);
    }

    @Test
    void noKeys_isACredentialError() {
        CredentialPool pool = pool();

        assertThatThrownBy(pool::current)
                .isInstanceOf(ProviderException.class)
                .satisfies(e -> assertThat(((ProviderException) e).getKind())
                        .isEqualTo(ProviderException.Kind.CREDENTIAL));
    }

    @Test
    void stats_reportCountsMaskedKeysAndSuccessRate() {
        CredentialPool pool = pool("secret-abcd", "secret-wxyz");
        ProviderCredential k1 = pool.current();
        pool.report(k1, true, null);
        pool.report(k1, false, "model overloaded");

        CredentialStats stats = pool.stats();

        assertThat(stats.provider()).isEqualTo("gemini");
        assertThat(stats.totalCredentials()).isEqualTo(2);
        assertThat(stats.availableCredentials()).isEqualTo(2);
        CredentialStats.CredentialView view = stats.credentials().get(0);
        assertThat(view.key()).isEqualTo("...abcd");
        assertThat(view.totalRequests()).isEqualTo(2);
        assertThat(view.successRate()).isEqualTo(0.5);
        assertThat(view.consecutiveFailures()).isEqualTo(1);
        assertThat(view.lastUsed()).isEqualTo(clock.instant());
    }

    // ------------------------------------------------------------------

    private CredentialPool pool(String... secrets) {
        return new CredentialPool("gemini", List.of(secrets), COOLDOWN, clock);
    }

    private static List<String> ids(CredentialPool pool, int calls) {
        List<String> out = new ArrayList<>();
        for (int i = 0; i < calls; i++) {
            out.add(pool.current().getId());
        }
        return out;
    }
}
