package com.dirgen.orchestrator.llm.credential;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time statistics of one provider's credential pool.
 */
public record CredentialStats(
        String              provider,
        int                 totalCredentials,
        int                 availableCredentials,
        List<CredentialView> credentials
) {

    public record CredentialView(
            String  id,
            String  key,
            boolean active,
            boolean available,
            long    totalRequests,
            long    successfulRequests,
            double  successRate,
            int     consecutiveFailures,
            Instant lastUsed,
            Instant cooldownUntil
    ) {}
}
