package com.dirgen.orchestrator.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Bounded retry bookkeeping for the design stage of one run.
 *
 * Every failure is appended to the history; a retry is only granted while
 * fewer than {@code maxRetries} have been granted, so the counter never
 * exceeds the maximum.
 */
public class RetryRecord {

    private final int          maxRetries;
    private final List<String> failureHistory = new ArrayList<>();
    private int                attempts;

    public RetryRecord(int maxRetries) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, got " + maxRetries);
        }
        this.maxRetries = maxRetries;
    }

    /**
     * Record a failure and try to take one retry.
     *
     * @return true if a retry was granted (the counter was incremented)
     */
    public boolean recordFailure(String reason) {
        failureHistory.add(reason == null ? "unknown error" : reason);
        if (attempts >= maxRetries) {
            return false;
        }
        attempts++;
        return true;
    }

    /**
     * Feedback for the re-invoked design worker: the current error plus a
     * summary of every earlier one.
     */
    public String feedback() {
        String current = failureHistory.isEmpty() ? "" : failureHistory.get(failureHistory.size() - 1);
        StringBuilder sb = new StringBuilder()
                .append("Attempt ").append(attempts).append('/').append(maxRetries)
                .append(". Error: ").append(current);
        if (failureHistory.size() > 1) {
            sb.append(" Previous errors: ")
              .append(String.join("; ", failureHistory.subList(0, failureHistory.size() - 1)));
        }
        return sb.toString();
    }

    public int          attempts()       { return attempts; }
    public int          maxRetries()     { return maxRetries; }
    public List<String> failureHistory() { return Collections.unmodifiableList(failureHistory); }
}
