package com.memquest.providers;

/**
 * Attempt ceiling and exponential backoff: the wait after attempt {@code n} (0-based)
 * is {@code baseDelayMs * 2^n}, capped at {@code maxBackoffMs}.
 */
public record RetryPolicy(int maxAttempts, long baseDelayMs, long maxBackoffMs) {

    public RetryPolicy {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
        baseDelayMs = Math.max(baseDelayMs, 0);
        maxBackoffMs = Math.max(maxBackoffMs, baseDelayMs);
    }

    public static RetryPolicy exponential(int maxAttempts, long baseDelayMs) {
        return new RetryPolicy(maxAttempts, baseDelayMs, 30_000);
    }

    public long delayForAttempt(int attempt) {
        long delay = baseDelayMs;
        for (int i = 0; i < attempt && delay < maxBackoffMs; i++) {
            delay *= 2;
        }
        return Math.min(delay, maxBackoffMs);
    }
}
