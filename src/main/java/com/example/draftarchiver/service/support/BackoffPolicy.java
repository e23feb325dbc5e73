package com.example.draftarchiver.service.support;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Bounded retry schedule with exponential backoff and jitter.
 * The delay before retry {@code n} (1-based) is drawn from {@code [base/2, base]},
 * where {@code base = min(initialDelay * 2^(n-1), maxDelay)}.
 */
public class BackoffPolicy {

    private final int maxAttempts;
    private final long initialDelayMillis;
    private final long maxDelayMillis;

    public BackoffPolicy(int maxAttempts, Duration initialDelay, Duration maxDelay) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, was " + maxAttempts);
        }
        if (initialDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("Backoff delays cannot be negative.");
        }
        this.maxAttempts = maxAttempts;
        this.initialDelayMillis = initialDelay.toMillis();
        this.maxDelayMillis = Math.max(maxDelay.toMillis(), initialDelayMillis);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public boolean hasAttemptsLeft(int attemptsMade) {
        return attemptsMade < maxAttempts;
    }

    public long delayMillisBeforeRetry(int retryNumber) {
        if (retryNumber < 1 || initialDelayMillis == 0) {
            return 0;
        }
        int shift = Math.min(retryNumber - 1, 30);
        long base = Math.min(initialDelayMillis << shift, maxDelayMillis);
        if (base <= 1) {
            return base;
        }
        long half = base / 2;
        return half + ThreadLocalRandom.current().nextLong(base - half + 1);
    }

    public void sleepBeforeRetry(int retryNumber) throws InterruptedException {
        long delay = delayMillisBeforeRetry(retryNumber);
        if (delay > 0) {
            Thread.sleep(delay);
        }
    }
}
