package com.parametric.payout;

import java.time.Duration;
import java.time.Instant;

/**
 * Attempt bookkeeping for one transaction. {@code currentRetry} counts failed attempts;
 * the transaction gives up when it reaches {@code maxRetries}.
 */
public record RetryMechanism(int maxRetries, int currentRetry, double backoffMultiplier, Instant nextRetryAt) {

    public static RetryMechanism initial(int maxRetries, double backoffMultiplier) {
        return new RetryMechanism(maxRetries, 0, backoffMultiplier, null);
    }

    public boolean exhaustedAfterFailure() {
        return currentRetry + 1 >= maxRetries;
    }

    /** Records a failed attempt and schedules the next one at {@code delay * multiplier^(failures - 1)}. */
    public RetryMechanism afterFailure(Instant now, Duration baseDelay) {
        int failures = currentRetry + 1;
        long delayMillis = Math.round(baseDelay.toMillis() * Math.pow(backoffMultiplier, failures - 1));
        return new RetryMechanism(maxRetries, failures, backoffMultiplier, now.plusMillis(delayMillis));
    }

    public RetryMechanism exhausted() {
        return new RetryMechanism(maxRetries, currentRetry + 1, backoffMultiplier, null);
    }
}
