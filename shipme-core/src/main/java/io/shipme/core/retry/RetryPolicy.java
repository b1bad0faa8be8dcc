package io.shipme.core.retry;

import java.time.Duration;
import java.util.Set;

public record RetryPolicy(
    int maxRetries,
    Duration initialDelay,
    Set<Integer> retryableStatuses,
    String label
) {
    public static final int DEFAULT_MAX_RETRIES = 3;
    /** Upper bound on {@code maxRetries}; backoff delays are computed for attempt indexes below it. */
    public static final int MAX_RETRIES_LIMIT = 30;
    public static final Duration DEFAULT_INITIAL_DELAY = Duration.ofSeconds(1);
    public static final Set<Integer> DEFAULT_RETRYABLE_STATUSES = Set.of(429, 502, 503, 504);

    public RetryPolicy {
        if (maxRetries < 0 || maxRetries > MAX_RETRIES_LIMIT) {
            throw new IllegalArgumentException("maxRetries must be between 0 and " + MAX_RETRIES_LIMIT);
        }
        if (initialDelay == null || initialDelay.isNegative()) {
            throw new IllegalArgumentException("initialDelay must be a non-negative duration");
        }
        retryableStatuses = retryableStatuses == null ? Set.of() : Set.copyOf(retryableStatuses);
        label = label == null || label.isBlank() ? "API call" : label;
    }

    public static RetryPolicy defaults(String label) {
        return new RetryPolicy(DEFAULT_MAX_RETRIES, DEFAULT_INITIAL_DELAY, DEFAULT_RETRYABLE_STATUSES, label);
    }

    public RetryPolicy withLabel(String newLabel) {
        return new RetryPolicy(maxRetries, initialDelay, retryableStatuses, newLabel);
    }

    public int maxAttempts() {
        return maxRetries + 1;
    }

    public Duration delayBefore(int attemptIndex) {
        if (attemptIndex < 0 || attemptIndex >= MAX_RETRIES_LIMIT) {
            throw new IllegalArgumentException("attemptIndex out of range: " + attemptIndex);
        }
        return initialDelay.multipliedBy(1L << attemptIndex);
    }
}
