package io.shipme.core.readiness;

import java.time.Duration;

public record ReadinessPolicy(
    Duration pollInterval,
    Duration maxWaitTime,
    String label
) {
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(5);
    public static final Duration DEFAULT_MAX_WAIT_TIME = Duration.ofSeconds(120);

    public ReadinessPolicy {
        if (pollInterval == null || pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive");
        }
        if (maxWaitTime == null || maxWaitTime.isNegative()) {
            throw new IllegalArgumentException("maxWaitTime must be a non-negative duration");
        }
        label = label == null || label.isBlank() ? "resource" : label;
    }

    public static ReadinessPolicy defaults(String label) {
        return new ReadinessPolicy(DEFAULT_POLL_INTERVAL, DEFAULT_MAX_WAIT_TIME, label);
    }

    public ReadinessPolicy withLabel(String newLabel) {
        return new ReadinessPolicy(pollInterval, maxWaitTime, newLabel);
    }
}
