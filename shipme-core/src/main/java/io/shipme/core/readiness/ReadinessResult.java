package io.shipme.core.readiness;

import java.time.Duration;

public record ReadinessResult<S>(
    ResourceReadinessState state,
    S status,
    int polls,
    Duration elapsed
) {
}
