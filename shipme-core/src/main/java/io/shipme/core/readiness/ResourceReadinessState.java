package io.shipme.core.readiness;

public enum ResourceReadinessState {
    PENDING,
    ACTIVE,
    FAILED,
    TIMED_OUT
}
