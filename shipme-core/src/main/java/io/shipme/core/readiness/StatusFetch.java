package io.shipme.core.readiness;

@FunctionalInterface
public interface StatusFetch<S> {
    S fetch() throws Exception;
}
