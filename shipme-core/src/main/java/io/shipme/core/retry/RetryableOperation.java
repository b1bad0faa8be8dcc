package io.shipme.core.retry;

@FunctionalInterface
public interface RetryableOperation<T> {
    T execute() throws Exception;
}
