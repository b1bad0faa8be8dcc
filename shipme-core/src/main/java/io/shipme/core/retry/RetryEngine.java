package io.shipme.core.retry;

import io.shipme.core.time.Sleeper;
import java.time.Duration;
import java.util.OptionalInt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exponential backoff without jitter. Failures without a status code are presumed transient;
 * failures with a status outside the policy's retryable set are rethrown at once.
 */
public final class RetryEngine {
    private static final Logger LOG = LoggerFactory.getLogger(RetryEngine.class);

    private final Sleeper sleeper;

    public RetryEngine() {
        this(Sleeper.SYSTEM);
    }

    public RetryEngine(Sleeper sleeper) {
        this.sleeper = sleeper;
    }

    public <T> T withRetry(RetryableOperation<T> operation, RetryPolicy policy) throws Exception {
        int attempts = policy.maxAttempts();
        for (int attempt = 0; ; attempt++) {
            try {
                return operation.execute();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw e;
            } catch (Exception e) {
                boolean attemptsLeft = attempt < policy.maxRetries();
                if (!attemptsLeft || !retryable(e, policy)) {
                    throw e;
                }
                Duration delay = policy.delayBefore(attempt);
                LOG.warn(
                    "[Retry] {} failed (attempt {}/{}), retrying in {}ms: {}",
                    policy.label(),
                    attempt + 1,
                    attempts,
                    delay.toMillis(),
                    e.getMessage()
                );
                pause(delay, policy, e);
            }
        }
    }

    private boolean retryable(Exception failure, RetryPolicy policy) {
        OptionalInt status = StatusCodes.of(failure);
        return status.isEmpty() || policy.retryableStatuses().contains(status.getAsInt());
    }

    private void pause(Duration delay, RetryPolicy policy, Exception pending) throws Exception {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pending.addSuppressed(e);
            LOG.debug("Retry wait for {} interrupted", policy.label());
            throw pending;
        }
    }
}
