package io.shipme.core.readiness;

import io.shipme.core.retry.ApiException;
import io.shipme.core.time.Sleeper;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Polls the status of an asynchronously provisioned resource until it is active, has failed, or the
 * deadline passes. A failing status fetch is logged and polling goes on unless the failure is a hard stop:
 * a {@link ResourceFailedException}, a client error other than 408/429, or an interrupt.
 */
public final class ReadinessPoller {
    private static final Logger LOG = LoggerFactory.getLogger(ReadinessPoller.class);

    private final Clock clock;
    private final Sleeper sleeper;

    public ReadinessPoller() {
        this(Clock.systemUTC(), Sleeper.SYSTEM);
    }

    public ReadinessPoller(Clock clock, Sleeper sleeper) {
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public <S> ReadinessResult<S> waitUntilReady(
        StatusFetch<S> statusFetch,
        Predicate<? super S> isTerminalSuccess,
        Predicate<? super S> isTerminalFailure,
        ReadinessPolicy policy
    ) throws InterruptedException {
        Instant start = clock.instant();
        int polls = 0;
        S lastStatus = null;

        while (true) {
            Duration elapsed = Duration.between(start, clock.instant());
            if (elapsed.compareTo(policy.maxWaitTime()) >= 0) {
                LOG.warn("{} not ready after {} poll(s), giving up", policy.label(), polls);
                throw new ResourceTimeoutException(policy.label(), policy.maxWaitTime(), elapsed, lastStatus);
            }

            polls++;
            try {
                S status = statusFetch.fetch();
                lastStatus = status;
                if (status != null && isTerminalSuccess.test(status)) {
                    Duration total = Duration.between(start, clock.instant());
                    LOG.info("{} is ready after {} poll(s)", policy.label(), polls);
                    return new ReadinessResult<>(ResourceReadinessState.ACTIVE, status, polls, total);
                }
                if (status != null && isTerminalFailure.test(status)) {
                    LOG.warn("{} failed with status {}", policy.label(), status);
                    throw new ResourceFailedException(policy.label(), status);
                }
                LOG.info("{} status: {}...", policy.label(), status);
            } catch (ResourceFailedException | InterruptedException e) {
                throw e;
            } catch (Exception e) {
                if (e instanceof ApiException api && hardStop(api)) {
                    LOG.warn("Status check for {} rejected with HTTP {}", policy.label(), api.status());
                    throw api;
                }
                LOG.warn("Status check for {} failed, will poll again: {}", policy.label(), e.getMessage());
            }

            Duration remaining = policy.maxWaitTime().minus(Duration.between(start, clock.instant()));
            if (remaining.isNegative() || remaining.isZero()) {
                continue;
            }
            sleeper.sleep(remaining.compareTo(policy.pollInterval()) < 0 ? remaining : policy.pollInterval());
        }
    }

    private boolean hardStop(ApiException failure) {
        int status = failure.status();
        // a freshly created resource can briefly be missing from its status endpoint
        return failure.clientError() && status != 404 && status != 408 && status != 429;
    }
}
