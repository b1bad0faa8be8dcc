package io.shipme.core.readiness;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.shipme.core.retry.ApiException;
import io.shipme.core.time.ManualClock;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class ReadinessPollerTest {

    private static final Duration INTERVAL = Duration.ofSeconds(5);

    private final ManualClock clock = new ManualClock();
    private final ReadinessPoller poller = new ReadinessPoller(clock, clock);

    @Test
    void shouldReturnActiveAfterThirdPoll() throws Exception {
        Deque<String> statuses = new ArrayDeque<>(List.of("COMING_UP", "COMING_UP", "ACTIVE_HEALTHY"));

        ReadinessResult<String> result = poller.waitUntilReady(
            statuses::pop,
            "ACTIVE_HEALTHY"::equals,
            "INIT_FAILED"::equals,
            new ReadinessPolicy(INTERVAL, Duration.ofSeconds(120), "project abc")
        );

        assertThat(result.state()).isEqualTo(ResourceReadinessState.ACTIVE);
        assertThat(result.status()).isEqualTo("ACTIVE_HEALTHY");
        assertThat(result.polls()).isEqualTo(3);
        assertThat(result.elapsed()).isEqualTo(Duration.ofSeconds(10));
        assertThat(clock.sleeps()).containsExactly(INTERVAL, INTERVAL);
    }

    @Test
    void shouldTimeOutWhenNoTerminalStateIsReached() {
        AtomicInteger polls = new AtomicInteger();

        assertThatThrownBy(() -> poller.waitUntilReady(
            () -> {
                polls.incrementAndGet();
                return "COMING_UP";
            },
            "ACTIVE_HEALTHY"::equals,
            "INIT_FAILED"::equals,
            new ReadinessPolicy(INTERVAL, INTERVAL.multipliedBy(2), "project abc")
        ))
            .isInstanceOfSatisfying(ResourceTimeoutException.class, e -> assertThat(e.elapsed()).isEqualTo(Duration.ofSeconds(10)))
            .hasMessageContaining("project abc")
            .hasMessageContaining("within 10s");

        assertThat(polls).hasValue(2);
    }

    @Test
    void shouldFailOnTerminalFailureStatus() {
        assertThatThrownBy(() -> poller.waitUntilReady(
            () -> "INIT_FAILED",
            "ACTIVE_HEALTHY"::equals,
            "INIT_FAILED"::equals,
            new ReadinessPolicy(INTERVAL, Duration.ofSeconds(60), "project abc")
        ))
            .isInstanceOf(ResourceFailedException.class)
            .hasMessageContaining("INIT_FAILED");
    }

    @Test
    void shouldKeepPollingThroughTransientFetchFailures() throws Exception {
        AtomicInteger polls = new AtomicInteger();

        ReadinessResult<String> result = poller.waitUntilReady(
            () -> {
                int poll = polls.incrementAndGet();
                if (poll == 1) {
                    throw new IOException("connection refused");
                }
                if (poll == 2) {
                    throw new ApiException(503, "unavailable");
                }
                return "ready";
            },
            "ready"::equals,
            "error"::equals,
            new ReadinessPolicy(INTERVAL, Duration.ofSeconds(60), "deploy d1")
        );

        assertThat(result.polls()).isEqualTo(3);
    }

    @Test
    void shouldKeepPollingWhileNewResourceIsNotYetVisible() throws Exception {
        AtomicInteger polls = new AtomicInteger();

        ReadinessResult<String> result = poller.waitUntilReady(
            () -> {
                if (polls.incrementAndGet() <= 2) {
                    throw new ApiException(404, "project not found");
                }
                return "ACTIVE_HEALTHY";
            },
            "ACTIVE_HEALTHY"::equals,
            "INIT_FAILED"::equals,
            new ReadinessPolicy(INTERVAL, Duration.ofSeconds(60), "Supabase project abc")
        );

        assertThat(result.polls()).isEqualTo(3);
        assertThat(clock.sleeps()).containsExactly(INTERVAL, INTERVAL);
    }

    @Test
    void shouldStopOnClientErrors() {
        AtomicInteger polls = new AtomicInteger();

        assertThatThrownBy(() -> poller.waitUntilReady(
            () -> {
                polls.incrementAndGet();
                throw new ApiException(401, "invalid token");
            },
            "ready"::equals,
            "error"::equals,
            new ReadinessPolicy(INTERVAL, Duration.ofSeconds(60), "deploy d1")
        ))
            .isInstanceOf(ApiException.class)
            .hasMessage("invalid token");

        assertThat(polls).hasValue(1);
    }

    @Test
    void shouldNotOversleepPastDeadline() {
        assertThatThrownBy(() -> poller.waitUntilReady(
            () -> "pending",
            "ready"::equals,
            "error"::equals,
            new ReadinessPolicy(INTERVAL, Duration.ofSeconds(7), "site s1")
        )).isInstanceOf(ResourceTimeoutException.class);

        assertThat(clock.sleeps()).containsExactly(INTERVAL, Duration.ofSeconds(2));
    }
}
