package io.shipme.core.readiness;

import java.time.Duration;
import java.util.Locale;

public final class ResourceTimeoutException extends RuntimeException {
    private final String resource;
    private final Duration elapsed;

    public ResourceTimeoutException(String resource, Duration maxWaitTime, Duration elapsed, Object lastStatus) {
        super(
            "Resource " + resource + " did not become ready within " + seconds(maxWaitTime)
                + " (elapsed " + seconds(elapsed) + ", last status " + lastStatus + ")"
        );
        this.resource = resource;
        this.elapsed = elapsed;
    }

    public String resource() {
        return resource;
    }

    public Duration elapsed() {
        return elapsed;
    }

    private static String seconds(Duration duration) {
        long millis = duration.toMillis();
        if (millis % 1000 == 0) {
            return (millis / 1000) + "s";
        }
        return String.format(Locale.ROOT, "%.1fs", millis / 1000.0);
    }
}
