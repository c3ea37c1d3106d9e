package org.blockindex.migrations.pipeline.scan;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * How much of the current invocation's wall-clock budget is left.
 */
@FunctionalInterface
public interface RemainingTime {

    Duration remaining();

    static RemainingTime until(Instant deadline, Clock clock) {
        return () -> Duration.between(clock.instant(), deadline);
    }

    static RemainingTime unbounded() {
        return () -> Duration.ofMillis(Long.MAX_VALUE);
    }
}
