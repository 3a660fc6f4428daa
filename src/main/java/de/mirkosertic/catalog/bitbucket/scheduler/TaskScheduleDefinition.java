package de.mirkosertic.catalog.bitbucket.scheduler;

import java.time.Duration;
import java.util.Objects;

/**
 * How often a task runs and how long one run may take.
 */
public record TaskScheduleDefinition(
        /** Delay between the end of one run and the start of the next. */
        Duration frequency,
        /** Maximum duration of a single run before it is interrupted. */
        Duration timeout,
        /** Delay before the first run. */
        Duration initialDelay
) {
    public TaskScheduleDefinition {
        Objects.requireNonNull(frequency, "frequency");
        Objects.requireNonNull(timeout, "timeout");
        if (frequency.isNegative() || frequency.isZero()) {
            throw new IllegalArgumentException("frequency must be positive, was " + frequency);
        }
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive, was " + timeout);
        }
        initialDelay = initialDelay == null ? Duration.ZERO : initialDelay;
    }

    public TaskScheduleDefinition(final Duration frequency, final Duration timeout) {
        this(frequency, timeout, Duration.ZERO);
    }
}
