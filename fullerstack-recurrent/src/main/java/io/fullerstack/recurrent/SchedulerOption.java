package io.fullerstack.recurrent;

import io.fullerstack.recurrent.clock.Clock;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadFactory;

/**
 * Independent, composable modifier of a {@link SchedulerConfig}.
 * <p>
 * Options are applied in order, so a later option overrides an earlier one touching the
 * same setting. Arguments are validated when the option is created.
 */
@FunctionalInterface
public interface SchedulerOption {

    SchedulerConfig applyTo(SchedulerConfig config);

    /**
     * Sets the interval at which the target is invoked automatically (default: 1 second).
     */
    static SchedulerOption withInterval(Duration interval) {
        SchedulerConfig.requirePositive(interval, "interval");
        return config -> config.withInterval(interval);
    }

    /**
     * Limits signal-driven invocations to one per {@code window} (no throttle by default).
     */
    static SchedulerOption withThrottle(Duration window) {
        SchedulerConfig.requirePositive(window, "throttle");
        return config -> config.withThrottle(window);
    }

    /**
     * Replaces the wall clock, typically with a hand-driven clock in tests.
     */
    static SchedulerOption withClock(Clock clock) {
        Objects.requireNonNull(clock, "clock cannot be null");
        return config -> config.withClock(clock);
    }

    static SchedulerOption withName(String name) {
        SchedulerConfig.requireName(name);
        return config -> config.withName(name);
    }

    static SchedulerOption withThreadFactory(ThreadFactory threadFactory) {
        Objects.requireNonNull(threadFactory, "threadFactory cannot be null");
        return config -> config.withThreadFactory(threadFactory);
    }
}
