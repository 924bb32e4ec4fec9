package io.fullerstack.recurrent;

import io.fullerstack.recurrent.clock.Clock;
import io.fullerstack.recurrent.config.HierarchicalConfig;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ThreadFactory;

/**
 * Resolved configuration of a scheduler.
 *
 * @param name          Scheduler name, used for the loop thread and log messages
 * @param interval      Automatic firing period (default: 1 second)
 * @param throttle      Signal throttle window; empty means unthrottled (default)
 * @param clock         Time source; empty means a private {@link io.fullerstack.recurrent.clock.SystemClock}
 * @param threadFactory Factory for the loop thread; empty means a named thread per scheduler
 * @param daemonThreads Whether the default loop thread is a daemon thread
 */
public record SchedulerConfig(
        String name,
        Duration interval,
        Optional<Duration> throttle,
        Optional<Clock> clock,
        Optional<ThreadFactory> threadFactory,
        boolean daemonThreads
) {
    public static final String DEFAULT_NAME = "scheduler";
    public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(1);

    /**
     * Compact constructor with validation.
     */
    public SchedulerConfig {
        requireName(name);
        requirePositive(interval, "interval");
        Objects.requireNonNull(throttle, "throttle cannot be null");
        throttle.ifPresent(window -> requirePositive(window, "throttle"));
        Objects.requireNonNull(clock, "clock cannot be null");
        Objects.requireNonNull(threadFactory, "threadFactory cannot be null");
    }

    /**
     * Defaults from the global section of {@code recurrent.properties}.
     */
    public static SchedulerConfig defaults() {
        return from(DEFAULT_NAME, HierarchicalConfig.global());
    }

    /**
     * Defaults for a named scheduler, honouring {@code scheduler.<name>.*} overrides.
     */
    public static SchedulerConfig defaults(String name) {
        requireName(name);
        return from(name, HierarchicalConfig.forScheduler(name));
    }

    /**
     * Builds a configuration from property values.
     *
     * @param name   scheduler name
     * @param config source of {@code interval-ms}, {@code throttle-ms} and {@code daemon-threads}
     */
    public static SchedulerConfig from(String name, HierarchicalConfig config) {
        Objects.requireNonNull(config, "config cannot be null");
        Duration interval = config.getDuration("interval-ms", DEFAULT_INTERVAL);
        if (interval.isZero() || interval.isNegative()) {
            interval = DEFAULT_INTERVAL;
        }
        return new SchedulerConfig(
            name,
            interval,
            config.getOptionalDuration("throttle-ms"),
            Optional.empty(),
            Optional.empty(),
            config.getBoolean("daemon-threads", true)
        );
    }

    public SchedulerConfig withName(String name) {
        return new SchedulerConfig(name, interval, throttle, clock, threadFactory, daemonThreads);
    }

    public SchedulerConfig withInterval(Duration interval) {
        return new SchedulerConfig(name, interval, throttle, clock, threadFactory, daemonThreads);
    }

    public SchedulerConfig withThrottle(Duration window) {
        return new SchedulerConfig(name, interval, Optional.of(window), clock, threadFactory, daemonThreads);
    }

    public SchedulerConfig withoutThrottle() {
        return new SchedulerConfig(name, interval, Optional.empty(), clock, threadFactory, daemonThreads);
    }

    public SchedulerConfig withClock(Clock clock) {
        return new SchedulerConfig(name, interval, throttle, Optional.of(clock), threadFactory, daemonThreads);
    }

    public SchedulerConfig withThreadFactory(ThreadFactory threadFactory) {
        return new SchedulerConfig(name, interval, throttle, clock, Optional.of(threadFactory), daemonThreads);
    }

    /**
     * @return true when signals go through a throttle gate
     */
    public boolean throttled() {
        return throttle.isPresent();
    }

    static Duration requirePositive(Duration duration, String what) {
        Objects.requireNonNull(duration, what + " cannot be null");
        if (duration.isZero() || duration.isNegative()) {
            throw new IllegalArgumentException(what + " must be > 0: " + duration);
        }
        return duration;
    }

    static String requireName(String name) {
        Objects.requireNonNull(name, "name cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name cannot be blank");
        }
        return name;
    }
}
