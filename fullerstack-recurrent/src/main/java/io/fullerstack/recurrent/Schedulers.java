package io.fullerstack.recurrent;

import io.fullerstack.recurrent.scheduler.RecurrentScheduler;

import java.util.Objects;

/**
 * Entry points for creating schedulers.
 */
public final class Schedulers {

    private Schedulers() {
    }

    /**
     * Creates a scheduler for {@code target}, starting from the global defaults.
     *
     * @param target  callback to invoke
     * @param options modifiers applied in order
     * @return a scheduler in the {@link LifecycleState#CREATED} state
     */
    public static Scheduler newScheduler(Runnable target, SchedulerOption... options) {
        return newScheduler(target, SchedulerConfig.defaults(), options);
    }

    /**
     * Creates a named scheduler, starting from the defaults configured for that name.
     *
     * @param name    scheduler name
     * @param target  callback to invoke
     * @param options modifiers applied in order
     * @return a scheduler in the {@link LifecycleState#CREATED} state
     */
    public static Scheduler newScheduler(String name, Runnable target, SchedulerOption... options) {
        return newScheduler(target, SchedulerConfig.defaults(name), options);
    }

    private static Scheduler newScheduler(Runnable target, SchedulerConfig base, SchedulerOption... options) {
        Objects.requireNonNull(target, "Target cannot be null");
        Objects.requireNonNull(options, "options cannot be null");
        SchedulerConfig config = base;
        for (SchedulerOption option : options) {
            config = Objects.requireNonNull(option, "option cannot be null").applyTo(config);
        }
        return new RecurrentScheduler(target, config);
    }
}
