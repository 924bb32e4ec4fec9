package io.fullerstack.recurrent;

import java.time.Duration;
import java.util.concurrent.CompletionStage;

/**
 * Periodically executes a target callback, and on request executes it out of band.
 * <p>
 * The target runs on a single background thread, so invocations never overlap. Besides the
 * automatic firing every interval, callers may {@link #signal()} for an immediate execution
 * as often as they like: signals never block, and at most one is pending at any time. When
 * the scheduler is throttled, signal-driven executions happen at most once per throttle
 * window.
 *
 * <h3>Usage:</h3>
 * <pre>{@code
 * Scheduler scheduler = Schedulers.newScheduler(
 *     cache::refresh,
 *     SchedulerOption.withInterval(Duration.ofSeconds(30)),
 *     SchedulerOption.withThrottle(Duration.ofSeconds(1))
 * );
 *
 * scheduler.start();
 * scheduler.signal();   // refresh now, without waiting for the next interval
 *
 * // Later...
 * scheduler.stop();
 * }</pre>
 *
 * @see Schedulers
 * @see SchedulerOption
 */
public interface Scheduler extends AutoCloseable {

    /**
     * Starts the background loop and returns immediately.
     *
     * @throws IllegalStateException if the scheduler was already started or stopped
     */
    void start();

    /**
     * Requests the loop to terminate and returns immediately, without waiting for a target
     * invocation in progress. No invocation is admitted after this returns; one admitted
     * just before may still be entering the target. Calling it again has no effect.
     */
    void stop();

    /**
     * Asks for an immediate execution of the target. Never blocks.
     *
     * @return true if the signal was buffered, false if it was coalesced into a pending one
     *         or dropped because the scheduler has shut down
     */
    boolean signal();

    /**
     * @return the current lifecycle state
     */
    LifecycleState state();

    /**
     * Completes when the background loop exits: normally after {@link #stop()}, exceptionally
     * with the failure if the target threw. A scheduler whose target failed never fires again.
     *
     * @return stage tracking the loop's termination
     */
    CompletionStage<Void> termination();

    /**
     * Waits for the background loop to exit.
     *
     * @param timeout maximum time to wait
     * @return true if the loop exited within the timeout
     * @throws InterruptedException if interrupted while waiting
     */
    boolean awaitTermination(Duration timeout) throws InterruptedException;

    /**
     * Same as {@link #stop()}.
     */
    @Override
    default void close() {
        stop();
    }
}
