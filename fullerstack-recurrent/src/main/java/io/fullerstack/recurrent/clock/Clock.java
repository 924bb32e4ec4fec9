package io.fullerstack.recurrent.clock;

import java.time.Duration;

/**
 * Time source used by the scheduler loop.
 * <p>
 * Exposes the two timing primitives the loop needs: a one-shot readiness event
 * ({@link #after}) and a repeating one ({@link #newTicker}). Both deliver readiness by
 * running a callback, which must return quickly since implementations may share a single
 * timer thread between all callbacks.
 * <p>
 * {@link SystemClock} is the wall-clock implementation. Tests substitute a clock whose
 * events are fired by hand.
 */
public interface Clock extends AutoCloseable {

    /**
     * Runs {@code action} once, after {@code delay} has elapsed.
     *
     * @param delay  time to wait, zero or positive
     * @param action callback to run
     * @return handle that cancels the action if it has not run yet
     */
    Cancellable after(Duration delay, Runnable action);

    /**
     * Runs {@code onTick} every {@code period} until the returned ticker is stopped.
     *
     * @param period time between ticks, strictly positive
     * @param onTick callback to run on each tick
     * @return the running ticker
     */
    Ticker newTicker(Duration period, Runnable onTick);

    /**
     * Releases resources held by this clock. Does nothing unless the clock owns a timer thread.
     */
    @Override
    default void close() {
    }
}
