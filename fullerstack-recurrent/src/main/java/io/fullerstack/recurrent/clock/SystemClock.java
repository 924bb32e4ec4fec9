package io.fullerstack.recurrent.clock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wall-clock {@link Clock} backed by a {@link ScheduledExecutorService}.
 *
 * <p>Two modes of ownership:
 * <ul>
 *   <li>{@link #SystemClock()} creates a private single-thread daemon executor and shuts it
 *       down on {@link #close()}</li>
 *   <li>{@link #SystemClock(ScheduledExecutorService)} borrows a shared executor; the caller
 *       manages its lifecycle and {@link #close()} only stops new registrations</li>
 * </ul>
 *
 * @see Clock
 */
public class SystemClock implements Clock {
    private static final Logger logger = LoggerFactory.getLogger(SystemClock.class);

    private static final AtomicInteger THREAD_SEQUENCE = new AtomicInteger();

    private final ScheduledExecutorService executor;
    private final boolean ownsExecutor;
    private volatile boolean closed = false;

    /**
     * Creates a clock with its own timer thread.
     */
    public SystemClock() {
        this(Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "recurrent-clock-" + THREAD_SEQUENCE.incrementAndGet());
            t.setDaemon(true);
            return t;
        }), true);
    }

    /**
     * Creates a clock on a shared executor.
     *
     * @param executor executor to schedule on, not shut down by this clock
     */
    public SystemClock(ScheduledExecutorService executor) {
        this(Objects.requireNonNull(executor, "Executor cannot be null"), false);
    }

    private SystemClock(ScheduledExecutorService executor, boolean ownsExecutor) {
        this.executor = executor;
        this.ownsExecutor = ownsExecutor;
    }

    @Override
    public Cancellable after(Duration delay, Runnable action) {
        Objects.requireNonNull(delay, "Delay cannot be null");
        Objects.requireNonNull(action, "Action cannot be null");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("Delay must be >= 0: " + delay);
        }
        checkOpen();

        ScheduledFuture<?> future = executor.schedule(action, delay.toNanos(), TimeUnit.NANOSECONDS);
        return () -> future.cancel(false);
    }

    @Override
    public Ticker newTicker(Duration period, Runnable onTick) {
        Objects.requireNonNull(period, "Period cannot be null");
        Objects.requireNonNull(onTick, "Tick callback cannot be null");
        if (period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("Period must be > 0: " + period);
        }
        checkOpen();

        long periodNanos = period.toNanos();
        ScheduledFuture<?> future = executor.scheduleAtFixedRate(
            () -> {
                if (!closed) {
                    onTick.run();
                }
            },
            periodNanos,
            periodNanos,
            TimeUnit.NANOSECONDS
        );
        return new FutureTicker(period, future);
    }

    /**
     * @return true once {@link #close()} has been called
     */
    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            if (ownsExecutor) {
                executor.shutdownNow();
                logger.debug("Shut down private timer thread");
            }
        }
    }

    private void checkOpen() {
        if (closed) {
            throw new IllegalStateException("Clock is closed");
        }
    }

    /**
     * Ticker view of a periodic {@link ScheduledFuture}.
     */
    private static final class FutureTicker implements Ticker {
        private final Duration period;
        private final ScheduledFuture<?> future;

        private FutureTicker(Duration period, ScheduledFuture<?> future) {
            this.period = period;
            this.future = future;
        }

        @Override
        public Duration period() {
            return period;
        }

        @Override
        public void stop() {
            future.cancel(false);
        }
    }
}
