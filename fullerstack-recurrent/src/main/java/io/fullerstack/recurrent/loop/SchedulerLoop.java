package io.fullerstack.recurrent.loop;

import io.fullerstack.recurrent.SchedulerConfig;
import io.fullerstack.recurrent.clock.Cancellable;
import io.fullerstack.recurrent.clock.Clock;
import io.fullerstack.recurrent.clock.SystemClock;
import io.fullerstack.recurrent.gate.ReadySource;
import io.fullerstack.recurrent.signal.SignalBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Control loop of a scheduler: merges interval firing, released signals and shutdown into
 * one serialized stream of target invocations.
 * <p>
 * <b>Per pass</b>, after {@link Triggers#await()} returns the raised triggers:
 * <ol>
 *   <li>{@link Trigger#SHUTDOWN}: leave the loop</li>
 *   <li>{@link Trigger#INTERVAL}: post a signal, exactly as an external caller would. The
 *       target is not invoked directly, so automatic firings go through the same buffer and
 *       throttle gate as external signals</li>
 *   <li>{@link Trigger#RELEASE}: consume the pending signal, if any, and run the target inline</li>
 * </ol>
 * A pass that handled an elapsed interval or ran the target restarts the interval, so the
 * next automatic firing comes one full interval after the latest of either. A release that
 * finds nothing pending leaves the interval alone.
 * Running the target on the loop thread means invocations never overlap. Anything arriving
 * meanwhile collapses into the single-slot {@link SignalBuffer} and the raised-trigger set.
 * <p>
 * <b>Exit</b> always releases the armed interval, the ready-source ticker, the signal buffer
 * and, when the loop created it, the clock. If the target throws, the failure completes the
 * termination future exceptionally and is rethrown so that it also reaches the thread's
 * uncaught-exception handler. The loop never runs again.
 */
public final class SchedulerLoop implements Runnable {
    private static final Logger logger = LoggerFactory.getLogger(SchedulerLoop.class);

    // Admission states of a target invocation
    private static final int IDLE = 0;
    private static final int FIRING = 1;
    private static final int CLOSED = 2;

    private final SchedulerConfig config;
    private final Runnable target;
    private final ReadySource readySource;
    private final SignalBuffer signals;
    private final Triggers triggers;
    private final CompletableFuture<Void> termination;
    private final AtomicLong firings = new AtomicLong();
    private final AtomicInteger admission = new AtomicInteger(IDLE);

    private volatile boolean shutdown = false;
    private boolean inTarget = false;  // loop thread only

    public SchedulerLoop(
        SchedulerConfig config,
        Runnable target,
        ReadySource readySource,
        SignalBuffer signals,
        Triggers triggers,
        CompletableFuture<Void> termination
    ) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.target = Objects.requireNonNull(target, "target cannot be null");
        this.readySource = Objects.requireNonNull(readySource, "readySource cannot be null");
        this.signals = Objects.requireNonNull(signals, "signals cannot be null");
        this.triggers = Objects.requireNonNull(triggers, "triggers cannot be null");
        this.termination = Objects.requireNonNull(termination, "termination cannot be null");
    }

    /**
     * Requests the loop to exit. Returns immediately; an invocation in progress completes.
     * <p>
     * Once this returns no invocation is admitted. An invocation admitted just before the
     * call may still be entering the target.
     */
    public void shutdown() {
        shutdown = true;
        admission.set(CLOSED);
        triggers.raise(Trigger.SHUTDOWN);
    }

    public boolean isShutdown() {
        return shutdown;
    }

    /**
     * @return number of target invocations started so far
     */
    public long firings() {
        return firings.get();
    }

    @Override
    public void run() {
        Clock clock = null;
        Cancellable pendingInterval = null;
        Throwable failure = null;
        try {
            clock = config.clock().orElseGet(SystemClock::new);
            readySource.open(clock, triggers);
            pendingInterval = armInterval(clock);
            logger.debug("Scheduler '{}' loop running", config.name());

            while (!shutdown) {
                Set<Trigger> fired = triggers.await();
                if (fired.contains(Trigger.SHUTDOWN)) {
                    break;
                }
                boolean restart = false;
                if (fired.contains(Trigger.INTERVAL)) {
                    signals.post();
                    restart = true;
                }
                if (fired.contains(Trigger.RELEASE) && signals.take()) {
                    fire();
                    restart = true;
                }
                if (restart) {
                    pendingInterval.cancel();
                    pendingInterval = armInterval(clock);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Scheduler '{}' loop interrupted, no further firings will occur", config.name());
        } catch (RuntimeException | Error e) {
            failure = e;
            if (inTarget) {
                logger.error("Target of scheduler '{}' failed, no further firings will occur", config.name(), e);
            } else {
                logger.error("Scheduler '{}' loop failed, no further firings will occur", config.name(), e);
            }
            throw e;
        } finally {
            release(clock, pendingInterval);
            if (failure == null) {
                termination.complete(null);
            } else {
                termination.completeExceptionally(failure);
            }
            logger.debug("Scheduler '{}' loop exited after {} firings", config.name(), firings.get());
        }
    }

    private Cancellable armInterval(Clock clock) {
        return clock.after(config.interval(), () -> triggers.raise(Trigger.INTERVAL));
    }

    private void fire() {
        // stop() may have returned between await() and here
        if (!admission.compareAndSet(IDLE, FIRING)) {
            return;
        }
        long count = firings.incrementAndGet();
        logger.trace("Scheduler '{}' firing #{}", config.name(), count);
        inTarget = true;
        try {
            target.run();
        } finally {
            admission.compareAndSet(FIRING, IDLE);
        }
        inTarget = false;
    }

    private void release(Clock clock, Cancellable pendingInterval) {
        if (pendingInterval != null) {
            pendingInterval.cancel();
        }
        readySource.close();
        signals.close();
        if (clock != null && config.clock().isEmpty()) {
            clock.close();
        }
    }
}
