package io.fullerstack.recurrent.scheduler;

import io.fullerstack.recurrent.LifecycleState;
import io.fullerstack.recurrent.Scheduler;
import io.fullerstack.recurrent.SchedulerConfig;
import io.fullerstack.recurrent.gate.ReadySource;
import io.fullerstack.recurrent.loop.SchedulerLoop;
import io.fullerstack.recurrent.loop.Triggers;
import io.fullerstack.recurrent.signal.SignalBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link Scheduler} running its {@link SchedulerLoop} on one dedicated thread.
 * <p>
 * The lifecycle is a single {@link AtomicReference} moved forward by compare-and-set, so
 * {@link #start()} and {@link #stop()} never block and race safely with each other.
 * {@link #stop()} is idempotent.
 *
 * @see io.fullerstack.recurrent.Schedulers
 */
public class RecurrentScheduler implements Scheduler {
    private static final Logger logger = LoggerFactory.getLogger(RecurrentScheduler.class);

    private final SchedulerConfig config;
    private final SignalBuffer signals;
    private final SchedulerLoop loop;
    private final CompletableFuture<Void> termination = new CompletableFuture<>();
    private final AtomicReference<LifecycleState> state = new AtomicReference<>(LifecycleState.CREATED);

    public RecurrentScheduler(Runnable target, SchedulerConfig config) {
        Objects.requireNonNull(target, "Target cannot be null");
        this.config = Objects.requireNonNull(config, "Config cannot be null");

        Triggers triggers = new Triggers();
        ReadySource readySource = config.throttle()
            .map(ReadySource::throttled)
            .orElseGet(ReadySource::immediate);
        this.signals = new SignalBuffer(() -> readySource.signalPosted(triggers));
        this.loop = new SchedulerLoop(config, target, readySource, signals, triggers, termination);
    }

    @Override
    public void start() {
        if (!state.compareAndSet(LifecycleState.CREATED, LifecycleState.RUNNING)) {
            throw new IllegalStateException(
                "Scheduler '" + config.name() + "' cannot be started from state " + state.get()
            );
        }

        try {
            Thread thread = Objects.requireNonNull(
                threadFactory().newThread(loop),
                "Thread factory returned no thread"
            );
            thread.start();
        } catch (RuntimeException | Error e) {
            // no loop will ever run: settle everything the loop would have released
            state.set(LifecycleState.STOPPED);
            loop.shutdown();
            signals.close();
            termination.completeExceptionally(e);
            logger.error("Failed to start scheduler '{}'", config.name(), e);
            throw e;
        }

        logger.info("Started scheduler '{}' (interval={}, throttle={})",
            config.name(), config.interval(), config.throttle().map(Duration::toString).orElse("none"));
    }

    @Override
    public void stop() {
        LifecycleState previous = state.getAndSet(LifecycleState.STOPPED);
        switch (previous) {
            case CREATED -> {
                loop.shutdown();
                signals.close();
                termination.complete(null);
                logger.info("Stopped scheduler '{}' before it was started", config.name());
            }
            case RUNNING -> {
                loop.shutdown();
                logger.info("Stopped scheduler '{}'", config.name());
            }
            case STOPPED -> logger.debug("Scheduler '{}' already stopped, ignoring stop()", config.name());
        }
    }

    @Override
    public boolean signal() {
        boolean accepted = signals.post();
        if (!accepted) {
            logger.trace("Signal to scheduler '{}' coalesced or dropped", config.name());
        }
        return accepted;
    }

    @Override
    public LifecycleState state() {
        return state.get();
    }

    @Override
    public CompletionStage<Void> termination() {
        return termination.minimalCompletionStage();
    }

    @Override
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        Objects.requireNonNull(timeout, "Timeout cannot be null");
        try {
            termination.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
            return true;
        } catch (ExecutionException e) {
            // terminated by a target failure
            return true;
        } catch (TimeoutException e) {
            return false;
        }
    }

    /**
     * @return number of target invocations started so far
     */
    public long firings() {
        return loop.firings();
    }

    public SchedulerConfig config() {
        return config;
    }

    private ThreadFactory threadFactory() {
        return config.threadFactory().orElseGet(this::loopThreadFactory);
    }

    private ThreadFactory loopThreadFactory() {
        return r -> {
            Thread t = new Thread(r, config.name() + "-loop");
            t.setDaemon(config.daemonThreads());
            return t;
        };
    }

    @Override
    public String toString() {
        return "RecurrentScheduler[name=" + config.name() + ", state=" + state.get() + "]";
    }
}
