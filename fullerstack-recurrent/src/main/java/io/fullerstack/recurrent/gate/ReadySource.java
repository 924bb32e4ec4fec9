package io.fullerstack.recurrent.gate;

import io.fullerstack.recurrent.clock.Clock;
import io.fullerstack.recurrent.clock.Ticker;
import io.fullerstack.recurrent.loop.Trigger;
import io.fullerstack.recurrent.loop.Triggers;

import java.time.Duration;
import java.util.Objects;

/**
 * Decides when a pending signal may trigger the target, by raising {@link Trigger#RELEASE}.
 * <p>
 * Selected once when a scheduler is built:
 * <ul>
 *   <li>{@link Immediate} releases as soon as a signal is posted</li>
 *   <li>{@link Throttled} releases on the ticks of a periodic timer, so at most one signal
 *       passes per window however many were posted</li>
 * </ul>
 * The loop calls {@link #open} when it starts and {@link #close} when it exits.
 */
public sealed interface ReadySource permits ReadySource.Immediate, ReadySource.Throttled {

    static ReadySource immediate() {
        return new Immediate();
    }

    static ReadySource throttled(Duration window) {
        return new Throttled(window);
    }

    /**
     * Called on the posting thread each time a signal enters the empty buffer.
     */
    void signalPosted(Triggers triggers);

    /**
     * Acquires whatever timing resources this source needs.
     */
    void open(Clock clock, Triggers triggers);

    /**
     * Releases the resources acquired by {@link #open}. Safe to call more than once.
     */
    void close();

    /**
     * Unthrottled pass-through.
     */
    record Immediate() implements ReadySource {

        @Override
        public void signalPosted(Triggers triggers) {
            triggers.raise(Trigger.RELEASE);
        }

        @Override
        public void open(Clock clock, Triggers triggers) {
        }

        @Override
        public void close() {
        }
    }

    /**
     * Gate driven by a ticker of {@code window} period.
     * <p>
     * A tick releases exactly one pending signal. If nothing is pending at that tick, nothing
     * fires and the next chance is the following tick. Ticks that pile up while the target is
     * running collapse into a single release.
     */
    final class Throttled implements ReadySource {
        private final Duration window;
        private volatile Ticker ticker;

        Throttled(Duration window) {
            Objects.requireNonNull(window, "Throttle window cannot be null");
            if (window.isZero() || window.isNegative()) {
                throw new IllegalArgumentException("Throttle window must be > 0: " + window);
            }
            this.window = window;
        }

        public Duration window() {
            return window;
        }

        @Override
        public void signalPosted(Triggers triggers) {
            // released by the next tick
        }

        @Override
        public void open(Clock clock, Triggers triggers) {
            if (ticker != null) {
                throw new IllegalStateException("Throttle gate already open");
            }
            ticker = clock.newTicker(window, () -> triggers.raise(Trigger.RELEASE));
        }

        @Override
        public void close() {
            Ticker current = ticker;
            if (current != null) {
                current.stop();
            }
        }

        @Override
        public String toString() {
            return "Throttled[window=" + window + "]";
        }
    }
}
