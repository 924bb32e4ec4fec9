package io.fullerstack.recurrent.signal;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single-slot coalescing mailbox for signals.
 * <p>
 * Any number of threads may {@link #post()}; exactly one consumer (the scheduler loop)
 * calls {@link #take()}. At most one signal is pending at any time: posting while a
 * signal is already pending is dropped without blocking the poster.
 * <p>
 * The listener passed at construction runs on the posting thread, once per signal that
 * actually entered the slot. It never runs for a dropped post.
 */
public final class SignalBuffer {

    private final AtomicBoolean pending = new AtomicBoolean(false);
    private final Runnable onPosted;
    private volatile boolean closed = false;

    /**
     * Creates a buffer without a post listener.
     */
    public SignalBuffer() {
        this(() -> {
        });
    }

    /**
     * @param onPosted runs after each post that filled the empty slot
     */
    public SignalBuffer(Runnable onPosted) {
        this.onPosted = Objects.requireNonNull(onPosted, "Post listener cannot be null");
    }

    /**
     * Offers a signal to the buffer.
     *
     * @return true if the slot was empty and now holds the signal, false if the signal was
     *         coalesced into a pending one or the buffer is closed
     */
    public boolean post() {
        if (closed) {
            return false;
        }
        if (pending.compareAndSet(false, true)) {
            onPosted.run();
            return true;
        }
        return false;
    }

    /**
     * Consumes the pending signal.
     *
     * @return true if a signal was pending
     */
    public boolean take() {
        return pending.getAndSet(false);
    }

    public boolean isPending() {
        return pending.get();
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Closes the buffer and discards any pending signal. Later posts are no-ops.
     */
    public void close() {
        closed = true;
        pending.set(false);
    }
}
