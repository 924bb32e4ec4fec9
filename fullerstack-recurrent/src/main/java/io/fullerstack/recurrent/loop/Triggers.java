package io.fullerstack.recurrent.loop;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.LockSupport;

/**
 * Coalescing wake-up point for a single waiting thread.
 * <p>
 * Producers {@link #raise} triggers from any thread without blocking. The consumer
 * {@link #await()}s and receives every trigger raised since its previous wait, all at once.
 * Raising a trigger that is already pending has no further effect, so a slow consumer sees a
 * burst of the same trigger as one.
 * <p>
 * Raised triggers are kept as bits in one {@link AtomicInteger}; the waiter parks with
 * {@link LockSupport} and the producer that moves the set from empty to non-empty unparks it.
 */
public final class Triggers {

    private final AtomicInteger raised = new AtomicInteger();
    private volatile Thread waiter;

    /**
     * Raises a trigger and wakes the waiting thread if it was idle.
     *
     * @param trigger trigger to raise
     */
    public void raise(Trigger trigger) {
        Objects.requireNonNull(trigger, "Trigger cannot be null");
        int mask = trigger.mask();
        int previous = raised.getAndUpdate(bits -> bits | mask);
        if (previous == 0) {
            Thread t = waiter;
            if (t != null) {
                LockSupport.unpark(t);
            }
        }
    }

    /**
     * Blocks until at least one trigger is raised, then clears and returns all raised triggers.
     * <p>
     * Only one thread may wait at a time.
     *
     * @return the non-empty set of triggers raised since the previous call
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public Set<Trigger> await() throws InterruptedException {
        waiter = Thread.currentThread();
        try {
            int bits;
            while ((bits = raised.getAndSet(0)) == 0) {
                LockSupport.park(this);
                if (Thread.interrupted()) {
                    throw new InterruptedException("Interrupted while waiting for triggers");
                }
            }
            return decode(bits);
        } finally {
            waiter = null;
        }
    }

    /**
     * @return true if the trigger is raised and not yet consumed by {@link #await()}
     */
    public boolean isRaised(Trigger trigger) {
        return (raised.get() & trigger.mask()) != 0;
    }

    private static Set<Trigger> decode(int bits) {
        EnumSet<Trigger> triggers = EnumSet.noneOf(Trigger.class);
        for (Trigger trigger : Trigger.values()) {
            if ((bits & trigger.mask()) != 0) {
                triggers.add(trigger);
            }
        }
        return triggers;
    }
}
