package io.fullerstack.recurrent.clock;

/**
 * Cancellation handle for a one-shot action registered with {@link Clock#after}.
 */
@FunctionalInterface
public interface Cancellable {

    /**
     * Attempts to cancel the action.
     *
     * @return true if the action will not run, false if it already ran or was cancelled before
     */
    boolean cancel();
}
