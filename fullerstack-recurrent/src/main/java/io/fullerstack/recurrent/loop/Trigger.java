package io.fullerstack.recurrent.loop;

/**
 * Events the scheduler loop reacts to.
 */
public enum Trigger {

    /**
     * The ready-source lets a pending signal through.
     */
    RELEASE,

    /**
     * The interval one-shot elapsed.
     */
    INTERVAL,

    /**
     * Stop was requested.
     */
    SHUTDOWN;

    int mask() {
        return 1 << ordinal();
    }
}
