package io.fullerstack.recurrent.clock;

import java.time.Duration;

/**
 * Repeating timer created by {@link Clock#newTicker}.
 */
public interface Ticker {

    /**
     * @return the period between two ticks
     */
    Duration period();

    /**
     * Stops the ticker. No tick starts after this returns. Calling it again has no effect.
     */
    void stop();
}
