package games.cryptogram.progress;

import games.cryptogram.game.TerminalResult;

/**
 * Receives the outcome of every finished session. Delivery happens once; sinks that fail
 * are not retried.
 */
public interface StatisticsSink {

    /**
     * Records one finished session.
     *
     * @param result the outcome; never null
     */
    void record(TerminalResult result);
}
