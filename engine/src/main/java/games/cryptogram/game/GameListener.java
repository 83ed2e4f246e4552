package games.cryptogram.game;

/**
 * Receives notifications from a {@link CryptogramGame}. Callbacks run synchronously on the
 * caller's thread, after the game state has been updated.
 */
public interface GameListener {

    /** Listener that ignores every notification. */
    GameListener NONE = new GameListener() {
    };

    /**
     * Called after any operation that changed cells or the session. Snapshots taken here are
     * meant for debounced saving by the caller.
     */
    default void onStateChanged(CryptogramGame game) {
    }

    /**
     * Called exactly once when the session completes or fails. Receivers should persist the
     * final state immediately.
     *
     * @param result the outcome summary
     * @param game the game in its terminal state
     */
    default void onTerminal(TerminalResult result, CryptogramGame game) {
    }
}
