package games.cryptogram.game;

/**
 * Overall phase of a {@link CryptogramGame}. Pausing is tracked separately on the
 * {@link Session} and does not change the phase.
 */
public enum GamePhase {
    /** Puzzle loaded (or none yet); the player has not typed or asked for a hint. */
    IDLE,
    /** The clock is running. */
    ACTIVE,
    /** Every letter cell holds its solution letter. */
    COMPLETED,
    /** The mistake limit was reached. */
    FAILED
}
