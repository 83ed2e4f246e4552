package games.cryptogram.game;

/**
 * Chooses which unsolved cell a hint reveals. Every occurrence of an encoded token is
 * revealed on its own; a hint never fills other cells sharing the token.
 */
public enum HintPolicy {
    /** Uniformly random among eligible cells. */
    RANDOM,
    /** The selected cell when it is eligible, otherwise the first eligible cell. */
    SELECTED_CELL,
    /** The first eligible cell in reading order. */
    FIRST_UNSOLVED
}
