package games.cryptogram.player;

import games.cryptogram.game.CryptogramGame;

/**
 * Represents a player capable of providing the next command for the game loop.
 */
public interface Player {

    /**
     * Provide the next command for the game loop (e.g., "type 3 E", "hint", "quit").
     *
     * @param game     current game state.
     * @param feedback result of the previous command, or an empty string.
     * @return raw command string, or null to signal the game should exit.
     */
    String nextCommand(CryptogramGame game, String feedback);
}
