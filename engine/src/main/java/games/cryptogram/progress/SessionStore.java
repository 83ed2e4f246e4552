package games.cryptogram.progress;

import games.cryptogram.game.EncodingScheme;
import java.util.Optional;

/**
 * Keeps the latest snapshot of each puzzle so it can be resumed. One snapshot per puzzle and
 * scheme; saving replaces the previous one.
 */
public interface SessionStore {

    void save(SessionSnapshot snapshot);

    Optional<SessionSnapshot> load(String puzzleId, EncodingScheme scheme);

    /**
     * @return whether a snapshot existed
     */
    boolean delete(String puzzleId, EncodingScheme scheme);
}
