package games.cryptogram.game;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Outcome of a session, emitted once per terminal transition (completed or failed).
 *
 * @param puzzleId the puzzle that was played
 * @param scheme the encoding the puzzle was played with
 * @param complete whether the puzzle was solved
 * @param failed whether the mistake limit was reached
 * @param mistakeCount incorrect inputs during the session
 * @param hintCount hints used during the session
 * @param elapsedTime play time excluding pauses
 * @param finishedAt when the session ended
 */
public record TerminalResult(String puzzleId, EncodingScheme scheme, boolean complete, boolean failed,
                             int mistakeCount, int hintCount, Duration elapsedTime, Instant finishedAt) {

    public TerminalResult {
        Objects.requireNonNull(puzzleId, "puzzleId");
        Objects.requireNonNull(scheme, "scheme");
        Objects.requireNonNull(elapsedTime, "elapsedTime");
        Objects.requireNonNull(finishedAt, "finishedAt");
        if (complete == failed) {
            throw new IllegalArgumentException("A terminal result is either complete or failed");
        }
    }
}
