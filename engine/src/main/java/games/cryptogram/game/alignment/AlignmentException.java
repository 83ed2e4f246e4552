package games.cryptogram.game.alignment;

/**
 * Raised when a puzzle's encoded text cannot be aligned with its solution.
 * <p>
 * This is a content error: the puzzle data is malformed and cannot be played. It is never
 * raised for player interaction.
 */
public class AlignmentException extends RuntimeException {

    /** Why alignment failed. */
    public enum Reason {
        /** The encoded text contains no letter or number tokens. */
        EMPTY_ENCODED_TEXT,
        /** The solution text contains no letters. */
        EMPTY_SOLUTION,
        /** The encoded text has more tokens than the solution has letters. */
        INSUFFICIENT_SOLUTION_LETTERS
    }

    private final Reason reason;
    private final String puzzleId;

    public AlignmentException(Reason reason, String puzzleId, String message) {
        super("Puzzle " + puzzleId + ": " + message);
        this.reason = reason;
        this.puzzleId = puzzleId;
    }

    public Reason getReason() {
        return reason;
    }

    public String getPuzzleId() {
        return puzzleId;
    }
}
