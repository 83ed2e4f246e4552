package games.cryptogram.progress;

import games.cryptogram.game.EncodingScheme;
import games.cryptogram.game.TerminalResult;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * One recorded attempt at a puzzle. Exactly one of {@code completedAt} and {@code failedAt}
 * is set; {@code completionTime} is only known for completed attempts.
 */
public record PuzzleAttempt(UUID attemptId, String puzzleId, EncodingScheme scheme, Instant completedAt,
                            Instant failedAt, Duration completionTime, int hintCount, int mistakeCount) {

    public PuzzleAttempt {
        Objects.requireNonNull(attemptId, "attemptId");
        Objects.requireNonNull(puzzleId, "puzzleId");
        Objects.requireNonNull(scheme, "scheme");
    }

    /**
     * Converts a terminal result into an attempt with a fresh id.
     */
    public static PuzzleAttempt from(TerminalResult result) {
        return new PuzzleAttempt(
                UUID.randomUUID(),
                result.puzzleId(),
                result.scheme(),
                result.complete() ? result.finishedAt() : null,
                result.failed() ? result.finishedAt() : null,
                result.complete() ? result.elapsedTime() : null,
                result.hintCount(),
                result.mistakeCount());
    }

    public boolean isCompleted() {
        return completedAt != null;
    }

    public boolean isFailed() {
        return failedAt != null;
    }
}
