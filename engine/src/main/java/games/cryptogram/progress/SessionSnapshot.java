package games.cryptogram.progress;

import games.cryptogram.game.Cell;
import games.cryptogram.game.CryptogramGame;
import games.cryptogram.game.EncodingScheme;
import games.cryptogram.game.Session;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Serialisable copy of a game's cells and session, used to resume a puzzle later.
 * <p>
 * A pause in progress when the snapshot is taken is folded into {@code pausedMillis}. When an
 * unfinished snapshot is restored, the time it spent in storage is counted as paused too, so
 * elapsed time only covers actual play.
 */
public record SessionSnapshot(String puzzleId, EncodingScheme scheme, Instant savedAt, List<CellState> cells,
                              Instant startTime, Instant endTime, int mistakeCount, int hintCount,
                              Integer selectedIndex, boolean complete, boolean failed, long pausedMillis,
                              boolean continuedAfterFailure) {

    public SessionSnapshot {
        Objects.requireNonNull(puzzleId, "puzzleId");
        Objects.requireNonNull(scheme, "scheme");
        Objects.requireNonNull(savedAt, "savedAt");
        cells = cells == null ? List.of() : List.copyOf(cells);
    }

    /**
     * Persisted state of one cell.
     *
     * @param solution the solution letter as a one-character string; null for symbols
     */
    public record CellState(int position, String encodedToken, String solution, boolean symbol,
                            String userInput, boolean revealed, boolean preFilled, boolean error) {
    }

    /**
     * Captures the current state of a game.
     *
     * @param game a game with a started puzzle
     * @param savedAt the capture time
     * @throws IllegalStateException if the game has no puzzle
     */
    public static SessionSnapshot of(CryptogramGame game, Instant savedAt) {
        if (game.getPuzzle() == null) {
            throw new IllegalStateException("No puzzle to snapshot");
        }
        Session session = game.getSession();
        List<CellState> states = new ArrayList<>();
        for (Cell cell : game.getCells()) {
            states.add(new CellState(
                    cell.getPosition(),
                    cell.getEncodedToken(),
                    cell.getSolutionChar() == null ? null : cell.getSolutionChar().toString(),
                    cell.isSymbol(),
                    cell.getUserInput(),
                    cell.isRevealed(),
                    cell.isPreFilled(),
                    cell.isError()));
        }
        Duration paused = session.getTotalPausedDuration();
        if (session.isPaused() && session.getPauseStartedAt() != null && savedAt.isAfter(session.getPauseStartedAt())) {
            paused = paused.plus(Duration.between(session.getPauseStartedAt(), savedAt));
        }
        return new SessionSnapshot(game.getPuzzle().id(), game.getScheme(), savedAt, states,
                session.getStartTime(), session.getEndTime(), session.getMistakeCount(), session.getHintCount(),
                session.getSelectedIndex(), session.isComplete(), session.isFailed(), paused.toMillis(),
                session.hasContinuedAfterFailure());
    }

    /**
     * Rebuilds the cells. Ids are re-derived from the puzzle id and match freshly aligned cells.
     *
     * @throws IllegalArgumentException if a saved cell is inconsistent
     */
    public List<Cell> toCells() {
        List<Cell> result = new ArrayList<>();
        for (CellState state : cells) {
            Character solution = state.solution() == null || state.solution().isEmpty()
                    ? null : state.solution().charAt(0);
            result.add(Cell.restored(puzzleId, state.position(), state.encodedToken(), solution, state.symbol(),
                    state.userInput(), state.revealed(), state.preFilled(), state.error()));
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Rebuilds the session as of {@code restoredAt}.
     */
    public Session toSession(Instant restoredAt) {
        Duration paused = Duration.ofMillis(pausedMillis);
        boolean running = startTime != null && !complete && !failed;
        if (running && restoredAt != null && restoredAt.isAfter(savedAt)) {
            paused = paused.plus(Duration.between(savedAt, restoredAt));
        }
        return Session.restored(startTime, endTime, mistakeCount, hintCount, selectedIndex, complete, failed,
                paused, continuedAfterFailure);
    }

    /**
     * Applies this snapshot to a game that has the same puzzle loaded.
     *
     * @throws IllegalArgumentException if the game holds a different puzzle or scheme, or the
     *         saved cells are inconsistent
     */
    public void restoreInto(CryptogramGame game, Instant restoredAt) {
        if (game.getPuzzle() == null || !game.getPuzzle().id().equals(puzzleId) || game.getScheme() != scheme) {
            throw new IllegalArgumentException("Snapshot of " + puzzleId + " (" + scheme + ") does not match the loaded puzzle");
        }
        game.restore(toCells(), toSession(restoredAt));
    }
}
