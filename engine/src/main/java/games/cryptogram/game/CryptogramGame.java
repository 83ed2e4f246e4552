package games.cryptogram.game;

import games.cryptogram.game.alignment.AlignmentException;
import games.cryptogram.game.alignment.CellAligner;
import games.cryptogram.puzzle.Puzzle;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Random;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * State machine for one cryptogram: owns the live cells and the {@link Session} and applies
 * player interaction to them.
 * <p>
 * <strong>Phases:</strong> {@code IDLE -> ACTIVE -> COMPLETED | FAILED}. The game becomes active
 * with the first input or hint, which also starts the clock. Pausing is orthogonal to the
 * phase. {@link #clearFailureState()} returns a failed game to active play with unlimited
 * mistakes; {@link #reset()} starts the puzzle over.
 * <p>
 * <strong>No-ops:</strong> operations on out-of-range indices, symbol cells, locked (hinted or
 * pre-filled) cells, or while the game is paused or finished are ignored and reported through
 * the return value. They stem from the UI racing fast-changing state and are never errors. The
 * only exception callers must handle is the {@link AlignmentException} thrown when a puzzle
 * cannot be loaded.
 * <p>
 * <strong>Validation:</strong> every cell is checked on its own against its plaintext letter;
 * typing into one cell never fills or checks other cells sharing the same encoded token.
 * <p>
 * Not thread-safe. All collaborators (aligner, difficulty, randomness, clock, listener) are
 * passed in; nothing is looked up globally.
 */
public class CryptogramGame {
    private static final Logger log = LoggerFactory.getLogger(CryptogramGame.class);
    /** Guards the pre-fill count against products like 10 * 0.2 landing just above an integer. */
    private static final double PREFILL_EPSILON = 1e-9;

    private final CellAligner aligner;
    private final DifficultyConfig difficulty;
    private final EncodingScheme scheme;
    private final Random random;
    private final Clock clock;
    private final GameListener listener;
    private final SelectionHelper selection;

    private Puzzle puzzle;
    private List<Cell> cells = new ArrayList<>();
    private Session session = new Session();

    /**
     * @param aligner builds the cells of each puzzle
     * @param difficulty pre-fill and mistake settings
     * @param scheme encoding the puzzles are played with
     * @param random source for pre-fill and hint choices
     * @param clock source of session timestamps
     * @param listener receives state change and terminal notifications
     */
    public CryptogramGame(CellAligner aligner, DifficultyConfig difficulty, EncodingScheme scheme,
                          Random random, Clock clock, GameListener listener) {
        this.aligner = Objects.requireNonNull(aligner, "aligner");
        this.difficulty = Objects.requireNonNull(difficulty, "difficulty");
        this.scheme = Objects.requireNonNull(scheme, "scheme");
        this.random = Objects.requireNonNull(random, "random");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.listener = Objects.requireNonNull(listener, "listener");
        this.selection = new SelectionHelper(this);
    }

    public CryptogramGame(DifficultyConfig difficulty, EncodingScheme scheme) {
        this(new CellAligner(), difficulty, scheme, new Random(), Clock.systemUTC(), GameListener.NONE);
    }

    // ---------------------------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------------------------

    /**
     * Loads a puzzle: aligns it, creates a fresh session and, in normal mode, pre-fills letters.
     * <p>
     * Alignment runs before any state is touched, so a malformed puzzle leaves the current game
     * as it was.
     *
     * @param puzzle the puzzle to play; must not be null
     * @throws AlignmentException if the puzzle content cannot be aligned
     */
    public void start(Puzzle puzzle) {
        Objects.requireNonNull(puzzle, "puzzle");
        List<Cell> aligned = aligner.align(puzzle, scheme);
        this.puzzle = puzzle;
        this.cells = new ArrayList<>(aligned);
        this.session = new Session();
        if (difficulty.isPrefillEnabled()) {
            applyPrefill();
        }
        if (log.isDebugEnabled()) {
            log.debug("Started puzzle {} ({}, {}): {} cells", puzzle.id(), scheme, difficulty.getMode(), cells.size());
        }
        checkCompletion();
        listener.onStateChanged(this);
    }

    /**
     * Starts the current puzzle over, discarding all progress.
     *
     * @throws IllegalStateException if no puzzle has been started
     */
    public void reset() {
        if (puzzle == null) {
            throw new IllegalStateException("No puzzle to reset");
        }
        start(puzzle);
    }

    /**
     * Replaces the current puzzle (if any) with the given one and starts it.
     *
     * @throws AlignmentException if the puzzle content cannot be aligned
     */
    public void reset(Puzzle puzzle) {
        start(puzzle);
    }

    /**
     * Replaces live state for the current puzzle with previously saved cells and session,
     * without re-running alignment.
     *
     * @throws IllegalStateException if no puzzle has been started
     * @throws IllegalArgumentException if the cell positions are not 0..N-1
     */
    public void restore(List<Cell> savedCells, Session savedSession) {
        if (puzzle == null) {
            throw new IllegalStateException("No puzzle to restore into");
        }
        restore(puzzle, savedCells, savedSession);
    }

    /**
     * Replaces the puzzle, cells and session with saved state, without re-running alignment.
     * A restored finished session is not reported to listeners again.
     *
     * @throws IllegalArgumentException if the cell positions are not 0..N-1
     */
    public void restore(Puzzle puzzle, List<Cell> savedCells, Session savedSession) {
        Objects.requireNonNull(puzzle, "puzzle");
        Objects.requireNonNull(savedCells, "savedCells");
        Objects.requireNonNull(savedSession, "savedSession");
        for (int i = 0; i < savedCells.size(); i++) {
            if (savedCells.get(i).getPosition() != i) {
                throw new IllegalArgumentException("Cell at index " + i + " has position "
                        + savedCells.get(i).getPosition());
            }
        }
        this.puzzle = puzzle;
        this.cells = new ArrayList<>(savedCells);
        this.session = savedSession.copy();
        Integer selected = session.getSelectedIndex();
        if (selected != null && (!inRange(selected) || cells.get(selected).isSymbol())) {
            session.select(null);
        }
        if (log.isDebugEnabled()) {
            log.debug("Restored puzzle {}: {} cells, {}", puzzle.id(), cells.size(), session);
        }
        listener.onStateChanged(this);
    }

    // ---------------------------------------------------------------------------------------
    // Player interaction
    // ---------------------------------------------------------------------------------------

    /**
     * Moves the cursor to a letter cell.
     *
     * @return whether the cursor moved; false for symbols and out-of-range indices
     */
    public boolean selectCell(int index) {
        if (!inRange(index) || cells.get(index).isSymbol()) {
            return false;
        }
        session.select(index);
        return true;
    }

    /**
     * Moves the cursor to the neighbouring letter cell.
     *
     * @return whether the cursor moved
     */
    public boolean moveSelection(SelectionHelper.Direction direction) {
        return selection.move(direction);
    }

    /**
     * Enters a guess into a cell.
     * <p>
     * Starts the clock on the first interaction. A correct guess advances the cursor to the
     * next letter cell and may complete the puzzle; an incorrect one is kept (flagged as an
     * error) and counts as a mistake, possibly failing the session.
     *
     * @param index cell index
     * @param letter the guessed plaintext letter, any case
     * @return whether the guess was correct; false when the input was ignored
     */
    public boolean inputLetter(int index, char letter) {
        if (!isPlayable() || !inRange(index) || !Character.isLetter(letter)) {
            logIgnored("input", index);
            return false;
        }
        Cell cell = cells.get(index);
        if (!cell.isEditable()) {
            logIgnored("input", index);
            return false;
        }

        Instant now = clock.instant();
        session.start(now);
        session.select(index);

        char guess = Character.toUpperCase(letter);
        boolean correct = guess == cell.getSolutionChar();
        cells.set(index, cell.withInput(String.valueOf(guess), !correct));

        if (correct) {
            selection.nextEligibleIndex(index, SelectionHelper.Direction.FORWARD).ifPresent(session::select);
            checkCompletion();
        } else {
            session.incrementMistakes();
            if (log.isDebugEnabled()) {
                log.debug("Mistake {} of {} at cell {} ({} is not {})", session.getMistakeCount(),
                        difficulty.getMaxMistakes(), index, guess, cell.getEncodedToken());
            }
            if (!session.hasContinuedAfterFailure()
                    && session.getMistakeCount() >= difficulty.getMaxMistakes()) {
                session.markFailed(now);
                reportTerminal();
            }
        }
        listener.onStateChanged(this);
        return correct;
    }

    /**
     * Clears the guess (and error flag) of an editable cell. Never changes the mistake count.
     *
     * @return whether the cell changed
     */
    public boolean handleDelete(int index) {
        if (!isPlayable() || !inRange(index)) {
            logIgnored("delete", index);
            return false;
        }
        Cell cell = cells.get(index);
        if (!cell.isEditable() || (cell.isEmpty() && !cell.isError())) {
            return false;
        }
        cells.set(index, cell.cleared());
        listener.onStateChanged(this);
        return true;
    }

    /**
     * Reveals the solution letter of one unsolved cell. Hinted cells are locked afterwards.
     *
     * @param policy how the cell is chosen
     * @return the revealed index, or empty when no cell is eligible or the game is not playable
     */
    public OptionalInt revealHint(HintPolicy policy) {
        Objects.requireNonNull(policy, "policy");
        if (!isPlayable()) {
            logIgnored("hint", -1);
            return OptionalInt.empty();
        }
        List<Integer> eligible = hintCandidates();
        if (eligible.isEmpty()) {
            return OptionalInt.empty();
        }

        Integer selected = session.getSelectedIndex();
        int target = switch (policy) {
            case RANDOM -> eligible.get(random.nextInt(eligible.size()));
            case SELECTED_CELL -> selected != null && eligible.contains(selected) ? selected : eligible.get(0);
            case FIRST_UNSOLVED -> eligible.get(0);
        };

        session.start(clock.instant());
        cells.set(target, cells.get(target).revealedCopy());
        session.incrementHints();
        session.select(target);
        selection.nextEligibleIndex(target, SelectionHelper.Direction.FORWARD).ifPresent(session::select);
        if (log.isDebugEnabled()) {
            log.debug("Hint {} revealed cell {} ({})", session.getHintCount(), target, policy);
        }
        checkCompletion();
        listener.onStateChanged(this);
        return OptionalInt.of(target);
    }

    /** Reveals a random unsolved cell. */
    public OptionalInt revealHint() {
        return revealHint(HintPolicy.RANDOM);
    }

    /**
     * Pauses or resumes the clock. Only possible once the game has started and before it ends.
     *
     * @return whether the pause state changed
     */
    public boolean togglePause() {
        if (puzzle == null || !session.hasStarted()) {
            return false;
        }
        session.togglePause(clock.instant());
        listener.onStateChanged(this);
        return true;
    }

    /**
     * Lets the player keep going after failing. Mistakes made from here on no longer fail the
     * session.
     *
     * @return whether the game was failed
     */
    public boolean clearFailureState() {
        if (!session.isFailed()) {
            return false;
        }
        session.clearFailure();
        log.debug("Continuing puzzle {} after failure", puzzle.id());
        listener.onStateChanged(this);
        return true;
    }

    /**
     * Marks the puzzle complete when every letter cell holds its solution letter (case-insensitive),
     * reporting the completion once.
     *
     * @return whether the puzzle is complete
     */
    public boolean checkCompletion() {
        if (puzzle == null || session.isFailed()) {
            return false;
        }
        if (session.isComplete()) {
            return true;
        }
        for (Cell cell : cells) {
            if (!cell.isSymbol() && !cell.isCorrect()) {
                return false;
            }
        }
        session.markComplete(clock.instant());
        reportTerminal();
        return true;
    }

    // ---------------------------------------------------------------------------------------
    // Read-only accessors
    // ---------------------------------------------------------------------------------------

    /** Returns an immutable snapshot of the cells. */
    public List<Cell> getCells() {
        return Collections.unmodifiableList(new ArrayList<>(cells));
    }

    /** Returns a copy of the session. */
    public Session getSession() {
        return session.copy();
    }

    public Puzzle getPuzzle() {
        return puzzle;
    }

    public EncodingScheme getScheme() {
        return scheme;
    }

    public DifficultyConfig getDifficulty() {
        return difficulty;
    }

    public SelectionHelper getSelection() {
        return selection;
    }

    public OptionalInt getSelectedIndex() {
        Integer selected = session.getSelectedIndex();
        return selected == null ? OptionalInt.empty() : OptionalInt.of(selected);
    }

    public GamePhase getPhase() {
        if (session.isComplete()) {
            return GamePhase.COMPLETED;
        }
        if (session.isFailed()) {
            return GamePhase.FAILED;
        }
        return session.getStartTime() == null ? GamePhase.IDLE : GamePhase.ACTIVE;
    }

    public boolean isComplete() {
        return session.isComplete();
    }

    public boolean isFailed() {
        return session.isFailed();
    }

    public boolean isPaused() {
        return session.isPaused();
    }

    /** Play time so far, excluding pauses. */
    public Duration elapsedTime() {
        return session.elapsedTime(clock.instant());
    }

    /**
     * Share of letter cells holding any guess, in [0, 1]. Pre-filled and hinted cells count.
     */
    public double progress() {
        int total = 0;
        int filled = 0;
        for (Cell cell : cells) {
            if (cell.isSymbol()) {
                continue;
            }
            total++;
            if (!cell.isEmpty()) {
                filled++;
            }
        }
        return total == 0 ? 0.0 : (double) filled / total;
    }

    /**
     * Number of cells the player still has to solve: editable letter cells that are not yet
     * correct. Pre-filled and hinted cells never count.
     */
    public int remainingCells() {
        int remaining = 0;
        for (Cell cell : cells) {
            if (cell.isEditable() && !cell.isCorrect()) {
                remaining++;
            }
        }
        return remaining;
    }

    /**
     * Encoded tokens all of whose cells hold a guess, in order of first appearance.
     */
    Set<String> completedTokens() {
        Set<String> tokens = new LinkedHashSet<>();
        Set<String> unfinished = new TreeSet<>();
        for (Cell cell : cells) {
            if (cell.isSymbol()) {
                continue;
            }
            tokens.add(cell.getEncodedToken());
            if (cell.isEmpty()) {
                unfinished.add(cell.getEncodedToken());
            }
        }
        tokens.removeAll(unfinished);
        return tokens;
    }

    /**
     * Builds the summary reported on a terminal transition.
     *
     * @throws IllegalStateException if the game is neither complete nor failed
     */
    public TerminalResult terminalResult() {
        if (!session.isTerminal()) {
            throw new IllegalStateException("Game has not finished");
        }
        Instant now = clock.instant();
        Instant finishedAt = session.getEndTime() != null ? session.getEndTime() : now;
        return new TerminalResult(puzzle.id(), scheme, session.isComplete(), session.isFailed(),
                session.getMistakeCount(), session.getHintCount(), session.elapsedTime(now), finishedAt);
    }

    /** Cells as held by the game, for collaborators in this package that only read them. */
    List<Cell> liveCells() {
        return Collections.unmodifiableList(cells);
    }

    // ---------------------------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------------------------

    /**
     * Pre-fills one random occurrence of {@code max(1, ceil(n * prefillFraction))} randomly chosen
     * distinct solution letters. Pre-filled cells are locked and are not hints.
     */
    private void applyPrefill() {
        Set<Character> letters = new TreeSet<>();
        for (Cell cell : cells) {
            if (!cell.isSymbol()) {
                letters.add(cell.getSolutionChar());
            }
        }
        if (letters.isEmpty()) {
            return;
        }
        int wanted = (int) Math.ceil(letters.size() * difficulty.getPrefillFraction() - PREFILL_EPSILON);
        int count = Math.min(letters.size(), Math.max(1, wanted));

        List<Character> pool = new ArrayList<>(letters);
        Collections.shuffle(pool, random);
        for (Character letter : pool.subList(0, count)) {
            List<Integer> occurrences = new ArrayList<>();
            for (int i = 0; i < cells.size(); i++) {
                Cell cell = cells.get(i);
                if (!cell.isSymbol() && letter.equals(cell.getSolutionChar())) {
                    occurrences.add(i);
                }
            }
            int index = occurrences.get(random.nextInt(occurrences.size()));
            cells.set(index, cells.get(index).preFilledCopy());
        }
        if (log.isDebugEnabled()) {
            log.debug("Pre-filled {} of {} distinct letters", count, letters.size());
        }
    }

    private List<Integer> hintCandidates() {
        List<Integer> eligible = new ArrayList<>();
        for (int i = 0; i < cells.size(); i++) {
            Cell cell = cells.get(i);
            if (cell.isEditable() && !cell.isCorrect()) {
                eligible.add(i);
            }
        }
        return eligible;
    }

    private void reportTerminal() {
        if (session.isTerminalReported()) {
            return;
        }
        session.markTerminalReported();
        TerminalResult result = terminalResult();
        log.info("Puzzle {} {} after {} (mistakes={}, hints={})", result.puzzleId(),
                result.complete() ? "completed" : "failed", result.elapsedTime(),
                result.mistakeCount(), result.hintCount());
        listener.onTerminal(result, this);
    }

    private boolean isPlayable() {
        return puzzle != null && !session.isTerminal() && !session.isPaused();
    }

    private boolean inRange(int index) {
        return index >= 0 && index < cells.size();
    }

    private void logIgnored(String operation, int index) {
        if (log.isDebugEnabled()) {
            log.debug("Ignoring {} at {} (phase={}, paused={}, cells={})", operation, index,
                    getPhase(), session.isPaused(), cells.size());
        }
    }
}
