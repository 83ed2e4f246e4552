package games.cryptogram.game;

import java.time.Duration;
import java.time.Instant;

/**
 * Bookkeeping for one attempt at a puzzle: timing, counters and terminal flags.
 * <p>
 * Owned and mutated by {@link CryptogramGame}; callers only ever see copies returned by
 * {@link CryptogramGame#getSession()}. Time is never read here; every timestamp is supplied
 * by the game from its injected clock, which keeps elapsed-time arithmetic deterministic in tests.
 * <p>
 * <strong>Elapsed time</strong> is {@code (endTime or now) - startTime - totalPausedDuration},
 * with a pause still in progress also excluded.
 */
public final class Session {
    private Instant startTime;
    private Instant endTime;
    private int mistakeCount;
    private int hintCount;
    private Integer selectedIndex;
    private boolean complete;
    private boolean failed;
    private boolean paused;
    private Instant pauseStartedAt;
    private Duration totalPausedDuration = Duration.ZERO;
    /** Set once the player chose to keep playing after failing; further mistakes no longer fail. */
    private boolean continuedAfterFailure;
    /** Whether the current terminal state has already been reported to listeners. */
    private boolean terminalReported;

    /** Creates a fresh, not yet started session. */
    public Session() {
    }

    /**
     * Rebuilds a session from persisted values. A session cannot be both complete and failed,
     * and restored sessions are never paused.
     *
     * @throws IllegalArgumentException if counters are negative or both terminal flags are set
     */
    public static Session restored(Instant startTime, Instant endTime, int mistakeCount, int hintCount,
                                   Integer selectedIndex, boolean complete, boolean failed,
                                   Duration totalPausedDuration, boolean continuedAfterFailure) {
        if (mistakeCount < 0 || hintCount < 0) {
            throw new IllegalArgumentException("Session counters must not be negative");
        }
        if (complete && failed) {
            throw new IllegalArgumentException("Session cannot be both complete and failed");
        }
        Session session = new Session();
        session.startTime = startTime;
        session.endTime = endTime;
        session.mistakeCount = mistakeCount;
        session.hintCount = hintCount;
        session.selectedIndex = selectedIndex;
        session.complete = complete;
        session.failed = failed;
        session.totalPausedDuration = totalPausedDuration == null || totalPausedDuration.isNegative()
                ? Duration.ZERO : totalPausedDuration;
        session.continuedAfterFailure = continuedAfterFailure;
        // A terminal session loaded from storage was reported when it finished.
        session.terminalReported = complete || failed;
        return session;
    }

    /**
     * Returns an independent copy of this session.
     */
    public Session copy() {
        Session copy = new Session();
        copy.startTime = startTime;
        copy.endTime = endTime;
        copy.mistakeCount = mistakeCount;
        copy.hintCount = hintCount;
        copy.selectedIndex = selectedIndex;
        copy.complete = complete;
        copy.failed = failed;
        copy.paused = paused;
        copy.pauseStartedAt = pauseStartedAt;
        copy.totalPausedDuration = totalPausedDuration;
        copy.continuedAfterFailure = continuedAfterFailure;
        copy.terminalReported = terminalReported;
        return copy;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Instant getEndTime() {
        return endTime;
    }

    public int getMistakeCount() {
        return mistakeCount;
    }

    public int getHintCount() {
        return hintCount;
    }

    /**
     * Returns the cursor position, or {@code null} when no cell is selected.
     */
    public Integer getSelectedIndex() {
        return selectedIndex;
    }

    public boolean isComplete() {
        return complete;
    }

    public boolean isFailed() {
        return failed;
    }

    public boolean isPaused() {
        return paused;
    }

    /**
     * Returns when the current pause began, or {@code null} when not paused.
     */
    public Instant getPauseStartedAt() {
        return pauseStartedAt;
    }

    public Duration getTotalPausedDuration() {
        return totalPausedDuration;
    }

    public boolean hasContinuedAfterFailure() {
        return continuedAfterFailure;
    }

    public boolean isTerminalReported() {
        return terminalReported;
    }

    /** Started and not yet finished. */
    public boolean hasStarted() {
        return startTime != null && !complete && !failed;
    }

    public boolean isTerminal() {
        return complete || failed;
    }

    /**
     * Computes elapsed play time at {@code now}.
     *
     * @param now the current instant (ignored once the session has ended)
     * @return elapsed time excluding pauses; zero before the first interaction
     */
    public Duration elapsedTime(Instant now) {
        if (startTime == null) {
            return Duration.ZERO;
        }
        Instant until = endTime != null ? endTime : now;
        Duration elapsed = Duration.between(startTime, until).minus(totalPausedDuration);
        if (paused && pauseStartedAt != null && endTime == null) {
            elapsed = elapsed.minus(Duration.between(pauseStartedAt, until));
        }
        return elapsed.isNegative() ? Duration.ZERO : elapsed;
    }

    void start(Instant now) {
        if (startTime == null) {
            startTime = now;
        }
    }

    void select(Integer index) {
        selectedIndex = index;
    }

    void incrementMistakes() {
        mistakeCount++;
    }

    void incrementHints() {
        hintCount++;
    }

    void markComplete(Instant now) {
        complete = true;
        failed = false;
        if (endTime == null) {
            endTime = now;
        }
    }

    void markFailed(Instant now) {
        failed = true;
        if (endTime == null) {
            endTime = now;
        }
    }

    void markTerminalReported() {
        terminalReported = true;
    }

    /**
     * Leaves the failed state so play can continue. The mistake count is kept; the end time is
     * cleared so the clock runs again until the puzzle is finished.
     */
    void clearFailure() {
        failed = false;
        continuedAfterFailure = true;
        endTime = null;
        terminalReported = false;
    }

    void togglePause(Instant now) {
        paused = !paused;
        if (paused) {
            pauseStartedAt = now;
        } else if (pauseStartedAt != null) {
            totalPausedDuration = totalPausedDuration.plus(Duration.between(pauseStartedAt, now));
            pauseStartedAt = null;
        }
    }

    @Override
    public String toString() {
        return "Session(start=" + startTime + ", end=" + endTime + ", mistakes=" + mistakeCount
                + ", hints=" + hintCount + ", complete=" + complete + ", failed=" + failed
                + ", paused=" + paused + ", paused_total=" + totalPausedDuration + ")";
    }
}
