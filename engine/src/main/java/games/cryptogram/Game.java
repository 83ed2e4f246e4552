package games.cryptogram;

import games.cryptogram.config.DifficultyProperties;
import games.cryptogram.config.EncodingProperties;
import games.cryptogram.config.ProgressProperties;
import games.cryptogram.game.BoardFormatter;
import games.cryptogram.game.CryptogramGame;
import games.cryptogram.game.DifficultyConfig;
import games.cryptogram.game.EncodingScheme;
import games.cryptogram.game.HintPolicy;
import games.cryptogram.game.Session;
import games.cryptogram.game.SelectionHelper;
import games.cryptogram.game.alignment.AlignmentException;
import games.cryptogram.game.alignment.CellAligner;
import games.cryptogram.player.Command;
import games.cryptogram.player.Player;
import games.cryptogram.progress.AttemptStatistics;
import games.cryptogram.progress.ProgressRecorder;
import games.cryptogram.progress.SessionSnapshot;
import games.cryptogram.progress.SessionStore;
import games.cryptogram.puzzle.Puzzle;
import games.cryptogram.puzzle.PuzzleSource;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class Game implements CommandLineRunner {
    private static final Logger log = LoggerFactory.getLogger(Game.class);

    private final Player player;
    private final PuzzleSource puzzles;
    private final ProgressRecorder recorder;
    private final SessionStore store;
    private final AttemptStatistics statistics;
    private final CellAligner aligner;
    private final DifficultyConfig difficulty;
    private final EncodingScheme scheme;
    private final boolean resume;
    private final Random random;
    private final Clock clock;

    @Autowired
    public Game(Player player, PuzzleSource puzzles, ProgressRecorder recorder, SessionStore store,
                AttemptStatistics statistics, CellAligner aligner, DifficultyProperties difficulty,
                EncodingProperties encoding, ProgressProperties progress, Random random, Clock clock) {
        this(player, puzzles, recorder, store, statistics, aligner, difficulty.toConfig(), encoding.toScheme(),
                progress.isResume(), random, clock);
    }

    Game(Player player, PuzzleSource puzzles, ProgressRecorder recorder, SessionStore store,
         AttemptStatistics statistics, CellAligner aligner, DifficultyConfig difficulty, EncodingScheme scheme,
         boolean resume, Random random, Clock clock) {
        this.player = player;
        this.puzzles = puzzles;
        this.recorder = recorder;
        this.store = store;
        this.statistics = statistics;
        this.aligner = aligner;
        this.difficulty = difficulty;
        this.scheme = scheme;
        this.resume = resume;
        this.random = random;
        this.clock = clock;
    }

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Game.class);
        app.setWebApplicationType(WebApplicationType.NONE);
        app.run(args);
    }

    /**
     * Plays the puzzle named by the first non-option argument, or today's puzzle.
     */
    @Override
    public void run(String... args) {
        Puzzle puzzle;
        try {
            puzzle = choosePuzzle(args);
        } catch (NoSuchElementException e) {
            log.error("No puzzle to play: {}", e.getMessage());
            return;
        }
        try {
            play(puzzle);
        } catch (AlignmentException e) {
            log.error("Puzzle {} cannot be played ({}): {}", e.getPuzzleId(), e.getReason(), e.getMessage());
        }
    }

    private Puzzle choosePuzzle(String... args) {
        for (String arg : args) {
            if (!arg.startsWith("-")) {
                return puzzles.findById(arg, scheme)
                        .orElseThrow(() -> new NoSuchElementException("unknown puzzle id " + arg));
            }
        }
        return puzzles.daily(LocalDate.now(clock), scheme);
    }

    /**
     * Core game loop used by both the CLI runner and automated tests.
     *
     * <p>Each turn renders the board, asks the player for a command, applies it and saves a
     * checkpoint. An unfinished saved session of the same puzzle is resumed first. The loop
     * ends when the player quits or stops answering.
     *
     * @return summary of the final state of the puzzle
     * @throws AlignmentException if the puzzle content cannot be aligned
     */
    public GameResult play(Puzzle puzzle) {
        CryptogramGame game = new CryptogramGame(aligner, difficulty, scheme, random, clock, recorder);
        game.start(puzzle);
        if (resume) {
            resumeSaved(game);
        }
        BoardFormatter formatter = new BoardFormatter(game);
        String feedback = "";

        while (true) {
            log.info("\n{}", formatter.format());
            String input = player.nextCommand(game, feedback);
            if (input == null) {
                break;
            }
            Command command;
            try {
                command = Command.parse(input);
            } catch (IllegalArgumentException e) {
                feedback = e.getMessage();
                continue;
            }
            if (log.isDebugEnabled()) {
                log.debug("Received command from {}: {}", player.getClass().getSimpleName(), command);
            }
            if (command.type() == Command.Type.QUIT) {
                break;
            }
            feedback = apply(game, command);
            recorder.checkpoint(game);
        }

        Session session = game.getSession();
        return new GameResult(puzzle.id(), game.isComplete(), game.isFailed(), session.getMistakeCount(),
                session.getHintCount(), game.elapsedTime());
    }

    private void resumeSaved(CryptogramGame game) {
        Optional<SessionSnapshot> saved;
        try {
            saved = store.load(game.getPuzzle().id(), scheme);
        } catch (UncheckedIOException e) {
            log.warn("Could not read saved session for {}; starting fresh", game.getPuzzle().id(), e);
            return;
        }
        if (saved.isEmpty() || saved.get().complete() || saved.get().failed()) {
            return;
        }
        try {
            saved.get().restoreInto(game, clock.instant());
            log.info("Resumed puzzle {} saved at {}", game.getPuzzle().id(), saved.get().savedAt());
        } catch (IllegalArgumentException e) {
            log.warn("Saved session for {} does not fit the puzzle; starting fresh", game.getPuzzle().id(), e);
            game.reset();
        }
    }

    /**
     * Applies one command and describes the outcome for the player.
     *
     * @return feedback for the next prompt; empty when there is nothing to say
     */
    String apply(CryptogramGame game, Command command) {
        switch (command.type()) {
            case SELECT:
                return game.selectCell(command.index()) ? "" : "Cell " + command.index() + " cannot be selected.";
            case TYPE:
                return type(game, command);
            case DELETE: {
                OptionalInt target = target(game, command);
                if (target.isEmpty()) {
                    return "Select a cell first.";
                }
                return game.handleDelete(target.getAsInt()) ? "" : "Nothing to delete in cell " + target.getAsInt() + ".";
            }
            case HINT: {
                OptionalInt revealed = game.revealHint(HintPolicy.RANDOM);
                return revealed.isPresent() ? outcome(game, "Revealed cell " + revealed.getAsInt() + ".")
                        : "No hint available.";
            }
            case LEFT:
                return game.moveSelection(SelectionHelper.Direction.BACKWARD) ? "" : "Already at the first cell.";
            case RIGHT:
                return game.moveSelection(SelectionHelper.Direction.FORWARD) ? "" : "Already at the last cell.";
            case PAUSE:
                if (!game.togglePause()) {
                    return "The clock has not started.";
                }
                return game.isPaused() ? "Paused." : "Resumed.";
            case CONTINUE:
                return game.clearFailureState() ? "Continuing. Mistakes no longer end the game." : "Nothing to continue.";
            case RESET:
                try {
                    store.delete(game.getPuzzle().id(), scheme);
                } catch (UncheckedIOException e) {
                    log.warn("Could not delete saved session for {}", game.getPuzzle().id(), e);
                }
                game.reset();
                return "Started over.";
            case STATS:
                return stats(game.getPuzzle().id());
            default:
                throw new IllegalStateException("Unhandled command: " + command);
        }
    }

    private String type(CryptogramGame game, Command command) {
        OptionalInt target = target(game, command);
        if (target.isEmpty()) {
            return "Select a cell first.";
        }
        int mistakesBefore = game.getSession().getMistakeCount();
        boolean correct = game.inputLetter(target.getAsInt(), command.letter());
        if (correct) {
            return outcome(game, "");
        }
        if (game.getSession().getMistakeCount() > mistakesBefore) {
            return outcome(game, command.letter() + " is not right for cell " + target.getAsInt() + ".");
        }
        return "Cell " + target.getAsInt() + " cannot be changed.";
    }

    /**
     * Summarises the attempt history overall and for the current puzzle.
     */
    private String stats(String puzzleId) {
        if (statistics.totalAttempts() == 0) {
            return "No finished puzzles yet.";
        }
        StringBuilder sb = new StringBuilder()
                .append("Played ").append(statistics.totalAttempts())
                .append(", solved ").append(statistics.totalCompletions())
                .append(" (").append(statistics.winRatePercentage()).append("%)")
                .append(", failed ").append(statistics.totalFailures()).append('.');
        statistics.bestTime().ifPresent(best -> sb.append(" Best ").append(BoardFormatter.formatMinutesSeconds(best)));
        statistics.averageTime().ifPresent(average ->
                sb.append(", average ").append(BoardFormatter.formatMinutesSeconds(average)).append('.'));
        sb.append(" Distinct puzzles solved: ").append(statistics.completedPuzzleIds(scheme).size()).append('.');
        sb.append(" This puzzle: solved ").append(statistics.completionCount(puzzleId, scheme))
                .append(", failed ").append(statistics.failureCount(puzzleId, scheme));
        statistics.bestTime(puzzleId, scheme)
                .ifPresent(best -> sb.append(", best ").append(BoardFormatter.formatMinutesSeconds(best)));
        return sb.append('.').toString();
    }

    private static OptionalInt target(CryptogramGame game, Command command) {
        return command.index() != null ? OptionalInt.of(command.index()) : game.getSelectedIndex();
    }

    private static String outcome(CryptogramGame game, String message) {
        if (game.isComplete()) {
            Session session = game.getSession();
            return "Solved in " + BoardFormatter.formatMinutesSeconds(game.elapsedTime()) + " with "
                    + session.getMistakeCount() + " mistakes and " + session.getHintCount() + " hints.";
        }
        if (game.isFailed()) {
            return "Out of mistakes. Type 'continue' to keep going or 'reset' to start over.";
        }
        return message;
    }

    /**
     * Lightweight summary of a single game run.
     */
    public static final class GameResult {
        private final String puzzleId;
        private final boolean solved;
        private final boolean failed;
        private final int mistakes;
        private final int hints;
        private final Duration elapsed;

        public GameResult(String puzzleId, boolean solved, boolean failed, int mistakes, int hints, Duration elapsed) {
            this.puzzleId = puzzleId;
            this.solved = solved;
            this.failed = failed;
            this.mistakes = mistakes;
            this.hints = hints;
            this.elapsed = elapsed;
        }

        public String getPuzzleId() {
            return puzzleId;
        }

        public boolean isSolved() {
            return solved;
        }

        public boolean isFailed() {
            return failed;
        }

        public int getMistakes() {
            return mistakes;
        }

        public int getHints() {
            return hints;
        }

        public Duration getElapsed() {
            return elapsed;
        }
    }
}
