package games.cryptogram;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import games.cryptogram.game.CryptogramGame;
import games.cryptogram.game.DifficultyConfig;
import games.cryptogram.game.EncodingScheme;
import games.cryptogram.game.alignment.CellAligner;
import games.cryptogram.helpers.MutableClock;
import games.cryptogram.helpers.TestPuzzles;
import games.cryptogram.player.Player;
import games.cryptogram.progress.AttemptStatistics;
import games.cryptogram.progress.JsonSessionStore;
import games.cryptogram.progress.ProgressRecorder;
import games.cryptogram.progress.SessionSnapshot;
import games.cryptogram.puzzle.ClasspathPuzzleSource;
import games.cryptogram.puzzle.Puzzle;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("Game loop")
class GameTest {
    @TempDir
    Path tempDir;

    private MutableClock clock;
    private JsonSessionStore store;
    private AttemptStatistics statistics;
    private ClasspathPuzzleSource puzzles;

    /** Replays a fixed list of commands and keeps the feedback it was shown. */
    private static final class ScriptedPlayer implements Player {
        private final Deque<String> commands;
        private final List<String> feedback = new ArrayList<>();

        ScriptedPlayer(String... commands) {
            this.commands = new ArrayDeque<>(Arrays.asList(commands));
        }

        @Override
        public String nextCommand(CryptogramGame game, String feedback) {
            this.feedback.add(feedback);
            return commands.poll();
        }

        String lastFeedback() {
            return feedback.get(feedback.size() - 1);
        }
    }

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        store = new JsonSessionStore(tempDir);
        statistics = new AttemptStatistics(tempDir.resolve("attempts.json"));
        puzzles = new ClasspathPuzzleSource("puzzles-test.json");
    }

    private Game game(Player player, DifficultyConfig difficulty, boolean resume) {
        ProgressRecorder recorder = new ProgressRecorder(List.of(statistics), store, clock);
        return new Game(player, puzzles, recorder, store, statistics, new CellAligner(), difficulty,
                EncodingScheme.LETTERS, resume, new Random(3), clock);
    }

    private Puzzle t1() {
        // A B , _ C D -> H I , _ J K
        return puzzles.findById("t1", EncodingScheme.LETTERS).orElseThrow();
    }

    @Test
    void solvesAPuzzleWithTypedAndBareLetters() {
        ScriptedPlayer player = new ScriptedPlayer("type 0 h", "i", "select 4", "j", "k");

        Game.GameResult result = game(player, DifficultyConfig.expert(), true).play(t1());

        assertTrue(result.isSolved());
        assertEquals("t1", result.getPuzzleId());
        assertEquals(0, result.getMistakes());
        assertTrue(player.lastFeedback().startsWith("Solved in 00:00"));
        assertEquals(1, statistics.totalCompletions());
        assertTrue(store.load("t1", EncodingScheme.LETTERS).orElseThrow().complete());
    }

    @Test
    void unknownCommandsBecomeFeedback() {
        ScriptedPlayer player = new ScriptedPlayer("dance");
        game(player, DifficultyConfig.expert(), true).play(t1());
        assertEquals("Unrecognised command: dance", player.lastFeedback());
    }

    @Test
    void quitEndsTheLoop() {
        ScriptedPlayer player = new ScriptedPlayer("quit", "type 0 H");
        Game.GameResult result = game(player, DifficultyConfig.expert(), true).play(t1());
        assertFalse(result.isSolved());
        assertEquals(1, player.feedback.size());
    }

    @Test
    void failingThenContinuing() {
        ScriptedPlayer player = new ScriptedPlayer("type 0 z", "continue", "type 1 z");

        Game.GameResult result = game(player, TestPuzzles.expert(1), true).play(t1());

        assertTrue(player.feedback.get(1).startsWith("Out of mistakes"));
        assertTrue(player.feedback.get(2).startsWith("Continuing"));
        assertEquals("Z is not right for cell 1.", player.lastFeedback());
        assertFalse(result.isFailed());
        assertEquals(2, result.getMistakes());
        assertEquals(1, statistics.totalFailures());
    }

    @Test
    void unfinishedSessionIsResumed() {
        game(new ScriptedPlayer("type 0 z", "type 1 I"), DifficultyConfig.expert(), true).play(t1());

        Game.GameResult resumed = game(new ScriptedPlayer(), DifficultyConfig.expert(), true).play(t1());
        assertEquals(1, resumed.getMistakes());

        Game.GameResult fresh = game(new ScriptedPlayer(), DifficultyConfig.expert(), false).play(t1());
        assertEquals(0, fresh.getMistakes());
    }

    @Test
    void finishedSessionIsNotResumed() {
        game(new ScriptedPlayer("hint", "hint", "hint", "hint"), DifficultyConfig.expert(), true).play(t1());
        assertEquals(1, statistics.totalCompletions());

        Game.GameResult again = game(new ScriptedPlayer(), DifficultyConfig.expert(), true).play(t1());
        assertFalse(again.isSolved());
        assertEquals(0, again.getHints());
    }

    @Test
    void corruptedSaveStartsFresh() {
        game(new ScriptedPlayer("type 0 z"), DifficultyConfig.expert(), true).play(t1());
        SessionSnapshot saved = store.load("t1", EncodingScheme.LETTERS).orElseThrow();
        List<SessionSnapshot.CellState> cells = new ArrayList<>(saved.cells());
        SessionSnapshot.CellState first = cells.get(0);
        cells.set(0, new SessionSnapshot.CellState(first.position(), first.encodedToken(), null, false,
                "Z", false, false, true));
        store.save(new SessionSnapshot(saved.puzzleId(), saved.scheme(), saved.savedAt(), cells, saved.startTime(),
                saved.endTime(), saved.mistakeCount(), saved.hintCount(), saved.selectedIndex(), saved.complete(),
                saved.failed(), saved.pausedMillis(), saved.continuedAfterFailure()));

        ScriptedPlayer player = new ScriptedPlayer("type 0 h");
        Game.GameResult result = game(player, DifficultyConfig.expert(), true).play(t1());

        assertEquals(0, result.getMistakes());
        assertEquals("", player.lastFeedback());
    }

    @Test
    void statsBeforeAnyFinishedPuzzle() {
        ScriptedPlayer player = new ScriptedPlayer("stats");
        game(player, DifficultyConfig.expert(), true).play(t1());
        assertEquals("No finished puzzles yet.", player.lastFeedback());
    }

    @Test
    void statsSurviveARestart() {
        game(new ScriptedPlayer("type 0 h", "i", "select 4", "j", "k"), DifficultyConfig.expert(), true).play(t1());

        statistics = new AttemptStatistics(tempDir.resolve("attempts.json"));
        ScriptedPlayer player = new ScriptedPlayer("stats");
        game(player, DifficultyConfig.expert(), true).play(t1());

        String stats = player.lastFeedback();
        assertTrue(stats.startsWith("Played 1, solved 1 (100%), failed 0."), stats);
        assertTrue(stats.contains("Distinct puzzles solved: 1."), stats);
        assertTrue(stats.endsWith("This puzzle: solved 1, failed 0, best 00:00."), stats);
    }

    @Test
    void resetDiscardsTheSavedSession() {
        ScriptedPlayer player = new ScriptedPlayer("type 0 z", "reset");
        game(player, DifficultyConfig.expert(), true).play(t1());

        assertEquals("Started over.", player.lastFeedback());
        SessionSnapshot saved = store.load("t1", EncodingScheme.LETTERS).orElseThrow();
        assertEquals(0, saved.mistakeCount());
    }

    @Test
    void feedbackForNoOps() {
        ScriptedPlayer player = new ScriptedPlayer("delete", "pause", "select 2", "right", "right", "right", "right", "right");
        game(player, DifficultyConfig.expert(), true).play(t1());

        assertEquals("Select a cell first.", player.feedback.get(1));
        assertEquals("The clock has not started.", player.feedback.get(2));
        assertEquals("Cell 2 cannot be selected.", player.feedback.get(3));
        assertEquals("", player.feedback.get(4));
        assertEquals("Already at the last cell.", player.lastFeedback());
    }

    @Test
    void unknownPuzzleIdIsReportedWithoutPlaying() {
        ScriptedPlayer player = new ScriptedPlayer("quit");
        game(player, DifficultyConfig.expert(), true).run("nope");
        assertTrue(player.feedback.isEmpty());
    }

    @Test
    void namedPuzzleIsPlayed() {
        ScriptedPlayer player = new ScriptedPlayer("quit");
        game(player, DifficultyConfig.expert(), true).run("--spring.main.banner-mode=off", "t2");
        assertEquals(1, player.feedback.size());
    }
}
