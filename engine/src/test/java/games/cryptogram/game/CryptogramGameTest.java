package games.cryptogram.game;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import games.cryptogram.game.alignment.AlignmentException;
import games.cryptogram.helpers.MutableClock;
import games.cryptogram.helpers.RecordingListener;
import games.cryptogram.helpers.TestPuzzles;
import games.cryptogram.puzzle.Puzzle;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.OptionalInt;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("CryptogramGame")
class CryptogramGameTest {
    private MutableClock clock;
    private RecordingListener listener;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        listener = new RecordingListener();
    }

    private CryptogramGame expert(int maxMistakes, Puzzle puzzle) {
        CryptogramGame game = TestPuzzles.game(TestPuzzles.expert(maxMistakes), clock, listener);
        game.start(puzzle);
        return game;
    }

    @Nested
    @DisplayName("Input")
    class InputTests {

        @Test
        void firstInputStartsTheClock() {
            CryptogramGame game = expert(3, TestPuzzles.fourLetters());
            assertEquals(GamePhase.IDLE, game.getPhase());
            assertNull(game.getSession().getStartTime());

            assertTrue(game.inputLetter(0, 'h'));

            assertEquals(GamePhase.ACTIVE, game.getPhase());
            assertEquals(clock.instant(), game.getSession().getStartTime());
            assertEquals("H", game.getCells().get(0).getUserInput());
        }

        @Test
        void correctInputAdvancesPastSymbols() {
            CryptogramGame game = expert(3, TestPuzzles.hiJk());
            game.inputLetter(1, 'I');
            assertEquals(OptionalInt.of(4), game.getSelectedIndex());
        }

        @Test
        void wrongInputIsKeptAndFlagged() {
            CryptogramGame game = expert(3, TestPuzzles.fourLetters());

            assertFalse(game.inputLetter(0, 'Z'));

            Cell cell = game.getCells().get(0);
            assertEquals("Z", cell.getUserInput());
            assertTrue(cell.isError());
            assertEquals(1, game.getSession().getMistakeCount());
            assertEquals(OptionalInt.of(0), game.getSelectedIndex());
        }

        @Test
        void everyWrongInputCountsEvenOnTheSameCell() {
            CryptogramGame game = expert(5, TestPuzzles.fourLetters());
            game.inputLetter(0, 'Z');
            game.inputLetter(0, 'Y');
            assertEquals(2, game.getSession().getMistakeCount());
        }

        @Test
        void validationIsPerCell() {
            CryptogramGame game = expert(3, new Puzzle("rep", "ABA", "HIH"));
            game.inputLetter(0, 'H');
            assertTrue(game.getCells().get(2).isEmpty());
        }

        @Test
        void ignoredInputs() {
            CryptogramGame game = expert(3, TestPuzzles.hiJk());

            assertFalse(game.inputLetter(0, '1'));
            assertFalse(game.inputLetter(2, 'A'));
            assertFalse(game.inputLetter(-1, 'A'));
            assertFalse(game.inputLetter(99, 'A'));

            assertEquals(0, game.getSession().getMistakeCount());
            assertEquals(GamePhase.IDLE, game.getPhase());
        }

        @Test
        void inputBeforeAnyPuzzleIsIgnored() {
            CryptogramGame game = TestPuzzles.expertGame(clock, listener);
            assertFalse(game.inputLetter(0, 'A'));
            assertEquals(0, game.getCells().size());
        }

        @Test
        void selectionRejectsSymbolsAndOutOfRange() {
            CryptogramGame game = expert(3, TestPuzzles.hiJk());
            assertFalse(game.selectCell(2));
            assertFalse(game.selectCell(-1));
            assertFalse(game.selectCell(6));
            assertTrue(game.selectCell(5));
            assertEquals(OptionalInt.of(5), game.getSelectedIndex());
        }

        @Test
        void deleteClearsInputButNotMistakes() {
            CryptogramGame game = expert(3, TestPuzzles.fourLetters());
            game.inputLetter(0, 'Z');

            assertTrue(game.handleDelete(0));

            Cell cell = game.getCells().get(0);
            assertTrue(cell.isEmpty());
            assertFalse(cell.isError());
            assertEquals(1, game.getSession().getMistakeCount());
            assertFalse(game.handleDelete(0));
        }

        @Test
        void deleteIgnoresLockedCells() {
            CryptogramGame game = expert(3, TestPuzzles.fourLetters());
            game.revealHint(HintPolicy.FIRST_UNSOLVED);
            assertFalse(game.handleDelete(0));
            assertEquals("H", game.getCells().get(0).getUserInput());
        }
    }

    @Nested
    @DisplayName("Failure")
    class FailureTests {

        @Test
        void reachingTheMistakeLimitFails() {
            CryptogramGame game = expert(3, TestPuzzles.fourLetters());
            game.inputLetter(0, 'Z');
            game.inputLetter(1, 'Z');
            clock.advanceSeconds(7);
            game.inputLetter(2, 'Z');

            assertTrue(game.isFailed());
            assertEquals(GamePhase.FAILED, game.getPhase());
            assertEquals(clock.instant(), game.getSession().getEndTime());
            assertEquals(1, listener.terminals().size());
            assertTrue(listener.terminals().get(0).failed());
            assertEquals(3, listener.terminals().get(0).mistakeCount());
        }

        @Test
        void failedGameIgnoresInput() {
            CryptogramGame game = expert(1, TestPuzzles.fourLetters());
            game.inputLetter(0, 'Z');

            assertFalse(game.inputLetter(3, 'K'));
            assertFalse(game.handleDelete(0));
            assertEquals(OptionalInt.empty(), game.revealHint());
            assertTrue(game.getCells().get(3).isEmpty());
        }

        @Test
        void continuingAfterFailureAllowsUnlimitedMistakes() {
            CryptogramGame game = expert(1, TestPuzzles.fourLetters());
            game.inputLetter(0, 'Z');
            assertTrue(game.clearFailureState());

            assertEquals(GamePhase.ACTIVE, game.getPhase());
            assertNull(game.getSession().getEndTime());
            assertTrue(game.getSession().hasContinuedAfterFailure());

            game.inputLetter(1, 'Z');
            game.inputLetter(2, 'Z');
            assertFalse(game.isFailed());
            assertEquals(3, game.getSession().getMistakeCount());

            TestPuzzles.solve(game);
            assertTrue(game.isComplete());
            assertEquals(2, listener.terminals().size());
            assertTrue(listener.terminals().get(1).complete());
        }

        @Test
        void clearFailureStateOnlyAppliesToFailedGames() {
            CryptogramGame game = expert(3, TestPuzzles.fourLetters());
            assertFalse(game.clearFailureState());
        }
    }

    @Nested
    @DisplayName("Completion")
    class CompletionTests {

        @Test
        void solvingEveryCellCompletesOnce() {
            CryptogramGame game = expert(3, TestPuzzles.hiJk());
            assertEquals(OptionalInt.of(0), game.revealHint(HintPolicy.FIRST_UNSOLVED));
            game.inputLetter(1, 'i');
            game.inputLetter(4, 'J');
            assertFalse(game.isComplete());
            clock.advanceSeconds(30);
            game.inputLetter(5, 'K');

            assertTrue(game.isComplete());
            assertEquals(GamePhase.COMPLETED, game.getPhase());
            assertTrue(game.checkCompletion());
            assertEquals(1, listener.terminals().size());

            TerminalResult result = listener.terminals().get(0);
            assertEquals("hijk", result.puzzleId());
            assertEquals(EncodingScheme.LETTERS, result.scheme());
            assertEquals(1, result.hintCount());
            assertEquals(Duration.ofSeconds(30), result.elapsedTime());
            assertEquals(result, game.terminalResult());
        }

        @Test
        void completedGameIgnoresInput() {
            CryptogramGame game = expert(3, TestPuzzles.fourLetters());
            TestPuzzles.solve(game);
            assertFalse(game.inputLetter(0, 'Z'));
            assertEquals(0, game.getSession().getMistakeCount());
        }

        @Test
        void elapsedTimeFreezesOnCompletion() {
            CryptogramGame game = expert(3, TestPuzzles.fourLetters());
            game.inputLetter(0, 'H');
            clock.advanceSeconds(12);
            TestPuzzles.solve(game);
            clock.advanceSeconds(100);
            assertEquals(Duration.ofSeconds(12), game.elapsedTime());
        }

        @Test
        void terminalResultRequiresAFinishedGame() {
            CryptogramGame game = expert(3, TestPuzzles.fourLetters());
            assertThrows(IllegalStateException.class, game::terminalResult);
        }
    }

    @Nested
    @DisplayName("Hints")
    class HintTests {

        @Test
        void hintRevealsAndLocksACell() {
            CryptogramGame game = expert(3, TestPuzzles.fourLetters());
            OptionalInt revealed = game.revealHint(HintPolicy.FIRST_UNSOLVED);

            assertEquals(OptionalInt.of(0), revealed);
            Cell cell = game.getCells().get(0);
            assertTrue(cell.isRevealed());
            assertTrue(cell.isCorrect());
            assertFalse(game.inputLetter(0, 'Z'));
            assertEquals(1, game.getSession().getHintCount());
            assertEquals(0, game.getSession().getMistakeCount());
            assertEquals(OptionalInt.of(1), game.getSelectedIndex());
            assertNotNull(game.getSession().getStartTime());
        }

        @Test
        void hintSkipsCorrectCellsAndFixesWrongOnes() {
            CryptogramGame game = expert(3, TestPuzzles.fourLetters());
            game.inputLetter(0, 'H');
            game.inputLetter(1, 'Z');

            assertEquals(OptionalInt.of(1), game.revealHint(HintPolicy.FIRST_UNSOLVED));
            assertFalse(game.getCells().get(1).isError());
            assertEquals("I", game.getCells().get(1).getUserInput());
        }

        @Test
        void selectedCellPolicyPrefersTheCursor() {
            CryptogramGame game = expert(3, TestPuzzles.fourLetters());
            game.selectCell(2);
            assertEquals(OptionalInt.of(2), game.revealHint(HintPolicy.SELECTED_CELL));
            // cursor advanced to 3, which is eligible
            assertEquals(OptionalInt.of(3), game.revealHint(HintPolicy.SELECTED_CELL));
            // nothing eligible selected: falls back to the first unsolved cell
            assertEquals(OptionalInt.of(0), game.revealHint(HintPolicy.SELECTED_CELL));
        }

        @Test
        void randomHintOnlyPicksEligibleCells() {
            CryptogramGame game = expert(3, TestPuzzles.hiJk());
            game.inputLetter(0, 'H');
            OptionalInt revealed = game.revealHint();
            assertTrue(revealed.isPresent());
            assertTrue(Set.of(1, 4, 5).contains(revealed.getAsInt()));
        }

        @Test
        void lastHintCompletesThePuzzle() {
            CryptogramGame game = expert(3, TestPuzzles.single());
            assertEquals(OptionalInt.of(0), game.revealHint());
            assertTrue(game.isComplete());
            assertEquals(OptionalInt.empty(), game.revealHint());
            assertEquals(1, listener.terminals().size());
        }
    }

    @Nested
    @DisplayName("Pre-fill")
    class PrefillTests {

        private List<Cell> preFilled(CryptogramGame game) {
            List<Cell> result = new ArrayList<>();
            for (Cell cell : game.getCells()) {
                if (cell.isPreFilled()) {
                    result.add(cell);
                }
            }
            return result;
        }

        @Test
        void prefillsOneOccurrenceOfAShareOfTheLetters() {
            CryptogramGame game = TestPuzzles.game(TestPuzzles.normal(0.20), clock, listener);
            game.start(TestPuzzles.tenLettersTwice());

            List<Cell> filled = preFilled(game);
            assertEquals(2, filled.size());
            Set<Character> letters = new HashSet<>();
            for (Cell cell : filled) {
                letters.add(cell.getSolutionChar());
                assertTrue(cell.isCorrect());
                assertFalse(cell.isRevealed());
            }
            assertEquals(2, letters.size());
            assertEquals(0, game.getSession().getHintCount());
            assertEquals(GamePhase.IDLE, game.getPhase());
        }

        @Test
        void prefillsAtLeastOneLetter() {
            CryptogramGame game = TestPuzzles.game(TestPuzzles.normal(0.0), clock, listener);
            game.start(TestPuzzles.tenLettersTwice());
            assertEquals(1, preFilled(game).size());
        }

        @Test
        void fullPrefillStillLeavesOtherOccurrences() {
            CryptogramGame game = TestPuzzles.game(TestPuzzles.normal(1.0), clock, listener);
            game.start(TestPuzzles.tenLettersTwice());
            assertEquals(10, preFilled(game).size());
            assertFalse(game.isComplete());
            assertEquals(10, game.remainingCells());
        }

        @Test
        void expertModeDoesNotPrefill() {
            CryptogramGame game = expert(3, TestPuzzles.tenLettersTwice());
            assertEquals(0, preFilled(game).size());
        }

        @Test
        void prefillCanCompleteATinyPuzzle() {
            CryptogramGame game = TestPuzzles.game(TestPuzzles.normal(0.20), clock, listener);
            game.start(TestPuzzles.single());
            assertTrue(game.isComplete());
            assertEquals(1, listener.terminals().size());
        }

        @Test
        void prefilledCellsAreLocked() {
            CryptogramGame game = TestPuzzles.game(TestPuzzles.normal(0.20), clock, listener);
            game.start(TestPuzzles.tenLettersTwice());
            int index = preFilled(game).get(0).getPosition();
            assertFalse(game.inputLetter(index, 'Z'));
            assertFalse(game.handleDelete(index));
        }
    }

    @Nested
    @DisplayName("Timing")
    class TimingTests {

        @Test
        void pausedTimeIsExcluded() {
            CryptogramGame game = expert(3, TestPuzzles.fourLetters());
            game.inputLetter(0, 'H');
            clock.advanceSeconds(10);

            assertTrue(game.togglePause());
            assertTrue(game.isPaused());
            clock.advanceSeconds(5);
            assertEquals(Duration.ofSeconds(10), game.elapsedTime());

            assertTrue(game.togglePause());
            clock.advanceSeconds(3);
            assertEquals(Duration.ofSeconds(13), game.elapsedTime());
            assertEquals(Duration.ofSeconds(5), game.getSession().getTotalPausedDuration());
        }

        @Test
        void pausedGameIgnoresInput() {
            CryptogramGame game = expert(3, TestPuzzles.fourLetters());
            game.inputLetter(0, 'H');
            game.togglePause();

            assertFalse(game.inputLetter(1, 'I'));
            assertEquals(OptionalInt.empty(), game.revealHint());
        }

        @Test
        void cannotPauseBeforeTheClockStarts() {
            CryptogramGame game = expert(3, TestPuzzles.fourLetters());
            assertFalse(game.togglePause());
            assertEquals(Duration.ZERO, game.elapsedTime());
        }
    }

    @Nested
    @DisplayName("Lifecycle")
    class LifecycleTests {

        @Test
        void resetStartsOver() {
            CryptogramGame game = expert(3, TestPuzzles.fourLetters());
            game.inputLetter(0, 'Z');
            game.inputLetter(1, 'I');

            game.reset();

            assertEquals(GamePhase.IDLE, game.getPhase());
            assertEquals(0, game.getSession().getMistakeCount());
            for (Cell cell : game.getCells()) {
                assertTrue(cell.isEmpty());
            }
        }

        @Test
        void sameSeedGivesTheSameBoardAcrossResets() {
            CryptogramGame first = TestPuzzles.game(TestPuzzles.normal(0.20), clock, listener);
            CryptogramGame second = TestPuzzles.game(TestPuzzles.normal(0.20), clock, listener);
            first.start(TestPuzzles.tenLettersTwice());
            second.start(TestPuzzles.tenLettersTwice());

            List<UUID> ids = ids(first);
            assertEquals(ids, ids(second));
            assertEquals(preFilledPositions(first), preFilledPositions(second));
            assertEquals(2, preFilledPositions(first).size());

            for (Cell cell : first.getCells()) {
                if (cell.isEditable()) {
                    first.inputLetter(cell.getPosition(), 'Z');
                    break;
                }
            }
            assertEquals(1, first.getSession().getMistakeCount());
            first.reset();
            second.reset();

            assertEquals(ids, ids(first));
            assertEquals(ids, ids(second));
            assertEquals(preFilledPositions(first), preFilledPositions(second));
            assertEquals(2, preFilledPositions(first).size());
            assertEquals(0, first.getSession().getMistakeCount());
        }

        private List<UUID> ids(CryptogramGame game) {
            List<UUID> result = new ArrayList<>();
            for (Cell cell : game.getCells()) {
                result.add(cell.getId());
            }
            return result;
        }

        private List<Integer> preFilledPositions(CryptogramGame game) {
            List<Integer> result = new ArrayList<>();
            for (Cell cell : game.getCells()) {
                if (cell.isPreFilled()) {
                    result.add(cell.getPosition());
                }
            }
            return result;
        }

        @Test
        void resetWithoutPuzzleFails() {
            CryptogramGame game = TestPuzzles.expertGame(clock, listener);
            assertThrows(IllegalStateException.class, game::reset);
        }

        @Test
        void malformedPuzzleLeavesTheCurrentGameAlone() {
            CryptogramGame game = expert(3, TestPuzzles.fourLetters());
            game.inputLetter(0, 'H');

            assertThrows(AlignmentException.class, () -> game.start(new Puzzle("bad", "ABC", "HI")));

            assertEquals("four", game.getPuzzle().id());
            assertEquals("H", game.getCells().get(0).getUserInput());
        }

        @Test
        void restoreCopiesState() {
            CryptogramGame original = expert(3, TestPuzzles.hiJk());
            original.inputLetter(0, 'H');
            original.inputLetter(1, 'Z');

            CryptogramGame copy = TestPuzzles.expertGame(clock, GameListener.NONE);
            copy.restore(original.getPuzzle(), original.getCells(), original.getSession());

            assertEquals(original.getCells(), copy.getCells());
            assertEquals(1, copy.getSession().getMistakeCount());
            assertEquals(original.getSelectedIndex(), copy.getSelectedIndex());
        }

        @Test
        void restoredFinishedSessionIsNotReportedAgain() {
            CryptogramGame original = expert(3, TestPuzzles.fourLetters());
            TestPuzzles.solve(original);

            RecordingListener other = new RecordingListener();
            CryptogramGame copy = TestPuzzles.game(TestPuzzles.expert(3), clock, other);
            copy.restore(original.getPuzzle(), original.getCells(), original.getSession());

            assertTrue(copy.isComplete());
            assertTrue(copy.checkCompletion());
            assertTrue(other.terminals().isEmpty());
        }

        @Test
        void restoreRejectsGapsInPositions() {
            CryptogramGame game = expert(3, TestPuzzles.fourLetters());
            List<Cell> cells = new ArrayList<>(game.getCells());
            cells.remove(1);
            assertThrows(IllegalArgumentException.class, () -> game.restore(cells, game.getSession()));
        }

        @Test
        void restoreNeedsAPuzzle() {
            CryptogramGame game = TestPuzzles.expertGame(clock, listener);
            assertThrows(IllegalStateException.class, () -> game.restore(List.of(), new Session()));
        }
    }

    @Nested
    @DisplayName("Read-only views")
    class ViewTests {

        @Test
        void progressCountsFilledLetterCells() {
            CryptogramGame game = expert(3, TestPuzzles.hiJk());
            game.inputLetter(0, 'H');
            game.inputLetter(1, 'Z');

            assertEquals(0.5, game.progress(), 1e-9);
            assertEquals(3, game.remainingCells());
        }

        @Test
        void completedTokensNeedEveryOccurrence() {
            CryptogramGame game = expert(3, new Puzzle("rep", "ABA", "HIH"));
            game.inputLetter(0, 'H');
            assertTrue(game.completedTokens().isEmpty());
            game.inputLetter(2, 'H');
            assertEquals(Set.of("A"), game.completedTokens());
        }

        @Test
        void cellsAndSessionAreCopies() {
            CryptogramGame game = expert(3, TestPuzzles.fourLetters());
            assertThrows(UnsupportedOperationException.class, () -> game.getCells().clear());

            Session session = game.getSession();
            game.inputLetter(0, 'Z');
            assertEquals(0, session.getMistakeCount());
        }

        @Test
        void listenerSeesStateChanges() {
            CryptogramGame game = expert(3, TestPuzzles.fourLetters());
            int before = listener.stateChanges();
            game.inputLetter(0, 'H');
            assertEquals(before + 1, listener.stateChanges());
        }
    }
}
