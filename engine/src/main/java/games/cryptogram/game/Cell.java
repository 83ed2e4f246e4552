package games.cryptogram.game;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;

/**
 * One rendered position of a cryptogram: an encoded token with the plaintext letter it
 * resolves to, or a fixed symbol (space, punctuation).
 * <p>
 * Cells are immutable. The game replaces a cell with an updated copy whenever the player's
 * guess or its flags change, so any list of cells handed out is a stable snapshot.
 * <p>
 * <strong>Identity:</strong> the {@link #getId() id} is a name-based UUID derived from
 * {@code (puzzleId, position, encodedToken, solutionChar, symbol)}. Aligning the same puzzle
 * twice yields identical ids; state changes keep the id.
 * <p>
 * <strong>Symbols:</strong> symbol cells never carry a solution letter or user input and are
 * ignored by completion and mistake accounting.
 */
public final class Cell {
    private final UUID id;
    private final int position;
    private final String encodedToken;
    /** Plaintext letter; null for symbols. */
    private final Character solutionChar;
    private final boolean symbol;
    private final String userInput;
    private final boolean revealed;
    private final boolean preFilled;
    private final boolean error;

    private Cell(UUID id, int position, String encodedToken, Character solutionChar, boolean symbol,
                 String userInput, boolean revealed, boolean preFilled, boolean error) {
        this.id = id;
        this.position = position;
        this.encodedToken = encodedToken;
        this.solutionChar = solutionChar;
        this.symbol = symbol;
        this.userInput = userInput;
        this.revealed = revealed;
        this.preFilled = preFilled;
        this.error = error;
    }

    /**
     * Creates an empty letter (or number) cell.
     *
     * @param puzzleId id of the puzzle the cell belongs to; used for the stable cell id
     * @param position 0-based position in the final cell sequence
     * @param encodedToken the encoded letter or number shown to the player
     * @param solutionChar the plaintext letter this cell resolves to
     * @throws IllegalArgumentException if position is negative or the token is blank
     */
    public static Cell letter(String puzzleId, int position, String encodedToken, char solutionChar) {
        requireToken(encodedToken);
        requirePosition(position);
        char solution = Character.toUpperCase(solutionChar);
        return new Cell(deriveId(puzzleId, position, encodedToken, solution, false),
                position, encodedToken, solution, false, "", false, false, false);
    }

    /**
     * Creates a symbol cell (space or punctuation).
     *
     * @param puzzleId id of the puzzle the cell belongs to
     * @param position 0-based position in the final cell sequence
     * @param symbol the literal character rendered at this position
     */
    public static Cell symbol(String puzzleId, int position, String symbol) {
        requireToken(symbol);
        requirePosition(position);
        return new Cell(deriveId(puzzleId, position, symbol, null, true),
                position, symbol, null, true, "", false, false, false);
    }

    /**
     * Rebuilds a cell from persisted state. Symbol cells drop any input or flags.
     *
     * @throws IllegalArgumentException if the state is inconsistent, such as a letter cell
     *         without a solution letter
     */
    public static Cell restored(String puzzleId, int position, String encodedToken, Character solutionChar,
                                boolean symbol, String userInput, boolean revealed, boolean preFilled,
                                boolean error) {
        if (symbol) {
            return symbol(puzzleId, position, encodedToken);
        }
        if (solutionChar == null) {
            throw new IllegalArgumentException("letter cell " + position + " has no solution letter");
        }
        return letter(puzzleId, position, encodedToken, solutionChar)
                .withState(normaliseInput(userInput), revealed, preFilled, error);
    }

    private static void requireToken(String token) {
        if (token == null || token.isEmpty()) {
            throw new IllegalArgumentException("encodedToken must not be empty");
        }
    }

    private static void requirePosition(int position) {
        if (position < 0) {
            throw new IllegalArgumentException("position must not be negative: " + position);
        }
    }

    private static String normaliseInput(String input) {
        if (input == null || input.isEmpty()) {
            return "";
        }
        return input.substring(0, 1).toUpperCase(Locale.ROOT);
    }

    static UUID deriveId(String puzzleId, int position, String encodedToken, Character solutionChar,
                         boolean symbol) {
        String name = Objects.toString(puzzleId, "") + '|' + position + '|' + encodedToken + '|'
                + (solutionChar == null ? "" : solutionChar.toString()) + '|' + symbol;
        return UUID.nameUUIDFromBytes(name.getBytes(StandardCharsets.UTF_8));
    }

    public UUID getId() {
        return id;
    }

    public int getPosition() {
        return position;
    }

    public String getEncodedToken() {
        return encodedToken;
    }

    /**
     * Returns the plaintext letter, or {@code null} for symbol cells.
     */
    public Character getSolutionChar() {
        return solutionChar;
    }

    public boolean isSymbol() {
        return symbol;
    }

    /**
     * Returns the player's current guess: empty or a single upper-case letter.
     */
    public String getUserInput() {
        return userInput;
    }

    public boolean isRevealed() {
        return revealed;
    }

    public boolean isPreFilled() {
        return preFilled;
    }

    public boolean isError() {
        return error;
    }

    public boolean isEmpty() {
        return userInput.isEmpty();
    }

    /**
     * Returns whether the guess matches the solution letter (case-insensitive).
     * Symbol cells are always considered correct.
     */
    public boolean isCorrect() {
        if (symbol) {
            return true;
        }
        return userInput.length() == 1
                && Character.toUpperCase(userInput.charAt(0)) == Character.toUpperCase(solutionChar);
    }

    /**
     * Returns whether the player may still type into or clear this cell.
     * Hinted and pre-filled cells are locked.
     */
    public boolean isEditable() {
        return !symbol && !revealed && !preFilled;
    }

    /**
     * Returns a copy holding the given guess, with the error flag set as supplied.
     */
    public Cell withInput(String input, boolean error) {
        if (symbol) {
            return this;
        }
        return withState(normaliseInput(input), revealed, preFilled, error);
    }

    /** Returns a copy with the guess and error flag cleared. */
    public Cell cleared() {
        if (symbol) {
            return this;
        }
        return withState("", revealed, preFilled, false);
    }

    /** Returns a copy showing the solution letter, marked as revealed by a hint. */
    public Cell revealedCopy() {
        if (symbol) {
            return this;
        }
        return withState(solutionChar.toString(), true, false, false);
    }

    /** Returns a copy showing the solution letter, marked as pre-filled. */
    public Cell preFilledCopy() {
        if (symbol) {
            return this;
        }
        return withState(solutionChar.toString(), false, true, false);
    }

    private Cell withState(String input, boolean revealed, boolean preFilled, boolean error) {
        return new Cell(id, position, encodedToken, solutionChar, false, input, revealed, preFilled, error);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Cell)) {
            return false;
        }
        Cell other = (Cell) o;
        return position == other.position
                && symbol == other.symbol
                && revealed == other.revealed
                && preFilled == other.preFilled
                && error == other.error
                && id.equals(other.id)
                && encodedToken.equals(other.encodedToken)
                && Objects.equals(solutionChar, other.solutionChar)
                && userInput.equals(other.userInput);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, position, encodedToken, solutionChar, symbol, userInput, revealed, preFilled, error);
    }

    @Override
    public String toString() {
        if (symbol) {
            return "Cell(" + position + ", symbol='" + encodedToken + "')";
        }
        return "Cell(" + position + ", " + encodedToken + "->" + solutionChar
                + ", input='" + userInput + "'"
                + (revealed ? ", revealed" : "")
                + (preFilled ? ", prefilled" : "")
                + (error ? ", error" : "") + ")";
    }
}
