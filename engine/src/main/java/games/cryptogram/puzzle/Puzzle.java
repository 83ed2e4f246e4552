package games.cryptogram.puzzle;

import java.util.Objects;

/**
 * A pre-encoded quote as supplied by a {@link PuzzleSource}.
 * <p>
 * {@code encodedText} is the cipher text for one encoding scheme; the same quote encoded with
 * the other scheme is a different {@code Puzzle} instance sharing the {@code id}.
 *
 * @param id stable identifier, also used to derive stable cell ids
 * @param encodedText the cipher text shown to the player
 * @param solution the plaintext quote
 * @param author attribution shown once the puzzle is solved
 * @param difficulty free-form difficulty label of the quote (e.g. "Medium")
 */
public record Puzzle(String id, String encodedText, String solution, String author, String difficulty) {

    public static final String UNKNOWN_AUTHOR = "Unknown";
    public static final String DEFAULT_DIFFICULTY = "Medium";

    public Puzzle {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(encodedText, "encodedText");
        Objects.requireNonNull(solution, "solution");
        author = author == null || author.isBlank() ? UNKNOWN_AUTHOR : author;
        difficulty = difficulty == null || difficulty.isBlank() ? DEFAULT_DIFFICULTY : difficulty;
    }

    public Puzzle(String id, String encodedText, String solution) {
        this(id, encodedText, solution, UNKNOWN_AUTHOR, DEFAULT_DIFFICULTY);
    }
}
