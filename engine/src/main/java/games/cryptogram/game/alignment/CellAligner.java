package games.cryptogram.game.alignment;

import games.cryptogram.game.Cell;
import games.cryptogram.game.EncodingScheme;
import games.cryptogram.puzzle.Puzzle;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Aligns a puzzle's encoded text with its solution into the canonical cell sequence.
 * <p>
 * The encoded text and the solution are not guaranteed to agree on spacing and punctuation,
 * so the encoded text only contributes the <em>tokens</em> (one per plaintext letter) and the
 * solution decides where symbols go:
 * <ol>
 *   <li>Tokenise the encoded text. {@link EncodingScheme#LETTERS}: every letter or digit is a
 *       token and everything else is dropped. {@link EncodingScheme#NUMBERS}: whitespace-separated
 *       components are split into runs of letters/digits (tokens) and single other characters,
 *       which are kept verbatim as symbol tokens.</li>
 *   <li>Pair each token, in order, with the next letter of the upper-cased solution.</li>
 *   <li>Re-insert symbols from the solution in the gaps before, between and after the paired
 *       letters: every non-letter for the letters scheme. The numbers scheme takes only whitespace
 *       from the solution; its punctuation comes from the encoded text and is placed where the
 *       solution has the same character.</li>
 *   <li>Number positions densely from 0.</li>
 * </ol>
 * <p>
 * Malformed content fails with an {@link AlignmentException}; a partially aligned list is never
 * returned. Instances are stateless and may be shared.
 */
public class CellAligner {
    private static final Logger log = LoggerFactory.getLogger(CellAligner.class);

    /**
     * Aligns the puzzle for the given scheme.
     *
     * @param puzzle the puzzle to align; must not be null
     * @param scheme how the encoded text is tokenised; must not be null
     * @return an unmodifiable list of cells with positions 0..N-1
     * @throws AlignmentException if the encoded text has no tokens, the solution has no letters,
     *         or there are more tokens than solution letters
     */
    public List<Cell> align(Puzzle puzzle, EncodingScheme scheme) {
        Objects.requireNonNull(puzzle, "puzzle");
        Objects.requireNonNull(scheme, "scheme");

        String solution = puzzle.solution().toUpperCase(Locale.ROOT);
        List<Token> tokens = scheme == EncodingScheme.LETTERS
                ? letterTokens(puzzle.encodedText())
                : numberTokens(puzzle.encodedText());

        int tokenCount = 0;
        for (Token token : tokens) {
            if (!token.symbol()) {
                tokenCount++;
            }
        }
        if (tokenCount == 0) {
            throw new AlignmentException(AlignmentException.Reason.EMPTY_ENCODED_TEXT, puzzle.id(),
                    "encoded text contains no " + scheme + " to solve");
        }
        int letterCount = countLetters(solution);
        if (letterCount == 0) {
            throw new AlignmentException(AlignmentException.Reason.EMPTY_SOLUTION, puzzle.id(),
                    "solution contains no letters");
        }
        if (tokenCount > letterCount) {
            throw new AlignmentException(AlignmentException.Reason.INSUFFICIENT_SOLUTION_LETTERS, puzzle.id(),
                    "encoded text has " + tokenCount + " tokens but the solution only " + letterCount + " letters");
        }

        List<Cell> cells = interleave(puzzle.id(), tokens, solution, scheme);
        if (log.isDebugEnabled()) {
            log.debug("Aligned puzzle {} ({}): {} cells, {} tokens, {} solution letters",
                    puzzle.id(), scheme, cells.size(), tokenCount, letterCount);
        }
        return Collections.unmodifiableList(cells);
    }

    private static List<Cell> interleave(String puzzleId, List<Token> tokens, String solution, EncodingScheme scheme) {
        List<Cell> cells = new ArrayList<>();
        // Encoded symbols seen since the last paired token (numbers scheme only).
        List<String> pendingSymbols = new ArrayList<>();
        int solutionIndex = 0;

        for (Token token : tokens) {
            if (token.symbol()) {
                pendingSymbols.add(token.text());
                continue;
            }
            int letterIndex = nextLetter(solution, solutionIndex);
            appendGap(puzzleId, cells, pendingSymbols, solution, solutionIndex, letterIndex, scheme);
            cells.add(Cell.letter(puzzleId, cells.size(), token.text(), solution.charAt(letterIndex)));
            solutionIndex = letterIndex + 1;
        }
        appendGap(puzzleId, cells, pendingSymbols, solution, solutionIndex, solution.length(), scheme);
        return cells;
    }

    /**
     * Appends the symbols belonging between two paired letters. The trailing gap may still hold
     * unpaired solution letters; those are not rendered.
     * <p>
     * For the numbers scheme the solution's gap is walked in order: whitespace lands where it
     * falls, and a pending encoded symbol is placed where the solution has the same character.
     * Encoded symbols the solution never mentions go at the end of the gap.
     */
    private static void appendGap(String puzzleId, List<Cell> cells, List<String> pendingSymbols,
                                  String solution, int from, int to, EncodingScheme scheme) {
        for (int i = from; i < to; i++) {
            char c = solution.charAt(i);
            if (Character.isLetter(c)) {
                continue;
            }
            String text = String.valueOf(c);
            if (scheme == EncodingScheme.LETTERS || Character.isWhitespace(c)) {
                cells.add(Cell.symbol(puzzleId, cells.size(), text));
            } else if (!pendingSymbols.isEmpty() && pendingSymbols.get(0).equals(text)) {
                cells.add(Cell.symbol(puzzleId, cells.size(), pendingSymbols.remove(0)));
            }
        }
        for (String symbol : pendingSymbols) {
            cells.add(Cell.symbol(puzzleId, cells.size(), symbol));
        }
        pendingSymbols.clear();
    }

    private static int nextLetter(String solution, int from) {
        int i = from;
        while (i < solution.length() && !Character.isLetter(solution.charAt(i))) {
            i++;
        }
        return i;
    }

    private static int countLetters(String text) {
        int count = 0;
        for (int i = 0; i < text.length(); i++) {
            if (Character.isLetter(text.charAt(i))) {
                count++;
            }
        }
        return count;
    }

    static List<Token> letterTokens(String encodedText) {
        List<Token> tokens = new ArrayList<>();
        for (int i = 0; i < encodedText.length(); i++) {
            char c = encodedText.charAt(i);
            if (Character.isLetterOrDigit(c)) {
                tokens.add(new Token(String.valueOf(c), false));
            }
        }
        return tokens;
    }

    static List<Token> numberTokens(String encodedText) {
        List<Token> tokens = new ArrayList<>();
        for (String component : encodedText.trim().split("\\s+")) {
            int i = 0;
            while (i < component.length()) {
                char c = component.charAt(i);
                if (Character.isLetterOrDigit(c)) {
                    int end = i;
                    while (end < component.length() && Character.isLetterOrDigit(component.charAt(end))) {
                        end++;
                    }
                    tokens.add(new Token(component.substring(i, end), false));
                    i = end;
                } else {
                    tokens.add(new Token(String.valueOf(c), true));
                    i++;
                }
            }
        }
        return tokens;
    }

    /**
     * One unit of encoded text: a letter/number standing for a plaintext letter, or a symbol
     * kept verbatim.
     */
    record Token(String text, boolean symbol) {
    }
}
