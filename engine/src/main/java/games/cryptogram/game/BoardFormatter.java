package games.cryptogram.game;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

/**
 * Renders a {@link CryptogramGame} for console display.
 * <p>
 * Each cell is drawn as a column of three rows: the player's guess (or {@code _}), the encoded
 * token, and the cell index used by console commands. Words are kept together when lines are
 * wrapped. Errors are shown in red and hinted or pre-filled letters in cyan; all width
 * calculations ignore ANSI colour escape sequences.
 */
public class BoardFormatter {
    /** Maximum visible characters per rendered line before wrapping. */
    private static final int DEFAULT_LINE_WIDTH = 72;
    private static final String RED = "\u001B[31m";
    private static final String CYAN = "\u001B[36m";
    private static final String RESET = "\u001B[0m";

    private final CryptogramGame game;
    private final int lineWidth;
    private final boolean colour;

    /**
     * @param game the game to format; must not be null
     */
    public BoardFormatter(CryptogramGame game) {
        this(game, DEFAULT_LINE_WIDTH, true);
    }

    /**
     * @param game the game to format; must not be null
     * @param lineWidth maximum visible characters per line
     * @param colour whether to emit ANSI colour codes
     */
    public BoardFormatter(CryptogramGame game, int lineWidth, boolean colour) {
        this.game = game;
        this.lineWidth = Math.max(8, lineWidth);
        this.colour = colour;
    }

    /**
     * Renders the status line followed by the wrapped puzzle grid.
     *
     * @return a multi-line string
     */
    public String format() {
        StringBuilder sb = new StringBuilder();
        String status = formatStatus();
        sb.append(status).append('\n');
        sb.append("-".repeat(Math.min(lineWidth, status.length()))).append('\n');

        List<Cell> cells = game.getCells();
        int width = computeCellWidth(cells);
        OptionalInt selected = game.getSelectedIndex();
        for (List<List<Cell>> line : wrap(cells, width)) {
            appendLine(sb, line, width, selected);
        }
        return sb.toString();
    }

    /**
     * Formats the one-line summary: phase, mistakes, hints, time, progress and
     * the number of cells still to solve.
     */
    public String formatStatus() {
        Session session = game.getSession();
        StringBuilder sb = new StringBuilder();
        sb.append(game.getPhase());
        if (session.isPaused()) {
            sb.append(" (paused)");
        }
        sb.append("  mistakes ").append(session.getMistakeCount());
        if (!session.hasContinuedAfterFailure()) {
            sb.append('/').append(game.getDifficulty().getMaxMistakes());
        }
        sb.append("  hints ").append(session.getHintCount());
        sb.append("  time ").append(formatMinutesSeconds(game.elapsedTime()));
        sb.append("  solved ").append(Math.round(game.progress() * 100)).append('%');
        sb.append("  left ").append(game.remainingCells());
        return sb.toString();
    }

    /**
     * Formats a duration as {@code MM:SS}; minutes keep growing past 59.
     */
    public static String formatMinutesSeconds(Duration duration) {
        long seconds = Math.max(0, duration.getSeconds());
        return String.format("%02d:%02d", seconds / 60, seconds % 60);
    }

    /**
     * Splits the cells into lines of words. A word is a run of cells up to and including the
     * next space symbol; a word wider than a line is split wherever the line is full.
     */
    private List<List<List<Cell>>> wrap(List<Cell> cells, int width) {
        int perLine = Math.max(1, (lineWidth + 1) / (width + 1));
        List<List<List<Cell>>> lines = new ArrayList<>();
        List<List<Cell>> line = new ArrayList<>();
        int used = 0;
        for (List<Cell> word : words(cells)) {
            int remainingWord = word.size();
            int start = 0;
            while (remainingWord > 0) {
                if (used > 0 && used + remainingWord > perLine) {
                    lines.add(line);
                    line = new ArrayList<>();
                    used = 0;
                }
                int take = Math.min(remainingWord, perLine - used);
                line.add(word.subList(start, start + take));
                used += take;
                start += take;
                remainingWord -= take;
            }
        }
        if (!line.isEmpty()) {
            lines.add(line);
        }
        return lines;
    }

    private static List<List<Cell>> words(List<Cell> cells) {
        List<List<Cell>> words = new ArrayList<>();
        List<Cell> current = new ArrayList<>();
        for (Cell cell : cells) {
            current.add(cell);
            if (cell.isSymbol() && " ".equals(cell.getEncodedToken())) {
                words.add(current);
                current = new ArrayList<>();
            }
        }
        if (!current.isEmpty()) {
            words.add(current);
        }
        return words;
    }

    private void appendLine(StringBuilder sb, List<List<Cell>> words, int width, OptionalInt selected) {
        StringBuilder guesses = new StringBuilder();
        StringBuilder tokens = new StringBuilder();
        StringBuilder indices = new StringBuilder();
        for (List<Cell> word : words) {
            for (Cell cell : word) {
                boolean isSelected = selected.isPresent() && selected.getAsInt() == cell.getPosition();
                if (cell.isSymbol()) {
                    guesses.append(padCell(cell.getEncodedToken(), width)).append(' ');
                    tokens.append(padCell("", width)).append(' ');
                    indices.append(padCell("", width)).append(' ');
                    continue;
                }
                guesses.append(padCell(guess(cell), width)).append(' ');
                tokens.append(padCell(cell.getEncodedToken(), width)).append(' ');
                String index = Integer.toString(cell.getPosition());
                indices.append(padCell(isSelected ? "^" + index : index, width)).append(' ');
            }
        }
        sb.append(stripTrailing(guesses)).append('\n');
        sb.append(stripTrailing(tokens)).append('\n');
        sb.append(stripTrailing(indices)).append('\n');
        sb.append('\n');
    }

    private String guess(Cell cell) {
        if (cell.isEmpty()) {
            return "_";
        }
        if (!colour) {
            return cell.getUserInput();
        }
        if (cell.isError()) {
            return RED + cell.getUserInput() + RESET;
        }
        if (cell.isRevealed() || cell.isPreFilled()) {
            return CYAN + cell.getUserInput() + RESET;
        }
        return cell.getUserInput();
    }

    /**
     * Widest token or index label (including the selection marker), never narrower than 2.
     */
    private int computeCellWidth(List<Cell> cells) {
        int width = 2;
        for (Cell cell : cells) {
            width = Math.max(width, cell.getEncodedToken().length());
            if (!cell.isSymbol()) {
                width = Math.max(width, Integer.toString(cell.getPosition()).length() + 1);
            }
        }
        return width;
    }

    /**
     * Centres a value within the given width. ANSI colour codes do not count towards the width.
     */
    private String padCell(String value, int width) {
        int visible = visibleLength(value);
        if (visible >= width) {
            return value;
        }
        int totalPad = width - visible;
        int left = totalPad / 2;
        int right = totalPad - left;
        return " ".repeat(left) + value + " ".repeat(right);
    }

    private int visibleLength(String value) {
        return value.replaceAll("\\u001B\\[[;\\d]*m", "").length();
    }

    private static String stripTrailing(StringBuilder sb) {
        return sb.toString().replaceAll("\\s+$", "");
    }
}
