package games.cryptogram.game;

import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Cursor movement across the letter cells of a {@link CryptogramGame}.
 * <p>
 * Manual navigation and the automatic advance after a correct input or a hint both use
 * {@link #nextEligibleIndex(int, Direction)}, so the cursor never rests on a symbol cell and
 * both triggers move it the same way.
 */
public final class SelectionHelper {

    /** Scan direction through the cell sequence. */
    public enum Direction {
        BACKWARD(-1),
        FORWARD(1);

        private final int step;

        Direction(int step) {
            this.step = step;
        }

        public int step() {
            return step;
        }
    }

    private final CryptogramGame game;

    /**
     * @param game the game whose cells are navigated; must not be null
     */
    public SelectionHelper(CryptogramGame game) {
        this.game = Objects.requireNonNull(game, "game");
    }

    /**
     * Returns the first non-symbol index after {@code from} in the given direction.
     *
     * @param from starting index, exclusive; may be {@code -1} or the cell count to scan from an edge
     * @param direction scan direction
     * @return the index found, or empty when only symbols (or nothing) remain that way
     */
    public OptionalInt nextEligibleIndex(int from, Direction direction) {
        Objects.requireNonNull(direction, "direction");
        List<Cell> cells = game.liveCells();
        for (int i = from + direction.step(); i >= 0 && i < cells.size(); i += direction.step()) {
            if (!cells.get(i).isSymbol()) {
                return OptionalInt.of(i);
            }
        }
        return OptionalInt.empty();
    }

    /** Returns the first letter cell of the puzzle, if any. */
    public OptionalInt firstEligibleIndex() {
        return nextEligibleIndex(-1, Direction.FORWARD);
    }

    /**
     * Moves the cursor one letter cell in the given direction. With nothing selected the first
     * letter cell is selected instead.
     *
     * @return whether the cursor moved
     */
    public boolean move(Direction direction) {
        OptionalInt current = game.getSelectedIndex();
        OptionalInt target = current.isPresent()
                ? nextEligibleIndex(current.getAsInt(), direction)
                : firstEligibleIndex();
        if (target.isEmpty()) {
            return false;
        }
        return game.selectCell(target.getAsInt());
    }
}
