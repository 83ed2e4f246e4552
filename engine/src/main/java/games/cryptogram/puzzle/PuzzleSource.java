package games.cryptogram.puzzle;

import games.cryptogram.game.EncodingScheme;
import java.time.LocalDate;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Random;

/**
 * Supplies pre-encoded puzzles. The engine never fetches or caches puzzles itself.
 */
public interface PuzzleSource {

    /**
     * Returns every puzzle available in the given encoding, in catalogue order.
     */
    List<Puzzle> all(EncodingScheme scheme);

    /**
     * Looks up a puzzle by id.
     */
    Optional<Puzzle> findById(String id, EncodingScheme scheme);

    /**
     * Returns the puzzle of the day. The same date always maps to the same puzzle for an
     * unchanged catalogue.
     *
     * @throws NoSuchElementException if no puzzle exists for the scheme
     */
    default Puzzle daily(LocalDate date, EncodingScheme scheme) {
        List<Puzzle> puzzles = all(scheme);
        if (puzzles.isEmpty()) {
            throw new NoSuchElementException("No " + scheme + " puzzles available");
        }
        return puzzles.get((int) Math.floorMod(date.toEpochDay(), (long) puzzles.size()));
    }

    /**
     * Returns a random puzzle.
     *
     * @throws NoSuchElementException if no puzzle exists for the scheme
     */
    default Puzzle random(Random random, EncodingScheme scheme) {
        List<Puzzle> puzzles = all(scheme);
        if (puzzles.isEmpty()) {
            throw new NoSuchElementException("No " + scheme + " puzzles available");
        }
        return puzzles.get(random.nextInt(puzzles.size()));
    }
}
