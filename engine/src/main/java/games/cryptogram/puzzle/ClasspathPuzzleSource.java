package games.cryptogram.puzzle;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import games.cryptogram.game.EncodingScheme;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Puzzle catalogue read once from a JSON resource on the classpath.
 * <p>
 * The resource holds an array of entries:
 * <pre>
 * [{"id": "q001", "solution": "...", "author": "...", "difficulty": "Easy",
 *   "encodedLetters": "...", "encodedNumbers": "..."}]
 * </pre>
 * An entry without an encoding for a scheme is simply not offered for that scheme.
 */
@Component
public class ClasspathPuzzleSource implements PuzzleSource {
    private static final Logger log = LoggerFactory.getLogger(ClasspathPuzzleSource.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final List<Entry> entries;

    /**
     * @param resource classpath location of the catalogue (e.g. {@code puzzles.json})
     * @throws UncheckedIOException if the resource is missing or cannot be parsed
     * @throws IllegalStateException if an entry has no id or solution
     */
    public ClasspathPuzzleSource(@Value("${puzzles.resource:puzzles.json}") String resource) {
        this.entries = load(resource);
        log.info("Loaded {} puzzles from {}", entries.size(), resource);
    }

    @Override
    public List<Puzzle> all(EncodingScheme scheme) {
        List<Puzzle> puzzles = new ArrayList<>();
        for (Entry entry : entries) {
            entry.toPuzzle(scheme).ifPresent(puzzles::add);
        }
        return Collections.unmodifiableList(puzzles);
    }

    @Override
    public Optional<Puzzle> findById(String id, EncodingScheme scheme) {
        for (Entry entry : entries) {
            if (entry.id().equals(id)) {
                return entry.toPuzzle(scheme);
            }
        }
        return Optional.empty();
    }

    private static List<Entry> load(String resource) {
        ClassLoader loader = ClasspathPuzzleSource.class.getClassLoader();
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new UncheckedIOException(new IOException("Puzzle catalogue not found: " + resource));
            }
            Entry[] parsed = OBJECT_MAPPER.readValue(in, Entry[].class);
            List<Entry> result = new ArrayList<>();
            for (Entry entry : parsed) {
                if (entry.id() == null || entry.id().isBlank() || entry.solution() == null || entry.solution().isBlank()) {
                    throw new IllegalStateException("Puzzle entry without id or solution in " + resource);
                }
                result.add(entry);
            }
            return Collections.unmodifiableList(result);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read puzzle catalogue " + resource, e);
        }
    }

    /**
     * One quote as stored in the catalogue, with its encoding for each scheme.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record Entry(String id, String solution, String author, String difficulty,
                 String encodedLetters, String encodedNumbers) {

        Optional<Puzzle> toPuzzle(EncodingScheme scheme) {
            String encoded = scheme == EncodingScheme.LETTERS ? encodedLetters : encodedNumbers;
            if (encoded == null || encoded.isBlank()) {
                return Optional.empty();
            }
            return Optional.of(new Puzzle(id, encoded, solution, author, difficulty));
        }
    }
}
