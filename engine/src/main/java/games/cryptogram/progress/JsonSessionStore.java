package games.cryptogram.progress;

import com.fasterxml.jackson.databind.ObjectMapper;
import games.cryptogram.config.ProgressProperties;
import games.cryptogram.game.EncodingScheme;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Stores each snapshot as a JSON file named {@code <puzzleId>-<scheme>.json} in one directory.
 * <p>
 * Files are written to a temporary sibling first and then moved into place, so a crash never
 * leaves a half-written snapshot. A failed save removes its temporary file again. I/O failures
 * surface as {@link UncheckedIOException}.
 */
@Component
public class JsonSessionStore implements SessionStore {
    private static final Logger log = LoggerFactory.getLogger(JsonSessionStore.class);

    private final Path directory;
    private final ObjectMapper objectMapper;

    @Autowired
    public JsonSessionStore(ProgressProperties properties) {
        this(Paths.get(properties.getDirectory()));
    }

    public JsonSessionStore(Path directory) {
        this.directory = directory;
        this.objectMapper = JsonFiles.newMapper();
    }

    @Override
    public void save(SessionSnapshot snapshot) {
        Path target = fileFor(snapshot.puzzleId(), snapshot.scheme());
        try {
            JsonFiles.writeAtomically(objectMapper, target, snapshot);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to save session for " + snapshot.puzzleId(), e);
        }
        if (log.isDebugEnabled()) {
            log.debug("Saved session {} ({}) to {}", snapshot.puzzleId(), snapshot.scheme(), target);
        }
    }

    @Override
    public Optional<SessionSnapshot> load(String puzzleId, EncodingScheme scheme) {
        Path file = fileFor(puzzleId, scheme);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(file.toFile(), SessionSnapshot.class));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load session for " + puzzleId, e);
        }
    }

    @Override
    public boolean delete(String puzzleId, EncodingScheme scheme) {
        try {
            return Files.deleteIfExists(fileFor(puzzleId, scheme));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete session for " + puzzleId, e);
        }
    }

    private Path fileFor(String puzzleId, EncodingScheme scheme) {
        String safeId = puzzleId.replaceAll("[^A-Za-z0-9._-]", "_");
        return directory.resolve(safeId + "-" + scheme.getLabel() + ".json");
    }
}
