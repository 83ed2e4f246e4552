package games.cryptogram.progress;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import games.cryptogram.config.ProgressProperties;
import games.cryptogram.game.EncodingScheme;
import games.cryptogram.game.TerminalResult;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Attempt history answering the statistics shown to the player: totals, win rate, best and
 * average completion times, overall and per puzzle.
 * <p>
 * When backed by a file, the history is read from it on construction and the whole list is
 * rewritten as a JSON array after every recorded attempt.
 */
@Component
public class AttemptStatistics implements StatisticsSink {
    private static final Logger log = LoggerFactory.getLogger(AttemptStatistics.class);
    private static final TypeReference<List<PuzzleAttempt>> ATTEMPT_LIST = new TypeReference<>() {
    };

    private final List<PuzzleAttempt> attempts = new ArrayList<>();
    /** Backing file; null keeps the history in memory only. */
    private final Path file;
    private final ObjectMapper objectMapper = JsonFiles.newMapper();

    public AttemptStatistics() {
        this.file = null;
    }

    @Autowired
    public AttemptStatistics(ProgressProperties properties) {
        this(Paths.get(properties.getAttemptsFile()));
    }

    public AttemptStatistics(Path file) {
        this.file = file;
        load();
    }

    /**
     * Adds the attempt and writes the history back to the backing file.
     *
     * @throws UncheckedIOException if the history cannot be written; the attempt is still counted
     */
    @Override
    public void record(TerminalResult result) {
        attempts.add(PuzzleAttempt.from(result));
        if (file == null) {
            return;
        }
        try {
            JsonFiles.writeAtomically(objectMapper, file, attempts);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to save attempt history to " + file, e);
        }
    }

    private void load() {
        if (!Files.exists(file)) {
            return;
        }
        try {
            List<PuzzleAttempt> saved = objectMapper.readValue(file.toFile(), ATTEMPT_LIST);
            for (PuzzleAttempt attempt : saved) {
                if (attempt != null) {
                    attempts.add(attempt);
                }
            }
            if (log.isDebugEnabled()) {
                log.debug("Loaded {} attempts from {}", attempts.size(), file);
            }
        } catch (IOException e) {
            log.warn("Could not read attempt history from {}; starting with none", file, e);
        }
    }

    public List<PuzzleAttempt> attempts() {
        return Collections.unmodifiableList(attempts);
    }

    public int totalAttempts() {
        return attempts.size();
    }

    public int totalCompletions() {
        int count = 0;
        for (PuzzleAttempt attempt : attempts) {
            if (attempt.isCompleted()) {
                count++;
            }
        }
        return count;
    }

    public int totalFailures() {
        int count = 0;
        for (PuzzleAttempt attempt : attempts) {
            if (attempt.isFailed()) {
                count++;
            }
        }
        return count;
    }

    /**
     * Completed attempts as a whole-number percentage of all attempts, rounded down; 0 without attempts.
     */
    public int winRatePercentage() {
        if (attempts.isEmpty()) {
            return 0;
        }
        return (int) (totalCompletions() * 100L / attempts.size());
    }

    public Optional<Duration> bestTime() {
        return attempts.stream()
                .map(PuzzleAttempt::completionTime)
                .filter(time -> time != null)
                .min(Duration::compareTo);
    }

    public Optional<Duration> averageTime() {
        List<Duration> times = new ArrayList<>();
        for (PuzzleAttempt attempt : attempts) {
            if (attempt.completionTime() != null) {
                times.add(attempt.completionTime());
            }
        }
        if (times.isEmpty()) {
            return Optional.empty();
        }
        Duration total = Duration.ZERO;
        for (Duration time : times) {
            total = total.plus(time);
        }
        return Optional.of(total.dividedBy(times.size()));
    }

    public int completionCount(String puzzleId, EncodingScheme scheme) {
        int count = 0;
        for (PuzzleAttempt attempt : forPuzzle(puzzleId, scheme)) {
            if (attempt.isCompleted()) {
                count++;
            }
        }
        return count;
    }

    public int failureCount(String puzzleId, EncodingScheme scheme) {
        int count = 0;
        for (PuzzleAttempt attempt : forPuzzle(puzzleId, scheme)) {
            if (attempt.isFailed()) {
                count++;
            }
        }
        return count;
    }

    public Optional<Duration> bestTime(String puzzleId, EncodingScheme scheme) {
        return forPuzzle(puzzleId, scheme).stream()
                .map(PuzzleAttempt::completionTime)
                .filter(time -> time != null)
                .min(Duration::compareTo);
    }

    /**
     * Ids of puzzles completed at least once with the given scheme, in order of first completion.
     */
    public Set<String> completedPuzzleIds(EncodingScheme scheme) {
        Set<String> ids = new LinkedHashSet<>();
        for (PuzzleAttempt attempt : attempts) {
            if (attempt.scheme() == scheme && attempt.isCompleted()) {
                ids.add(attempt.puzzleId());
            }
        }
        return ids;
    }

    private List<PuzzleAttempt> forPuzzle(String puzzleId, EncodingScheme scheme) {
        List<PuzzleAttempt> matching = new ArrayList<>();
        for (PuzzleAttempt attempt : attempts) {
            if (attempt.puzzleId().equals(puzzleId) && attempt.scheme() == scheme) {
                matching.add(attempt);
            }
        }
        return matching;
    }
}
