package games.cryptogram.progress;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import games.cryptogram.game.TerminalResult;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Emits one structured JSON line per finished session.
 * <p>
 * Lines are prefixed with {@code ATTEMPT } so downstream tools can filter them out of mixed
 * logs, e.g. {@code ATTEMPT {"puzzle_id":"q001","scheme":"letters","complete":true,...}}.
 */
@Component
public class AttemptLogger implements StatisticsSink {
    private static final Logger log = LoggerFactory.getLogger(AttemptLogger.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    @Override
    public void record(TerminalResult result) {
        if (!log.isInfoEnabled()) {
            return;
        }
        log.info("ATTEMPT {}", toJson(result));
    }

    /**
     * Serialises the result as a single-line JSON object with snake_case keys.
     */
    static String toJson(TerminalResult result) {
        Map<String, Object> line = new LinkedHashMap<>();
        line.put("puzzle_id", result.puzzleId());
        line.put("scheme", result.scheme().getLabel());
        line.put("complete", result.complete());
        line.put("failed", result.failed());
        line.put("mistakes", result.mistakeCount());
        line.put("hints", result.hintCount());
        line.put("elapsed_ms", result.elapsedTime().toMillis());
        line.put("finished_at", result.finishedAt().toString());
        try {
            return OBJECT_MAPPER.writeValueAsString(line);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialise attempt for " + result.puzzleId(), e);
        }
    }
}
