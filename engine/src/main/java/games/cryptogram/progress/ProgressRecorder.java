package games.cryptogram.progress;

import games.cryptogram.game.CryptogramGame;
import games.cryptogram.game.GameListener;
import games.cryptogram.game.TerminalResult;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Connects a game to its persistence and statistics collaborators.
 * <p>
 * A terminal transition is saved immediately and forwarded once to every
 * {@link StatisticsSink}. Ordinary state changes are not saved here; callers decide when to
 * {@link #checkpoint(CryptogramGame) checkpoint}. A failing store or sink is logged and never
 * interrupts the game.
 */
@Component
public class ProgressRecorder implements GameListener {
    private static final Logger log = LoggerFactory.getLogger(ProgressRecorder.class);

    private final List<StatisticsSink> sinks;
    private final SessionStore store;
    private final Clock clock;

    public ProgressRecorder(List<StatisticsSink> sinks, SessionStore store, Clock clock) {
        this.sinks = List.copyOf(sinks);
        this.store = store;
        this.clock = clock;
    }

    @Override
    public void onTerminal(TerminalResult result, CryptogramGame game) {
        save(game);
        for (StatisticsSink sink : sinks) {
            try {
                sink.record(result);
            } catch (RuntimeException e) {
                log.warn("Statistics sink {} rejected result for {}", sink.getClass().getSimpleName(),
                        result.puzzleId(), e);
            }
        }
    }

    /**
     * Saves the current state of the game, if it has a puzzle.
     */
    public void checkpoint(CryptogramGame game) {
        if (game.getPuzzle() == null) {
            return;
        }
        save(game);
    }

    private void save(CryptogramGame game) {
        try {
            store.save(SessionSnapshot.of(game, clock.instant()));
        } catch (UncheckedIOException e) {
            log.warn("Could not save session for {}", game.getPuzzle().id(), e);
        }
    }
}
