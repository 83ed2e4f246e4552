package games.cryptogram.player;

import games.cryptogram.game.CryptogramGame;
import java.io.InputStream;
import java.io.PrintStream;
import java.util.Scanner;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Human player that reads commands from stdin (CLI).
 */
@Component
public class HumanPlayer implements Player {
    private final Scanner scanner;
    private final PrintStream out;

    @Autowired
    public HumanPlayer() {
        this(System.in, System.out);
    }

    public HumanPlayer(InputStream in, PrintStream out) {
        this.scanner = new Scanner(in);
        this.out = out;
    }

    @Override
    public String nextCommand(CryptogramGame game, String feedback) {
        if (feedback != null && !feedback.isEmpty()) {
            out.println(feedback);
        }
        out.print(buildPrompt(game));
        if (!scanner.hasNextLine()) {
            return null;
        }
        return scanner.nextLine();
    }

    /**
     * Builds the command prompt, offering only the commands that make sense in the current state.
     *
     * @param game the current game state
     * @return the prompt string
     */
    String buildPrompt(CryptogramGame game) {
        if (game.isFailed()) {
            return "Out of mistakes (continue | reset | stats | quit): ";
        }
        if (game.isComplete()) {
            return "Solved! (reset | stats | quit): ";
        }
        if (game.isPaused()) {
            return "Paused (pause | quit): ";
        }
        return "Enter command (LETTER | type N LETTER | select N | delete [N] | left | right | hint | pause | reset | stats | quit): ";
    }
}
