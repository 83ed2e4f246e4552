package games.cryptogram.player;

import java.util.Locale;
import java.util.Objects;

/**
 * Structured representation of a console command.
 *
 * <p><b>Supported command shapes:</b>
 * <ul>
 *   <li>{@code select N}: move the cursor to cell N</li>
 *   <li>{@code type N X}: guess letter X for cell N</li>
 *   <li>{@code X}: a bare letter is typed into the selected cell</li>
 *   <li>{@code delete [N]}: clear cell N, or the selected cell</li>
 *   <li>{@code hint}, {@code left}, {@code right}, {@code pause}, {@code continue},
 *       {@code reset}, {@code stats}, {@code quit}</li>
 * </ul>
 * Keywords are case-insensitive.
 */
public final class Command {

    public enum Type {
        SELECT,
        TYPE,
        DELETE,
        HINT,
        LEFT,
        RIGHT,
        PAUSE,
        CONTINUE,
        RESET,
        STATS,
        QUIT
    }

    private final Type type;
    /** Target cell; null means the selected cell. */
    private final Integer index;
    /** Guessed letter for {@link Type#TYPE}; null otherwise. */
    private final Character letter;

    private Command(Type type, Integer index, Character letter) {
        this.type = type;
        this.index = index;
        this.letter = letter;
    }

    public static Command of(Type type) {
        return new Command(Objects.requireNonNull(type, "type"), null, null);
    }

    public static Command select(int index) {
        return new Command(Type.SELECT, index, null);
    }

    public static Command type(Integer index, char letter) {
        return new Command(Type.TYPE, index, Character.toUpperCase(letter));
    }

    public static Command delete(Integer index) {
        return new Command(Type.DELETE, index, null);
    }

    /**
     * Parses a command string.
     *
     * @throws IllegalArgumentException if parsing fails
     */
    public static Command parse(String command) {
        if (command == null) {
            throw new IllegalArgumentException("Command cannot be null");
        }
        String trimmed = command.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Command cannot be blank");
        }

        String[] parts = trimmed.split("\\s+");
        String keyword = parts[0].toLowerCase(Locale.ROOT);
        if (parts.length == 1 && keyword.length() == 1 && Character.isLetter(keyword.charAt(0))) {
            return type(null, keyword.charAt(0));
        }

        switch (keyword) {
            case "select":
                requireArgs(parts, 2, command);
                return select(parseIndex(parts[1], command));
            case "type":
                requireArgs(parts, 3, command);
                return type(parseIndex(parts[1], command), parseLetter(parts[2], command));
            case "delete":
                if (parts.length == 1) {
                    return delete(null);
                }
                requireArgs(parts, 2, command);
                return delete(parseIndex(parts[1], command));
            default:
                break;
        }

        if (parts.length != 1) {
            throw new IllegalArgumentException("Unrecognised command: " + command);
        }
        return switch (keyword) {
            case "hint" -> of(Type.HINT);
            case "left" -> of(Type.LEFT);
            case "right" -> of(Type.RIGHT);
            case "pause" -> of(Type.PAUSE);
            case "continue" -> of(Type.CONTINUE);
            case "reset" -> of(Type.RESET);
            case "stats" -> of(Type.STATS);
            case "quit" -> of(Type.QUIT);
            default -> throw new IllegalArgumentException("Unrecognised command: " + command);
        };
    }

    private static void requireArgs(String[] parts, int expected, String command) {
        if (parts.length != expected) {
            throw new IllegalArgumentException("Unrecognised command: " + command);
        }
    }

    private static int parseIndex(String token, String command) {
        try {
            int index = Integer.parseInt(token);
            if (index < 0) {
                throw new IllegalArgumentException("Cell index must not be negative: " + command);
            }
            return index;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Cell index is not a number: " + command, e);
        }
    }

    private static char parseLetter(String token, String command) {
        if (token.length() != 1 || !Character.isLetter(token.charAt(0))) {
            throw new IllegalArgumentException("Expected a single letter: " + command);
        }
        return token.charAt(0);
    }

    public Type type() {
        return type;
    }

    /**
     * Returns the explicit target cell, or {@code null} to act on the selected cell.
     */
    public Integer index() {
        return index;
    }

    public Character letter() {
        return letter;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Command)) {
            return false;
        }
        Command other = (Command) o;
        return type == other.type && Objects.equals(index, other.index) && Objects.equals(letter, other.letter);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, index, letter);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(type.name().toLowerCase(Locale.ROOT));
        if (index != null) {
            sb.append(' ').append(index);
        }
        if (letter != null) {
            sb.append(' ').append(letter);
        }
        return sb.toString();
    }
}
