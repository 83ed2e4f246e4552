package games.cryptogram.game;

import java.util.Locale;

/**
 * Difficulty modes. Only {@link #NORMAL} pre-fills letters when a puzzle starts.
 */
public enum DifficultyMode {
    NORMAL("Normal"),
    EXPERT("Expert");

    private final String displayName;

    DifficultyMode(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Parses a mode name case-insensitively ({@code "normal"}, {@code "Expert"}, ...).
     *
     * @throws IllegalArgumentException if the value names no mode
     */
    public static DifficultyMode fromName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Difficulty mode must not be blank");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown difficulty mode: " + value, e);
        }
    }
}
