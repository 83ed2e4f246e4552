package games.cryptogram.game;

import java.util.Objects;

/**
 * Immutable difficulty settings handed to a {@link CryptogramGame} at construction.
 * <p>
 * The game never looks these values up anywhere else; changing difficulty means building a
 * new game (or calling {@link CryptogramGame#reset} on one built with the new config).
 */
public final class DifficultyConfig {
    public static final double DEFAULT_PREFILL_FRACTION = 0.20;
    public static final int DEFAULT_MAX_MISTAKES = 3;

    private final DifficultyMode mode;
    private final double prefillFraction;
    private final int maxMistakes;

    /**
     * @param mode difficulty mode; must not be null
     * @param prefillFraction share of distinct solution letters pre-filled in normal mode, in [0, 1]
     * @param maxMistakes number of incorrect inputs that fails the session; at least 1
     * @throws IllegalArgumentException if a value is out of range
     */
    public DifficultyConfig(DifficultyMode mode, double prefillFraction, int maxMistakes) {
        this.mode = Objects.requireNonNull(mode, "mode");
        if (Double.isNaN(prefillFraction) || prefillFraction < 0.0 || prefillFraction > 1.0) {
            throw new IllegalArgumentException("prefillFraction must be within [0, 1]: " + prefillFraction);
        }
        if (maxMistakes < 1) {
            throw new IllegalArgumentException("maxMistakes must be at least 1: " + maxMistakes);
        }
        this.prefillFraction = prefillFraction;
        this.maxMistakes = maxMistakes;
    }

    /** Normal mode with the default pre-fill share and mistake limit. */
    public static DifficultyConfig defaults() {
        return new DifficultyConfig(DifficultyMode.NORMAL, DEFAULT_PREFILL_FRACTION, DEFAULT_MAX_MISTAKES);
    }

    /** Expert mode: no pre-filled letters, default mistake limit. */
    public static DifficultyConfig expert() {
        return new DifficultyConfig(DifficultyMode.EXPERT, DEFAULT_PREFILL_FRACTION, DEFAULT_MAX_MISTAKES);
    }

    public DifficultyMode getMode() {
        return mode;
    }

    public double getPrefillFraction() {
        return prefillFraction;
    }

    public int getMaxMistakes() {
        return maxMistakes;
    }

    public boolean isPrefillEnabled() {
        return mode == DifficultyMode.NORMAL;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DifficultyConfig)) {
            return false;
        }
        DifficultyConfig other = (DifficultyConfig) o;
        return mode == other.mode
                && Double.compare(prefillFraction, other.prefillFraction) == 0
                && maxMistakes == other.maxMistakes;
    }

    @Override
    public int hashCode() {
        return Objects.hash(mode, prefillFraction, maxMistakes);
    }

    @Override
    public String toString() {
        return "DifficultyConfig(mode=" + mode + ", prefillFraction=" + prefillFraction
                + ", maxMistakes=" + maxMistakes + ")";
    }
}
