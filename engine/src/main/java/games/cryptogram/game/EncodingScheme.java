package games.cryptogram.game;

import java.util.Locale;

/**
 * Substitution alphabet a puzzle is enciphered with.
 * <p>
 * Both schemes resolve to plaintext letters; they only differ in how the encoded text is
 * tokenised into cells.
 */
public enum EncodingScheme {
    /** Every encoded letter stands for one plaintext letter (classic cryptogram). */
    LETTERS("letters"),
    /** Whitespace-separated numbers stand for plaintext letters. */
    NUMBERS("numbers");

    private final String label;

    EncodingScheme(String label) {
        this.label = label;
    }

    /**
     * Returns the lower-case configuration label (e.g. {@code "letters"}).
     *
     * @return the label used in configuration files and snapshots
     */
    public String getLabel() {
        return label;
    }

    /**
     * Parses a scheme label case-insensitively.
     *
     * @param value {@code "letters"} or {@code "numbers"}
     * @return the matching scheme
     * @throws IllegalArgumentException if the value names no scheme
     */
    public static EncodingScheme fromLabel(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Encoding scheme must not be blank");
        }
        String normalised = value.trim().toLowerCase(Locale.ROOT);
        for (EncodingScheme scheme : values()) {
            if (scheme.label.equals(normalised)) {
                return scheme;
            }
        }
        throw new IllegalArgumentException("Unknown encoding scheme: " + value);
    }

    @Override
    public String toString() {
        return label;
    }
}
