package jp.furigana.annotator.dictionary;

import java.util.Objects;

/**
 * A base text and the reading an author attached to it.
 */
public record RubyPair(String base, String reading) {

    public RubyPair {
        Objects.requireNonNull(base, "base");
        Objects.requireNonNull(reading, "reading");
        if (reading.isEmpty()) {
            throw new IllegalArgumentException("reading must not be empty");
        }
        if (base.equals(reading)) {
            throw new IllegalArgumentException("base and reading must differ: " + base);
        }
    }

    /**
     * Whether the pair would satisfy the record invariants.
     */
    public static boolean isMeaningful(String base, String reading) {
        return base != null && !base.isEmpty()
                && reading != null && !reading.isEmpty()
                && !base.equals(reading);
    }
}
