package jp.furigana.annotator.annotate;

import java.util.Objects;
import java.util.Optional;

/**
 * One morpheme reported by the tokenizer. The reading is katakana, or absent when the analyzer has none.
 */
public record Token(String surface, Optional<String> tokenizerReading) {

    private static final String UNKNOWN_READING = "*";

    public Token {
        Objects.requireNonNull(surface, "surface");
        tokenizerReading = tokenizerReading == null
                ? Optional.empty()
                : tokenizerReading.filter(value -> !value.isBlank() && !UNKNOWN_READING.equals(value));
    }

    public static Token of(String surface, String reading) {
        return new Token(surface, Optional.ofNullable(reading));
    }

    public static Token unread(String surface) {
        return new Token(surface, Optional.empty());
    }
}
