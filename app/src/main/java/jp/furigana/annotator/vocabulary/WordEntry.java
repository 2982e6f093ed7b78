package jp.furigana.annotator.vocabulary;

import java.util.Objects;

/**
 * A whole vocabulary word with its reading, possibly assembled from several ruby annotations.
 */
public record WordEntry(String word, String reading, WordSource source, String note) {

    public WordEntry {
        Objects.requireNonNull(word, "word");
        Objects.requireNonNull(reading, "reading");
        Objects.requireNonNull(source, "source");
        note = note == null ? "" : note;
    }

    public WordEntry(String word, String reading, WordSource source) {
        this(word, reading, source, "");
    }

    public RegistryEntry toRegistryEntry() {
        return new RegistryEntry(word, reading, source.wireName(), note);
    }
}
