package jp.furigana.annotator.vocabulary;

import java.util.Objects;

/**
 * Persisted form of a vocabulary entry; {@code kanji} is the unique key.
 */
public record RegistryEntry(String kanji, String reading, String source, String note) {

    public RegistryEntry {
        if (kanji == null || kanji.isBlank()) {
            throw new IllegalArgumentException("kanji must not be blank");
        }
        Objects.requireNonNull(reading, "reading");
        source = source == null ? WordSource.EPUB.wireName() : source;
        note = note == null ? "" : note;
    }
}
