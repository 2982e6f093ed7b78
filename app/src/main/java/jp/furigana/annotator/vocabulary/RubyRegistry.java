package jp.furigana.annotator.vocabulary;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reading dictionary for one book: entries unique by {@code kanji} and ordered by it.
 */
public record RubyRegistry(String bookTitle, List<RegistryEntry> entries) {

    public RubyRegistry {
        bookTitle = bookTitle == null ? "" : bookTitle;
        entries = normalize(entries == null ? List.of() : entries);
    }

    public static RubyRegistry of(String bookTitle, List<WordEntry> words) {
        List<RegistryEntry> entries = new ArrayList<>(words.size());
        for (WordEntry word : words) {
            entries.add(word.toRegistryEntry());
        }
        return new RubyRegistry(bookTitle, entries);
    }

    /**
     * Adds entries for kanji not yet registered. Existing entries are never replaced.
     */
    public RubyRegistry merge(List<WordEntry> words) {
        List<RegistryEntry> merged = new ArrayList<>(entries);
        for (WordEntry word : words) {
            merged.add(word.toRegistryEntry());
        }
        return new RubyRegistry(bookTitle, merged);
    }

    public int size() {
        return entries.size();
    }

    private static List<RegistryEntry> normalize(List<RegistryEntry> entries) {
        Map<String, RegistryEntry> unique = new LinkedHashMap<>();
        for (RegistryEntry entry : entries) {
            unique.putIfAbsent(entry.kanji(), entry);
        }
        List<RegistryEntry> sorted = new ArrayList<>(unique.values());
        sorted.sort(Comparator.comparing(RegistryEntry::kanji));
        return List.copyOf(sorted);
    }
}
