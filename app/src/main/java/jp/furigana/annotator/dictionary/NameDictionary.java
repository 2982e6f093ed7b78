package jp.furigana.annotator.dictionary;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable mapping from a term to the one reading the author used for it.
 */
public final class NameDictionary {

    private static final NameDictionary EMPTY = new NameDictionary(Map.of());

    private final Map<String, String> readings;

    private NameDictionary(Map<String, String> readings) {
        this.readings = Collections.unmodifiableMap(new LinkedHashMap<>(readings));
    }

    public static NameDictionary empty() {
        return EMPTY;
    }

    public static NameDictionary of(Map<String, String> readings) {
        Objects.requireNonNull(readings, "readings");
        readings.forEach((term, reading) -> {
            if (term == null || term.isEmpty() || reading == null || reading.isEmpty()) {
                throw new IllegalArgumentException("terms and readings must not be empty");
            }
        });
        return new NameDictionary(readings);
    }

    public Optional<String> reading(String term) {
        return Optional.ofNullable(readings.get(term));
    }

    public boolean contains(String term) {
        return readings.containsKey(term);
    }

    public int size() {
        return readings.size();
    }

    public boolean isEmpty() {
        return readings.isEmpty();
    }

    /**
     * Read-only view in first-seen term order.
     */
    public Map<String, String> asMap() {
        return readings;
    }

    @Override
    public String toString() {
        return "NameDictionary" + readings;
    }
}
