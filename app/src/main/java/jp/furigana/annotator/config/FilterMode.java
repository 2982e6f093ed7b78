package jp.furigana.annotator.config;

import java.util.Locale;

/**
 * Which kanji receive furigana: all of them, or only those beyond JLPT N4.
 */
public enum FilterMode {
    NONE,
    N3;

    public static FilterMode from(String raw) {
        if (raw == null || raw.isBlank()) {
            return NONE;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "none", "all" -> NONE;
            case "n3" -> N3;
            default -> throw new IllegalArgumentException("Unsupported filter mode: " + raw);
        };
    }

    public boolean isFiltering() {
        return this == N3;
    }
}
