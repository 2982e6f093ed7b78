package jp.furigana.annotator.vocabulary;

/**
 * Where a vocabulary entry was mined from.
 */
public enum WordSource {
    EPUB("epub"),
    EPUB_SMART("epub_smart"),
    TEXT("text");

    private final String wireName;

    WordSource(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static WordSource from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Word source must be provided");
        }
        for (WordSource source : values()) {
            if (source.wireName.equalsIgnoreCase(raw.trim())) {
                return source;
            }
        }
        throw new IllegalArgumentException("Unsupported word source: " + raw);
    }
}
