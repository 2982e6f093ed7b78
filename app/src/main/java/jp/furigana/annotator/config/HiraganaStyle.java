package jp.furigana.annotator.config;

import java.util.Locale;

/**
 * How long vowels appear in generated readings: spelled out ({@code しょう}) or as a mark ({@code しょー}).
 */
public enum HiraganaStyle {
    FULL,
    LONG_VOWEL;

    public static HiraganaStyle from(String raw) {
        if (raw == null || raw.isBlank()) {
            return FULL;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "full" -> FULL;
            case "long-vowel", "long_vowel" -> LONG_VOWEL;
            default -> throw new IllegalArgumentException("Unsupported hiragana style: " + raw);
        };
    }

    public boolean preserveLongVowel() {
        return this == LONG_VOWEL;
    }
}
