package jp.furigana.annotator.script;

/**
 * Character-class predicates over Japanese scripts. All methods take Unicode code points.
 */
public final class ScriptClassifier {

    public static final int LONG_VOWEL_MARK = 'ー';
    public static final int REPETITION_MARK = '々';
    public static final int READING_COMMA = '、';

    private static final String SENTENCE_END_PUNCTUATION = "。」』）)！？";
    private static final String CLOSING_PUNCTUATION = "。、」』）)！？…―";
    private static final int SHORT_KANJI_RUN_LIMIT = 3;

    private ScriptClassifier() {
    }

    public static boolean isKanji(int codePoint) {
        return (codePoint >= 0x4E00 && codePoint <= 0x9FFF)
                || (codePoint >= 0x3400 && codePoint <= 0x4DBF);
    }

    public static boolean isHiragana(int codePoint) {
        return codePoint >= 0x3040 && codePoint <= 0x309F;
    }

    public static boolean isKatakana(int codePoint) {
        return codePoint >= 0x30A0 && codePoint <= 0x30FF;
    }

    public static boolean isLongVowelMark(int codePoint) {
        return codePoint == LONG_VOWEL_MARK;
    }

    public static boolean isRepetitionMark(int codePoint) {
        return codePoint == REPETITION_MARK;
    }

    public static boolean isSentenceEndPunctuation(int codePoint) {
        return SENTENCE_END_PUNCTUATION.indexOf(codePoint) >= 0;
    }

    /**
     * Sentence-ending punctuation plus the reading comma, ellipsis and dash.
     */
    public static boolean isClosingPunctuation(int codePoint) {
        return CLOSING_PUNCTUATION.indexOf(codePoint) >= 0;
    }

    public static boolean containsKanji(String text) {
        return text != null && text.codePoints().anyMatch(ScriptClassifier::isKanji);
    }

    /**
     * True when the text is non-empty and made of kanji and repetition marks only.
     */
    public static boolean isAllKanji(String text) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        return text.codePoints().allMatch(cp -> isKanji(cp) || isRepetitionMark(cp));
    }

    /**
     * True when the text is one to three kanji and nothing else.
     */
    public static boolean isShortKanjiRun(String text) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        long count = text.codePoints().count();
        return count <= SHORT_KANJI_RUN_LIMIT && text.codePoints().allMatch(ScriptClassifier::isKanji);
    }

    public static boolean startsWithKanji(String text) {
        return text != null && !text.isEmpty() && isKanji(text.codePointAt(0));
    }

    public static boolean startsWithHiragana(String text) {
        return text != null && !text.isEmpty() && isHiragana(text.codePointAt(0));
    }

    public static boolean endsWithKanji(String text) {
        return text != null && !text.isEmpty() && isKanji(lastCodePoint(text));
    }

    public static int lastCodePoint(String text) {
        return text.codePointBefore(text.length());
    }
}
