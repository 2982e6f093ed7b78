package jp.furigana.annotator.script;

/**
 * Converts katakana readings produced by the morphological analyzer into hiragana furigana.
 */
public final class ReadingConverter {

    private static final int KATAKANA_TO_HIRAGANA_OFFSET = 0x60;
    private static final int CONVERTIBLE_KATAKANA_START = 0x30A1;
    private static final int CONVERTIBLE_KATAKANA_END = 0x30F6;

    private static final String A_ROW = "あかがさざただなはばぱまやらわ";
    private static final String I_ROW = "いきぎしじちぢにひびぴみり";
    private static final String U_ROW = "うくぐすずつづぬふぶぷむゆる";
    private static final String E_ROW = "えけげせぜてでねへべぺめれ";
    private static final String O_ROW = "おこごそぞとどのほぼぽもよろを";
    private static final String SMALL_Y = "ゃゅょ";
    private static final String SMALL_VOWELS = "ぁぃぅぇぉ";
    private static final String SMALL_VOWEL_TARGETS = "あいういう";

    private ReadingConverter() {
    }

    public static String toHiragana(String reading) {
        return toHiragana(reading, false);
    }

    /**
     * Shifts every katakana code point to hiragana. A long-vowel mark is either kept or spelled out
     * with the vowel implied by the row of the character emitted just before it.
     */
    public static String toHiragana(String reading, boolean preserveLongVowel) {
        if (reading == null || reading.isEmpty()) {
            return reading;
        }
        StringBuilder result = new StringBuilder(reading.length());
        reading.codePoints().forEach(codePoint -> {
            if (ScriptClassifier.isLongVowelMark(codePoint)) {
                if (preserveLongVowel) {
                    result.appendCodePoint(codePoint);
                } else {
                    int previous = result.length() == 0 ? -1 : result.codePointBefore(result.length());
                    result.append(vowelFor(previous));
                }
            } else if (codePoint >= CONVERTIBLE_KATAKANA_START && codePoint <= CONVERTIBLE_KATAKANA_END) {
                result.appendCodePoint(codePoint - KATAKANA_TO_HIRAGANA_OFFSET);
            } else {
                result.appendCodePoint(codePoint);
            }
        });
        return result.toString();
    }

    /**
     * Vowel that lengthens the given hiragana. E-row lengthens with い, o-row with う; anything
     * unrecognised (including no predecessor, passed as -1) falls back to う.
     */
    static char vowelFor(int previous) {
        if (previous < 0) {
            return 'う';
        }
        if (A_ROW.indexOf(previous) >= 0) {
            return 'あ';
        }
        if (I_ROW.indexOf(previous) >= 0 || E_ROW.indexOf(previous) >= 0) {
            return 'い';
        }
        if (U_ROW.indexOf(previous) >= 0 || O_ROW.indexOf(previous) >= 0 || SMALL_Y.indexOf(previous) >= 0) {
            return 'う';
        }
        int smallVowel = SMALL_VOWELS.indexOf(previous);
        if (smallVowel >= 0) {
            return SMALL_VOWEL_TARGETS.charAt(smallVowel);
        }
        return 'う';
    }
}
