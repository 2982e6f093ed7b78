package jp.furigana.annotator.repair;

import static jp.furigana.annotator.script.ScriptClassifier.endsWithKanji;
import static jp.furigana.annotator.script.ScriptClassifier.isClosingPunctuation;
import static jp.furigana.annotator.script.ScriptClassifier.isSentenceEndPunctuation;
import static jp.furigana.annotator.script.ScriptClassifier.isShortKanjiRun;
import static jp.furigana.annotator.script.ScriptClassifier.lastCodePoint;
import static jp.furigana.annotator.script.ScriptClassifier.startsWithHiragana;
import static jp.furigana.annotator.script.ScriptClassifier.startsWithKanji;

import jp.furigana.annotator.script.ScriptClassifier;

/**
 * Decides whether two neighbouring lines are halves of text that an annotation boundary split apart.
 * Lines starting with a rephrase or heading marker are never joined onto a previous line.
 */
public final class LineMergeRules {

    private static final String MARKUP_MARKERS = "<>＜＞";

    private LineMergeRules() {
    }

    public static boolean shouldMergeWithNext(String currentLine, String nextLine) {
        String current = currentLine.strip();
        String next = nextLine.strip();
        if (current.isEmpty() || next.isEmpty()) {
            return false;
        }
        boolean nextIsShortKanji = isShortKanjiRun(next);
        boolean nextIsMarkup = startsWithMarkupMarker(next);

        if (isShortKanjiRun(current) && (startsWithHiragana(next) || nextIsShortKanji)) {
            return true;
        }
        if (nextIsShortKanji && !endsWithClosingPunctuation(current) && !nextIsMarkup) {
            return true;
        }
        if (endsWithKanji(current) && startsWithHiragana(next) && !nextIsMarkup) {
            return true;
        }
        if (!isSentenceEndPunctuation(lastCodePoint(current)) && nextIsShortKanji && !nextIsMarkup) {
            return true;
        }
        return lastCodePoint(current) == ScriptClassifier.READING_COMMA && startsWithKanji(next) && !nextIsMarkup;
    }

    public static boolean shouldMergeWithPrevious(String previousLine, String currentLine) {
        String previous = previousLine.strip();
        String current = currentLine.strip();
        if (previous.isEmpty() || current.isEmpty()) {
            return false;
        }
        return isShortKanjiRun(current)
                && !endsWithClosingPunctuation(previous)
                && !startsWithMarkupMarker(current);
    }

    static boolean startsWithMarkupMarker(String line) {
        return !line.isEmpty() && MARKUP_MARKERS.indexOf(line.codePointAt(0)) >= 0;
    }

    private static boolean endsWithClosingPunctuation(String line) {
        return isClosingPunctuation(lastCodePoint(line));
    }
}
