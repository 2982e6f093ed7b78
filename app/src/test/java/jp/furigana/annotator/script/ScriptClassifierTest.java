package jp.furigana.annotator.script;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ScriptClassifierTest {

    @Test
    void classifiesCodePointsByScript() {
        assertThat(ScriptClassifier.isKanji('漢')).isTrue();
        assertThat(ScriptClassifier.isKanji(0x3400)).isTrue();
        assertThat(ScriptClassifier.isKanji('か')).isFalse();
        assertThat(ScriptClassifier.isHiragana('か')).isTrue();
        assertThat(ScriptClassifier.isHiragana('カ')).isFalse();
        assertThat(ScriptClassifier.isKatakana('カ')).isTrue();
        assertThat(ScriptClassifier.isKatakana('ー')).isTrue();
        assertThat(ScriptClassifier.isLongVowelMark('ー')).isTrue();
        assertThat(ScriptClassifier.isRepetitionMark('々')).isTrue();
        assertThat(ScriptClassifier.isKanji('々')).isFalse();
    }

    @Test
    void recognisesSentenceEndingAndClosingPunctuation() {
        assertThat(ScriptClassifier.isSentenceEndPunctuation('。')).isTrue();
        assertThat(ScriptClassifier.isSentenceEndPunctuation('」')).isTrue();
        assertThat(ScriptClassifier.isSentenceEndPunctuation('、')).isFalse();
        assertThat(ScriptClassifier.isClosingPunctuation('、')).isTrue();
        assertThat(ScriptClassifier.isClosingPunctuation('…')).isTrue();
        assertThat(ScriptClassifier.isClosingPunctuation('あ')).isFalse();
    }

    @Test
    void answersStringLevelQuestions() {
        assertThat(ScriptClassifier.containsKanji("これは漢字")).isTrue();
        assertThat(ScriptClassifier.containsKanji("ひらがな")).isFalse();
        assertThat(ScriptClassifier.isAllKanji("人々")).isTrue();
        assertThat(ScriptClassifier.isAllKanji("行く")).isFalse();
        assertThat(ScriptClassifier.isAllKanji("")).isFalse();
        assertThat(ScriptClassifier.isShortKanjiRun("襖")).isTrue();
        assertThat(ScriptClassifier.isShortKanjiRun("東京都")).isTrue();
        assertThat(ScriptClassifier.isShortKanjiRun("東京都庁")).isFalse();
        assertThat(ScriptClassifier.startsWithHiragana("を開ける")).isTrue();
        assertThat(ScriptClassifier.endsWithKanji("開け閉め")).isFalse();
        assertThat(ScriptClassifier.endsWithKanji("彼は襖")).isTrue();
    }
}
