package jp.furigana.annotator.script;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ReadingConverterTest {

    @Test
    void shiftsKatakanaToHiragana() {
        assertThat(ReadingConverter.toHiragana("カンジ")).isEqualTo("かんじ");
        assertThat(ReadingConverter.toHiragana("ヂャ")).isEqualTo("ぢゃ");
    }

    @Test
    void leavesOtherCharactersUntouched() {
        assertThat(ReadingConverter.toHiragana("漢A1かな")).isEqualTo("漢A1かな");
        assertThat(ReadingConverter.toHiragana("")).isEmpty();
    }

    @Test
    void spellsOutLongVowelFromPrecedingRow() {
        assertThat(ReadingConverter.toHiragana("シヨー")).isEqualTo("しよう");
        assertThat(ReadingConverter.toHiragana("シー")).isEqualTo("しい");
        assertThat(ReadingConverter.toHiragana("コーヒー")).isEqualTo("こうひい");
        assertThat(ReadingConverter.toHiragana("カー")).isEqualTo("かあ");
        assertThat(ReadingConverter.toHiragana("セーター")).isEqualTo("せいたあ");
        assertThat(ReadingConverter.toHiragana("キュー")).isEqualTo("きゅう");
        assertThat(ReadingConverter.toHiragana("ルー")).isEqualTo("るう");
    }

    @Test
    void smallVowelsLengthenWithTheirOwnVowel() {
        assertThat(ReadingConverter.toHiragana("ファー")).isEqualTo("ふぁあ");
        assertThat(ReadingConverter.toHiragana("ティー")).isEqualTo("てぃい");
        assertThat(ReadingConverter.toHiragana("フォー")).isEqualTo("ふぉう");
    }

    @Test
    void longVowelWithoutPredecessorBecomesU() {
        assertThat(ReadingConverter.toHiragana("ー")).isEqualTo("う");
        assertThat(ReadingConverter.vowelFor(-1)).isEqualTo('う');
        assertThat(ReadingConverter.vowelFor('ん')).isEqualTo('う');
    }

    @Test
    void keepsLongVowelMarkWhenRequested() {
        assertThat(ReadingConverter.toHiragana("コーヒー", true)).isEqualTo("こーひー");
    }
}
