package jp.furigana.annotator.annotate;

import static org.assertj.core.api.Assertions.assertThat;

import jp.furigana.annotator.dictionary.NameDictionary;
import org.junit.jupiter.api.Test;

class PlainTextAnnotatorTest {

    private final PlainTextAnnotator annotator = new PlainTextAnnotator(new FuriganaAnnotator(
            ScriptedTokenizer.of("漢字", "カンジ", "読", "ヨ", "書", "カ"), NameDictionary.empty()));

    @Test
    void annotatesLineByLineKeepingBlankAndAnnotatedLines() {
        String content = "漢字を読む\n\nもう<ruby>一度<rt>いちど</rt></ruby>書く\n";

        String result = annotator.annotate(content, false);

        assertThat(result).isEqualTo("<ruby>漢字<rt>かんじ</rt></ruby>を<ruby>読<rt>よ</rt></ruby>む\n"
                + "\n"
                + "もう<ruby>一度<rt>いちど</rt></ruby>書く\n");
    }

    @Test
    void keepsRephraseMarkersAndAnnotatesTheRest() {
        String content = "< 漢字を読む\n>>漢字を書く\n＜書く";

        String result = annotator.annotate(content, false);

        assertThat(result.split("\n")).containsExactly(
                "< <ruby>漢字<rt>かんじ</rt></ruby>を<ruby>読<rt>よ</rt></ruby>む",
                ">><ruby>漢字<rt>かんじ</rt></ruby>を<ruby>書<rt>か</rt></ruby>く",
                "＜<ruby>書<rt>か</rt></ruby>く");
    }

    @Test
    void detectsRephraseLayout() {
        assertThat(PlainTextAnnotator.isRephraseFormat("<原文\n>>言い換え")).isTrue();
        assertThat(PlainTextAnnotator.isRephraseFormat("<原文だけ")).isFalse();
        assertThat(PlainTextAnnotator.isRephraseFormat("<ruby>字<rt>じ</rt></ruby> >> 矢印")).isFalse();
    }

    @Test
    void canReplaceExistingAnnotations() {
        String content = "<ruby>漢字<rt>おとこ</rt></ruby>";

        assertThat(annotator.annotate(content, false)).isEqualTo(content);
        assertThat(annotator.annotate(content, false, true)).isEqualTo("<ruby>漢字<rt>かんじ</rt></ruby>");
    }

    @Test
    void emptyContentIsReturnedAsIs() {
        assertThat(annotator.annotate("", false)).isEmpty();
    }
}
