package jp.furigana.annotator.annotate;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import jp.furigana.annotator.dictionary.NameDictionary;
import org.junit.jupiter.api.Test;

class FuriganaAnnotatorTest {

    @Test
    void glossesKanjiTokensWithHiraganaReadings() {
        FuriganaAnnotator annotator = new FuriganaAnnotator(ScriptedTokenizer.of("漢字", "カンジ"), NameDictionary.empty());

        assertThat(annotator.annotateToMarkup("これは漢字です", false))
                .isEqualTo("これは<ruby>漢字<rt>かんじ</rt></ruby>です");
    }

    @Test
    void leavesKanaOnlyTextUnchanged() {
        FuriganaAnnotator annotator = new FuriganaAnnotator(ScriptedTokenizer.of("ひらがな", "ヒラガナ"), NameDictionary.empty());

        List<AnnotatedSpan> spans = annotator.annotate("ひらがなとカタカナ", false);

        assertThat(spans).noneMatch(AnnotatedSpan::isRuby);
        assertThat(FuriganaAnnotator.render(spans)).isEqualTo("ひらがなとカタカナ");
    }

    @Test
    void prefersAuthorReadingsFromNameDictionary() {
        NameDictionary names = NameDictionary.of(Map.of("春日", "かすが"));
        FuriganaAnnotator annotator = new FuriganaAnnotator(ScriptedTokenizer.of("春日", "ハルヒ"), names);

        assertThat(annotator.annotateToMarkup("春日が来た", false))
                .startsWith("<ruby>春日<rt>かすが</rt></ruby>が");
    }

    @Test
    void filterModeSkipsElementaryKanji() {
        FuriganaAnnotator annotator = new FuriganaAnnotator(
                ScriptedTokenizer.of("日本", "ニホン", "憂鬱", "ユウウツ"), NameDictionary.empty());

        assertThat(annotator.annotateToMarkup("日本は憂鬱", true))
                .isEqualTo("日本は<ruby>憂鬱<rt>ゆううつ</rt></ruby>");
        assertThat(annotator.annotateToMarkup("日本は憂鬱", false))
                .isEqualTo("<ruby>日本<rt>にほん</rt></ruby>は<ruby>憂鬱<rt>ゆううつ</rt></ruby>");
    }

    @Test
    void mixedSurfaceIsGlossedWhenAnyKanjiIsAdvanced() {
        FuriganaAnnotator annotator = new FuriganaAnnotator(ScriptedTokenizer.of("大鍋", "オオナベ"), NameDictionary.empty());

        assertThat(annotator.annotateToMarkup("大鍋", true)).isEqualTo("<ruby>大鍋<rt>おおなべ</rt></ruby>");
    }

    @Test
    void tokensWithoutReadingStayPlain() {
        FuriganaAnnotator annotator = new FuriganaAnnotator(text -> List.of(Token.unread("謎"), Token.of("字", "*")),
                NameDictionary.empty());

        List<AnnotatedSpan> spans = annotator.annotate("謎字", false);

        assertThat(spans).extracting(AnnotatedSpan::kind)
                .containsExactly(AnnotatedSpan.Kind.PLAIN, AnnotatedSpan.Kind.PLAIN);
    }

    @Test
    void reproducesTextCharactersTheTokenizerSkipped() {
        FuriganaAnnotator annotator = new FuriganaAnnotator(ScriptedTokenizer.of(), NameDictionary.empty());
        String text = "「漢字」 です";

        List<AnnotatedSpan> spans = annotator.annotate(text,
                List.of(Token.of("漢字", "カンジ"), Token.of("です", "デス"), Token.of("無い", "ナイ")), false);

        assertThat(spans.stream().map(AnnotatedSpan::base).collect(Collectors.joining())).isEqualTo(text);
        assertThat(FuriganaAnnotator.render(spans)).isEqualTo("「<ruby>漢字<rt>かんじ</rt></ruby>」 です");
    }

    @Test
    void keepsLongVowelMarkWhenConfigured() {
        FuriganaAnnotator annotator = new FuriganaAnnotator(ScriptedTokenizer.of("珈琲", "コーヒー"),
                NameDictionary.empty(), ProficiencyFilter.elementary(), true);

        assertThat(annotator.annotateToMarkup("珈琲", false)).isEqualTo("<ruby>珈琲<rt>こーひー</rt></ruby>");
    }

    @Test
    void handlesEmptyAndBlankInput() {
        ScriptedTokenizer tokenizer = ScriptedTokenizer.of();
        FuriganaAnnotator annotator = new FuriganaAnnotator(tokenizer, NameDictionary.empty());

        assertThat(annotator.annotate("", false)).isEmpty();
        assertThat(annotator.annotate("  ", false)).containsExactly(AnnotatedSpan.plain("  "));
        assertThat(tokenizer.invocations()).isZero();
    }
}
