package jp.furigana.annotator.vocabulary;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class RubyHarvesterTest {

    private final RubyHarvester harvester = new RubyHarvester();

    @Test
    void collectsEveryDistinctPairWithFirstReading() {
        String html = "<p><ruby>漢字<rt>かんじ</rt></ruby><ruby>猫<rt>ねこ</rt></ruby><ruby>漢字<rt>おとこ</rt></ruby></p>";

        assertThat(harvester.collectAll(html)).containsExactly(
                new WordEntry("漢字", "かんじ", WordSource.EPUB),
                new WordEntry("猫", "ねこ", WordSource.EPUB));
    }

    @Test
    void harvestsRepeatedAnnotationsFromText() {
        String text = "<ruby>憂鬱<rt>ゆううつ</rt></ruby>な朝。<ruby>憂鬱<rt>ゆううつ</rt></ruby>な夜。"
                + "<ruby>襖<rt>ふすま</rt></ruby>";

        assertThat(harvester.harvestText(text, 2))
                .containsExactly(new WordEntry("憂鬱", "ゆううつ", WordSource.TEXT));
        assertThat(harvester.harvestText(text, 1)).extracting(WordEntry::word).containsExactly("憂鬱", "襖");
    }

    @Test
    void countsOnlyRepeatsWithTheFirstReading() {
        String text = "<ruby>憂鬱<rt>ゆううつ</rt></ruby><ruby>憂鬱<rt>ゆうつ</rt></ruby>";

        assertThat(harvester.harvestText(text, 2)).isEmpty();
    }

    @Test
    void skipsCommonWords() {
        String text = "<ruby>私<rt>わたし</rt></ruby><ruby>本書<rt>ほんしょ</rt></ruby><ruby>襖<rt>ふすま</rt></ruby>";

        assertThat(harvester.harvestText(text, 1)).extracting(WordEntry::word).containsExactly("襖");
    }

    @Test
    void rejectsNonPositiveThreshold() {
        assertThatThrownBy(() -> harvester.harvestText("", 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
