package jp.furigana.annotator.vocabulary;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class RubyRegistryTest {

    @Test
    void ordersAndDeduplicatesByKanji() {
        RubyRegistry registry = RubyRegistry.of("本", List.of(
                new WordEntry("猫", "ねこ", WordSource.EPUB),
                new WordEntry("犬", "いぬ", WordSource.EPUB),
                new WordEntry("猫", "びょう", WordSource.TEXT)));

        assertThat(registry.entries()).extracting(RegistryEntry::kanji).containsExactly("犬", "猫");
        assertThat(registry.entries().get(1).reading()).isEqualTo("ねこ");
    }

    @Test
    void mergeKeepsExistingEntries() {
        RubyRegistry registry = RubyRegistry.of("本", List.of(new WordEntry("襖", "ふすま", WordSource.EPUB)));

        RubyRegistry merged = registry.merge(List.of(
                new WordEntry("襖", "あお", WordSource.TEXT, "harvested"),
                new WordEntry("鞄", "かばん", WordSource.TEXT, "harvested")));

        assertThat(merged.size()).isEqualTo(2);
        assertThat(merged.entries()).containsExactly(
                new RegistryEntry("襖", "ふすま", "epub", ""),
                new RegistryEntry("鞄", "かばん", "text", "harvested"));
        assertThat(merged.bookTitle()).isEqualTo("本");
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    void wordSourcesUseWireNames() {
        assertThat(WordSource.from("epub_smart")).isEqualTo(WordSource.EPUB_SMART);
        assertThat(new WordEntry("鞄", "かばん", WordSource.EPUB_SMART).toRegistryEntry().source()).isEqualTo("epub_smart");
    }
}
