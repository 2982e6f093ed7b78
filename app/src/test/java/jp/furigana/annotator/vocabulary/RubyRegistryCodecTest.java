package jp.furigana.annotator.vocabulary;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RubyRegistryCodecTest {

    private final RubyRegistryCodec codec = new RubyRegistryCodec();

    @TempDir
    Path tempDir;

    @Test
    void writesReadableUtf8Json() throws Exception {
        RubyRegistry registry = RubyRegistry.of("吾輩は猫である", List.of(new WordEntry("襖", "ふすま", WordSource.EPUB)));
        Path target = tempDir.resolve("registry/ruby.json");

        codec.write(target, registry);

        String json = Files.readString(target, StandardCharsets.UTF_8);
        assertThat(json).contains("\"bookTitle\" : \"吾輩は猫である\"");
        assertThat(json).contains("\"kanji\" : \"襖\"");
        assertThat(codec.read(target)).isEqualTo(registry);
    }

    @Test
    void toleratesUnknownAndMissingFields() {
        RubyRegistry registry = codec.fromJson("{\"bookTitle\":\"t\",\"version\":2,"
                + "\"entries\":[{\"kanji\":\"猫\",\"reading\":\"ねこ\",\"extra\":true}]}");

        assertThat(registry.entries()).containsExactly(new RegistryEntry("猫", "ねこ", "epub", ""));
    }

    @Test
    void reportsMalformedDocuments() {
        assertThatThrownBy(() -> codec.fromJson("{not json"))
                .isInstanceOf(UncheckedIOException.class)
                .hasMessageContaining("parse");
    }

    @Test
    void rejectsEmptyDocuments() {
        assertThatThrownBy(() -> codec.fromJson("null"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("empty");
    }
}
