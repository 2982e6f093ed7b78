package jp.furigana.annotator.annotate;

import java.util.Objects;

/**
 * Output unit of annotation: plain text, a generated ruby, or an author's ruby kept exactly as written.
 */
public record AnnotatedSpan(Kind kind, String base, String reading, String markup) {

    public enum Kind {
        PLAIN,
        GENERATED,
        PRESERVED
    }

    public AnnotatedSpan {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(base, "base");
        Objects.requireNonNull(markup, "markup");
        if (kind != Kind.PLAIN && (reading == null || reading.isEmpty())) {
            throw new IllegalArgumentException("ruby spans require a reading");
        }
    }

    public static AnnotatedSpan plain(String text) {
        return new AnnotatedSpan(Kind.PLAIN, text, null, text);
    }

    public static AnnotatedSpan ruby(String base, String reading) {
        return new AnnotatedSpan(Kind.GENERATED, base, reading, RubyMarkup.render(base, reading));
    }

    public static AnnotatedSpan preserved(String base, String reading, String markup) {
        return new AnnotatedSpan(Kind.PRESERVED, base, reading, markup);
    }

    public boolean isRuby() {
        return kind != Kind.PLAIN;
    }
}
