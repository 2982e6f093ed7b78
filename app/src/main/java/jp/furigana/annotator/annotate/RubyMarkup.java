package jp.furigana.annotator.annotate;

import java.util.regex.Pattern;

/**
 * Ruby markup syntax: {@code <ruby>BASE<rt>READING</rt></ruby>}.
 */
public final class RubyMarkup {

    private static final Pattern INNERMOST_RUBY = Pattern.compile("<ruby>([^<>]*?)<rt>.*?</rt></ruby>");
    private static final Pattern RUBY_PARENTHESIS = Pattern.compile("<rp>.*?</rp>");

    private RubyMarkup() {
    }

    public static String render(String base, String reading) {
        return "<ruby>" + base + "<rt>" + reading + "</rt></ruby>";
    }

    public static boolean containsRuby(String text) {
        return text != null && text.contains("<ruby>");
    }

    /**
     * Replaces every ruby annotation with its base text. Nested annotations are peeled from the inside out.
     */
    public static String strip(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String cleaned = RUBY_PARENTHESIS.matcher(text).replaceAll("");
        int previousLength = -1;
        while (cleaned.length() != previousLength) {
            previousLength = cleaned.length();
            cleaned = INNERMOST_RUBY.matcher(cleaned).replaceAll("$1");
        }
        return cleaned;
    }
}
