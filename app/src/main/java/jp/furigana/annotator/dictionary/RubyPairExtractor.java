package jp.furigana.annotator.dictionary;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.jsoup.nodes.Element;

/**
 * Reads base and reading text out of {@code <ruby>} elements without modifying the source tree.
 */
public final class RubyPairExtractor {

    public static final String RUBY = "ruby";
    public static final String RT = "rt";
    public static final String RP = "rp";

    private RubyPairExtractor() {
    }

    /**
     * Trimmed base text of a ruby element: all of its text except {@code <rt>} and {@code <rp>}.
     */
    public static String baseText(Element ruby) {
        Element copy = ruby.clone();
        copy.select(RT + ", " + RP).remove();
        return copy.wholeText().strip();
    }

    /**
     * Trimmed text of the first {@code <rt>} child, or empty when there is none.
     */
    public static String readingText(Element ruby) {
        Element rt = ruby.selectFirst(RT);
        return rt == null ? "" : rt.wholeText().strip();
    }

    public static Optional<RubyPair> extract(Element ruby) {
        if (ruby == null || !RUBY.equals(ruby.normalName())) {
            return Optional.empty();
        }
        String base = baseText(ruby);
        String reading = readingText(ruby);
        if (!RubyPair.isMeaningful(base, reading)) {
            return Optional.empty();
        }
        return Optional.of(new RubyPair(base, reading));
    }

    /**
     * Every meaningful pair below {@code root}, in document order.
     */
    public static List<RubyPair> extractAll(Element root) {
        List<RubyPair> pairs = new ArrayList<>();
        for (Element ruby : root.select(RUBY)) {
            extract(ruby).ifPresent(pairs::add);
        }
        return pairs;
    }
}
