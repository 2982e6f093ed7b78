package jp.furigana.annotator.annotate;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Adds furigana to line-oriented text files, including the rephrase layout where {@code <} lines carry the
 * original sentence and {@code >>} lines the rephrased one.
 */
public class PlainTextAnnotator {

    private static final Logger LOGGER = LoggerFactory.getLogger(PlainTextAnnotator.class);

    private static final Pattern REPHRASE_HEADING = Pattern.compile("^[<＜](?!ruby>)", Pattern.MULTILINE);
    private static final Pattern HEADING_PREFIX = Pattern.compile("^([<＜]\\s*)");
    private static final Pattern SUBITEM_PREFIX = Pattern.compile("^(>>\\s*)");
    private static final String SUBITEM_MARKER = ">>";

    private final FuriganaAnnotator annotator;

    public PlainTextAnnotator(FuriganaAnnotator annotator) {
        this.annotator = Objects.requireNonNull(annotator, "annotator");
    }

    public String annotate(String content, boolean filterMode) {
        return annotate(content, filterMode, false);
    }

    /**
     * @param stripExisting remove ruby already present so every line is glossed afresh
     */
    public String annotate(String content, boolean filterMode, boolean stripExisting) {
        if (content == null || content.isEmpty()) {
            return content;
        }
        String source = stripExisting ? RubyMarkup.strip(content) : content;
        boolean rephrase = isRephraseFormat(source);
        LOGGER.debug("Annotating {} text", rephrase ? "rephrase" : "plain");
        String[] lines = source.split("\n", -1);
        List<String> result = new ArrayList<>(lines.length);
        for (String line : lines) {
            result.add(rephrase ? annotateRephraseLine(line, filterMode) : annotateLine(line, filterMode));
        }
        return String.join("\n", result);
    }

    static boolean isRephraseFormat(String content) {
        return REPHRASE_HEADING.matcher(content).find() && content.contains(SUBITEM_MARKER);
    }

    private String annotateRephraseLine(String line, boolean filterMode) {
        String stripped = line.strip();
        if (stripped.isEmpty()) {
            return line;
        }
        if (REPHRASE_HEADING.matcher(stripped).find()) {
            return annotateAfterPrefix(stripped, HEADING_PREFIX, filterMode).orElse(line);
        }
        if (stripped.startsWith(SUBITEM_MARKER)) {
            return annotateAfterPrefix(stripped, SUBITEM_PREFIX, filterMode).orElse(line);
        }
        return annotateLine(stripped, filterMode);
    }

    private Optional<String> annotateAfterPrefix(String stripped, Pattern prefixPattern, boolean filterMode) {
        Matcher matcher = prefixPattern.matcher(stripped);
        if (!matcher.find()) {
            return Optional.empty();
        }
        String prefix = matcher.group(1);
        return Optional.of(prefix + annotateLine(stripped.substring(prefix.length()), filterMode));
    }

    private String annotateLine(String line, boolean filterMode) {
        if (line.isBlank() || RubyMarkup.containsRuby(line)) {
            return line;
        }
        return annotator.annotateToMarkup(line, filterMode);
    }
}
