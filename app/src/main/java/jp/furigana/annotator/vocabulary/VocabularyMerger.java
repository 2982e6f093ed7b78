package jp.furigana.annotator.vocabulary;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import jp.furigana.annotator.dictionary.RubyPairExtractor;
import jp.furigana.annotator.script.ScriptClassifier;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rebuilds whole words from ruby annotations. Kanji annotated one node at a time are joined back into
 * compounds, and the inflectional kana that follows a stem is attached using the longest ending found in
 * {@link OkuriganaRules}.
 */
public class VocabularyMerger {

    private static final Logger LOGGER = LoggerFactory.getLogger(VocabularyMerger.class);

    private static final Pattern LEADING_KANA = Pattern.compile("^[\\u3040-\\u309F\\u30FC]+");
    private static final int MAX_ENDING_LENGTH = 4;
    private static final String VOLITIONAL_ENDING = "う";

    private final OkuriganaRules rules;

    public VocabularyMerger() {
        this(OkuriganaRules.defaults());
    }

    public VocabularyMerger(OkuriganaRules rules) {
        this.rules = Objects.requireNonNull(rules, "rules");
    }

    public List<WordEntry> extractWords(String html) {
        return extractWords(Jsoup.parse(html == null ? "" : html));
    }

    public List<WordEntry> extractWords(Element document) {
        Objects.requireNonNull(document, "document");
        Map<String, WordEntry> words = new LinkedHashMap<>();
        Set<Element> processed = Collections.newSetFromMap(new IdentityHashMap<>());

        for (Element ruby : document.select(RubyPairExtractor.RUBY)) {
            if (processed.contains(ruby)) {
                continue;
            }
            String base = RubyPairExtractor.baseText(ruby);
            String reading = RubyPairExtractor.readingText(ruby);
            if (base.isEmpty() || reading.isEmpty()) {
                continue;
            }
            if (ScriptClassifier.isRepetitionMark(base.codePointAt(0))) {
                continue;
            }
            processed.add(ruby);

            StringBuilder word = new StringBuilder(base);
            StringBuilder wordReading = new StringBuilder(reading);
            Element current = ruby;
            Optional<Element> next = nextRubySibling(current);
            while (next.isPresent()) {
                String nextBase = RubyPairExtractor.baseText(next.get());
                if (!ScriptClassifier.isAllKanji(word.toString()) || !ScriptClassifier.isAllKanji(nextBase)) {
                    break;
                }
                word.append(nextBase);
                wordReading.append(RubyPairExtractor.readingText(next.get()));
                current = next.get();
                processed.add(current);
                next = nextRubySibling(current);
            }

            String ending = okuriganaAfter(current, word.toString());
            word.append(ending);
            wordReading.append(ending);

            String finalWord = word.toString();
            String finalReading = wordReading.toString();
            if (!finalWord.equals(finalReading)) {
                words.putIfAbsent(finalWord, new WordEntry(finalWord, finalReading, WordSource.EPUB_SMART));
            }
        }
        LOGGER.debug("Extracted {} vocabulary entries", words.size());
        return new ArrayList<>(words.values());
    }

    /**
     * Longest inflectional ending at the start of the text that follows {@code ruby}, or an empty string.
     */
    String okuriganaAfter(Element ruby, String base) {
        Matcher matcher = LEADING_KANA.matcher(trailingText(ruby));
        if (!matcher.find()) {
            return "";
        }
        String kana = matcher.group();
        String candidate = kana.substring(0, Math.min(kana.length(), MAX_ENDING_LENGTH));
        for (int length = candidate.length(); length >= 2; length--) {
            String ending = candidate.substring(0, length);
            if (rules.isEnding(ending)) {
                return ending;
            }
        }
        String first = candidate.substring(0, 1);
        if (rules.isEnding(first) && !rules.isParticle(first)) {
            return first;
        }
        if (VOLITIONAL_ENDING.equals(first) && !base.isEmpty()
                && rules.isVolitionalStem(base.substring(base.length() - 1))) {
            return first;
        }
        return "";
    }

    /**
     * Next sibling ruby, looking past whitespace-only text. Any other node in between ends the search.
     */
    static Optional<Element> nextRubySibling(Element element) {
        Element parent = element.parent();
        if (parent == null) {
            return Optional.empty();
        }
        List<Node> siblings = parent.childNodes();
        for (int index = element.siblingIndex() + 1; index < siblings.size(); index++) {
            Node sibling = siblings.get(index);
            if (sibling instanceof TextNode text && text.isBlank()) {
                continue;
            }
            if (sibling instanceof Element candidate && RubyPairExtractor.RUBY.equals(candidate.normalName())) {
                return Optional.of(candidate);
            }
            return Optional.empty();
        }
        return Optional.empty();
    }

    static String trailingText(Element element) {
        Node sibling = element.nextSibling();
        if (sibling instanceof TextNode text) {
            return text.getWholeText();
        }
        return "";
    }
}
