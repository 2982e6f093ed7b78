package jp.furigana.annotator.vocabulary;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import jp.furigana.annotator.dictionary.RubyPair;
import jp.furigana.annotator.dictionary.RubyPairExtractor;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects ruby pairs as-is, without the compound and okurigana heuristics of {@link VocabularyMerger}.
 */
public class RubyHarvester {

    private static final Logger LOGGER = LoggerFactory.getLogger(RubyHarvester.class);

    private static final Pattern RUBY_PATTERN = Pattern.compile("<ruby>([^<]+)<rt>([^<]+)</rt></ruby>");

    private static final Set<String> COMMON_SINGLE_KANJI = Set.of(
            "私", "僕", "俺", "彼", "今", "何", "時", "人", "事", "物",
            "所", "方", "前", "後", "上", "下", "中", "大", "小", "新",
            "古", "良", "悪", "高", "低", "長", "短", "日", "月", "年",
            "言", "思", "見", "聞", "知", "行", "来", "出", "入", "持",
            "一", "二", "三", "四", "五", "六", "七", "八", "九", "十");

    private static final Set<String> COMMON_WORDS = Set.of(
            "本書", "発刊", "刊行", "出版", "株式", "会社", "研究", "最後",
            "感謝", "平成", "令和", "昭和", "大正", "明治");

    public List<WordEntry> collectAll(String html) {
        return collectAll(Jsoup.parse(html == null ? "" : html));
    }

    /**
     * Every distinct ruby base in document order with the first reading seen for it.
     */
    public List<WordEntry> collectAll(Element document) {
        Map<String, WordEntry> entries = new LinkedHashMap<>();
        for (RubyPair pair : RubyPairExtractor.extractAll(document)) {
            entries.putIfAbsent(pair.base(), new WordEntry(pair.base(), pair.reading(), WordSource.EPUB));
        }
        return new ArrayList<>(entries.values());
    }

    /**
     * Harvests ruby from already-annotated text. Repeats of a base are counted only when they carry the
     * reading seen first; common words and bases below {@code minOccurrences} are dropped.
     */
    public List<WordEntry> harvestText(String text, int minOccurrences) {
        if (minOccurrences < 1) {
            throw new IllegalArgumentException("minOccurrences must be at least 1");
        }
        Map<String, String> readings = new LinkedHashMap<>();
        Map<String, Integer> counts = new LinkedHashMap<>();
        Matcher matcher = RUBY_PATTERN.matcher(text == null ? "" : text);
        while (matcher.find()) {
            String base = matcher.group(1).strip();
            String reading = matcher.group(2).strip();
            if (!RubyPair.isMeaningful(base, reading)) {
                continue;
            }
            String known = readings.putIfAbsent(base, reading);
            if (known == null || known.equals(reading)) {
                counts.merge(base, 1, Integer::sum);
            }
        }

        List<WordEntry> entries = new ArrayList<>();
        readings.forEach((base, reading) -> {
            if (isCommon(base) || counts.get(base) < minOccurrences) {
                return;
            }
            entries.add(new WordEntry(base, reading, WordSource.TEXT, ""));
        });
        LOGGER.debug("Harvested {} of {} ruby bases from text", entries.size(), readings.size());
        return entries;
    }

    private static boolean isCommon(String base) {
        return (base.length() == 1 && COMMON_SINGLE_KANJI.contains(base)) || COMMON_WORDS.contains(base);
    }
}
