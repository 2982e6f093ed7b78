package jp.furigana.annotator.dictionary;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a {@link NameDictionary} from the ruby annotations already present in a collection of documents.
 * When a term carries several readings the most frequent one wins; equal counts keep the reading seen first.
 */
public class NameDictionaryBuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(NameDictionaryBuilder.class);

    public NameDictionary build(List<String> documents) {
        Objects.requireNonNull(documents, "documents");
        Map<String, Map<String, Integer>> frequencies = new LinkedHashMap<>();
        int skipped = 0;
        for (int index = 0; index < documents.size(); index++) {
            String html = documents.get(index);
            try {
                Document document = Jsoup.parse(Objects.requireNonNull(html, "document content"));
                count(document, frequencies);
            } catch (RuntimeException ex) {
                skipped++;
                LOGGER.warn("Skipping document {} while building name dictionary: {}", index, ex.getMessage());
            }
        }
        NameDictionary dictionary = resolve(frequencies);
        LOGGER.info("Built name dictionary with {} terms from {} documents ({} skipped)",
                dictionary.size(), documents.size(), skipped);
        return dictionary;
    }

    public NameDictionary buildFromElements(List<? extends Element> roots) {
        Objects.requireNonNull(roots, "roots");
        Map<String, Map<String, Integer>> frequencies = new LinkedHashMap<>();
        for (Element root : roots) {
            count(root, frequencies);
        }
        return resolve(frequencies);
    }

    private void count(Element root, Map<String, Map<String, Integer>> frequencies) {
        for (RubyPair pair : RubyPairExtractor.extractAll(root)) {
            frequencies.computeIfAbsent(pair.base(), key -> new LinkedHashMap<>())
                    .merge(pair.reading(), 1, Integer::sum);
        }
    }

    private NameDictionary resolve(Map<String, Map<String, Integer>> frequencies) {
        Map<String, String> readings = new LinkedHashMap<>();
        frequencies.forEach((term, candidates) -> {
            String best = null;
            int bestCount = 0;
            // strict comparison keeps the first-seen reading on ties
            for (Map.Entry<String, Integer> candidate : candidates.entrySet()) {
                if (candidate.getValue() > bestCount) {
                    best = candidate.getKey();
                    bestCount = candidate.getValue();
                }
            }
            if (candidates.size() > 1) {
                LOGGER.debug("Resolved {} candidate readings for {} to {}", candidates.size(), term, best);
            }
            readings.put(term, best);
        });
        return NameDictionary.of(readings);
    }
}
