package jp.furigana.annotator.repair;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rejoins lines that were broken at a ruby boundary during extraction, e.g. a lone {@code 襖} line followed
 * by {@code を開け閉めする}. Passes repeat until nothing merges, up to a fixed limit.
 */
public class LineRepair {

    private static final Logger LOGGER = LoggerFactory.getLogger(LineRepair.class);

    static final int MAX_PASSES = 5;

    public String repair(String content) {
        if (content == null || content.isEmpty()) {
            return content;
        }
        return String.join("\n", repair(Arrays.asList(content.split("\n", -1))));
    }

    public List<String> repair(List<String> lines) {
        List<String> current = new ArrayList<>(lines);
        int merges = 0;
        for (int pass = 0; pass < MAX_PASSES; pass++) {
            PassResult result = runPass(current);
            current = result.lines();
            merges += result.merges();
            if (result.merges() == 0) {
                break;
            }
        }
        if (merges > 0) {
            LOGGER.debug("Merged {} split lines ({} -> {})", merges, lines.size(), current.size());
        }
        return current;
    }

    private PassResult runPass(List<String> lines) {
        List<String> result = new ArrayList<>(lines.size());
        int merges = 0;
        int index = 0;
        while (index < lines.size()) {
            String line = lines.get(index);

            if (!result.isEmpty() && LineMergeRules.shouldMergeWithPrevious(result.get(result.size() - 1), line)) {
                result.set(result.size() - 1, result.get(result.size() - 1) + line.strip());
                merges++;
                index++;
                continue;
            }

            while (index + 1 < lines.size() && LineMergeRules.shouldMergeWithNext(line, lines.get(index + 1))) {
                line = line.stripTrailing() + lines.get(index + 1).strip();
                merges++;
                index++;
            }

            result.add(line);
            index++;
        }
        return new PassResult(result, merges);
    }

    private record PassResult(List<String> lines, int merges) {
    }
}
