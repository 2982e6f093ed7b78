package jp.furigana.annotator.config;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable runtime configuration assembled from CLI arguments and environment values.
 */
public record Config(
        Task task,
        List<Path> inputs,
        Optional<Path> output,
        FilterMode filterMode,
        HiraganaStyle hiraganaStyle,
        LogFormat logFormat,
        Optional<String> title,
        Optional<String> author,
        int minOccurrences,
        boolean dryRun
) {

    public Config {
        Objects.requireNonNull(task, "task");
        inputs = inputs == null ? List.of() : List.copyOf(inputs);
        if (inputs.isEmpty()) {
            throw new IllegalArgumentException("at least one input file must be provided");
        }
        output = output == null ? Optional.empty() : output;
        filterMode = Objects.requireNonNull(filterMode, "filterMode");
        hiraganaStyle = Objects.requireNonNull(hiraganaStyle, "hiraganaStyle");
        logFormat = Objects.requireNonNull(logFormat, "logFormat");
        title = title == null ? Optional.empty() : title;
        author = author == null ? Optional.empty() : author;
        if (minOccurrences < 1) {
            throw new IllegalArgumentException("minOccurrences must be at least 1");
        }
    }
}
