package jp.furigana.annotator.config;

import java.util.Optional;

/**
 * Source of {@code FURIGANA_*} and {@code LOG_FORMAT} fallbacks for options missing on the command line.
 */
@FunctionalInterface
public interface EnvironmentReader {
    Optional<String> get(String key);

    /**
     * Trimmed value of {@code key}, empty when unset or blank.
     */
    default Optional<String> value(String key) {
        return get(key).map(String::trim).filter(value -> !value.isEmpty());
    }
}
