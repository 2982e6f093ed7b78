package jp.furigana.annotator.config;

import java.util.Locale;

/**
 * Operation the CLI runs over its input files.
 */
public enum Task {
    ANNOTATE("annotate"),
    ANNOTATE_TEXT("annotate-text"),
    EXTRACT_WORDS("extract-words"),
    COLLECT_RUBY("collect-ruby"),
    HARVEST_TEXT("harvest-text"),
    REPAIR_LINES("repair-lines");

    private final String cliName;

    Task(String cliName) {
        this.cliName = cliName;
    }

    public String cliName() {
        return cliName;
    }

    public static Task from(String raw) {
        if (raw == null || raw.isBlank()) {
            return ANNOTATE;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (Task task : values()) {
            if (task.cliName.equals(normalized)) {
                return task;
            }
        }
        throw new IllegalArgumentException("Unsupported task: " + raw);
    }
}
