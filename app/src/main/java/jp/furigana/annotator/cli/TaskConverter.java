package jp.furigana.annotator.cli;

import jp.furigana.annotator.config.Task;
import picocli.CommandLine;

/**
 * Parses the {@code --task} option, accepting names such as {@code annotate-text}.
 */
public class TaskConverter implements CommandLine.ITypeConverter<Task> {
    @Override
    public Task convert(String value) {
        return Task.from(value);
    }
}
