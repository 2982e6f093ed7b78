package jp.furigana.annotator.cli;

import jp.furigana.annotator.config.FilterMode;
import picocli.CommandLine;

/**
 * Parses the {@code --filter} option.
 */
public class FilterModeConverter implements CommandLine.ITypeConverter<FilterMode> {
    @Override
    public FilterMode convert(String value) {
        return FilterMode.from(value);
    }
}
