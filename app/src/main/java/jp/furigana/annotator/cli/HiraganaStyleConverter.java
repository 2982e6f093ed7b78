package jp.furigana.annotator.cli;

import jp.furigana.annotator.config.HiraganaStyle;
import picocli.CommandLine;

/**
 * Parses the {@code --hiragana-style} option.
 */
public class HiraganaStyleConverter implements CommandLine.ITypeConverter<HiraganaStyle> {
    @Override
    public HiraganaStyle convert(String value) {
        return HiraganaStyle.from(value);
    }
}
