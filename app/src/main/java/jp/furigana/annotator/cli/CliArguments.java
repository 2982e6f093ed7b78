package jp.furigana.annotator.cli;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import jp.furigana.annotator.config.FilterMode;
import jp.furigana.annotator.config.HiraganaStyle;
import jp.furigana.annotator.config.LogFormat;
import jp.furigana.annotator.config.Task;
import picocli.CommandLine;

@CommandLine.Command(name = "furigana-annotator", mixinStandardHelpOptions = true,
        description = "Adds furigana ruby markup to Japanese text and mines existing ruby into reading registries")
public class CliArguments {

    @CommandLine.Option(names = "--task", converter = TaskConverter.class,
            description = "annotate, annotate-text, extract-words, collect-ruby, harvest-text or repair-lines", paramLabel = "TASK")
    private Task task;

    @CommandLine.Option(names = "--filter", converter = FilterModeConverter.class,
            description = "Kanji to annotate: none (all) or n3 (only beyond JLPT N4)", paramLabel = "MODE")
    private FilterMode filterMode;

    @CommandLine.Option(names = "--hiragana-style", converter = HiraganaStyleConverter.class,
            description = "Long vowels in readings: full or long-vowel", paramLabel = "STYLE")
    private HiraganaStyle hiraganaStyle;

    @CommandLine.Option(names = {"-o", "--output"}, description = "Output file or directory", paramLabel = "PATH")
    private Path output;

    @CommandLine.Option(names = "--title", description = "Book title for assembled text and registries", paramLabel = "TITLE")
    private String title;

    @CommandLine.Option(names = "--author", description = "Author for assembled text", paramLabel = "AUTHOR")
    private String author;

    @CommandLine.Option(names = "--min-occurrences", description = "Minimum repeats for harvest-text entries", paramLabel = "COUNT")
    private Integer minOccurrences;

    @CommandLine.Option(names = "--dry-run", description = "Report line repairs without writing files")
    private boolean dryRun;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    @CommandLine.Parameters(paramLabel = "FILES", arity = "0..*", description = "Input files")
    private List<Path> inputs = new ArrayList<>();

    public Task task() {
        return task;
    }

    public FilterMode filterMode() {
        return filterMode;
    }

    public HiraganaStyle hiraganaStyle() {
        return hiraganaStyle;
    }

    public Path output() {
        return output;
    }

    public String title() {
        return title;
    }

    public String author() {
        return author;
    }

    public Integer minOccurrences() {
        return minOccurrences;
    }

    public boolean dryRun() {
        return dryRun;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public List<Path> inputs() {
        return inputs;
    }
}
