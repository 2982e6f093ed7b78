package jp.furigana.annotator.config;

import jp.furigana.annotator.cli.CliArguments;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_TASK = "FURIGANA_TASK";
    static final String ENV_FILTER = "FURIGANA_FILTER";
    static final String ENV_HIRAGANA_STYLE = "FURIGANA_HIRAGANA_STYLE";
    static final String ENV_OUTPUT = "FURIGANA_OUTPUT";
    static final String ENV_MIN_OCCURRENCES = "FURIGANA_MIN_OCCURRENCES";
    static final String ENV_DRY_RUN = "FURIGANA_DRY_RUN";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";

    private static final int DEFAULT_MIN_OCCURRENCES = 1;

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        Task task = arguments.task() != null
                ? arguments.task()
                : environmentReader.value(ENV_TASK).map(Task::from).orElse(Task.ANNOTATE);
        FilterMode filterMode = arguments.filterMode() != null
                ? arguments.filterMode()
                : environmentReader.value(ENV_FILTER).map(FilterMode::from).orElse(FilterMode.NONE);
        HiraganaStyle hiraganaStyle = arguments.hiraganaStyle() != null
                ? arguments.hiraganaStyle()
                : environmentReader.value(ENV_HIRAGANA_STYLE).map(HiraganaStyle::from).orElse(HiraganaStyle.FULL);
        LogFormat logFormat = resolveLogFormat(arguments);

        Optional<Path> output = Optional.ofNullable(arguments.output())
                .or(() -> environmentReader.value(ENV_OUTPUT).map(Path::of));

        int minOccurrences = resolveMinOccurrences(arguments);
        boolean dryRun = resolveDryRun(arguments);

        List<Path> inputs = arguments.inputs() == null ? List.of() : arguments.inputs();
        if (inputs.isEmpty()) {
            throw new IllegalArgumentException("at least one input file must be provided");
        }

        return new Config(task, inputs, output, filterMode, hiraganaStyle, logFormat,
                Optional.ofNullable(arguments.title()).filter(ConfigLoader::isNotBlank),
                Optional.ofNullable(arguments.author()).filter(ConfigLoader::isNotBlank),
                minOccurrences, dryRun);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.value(ENV_LOG_FORMAT)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private int resolveMinOccurrences(CliArguments arguments) {
        Integer cliValue = arguments.minOccurrences();
        if (cliValue != null) {
            if (cliValue < 1) {
                throw new IllegalArgumentException("--min-occurrences must be at least 1");
            }
            return cliValue;
        }
        return environmentReader.value(ENV_MIN_OCCURRENCES)
                .map(ConfigLoader::parsePositiveInteger)
                .orElse(DEFAULT_MIN_OCCURRENCES);
    }

    private boolean resolveDryRun(CliArguments arguments) {
        if (arguments.dryRun()) {
            return true;
        }
        return environmentReader.value(ENV_DRY_RUN)
                .map(value -> value.equalsIgnoreCase("true") || value.equals("1"))
                .orElse(false);
    }

    private static int parsePositiveInteger(String raw) {
        try {
            int value = Integer.parseInt(raw);
            if (value < 1) {
                throw new IllegalArgumentException(ENV_MIN_OCCURRENCES + " must be at least 1");
            }
            return value;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(ENV_MIN_OCCURRENCES + " must be an integer", ex);
        }
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }
}
