package jp.furigana.annotator.cli;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;
import jp.furigana.annotator.annotate.FuriganaAnnotator;
import jp.furigana.annotator.annotate.KuromojiTokenizer;
import jp.furigana.annotator.annotate.PlainTextAnnotator;
import jp.furigana.annotator.annotate.ProficiencyFilter;
import jp.furigana.annotator.annotate.Tokenizer;
import jp.furigana.annotator.config.Config;
import jp.furigana.annotator.config.ConfigLoader;
import jp.furigana.annotator.config.SystemEnvironmentReader;
import jp.furigana.annotator.dictionary.NameDictionary;
import jp.furigana.annotator.dictionary.NameDictionaryBuilder;
import jp.furigana.annotator.logging.LoggingConfigurator;
import jp.furigana.annotator.logging.SimpleJsonLayout;
import jp.furigana.annotator.markup.BookTextAssembler;
import jp.furigana.annotator.markup.MarkupWalker;
import jp.furigana.annotator.repair.LineRepair;
import jp.furigana.annotator.vocabulary.RubyHarvester;
import jp.furigana.annotator.vocabulary.RubyRegistry;
import jp.furigana.annotator.vocabulary.RubyRegistryCodec;
import jp.furigana.annotator.vocabulary.VocabularyMerger;
import jp.furigana.annotator.vocabulary.WordEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and the annotation passes.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    private static final String UNTITLED = "Untitled";

    private final ConfigLoader configLoader;
    private final Supplier<Tokenizer> tokenizerFactory;
    private final OutputWriter outputWriter;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), KuromojiTokenizer::new, OutputWriter.standardOutput());
    }

    CliApplication(ConfigLoader configLoader, Supplier<Tokenizer> tokenizerFactory, OutputWriter outputWriter) {
        this.configLoader = Objects.requireNonNull(configLoader, "configLoader");
        this.tokenizerFactory = Objects.requireNonNull(tokenizerFactory, "tokenizerFactory");
        this.outputWriter = Objects.requireNonNull(outputWriter, "outputWriter");
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }
        LoggingConfigurator.configure(config.logFormat());
        LOGGER.info("Running task {} on {} file(s) (filter={}, style={})", config.task().cliName(),
                config.inputs().size(), config.filterMode(), config.hiraganaStyle());

        try {
            switch (config.task()) {
                case ANNOTATE -> annotateBook(config);
                case ANNOTATE_TEXT -> annotateText(config);
                case EXTRACT_WORDS -> extractWords(config);
                case COLLECT_RUBY -> collectRuby(config);
                case HARVEST_TEXT -> harvestText(config);
                case REPAIR_LINES -> repairLines(config);
            }
            return 0;
        } catch (RuntimeException ex) {
            LOGGER.error("Task {} failed: {}", config.task().cliName(), ex.getMessage(), ex);
            return 1;
        } finally {
            MDC.remove(SimpleJsonLayout.DOCUMENT_KEY);
        }
    }

    private void annotateBook(Config config) {
        List<String> documents = new ArrayList<>(config.inputs().size());
        for (Path input : config.inputs()) {
            documents.add(outputWriter.read(input));
        }
        NameDictionary dictionary = new NameDictionaryBuilder().build(documents);
        MarkupWalker walker = new MarkupWalker(createAnnotator(config, dictionary), config.filterMode().isFiltering());

        List<String> chapters = new ArrayList<>(documents.size());
        for (int index = 0; index < documents.size(); index++) {
            MDC.put(SimpleJsonLayout.DOCUMENT_KEY, config.inputs().get(index).toString());
            chapters.add(walker.walkHtml(documents.get(index)));
            LOGGER.debug("Annotated chapter {}", index + 1);
        }
        MDC.remove(SimpleJsonLayout.DOCUMENT_KEY);

        String book = new BookTextAssembler().assemble(config.title().orElse(UNTITLED),
                config.author().orElse(null), chapters);
        outputWriter.write(config.output().orElse(null), book);
        config.output().ifPresent(path -> LOGGER.info("Wrote annotated text to {}", path));
    }

    private void annotateText(Config config) {
        PlainTextAnnotator annotator = new PlainTextAnnotator(createAnnotator(config, NameDictionary.empty()));
        boolean multiple = config.inputs().size() > 1;
        for (Path input : config.inputs()) {
            MDC.put(SimpleJsonLayout.DOCUMENT_KEY, input.toString());
            String annotated = annotator.annotate(outputWriter.read(input), config.filterMode().isFiltering());
            Path target = OutputWriter.targetFor(config.output().orElse(null), input, multiple);
            outputWriter.write(target, annotated);
            LOGGER.info("Annotated {}", input);
        }
    }

    private void extractWords(Config config) {
        VocabularyMerger merger = new VocabularyMerger();
        List<WordEntry> words = new ArrayList<>();
        for (Path input : config.inputs()) {
            MDC.put(SimpleJsonLayout.DOCUMENT_KEY, input.toString());
            List<WordEntry> extracted = merger.extractWords(outputWriter.read(input));
            LOGGER.info("Extracted {} words", extracted.size());
            words.addAll(extracted);
        }
        MDC.remove(SimpleJsonLayout.DOCUMENT_KEY);
        writeRegistry(config, words);
    }

    private void collectRuby(Config config) {
        RubyHarvester harvester = new RubyHarvester();
        List<WordEntry> pairs = new ArrayList<>();
        for (Path input : config.inputs()) {
            MDC.put(SimpleJsonLayout.DOCUMENT_KEY, input.toString());
            List<WordEntry> collected = harvester.collectAll(outputWriter.read(input));
            LOGGER.info("Collected {} ruby pairs", collected.size());
            pairs.addAll(collected);
        }
        MDC.remove(SimpleJsonLayout.DOCUMENT_KEY);
        writeRegistry(config, pairs);
    }

    private void harvestText(Config config) {
        RubyHarvester harvester = new RubyHarvester();
        StringBuilder combined = new StringBuilder();
        for (Path input : config.inputs()) {
            combined.append(outputWriter.read(input)).append('\n');
        }
        List<WordEntry> words = harvester.harvestText(combined.toString(), config.minOccurrences());
        LOGGER.info("Harvested {} words occurring at least {} time(s)", words.size(), config.minOccurrences());
        writeRegistry(config, words);
    }

    private void writeRegistry(Config config, List<WordEntry> words) {
        RubyRegistryCodec codec = new RubyRegistryCodec();
        Path output = config.output().orElse(null);
        RubyRegistry registry;
        if (output != null && Files.isRegularFile(output)) {
            RubyRegistry existing = codec.read(output);
            registry = existing.merge(words);
            LOGGER.info("Merged registry {}: {} -> {} entries", output, existing.size(), registry.size());
        } else {
            registry = RubyRegistry.of(config.title().orElse(UNTITLED), words);
        }
        if (output == null) {
            outputWriter.write(null, codec.toJson(registry));
        } else {
            codec.write(output, registry);
            LOGGER.info("Wrote {} registry entries to {}", registry.size(), output);
        }
    }

    private void repairLines(Config config) {
        LineRepair repair = new LineRepair();
        boolean multiple = config.inputs().size() > 1;
        for (Path input : config.inputs()) {
            MDC.put(SimpleJsonLayout.DOCUMENT_KEY, input.toString());
            String original = outputWriter.read(input);
            String repaired = repair.repair(original);
            int removed = lineCount(original) - lineCount(repaired);
            if (config.dryRun()) {
                LOGGER.info("Dry run: would merge {} line(s)", removed);
                continue;
            }
            if (removed == 0 && config.output().isEmpty()) {
                LOGGER.info("No split lines found");
                continue;
            }
            Path target = config.output()
                    .map(output -> OutputWriter.targetFor(output, input, multiple))
                    .orElse(input);
            outputWriter.write(target, repaired);
            LOGGER.info("Merged {} line(s) into {}", removed, target);
        }
    }

    private FuriganaAnnotator createAnnotator(Config config, NameDictionary dictionary) {
        return new FuriganaAnnotator(tokenizerFactory.get(), dictionary, ProficiencyFilter.elementary(),
                config.hiraganaStyle().preserveLongVowel());
    }

    private static int lineCount(String content) {
        return content.isEmpty() ? 0 : content.split("\n", -1).length;
    }
}
