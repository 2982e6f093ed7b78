package jp.furigana.annotator.cli;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * Reads UTF-8 input files and writes results either to a file or to the console, always as UTF-8.
 */
public class OutputWriter {

    private final PrintStream console;

    public OutputWriter(OutputStream console) {
        this.console = new PrintStream(Objects.requireNonNull(console, "console"), true, StandardCharsets.UTF_8);
    }

    /**
     * Writer bound to the process's standard output, bypassing the platform default charset of {@code System.out}.
     */
    public static OutputWriter standardOutput() {
        return new OutputWriter(new FileOutputStream(FileDescriptor.out));
    }

    public String read(Path source) {
        try {
            return Files.readString(source, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read input: " + source, ex);
        }
    }

    public void write(Path target, String content) {
        if (target == null) {
            console.println(content);
            return;
        }
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, content, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write output: " + target, ex);
        }
    }

    /**
     * Target for one of several per-file results: inside {@code output} when it is a directory or when
     * more than one input is processed, otherwise {@code output} itself.
     */
    static Path targetFor(Path output, Path input, boolean multipleInputs) {
        if (output == null) {
            return null;
        }
        if (multipleInputs || Files.isDirectory(output)) {
            return output.resolve(input.getFileName());
        }
        return output;
    }
}
