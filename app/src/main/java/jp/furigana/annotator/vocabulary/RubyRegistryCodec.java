package jp.furigana.annotator.vocabulary;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes {@link RubyRegistry} documents as JSON.
 */
public class RubyRegistryCodec {

    private final ObjectMapper objectMapper;

    public RubyRegistryCodec() {
        this.objectMapper = new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public String toJson(RubyRegistry registry) {
        try {
            return objectMapper.writeValueAsString(registry);
        } catch (JsonProcessingException ex) {
            throw new UncheckedIOException("Failed to serialize ruby registry", ex);
        }
    }

    public RubyRegistry fromJson(String json) {
        try {
            RubyRegistry registry = objectMapper.readValue(json, RubyRegistry.class);
            if (registry == null) {
                throw new IllegalArgumentException("Ruby registry document is empty");
            }
            return registry;
        } catch (JsonProcessingException ex) {
            throw new UncheckedIOException("Failed to parse ruby registry", ex);
        }
    }

    public RubyRegistry read(Path path) {
        try {
            return fromJson(Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read ruby registry: " + path, ex);
        }
    }

    public void write(Path path, RubyRegistry registry) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(path, toJson(registry), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write ruby registry: " + path, ex);
        }
    }
}
