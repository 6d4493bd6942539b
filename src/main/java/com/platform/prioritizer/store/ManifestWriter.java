package com.platform.prioritizer.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.platform.prioritizer.domain.RunManifest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Persists run manifests as {@code manifest-<runId>.json} under the output directory.
 * Does nothing when no directory is configured.
 */
public class ManifestWriter {

    private static final Logger log = LoggerFactory.getLogger(ManifestWriter.class);

    private final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);
    private final Path outputDir;

    public ManifestWriter(Path outputDir) {
        this.outputDir = outputDir;
    }

    public Optional<Path> write(RunManifest manifest) {
        if (outputDir == null) {
            return Optional.empty();
        }
        Path target = outputDir.resolve("manifest-" + manifest.runId() + ".json");
        try {
            Files.createDirectories(outputDir);
            mapper.writeValue(target.toFile(), manifest);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write manifest " + target, e);
        }
        log.info("Run manifest written to {}", target);
        return Optional.of(target);
    }

    public RunManifest read(Path path) {
        try {
            return mapper.readValue(path.toFile(), RunManifest.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read manifest " + path, e);
        }
    }
}
