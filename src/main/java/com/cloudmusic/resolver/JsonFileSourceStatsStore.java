package com.cloudmusic.resolver;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stores source statistics as a JSON object: {@code {"kuwo": {"success": 3, "failure": 1}, ...}}.
 * <p>
 * Each write goes to its own temporary sibling and is moved into place, so neither a crash nor a concurrent
 * writer leaves a half-written file behind. A file that cannot be parsed is moved aside to {@code <name>.invalid-<millis>} and treated as empty.
 */
public class JsonFileSourceStatsStore implements SourceStatsStore {
    private static final Logger logger = LoggerFactory.getLogger(JsonFileSourceStatsStore.class);
    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private static final TypeReference<LinkedHashMap<String, SourceStats.Counter>> TYPE = new TypeReference<>() {};

    private final Path file;

    public JsonFileSourceStatsStore(Path file) {
        this.file = file;
    }

    @Override
    public synchronized Map<String, SourceStats.Counter> load() throws IOException {
        if (!Files.exists(file)) {
            logger.debug("No source stats at {}; starting fresh.", file);
            return new LinkedHashMap<>();
        }
        try {
            Map<String, SourceStats.Counter> counters = MAPPER.readValue(file.toFile(), TYPE);
            return counters == null ? new LinkedHashMap<>() : counters;
        } catch (IOException e) {
            Path backup = file.resolveSibling(file.getFileName() + ".invalid-" + System.currentTimeMillis());
            try {
                Files.move(file, backup);
                logger.warn("Source stats file {} is unreadable ({}); backed up to {}", file, e.getMessage(), backup);
            } catch (IOException mv) {
                logger.warn("Source stats file {} is unreadable and could not be backed up: {}", file, mv.getMessage());
            }
            return new LinkedHashMap<>();
        }
    }

    @Override
    public synchronized void save(Map<String, SourceStats.Counter> counters) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path tmp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
        try {
            MAPPER.writeValue(tmp.toFile(), counters);
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                logger.debug("Atomic move unsupported for {}; replacing in place", file);
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    public Path getFile() {
        return file;
    }
}
