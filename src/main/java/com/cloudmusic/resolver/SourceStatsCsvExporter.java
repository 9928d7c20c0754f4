package com.cloudmusic.resolver;

import com.opencsv.CSVWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

/**
 * Exports provider and source success counters to CSV using OpenCSV.
 * <p>
 * Columns: Name, Successes, Failures, SuccessRate. Rows follow the map's iteration order.
 *
 * @author Music Resolver Team
 * @since 1.0
 */
public class SourceStatsCsvExporter {
    private static final Logger logger = LoggerFactory.getLogger(SourceStatsCsvExporter.class);
    static final String[] HEADER = {"Name", "Successes", "Failures", "SuccessRate"};

    private final Path outputDir;

    public SourceStatsCsvExporter(Path outputDir) {
        this.outputDir = outputDir;
    }

    /**
     * Writes the counters to {@code filename} inside the output directory.
     * @param counters Counters keyed by provider or source name
     * @param filename Output file name; unsafe characters are replaced
     * @return Path of the written file
     * @throws IOException if the directory or file cannot be written
     */
    public Path export(Map<String, SourceStats.Counter> counters, String filename) throws IOException {
        if (counters == null) {
            throw new IllegalArgumentException("Counters cannot be null");
        }
        if (filename == null || filename.isBlank()) {
            throw new IllegalArgumentException("Filename cannot be null or empty");
        }
        Files.createDirectories(outputDir);
        Path target = outputDir.resolve(Utils.sanitizeFilename(filename));
        try (Writer out = Files.newBufferedWriter(target, StandardCharsets.UTF_8);
             CSVWriter writer = new CSVWriter(out)) {
            writer.writeNext(HEADER);
            for (Map.Entry<String, SourceStats.Counter> entry : counters.entrySet()) {
                SourceStats.Counter counter = entry.getValue();
                writer.writeNext(new String[]{
                    entry.getKey(),
                    Integer.toString(counter.success()),
                    Integer.toString(counter.failure()),
                    String.format(Locale.ROOT, "%.3f", counter.successRate())
                });
            }
        }
        logger.info("Wrote {} stats rows to {}", counters.size(), target);
        return target;
    }
}
