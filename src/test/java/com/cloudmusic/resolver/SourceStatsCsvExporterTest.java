package com.cloudmusic.resolver;

import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class SourceStatsCsvExporterTest {

    @Test
    void testWriteStatsToCsv(@TempDir Path dir) throws IOException, CsvException {
        Map<String, SourceStats.Counter> counters = new LinkedHashMap<>();
        counters.put("gdstudio", new SourceStats.Counter(3, 1));
        counters.put("kuwo", new SourceStats.Counter(0, 2));

        Path written = new SourceStatsCsvExporter(dir.resolve("out")).export(counters, "source stats.csv");

        assertEquals("source_stats.csv", written.getFileName().toString());
        try (Reader in = Files.newBufferedReader(written, StandardCharsets.UTF_8);
             CSVReader reader = new CSVReader(in)) {
            List<String[]> lines = reader.readAll();
            assertEquals(3, lines.size());
            assertArrayEquals(new String[]{"Name", "Successes", "Failures", "SuccessRate"}, lines.get(0));
            assertArrayEquals(new String[]{"gdstudio", "3", "1", "0.750"}, lines.get(1));
            assertArrayEquals(new String[]{"kuwo", "0", "2", "0.000"}, lines.get(2));
        }
    }

    @Test
    void rejectsMissingFilename(@TempDir Path dir) {
        SourceStatsCsvExporter exporter = new SourceStatsCsvExporter(dir);
        assertThrows(IllegalArgumentException.class, () -> exporter.export(Map.of(), " "));
        assertThrows(IllegalArgumentException.class, () -> exporter.export(null, "x.csv"));
    }
}
