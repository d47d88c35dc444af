package com.grantharvest.crawl.service;

import com.grantharvest.crawl.model.Grant;
import com.grantharvest.crawl.model.StoredGrant;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;

class GrantCsvExporterTest {
    private final GrantCsvExporter exporter = new GrantCsvExporter();

    @TempDir
    Path tempDir;

    @Test
    void writesOneRowPerGrantWithSortedGenres() throws Exception {
        Grant grant = new Grant(
            "Poets & Writers",
            "Prize, with comma",
            "$1,000",
            "$10",
            "May 1",
            "Poetry, Fiction",
            "Line one \"quoted\"",
            "https://grants.test/grants/1",
            null
        );
        Path target = tempDir.resolve("out/grants.csv");

        int rows = exporter.export(List.of(new StoredGrant(42L, grant, Set.of("Poetry", "Fiction"))), target);

        assertEquals(1, rows);
        try (Reader reader = Files.newBufferedReader(target, StandardCharsets.UTF_8);
             CSVParser parser = CSVFormat.DEFAULT.builder()
                 .setHeader()
                 .setSkipHeaderRecord(true)
                 .build()
                 .parse(reader)) {
            List<CSVRecord> records = parser.getRecords();
            assertEquals(1, records.size());
            CSVRecord record = records.get(0);
            assertEquals("42", record.get("id"));
            assertEquals("Prize, with comma", record.get("title"));
            assertEquals("Fiction, Poetry", record.get("genres"));
            assertEquals("Line one \"quoted\"", record.get("description"));
            assertEquals("", record.get("extra_info"));
        }
    }
}
