package com.vulnharvest.core.export;

import com.vulnharvest.core.model.CollectionResult;
import com.vulnharvest.core.model.CollectionStats;
import com.vulnharvest.core.model.SweepReport;
import com.vulnharvest.core.model.SweepState;
import com.vulnharvest.core.model.VulnRecord;
import com.vulnharvest.core.model.Severity;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ResultExporterTest {

    @TempDir
    Path tmp;

    private static CollectionResult result(List<VulnRecord> records) {
        return new CollectionResult(Instant.parse("2025-02-03T04:05:06Z"), records.size(), records,
                List.of(new SweepReport("unfiltered", SweepState.COMPLETED, 2, 1, 1, 0, 2, 2, null)),
                new CollectionStats().snapshot(), 2, 1500);
    }

    @Test
    void save_shouldWriteTimestampedAndLatestFiles() throws Exception {
        // given
        List<VulnRecord> records = List.of(
                VulnRecord.builder().id("CVE-2024-1").severity(Severity.HIGH).score(8.0)
                        .publishedDate(LocalDate.of(2024, 5, 1)).build(),
                VulnRecord.builder().id("CVE-2024-2").build());
        ResultExporter exporter = new ResultExporter(tmp, "cve data");

        // when
        Path out = exporter.save(result(records));

        // then
        assertTrue(Files.exists(out), "timestamped file should exist");
        assertTrue(out.getFileName().toString().matches("cve-data_\\d{8}-\\d{6}\\.json"), out.toString());
        Path latest = tmp.resolve("cve-data_latest.json");
        assertTrue(Files.exists(latest), "latest copy should exist");
        assertEquals(Files.readString(out), Files.readString(latest));

        String json = Files.readString(out);
        assertTrue(json.contains("\"totalRecords\" : 2"), "totalRecords field");
        assertTrue(json.contains("\"sweeps\""), "sweeps section exists");
        assertTrue(json.contains("\"2024-05-01\""), "dates written as ISO strings");

        assertEquals(records, ResultExporter.readRecords(out));
    }

    @Test
    void readRecords_acceptsBareArray() throws Exception {
        Path f = tmp.resolve("records.json");
        Files.writeString(f, "[{\"id\":\"CVE-2020-1\",\"severity\":\"LOW\",\"unknownField\":1}]");

        List<VulnRecord> rs = ResultExporter.readRecords(f);

        assertEquals(1, rs.size());
        assertEquals(Severity.LOW, rs.get(0).getSeverity());
    }

    @Test
    void readRecords_rejectsFileWithoutRecords() throws Exception {
        Path f = tmp.resolve("other.json");
        Files.writeString(f, "{\"meta\":{}}");

        assertThrows(IOException.class, () -> ResultExporter.readRecords(f));
    }

    @Test
    void saveAnalytics_usesAnalyticsName() throws Exception {
        ResultExporter exporter = new ResultExporter(tmp, "cve_data");
        Path out = exporter.saveAnalytics(ResultAnalytics.analyze(List.of()), Instant.now());

        assertTrue(out.getFileName().toString().startsWith("cve_data_analytics_"));
        assertTrue(Files.readString(out).contains("\"severityDistribution\""));
    }
}
