package com.vulnharvest.core.export;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.vulnharvest.core.model.CollectionResult;
import com.vulnharvest.core.model.VulnRecord;
import com.vulnharvest.core.util.JsonMappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 결과 JSON 저장/로드.
 * 저장: 타임스탬프 파일 + _latest 사본. 로드: 결과 파일(records 필드) 또는 레코드 배열 둘 다 허용.
 */
public class ResultExporter {
    private static final Logger LOG = LoggerFactory.getLogger(ResultExporter.class);

    private final Path outDir;
    private final String name;
    private final ObjectMapper mapper = JsonMappers.create();

    public ResultExporter(Path outDir, String name) {
        this.outDir = Objects.requireNonNull(outDir, "outDir");
        this.name = Objects.requireNonNull(name, "name");
    }

    /** @return 타임스탬프 파일 경로 */
    public Path save(CollectionResult result) throws IOException {
        Objects.requireNonNull(result, "result");
        Files.createDirectories(outDir);
        Path file = ResultNaming.resultPath(outDir, name, result.collectedAt());
        writer().writeValue(file.toFile(), result);
        Files.copy(file, ResultNaming.latestPath(outDir, name), StandardCopyOption.REPLACE_EXISTING);
        LOG.info("Result saved: {} ({} records)", file, result.totalRecords());
        return file;
    }

    public Path saveAnalytics(ResultAnalytics.Report report, Instant at) throws IOException {
        Objects.requireNonNull(report, "report");
        Files.createDirectories(outDir);
        Path file = ResultNaming.analyticsPath(outDir, name, at == null ? Instant.now() : at);
        writer().writeValue(file.toFile(), report);
        LOG.info("Analytics saved: {}", file);
        return file;
    }

    /** 결과 파일에서 레코드만 읽는다. 형식 불일치는 IOException */
    public static List<VulnRecord> readRecords(Path file) throws IOException {
        ObjectMapper m = JsonMappers.create();
        JsonNode root = m.readTree(file.toFile());
        JsonNode arr = (root != null && root.isArray()) ? root : (root == null ? null : root.get("records"));
        if (arr == null || !arr.isArray()) {
            throw new IOException("no records array in " + file);
        }
        List<VulnRecord> out = new ArrayList<>(arr.size());
        for (JsonNode n : arr) {
            out.add(m.treeToValue(n, VulnRecord.class));
        }
        return out;
    }

    private ObjectWriter writer() {
        return mapper.writerWithDefaultPrettyPrinter();
    }
}
