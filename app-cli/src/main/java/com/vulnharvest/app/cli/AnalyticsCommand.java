package com.vulnharvest.app.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.vulnharvest.app.app.App;
import com.vulnharvest.core.export.ResultAnalytics;
import com.vulnharvest.core.export.ResultExporter;
import com.vulnharvest.core.model.VulnRecord;
import com.vulnharvest.core.util.JsonMappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Callable;

/** 저장된 결과 파일 분석 */
@Command(
        name = "analytics",
        mixinStandardHelpOptions = true,
        description = "결과 파일의 통계를 계산한다"
)
public class AnalyticsCommand implements Callable<Integer> {
    private static final Logger LOG = LoggerFactory.getLogger(AnalyticsCommand.class);

    @Parameters(index = "0", description = "결과 JSON 파일")
    Path file;

    @Option(names = {"-o", "--output"}, description = "분석 파일 저장 디렉터리 (없으면 표준출력만)")
    Path outputDir;

    @Option(names = {"--name"}, description = "분석 파일 이름 접두 (기본: cve_data)")
    String name = "cve_data";

    PrintStream out = System.out;

    @Override
    public Integer call() {
        List<VulnRecord> records;
        try {
            records = ResultExporter.readRecords(file);
        } catch (IOException e) {
            LOG.error("Cannot read {}: {}", file, e.getMessage());
            return App.EXIT_FAILURE;
        }

        ResultAnalytics.Report report = ResultAnalytics.analyze(records);
        try {
            out.println(JsonMappers.create().writerWithDefaultPrettyPrinter().writeValueAsString(report));
            if (outputDir != null) {
                Path saved = new ResultExporter(outputDir, name).saveAnalytics(report, Instant.now());
                out.println("Analytics saved: " + saved);
            }
        } catch (JsonProcessingException e) {
            LOG.error("Cannot render analytics: {}", e.getOriginalMessage());
            return App.EXIT_FAILURE;
        } catch (IOException e) {
            LOG.error("Cannot save analytics: {}", e.getMessage());
            return App.EXIT_FAILURE;
        }
        return App.EXIT_OK;
    }
}
