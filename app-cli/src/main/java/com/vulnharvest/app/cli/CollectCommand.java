package com.vulnharvest.app.cli;

import com.vulnharvest.app.app.App;
import com.vulnharvest.app.app.ConfigSupport;
import com.vulnharvest.app.app.ShutdownRescue;
import com.vulnharvest.core.export.ResultAnalytics;
import com.vulnharvest.core.export.ResultExporter;
import com.vulnharvest.core.model.CollectionResult;
import com.vulnharvest.core.model.CollectorConfig;
import com.vulnharvest.core.service.CollectionRun;
import com.vulnharvest.core.service.CollectionService;
import com.vulnharvest.core.service.UpstreamUnavailableException;
import com.vulnharvest.core.util.ProgressListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;

/** 전수 수집 실행 → 결과 저장(+분석) */
@Command(
        name = "collect",
        mixinStandardHelpOptions = true,
        description = "업스트림 검색 API에서 CVE 레코드를 전수 수집한다"
)
public class CollectCommand implements Callable<Integer> {
    private static final Logger LOG = LoggerFactory.getLogger(CollectCommand.class);

    @Option(names = {"-c", "--config"}, description = "설정 파일 (기본: collector.yml, 없으면 기본값)")
    Path configFile = Path.of("collector.yml");

    @Option(names = {"--max-records"}, description = "전체 레코드 상한")
    Integer maxRecords;

    @Option(names = {"--page-delay"}, description = "페이지 간 대기(ms)")
    Long pageDelayMs;

    @Option(names = {"--concurrency"}, description = "동시 facet 스윕 수 K (무필터 스윕 제외)")
    Integer concurrency;

    @Option(names = {"-o", "--output"}, description = "결과 디렉터리")
    Path outputDir;

    @Option(names = {"--resume"}, description = "최신 체크포인트에서 재개")
    boolean resume;

    @Option(names = {"--no-analytics"}, description = "분석 파일 생성 생략")
    boolean noAnalytics;

    @Option(names = {"--checkpoints"}, description = "주기 체크포인트 활성화")
    boolean checkpoints;

    @Option(names = {"--no-enrich"}, description = "상세 페이지 보강 생략")
    boolean noEnrich;

    Map<String, String> env = System.getenv();
    PrintStream out = System.out;

    @Override
    public Integer call() {
        CollectorConfig cfg;
        try {
            cfg = buildConfig();
        } catch (IOException | RuntimeException e) {
            LOG.error("Invalid configuration: {}", e.getMessage());
            return App.EXIT_FAILURE;
        }

        CollectionService service = new CollectionService(cfg);
        CollectionRun run = resume ? service.resumeRun() : service.newRun();
        ShutdownRescue rescue = ShutdownRescue.install(run, service.checkpoints(), ShutdownRescue.DEFAULT_GRACE);

        CollectionResult result;
        try {
            result = service.collect(run, progressPrinter());
        } catch (UpstreamUnavailableException e) {
            LOG.error("Collection aborted: {}", e.getMessage());
            return App.EXIT_UPSTREAM_UNAVAILABLE;
        } finally {
            rescue.uninstall();
        }

        try {
            ResultExporter exporter = new ResultExporter(cfg.getOutputDir(), cfg.getOutputName());
            Path saved = exporter.save(result);
            out.printf(Locale.ROOT, "Saved %d records to %s%n", result.totalRecords(), saved);
            if (!noAnalytics) {
                Path a = exporter.saveAnalytics(ResultAnalytics.analyze(result.records()), Instant.now());
                out.printf(Locale.ROOT, "Analytics: %s%n", a);
            }
        } catch (IOException e) {
            LOG.error("Failed to save result: {}", e.getMessage());
            return App.EXIT_FAILURE;
        }

        out.printf(Locale.ROOT, "Sweeps ok=%d failed=%d, processed=%d, %.1f ms/record%n",
                result.succeededSweeps(), result.failedSweeps(), result.processedCount(),
                result.averageTimePerRecordMs());
        return App.EXIT_OK;
    }

    /** 파일 → 환경변수 → 명령행 순으로 덮어쓴 뒤 검증 */
    CollectorConfig buildConfig() throws IOException {
        CollectorConfig cfg = ConfigSupport.load(configFile);
        ConfigSupport.applyEnv(cfg, env);
        if (maxRecords != null) cfg.setMaxRecords(maxRecords);
        if (pageDelayMs != null) cfg.setPageDelay(Duration.ofMillis(pageDelayMs));
        if (concurrency != null) cfg.setConcurrency(concurrency);
        if (outputDir != null) cfg.setOutputDir(outputDir);
        if (checkpoints || resume) cfg.setCheckpointsEnabled(true);
        if (noEnrich) cfg.setEnrichmentEnabled(false);
        cfg.validate();
        return cfg;
    }

    private ProgressListener progressPrinter() {
        return (progress, phase, done, total) -> {
            if ("sweep".equals(phase) && done > 0) {
                out.printf(Locale.ROOT, "[%3.0f%%] sweeps %d/%d%n", progress * 100, done, total);
            }
        };
    }
}
