// core/src/main/java/com/vulnharvest/core/service/CollectionService.java
package com.vulnharvest.core.service;

import com.vulnharvest.core.api.IDetailEnricher;
import com.vulnharvest.core.api.IQueryClient;
import com.vulnharvest.core.checkpoint.CheckpointManager;
import com.vulnharvest.core.checkpoint.PeriodicCheckpointer;
import com.vulnharvest.core.enrich.DetailPageEnricher;
import com.vulnharvest.core.http.DefaultRetryPolicy;
import com.vulnharvest.core.http.RetryingCaller;
import com.vulnharvest.core.http.SearchQueryClient;
import com.vulnharvest.core.model.Checkpoint;
import com.vulnharvest.core.model.CollectionResult;
import com.vulnharvest.core.model.CollectionStats;
import com.vulnharvest.core.model.CollectorConfig;
import com.vulnharvest.core.model.FacetFilter;
import com.vulnharvest.core.model.SweepReport;
import com.vulnharvest.core.model.SweepState;
import com.vulnharvest.core.model.VulnRecord;
import com.vulnharvest.core.util.DefaultSleeper;
import com.vulnharvest.core.util.ProgressListener;
import com.vulnharvest.core.util.Sleeper;
import com.vulnharvest.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 수집 오케스트레이터 (필터 팬아웃 스케줄러):
 *  - 무필터 스윕 1개는 즉시 전용 워커에서 시작
 *  - facet 스윕은 K(=concurrency)개씩 그룹으로 동시 실행, 그룹 완료 대기 후 groupDelay
 *  - 고정 스레드풀(K+1) → 동시 스윕 수 ≤ K+1
 *  - 개별 스윕 실패는 실행을 실패시키지 않음. 모든 프로브 실패(취소 아님)만 예외
 */
public final class CollectionService {

    static final String UNFILTERED = "unfiltered";

    private static final Logger LOG = LoggerFactory.getLogger(CollectionService.class);
    private static final StructuredLog SLOG = StructuredLog.get(CollectionService.class);

    private final CollectorConfig config;
    private final IQueryClient client;
    private final IDetailEnricher enricher;
    private final Sleeper sleeper;
    private final CheckpointManager checkpoints;
    private final CollectionStats stats = new CollectionStats();

    /** 기본 구현(실제 업스트림) */
    public CollectionService(CollectorConfig config) {
        this(config, new SearchQueryClient(config), new DetailPageEnricher(config),
                new DefaultSleeper(), new CheckpointManager(config));
    }

    /** DI/테스트용 */
    public CollectionService(CollectorConfig config, IQueryClient client, IDetailEnricher enricher,
                             Sleeper sleeper, CheckpointManager checkpoints) {
        this.config = Objects.requireNonNull(config, "config");
        this.config.validate();
        this.client = Objects.requireNonNull(client, "client");
        this.enricher = Objects.requireNonNull(enricher, "enricher");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.checkpoints = Objects.requireNonNull(checkpoints, "checkpoints");
    }

    /* =========================
       실행 핸들
       ========================= */

    /** 새 실행 핸들 */
    public CollectionRun newRun() {
        return new CollectionRun(config.getMaxRecords());
    }

    /** 최신 체크포인트가 있으면 그걸로 시드, 없으면 새 실행 */
    public CollectionRun resumeRun() {
        return checkpoints.loadLatest()
                .map(this::resumeRun)
                .orElseGet(() -> {
                    LOG.info("No checkpoint found, starting fresh");
                    return newRun();
                });
    }

    public CollectionRun resumeRun(Checkpoint cp) {
        CollectionRun run = CollectionRun.resumeFrom(config.getMaxRecords(), cp);
        LOG.info("Resuming from checkpoint {}: records={}, processed={}",
                cp.timestamp(), run.mergedCount(), run.processedCount());
        SLOG.info("collect-resume", "checkpoint", cp.timestamp().toString(),
                "records", run.mergedCount(), "processed", run.processedCount());
        return run;
    }

    public CheckpointManager checkpoints() { return checkpoints; }

    /* =========================
       실행 API
       ========================= */

    public CollectionResult collect() {
        return collect(newRun(), ProgressListener.NONE);
    }

    public CollectionResult collect(CollectionRun run, ProgressListener listener) {
        Objects.requireNonNull(run, "run");
        final ProgressListener pl = (listener != null) ? listener : ProgressListener.NONE;
        final long t0 = System.nanoTime();
        // facet 수보다 많은 워커는 놀기만 한다
        final int k = Math.min(config.getConcurrency(), Math.max(1, config.getFacets().size()));

        try {
            return doCollect(run, pl, k, t0);
        } finally {
            run.markFinished();
        }
    }

    private CollectionResult doCollect(CollectionRun run, ProgressListener pl, int k, long t0) {
        final List<FacetFilter> facets = config.getFacets();
        final int totalSweeps = 1 + facets.size();

        LOG.info("Collect start: sweeps={}, concurrency={}, pageSize={}, perSweepCap={}, maxRecords={}",
                totalSweeps, k, config.getPageSize(), config.getPerSweepCap(), config.getMaxRecords());
        SLOG.info("collect-start",
                "sweeps", totalSweeps,
                "cc", k,
                "pageSize", config.getPageSize(),
                "perSweepCap", config.getPerSweepCap(),
                "maxRecords", config.getMaxRecords(),
                "seeded", run.mergedCount());
        pl.onProgress(0.0, "sweep", 0, totalSweeps);

        if (checkpoints.isEnabled()) {
            run.setProcessedListener(new PeriodicCheckpointer(checkpoints, run, config.getCheckpointInterval()));
        }

        final RetryingCaller retry = new RetryingCaller(
                new DefaultRetryPolicy(config.getRetryAttempts(), config.getRetryBaseMs()), sleeper, stats);
        final SweepRunner runner = new SweepRunner(config, client, enricher, retry, sleeper, stats, run);
        final AtomicInteger inFlight = new AtomicInteger(0);
        final AtomicInteger done = new AtomicInteger(0);

        ExecutorService exec = Executors.newFixedThreadPool(k + 1, new NamedThreadFactory("sweep-worker"));
        SweepReport unfilteredReport = null;
        List<SweepReport> facetReports = new ArrayList<>(facets.size());
        try {
            // ---- 1) 무필터 스윕: 즉시 시작 ----
            Future<SweepReport> unfiltered = exec.submit(
                    () -> runTracked(runner, UNFILTERED, List.of(), inFlight, done, totalSweeps, pl));

            // ---- 2) facet 그룹: K개씩, 그룹 대기 후 groupDelay ----
            for (int from = 0; from < facets.size(); from += k) {
                List<FacetFilter> group = facets.subList(from, Math.min(facets.size(), from + k));
                if (run.isCancelled()) {
                    group.forEach(f -> facetReports.add(notStarted(run, f.label())));
                    continue;
                }
                List<Future<SweepReport>> futures = new ArrayList<>(group.size());
                for (FacetFilter f : group) {
                    futures.add(exec.submit(
                            () -> runTracked(runner, f.label(), List.of(f.token()), inFlight, done, totalSweeps, pl)));
                }
                for (int i = 0; i < futures.size(); i++) {
                    facetReports.add(await(futures.get(i), group.get(i).label(), run));
                }
                boolean more = from + k < facets.size();
                if (more && !run.isCancelled()) {
                    try {
                        sleeper.sleep(config.getGroupDelay());
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        run.cancel();
                    }
                }
            }

            // ---- 3) 무필터 스윕 대기 ----
            unfilteredReport = await(unfiltered, UNFILTERED, run);
        } finally {
            exec.shutdown();
            try {
                if (!exec.awaitTermination(30, TimeUnit.SECONDS)) exec.shutdownNow();
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                exec.shutdownNow();
            }
        }

        List<SweepReport> reports = new ArrayList<>(totalSweeps);
        reports.add(unfilteredReport);
        reports.addAll(facetReports);

        // FAILED는 프로브 실패에만 부여된다
        long failedProbes = reports.stream().filter(r -> r.state() == SweepState.FAILED).count();
        if (failedProbes == reports.size() && !run.isCancelled()) {
            LOG.error("All {} sweeps failed to probe upstream", failedProbes);
            SLOG.warn("collect-failed", "failedSweeps", failedProbes);
            throw new UpstreamUnavailableException(
                    "upstream unavailable: all " + failedProbes + " sweep probes failed", (int) failedProbes);
        }

        // ---- 4) 결과 조립 ----
        pl.onProgress(1.0, "merge", done.get(), totalSweeps);
        List<VulnRecord> records = run.collector().snapshot();
        records.sort(Comparator.comparing(VulnRecord::getId));
        long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0);

        CollectionResult result = new CollectionResult(Instant.now(), records.size(), records, reports,
                stats.snapshot(), run.processedCount(), durationMs);

        LOG.info("Collect done. records={}, processed={}, sweepsOk={}, sweepsFailed={}, cancelled={}, durationMs={}",
                result.totalRecords(), result.processedCount(), result.succeededSweeps(), result.failedSweeps(),
                run.isCancelled(), durationMs);
        SLOG.info("collect-done",
                "records", result.totalRecords(),
                "processed", result.processedCount(),
                "sweepsOk", result.succeededSweeps(),
                "sweepsFailed", result.failedSweeps(),
                "cancelled", run.isCancelled(),
                "maxObservedCC", result.runtime().maxObservedConcurrency(),
                "durationMs", durationMs);
        pl.onProgress(1.0, "done", done.get(), totalSweeps);
        return result;
    }

    private SweepReport runTracked(SweepRunner runner, String label, List<String> tokens,
                                   AtomicInteger inFlight, AtomicInteger done, int total, ProgressListener pl) {
        int cur = inFlight.incrementAndGet();
        stats.observeConcurrency(cur);
        try {
            return runner.run(label, tokens);
        } finally {
            inFlight.decrementAndGet();
            int d = done.incrementAndGet();
            try {
                pl.onProgress(Math.min(1.0, (double) d / total), "sweep", d, total);
            } catch (RuntimeException e) {
                LOG.debug("progress listener failed: {}", e.toString());
            }
        }
    }

    /**
     * 작업 예외 흡수. 프로브를 마치기 전이면 FAILED(프로브 실패로 집계),
     * 그 뒤라면 run 실패 판정에 끼지 않도록 CANCELLED로 남긴다.
     */
    private SweepReport await(Future<SweepReport> f, String label, CollectionRun run) {
        try {
            return f.get();
        } catch (ExecutionException e) {
            Throwable cause = (e.getCause() != null ? e.getCause() : e);
            LOG.warn("Sweep '{}' task failed: {}", label, cause.toString());
            SLOG.error("task-failed", cause, "sweep", label);
            SweepState seen = run.stateOf(label);
            if (seen == null || seen == SweepState.PENDING || seen == SweepState.PROBING) {
                run.setState(label, SweepState.FAILED);
                return SweepReport.failed(label, cause.toString());
            }
            run.setState(label, SweepState.CANCELLED);
            return new SweepReport(label, SweepState.CANCELLED, 0, 0, 0, 0, 0, 0, cause.toString());
        } catch (CancellationException ce) {
            run.setState(label, SweepState.CANCELLED);
            return notStartedReport(label);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            // 스윕 자신은 취소 토큰을 보고 병합 후 종료, 보고서만 CANCELLED로 대체
            run.cancel();
            return notStartedReport(label);
        }
    }

    private static SweepReport notStarted(CollectionRun run, String label) {
        run.setState(label, SweepState.CANCELLED);
        return notStartedReport(label);
    }

    private static SweepReport notStartedReport(String label) {
        return new SweepReport(label, SweepState.CANCELLED, 0, 0, 0, 0, 0, 0, null);
    }

    public CollectionStats.Snapshot getRuntimeSnapshot() {
        return stats.snapshot();
    }

    static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger seq = new AtomicInteger(1);
        NamedThreadFactory(String prefix) { this.prefix = prefix; }
        @Override public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + "-" + seq.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }
}
