package com.vulnharvest.core.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.vulnharvest.core.api.IDetailEnricher;
import com.vulnharvest.core.api.IQueryClient;
import com.vulnharvest.core.http.RetryingCaller;
import com.vulnharvest.core.http.UpstreamException;
import com.vulnharvest.core.model.CollectionStats;
import com.vulnharvest.core.model.CollectorConfig;
import com.vulnharvest.core.model.ReferenceLink;
import com.vulnharvest.core.model.SearchPage;
import com.vulnharvest.core.model.SweepReport;
import com.vulnharvest.core.model.SweepState;
import com.vulnharvest.core.model.VulnRecord;
import com.vulnharvest.core.transform.RecordTransformer;
import com.vulnharvest.core.transform.RecordValidator;
import com.vulnharvest.core.util.Sleeper;
import com.vulnharvest.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 스윕 1건 실행기:
 *  PROBING(page 0, size 1) → PAGING(페이지 순차, 실패 페이지는 건너뜀) → MERGING → 종료 상태
 * 로컬 맵은 synchronizedMap: 셧다운 구조 시 다른 스레드가 복사할 수 있음.
 */
final class SweepRunner {
    private static final Logger LOG = LoggerFactory.getLogger(SweepRunner.class);
    private static final StructuredLog SLOG = StructuredLog.get(SweepRunner.class);

    private final CollectorConfig config;
    private final IQueryClient client;
    private final IDetailEnricher enricher;
    private final RecordTransformer transformer;
    private final RetryingCaller retry;
    private final Sleeper sleeper;
    private final CollectionStats stats;
    private final CollectionRun run;

    SweepRunner(CollectorConfig config, IQueryClient client, IDetailEnricher enricher,
                RetryingCaller retry, Sleeper sleeper, CollectionStats stats, CollectionRun run) {
        this.config = Objects.requireNonNull(config, "config");
        this.client = Objects.requireNonNull(client, "client");
        this.enricher = Objects.requireNonNull(enricher, "enricher");
        this.retry = Objects.requireNonNull(retry, "retry");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.stats = Objects.requireNonNull(stats, "stats");
        this.run = Objects.requireNonNull(run, "run");
        this.transformer = new RecordTransformer(config.getMaxDescriptionLength());
    }

    /**
     * 스윕 실행. 개별 실패는 보고서로 표현하고 예외를 던지지 않는다.
     * FAILED는 PROBING 단계 실패에만 쓴다. 그 뒤의 오류는 페이지나 hit 단위로 흡수하고,
     * 로컬 맵은 어떤 경우에도 finally에서 병합된다.
     */
    SweepReport run(String label, List<String> tokens) {
        final List<String> filter = (tokens == null) ? List.of() : List.copyOf(tokens);

        // ---- PROBING ----
        run.setState(label, SweepState.PROBING);
        long totalHits;
        try {
            totalHits = retry.call(label + "#probe", () -> client.fetchPage(0, 1, filter)).totalHits();
        } catch (UpstreamException e) {
            return probeFailed(label, e.getStatusCode(), e.getMessage());
        } catch (RuntimeException e) {
            return probeFailed(label, -1, e.toString());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            run.cancel();
            run.setState(label, SweepState.CANCELLED);
            return new SweepReport(label, SweepState.CANCELLED, 0, 0, 0, 0, 0, 0, null);
        }

        final int pageSize = config.getPageSize();
        final int localCap = config.getPerSweepCap();
        final long wanted = Math.min(totalHits, (long) localCap);
        final int pagesPlanned = (int) ((wanted + pageSize - 1) / pageSize);
        LOG.info("Sweep '{}': totalHits={}, pages={}", label, totalHits, pagesPlanned);

        // ---- PAGING ----
        run.setState(label, SweepState.PAGING);
        final Map<String, VulnRecord> local = Collections.synchronizedMap(new LinkedHashMap<>());
        run.registerLocal(local);

        int fetched = 0, failed = 0;
        boolean capped = false, cancelled = false;
        String error = null;
        int merged = 0;
        List<VulnRecord> toMerge = List.of();
        try {
            pages:
            for (int page = 0; page < pagesPlanned; page++) {
                if (isCancelled()) { cancelled = true; break; }
                if (run.collector().isFull()) { capped = true; break; }

                final int p = page;
                SearchPage sp;
                try {
                    sp = retry.call(label + "#p" + p, () -> client.fetchPage(p, pageSize, filter));
                    stats.pageFetched();
                    fetched++;
                } catch (UpstreamException | RuntimeException e) {
                    stats.pageFailed();
                    failed++;
                    int status = (e instanceof UpstreamException) ? ((UpstreamException) e).getStatusCode() : -1;
                    LOG.warn("Sweep '{}' page {} skipped: {}", label, p, e.getMessage());
                    SLOG.warn("page-failed", "sweep", label, "page", p, "status", status);
                    pause(config.getPageDelay(), page, pagesPlanned);
                    continue;
                }

                for (JsonNode hit : sp.hits()) {
                    if (isCancelled()) { cancelled = true; break pages; }
                    if (local.size() >= localCap) { capped = true; break pages; }
                    collectHit(label, hit, local);
                }

                if (local.size() >= localCap) { capped = true; break; }
                pause(config.getPageDelay(), page, pagesPlanned);
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            run.cancel();
            cancelled = true;
        } catch (RuntimeException e) {
            // 페이지 루프 자체의 예기치 못한 오류: 모은 만큼만 병합하고 종료
            error = e.toString();
            LOG.warn("Sweep '{}' stopped early: {}", label, error);
            SLOG.error("sweep-aborted", e, "sweep", label);
        } finally {
            // ---- MERGING ----
            run.setState(label, SweepState.MERGING);
            synchronized (local) {
                toMerge = new ArrayList<>(local.values());
            }
            try {
                merged = run.collector().mergeAll(toMerge);
            } finally {
                run.unregisterLocal(local);
            }
        }

        SweepState end = cancelled ? SweepState.CANCELLED
                : (capped || merged < toMerge.size()) ? SweepState.CAPPED
                : SweepState.COMPLETED;
        run.setState(label, end);

        SLOG.info("sweep-done", "sweep", label, "state", end.name(),
                "totalHits", totalHits, "pagesFetched", fetched, "pagesFailed", failed,
                "collected", toMerge.size(), "merged", merged);
        return new SweepReport(label, end, totalHits, pagesPlanned, fetched, failed, toMerge.size(), merged, error);
    }

    private SweepReport probeFailed(String label, int status, String reason) {
        LOG.warn("Sweep '{}' probe failed: {}", label, reason);
        SLOG.warn("sweep-failed", "sweep", label, "status", status, "reason", reason);
        run.setState(label, SweepState.FAILED);
        return SweepReport.failed(label, reason);
    }

    /** hit 1건 → 레코드. 변환 중 오류는 해당 hit만 버린다 */
    private void collectHit(String label, JsonNode hit, Map<String, VulnRecord> local) throws InterruptedException {
        VulnRecord rec;
        try {
            rec = transformer.transform(hit);
        } catch (RuntimeException e) {
            LOG.warn("Sweep '{}' hit dropped: {}", label, e.toString());
            rec = null;
        }
        if (rec == null) {
            stats.hitDropped();
            return;
        }
        if (config.isEnrichmentEnabled()) {
            List<ReferenceLink> refs = enrichSafely(rec.getId());
            stats.enrichCall(refs.isEmpty());
            if (!refs.isEmpty()) rec = rec.withReferences(refs);
            sleeper.sleep(config.getEnrichDelay());
        }
        List<String> problems = RecordValidator.violations(rec);
        if (!problems.isEmpty()) {
            stats.recordInvalid();
            LOG.warn("Record {} failed validation: {}", rec.getId(), problems);
        }
        local.put(rec.getId(), rec);
        run.markProcessed();
    }

    /** 보강기 오류는 빈 목록으로 취급, 레코드는 그대로 수집 */
    private List<ReferenceLink> enrichSafely(String id) {
        try {
            List<ReferenceLink> refs = enricher.enrich(id);
            return (refs == null) ? List.of() : refs;
        } catch (RuntimeException e) {
            LOG.warn("Enrichment of {} failed: {}", id, e.toString());
            SLOG.warn("enrich-failed", "id", id, "reason", e.toString());
            return List.of();
        }
    }

    private boolean isCancelled() {
        return run.isCancelled() || Thread.currentThread().isInterrupted();
    }

    /** 마지막 페이지 뒤에는 대기하지 않음 */
    private void pause(Duration d, int page, int pagesPlanned) throws InterruptedException {
        if (page < pagesPlanned - 1) sleeper.sleep(d);
    }
}
