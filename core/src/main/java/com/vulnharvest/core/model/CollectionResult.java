package com.vulnharvest.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * 수집 실행 결과.
 * records는 id 오름차순. sweeps/runtime은 리포트용 메타.
 */
public record CollectionResult(Instant collectedAt,
                               int totalRecords,
                               List<VulnRecord> records,
                               List<SweepReport> sweeps,
                               CollectionStats.Snapshot runtime,
                               long processedCount,
                               long durationMs) {

    public CollectionResult {
        Objects.requireNonNull(collectedAt, "collectedAt");
        records = (records == null) ? List.of() : List.copyOf(records);
        sweeps = (sweeps == null) ? List.of() : List.copyOf(sweeps);
        totalRecords = records.size();
    }

    public long succeededSweeps() {
        return sweeps.stream().filter(s -> s.state().isSuccess()).count();
    }

    public long failedSweeps() {
        return sweeps.stream().filter(s -> s.state() == SweepState.FAILED).count();
    }

    /** 레코드당 평균 처리 시간(ms). 처리 0건이면 0 */
    public double averageTimePerRecordMs() {
        return processedCount > 0 ? (double) durationMs / processedCount : 0.0;
    }
}
