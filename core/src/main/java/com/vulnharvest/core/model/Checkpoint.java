package com.vulnharvest.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/** 불변 체크포인트: 생성 시각 + 당시 처리 건수 + 레코드 스냅샷 */
public record Checkpoint(Instant timestamp, long processedCount, List<VulnRecord> records) {
    public Checkpoint {
        Objects.requireNonNull(timestamp, "timestamp");
        records = (records == null) ? List.of() : List.copyOf(records);
    }
}
