package com.vulnharvest.core.checkpoint;

import com.vulnharvest.core.service.CollectionRun;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/** 처리 건수가 interval의 배수가 될 때마다 체크포인트 1회. 저장 중 겹치는 트리거는 건너뜀 */
public final class PeriodicCheckpointer implements CollectionRun.ProcessedListener {
    private final CheckpointManager manager;
    private final CollectionRun run;
    private final int interval;
    private final AtomicBoolean saving = new AtomicBoolean(false);

    public PeriodicCheckpointer(CheckpointManager manager, CollectionRun run, int interval) {
        this.manager = Objects.requireNonNull(manager, "manager");
        this.run = Objects.requireNonNull(run, "run");
        this.interval = Math.max(1, interval);
    }

    @Override
    public void onProcessed(long processedCount) {
        if (processedCount <= 0 || processedCount % interval != 0) return;
        if (!saving.compareAndSet(false, true)) return;
        try {
            manager.trySave(run.rescueSnapshot(), processedCount);
        } finally {
            saving.set(false);
        }
    }
}
