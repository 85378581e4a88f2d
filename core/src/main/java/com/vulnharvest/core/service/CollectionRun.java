package com.vulnharvest.core.service;

import com.vulnharvest.core.collect.DedupCollector;
import com.vulnharvest.core.model.Checkpoint;
import com.vulnharvest.core.model.SweepState;
import com.vulnharvest.core.model.VulnRecord;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 실행 1회의 핸들: 취소 토큰 + 공유 컬렉터 + 처리 카운터 + 진행 상태.
 * 셧다운 훅은 전역 상태 대신 이 핸들을 명시적으로 받는다.
 */
public final class CollectionRun {

    /** 처리 건수 증가 알림(주기 체크포인트 트리거) */
    @FunctionalInterface
    public interface ProcessedListener {
        void onProcessed(long processedCount);
    }

    private final DedupCollector collector;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final AtomicLong processed = new AtomicLong(0);
    private final AtomicInteger completedSweeps = new AtomicInteger(0);
    private final AtomicInteger failedSweeps = new AtomicInteger(0);
    private final Map<String, SweepState> states = new ConcurrentHashMap<>();
    private final Set<Map<String, VulnRecord>> inFlightLocals = ConcurrentHashMap.newKeySet();
    private final CountDownLatch finished = new CountDownLatch(1);
    private volatile ProcessedListener processedListener;

    public CollectionRun(int capacity) {
        this.collector = new DedupCollector(capacity);
    }

    /** 체크포인트에서 재개: 컬렉터와 처리 카운터를 시드 */
    public static CollectionRun resumeFrom(int capacity, Checkpoint cp) {
        Objects.requireNonNull(cp, "checkpoint");
        CollectionRun run = new CollectionRun(capacity);
        run.collector.mergeAll(cp.records());
        run.processed.set(Math.max(0, cp.processedCount()));
        return run;
    }

    // ===== 취소 =====
    public void cancel() { cancelled.set(true); }
    public boolean isCancelled() { return cancelled.get(); }

    // ===== 컬렉터/카운터 =====
    public DedupCollector collector() { return collector; }
    public long processedCount() { return processed.get(); }
    public int mergedCount() { return collector.size(); }

    void setProcessedListener(ProcessedListener l) { this.processedListener = l; }

    /** 레코드 1건 처리 완료. 반환: 증가 후 값 */
    long markProcessed() {
        long n = processed.incrementAndGet();
        ProcessedListener l = processedListener;
        if (l != null) l.onProcessed(n);
        return n;
    }

    // ===== 스윕 상태 =====
    void setState(String label, SweepState state) {
        states.put(label, state);
        if (state == SweepState.FAILED) failedSweeps.incrementAndGet();
        else if (state.isTerminal()) completedSweeps.incrementAndGet();
    }

    public Map<String, SweepState> sweepStates() { return Map.copyOf(states); }
    SweepState stateOf(String label) { return states.get(label); }
    public int completedSweeps() { return completedSweeps.get(); }
    public int failedSweeps() { return failedSweeps.get(); }

    // ===== 진행 중 로컬 맵(셧다운 구조용) =====
    void registerLocal(Map<String, VulnRecord> local) { inFlightLocals.add(local); }
    void unregisterLocal(Map<String, VulnRecord> local) { inFlightLocals.remove(local); }

    /**
     * 컬렉터 + 아직 병합되지 않은 로컬 맵을 합친 사본(id 기준, 로컬 값 우선).
     * 로컬 맵은 synchronizedMap이므로 순회 중 자기 모니터를 잡는다.
     */
    public List<VulnRecord> rescueSnapshot() {
        Map<String, VulnRecord> all = new LinkedHashMap<>();
        for (VulnRecord r : collector.snapshot()) all.put(r.getId(), r);
        for (Map<String, VulnRecord> local : inFlightLocals) {
            synchronized (local) {
                for (VulnRecord r : local.values()) all.put(r.getId(), r);
            }
        }
        return Collections.unmodifiableList(new ArrayList<>(all.values()));
    }

    // ===== 종료 대기 =====
    void markFinished() { finished.countDown(); }
    public boolean isFinished() { return finished.getCount() == 0; }

    /** 스윕이 모두 병합을 마칠 때까지 최대 grace 대기. 반환: 시간 내 종료 여부 */
    public boolean awaitFinished(Duration grace) throws InterruptedException {
        long ms = (grace == null) ? 0 : Math.max(0, grace.toMillis());
        return finished.await(ms, TimeUnit.MILLISECONDS);
    }
}
