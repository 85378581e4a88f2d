package com.vulnharvest.core.model;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/** 런타임 텔레메트리 누적기 (스레드 세이프). */
public final class CollectionStats {
    private final AtomicLong requestsTotal  = new AtomicLong(0);   // 검색 API 시도(재시도 포함)
    private final AtomicLong retriesTotal   = new AtomicLong(0);
    private final AtomicLong pagesFetched   = new AtomicLong(0);
    private final AtomicLong pagesFailed    = new AtomicLong(0);
    private final AtomicLong enrichCalls    = new AtomicLong(0);
    private final AtomicLong enrichEmpty    = new AtomicLong(0);   // 실패 포함, 링크 0건
    private final AtomicLong droppedHits    = new AtomicLong(0);   // 식별자 없는 hit
    private final AtomicLong invalidRecords = new AtomicLong(0);   // 검증 경고(레코드는 유지)
    private final AtomicInteger maxObservedConcurrency = new AtomicInteger(0);

    /** attempts = (1 + retries) for a page request */
    public void addAttempts(long attempts) { requestsTotal.addAndGet(attempts); }
    public void addRetries(long retries) { retriesTotal.addAndGet(retries); }
    public void pageFetched() { pagesFetched.incrementAndGet(); }
    public void pageFailed() { pagesFailed.incrementAndGet(); }
    public void enrichCall(boolean empty) {
        enrichCalls.incrementAndGet();
        if (empty) enrichEmpty.incrementAndGet();
    }
    public void hitDropped() { droppedHits.incrementAndGet(); }
    public void recordInvalid() { invalidRecords.incrementAndGet(); }

    /** 현재 동시 실행 스윕 수를 관측하여 최대값 갱신 */
    public void observeConcurrency(int current) {
        maxObservedConcurrency.accumulateAndGet(current, Math::max);
    }

    public Snapshot snapshot() {
        return new Snapshot(requestsTotal.get(), retriesTotal.get(),
                pagesFetched.get(), pagesFailed.get(),
                enrichCalls.get(), enrichEmpty.get(),
                droppedHits.get(), invalidRecords.get(),
                maxObservedConcurrency.get());
    }

    /** 불변 스냅샷 DTO */
    public record Snapshot(long requestsTotal,
                           long retriesTotal,
                           long pagesFetched,
                           long pagesFailed,
                           long enrichCalls,
                           long enrichEmpty,
                           long droppedHits,
                           long invalidRecords,
                           int maxObservedConcurrency) {}
}
