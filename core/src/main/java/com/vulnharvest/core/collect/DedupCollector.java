package com.vulnharvest.core.collect;

import com.vulnharvest.core.model.VulnRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * id 기준 중복 제거 누적기 (스윕 전체가 공유하는 유일한 가변 구조).
 * - 같은 id는 마지막 기록이 이김(교체는 항상 허용, 크기 불변)
 * - 새 id는 size < capacity일 때만 삽입 → size() ≤ capacity 항상 성립
 * check-then-insert는 하나의 모니터 아래에서 원자적으로 수행된다.
 */
public final class DedupCollector {
    private final int capacity;
    private final Map<String, VulnRecord> byId = new LinkedHashMap<>();

    public DedupCollector(int capacity) {
        if (capacity < 1) throw new IllegalArgumentException("capacity must be >= 1: " + capacity);
        this.capacity = capacity;
    }

    /** @return true면 삽입 또는 교체됨, false면 용량 초과로 거부 */
    public synchronized boolean tryInsert(VulnRecord record) {
        Objects.requireNonNull(record, "record");
        String id = record.getId();
        if (byId.containsKey(id)) {
            byId.put(id, record);
            return true;
        }
        if (byId.size() >= capacity) return false;
        byId.put(id, record);
        return true;
    }

    /** 순서대로 tryInsert. 반환: 수락(삽입+교체) 건수 */
    public synchronized int mergeAll(Collection<VulnRecord> records) {
        if (records == null) return 0;
        int accepted = 0;
        for (VulnRecord r : records) {
            if (r != null && tryInsert(r)) accepted++;
        }
        return accepted;
    }

    public synchronized int size() { return byId.size(); }

    public synchronized boolean isFull() { return byId.size() >= capacity; }

    public synchronized boolean contains(String id) { return byId.containsKey(id); }

    public int capacity() { return capacity; }

    /** 독립 사본(삽입 순서). 이후 변경의 영향을 받지 않음 */
    public synchronized List<VulnRecord> snapshot() {
        return new ArrayList<>(byId.values());
    }
}
