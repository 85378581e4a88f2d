package com.vulnharvest.core.collect;

import com.vulnharvest.core.model.Severity;
import com.vulnharvest.core.model.VulnRecord;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class DedupCollectorTest {

    private static VulnRecord rec(String id) {
        return VulnRecord.builder().id(id).build();
    }

    @Test
    void same_id_is_replaced_last_writer_wins() {
        DedupCollector c = new DedupCollector(10);
        c.tryInsert(VulnRecord.builder().id("CVE-2024-1").severity(Severity.LOW).build());
        c.tryInsert(VulnRecord.builder().id("CVE-2024-1").severity(Severity.CRITICAL).build());

        assertThat(c.size()).isEqualTo(1);
        assertThat(c.snapshot().get(0).getSeverity()).isEqualTo(Severity.CRITICAL);
    }

    @Test
    void capacity_rejects_new_ids_but_accepts_replacements() {
        DedupCollector c = new DedupCollector(2);
        assertThat(c.tryInsert(rec("A"))).isTrue();
        assertThat(c.tryInsert(rec("B"))).isTrue();
        assertThat(c.isFull()).isTrue();

        assertThat(c.tryInsert(rec("C"))).isFalse();
        assertThat(c.tryInsert(rec("A"))).isTrue();
        assertThat(c.size()).isEqualTo(2);
        assertThat(c.contains("C")).isFalse();
    }

    @Test
    void merge_all_counts_accepted_and_keeps_order() {
        DedupCollector c = new DedupCollector(3);
        int accepted = c.mergeAll(List.of(rec("A"), rec("B"), rec("A"), rec("C"), rec("D")));

        assertThat(accepted).isEqualTo(4);
        assertThat(c.snapshot()).extracting(VulnRecord::getId).containsExactly("A", "B", "C");
        assertThat(c.mergeAll(null)).isZero();
    }

    @Test
    void snapshot_is_independent_copy() {
        DedupCollector c = new DedupCollector(5);
        c.tryInsert(rec("A"));
        List<VulnRecord> snap = c.snapshot();
        c.tryInsert(rec("B"));

        assertThat(snap).hasSize(1);
        assertThatCode(() -> snap.add(rec("Z"))).doesNotThrowAnyException();
        assertThat(c.size()).isEqualTo(2);
    }

    @Test
    void rejects_non_positive_capacity() {
        assertThatThrownBy(() -> new DedupCollector(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void concurrent_producers_never_exceed_capacity() throws Exception {
        final int producers = 8, perProducer = 500, cap = 1000;
        DedupCollector c = new DedupCollector(cap);
        ExecutorService pool = Executors.newFixedThreadPool(producers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> fs = new ArrayList<>();
            for (int p = 0; p < producers; p++) {
                final int base = p * perProducer;
                fs.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perProducer; i++) {
                        // 절반은 다른 생산자와 겹치는 id
                        String id = (i % 2 == 0) ? "CVE-2024-" + (base + i) : "CVE-2024-shared-" + i;
                        c.tryInsert(rec(id));
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : fs) f.get(10, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        assertThat(c.size()).isEqualTo(cap);
        assertThat(c.snapshot()).extracting(VulnRecord::getId).doesNotHaveDuplicates();
    }
}
