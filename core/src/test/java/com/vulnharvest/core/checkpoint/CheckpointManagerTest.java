package com.vulnharvest.core.checkpoint;

import com.vulnharvest.core.model.Checkpoint;
import com.vulnharvest.core.model.RecordFlags;
import com.vulnharvest.core.model.ReferenceLink;
import com.vulnharvest.core.model.Severity;
import com.vulnharvest.core.model.VulnRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class CheckpointManagerTest {

    @TempDir
    Path tmp;

    private static VulnRecord full(String id) {
        return VulnRecord.builder()
                .id(id)
                .severity(Severity.CRITICAL)
                .score(9.8)
                .technologies(List.of("Linux"))
                .component(List.of("kernel", "..."))
                .publishedDate(LocalDate.of(2024, 1, 31))
                .description("Use-after-free in netfilter")
                .flags(new RecordFlags(true, true, false, true))
                .sourceUrl("https://nvd.nist.gov/vuln/detail/" + id)
                .references(List.of(new ReferenceLink("GitHub fix", "https://github.com/torvalds/linux/commit/1", "GitHub")))
                .build();
    }

    @Test
    void save_then_load_round_trips_records() throws Exception {
        CheckpointManager cm = new CheckpointManager(tmp, true);
        List<VulnRecord> records = List.of(full("CVE-2024-1086"), VulnRecord.builder().id("CVE-2023-1").build());

        Path file = cm.saveCheckpoint(records, 17);
        Checkpoint cp = cm.load(file);

        assertThat(file.getFileName().toString()).matches("checkpoint_\\d+\\.json");
        assertThat(cp.processedCount()).isEqualTo(17);
        assertThat(cp.records()).isEqualTo(records);
        try (var s = Files.list(tmp)) {
            assertThat(s.filter(p -> p.toString().endsWith(".tmp"))).isEmpty();
        }
    }

    @Test
    void latest_is_chosen_by_stamp_and_unrelated_files_ignored() throws Exception {
        CheckpointManager cm = new CheckpointManager(tmp, true);
        cm.saveCheckpoint(List.of(full("CVE-2024-1")), 1);
        cm.saveCheckpoint(List.of(full("CVE-2024-1"), full("CVE-2024-2")), 2);
        Files.writeString(tmp.resolve("notes.json"), "{}");
        Files.writeString(tmp.resolve("checkpoint_abc.json"), "{}");

        assertThat(cm.list()).hasSize(2);
        assertThat(cm.loadLatest().orElseThrow().processedCount()).isEqualTo(2L);
    }

    @Test
    void unparseable_newest_falls_back_to_previous() throws Exception {
        CheckpointManager cm = new CheckpointManager(tmp, true);
        cm.saveCheckpoint(List.of(full("CVE-2024-1")), 5);
        Files.writeString(tmp.resolve("checkpoint_99999999999999.json"), "{ truncated");

        assertThat(cm.list().get(0).getFileName().toString()).isEqualTo("checkpoint_99999999999999.json");
        assertThat(cm.loadLatest().orElseThrow().processedCount()).isEqualTo(5L);
    }

    @Test
    void disabled_manager_neither_saves_nor_loads() throws Exception {
        CheckpointManager on = new CheckpointManager(tmp, true);
        on.saveCheckpoint(List.of(full("CVE-2024-1")), 1);
        CheckpointManager off = new CheckpointManager(tmp, false);

        assertThat(off.trySave(List.of(full("CVE-2024-2")), 2)).isEmpty();
        assertThat(off.loadLatest()).isEmpty();
        assertThat(on.list()).hasSize(1);
    }

    @Test
    void missing_directory_means_no_checkpoint() {
        CheckpointManager cm = new CheckpointManager(tmp.resolve("nope"), true);
        assertThat(cm.list()).isEmpty();
        assertThat(cm.loadLatest()).isEmpty();
    }

    @Test
    void try_save_reports_write_failure_as_empty() throws Exception {
        Path blocker = tmp.resolve("file-not-dir");
        Files.writeString(blocker, "x");
        CheckpointManager cm = new CheckpointManager(blocker, true);

        assertThat(cm.trySave(List.of(full("CVE-2024-1")), 1)).isEmpty();
    }

    @Test
    void stamps_are_strictly_increasing() {
        long a = CheckpointManager.nextStamp();
        long b = CheckpointManager.nextStamp();
        long c = CheckpointManager.nextStamp();
        assertThat(b).isGreaterThan(a);
        assertThat(c).isGreaterThan(b);
    }
}
