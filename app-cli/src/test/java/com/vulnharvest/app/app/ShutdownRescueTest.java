package com.vulnharvest.app.app;

import com.vulnharvest.core.checkpoint.CheckpointManager;
import com.vulnharvest.core.model.Checkpoint;
import com.vulnharvest.core.model.VulnRecord;
import com.vulnharvest.core.service.CollectionRun;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

class ShutdownRescueTest {

    @TempDir
    Path tmp;

    @Test
    void rescue_cancels_run_and_saves_everything_collected() throws Exception {
        CollectionRun run = CollectionRun.resumeFrom(100, new Checkpoint(Instant.now(), 12, List.of(
                VulnRecord.builder().id("CVE-2024-1").build(),
                VulnRecord.builder().id("CVE-2024-2").build())));
        CheckpointManager cm = new CheckpointManager(tmp, true);

        Optional<Path> saved = new ShutdownRescue(run, cm, Duration.ofMillis(20)).rescue();

        assertThat(run.isCancelled()).isTrue();
        assertThat(saved).isPresent();
        Checkpoint cp = cm.load(saved.get());
        assertThat(cp.processedCount()).isEqualTo(12);
        assertThat(cp.records()).extracting(VulnRecord::getId).containsExactly("CVE-2024-1", "CVE-2024-2");
    }

    @Test
    void rescue_with_checkpoints_disabled_writes_nothing() {
        CollectionRun run = new CollectionRun(10);
        CheckpointManager cm = new CheckpointManager(tmp, false);

        assertThat(new ShutdownRescue(run, cm, Duration.ZERO).rescue()).isEmpty();
        assertThat(run.isCancelled()).isTrue();
    }

    @Test
    void install_and_uninstall_are_balanced() {
        ShutdownRescue r = ShutdownRescue.install(new CollectionRun(1), new CheckpointManager(tmp, false), null);
        assertThatCode(r::uninstall).doesNotThrowAnyException();
    }
}
