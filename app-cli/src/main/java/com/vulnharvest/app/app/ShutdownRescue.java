package com.vulnharvest.app.app;

import com.vulnharvest.core.checkpoint.CheckpointManager;
import com.vulnharvest.core.service.CollectionRun;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * JVM 종료 훅: 진행 중 실행을 취소 → grace 동안 스윕 병합 대기 → 수집분 전체를 체크포인트 1회 저장.
 * 실행이 이미 정상 종료됐으면 아무것도 하지 않는다.
 */
public final class ShutdownRescue {
    private static final Logger LOG = LoggerFactory.getLogger(ShutdownRescue.class);

    public static final Duration DEFAULT_GRACE = Duration.ofSeconds(10);

    private final CollectionRun run;
    private final CheckpointManager checkpoints;
    private final Duration grace;
    private final Thread hook;

    ShutdownRescue(CollectionRun run, CheckpointManager checkpoints, Duration grace) {
        this.run = Objects.requireNonNull(run, "run");
        this.checkpoints = Objects.requireNonNull(checkpoints, "checkpoints");
        this.grace = (grace == null) ? DEFAULT_GRACE : grace;
        this.hook = new Thread(this::onShutdown, "shutdown-rescue");
    }

    public static ShutdownRescue install(CollectionRun run, CheckpointManager checkpoints, Duration grace) {
        ShutdownRescue r = new ShutdownRescue(run, checkpoints, grace);
        Runtime.getRuntime().addShutdownHook(r.hook);
        return r;
    }

    /** 정상 종료 경로에서 훅 해제. 이미 종료 중이면 무시 */
    public void uninstall() {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            LOG.debug("Shutdown already in progress, hook stays: {}", e.getMessage());
        }
    }

    private void onShutdown() {
        if (run.isFinished()) return;
        rescue();
    }

    /** 훅 본체(테스트에서 직접 호출) */
    Optional<Path> rescue() {
        LOG.warn("Shutdown requested, cancelling collection and saving checkpoint");
        run.cancel();
        try {
            if (!run.awaitFinished(grace)) {
                LOG.warn("Sweeps did not finish within {} ms, saving what is collected", grace.toMillis());
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
        Optional<Path> saved = checkpoints.trySave(run.rescueSnapshot(), run.processedCount());
        saved.ifPresent(p -> LOG.warn("Rescue checkpoint written: {}", p));
        return saved;
    }
}
