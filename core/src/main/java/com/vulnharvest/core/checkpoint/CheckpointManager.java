package com.vulnharvest.core.checkpoint;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vulnharvest.core.model.Checkpoint;
import com.vulnharvest.core.model.CollectorConfig;
import com.vulnharvest.core.model.VulnRecord;
import com.vulnharvest.core.util.JsonMappers;
import com.vulnharvest.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 체크포인트 저장/조회.
 * - 파일명: checkpoint_&lt;epochMillis&gt;.json (프로세스 내 단조 증가)
 * - 임시 파일에 쓴 뒤 원자적 이동
 * - 최신 판정은 파일명 스탬프 기준(파일시스템 메타데이터 사용 안 함)
 */
public final class CheckpointManager {
    private static final Logger LOG = LoggerFactory.getLogger(CheckpointManager.class);
    private static final StructuredLog SLOG = StructuredLog.get(CheckpointManager.class);

    static final Pattern FILE_NAME = Pattern.compile("^checkpoint_(\\d+)\\.json$");
    private static final AtomicLong LAST_STAMP = new AtomicLong(0);

    private final Path dir;
    private final boolean enabled;
    private final ObjectMapper mapper = JsonMappers.create();

    public CheckpointManager(CollectorConfig config) {
        this(Objects.requireNonNull(config, "config").getCheckpointDir(), config.isCheckpointsEnabled());
    }

    public CheckpointManager(Path dir, boolean enabled) {
        this.dir = Objects.requireNonNull(dir, "dir");
        this.enabled = enabled;
    }

    public boolean isEnabled() { return enabled; }
    public Path getDir() { return dir; }

    /** 저장 후 경로 반환. 실패는 IOException 그대로 */
    public Path saveCheckpoint(List<VulnRecord> records, long processedCount) throws IOException {
        Files.createDirectories(dir);
        long stamp = nextStamp();
        Checkpoint cp = new Checkpoint(Instant.ofEpochMilli(stamp), processedCount, records);
        Path target = dir.resolve("checkpoint_" + stamp + ".json");
        Path tmp = Files.createTempFile(dir, "checkpoint_", ".tmp");
        try {
            mapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), cp);
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
        LOG.info("Checkpoint saved: {} (records={}, processed={})", target, cp.records().size(), processedCount);
        SLOG.info("checkpoint-saved", "file", target.getFileName().toString(),
                "records", cp.records().size(), "processed", processedCount);
        return target;
    }

    /** 비활성이면 저장 안 함. 쓰기 실패는 ERROR 로그 후 empty (수집은 계속) */
    public Optional<Path> trySave(List<VulnRecord> records, long processedCount) {
        if (!enabled) return Optional.empty();
        try {
            return Optional.of(saveCheckpoint(records, processedCount));
        } catch (IOException | RuntimeException e) {
            LOG.error("Checkpoint save failed in {}: {}", dir, e.toString());
            SLOG.error("checkpoint-failed", e, "dir", dir.toString());
            return Optional.empty();
        }
    }

    /** 가장 최근(스탬프 최대)이면서 파싱 가능한 체크포인트. 없으면 empty → 새 실행 */
    public Optional<Checkpoint> loadLatest() {
        if (!enabled) return Optional.empty();
        for (Path p : list()) {
            try {
                return Optional.of(load(p));
            } catch (IOException e) {
                LOG.warn("Skipping unreadable checkpoint {}: {}", p.getFileName(), e.getMessage());
            }
        }
        return Optional.empty();
    }

    public Checkpoint load(Path file) throws IOException {
        return mapper.readValue(file.toFile(), Checkpoint.class);
    }

    /** 체크포인트 파일 목록(최신 먼저). 관련 없는 파일은 무시 */
    public List<Path> list() {
        List<Stamped> found = new ArrayList<>();
        if (!Files.isDirectory(dir)) return List.of();
        try (DirectoryStream<Path> ds = Files.newDirectoryStream(dir, "checkpoint_*.json")) {
            for (Path p : ds) {
                Matcher m = FILE_NAME.matcher(p.getFileName().toString());
                if (!m.matches()) continue;
                try {
                    found.add(new Stamped(p, Long.parseLong(m.group(1))));
                } catch (NumberFormatException e) {
                    LOG.debug("Ignoring checkpoint-like file {}", p.getFileName());
                }
            }
        } catch (IOException e) {
            LOG.warn("Cannot list checkpoint dir {}: {}", dir, e.getMessage());
            return List.of();
        }
        found.sort(Comparator.comparingLong(Stamped::stamp).reversed());
        List<Path> out = new ArrayList<>(found.size());
        found.forEach(s -> out.add(s.path()));
        return out;
    }

    private record Stamped(Path path, long stamp) {}

    /** now와 직전 스탬프+1 중 큰 값 → 같은 밀리초 내 연속 저장도 구분 */
    static long nextStamp() {
        long now = System.currentTimeMillis();
        return LAST_STAMP.updateAndGet(prev -> Math.max(prev + 1, now));
    }
}
