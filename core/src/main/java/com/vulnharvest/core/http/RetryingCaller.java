package com.vulnharvest.core.http;

import com.vulnharvest.core.model.CollectionStats;
import com.vulnharvest.core.util.Sleeper;
import com.vulnharvest.core.util.StructuredLog;

import java.time.Duration;
import java.util.Objects;

/** 업스트림 호출을 RetryPolicy에 따라 반복. 429/5xx/(-1)에서만 재시도, Retry-After 우선(상한 30s) */
public final class RetryingCaller {

    /** 재시도 단위가 되는 호출 1회 */
    @FunctionalInterface
    public interface Call<T> {
        T call() throws UpstreamException;
    }

    static final Duration RETRY_AFTER_CAP = Duration.ofSeconds(30);

    private static final StructuredLog SLOG = StructuredLog.get(RetryingCaller.class);

    private final RetryPolicy policy;
    private final Sleeper sleeper;
    private final CollectionStats stats; // null 허용

    public RetryingCaller(RetryPolicy policy, Sleeper sleeper, CollectionStats stats) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.stats = stats;
    }

    /**
     * 성공 결과 또는 마지막 실패를 던진다.
     * @param what 로그용 호출 설명(예: "Linux#p3")
     */
    public <T> T call(String what, Call<T> call) throws UpstreamException, InterruptedException {
        CountingRetryPolicy counting = new CountingRetryPolicy(policy);
        int attempt = 1;
        while (true) {
            try {
                T out = call.call();
                record(attempt, counting);
                return out;
            } catch (UpstreamException e) {
                if (!counting.shouldRetry(e.getStatusCode(), attempt)) {
                    record(attempt, counting);
                    throw e;
                }
                Duration delay = resolveDelay(e.getRetryAfter(), policy.nextDelay(attempt));
                SLOG.debug("retry", "call", what, "attempt", attempt, "status", e.getStatusCode(), "delay", delay);
                sleeper.sleep(delay);
                attempt++;
            }
        }
    }

    private void record(int attempts, CountingRetryPolicy counting) {
        if (stats == null) return;
        stats.addAttempts(attempts);
        stats.addRetries(counting.getRetryCount());
    }

    /** 서버 힌트가 있으면 그것을(상한 30s), 없으면 정책 지연 */
    static Duration resolveDelay(Duration retryAfter, Duration fallback) {
        if (retryAfter == null || retryAfter.isNegative()) return fallback;
        return retryAfter.compareTo(RETRY_AFTER_CAP) > 0 ? RETRY_AFTER_CAP : retryAfter;
    }

    /** Retry-After 초 단위 값만 해석. HTTP-date 형태는 null(정책 지연 사용) */
    public static Duration parseRetryAfter(String header) {
        if (header == null || header.isBlank()) return null;
        try {
            long sec = Long.parseLong(header.trim());
            return sec < 0 ? null : Duration.ofSeconds(Math.min(sec, RETRY_AFTER_CAP.getSeconds()));
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
