package com.vulnharvest.core.http;

import com.vulnharvest.core.model.CollectionStats;
import com.vulnharvest.core.util.RecordingSleeper;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class RetryingCallerTest {

    /** 지터 없는 결정적 정책 */
    private static final RetryPolicy FIXED = new RetryPolicy() {
        @Override public boolean shouldRetry(int status, int attempt) {
            return (status == 429 || status == -1 || status >= 500) && attempt < 3;
        }
        @Override public Duration nextDelay(int attempt) { return Duration.ofMillis(100L * (1L << (attempt - 1))); }
        @Override public int maxAttempts() { return 3; }
    };

    @Test
    void retryAfter_is_honored_on_429_and_succeeds_on_second_attempt() throws Exception {
        RecordingSleeper sleeper = new RecordingSleeper();
        CollectionStats stats = new CollectionStats();
        RetryingCaller caller = new RetryingCaller(FIXED, sleeper, stats);
        AtomicInteger calls = new AtomicInteger();

        String out = caller.call("t", () -> {
            if (calls.incrementAndGet() == 1) throw new UpstreamException("slow down", 429, Duration.ofSeconds(2));
            return "ok";
        });

        assertThat(out).isEqualTo("ok");
        assertThat(calls.get()).isEqualTo(2);
        assertThat(sleeper.sleeps).containsExactly(Duration.ofSeconds(2));
        assertThat(stats.snapshot().requestsTotal()).isEqualTo(2);
        assertThat(stats.snapshot().retriesTotal()).isEqualTo(1);
    }

    @Test
    void gives_up_after_maxAttempts_and_rethrows_last_failure() {
        RecordingSleeper sleeper = new RecordingSleeper();
        RetryingCaller caller = new RetryingCaller(FIXED, sleeper, null);
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> caller.call("t", () -> {
            calls.incrementAndGet();
            throw new UpstreamException("boom", 503, null);
        })).isInstanceOf(UpstreamException.class)
           .extracting(e -> ((UpstreamException) e).getStatusCode()).isEqualTo(503);

        assertThat(calls.get()).isEqualTo(3);
        assertThat(sleeper.sleeps).containsExactly(Duration.ofMillis(100), Duration.ofMillis(200));
    }

    @Test
    void client_errors_are_not_retried() {
        RecordingSleeper sleeper = new RecordingSleeper();
        RetryingCaller caller = new RetryingCaller(FIXED, sleeper, null);
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> caller.call("t", () -> {
            calls.incrementAndGet();
            throw new UpstreamException("forbidden", 403, null);
        })).isInstanceOf(UpstreamException.class);

        assertThat(calls.get()).isEqualTo(1);
        assertThat(sleeper.sleeps).isEmpty();
    }

    @Test
    void retryAfter_is_capped_at_30_seconds() {
        assertThat(RetryingCaller.resolveDelay(Duration.ofMinutes(5), Duration.ofMillis(10)))
                .isEqualTo(Duration.ofSeconds(30));
        assertThat(RetryingCaller.resolveDelay(null, Duration.ofMillis(10)))
                .isEqualTo(Duration.ofMillis(10));
    }

    @Test
    void parseRetryAfter_accepts_seconds_only() {
        assertThat(RetryingCaller.parseRetryAfter("5")).isEqualTo(Duration.ofSeconds(5));
        assertThat(RetryingCaller.parseRetryAfter("120")).isEqualTo(Duration.ofSeconds(30));
        assertThat(RetryingCaller.parseRetryAfter("Wed, 21 Oct 2015 07:28:00 GMT")).isNull();
        assertThat(RetryingCaller.parseRetryAfter(null)).isNull();
    }
}
