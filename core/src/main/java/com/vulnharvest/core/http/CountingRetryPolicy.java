package com.vulnharvest.core.http;

import java.time.Duration;
import java.util.Objects;

/** RetryPolicy를 감싸 재시도 횟수를 집계하는 얇은 데코레이터. (페이지 요청 1건당 1개) */
public final class CountingRetryPolicy implements RetryPolicy {
    private final RetryPolicy delegate;
    private int retries = 0; // shouldRetry(...)가 true를 반환한 횟수

    public CountingRetryPolicy(RetryPolicy delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    @Override
    public boolean shouldRetry(int statusCode, int attempt) {
        boolean ok = delegate.shouldRetry(statusCode, attempt);
        if (ok) retries++;
        return ok;
    }

    @Override
    public Duration nextDelay(int attempt) {
        return delegate.nextDelay(attempt);
    }

    @Override
    public int maxAttempts() {
        return delegate.maxAttempts();
    }

    /** 요청 한 건에 대해 실제 발생한 재시도 횟수(0 이상). */
    public int getRetryCount() {
        return retries;
    }
}
