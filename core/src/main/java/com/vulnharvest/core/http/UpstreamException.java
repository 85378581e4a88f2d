package com.vulnharvest.core.http;

import java.io.IOException;
import java.time.Duration;

/**
 * 업스트림 호출 실패.
 * statusCode: HTTP 상태(전송 계층 오류는 -1, 응답 구조 오류는 받은 상태 그대로)
 * retryAfter: 서버가 준 Retry-After 힌트(없으면 null)
 */
public class UpstreamException extends IOException {
    private final int statusCode;
    private final Duration retryAfter;

    public UpstreamException(String message, int statusCode, Duration retryAfter) {
        super(message);
        this.statusCode = statusCode;
        this.retryAfter = retryAfter;
    }

    public UpstreamException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
        this.retryAfter = null;
    }

    public int getStatusCode() { return statusCode; }
    public Duration getRetryAfter() { return retryAfter; }
}
