package com.vulnharvest.core.service;

/** 모든 스윕의 프로브가 실패(취소 아님) → 업스트림 자체가 불가용 */
public class UpstreamUnavailableException extends RuntimeException {
    private final int failedSweeps;

    public UpstreamUnavailableException(String message, int failedSweeps) {
        super(message);
        this.failedSweeps = failedSweeps;
    }

    public int getFailedSweeps() { return failedSweeps; }
}
