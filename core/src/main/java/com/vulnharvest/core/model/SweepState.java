package com.vulnharvest.core.model;

/**
 * 스윕 상태 머신.
 * PENDING → PROBING → PAGING → MERGING → {COMPLETED | CAPPED | CANCELLED}
 * PROBING → FAILED (초기 건수 조회 실패만 해당, 페이지 단위 오류는 PAGING 유지)
 */
public enum SweepState {
    PENDING, PROBING, PAGING, MERGING, COMPLETED, CAPPED, CANCELLED, FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == CAPPED || this == CANCELLED || this == FAILED;
    }

    /** 실행 집계 시 성공으로 셀 상태 */
    public boolean isSuccess() {
        return this == COMPLETED || this == CAPPED || this == CANCELLED;
    }
}
