package com.vulnharvest.core.model;

/**
 * 스윕 1건의 최종 요약.
 * @param label        "unfiltered" 또는 facet 라벨
 * @param state        종료 상태
 * @param totalHits    프로브 시점 전체 히트 수 (FAILED면 -1)
 * @param pagesPlanned 계획 페이지 수
 * @param pagesFetched 성공 페이지 수
 * @param pagesFailed  건너뛴 페이지 수
 * @param collected    로컬 맵에 모은 레코드 수
 * @param merged       컬렉터가 받아들인 레코드 수
 * @param error        FAILED 사유 또는 조기 종료 사유(없으면 null)
 */
public record SweepReport(String label,
                          SweepState state,
                          long totalHits,
                          int pagesPlanned,
                          int pagesFetched,
                          int pagesFailed,
                          int collected,
                          int merged,
                          String error) {

    public static SweepReport failed(String label, String error) {
        return new SweepReport(label, SweepState.FAILED, -1, 0, 0, 0, 0, 0, error);
    }
}
