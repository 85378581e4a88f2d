package com.vulnharvest.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/** 검색 API 한 페이지 응답: 전체 히트 수 + 이 페이지의 raw hit 목록 */
public record SearchPage(long totalHits, List<JsonNode> hits) {
    public SearchPage {
        totalHits = Math.max(0, totalHits);
        hits = (hits == null) ? List.of() : List.copyOf(hits);
    }
}
