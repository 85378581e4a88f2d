package com.vulnharvest.core.model;

import java.util.Objects;

/**
 * 업스트림 facet 필터 1개.
 * token은 업스트림에 그대로 전달되는 불투명 문자열(예: "affectedTechnologies.filter:Linux"),
 * label은 로그/리포트 표시용.
 */
public record FacetFilter(String label, String token) {
    public FacetFilter {
        Objects.requireNonNull(token, "token");
        if (token.isBlank()) throw new IllegalArgumentException("facet token must not be blank");
        label = (label == null || label.isBlank()) ? token : label;
    }

    public static FacetFilter of(String label, String token) {
        return new FacetFilter(label, token);
    }
}
