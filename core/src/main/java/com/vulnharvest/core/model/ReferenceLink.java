package com.vulnharvest.core.model;

import java.util.Objects;

/** 상세 페이지 "Additional resources" 섹션에서 뽑은 외부 링크 1건 */
public record ReferenceLink(String title, String url, String category) {
    public ReferenceLink {
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(url, "url");
        category = (category == null || category.isBlank()) ? "Other" : category;
    }
}
