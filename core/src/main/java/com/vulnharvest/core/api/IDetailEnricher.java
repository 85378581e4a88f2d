// IDetailEnricher.java
package com.vulnharvest.core.api;

import com.vulnharvest.core.model.ReferenceLink;

import java.util.List;

/** 상세 보강 최소 계약: 식별자로 참고 링크 목록을 얻는다. 실패는 빈 리스트(예외 전파 금지). */
@FunctionalInterface
public interface IDetailEnricher {
    List<ReferenceLink> enrich(String id);

    IDetailEnricher NONE = id -> List.of();
}
