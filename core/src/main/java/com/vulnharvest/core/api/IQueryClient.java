// IQueryClient.java
package com.vulnharvest.core.api;

import com.vulnharvest.core.http.UpstreamException;
import com.vulnharvest.core.model.SearchPage;

import java.util.List;

/**
 * 검색 API 최소 계약: 페이지 1개를 요청해 전체 히트 수와 hit 목록을 돌려준다.
 * 호출 1회 = 업스트림 요청 1회. 재시도는 호출자 책임.
 */
public interface IQueryClient extends AutoCloseable {
    /**
     * @param pageIndex    0 이상
     * @param pageSize     1 이상
     * @param filterTokens 비어 있으면 무필터, 여러 개면 OR 결합
     */
    SearchPage fetchPage(int pageIndex, int pageSize, List<String> filterTokens) throws UpstreamException;

    @Override default void close() throws Exception {}
}
