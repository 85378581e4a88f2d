package com.vulnharvest.core.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.vulnharvest.core.api.IQueryClient;
import com.vulnharvest.core.config.FacetCatalog;
import com.vulnharvest.core.model.CollectorConfig;
import com.vulnharvest.core.model.SearchPage;
import com.vulnharvest.core.util.JsonMappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Algolia 스타일 검색 API 클라이언트.
 * POST searchUrl, 본문 {"requests":[{...}]}, 응답 results[0].nbHits / results[0].hits.
 * 호출 1회 = HTTP 1회. 재시도는 {@link RetryingCaller}가 담당.
 */
public class SearchQueryClient implements IQueryClient {
    private static final Logger log = LoggerFactory.getLogger(SearchQueryClient.class);

    /** 응답에 facet 집계를 함께 요청(업스트림 UI와 동일 구성) */
    static final List<String> FACETS = List.of(
            FacetCatalog.TECHNOLOGY_ATTRIBUTE,
            "exploitable",
            "hasCisaKevExploit",
            "hasFix",
            "isHighProfileThreat",
            "publishedAt",
            "severity",
            "sourceFeeds.filter");

    private final CollectorConfig config;
    private final HttpSender sender;
    private final ObjectMapper mapper = JsonMappers.create();
    private final URI endpoint;

    public SearchQueryClient(CollectorConfig config) {
        this(config, HttpSender.of(HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(Objects.requireNonNull(config, "config").getTimeout())
                .build()));
    }

    /** 테스트용 생성자(송신 훅 주입) */
    public SearchQueryClient(CollectorConfig config, HttpSender sender) {
        this.config = Objects.requireNonNull(config, "config");
        this.sender = Objects.requireNonNull(sender, "sender");
        this.endpoint = URI.create(config.getSearchUrl());
    }

    @Override
    public SearchPage fetchPage(int pageIndex, int pageSize, List<String> filterTokens) throws UpstreamException {
        if (pageIndex < 0) throw new IllegalArgumentException("pageIndex must be >= 0: " + pageIndex);
        if (pageSize < 1) throw new IllegalArgumentException("pageSize must be >= 1: " + pageSize);
        List<String> tokens = (filterTokens == null) ? List.of() : filterTokens;

        HttpRequest req = HttpRequest.newBuilder(endpoint)
                .timeout(config.getTimeout())
                .header("Content-Type", "application/json")
                .header("x-algolia-api-key", config.getApiKey())
                .header("x-algolia-application-id", config.getApplicationId())
                .POST(HttpRequest.BodyPublishers.ofString(buildBody(pageIndex, pageSize, tokens)))
                .build();

        HttpResponse<String> resp;
        try {
            resp = sender.send(req);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new UpstreamException("search request interrupted", ie);
        } catch (Exception e) {
            throw new UpstreamException("search request failed: " + e.getMessage(), e);
        }

        int status = resp.statusCode();
        if (status < 200 || status >= 300) {
            throw new UpstreamException("search returned HTTP " + status, status,
                    RetryingCaller.parseRetryAfter(resp.headers().firstValue("Retry-After").orElse(null)));
        }
        return parse(resp.body(), status);
    }

    /** 요청 본문. 토큰은 안쪽 배열 하나에 넣어 OR 결합 */
    String buildBody(int pageIndex, int pageSize, List<String> tokens) {
        ObjectNode root = mapper.createObjectNode();
        ObjectNode r = root.putArray("requests").addObject();
        r.put("indexName", config.getIndexName());
        r.put("query", "");
        r.put("page", pageIndex);
        r.put("hitsPerPage", pageSize);
        if (!tokens.isEmpty()) {
            ArrayNode inner = r.putArray("facetFilters").addArray();
            tokens.forEach(inner::add);
        }
        ArrayNode facets = r.putArray("facets");
        FACETS.forEach(facets::add);
        r.put("maxValuesPerFacet", 200);
        try {
            return mapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot serialize search request", e);
        }
    }

    private SearchPage parse(String body, int status) throws UpstreamException {
        JsonNode root;
        try {
            root = mapper.readTree(body == null ? "" : body);
        } catch (JsonProcessingException e) {
            throw new UpstreamException("malformed search response: " + e.getOriginalMessage(), status, null);
        }
        JsonNode first = (root == null) ? null : root.path("results").path(0);
        if (first == null || !first.isObject()) {
            throw new UpstreamException("search response has no results[0]", status, null);
        }
        long total = first.path("nbHits").asLong(0);
        List<JsonNode> hits = new ArrayList<>();
        JsonNode arr = first.path("hits");
        if (arr.isArray()) arr.forEach(hits::add);
        log.debug("search page parsed: nbHits={}, hits={}", total, hits.size());
        return new SearchPage(total, hits);
    }
}
