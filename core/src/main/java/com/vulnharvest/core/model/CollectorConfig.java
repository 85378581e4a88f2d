package com.vulnharvest.core.model;

import com.vulnharvest.core.config.FacetCatalog;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * 수집 설정 (collector.yml 매핑 대상). 순수 설정 보관용.
 * 엔진은 이 값을 읽기만 한다. 로딩/환경변수 오버라이드는 외부(YamlConfigLoader, CLI) 책임.
 */
public final class CollectorConfig {

    // ---------- 업스트림 ----------
    private String searchUrl = "https://hdr4182jve-dsn.algolia.net/1/indexes/*/queries";
    private String apiKey = "";
    private String applicationId = "HDR4182JVE";
    private String indexName = "cve-db";
    private String detailBaseUrl = "https://www.wiz.io/vulnerability-database/cve";
    private Duration timeout = Duration.ofSeconds(30);        // 요청 타임아웃
    private String userAgent = "Mozilla/5.0 (compatible; VulnHarvest/0.3)";

    /** 동시 facet 스윕 수 상한 */
    public static final int MAX_CONCURRENCY = 64;

    // ---------- 페이징/동시성 ----------
    private int pageSize = 20;
    private int perSweepCap = 1000;       // 스윕 1개가 모을 최대 레코드(업스트림 페이지 한도와 맞춤)
    private int concurrency = 3;          // 동시에 도는 facet 스윕 수(K)
    private Duration pageDelay = Duration.ofMillis(1000);
    private Duration enrichDelay = Duration.ofMillis(100);
    private Duration groupDelay = Duration.ofMillis(2000);

    // ---------- 수집 한도/가공 ----------
    private int maxRecords = 50_000;      // 전역 상한(하드 캡)
    private int maxDescriptionLength = 1000;
    private boolean enrichmentEnabled = true;

    // ---------- 재시도 ----------
    private int retryAttempts = 3;
    private long retryBaseMs = 1000;

    // ---------- 체크포인트 ----------
    private boolean checkpointsEnabled = false;
    private Path checkpointDir = Path.of("checkpoints");
    private int checkpointInterval = 100;

    // ---------- 출력 ----------
    private Path outputDir = Path.of("output");
    private String outputName = "cve_data";

    private List<FacetFilter> facets = FacetCatalog.defaults();

    // ---------- getters ----------
    public String getSearchUrl() { return searchUrl; }
    public String getApiKey() { return apiKey; }
    public String getApplicationId() { return applicationId; }
    public String getIndexName() { return indexName; }
    public String getDetailBaseUrl() { return detailBaseUrl; }
    public Duration getTimeout() { return timeout; }
    public String getUserAgent() { return userAgent; }
    public int getPageSize() { return pageSize; }
    public int getPerSweepCap() { return perSweepCap; }
    public int getConcurrency() { return concurrency; }
    public Duration getPageDelay() { return pageDelay; }
    public Duration getEnrichDelay() { return enrichDelay; }
    public Duration getGroupDelay() { return groupDelay; }
    public int getMaxRecords() { return maxRecords; }
    public int getMaxDescriptionLength() { return maxDescriptionLength; }
    public boolean isEnrichmentEnabled() { return enrichmentEnabled; }
    public int getRetryAttempts() { return retryAttempts; }
    public long getRetryBaseMs() { return retryBaseMs; }
    public boolean isCheckpointsEnabled() { return checkpointsEnabled; }
    public Path getCheckpointDir() { return checkpointDir; }
    public int getCheckpointInterval() { return checkpointInterval; }
    public Path getOutputDir() { return outputDir; }
    public String getOutputName() { return outputName; }
    public List<FacetFilter> getFacets() { return facets; }

    // ---------- fluent setters ----------
    public CollectorConfig setSearchUrl(String v) { this.searchUrl = v; return this; }
    public CollectorConfig setApiKey(String v) { this.apiKey = (v == null ? "" : v); return this; }
    public CollectorConfig setApplicationId(String v) { this.applicationId = (v == null ? "" : v); return this; }
    public CollectorConfig setIndexName(String v) { this.indexName = v; return this; }
    public CollectorConfig setDetailBaseUrl(String v) { this.detailBaseUrl = v; return this; }
    public CollectorConfig setTimeout(Duration v) { this.timeout = v; return this; }
    public CollectorConfig setUserAgent(String v) { this.userAgent = v; return this; }
    public CollectorConfig setPageSize(int v) { this.pageSize = Math.max(1, v); return this; }
    public CollectorConfig setPerSweepCap(int v) { this.perSweepCap = Math.max(1, v); return this; }
    public CollectorConfig setConcurrency(int v) { this.concurrency = Math.min(MAX_CONCURRENCY, Math.max(1, v)); return this; }
    public CollectorConfig setPageDelay(Duration v) { this.pageDelay = nonNegative(v); return this; }
    public CollectorConfig setEnrichDelay(Duration v) { this.enrichDelay = nonNegative(v); return this; }
    public CollectorConfig setGroupDelay(Duration v) { this.groupDelay = nonNegative(v); return this; }
    public CollectorConfig setMaxRecords(int v) { this.maxRecords = Math.max(1, v); return this; }
    public CollectorConfig setMaxDescriptionLength(int v) { this.maxDescriptionLength = Math.max(0, v); return this; }
    public CollectorConfig setEnrichmentEnabled(boolean v) { this.enrichmentEnabled = v; return this; }
    public CollectorConfig setRetryAttempts(int v) { this.retryAttempts = Math.max(1, v); return this; }
    public CollectorConfig setRetryBaseMs(long v) { this.retryBaseMs = Math.max(1, v); return this; }
    public CollectorConfig setCheckpointsEnabled(boolean v) { this.checkpointsEnabled = v; return this; }
    public CollectorConfig setCheckpointDir(Path v) { this.checkpointDir = v; return this; }
    public CollectorConfig setCheckpointInterval(int v) { this.checkpointInterval = Math.max(1, v); return this; }
    public CollectorConfig setOutputDir(Path v) { this.outputDir = v; return this; }
    public CollectorConfig setOutputName(String v) { this.outputName = v; return this; }

    /** null이면 기본 목록, 빈 리스트면 무필터 스윕만 */
    public CollectorConfig setFacets(List<FacetFilter> v) {
        this.facets = (v == null ? FacetCatalog.defaults() : List.copyOf(v));
        return this;
    }

    // ---------- validate ----------
    public void validate() {
        Objects.requireNonNull(searchUrl, "searchUrl");
        Objects.requireNonNull(indexName, "indexName");
        Objects.requireNonNull(detailBaseUrl, "detailBaseUrl");
        if (searchUrl.isBlank()) throw new IllegalArgumentException("searchUrl must not be blank");
        if (indexName.isBlank()) throw new IllegalArgumentException("indexName must not be blank");
        if (timeout == null || timeout.isNegative() || timeout.isZero())
            throw new IllegalArgumentException("timeout must be > 0");
        if (pageSize < 1) throw new IllegalArgumentException("pageSize must be >= 1");
        if (perSweepCap < 1) throw new IllegalArgumentException("perSweepCap must be >= 1");
        if (concurrency < 1 || concurrency > MAX_CONCURRENCY)
            throw new IllegalArgumentException("concurrency must be in [1, " + MAX_CONCURRENCY + "]");
        if (maxRecords < 1) throw new IllegalArgumentException("maxRecords must be >= 1");
        Objects.requireNonNull(pageDelay, "pageDelay");
        Objects.requireNonNull(enrichDelay, "enrichDelay");
        Objects.requireNonNull(groupDelay, "groupDelay");
        Objects.requireNonNull(checkpointDir, "checkpointDir");
        Objects.requireNonNull(outputDir, "outputDir");
        Objects.requireNonNull(outputName, "outputName");
        if (outputName.isBlank()) throw new IllegalArgumentException("outputName must not be blank");
        Objects.requireNonNull(facets, "facets");
    }

    // ---------- helpers ----------
    public static CollectorConfig defaults() { return new CollectorConfig(); }

    public long getTimeoutMs() { return timeout.toMillis(); }

    public CollectorConfig setTimeoutMs(long ms) {
        this.timeout = Duration.ofMillis(Math.max(1, ms));
        return this;
    }

    private static Duration nonNegative(Duration d) {
        if (d == null || d.isNegative()) return Duration.ZERO;
        return d;
    }
}
