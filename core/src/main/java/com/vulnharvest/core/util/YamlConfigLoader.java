package com.vulnharvest.core.util;

import com.vulnharvest.core.config.FacetCatalog;
import com.vulnharvest.core.model.CollectorConfig;
import com.vulnharvest.core.model.FacetFilter;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.*;
import java.util.function.Consumer;
import java.util.function.IntConsumer;
import java.util.function.LongConsumer;

/**
 * collector.yml을 읽어 CollectorConfig로 변환.
 *
 * 예상 YAML 키:
 * upstream:
 *   searchUrl: "https://xxx-dsn.algolia.net/1/indexes/*&#47;queries"
 *   apiKey: "..."
 *   applicationId: "..."
 *   indexName: "cve-db"
 *   detailBaseUrl: "https://www.wiz.io/vulnerability-database/cve"
 *   timeoutMs: 30000
 * paging:
 *   pageSize: 20
 *   perSweepCap: 1000
 * concurrency: 3
 * delays:
 *   pageMs: 1000
 *   enrichMs: 100
 *   groupMs: 2000
 * maxRecords: 50000
 * maxDescriptionLength: 1000
 * enrichment:
 *   enabled: true
 * retry:
 *   maxAttempts: 3
 *   baseMs: 1000
 * checkpoints:
 *   enabled: true
 *   dir: "checkpoints"
 *   interval: 100
 * output:
 *   dir: "output"
 *   name: "cve_data"
 * facets:                      # 생략 시 FacetCatalog 기본값, [] 이면 무필터 스윕만
 *   - { label: "Linux", token: "affectedTechnologies.filter:Linux" }
 *   - "Windows"                # 문자열만 주면 기술 facet으로 해석
 */
public final class YamlConfigLoader {

    private YamlConfigLoader() {}

    public static CollectorConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("collector.yml not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            return parse(in);
        }
    }

    public static CollectorConfig parse(InputStream in) {
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        Object root = yaml.load(in);

        CollectorConfig cfg = CollectorConfig.defaults();

        if (!(root instanceof Map<?, ?> map)) {
            // 비어있거나 단순 스칼라면 defaults 유지
            cfg.validate();
            return cfg;
        }

        // 1) upstream.*
        Map<String, Object> up = getMap(map, "upstream");
        if (up != null) {
            setString(up, "searchUrl", cfg::setSearchUrl);
            setString(up, "apiKey", cfg::setApiKey);
            setString(up, "applicationId", cfg::setApplicationId);
            setString(up, "indexName", cfg::setIndexName);
            setString(up, "detailBaseUrl", cfg::setDetailBaseUrl);
            setString(up, "userAgent", cfg::setUserAgent);
            setLongAsDurationMs(up, "timeoutMs", cfg::setTimeout);
        }

        // 2) paging.*
        Map<String, Object> paging = getMap(map, "paging");
        if (paging != null) {
            setInt(paging, "pageSize", cfg::setPageSize);
            setInt(paging, "perSweepCap", cfg::setPerSweepCap);
        }

        // 3) 평면 키
        setInt(map, "concurrency", cfg::setConcurrency);
        setInt(map, "maxRecords", cfg::setMaxRecords);
        setInt(map, "maxDescriptionLength", cfg::setMaxDescriptionLength);

        // 4) delays.* (0 허용)
        Map<String, Object> delays = getMap(map, "delays");
        if (delays != null) {
            setLongAsDurationMs(delays, "pageMs", cfg::setPageDelay);
            setLongAsDurationMs(delays, "enrichMs", cfg::setEnrichDelay);
            setLongAsDurationMs(delays, "groupMs", cfg::setGroupDelay);
        }

        Map<String, Object> enrichment = getMap(map, "enrichment");
        if (enrichment != null) {
            setBoolean(enrichment, "enabled", cfg::setEnrichmentEnabled);
        }

        Map<String, Object> retry = getMap(map, "retry");
        if (retry != null) {
            setInt(retry, "maxAttempts", cfg::setRetryAttempts);
            setLong(retry, "baseMs", cfg::setRetryBaseMs);
        }

        // 5) checkpoints.*
        Map<String, Object> cp = getMap(map, "checkpoints");
        if (cp != null) {
            setBoolean(cp, "enabled", cfg::setCheckpointsEnabled);
            setPath(cp, "dir", cfg::setCheckpointDir);
            setInt(cp, "interval", cfg::setCheckpointInterval);
        }

        // 6) output.*
        Map<String, Object> output = getMap(map, "output");
        if (output != null) {
            setPath(output, "dir", cfg::setOutputDir);
            setString(output, "name", cfg::setOutputName);
        }

        // 7) facets
        if (map.containsKey("facets")) {
            cfg.setFacets(parseFacets(map.get("facets")));
        }

        // 기본값/필수값 확인
        cfg.validate();
        return cfg;
    }

    // ------------ helpers ------------
    private static List<FacetFilter> parseFacets(Object v) {
        if (v == null) return null;   // 키만 있고 값 없음 → 기본 목록
        if (!(v instanceof List<?> list)) {
            throw new IllegalArgumentException("facets must be a list");
        }
        List<FacetFilter> out = new ArrayList<>();
        for (Object o : list) {
            if (o instanceof Map<?, ?> m) {
                Object token = m.get("token");
                if (token == null) throw new IllegalArgumentException("facet entry without token: " + m);
                Object label = m.get("label");
                out.add(FacetFilter.of(label == null ? null : String.valueOf(label), String.valueOf(token)));
            } else if (o != null && !String.valueOf(o).isBlank()) {
                out.add(FacetCatalog.technology(String.valueOf(o).trim()));
            }
        }
        return out;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        if (v instanceof Map<?, ?> m) return (Map<String, Object>) m;
        return null;
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v)));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) setter.accept(Integer.parseInt(String.valueOf(v).trim()));
    }

    private static void setLong(Map<?, ?> map, String key, LongConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.longValue());
        else if (v != null) setter.accept(Long.parseLong(String.valueOf(v).trim()));
    }

    private static void setLongAsDurationMs(Map<?, ?> map, String key, Consumer<Duration> setter) {
        Object v = map.get(key);
        if (v == null) return;
        long ms = (v instanceof Number n) ? n.longValue() : Long.parseLong(String.valueOf(v).trim());
        if (ms >= 0) setter.accept(Duration.ofMillis(ms));
    }

    private static void setPath(Map<?, ?> map, String key, Consumer<Path> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(Path.of(String.valueOf(v)));
    }
}
