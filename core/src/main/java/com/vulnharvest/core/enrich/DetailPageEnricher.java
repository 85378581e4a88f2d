package com.vulnharvest.core.enrich;

import com.vulnharvest.core.api.IDetailEnricher;
import com.vulnharvest.core.http.HttpSender;
import com.vulnharvest.core.model.CollectorConfig;
import com.vulnharvest.core.model.ReferenceLink;
import com.vulnharvest.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/** 상세 페이지 GET → ReferenceExtractor. 모든 실패는 빈 리스트 + WARN */
public class DetailPageEnricher implements IDetailEnricher {
    private static final Logger log = LoggerFactory.getLogger(DetailPageEnricher.class);
    private static final StructuredLog SLOG = StructuredLog.get(DetailPageEnricher.class);

    private final CollectorConfig config;
    private final HttpSender sender;

    public DetailPageEnricher(CollectorConfig config) {
        this(config, HttpSender.of(HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(Objects.requireNonNull(config, "config").getTimeout())
                .build()));
    }

    /** 테스트용 생성자(송신 훅 주입) */
    public DetailPageEnricher(CollectorConfig config, HttpSender sender) {
        this.config = Objects.requireNonNull(config, "config");
        this.sender = Objects.requireNonNull(sender, "sender");
    }

    @Override
    public List<ReferenceLink> enrich(String id) {
        if (id == null || id.isBlank()) return List.of();
        URI url;
        try {
            url = detailUrl(id);
        } catch (IllegalArgumentException e) {
            log.warn("enrich skipped, bad detail url for {}: {}", id, e.getMessage());
            return List.of();
        }
        try {
            HttpRequest req = HttpRequest.newBuilder(url)
                    .timeout(config.getTimeout())
                    .header("User-Agent", config.getUserAgent())
                    .GET()
                    .build();
            HttpResponse<String> resp = sender.send(req);
            int status = resp.statusCode();
            if (status < 200 || status >= 300) {
                log.warn("enrich {} → HTTP {}", id, status);
                SLOG.warn("enrich-failed", "id", id, "status", status);
                return List.of();
            }
            return ReferenceExtractor.extract(resp.body());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            log.warn("enrich {} interrupted", id);
            return List.of();
        } catch (Exception e) {
            log.warn("enrich {} failed: {}", id, e.toString());
            SLOG.warn("enrich-failed", "id", id, "status", -1, "error", e.getClass().getSimpleName());
            return List.of();
        }
    }

    URI detailUrl(String id) {
        String base = config.getDetailBaseUrl();
        if (base.endsWith("/")) base = base.substring(0, base.length() - 1);
        return URI.create(base + "/" + id.trim().toLowerCase(Locale.ROOT));
    }
}
