package com.vulnharvest.core.transform;

import com.fasterxml.jackson.databind.JsonNode;
import com.vulnharvest.core.model.RecordFlags;
import com.vulnharvest.core.model.Severity;
import com.vulnharvest.core.model.VulnRecord;

import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 검색 hit(JSON) → VulnRecord 순수 변환. I/O 없음.
 * 식별자 후보(externalId, name, id, objectID)가 모두 비어 있으면 null.
 */
public final class RecordTransformer {

    static final List<String> ID_FIELDS = List.of("externalId", "name", "id", "objectID");
    static final int MAX_COMPONENTS = 3;
    static final String TRUNCATION_MARKER = "...";

    /** 이 값보다 큰 epoch 숫자는 밀리초로 본다(약 2286년 이후의 초 값) */
    private static final long EPOCH_MILLIS_THRESHOLD = 10_000_000_000L;

    private final int maxDescriptionLength;

    public RecordTransformer(int maxDescriptionLength) {
        this.maxDescriptionLength = Math.max(0, maxDescriptionLength);
    }

    public VulnRecord transform(JsonNode hit) {
        if (hit == null || !hit.isObject()) return null;
        String id = canonicalId(hit);
        if (id == null) return null;

        return VulnRecord.builder()
                .id(id)
                .severity(Severity.parse(text(hit, "severity")))
                .score(score(hit))
                .technologies(technologies(hit.path("affectedTechnologies")))
                .component(components(hit.path("affectedSoftware")))
                .publishedDate(publishedDate(hit.get("publishedAt")))
                .description(TextCleaner.bound(TextCleaner.clean(text(hit, "description")), maxDescriptionLength))
                .flags(new RecordFlags(
                        hit.path("hasFix").asBoolean(false),
                        hit.path("exploitable").asBoolean(false),
                        hit.path("isHighProfileThreat").asBoolean(false),
                        hit.path("hasCisaKevExploit").asBoolean(false)))
                .sourceUrl(nullToEmpty(text(hit, "sourceUrl")).trim())
                .build();
    }

    /** 후보 필드 순서대로 첫 비어있지 않은 값. "cve-" 접두는 대문자화 */
    static String canonicalId(JsonNode hit) {
        for (String f : ID_FIELDS) {
            String v = text(hit, f);
            if (v == null) continue;
            v = v.trim();
            if (v.isEmpty()) continue;
            if (v.regionMatches(true, 0, "cve-", 0, 4)) {
                v = v.toUpperCase(Locale.ROOT);
            }
            return v;
        }
        return null;
    }

    /** cvssScore 우선, 없으면 score. 숫자/숫자 문자열 허용, 0..10 밖이면 null */
    static Double score(JsonNode hit) {
        Double v = number(hit.get("cvssScore"));
        if (v == null) v = number(hit.get("score"));
        if (v == null || v.isNaN() || v < 0.0 || v > 10.0) return null;
        return v;
    }

    private static Double number(JsonNode n) {
        if (n == null || n.isNull()) return null;
        if (n.isNumber()) return n.asDouble();
        if (n.isTextual()) {
            String s = n.asText().trim();
            if (s.isEmpty()) return null;
            try {
                return Double.parseDouble(s);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    /** [{name:..}] 또는 ["..."] 모두 허용 */
    static List<String> technologies(JsonNode arr) {
        List<String> out = new ArrayList<>();
        if (!arr.isArray()) return out;
        for (JsonNode t : arr) {
            String name = t.isObject() ? t.path("name").asText("") : t.asText("");
            name = name.trim();
            if (!name.isEmpty()) out.add(name);
        }
        return out;
    }

    static List<String> components(JsonNode arr) {
        List<String> all = new ArrayList<>();
        if (!arr.isArray()) return all;
        for (JsonNode c : arr) {
            String s = c.isObject() ? c.path("name").asText("") : c.asText("");
            s = s.trim();
            if (!s.isEmpty()) all.add(s);
        }
        if (all.size() <= MAX_COMPONENTS) return all;
        List<String> out = new ArrayList<>(all.subList(0, MAX_COMPONENTS));
        out.add(TRUNCATION_MARKER);
        return out;
    }

    /** ISO 날짜, ISO 시각, epoch(초/밀리초). 해석 불가면 null */
    static LocalDate publishedDate(JsonNode n) {
        if (n == null || n.isNull()) return null;
        if (n.isNumber()) return fromEpoch(n.asLong());
        String s = n.asText("").trim();
        if (s.isEmpty()) return null;
        if (s.chars().allMatch(Character::isDigit)) {
            try {
                return fromEpoch(Long.parseLong(s));
            } catch (NumberFormatException e) {
                return null;
            }
        }
        try {
            return OffsetDateTime.parse(s).withOffsetSameInstant(ZoneOffset.UTC).toLocalDate();
        } catch (DateTimeParseException ignore) {
            // 다음 형식 시도
        }
        try {
            return Instant.parse(s).atOffset(ZoneOffset.UTC).toLocalDate();
        } catch (DateTimeParseException ignore) {
            // 다음 형식 시도
        }
        try {
            return LocalDate.parse(s.length() > 10 ? s.substring(0, 10) : s);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static LocalDate fromEpoch(long v) {
        if (v <= 0) return null;
        Instant i = (v >= EPOCH_MILLIS_THRESHOLD) ? Instant.ofEpochMilli(v) : Instant.ofEpochSecond(v);
        return i.atOffset(ZoneOffset.UTC).toLocalDate();
    }

    private static String text(JsonNode hit, String field) {
        JsonNode n = hit.get(field);
        if (n == null || n.isNull() || n.isContainerNode()) return null;
        return n.asText();
    }

    private static String nullToEmpty(String s) { return s == null ? "" : s; }
}
