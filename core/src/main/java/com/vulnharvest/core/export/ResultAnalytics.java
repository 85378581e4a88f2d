package com.vulnharvest.core.export;

import com.vulnharvest.core.model.Severity;
import com.vulnharvest.core.model.VulnRecord;
import com.vulnharvest.core.transform.RecordValidator;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** 결과 집합 통계: 심각도 분포, 점수 구간, 상위 기술/컴포넌트, 공개일 범위, 평균 점수 */
public final class ResultAnalytics {
    private ResultAnalytics() {}

    static final int TOP_N = 10;
    static final List<String> SCORE_BUCKETS = List.of("0-3", "3-7", "7-9", "9-10");

    public record Count(String name, long count) {}

    public record Report(int total,
                         Map<String, Long> severityDistribution,
                         Map<String, Long> scoreBuckets,
                         List<Count> topTechnologies,
                         List<Count> topComponents,
                         LocalDate earliestPublished,
                         LocalDate latestPublished,
                         long validWithReferences,
                         Double averageScore) {}

    public static Report analyze(List<VulnRecord> records) {
        List<VulnRecord> rs = (records == null) ? List.of() : records;

        Map<Severity, Long> sev = new EnumMap<>(Severity.class);
        for (Severity s : Severity.values()) sev.put(s, 0L);
        Map<String, Long> buckets = new LinkedHashMap<>();
        SCORE_BUCKETS.forEach(b -> buckets.put(b, 0L));
        Map<String, Long> tech = new HashMap<>();
        Map<String, Long> comp = new HashMap<>();
        LocalDate earliest = null, latest = null;
        long validWithRefs = 0;
        double scoreSum = 0;
        long scored = 0;

        for (VulnRecord r : rs) {
            sev.merge(r.getSeverity(), 1L, Long::sum);

            Double s = r.getScore();
            if (s != null) {
                buckets.merge(bucketOf(s), 1L, Long::sum);
                scoreSum += s;
                scored++;
            }
            for (String t : r.getTechnologies()) tech.merge(t, 1L, Long::sum);
            for (String c : r.getComponent()) {
                if (!"...".equals(c)) comp.merge(c, 1L, Long::sum);
            }

            LocalDate d = r.getPublishedDate();
            if (d != null) {
                if (earliest == null || d.isBefore(earliest)) earliest = d;
                if (latest == null || d.isAfter(latest)) latest = d;
            }
            // 유효하지 않은 레코드는 참조 기반 통계에서 제외
            if (!r.getReferences().isEmpty() && RecordValidator.isValid(r)) validWithRefs++;
        }

        Map<String, Long> sevOut = new LinkedHashMap<>();
        sev.forEach((k, v) -> sevOut.put(k.name(), v));

        Double avg = (scored == 0) ? null
                : BigDecimal.valueOf(scoreSum / scored).setScale(2, RoundingMode.HALF_UP).doubleValue();

        return new Report(rs.size(), sevOut, buckets, top(tech), top(comp),
                earliest, latest, validWithRefs, avg);
    }

    /** 경계값은 위 구간: 3.0 → 3-7, 7.0 → 7-9, 9.0 → 9-10 */
    static String bucketOf(double score) {
        if (score < 3.0) return "0-3";
        if (score < 7.0) return "3-7";
        if (score < 9.0) return "7-9";
        return "9-10";
    }

    private static List<Count> top(Map<String, Long> counts) {
        List<Count> out = new ArrayList<>();
        counts.forEach((k, v) -> out.add(new Count(k, v)));
        out.sort(Comparator.comparingLong(Count::count).reversed().thenComparing(Count::name));
        return out.size() > TOP_N ? new ArrayList<>(out.subList(0, TOP_N)) : out;
    }
}
