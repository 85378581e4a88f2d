package com.vulnharvest.core.transform;

import com.vulnharvest.core.model.ReferenceLink;
import com.vulnharvest.core.model.VulnRecord;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * 구조 검증(권고용). 위반 사항 목록만 돌려주고 레코드를 버리지 않는다.
 * 호출자는 WARN 로그 + 통계 집계만 한다.
 */
public final class RecordValidator {
    private RecordValidator() {}

    private static final Pattern CVE_ID = Pattern.compile("^CVE-\\d{4}-\\d+$");

    /** 비어 있으면 유효 */
    public static List<String> violations(VulnRecord r) {
        List<String> out = new ArrayList<>();
        if (r == null) {
            out.add("record is null");
            return out;
        }
        if (!CVE_ID.matcher(r.getId()).matches()) out.add("id not CVE-YYYY-N: " + r.getId());
        Double s = r.getScore();
        if (s != null && (s < 0.0 || s > 10.0)) out.add("score out of range: " + s);
        if (!r.getSourceUrl().isEmpty() && !isAbsoluteHttp(r.getSourceUrl())) {
            out.add("sourceUrl not absolute http(s): " + r.getSourceUrl());
        }
        for (ReferenceLink l : r.getReferences()) {
            if (!isAbsoluteHttp(l.url())) out.add("reference url not absolute http(s): " + l.url());
        }
        return out;
    }

    public static boolean isValid(VulnRecord r) {
        return violations(r).isEmpty();
    }

    public static boolean isAbsoluteHttp(String url) {
        if (url == null || url.isBlank()) return false;
        try {
            URI u = URI.create(url.trim());
            String scheme = u.getScheme();
            return u.isAbsolute()
                    && ("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))
                    && u.getHost() != null;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
