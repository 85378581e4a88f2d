package com.vulnharvest.core.enrich;

import java.util.List;
import java.util.Locale;

/** URL/제목 부분문자열 규칙으로 링크 분류. 규칙은 위에서부터 첫 매치 */
public final class ReferenceCategorizer {
    private ReferenceCategorizer() {}

    public static final String OTHER = "Other";

    private record HostRule(String needle, String category) {}

    private static final List<HostRule> HOST_RULES = List.of(
            new HostRule("nvd.nist.gov", "NVD"),
            new HostRule("github.com", "GitHub"),
            new HostRule("gitlab.com", "GitLab"),
            new HostRule("bitbucket.org", "Bitbucket"),
            new HostRule("vuldb.com", "VulDB"),
            new HostRule("cve.mitre.org", "MITRE"),
            new HostRule("exploit-db.com", "Exploit-DB"));

    public static String categorize(String url, String title) {
        String u = (url == null) ? "" : url.toLowerCase(Locale.ROOT);
        String t = (title == null) ? "" : title.toLowerCase(Locale.ROOT);

        for (HostRule r : HOST_RULES) {
            if (u.contains(r.needle())) return r.category();
        }
        if (u.contains("security.") || t.contains("advisory")) return "Security Advisory";
        if (t.contains("patch") || t.contains("fix")) return "Patch/Fix";
        if (t.contains("poc") || t.contains("proof of concept")) return "Proof of Concept";
        return OTHER;
    }
}
