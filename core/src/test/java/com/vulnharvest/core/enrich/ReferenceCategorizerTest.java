package com.vulnharvest.core.enrich;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ReferenceCategorizerTest {

    @Test
    void host_rules() {
        assertThat(ReferenceCategorizer.categorize("https://nvd.nist.gov/vuln/detail/CVE-1", "x")).isEqualTo("NVD");
        assertThat(ReferenceCategorizer.categorize("https://GitHub.com/a/b", "x")).isEqualTo("GitHub");
        assertThat(ReferenceCategorizer.categorize("https://gitlab.com/a/b", "x")).isEqualTo("GitLab");
        assertThat(ReferenceCategorizer.categorize("https://bitbucket.org/a", "x")).isEqualTo("Bitbucket");
        assertThat(ReferenceCategorizer.categorize("https://vuldb.com/?id.1", "x")).isEqualTo("VulDB");
        assertThat(ReferenceCategorizer.categorize("https://cve.mitre.org/cgi-bin", "x")).isEqualTo("MITRE");
        assertThat(ReferenceCategorizer.categorize("https://www.exploit-db.com/exploits/1", "x")).isEqualTo("Exploit-DB");
    }

    @Test
    void host_rules_win_over_title_rules() {
        // github 링크 제목에 patch가 있어도 GitHub
        assertThat(ReferenceCategorizer.categorize("https://github.com/a/b/pull/1", "Patch for overflow")).isEqualTo("GitHub");
    }

    @Test
    void title_rules_in_order() {
        assertThat(ReferenceCategorizer.categorize("https://security.vendor.com/x", "notes")).isEqualTo("Security Advisory");
        assertThat(ReferenceCategorizer.categorize("https://vendor.com/x", "Vendor ADVISORY")).isEqualTo("Security Advisory");
        assertThat(ReferenceCategorizer.categorize("https://vendor.com/x", "Hotfix released")).isEqualTo("Patch/Fix");
        assertThat(ReferenceCategorizer.categorize("https://blog.example/x", "PoC exploit")).isEqualTo("Proof of Concept");
        assertThat(ReferenceCategorizer.categorize("https://blog.example/x", "Proof of Concept write-up")).isEqualTo("Proof of Concept");
        assertThat(ReferenceCategorizer.categorize("https://blog.example/x", "Analysis")).isEqualTo("Other");
    }
}
