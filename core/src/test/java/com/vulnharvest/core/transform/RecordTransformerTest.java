package com.vulnharvest.core.transform;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vulnharvest.core.model.RecordFlags;
import com.vulnharvest.core.model.Severity;
import com.vulnharvest.core.model.VulnRecord;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.*;

class RecordTransformerTest {

    private final ObjectMapper om = new ObjectMapper();
    private final RecordTransformer tx = new RecordTransformer(1000);

    private JsonNode json(String s) throws Exception {
        return om.readTree(s);
    }

    @Test
    void maps_full_hit() throws Exception {
        VulnRecord r = tx.transform(json("""
                {
                  "externalId": "cve-2024-1234",
                  "severity": "high",
                  "cvssScore": 8.1,
                  "affectedTechnologies": [{"name":"Linux"}, {"name":"OpenSSL"}],
                  "affectedSoftware": ["openssl", "libssl", "nginx", "curl", "wget"],
                  "publishedAt": "2024-03-05T10:15:00Z",
                  "description": "  Buffer\\u0007 overflow\\n\\n in   parser  ",
                  "sourceUrl": "https://nvd.nist.gov/vuln/detail/CVE-2024-1234",
                  "hasFix": true,
                  "exploitable": false,
                  "isHighProfileThreat": true,
                  "hasCisaKevExploit": true
                }"""));

        assertThat(r.getId()).isEqualTo("CVE-2024-1234");
        assertThat(r.getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(r.getScore()).isEqualTo(8.1);
        assertThat(r.getTechnologies()).containsExactly("Linux", "OpenSSL");
        assertThat(r.getComponent()).containsExactly("openssl", "libssl", "nginx", "...");
        assertThat(r.getPublishedDate()).isEqualTo(LocalDate.of(2024, 3, 5));
        assertThat(r.getDescription()).isEqualTo("Buffer overflow in parser");
        assertThat(r.getFlags()).isEqualTo(new RecordFlags(true, false, true, true));
        assertThat(r.getSourceUrl()).startsWith("https://nvd.nist.gov/");
        assertThat(r.getReferences()).isEmpty();
    }

    @Test
    void identifier_falls_back_in_order_and_missing_id_yields_null() throws Exception {
        assertThat(tx.transform(json("{\"name\":\"CVE-2023-1\",\"id\":\"x\"}")).getId()).isEqualTo("CVE-2023-1");
        assertThat(tx.transform(json("{\"externalId\":\"  \",\"id\":\"GHSA-xxxx\"}")).getId()).isEqualTo("GHSA-xxxx");
        assertThat(tx.transform(json("{\"objectID\":\"cve-2022-9\"}")).getId()).isEqualTo("CVE-2022-9");

        assertThat(tx.transform(json("{\"severity\":\"LOW\"}"))).isNull();
        assertThat(tx.transform(json("{\"externalId\":\"\"}"))).isNull();
        assertThat(tx.transform(json("[1,2]"))).isNull();
        assertThat(tx.transform(null)).isNull();
    }

    @Test
    void score_accepts_text_and_rejects_out_of_range() throws Exception {
        assertThat(tx.transform(json("{\"id\":\"a\",\"score\":\"7.5\"}")).getScore()).isEqualTo(7.5);
        assertThat(tx.transform(json("{\"id\":\"a\",\"cvssScore\":11}")).getScore()).isNull();
        assertThat(tx.transform(json("{\"id\":\"a\",\"score\":\"N/A\"}")).getScore()).isNull();
        assertThat(tx.transform(json("{\"id\":\"a\"}")).getScore()).isNull();
    }

    @Test
    void published_date_formats() throws Exception {
        assertThat(tx.transform(json("{\"id\":\"a\",\"publishedAt\":\"2021-12-10\"}")).getPublishedDate())
                .isEqualTo(LocalDate.of(2021, 12, 10));
        // epoch 초
        assertThat(tx.transform(json("{\"id\":\"a\",\"publishedAt\":1639094400}")).getPublishedDate())
                .isEqualTo(LocalDate.of(2021, 12, 10));
        // epoch 밀리초
        assertThat(tx.transform(json("{\"id\":\"a\",\"publishedAt\":1639094400000}")).getPublishedDate())
                .isEqualTo(LocalDate.of(2021, 12, 10));
        assertThat(tx.transform(json("{\"id\":\"a\",\"publishedAt\":\"yesterday\"}")).getPublishedDate()).isNull();
    }

    @Test
    void description_is_bounded_and_severity_defaults_to_unknown() throws Exception {
        RecordTransformer shortTx = new RecordTransformer(10);
        VulnRecord r = shortTx.transform(json("{\"id\":\"a\",\"description\":\"0123456789abcdef\",\"severity\":\"weird\"}"));

        assertThat(r.getDescription()).isEqualTo("0123456789");
        assertThat(r.getSeverity()).isEqualTo(Severity.UNKNOWN);
    }

    @Test
    void transform_is_total_over_odd_inputs() throws Exception {
        String[] odd = {
                "{}", "{\"id\":null}", "{\"id\":{\"nested\":1}}", "{\"id\":\"a\",\"affectedSoftware\":\"notalist\"}",
                "{\"id\":\"a\",\"affectedTechnologies\":[null, 3, {\"name\":\"\"}]}", "{\"id\":\"a\",\"hasFix\":\"yes\"}"
        };
        for (String s : odd) {
            assertThatCode(() -> tx.transform(json(s))).doesNotThrowAnyException();
        }
    }

    @Test
    void text_cleaner_strips_controls_and_collapses_whitespace() {
        assertThat(TextCleaner.clean("a\u0000b\t\tc \r\n d")).isEqualTo("ab c d");
        assertThat(TextCleaner.clean(null)).isEmpty();
        assertThat(TextCleaner.bound("abcdef", 3)).isEqualTo("abc");
        assertThat(TextCleaner.bound("abc", 0)).isEmpty();
    }
}
