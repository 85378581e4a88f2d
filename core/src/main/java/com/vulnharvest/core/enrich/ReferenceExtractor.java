package com.vulnharvest.core.enrich;

import com.vulnharvest.core.model.ReferenceLink;
import com.vulnharvest.core.transform.RecordValidator;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;

/**
 * 상세 HTML에서 "Additional resources" 섹션 링크 추출.
 * h2(텍스트 일치) 뒤 문서 순서상 첫 div[class*=prose] 안의 a[href].
 */
public final class ReferenceExtractor {
    private ReferenceExtractor() {}

    static final String SECTION_TITLE = "Additional resources";

    public static List<ReferenceLink> extract(String html) {
        List<ReferenceLink> out = new ArrayList<>();
        if (html == null || html.isBlank()) return out;

        Document doc = Jsoup.parse(html);
        Element section = findSection(doc);
        if (section == null) return out;

        for (Element a : section.select("a[href]")) {
            String url = a.attr("href").trim();
            String title = a.text().trim();
            if (title.isEmpty()) continue;
            if (!RecordValidator.isAbsoluteHttp(url)) continue; // 상대/비HTTP 링크 제외
            out.add(new ReferenceLink(title, url, ReferenceCategorizer.categorize(url, title)));
        }
        return out;
    }

    /** select 결과는 문서 순서 → 제목 h2 이후 첫 prose div */
    private static Element findSection(Document doc) {
        boolean afterHeading = false;
        for (Element e : doc.select("h2, div[class*=prose]")) {
            if ("h2".equals(e.normalName())) {
                if (!afterHeading && SECTION_TITLE.equalsIgnoreCase(e.text().trim())) afterHeading = true;
                continue;
            }
            if (afterHeading) return e;
        }
        return null;
    }
}
