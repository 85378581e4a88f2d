package com.vulnharvest.core.config;

import com.vulnharvest.core.model.FacetFilter;

import java.util.ArrayList;
import java.util.List;

/**
 * 기본 facet 목록(기술 스택 기준).
 * 단일 무필터 쿼리는 업스트림 페이지네이션 한도에 걸리므로 기술별로 코퍼스를 나눠 훑는다.
 * 목록은 고정 열거이며 실행 중 동적으로 발견하지 않는다.
 */
public final class FacetCatalog {
    private FacetCatalog() {}

    public static final String TECHNOLOGY_ATTRIBUTE = "affectedTechnologies.filter";

    private static final List<String> TECHNOLOGIES = List.of(
            "Linux", "Windows", "macOS", "Android", "iOS",
            "Apache HTTP Server", "Nginx", "Microsoft IIS", "Apache Tomcat",
            "Java", "Python", "Node.js", "PHP", "Go", "Ruby", ".NET",
            "WordPress", "Drupal", "Joomla",
            "MySQL", "PostgreSQL", "MongoDB", "Redis", "Elasticsearch",
            "Docker", "Kubernetes", "Jenkins", "GitLab",
            "OpenSSL", "OpenSSH", "Chrome", "Firefox", "Microsoft Office"
    );

    /** 기본 facet 전체 */
    public static List<FacetFilter> defaults() {
        List<FacetFilter> out = new ArrayList<>(TECHNOLOGIES.size());
        for (String t : TECHNOLOGIES) out.add(technology(t));
        return List.copyOf(out);
    }

    /** "affectedTechnologies.filter:<name>" 토큰 생성 */
    public static FacetFilter technology(String name) {
        return FacetFilter.of(name, TECHNOLOGY_ATTRIBUTE + ":" + name);
    }
}
