package com.vulnharvest.core.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/** 취약점 레코드 1건 (id 기준으로 중복 제거되는 단위) */
@JsonDeserialize(builder = VulnRecord.Builder.class)
public final class VulnRecord {
    private final String id;                    // 정규화된 식별자(예: CVE-2025-0001)
    private final Severity severity;
    private final Double score;                 // 0..10, nullable
    private final List<String> technologies;
    private final List<String> component;       // 최대 3개 + 잘림 표시("...")
    private final LocalDate publishedDate;      // nullable
    private final String description;
    private final RecordFlags flags;
    private final String sourceUrl;             // 빈 문자열 허용
    private final List<ReferenceLink> references;

    private VulnRecord(Builder b) {
        this.id = b.id;
        this.severity = (b.severity == null ? Severity.UNKNOWN : b.severity);
        this.score = b.score;
        this.technologies = (b.technologies == null ? List.of() : List.copyOf(b.technologies));
        this.component = (b.component == null ? List.of() : List.copyOf(b.component));
        this.publishedDate = b.publishedDate;
        this.description = (b.description == null ? "" : b.description);
        this.flags = (b.flags == null ? RecordFlags.NONE : b.flags);
        this.sourceUrl = (b.sourceUrl == null ? "" : b.sourceUrl);
        this.references = (b.references == null ? List.of() : List.copyOf(b.references));
    }

    public String getId() { return id; }
    public Severity getSeverity() { return severity; }
    public Double getScore() { return score; }
    public List<String> getTechnologies() { return technologies; }
    public List<String> getComponent() { return component; }
    public LocalDate getPublishedDate() { return publishedDate; }
    public String getDescription() { return description; }
    public RecordFlags getFlags() { return flags; }
    public String getSourceUrl() { return sourceUrl; }
    public List<ReferenceLink> getReferences() { return references; }

    /** 보강 결과(references)만 교체한 사본 */
    public VulnRecord withReferences(List<ReferenceLink> refs) {
        return toBuilder().references(refs).build();
    }

    public Builder toBuilder() {
        return builder()
                .id(id).severity(severity).score(score)
                .technologies(technologies).component(component)
                .publishedDate(publishedDate).description(description)
                .flags(flags).sourceUrl(sourceUrl).references(references);
    }

    public static Builder builder() { return new Builder(); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VulnRecord r)) return false;
        return id.equals(r.id)
                && severity == r.severity
                && Objects.equals(score, r.score)
                && technologies.equals(r.technologies)
                && component.equals(r.component)
                && Objects.equals(publishedDate, r.publishedDate)
                && description.equals(r.description)
                && flags.equals(r.flags)
                && sourceUrl.equals(r.sourceUrl)
                && references.equals(r.references);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, severity, score, technologies, component,
                publishedDate, description, flags, sourceUrl, references);
    }

    @Override
    public String toString() {
        return "VulnRecord{" + id + ", " + severity + ", score=" + score + ", refs=" + references.size() + "}";
    }

    @JsonPOJOBuilder(withPrefix = "")
    public static final class Builder {
        private String id;
        private Severity severity;
        private Double score;
        private List<String> technologies;
        private List<String> component;
        private LocalDate publishedDate;
        private String description;
        private RecordFlags flags;
        private String sourceUrl;
        private List<ReferenceLink> references;

        public Builder id(String id) { this.id = id; return this; }
        public Builder severity(Severity severity) { this.severity = severity; return this; }
        public Builder score(Double score) { this.score = score; return this; }
        public Builder technologies(List<String> technologies) { this.technologies = technologies; return this; }
        public Builder component(List<String> component) { this.component = component; return this; }
        public Builder publishedDate(LocalDate publishedDate) { this.publishedDate = publishedDate; return this; }
        public Builder description(String description) { this.description = description; return this; }
        public Builder flags(RecordFlags flags) { this.flags = flags; return this; }
        public Builder sourceUrl(String sourceUrl) { this.sourceUrl = sourceUrl; return this; }
        public Builder references(List<ReferenceLink> references) { this.references = references; return this; }

        public VulnRecord build() {
            Objects.requireNonNull(id, "id");
            if (id.isBlank()) throw new IllegalArgumentException("id must not be blank");
            return new VulnRecord(this);
        }
    }
}
