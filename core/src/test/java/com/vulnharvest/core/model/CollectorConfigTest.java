package com.vulnharvest.core.model;

import static org.assertj.core.api.Assertions.*;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.vulnharvest.core.config.FacetCatalog;

class CollectorConfigTest {

    @Test
    void defaultsAreValid() {
        CollectorConfig cfg = CollectorConfig.defaults();
        cfg.validate();

        assertThat(cfg.getPageSize()).isEqualTo(20);
        assertThat(cfg.getPerSweepCap()).isEqualTo(1000);
        assertThat(cfg.getConcurrency()).isEqualTo(3);
        assertThat(cfg.getMaxRecords()).isEqualTo(50_000);
        assertThat(cfg.getPageDelay()).isEqualTo(Duration.ofSeconds(1));
        assertThat(cfg.getGroupDelay()).isEqualTo(Duration.ofSeconds(2));
        assertThat(cfg.getTimeoutMs()).isEqualTo(30_000L);
        assertThat(cfg.isCheckpointsEnabled()).isFalse();
        assertThat(cfg.getCheckpointDir()).isEqualTo(Path.of("checkpoints"));
        assertThat(cfg.getFacets()).hasSameSizeAs(FacetCatalog.defaults());
    }

    @Test
    void settersClampToLowerBounds() {
        CollectorConfig cfg = CollectorConfig.defaults()
                .setConcurrency(0)
                .setPageSize(-3)
                .setMaxRecords(0)
                .setPageDelay(Duration.ofMillis(-5))
                .setTimeoutMs(0);

        assertThat(cfg.getConcurrency()).isEqualTo(1);
        assertThat(cfg.getPageSize()).isEqualTo(1);
        assertThat(cfg.getMaxRecords()).isEqualTo(1);
        assertThat(cfg.getPageDelay()).isEqualTo(Duration.ZERO);
        assertThat(cfg.getTimeoutMs()).isEqualTo(1L);
        cfg.validate(); // 여전히 유효해야 함
    }

    @Test
    void concurrencyIsClampedToUpperBound() {
        CollectorConfig cfg = CollectorConfig.defaults().setConcurrency(Integer.MAX_VALUE);

        assertThat(cfg.getConcurrency()).isEqualTo(CollectorConfig.MAX_CONCURRENCY);
        cfg.validate();
    }

    @Test
    void facetsNullMeansCatalogAndEmptyMeansUnfilteredOnly() {
        CollectorConfig cfg = CollectorConfig.defaults().setFacets(List.of());
        assertThat(cfg.getFacets()).isEmpty();

        cfg.setFacets(null);
        assertThat(cfg.getFacets()).isEqualTo(FacetCatalog.defaults());
    }

    @Test
    void validateRejectsBlankSearchUrl() {
        CollectorConfig cfg = CollectorConfig.defaults().setSearchUrl("  ");

        assertThatThrownBy(cfg::validate)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("searchUrl");
    }

    @Test
    void validateRejectsBlankOutputName() {
        CollectorConfig cfg = CollectorConfig.defaults().setOutputName("");

        assertThatThrownBy(cfg::validate)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("outputName");
    }

    @Test
    void facetTokenMustNotBeBlank() {
        assertThatThrownBy(() -> FacetFilter.of("x", " "))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(FacetFilter.of(null, "a:b").label()).isEqualTo("a:b");
        assertThat(FacetCatalog.technology("Linux").token()).isEqualTo("affectedTechnologies.filter:Linux");
    }
}
