package com.kpisentinel.core.config;

import com.kpisentinel.core.risk.ImpactProfile;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link MetricCatalogLoader}.
 */
class MetricCatalogLoaderTest {

    @Test
    @DisplayName("Should load a catalog from the classpath")
    void shouldLoadFromClasspath() {
        MetricCatalog catalog = MetricCatalogLoader.fromClasspath("test-metrics.yml");

        assertThat(catalog.metricNames()).containsExactly("test_fail_rate", "test_signups");
        assertThat(catalog.profileFor("test_fail_rate")).isEqualTo(ImpactProfile.RATE_INCREASE);
        assertThat(catalog.profileFor("test_signups")).isEqualTo(ImpactProfile.ACTIVITY_DROP);
    }

    @Test
    @DisplayName("Should fall back to the activity-drop profile for unlisted metrics")
    void shouldFallBackForUnknownMetric() {
        MetricCatalog catalog = MetricCatalogLoader.fromClasspath("test-metrics.yml");

        assertThat(catalog.profileFor("something_else")).isEqualTo(MetricCatalog.FALLBACK_PROFILE);
    }

    @Test
    @DisplayName("Should ship a default catalog with the four business KPIs")
    void shouldLoadBundledCatalog() {
        MetricCatalog catalog = MetricCatalogLoader.load(null);

        assertThat(catalog.metricNames()).containsExactly("tx_fail_rate", "latency_p95_ms", "tx_completed", "dau");
        assertThat(catalog.profileFor("tx_fail_rate")).isEqualTo(ImpactProfile.RATE_INCREASE);
        assertThat(catalog.profileFor("latency_p95_ms")).isEqualTo(ImpactProfile.LATENCY_INCREASE);
        assertThat(catalog.profileFor("tx_completed")).isEqualTo(ImpactProfile.VOLUME_DROP);
        assertThat(catalog.profileFor("dau")).isEqualTo(ImpactProfile.ACTIVITY_DROP);
    }

    @Test
    @DisplayName("Should prefer an existing catalog file over the bundled one")
    void shouldLoadFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("metrics.yml");
        Files.writeString(file, "metrics:\n  - name: refunds\n    impact: volume_drop\n");

        MetricCatalog catalog = MetricCatalogLoader.load(file.toString());

        assertThat(catalog.metricNames()).containsExactly("refunds");
    }

    @Test
    @DisplayName("Should use the bundled catalog when the configured file does not exist")
    void shouldIgnoreMissingFile(@TempDir Path dir) {
        MetricCatalog catalog = MetricCatalogLoader.load(dir.resolve("absent.yml").toString());

        assertThat(catalog.metricNames()).hasSize(4);
    }

    @Test
    @DisplayName("Should use the bundled catalog when the configured path is a directory")
    void shouldIgnoreDirectoryPath(@TempDir Path dir) {
        MetricCatalog catalog = MetricCatalogLoader.load(dir.toString());

        assertThat(catalog.metricNames()).containsExactly("tx_fail_rate", "latency_p95_ms", "tx_completed", "dau");
    }

    @Test
    @DisplayName("An empty catalog file should track no metrics")
    void shouldTrackNothingForEmptyFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("empty.yml");
        Files.writeString(file, "");

        assertThat(MetricCatalogLoader.load(file.toString()).metricNames()).isEmpty();
    }

    @Test
    @DisplayName("Should reject duplicate metric names")
    void shouldRejectDuplicates() {
        assertThatThrownBy(() -> MetricCatalogLoader.fromClasspath("duplicate-metrics.yml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Duplicate metric 'dau'");
    }

    @Test
    @DisplayName("Should reject an unknown impact profile")
    void shouldRejectUnknownProfile() {
        assertThatThrownBy(() -> MetricCatalogLoader.fromClasspath("unknown-profile-metrics.yml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("sideways");
    }

    @Test
    @DisplayName("Should throw when classpath resource does not exist")
    void shouldThrowForMissingResource() {
        assertThatThrownBy(() -> MetricCatalogLoader.fromClasspath("does-not-exist.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }
}
