package com.kpisentinel.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads the tracked-metric catalog from YAML. A catalog that names the same
 * metric twice or an unknown impact profile fails with
 * {@link IllegalStateException}; an empty one tracks nothing.
 */
public final class MetricCatalogLoader {

    private static final Logger LOG = LoggerFactory.getLogger(MetricCatalogLoader.class);

    /** Catalog bundled with the engine. */
    public static final String DEFAULT_RESOURCE = "metrics.yml";

    private MetricCatalogLoader() {
    }

    /**
     * Reads {@code path} when it names a regular file, else the bundled
     * {@value #DEFAULT_RESOURCE}.
     *
     * @param path configured catalog file, may be {@code null}
     */
    public static MetricCatalog load(String path) {
        if (path == null || path.isBlank() || !Files.isRegularFile(Path.of(path))) {
            return fromClasspath(DEFAULT_RESOURCE);
        }
        try (InputStream in = Files.newInputStream(Path.of(path))) {
            return read(in, path);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read metric catalog " + path, e);
        }
    }

    /**
     * @throws IllegalArgumentException when no such resource is on the classpath
     */
    public static MetricCatalog fromClasspath(String resource) {
        Objects.requireNonNull(resource, "resource must not be null");
        InputStream in = MetricCatalogLoader.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new IllegalArgumentException("Metric catalog resource not found: " + resource);
        }
        try (in) {
            return read(in, "classpath:" + resource);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read metric catalog classpath:" + resource, e);
        }
    }

    private static MetricCatalog read(InputStream in, String source) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        MetricCatalog catalog = new Yaml(new Constructor(MetricCatalog.class, options)).load(in);
        if (catalog == null || catalog.getMetrics().isEmpty()) {
            LOG.warn("Metric catalog {} tracks no metrics", source);
            return new MetricCatalog();
        }
        catalog.validate();
        LOG.info("Metric catalog {} tracks {} metric(s)", source, catalog.getMetrics().size());
        return catalog;
    }
}
