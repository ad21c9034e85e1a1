package com.healthrelay.alerting.alertmanager;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.healthrelay.alerting.exception.ProviderConfigException;
import com.healthrelay.core.model.ClientConfig;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record AlertmanagerConfig(
        @JsonProperty("url") String url,
        @JsonProperty("timeout") Duration timeout,
        @JsonProperty("default-severity") String defaultSeverity,
        @JsonProperty("extra-labels") Map<String, String> extraLabels,
        @JsonProperty("extra-annotations") Map<String, String> extraAnnotations,
        @JsonProperty("client") ClientConfig client
) {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);
    public static final String DEFAULT_SEVERITY = "critical";

    public AlertmanagerConfig {
        extraLabels = copyOf(extraLabels);
        extraAnnotations = copyOf(extraAnnotations);
    }

    public static AlertmanagerConfig forUrl(String url) {
        return new AlertmanagerConfig(url, null, null, null, null, null);
    }

    public static AlertmanagerConfig empty() {
        return new AlertmanagerConfig(null, null, null, null, null, null);
    }

    public AlertmanagerConfig validate() {
        if (!isPresent(url)) {
            throw new ProviderConfigException("alertmanager URL not set");
        }
        return new AlertmanagerConfig(
                url,
                isPresent(timeout) ? timeout : DEFAULT_TIMEOUT,
                isPresent(defaultSeverity) ? defaultSeverity : DEFAULT_SEVERITY,
                extraLabels,
                extraAnnotations,
                client
        );
    }

    // union of the maps, override wins per key; client is replaced as a whole
    public AlertmanagerConfig merge(AlertmanagerConfig override) {
        if (override == null) {
            return this;
        }
        return new AlertmanagerConfig(
                isPresent(override.url()) ? override.url() : url,
                isPresent(override.timeout()) ? override.timeout() : timeout,
                isPresent(override.defaultSeverity()) ? override.defaultSeverity() : defaultSeverity,
                union(extraLabels, override.extraLabels()),
                union(extraAnnotations, override.extraAnnotations()),
                override.client() != null ? override.client() : client
        );
    }

    private static Map<String, String> union(Map<String, String> base, Map<String, String> override) {
        if (override == null || override.isEmpty()) {
            return base;
        }
        Map<String, String> merged = base == null ? new LinkedHashMap<>() : new LinkedHashMap<>(base);
        merged.putAll(override);
        return merged;
    }

    private static Map<String, String> copyOf(Map<String, String> source) {
        if (source == null) {
            return null;
        }
        Map<String, String> copy = new LinkedHashMap<>();
        // "key:" with no value in YAML arrives as null
        source.forEach((key, value) -> copy.put(key, value == null ? "" : value));
        return Collections.unmodifiableMap(copy);
    }

    private static boolean isPresent(String value) {
        return value != null && !value.isEmpty();
    }

    private static boolean isPresent(Duration value) {
        return value != null && !value.isZero() && !value.isNegative();
    }
}
