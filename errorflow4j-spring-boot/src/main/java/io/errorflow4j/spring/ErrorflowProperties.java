/*
 * Copyright (c) 2025 Errorflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.errorflow4j.spring;

import io.errorflow4j.core.dedup.DedupCache;
import io.errorflow4j.core.handler.Slf4jLogSink;
import io.errorflow4j.core.sanitize.SanitizationPolicy;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "errorflow4j")
public class ErrorflowProperties {

    private boolean enabled = true;

    /** SLF4J logger the captured records are written to. */
    private String loggerName = Slf4jLogSink.DEFAULT_LOGGER_NAME;

    private Sanitization sanitization = new Sanitization();

    private Dedup dedup = new Dedup();

    private Metrics metrics = new Metrics();

    public void setSanitization(Sanitization sanitization) {
        this.sanitization = (sanitization == null) ? new Sanitization() : sanitization;
    }

    public void setDedup(Dedup dedup) {
        this.dedup = (dedup == null) ? new Dedup() : dedup;
    }

    public void setMetrics(Metrics metrics) {
        this.metrics = (metrics == null) ? new Metrics() : metrics;
    }

    // ---- nested: sanitization ----
    public static final class Sanitization {
        private List<String> sensitiveKeys = new ArrayList<>(SanitizationPolicy.DEFAULT_SENSITIVE_KEYS);

        @Setter
        @Getter
        private String maskValue = SanitizationPolicy.DEFAULT_MASK;

        private List<String> skipProperties = new ArrayList<>();

        @Setter
        @Getter
        private boolean truncateUrls = false;

        @Setter
        @Getter
        private Integer maxStringLength; // null = no limit

        public List<String> getSensitiveKeys() {
            return Collections.unmodifiableList(sensitiveKeys);
        }

        public void setSensitiveKeys(List<String> v) {
            this.sensitiveKeys = new ArrayList<>(Objects.requireNonNullElse(v, List.of()));
        }

        public List<String> getSkipProperties() {
            return Collections.unmodifiableList(skipProperties);
        }

        public void setSkipProperties(List<String> v) {
            this.skipProperties = new ArrayList<>(Objects.requireNonNullElse(v, List.of()));
        }
    }

    // ---- nested: dedup ----
    public static final class Dedup {
        @Setter
        @Getter
        private int maxEntries = DedupCache.DEFAULT_MAX_ENTRIES;
    }

    // ---- nested: metrics ----
    public static final class Metrics {
        /** Size of the recent-events ring buffer shown by the actuator endpoint. */
        @Setter
        @Getter
        private int recentEvents = 200;
    }
}
