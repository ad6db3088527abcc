/*
 * Copyright (c) 2025 Errorflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.errorflow4j.spring.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.errorflow4j.core.api.ErrorClassifier;
import io.errorflow4j.core.api.LogSink;
import io.errorflow4j.core.api.RequestContext;
import io.errorflow4j.core.classify.TaxonomyErrorClassifier;
import io.errorflow4j.core.dedup.DedupCache;
import io.errorflow4j.core.handler.ErrorHandler;
import io.errorflow4j.core.handler.RequestExpectations;
import io.errorflow4j.core.handler.Slf4jLogSink;
import io.errorflow4j.core.report.NoopReporter;
import io.errorflow4j.core.report.Reporter;
import io.errorflow4j.core.sanitize.SanitizationDefaults;
import io.errorflow4j.core.sanitize.SanitizationPolicy;
import io.errorflow4j.spring.ErrorflowEndpoint;
import io.errorflow4j.spring.ErrorflowProperties;
import io.errorflow4j.spring.MicrometerReporter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.HashSet;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.autoconfigure.endpoint.condition.ConditionalOnAvailableEndpoint;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Wires the capture pipeline. Every collaborator can be replaced by declaring a bean of the same type;
 * metrics are reported through Micrometer when a {@link MeterRegistry} is present.
 */
@AutoConfiguration(
        afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@EnableConfigurationProperties(ErrorflowProperties.class)
@ConditionalOnProperty(prefix = "errorflow4j", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ErrorflowAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public SanitizationDefaults errorflowSanitizationDefaults(ErrorflowProperties props) {
        var s = props.getSanitization();
        return new SanitizationDefaults(new SanitizationPolicy(
                new HashSet<>(s.getSensitiveKeys()),
                s.getMaskValue(),
                new HashSet<>(s.getSkipProperties()),
                s.isTruncateUrls(),
                s.getMaxStringLength()));
    }

    @Bean
    @ConditionalOnMissingBean
    public DedupCache errorflowDedupCache(ErrorflowProperties props) {
        return new DedupCache(props.getDedup().getMaxEntries());
    }

    @Bean
    @ConditionalOnMissingBean(RequestContext.class)
    public RequestExpectations errorflowRequestExpectations() {
        return new RequestExpectations();
    }

    @Bean
    @ConditionalOnMissingBean
    public ErrorClassifier errorflowClassifier() {
        return new TaxonomyErrorClassifier();
    }

    @Bean
    @ConditionalOnMissingBean
    public LogSink errorflowLogSink(ErrorflowProperties props) {
        return new Slf4jLogSink(props.getLoggerName());
    }

    @Bean
    @ConditionalOnMissingBean(Reporter.class)
    public Reporter errorflowReporter(ObjectProvider<MeterRegistry> registry, ErrorflowProperties props) {
        MeterRegistry r = registry.getIfAvailable();
        return (r == null) ? new NoopReporter() : new MicrometerReporter(r, props.getMetrics().getRecentEvents());
    }

    @Bean
    @ConditionalOnMissingBean
    public ErrorHandler errorHandler(
            ErrorClassifier classifier,
            SanitizationDefaults defaults,
            DedupCache cache,
            RequestContext requestContext,
            LogSink sink,
            Reporter reporter,
            ObjectProvider<ObjectMapper> objectMapper) {
        return ErrorHandler.builder()
                .classifier(classifier)
                .sanitizationDefaults(defaults)
                .dedupCache(cache)
                .requestContext(requestContext)
                .sink(sink)
                .reporter(reporter)
                .objectMapper(objectMapper.getIfAvailable(ObjectMapper::new))
                .build();
    }

    @Bean
    @ConditionalOnClass(name = "org.springframework.boot.actuate.endpoint.annotation.Endpoint")
    @ConditionalOnAvailableEndpoint(endpoint = ErrorflowEndpoint.class)
    public ErrorflowEndpoint errorflowEndpoint(ErrorHandler handler, Reporter reporter) {
        return new ErrorflowEndpoint(handler, reporter);
    }
}
