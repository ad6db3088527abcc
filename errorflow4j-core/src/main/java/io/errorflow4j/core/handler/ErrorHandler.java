/*
 * Copyright (c) 2025 Errorflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.errorflow4j.core.handler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.errorflow4j.core.api.ErrorClassifier;
import io.errorflow4j.core.api.LogSink;
import io.errorflow4j.core.api.RequestContext;
import io.errorflow4j.core.api.model.CaptureEvent;
import io.errorflow4j.core.api.model.ErrorCategory;
import io.errorflow4j.core.api.model.ErrorRecord;
import io.errorflow4j.core.api.shape.ErrorflowException;
import io.errorflow4j.core.api.shape.HttpClientError;
import io.errorflow4j.core.classify.TaxonomyErrorClassifier;
import io.errorflow4j.core.dedup.DedupCache;
import io.errorflow4j.core.detail.DetailExtractor;
import io.errorflow4j.core.record.ErrorRecordBuilder;
import io.errorflow4j.core.report.NoopReporter;
import io.errorflow4j.core.report.Reporter;
import io.errorflow4j.core.sanitize.DataSanitizer;
import io.errorflow4j.core.sanitize.MessageCleaner;
import io.errorflow4j.core.sanitize.SanitizationDefaults;
import io.errorflow4j.core.sanitize.SanitizationPolicy;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the pipeline: classify, build the canonical record, drop duplicates, sanitize and hand
 * the JSON to the {@link LogSink}.
 *
 * <p>{@link #captureError} never throws. Any failure inside the pipeline is reduced to a fallback record
 * with context {@value #FAILURE_CONTEXT}; if even that cannot be written the failure goes to this class'
 * own SLF4J logger.
 */
public final class ErrorHandler {

    private static final Logger LOG = LoggerFactory.getLogger(ErrorHandler.class);

    public static final String FAILURE_CONTEXT = "Error Handler Failure";
    public static final String NON_FATAL_CONTEXT = "Non-fatal error";
    static final String NON_FATAL_SUFFIX = " (non-fatal)";
    static final String UNKNOWN_TYPE = "Unknown";

    private final ErrorClassifier classifier;
    private final ErrorRecordBuilder recordBuilder;
    private final DetailExtractor detailExtractor;
    private final DataSanitizer sanitizer;
    private final DedupCache cache;
    private final RequestContext requestContext;
    private final LogSink sink;
    private final Reporter reporter;
    private final RecordJsonWriter json;

    private ErrorHandler(Builder b) {
        SanitizationDefaults defaults =
                (b.sanitizationDefaults == null) ? new SanitizationDefaults() : b.sanitizationDefaults;
        ObjectMapper mapper = (b.objectMapper == null) ? new ObjectMapper() : b.objectMapper;

        this.classifier = (b.classifier == null) ? new TaxonomyErrorClassifier() : b.classifier;
        this.sanitizer = new DataSanitizer(defaults);
        this.detailExtractor = new DetailExtractor(sanitizer, mapper);
        this.recordBuilder = new ErrorRecordBuilder(classifier, detailExtractor);
        this.cache = (b.dedupCache == null) ? new DedupCache() : b.dedupCache;
        this.requestContext = (b.requestContext == null) ? RequestContext.none() : b.requestContext;
        this.sink = (b.sink == null) ? new Slf4jLogSink() : b.sink;
        this.reporter = (b.reporter == null) ? new NoopReporter() : b.reporter;
        this.json = new RecordJsonWriter(mapper);
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------- capture ----------------

    public void captureError(Object error, String source) {
        captureError(error, source, null);
    }

    public void captureError(Object error, String source, String context) {
        ErrorCategory category = ErrorCategory.UNKNOWN;
        try {
            if (isExpectedError(error, context)) {
                int status = ((HttpClientError) error).status();
                sink.info("Expected error in negative test [" + context + "]: Status " + status);
                report(source, classifier.categorize(error), CaptureEvent.Outcome.EXPECTED);
                return;
            }

            ErrorRecord record = recordBuilder.build(error, source, context);
            category = record.category();
            if (!cache.markIfAbsent(ErrorRecordBuilder.fingerprint(record))) {
                report(source, category, CaptureEvent.Outcome.DUPLICATE);
                return;
            }

            // details go out on their own line
            sink.error(json.write(sanitizer.sanitizeForLogging(record.withDetails(null).toMap())));

            Map<String, Object> extra = record.details();
            if (extra != null) {
                Map<String, Object> payload = new LinkedHashMap<>();
                payload.put("source", source);
                payload.put("type", extra.get("statusText") instanceof String s && !s.isEmpty() ? s : UNKNOWN_TYPE);
                payload.put("details", extra);
                sink.error(json.write(sanitizer.sanitizeForLogging(payload)));
            }
            report(source, category, CaptureEvent.Outcome.LOGGED);
        } catch (RuntimeException | StackOverflowError | JsonProcessingException e) {
            writeFallback(source, e);
            report(source, category, CaptureEvent.Outcome.HANDLER_FAILURE);
        }
    }

    /** Captures an {@link ErrorflowException} carrying {@code message}, then throws it. */
    public void logAndThrow(String message, String source) {
        ErrorflowException ex = new ErrorflowException(message);
        captureError(ex, source);
        throw ex;
    }

    public void logAndContinue(Object error, String source) {
        logAndContinue(error, source, null);
    }

    public void logAndContinue(Object error, String source, String context) {
        String ctx = (context == null || context.isEmpty()) ? NON_FATAL_CONTEXT : context + NON_FATAL_SUFFIX;
        captureError(error, source, ctx);
    }

    private boolean isExpectedError(Object error, String context) {
        if (context == null || !(error instanceof HttpClientError http) || http.status() == null) return false;
        return requestContext.isExpectedStatus(context, http.status()) && requestContext.isNegativeTest(context);
    }

    private void writeFallback(String source, Throwable failure) {
        try {
            Map<String, Object> fallback = new LinkedHashMap<>();
            fallback.put("source", source);
            fallback.put("context", FAILURE_CONTEXT);
            fallback.put("message", failure.getMessage() == null
                    ? failure.getClass().getSimpleName()
                    : MessageCleaner.clean(failure.getMessage()));
            fallback.put("category", ErrorCategory.UNKNOWN.name());
            sink.error(json.write(fallback));
        } catch (RuntimeException | StackOverflowError | JsonProcessingException e) {
            e.addSuppressed(failure);
            LOG.error("Could not write fallback error record for source {}", source, e);
        }
    }

    private void report(String source, ErrorCategory category, CaptureEvent.Outcome outcome) {
        try {
            reporter.report(new CaptureEvent(source, category, outcome));
        } catch (RuntimeException e) {
            LOG.warn("Reporter failed for outcome {}: {}", outcome, e.toString());
        }
    }

    // ---------------- helpers exposed to callers ----------------

    public String getErrorMessage(Object error) {
        return classifier.extractMessage(error);
    }

    public ErrorRecord createErrorDetails(Object error, String source, String context) {
        return recordBuilder.build(error, source, context);
    }

    public Map<String, Object> extractExtraDetails(Object error) {
        return detailExtractor.extract(error);
    }

    public Map<String, Object> sanitizeObject(Map<?, ?> value) {
        return sanitizer.sanitizeForLogging(value);
    }

    public Object sanitizeData(Object value) {
        return sanitizer.sanitize(value);
    }

    public Object sanitizeData(Object value, SanitizationPolicy policy) {
        return sanitizer.sanitize(value, policy);
    }

    public Map<String, Object> sanitizeByPaths(Map<String, ?> value, List<String> paths) {
        return sanitizer.sanitizeByPaths(value, paths);
    }

    public Map<String, Object> sanitizeByPaths(Map<String, ?> value, List<String> paths, String maskValue) {
        return sanitizer.sanitizeByPaths(value, paths, maskValue);
    }

    /** Forget every fingerprint seen so far. Meant for test isolation. */
    public void resetCache() {
        cache.reset();
    }

    public int cacheSize() {
        return cache.size();
    }

    public static final class Builder {
        private ErrorClassifier classifier;
        private SanitizationDefaults sanitizationDefaults;
        private DedupCache dedupCache;
        private RequestContext requestContext;
        private LogSink sink;
        private Reporter reporter;
        private ObjectMapper objectMapper;

        private Builder() {}

        public Builder classifier(ErrorClassifier classifier) {
            this.classifier = classifier;
            return this;
        }

        public Builder sanitizationDefaults(SanitizationDefaults defaults) {
            this.sanitizationDefaults = defaults;
            return this;
        }

        public Builder dedupCache(DedupCache cache) {
            this.dedupCache = cache;
            return this;
        }

        public Builder requestContext(RequestContext requestContext) {
            this.requestContext = requestContext;
            return this;
        }

        public Builder sink(LogSink sink) {
            this.sink = sink;
            return this;
        }

        public Builder reporter(Reporter reporter) {
            this.reporter = reporter;
            return this;
        }

        public Builder objectMapper(ObjectMapper mapper) {
            this.objectMapper = mapper;
            return this;
        }

        public ErrorHandler build() {
            return new ErrorHandler(this);
        }
    }
}
