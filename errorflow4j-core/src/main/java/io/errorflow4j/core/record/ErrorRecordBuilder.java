/*
 * Copyright (c) 2025 Errorflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.errorflow4j.core.record;

import io.errorflow4j.core.api.ErrorClassifier;
import io.errorflow4j.core.api.model.ErrorRecord;
import io.errorflow4j.core.api.shape.HttpClientError;
import io.errorflow4j.core.detail.DetailExtractor;
import io.errorflow4j.core.sanitize.UrlPaths;
import java.util.Map;
import java.util.Objects;

/** Turns a raw error into the canonical {@link ErrorRecord} and derives its dedup fingerprint. */
public final class ErrorRecordBuilder {

    static final int MAX_MESSAGE_LENGTH = 1000;
    static final int FINGERPRINT_MESSAGE_PREFIX = 50;

    private final ErrorClassifier classifier;
    private final DetailExtractor detailExtractor;

    public ErrorRecordBuilder(ErrorClassifier classifier, DetailExtractor detailExtractor) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.detailExtractor = Objects.requireNonNull(detailExtractor, "detailExtractor");
    }

    public ErrorRecord build(Object error, String source, String context) {
        Objects.requireNonNull(source, "source");
        String ctx = (context == null || context.isBlank()) ? classifier.inferContext(error) : context;

        String message = classifier.extractMessage(error);
        if (message.length() > MAX_MESSAGE_LENGTH) {
            message = message.substring(0, MAX_MESSAGE_LENGTH) + "...";
        }

        Integer status = null;
        String url = null;
        if (error instanceof HttpClientError http && http.status() != null) {
            status = http.status();
            url = UrlPaths.pathOf(http.requestUrl());
        }
        Map<String, Object> details = detailExtractor.extract(error);
        return new ErrorRecord(source, ctx, message, classifier.categorize(error), status, url,
                details.isEmpty() ? null : details);
    }

    /** {@code source_CATEGORY_first-50-chars-of-message}. */
    public static String fingerprint(ErrorRecord record) {
        String msg = record.message();
        String prefix = msg.length() > FINGERPRINT_MESSAGE_PREFIX ? msg.substring(0, FINGERPRINT_MESSAGE_PREFIX) : msg;
        return record.source() + "_" + record.category().name() + "_" + prefix;
    }
}
