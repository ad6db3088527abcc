/*
 * Copyright (c) 2025 Errorflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.errorflow4j.core.api.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Canonical, already-cleaned representation of a captured error.
 *
 * @param source     component/operation that reported the error (required)
 * @param context    inferred or caller-supplied label, never blank
 * @param message    cleaned single-line message
 * @param category   taxonomy member, {@link ErrorCategory#UNKNOWN} when nothing matched
 * @param statusCode HTTP status, only for HTTP-shaped errors (nullable)
 * @param url        request path, only for HTTP-shaped errors (nullable)
 * @param details    sanitized extras (nullable)
 */
public record ErrorRecord(
        String source,
        String context,
        String message,
        ErrorCategory category,
        Integer statusCode,
        String url,
        Map<String, Object> details) {

    public static final String DEFAULT_CONTEXT = "General Error";

    public ErrorRecord {
        Objects.requireNonNull(source, "source");
        context = (context == null || context.isBlank()) ? DEFAULT_CONTEXT : context;
        message = (message == null) ? "" : message;
        category = (category == null) ? ErrorCategory.UNKNOWN : category;
        details = (details == null) ? null : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static ErrorRecord of(String source, String context, String message, ErrorCategory category) {
        return new ErrorRecord(source, context, message, category, null, null, null);
    }

    public ErrorRecord withDetails(Map<String, Object> extra) {
        return new ErrorRecord(source, context, message, category, statusCode, url, extra);
    }

    /** Insertion-ordered view used for sanitizing and JSON rendering; absent optionals are omitted. */
    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("source", source);
        m.put("context", context);
        m.put("message", message);
        m.put("category", category.name());
        if (statusCode != null) m.put("statusCode", statusCode);
        if (url != null) m.put("url", url);
        if (details != null && !details.isEmpty()) m.put("details", new LinkedHashMap<>(details));
        return m;
    }
}
