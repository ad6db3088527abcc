/*
 * Copyright (c) 2025 Errorflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.errorflow4j.core.detail;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.errorflow4j.core.api.model.MatcherResult;
import io.errorflow4j.core.api.shape.CategorizedError;
import io.errorflow4j.core.api.shape.HttpClientError;
import io.errorflow4j.core.api.shape.MatcherError;
import io.errorflow4j.core.classify.OsErrorCode;
import io.errorflow4j.core.sanitize.DataSanitizer;
import io.errorflow4j.core.sanitize.MessageCleaner;
import io.errorflow4j.core.sanitize.UrlPaths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Pulls the shape-specific part of an error (matcher result, HTTP exchange, OS code, user details) into a
 * flat, already sanitized map. Never returns null.
 */
public final class DetailExtractor {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final DataSanitizer sanitizer;
    private final ObjectMapper mapper;

    public DetailExtractor(DataSanitizer sanitizer, ObjectMapper mapper) {
        this.sanitizer = Objects.requireNonNull(sanitizer, "sanitizer");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public Map<String, Object> extract(Object error) {
        if (error == null) return Map.of();

        if (error instanceof MatcherError me && me.matcherResult() != null) {
            return matcherDetails(me.matcherResult());
        }
        if (error instanceof HttpClientError http) return httpDetails(http);
        if (error instanceof CategorizedError ce) {
            return ce.getDetails() == null ? Map.of() : sanitizer.sanitizeForLogging(ce.getDetails());
        }
        if (error instanceof Throwable t) {
            String code = OsErrorCode.codeOf(t);
            return code == null ? Map.of() : Map.of("code", code);
        }
        if (error instanceof Map<?, ?> m) return sanitizer.sanitizeForLogging(m);
        return beanDetails(error).orElse(Map.of());
    }

    /** Bean properties of {@code value}, sanitized; empty for scalars and for types Jackson cannot convert. */
    private Optional<Map<String, Object>> beanDetails(Object value) {
        if (value instanceof CharSequence || value instanceof Number || value instanceof Boolean) {
            return Optional.empty();
        }
        try {
            return Optional.of(sanitizer.sanitizeForLogging(mapper.convertValue(value, MAP_TYPE)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    private static Map<String, Object> matcherDetails(MatcherResult r) {
        Map<String, Object> out = new LinkedHashMap<>();
        putIfPresent(out, "name", r.name());
        out.put("pass", r.pass());
        putIfPresent(out, "expected", r.expected());
        putIfPresent(out, "actual", r.actual());
        if (r.message() != null) out.put("message", MessageCleaner.clean(r.message()));
        if (r.log() != null) {
            List<String> log = new ArrayList<>();
            for (String entry : r.log()) {
                // request/response traces are noise and may carry credentials
                if (entry == null || entry.contains("http")) continue;
                log.add(MessageCleaner.clean(entry));
            }
            out.put("log", log);
        }
        return out;
    }

    private Map<String, Object> httpDetails(HttpClientError http) {
        Map<String, Object> out = new LinkedHashMap<>();
        putIfPresent(out, "status", http.status());
        putIfPresent(out, "statusText", http.statusText());
        putIfPresent(out, "method", http.requestMethod());
        putIfPresent(out, "url", UrlPaths.pathOf(http.requestUrl()));
        out.put("headers", sanitizer.sanitizeHeaders(http.requestHeaders()));
        Object body = http.responseData();
        if (body instanceof Map<?, ?> m) {
            out.put("data", sanitizer.sanitizeForLogging(m));
        } else if (body != null) {
            beanDetails(body).ifPresent(data -> out.put("data", data));
        }
        return out;
    }

    private static void putIfPresent(Map<String, Object> out, String key, Object value) {
        if (value != null) out.put(key, value);
    }
}
