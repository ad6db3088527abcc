/*
 * Copyright (c) 2025 Errorflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.errorflow4j.core.classify;

import io.errorflow4j.core.api.ErrorClassifier;
import io.errorflow4j.core.api.model.ErrorCategory;
import io.errorflow4j.core.api.shape.CategorizedError;
import io.errorflow4j.core.api.shape.HttpClientError;
import io.errorflow4j.core.api.shape.MatcherError;
import io.errorflow4j.core.sanitize.MessageCleaner;
import io.errorflow4j.core.sanitize.UrlPaths;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Default classifier. Tiers, first hit wins:
 * <ol>
 *   <li>HTTP-client errors by status code;</li>
 *   <li>matcher assertion failures are always {@link ErrorCategory#TEST};</li>
 *   <li>throwables by OS error code, then by message keyword, then by their own declared category.</li>
 * </ol>
 */
public final class TaxonomyErrorClassifier implements ErrorClassifier {

    public static final String CONTEXT_API = "API Request Error";
    public static final String CONTEXT_MATCHER = "Playwright Test Error";
    public static final String CONTEXT_DATABASE = "Database Error";
    public static final String CONTEXT_PERMISSION = "Permission Error";
    public static final String CONTEXT_GENERAL = "General Error";

    private static final List<String> DATABASE_WORDS = List.of("database", "query", "sql");
    private static final List<String> PERMISSION_WORDS = List.of("permission", "access", "unauthorized");

    private final KeywordRules keywords;

    public TaxonomyErrorClassifier() {
        this(KeywordRules.defaults());
    }

    public TaxonomyErrorClassifier(KeywordRules keywords) {
        this.keywords = Objects.requireNonNull(keywords, "keywords");
    }

    @Override
    public String extractMessage(Object error) {
        if (error instanceof HttpClientError http) return formatHttp(http);
        if (error instanceof Throwable t) {
            return t.getMessage() == null ? t.getClass().getSimpleName() : MessageCleaner.clean(t.getMessage());
        }
        if (error instanceof CharSequence cs) return MessageCleaner.clean(cs.toString());
        if (error instanceof Map<?, ?> m && m.get("message") instanceof String s) return MessageCleaner.clean(s);
        return UNKNOWN_MESSAGE;
    }

    @Override
    public String inferContext(Object error) {
        if (error instanceof HttpClientError) return CONTEXT_API;
        if (error instanceof MatcherError) return CONTEXT_MATCHER;

        String lower = rawMessage(error).toLowerCase(Locale.ROOT);
        if (containsAny(lower, DATABASE_WORDS)) return CONTEXT_DATABASE;
        if (containsAny(lower, PERMISSION_WORDS)) return CONTEXT_PERMISSION;
        return CONTEXT_GENERAL;
    }

    @Override
    public ErrorCategory categorize(Object error) {
        if (error instanceof HttpClientError http) return byStatus(http.status());
        if (error instanceof MatcherError) return ErrorCategory.TEST;
        if (!(error instanceof Throwable t)) return ErrorCategory.UNKNOWN;

        Optional<OsErrorCode> code = OsErrorCode.resolve(t);
        if (code.isPresent()) return code.get().category();

        Optional<ErrorCategory> byKeyword = keywords.match(t.getMessage());
        if (byKeyword.isPresent()) return byKeyword.get();

        if (t instanceof CategorizedError ce && ce.getCategory() != null) return ce.getCategory();
        return ErrorCategory.UNKNOWN;
    }

    static ErrorCategory byStatus(Integer status) {
        if (status == null) return ErrorCategory.NETWORK;
        int s = status;
        if (s == 401) return ErrorCategory.AUTHENTICATION;
        if (s == 403) return ErrorCategory.AUTHORIZATION;
        if (s == 404) return ErrorCategory.NOT_FOUND;
        if (s >= 400 && s < 500) return ErrorCategory.HTTP_CLIENT;
        if (s >= 500) return ErrorCategory.HTTP_SERVER;
        return ErrorCategory.UNKNOWN;
    }

    private static String formatHttp(HttpClientError http) {
        Integer status = http.status();
        String statusText = http.statusText();
        String method = http.requestMethod();
        String path = http.requestUrl() == null ? "unknown" : UrlPaths.pathOf(http.requestUrl());

        return MessageCleaner.clean("HTTP " + (status == null ? "Error" : status) + ": "
                + (isBlank(statusText) ? http.getMessage() : statusText)
                + " (" + (isBlank(method) ? "GET" : method) + " " + path + ")");
    }

    /** Message text only; containers are never stringified. */
    private static String rawMessage(Object error) {
        if (error instanceof Throwable t) return t.getMessage() == null ? "" : t.getMessage();
        if (error instanceof CharSequence cs) return cs.toString();
        if (error instanceof Map<?, ?> map && map.get("message") instanceof String s) return s;
        return "";
    }

    private static boolean containsAny(String text, List<String> words) {
        for (String w : words) {
            if (text.contains(w)) return true;
        }
        return false;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
