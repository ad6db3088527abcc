/*
 * Copyright (c) 2025 Errorflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.errorflow4j.core.sanitize;

import java.net.URI;
import java.net.URISyntaxException;

/** Reduces request URLs to their path so hosts, credentials and query strings never reach the logs. */
public final class UrlPaths {

    public static final String UNKNOWN = "unknown";

    private static final URI PLACEHOLDER_BASE = URI.create("http://example.com/");

    private UrlPaths() {}

    /**
     * Path component of {@code url}, resolving relative URLs against a placeholder base.
     *
     * @return {@code null} for a null URL, {@link #UNKNOWN} when the URL cannot be parsed
     */
    public static String pathOf(String url) {
        if (url == null) return null;
        try {
            URI resolved = PLACEHOLDER_BASE.resolve(new URI(url.trim()));
            String path = resolved.getRawPath();
            return (path == null || path.isEmpty()) ? "/" : path;
        } catch (URISyntaxException | IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
