/*
 * Copyright (c) 2025 Errorflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.errorflow4j.core.api.shape;

import java.util.Map;

/**
 * Shape of a failure raised by an HTTP client: the (optional) response plus the request config.
 * Every accessor may return {@code null}; a missing {@link #status()} means no response was received.
 */
public interface HttpClientError {

    Integer status();

    String statusText();

    /** Response body as decoded by the client (a map for JSON objects, a string otherwise). */
    Object responseData();

    String requestUrl();

    String requestMethod();

    Map<String, ?> requestHeaders();

    /** Client-side message, used when no status text is available. */
    String getMessage();
}
