/*
 * Copyright (c) 2025 Errorflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.errorflow4j.core.api;

import io.errorflow4j.core.api.model.ErrorCategory;

/**
 * Reduces an arbitrary error value (throwable, HTTP-client error, string, map, ...) to a message,
 * a context label and a taxonomy category. Implementations must not throw for any input.
 */
public interface ErrorClassifier {

    String UNKNOWN_MESSAGE = "Unknown error occurred";

    String extractMessage(Object error);

    String inferContext(Object error);

    ErrorCategory categorize(Object error);
}
