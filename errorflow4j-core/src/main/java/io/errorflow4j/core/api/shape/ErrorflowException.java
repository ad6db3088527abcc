/*
 * Copyright (c) 2025 Errorflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.errorflow4j.core.api.shape;

/** Raised by {@code ErrorHandler.logAndThrow} after the failure has been logged. */
public class ErrorflowException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public ErrorflowException(String message) {
        super(message);
    }
}
