/*
 * Copyright (c) 2025 Errorflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.errorflow4j.core.api.shape;

/** Failure carrying a structured OS error code such as {@code ENOENT} or {@code EACCES}. */
public interface CodedError {
    String getCode();
}
