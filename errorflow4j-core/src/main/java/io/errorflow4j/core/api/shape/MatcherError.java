/*
 * Copyright (c) 2025 Errorflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.errorflow4j.core.api.shape;

import io.errorflow4j.core.api.model.MatcherResult;

/** Assertion failure that carries matcher metadata. The result itself may be {@code null}. */
public interface MatcherError {
    MatcherResult matcherResult();
}
