/*
 * Copyright (c) 2025 Errorflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.errorflow4j.core.api.shape;

import io.errorflow4j.core.api.model.MatcherResult;

public class MatcherAssertionError extends AssertionError implements MatcherError {
    private static final long serialVersionUID = 1L;

    private final transient MatcherResult matcherResult;

    public MatcherAssertionError(String message, MatcherResult matcherResult) {
        super(message);
        this.matcherResult = matcherResult;
    }

    @Override
    public MatcherResult matcherResult() {
        return matcherResult;
    }
}
