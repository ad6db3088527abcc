/*
 * Copyright (c) 2025 Errorflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.errorflow4j.core.handler;

import io.errorflow4j.core.api.RequestContext;
import io.errorflow4j.core.api.model.RequestExpectation;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory {@link RequestContext}: callers register what a context (typically a test name) expects
 * before issuing requests, and clear it afterwards.
 */
public final class RequestExpectations implements RequestContext {

    private final Map<String, RequestExpectation> byContext = new ConcurrentHashMap<>();

    public void register(String context, RequestExpectation expectation) {
        byContext.put(Objects.requireNonNull(context, "context"), Objects.requireNonNull(expectation, "expectation"));
    }

    public Optional<RequestExpectation> get(String context) {
        return context == null ? Optional.empty() : Optional.ofNullable(byContext.get(context));
    }

    public void clear(String context) {
        if (context != null) byContext.remove(context);
    }

    public void clearAll() {
        byContext.clear();
    }

    @Override
    public boolean isExpectedStatus(String context, int status) {
        return get(context).map(e -> e.expectedStatusCodes().contains(status)).orElse(false);
    }

    @Override
    public boolean isNegativeTest(String context) {
        return get(context).map(RequestExpectation::negativeTest).orElse(false);
    }
}
