/*
 * Copyright (c) 2025 Errorflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.errorflow4j.core.api.model;

import java.util.Arrays;
import java.util.Set;

/**
 * Expectations a test declares for the requests it issues under one context.
 *
 * @param expectedStatusCodes HTTP statuses the caller anticipates
 * @param negativeTest        whether the context is a declared negative test
 */
public record RequestExpectation(Set<Integer> expectedStatusCodes, boolean negativeTest) {

    public RequestExpectation {
        expectedStatusCodes = (expectedStatusCodes == null) ? Set.of() : Set.copyOf(expectedStatusCodes);
    }

    public static RequestExpectation negative(Integer... statuses) {
        return new RequestExpectation(Set.copyOf(Arrays.asList(statuses)), true);
    }
}
