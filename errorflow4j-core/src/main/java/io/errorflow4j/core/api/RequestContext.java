/*
 * Copyright (c) 2025 Errorflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.errorflow4j.core.api;

/** Lookup of what a calling context declared about the statuses it expects. */
public interface RequestContext {

    boolean isExpectedStatus(String context, int status);

    boolean isNegativeTest(String context);

    /** Null object: no context ever expects anything. */
    static RequestContext none() {
        return new RequestContext() {
            @Override
            public boolean isExpectedStatus(String context, int status) {
                return false;
            }

            @Override
            public boolean isNegativeTest(String context) {
                return false;
            }
        };
    }
}
