/*
 * Copyright (c) 2025 Errorflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.errorflow4j.core.api.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Matcher metadata attached to assertion failures (name, pass, expected, actual, message, call log). */
public record MatcherResult(
        String name, boolean pass, Object expected, Object actual, String message, List<String> log) {

    /** Call-log entries may be null; consumers skip them. */
    public MatcherResult {
        log = (log == null) ? null : Collections.unmodifiableList(new ArrayList<>(log));
    }
}
