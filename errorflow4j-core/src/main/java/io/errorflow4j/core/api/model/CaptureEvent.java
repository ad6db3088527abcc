/*
 * Copyright (c) 2025 Errorflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.errorflow4j.core.api.model;

/** A single capture outcome (source + category + outcome), useful for metrics. */
public record CaptureEvent(String source, ErrorCategory category, Outcome outcome) {

    public enum Outcome {
        /** New fingerprint, record written to the sink. */
        LOGGED,
        /** Fingerprint already seen, nothing written. */
        DUPLICATE,
        /** Declared negative-test status, logged at info only. */
        EXPECTED,
        /** The handler itself failed and wrote the fallback record. */
        HANDLER_FAILURE
    }
}
