/*
 * Copyright (c) 2025 Errorflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.errorflow4j.core.report;

import io.errorflow4j.core.api.model.CaptureEvent;

public final class NoopReporter implements Reporter {
    @Override
    public void report(CaptureEvent event) {
        /* no-op */
    }
}
