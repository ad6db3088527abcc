/*
 * Copyright (c) 2025 Errorflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.errorflow4j.spring;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.errorflow4j.core.api.model.CaptureEvent;
import io.errorflow4j.core.report.Reporter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/** Counts capture outcomes per category and keeps the most recent events for the actuator endpoint. */
public final class MicrometerReporter implements Reporter {

    public static final String COUNTER_NAME = "errorflow4j_errors_total";

    private final MeterRegistry registry;
    private final Deque<CaptureEvent> ring = new ArrayDeque<>();
    private final int capacity;

    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP2",
            justification = "MeterRegistry is a framework-managed, thread-safe component; "
                    + "keeping a reference is required for metrics reporting and it is not exposed via accessors.")
    public MicrometerReporter(MeterRegistry registry, int capacity) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.capacity = Math.max(10, capacity);
    }

    @Override
    public synchronized void report(CaptureEvent event) {
        if (event == null) return;
        registry.counter(
                        COUNTER_NAME,
                        "category", event.category().name(),
                        "outcome", event.outcome().name())
                .increment();
        if (ring.size() >= capacity) ring.removeFirst();
        ring.addLast(event);
    }

    /** Returns an unmodifiable snapshot of the recent events ring buffer. */
    public synchronized List<CaptureEvent> recentEvents() {
        return List.copyOf(ring);
    }

    public synchronized void clear() {
        ring.clear();
    }
}
