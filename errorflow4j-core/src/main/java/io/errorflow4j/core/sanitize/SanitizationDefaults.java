/*
 * Copyright (c) 2025 Errorflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.errorflow4j.core.sanitize;

import java.util.Objects;

/**
 * Owner of the process-wide default {@link SanitizationPolicy}.
 *
 * <p>One instance is created by whoever wires the pipeline (the Spring auto-configuration or a test)
 * and passed to every component that needs the defaults. Updates merge a partial override into the
 * current value; concurrent updates are last-writer-wins.
 */
public final class SanitizationDefaults {

    private final Object lock = new Object();
    private final SanitizationPolicy initial;
    private SanitizationPolicy current;

    public SanitizationDefaults() {
        this(SanitizationPolicy.defaults());
    }

    public SanitizationDefaults(SanitizationPolicy initial) {
        this.initial = Objects.requireNonNull(initial, "initial");
        this.current = initial;
    }

    /** Snapshot of the current defaults; policies are immutable so the snapshot never changes. */
    public SanitizationPolicy current() {
        synchronized (lock) {
            return current;
        }
    }

    public SanitizationPolicy update(PolicyOverride override) {
        synchronized (lock) {
            current = current.merge(override);
            return current;
        }
    }

    /** Restores the policy this instance was created with. */
    public void reset() {
        synchronized (lock) {
            current = initial;
        }
    }
}
