/*
 * Copyright (c) 2025 Errorflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.errorflow4j.core.dedup;

import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded set of fingerprints with first-in-first-out eviction. Lookups do not refresh an entry.
 */
public final class DedupCache {

    public static final int DEFAULT_MAX_ENTRIES = 1000;

    private final int maxEntries;
    private final Set<String> seen = new LinkedHashSet<>();
    private final ReentrantLock lock = new ReentrantLock();

    public DedupCache() {
        this(DEFAULT_MAX_ENTRIES);
    }

    public DedupCache(int maxEntries) {
        if (maxEntries <= 0) throw new IllegalArgumentException("maxEntries must be > 0, got " + maxEntries);
        this.maxEntries = maxEntries;
    }

    /**
     * Records {@code fingerprint} unless already present. Check, insert and eviction of the oldest entry
     * happen under one lock.
     *
     * @return true when the fingerprint was not seen before
     */
    public boolean markIfAbsent(String fingerprint) {
        lock.lock();
        try {
            if (!seen.add(fingerprint)) return false;
            if (seen.size() > maxEntries) {
                Iterator<String> oldest = seen.iterator();
                oldest.next();
                oldest.remove();
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    public boolean contains(String fingerprint) {
        lock.lock();
        try {
            return seen.contains(fingerprint);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return seen.size();
        } finally {
            lock.unlock();
        }
    }

    public int maxEntries() {
        return maxEntries;
    }

    public void reset() {
        lock.lock();
        try {
            seen.clear();
        } finally {
            lock.unlock();
        }
    }
}
