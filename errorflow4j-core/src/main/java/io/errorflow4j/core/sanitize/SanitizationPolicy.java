/*
 * Copyright (c) 2025 Errorflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.errorflow4j.core.sanitize;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable sanitization settings.
 *
 * @param sensitiveKeys   key names whose values are masked (stored lower-cased, matched by equality or substring)
 * @param maskValue       replacement for masked values
 * @param skipProperties  key fragments whose entries are dropped entirely (stored lower-cased)
 * @param truncateUrls    cut string values at the first {@code http} occurrence
 * @param maxStringLength maximum string length before truncation; {@code null} or non-positive disables it
 */
public record SanitizationPolicy(
        Set<String> sensitiveKeys,
        String maskValue,
        Set<String> skipProperties,
        boolean truncateUrls,
        Integer maxStringLength) {

    public static final String DEFAULT_MASK = "********";

    public static final List<String> DEFAULT_SENSITIVE_KEYS = List.of(
            "password", "apiKey", "secret", "authorization", "token", "accessToken", "refreshToken", "cookie");

    public SanitizationPolicy {
        sensitiveKeys = normalizeAll(sensitiveKeys);
        skipProperties = normalizeAll(skipProperties);
        maskValue = Objects.requireNonNullElse(maskValue, DEFAULT_MASK);
    }

    public static SanitizationPolicy defaults() {
        return new SanitizationPolicy(Set.copyOf(DEFAULT_SENSITIVE_KEYS), DEFAULT_MASK, Set.of(), false, null);
    }

    /** Returns a copy where every non-null field of {@code override} wins. */
    public SanitizationPolicy merge(PolicyOverride override) {
        if (override == null) return this;
        return new SanitizationPolicy(
                override.sensitiveKeys() != null ? override.sensitiveKeys() : sensitiveKeys,
                override.maskValue() != null ? override.maskValue() : maskValue,
                override.skipProperties() != null ? override.skipProperties() : skipProperties,
                override.truncateUrls() != null ? override.truncateUrls() : truncateUrls,
                override.maxStringLength() != null ? override.maxStringLength() : maxStringLength);
    }

    public boolean hasMaxLength() {
        return maxStringLength != null && maxStringLength > 0;
    }

    /** Equality or substring match, both sides lower-cased. */
    public boolean isSensitive(String key) {
        if (key == null || sensitiveKeys.isEmpty()) return false;
        String k = key.toLowerCase(Locale.ROOT);
        if (sensitiveKeys.contains(k)) return true;
        for (String s : sensitiveKeys) {
            if (k.contains(s)) return true;
        }
        return false;
    }

    public boolean isSkipped(String key) {
        if (key == null || skipProperties.isEmpty()) return false;
        String k = key.toLowerCase(Locale.ROOT);
        for (String s : skipProperties) {
            if (k.contains(s)) return true;
        }
        return false;
    }

    private static Set<String> normalizeAll(Collection<String> in) {
        Set<String> out = new LinkedHashSet<>();
        if (in != null) for (String k : in) if (k != null && !k.isEmpty()) out.add(k.toLowerCase(Locale.ROOT));
        return Collections.unmodifiableSet(out);
    }
}
