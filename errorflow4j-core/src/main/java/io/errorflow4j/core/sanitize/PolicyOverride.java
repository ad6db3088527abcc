/*
 * Copyright (c) 2025 Errorflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.errorflow4j.core.sanitize;

import java.util.Set;

/** Partial {@link SanitizationPolicy}; {@code null} fields keep the value they are merged into. */
public record PolicyOverride(
        Set<String> sensitiveKeys,
        String maskValue,
        Set<String> skipProperties,
        Boolean truncateUrls,
        Integer maxStringLength) {

    public static PolicyOverride none() {
        return new PolicyOverride(null, null, null, null, null);
    }

    public PolicyOverride withSensitiveKeys(Set<String> keys) {
        return new PolicyOverride(keys, maskValue, skipProperties, truncateUrls, maxStringLength);
    }

    public PolicyOverride withMaskValue(String mask) {
        return new PolicyOverride(sensitiveKeys, mask, skipProperties, truncateUrls, maxStringLength);
    }

    public PolicyOverride withSkipProperties(Set<String> skip) {
        return new PolicyOverride(sensitiveKeys, maskValue, skip, truncateUrls, maxStringLength);
    }

    public PolicyOverride withTruncateUrls(Boolean truncate) {
        return new PolicyOverride(sensitiveKeys, maskValue, skipProperties, truncate, maxStringLength);
    }

    public PolicyOverride withMaxStringLength(Integer max) {
        return new PolicyOverride(sensitiveKeys, maskValue, skipProperties, truncateUrls, max);
    }
}
