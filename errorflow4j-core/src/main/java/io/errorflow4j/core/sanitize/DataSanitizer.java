/*
 * Copyright (c) 2025 Errorflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.errorflow4j.core.sanitize;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Recursive sanitizer for maps, collections and arrays.
 *
 * <h2>Rules per map entry</h2>
 * <ol>
 *   <li>keys containing a configured skip property are dropped;</li>
 *   <li>keys equal to or containing a sensitive key get the mask value (masking wins over recursion);</li>
 *   <li>string values are cut at the first {@code http} (when URL truncation is on), then length-truncated;</li>
 *   <li>nested maps, collections and arrays are sanitized with the same policy.</li>
 * </ol>
 *
 * <p>Input is never mutated; every container is copied. A container already on the current path is
 * replaced by {@value #CIRCULAR} and anything nested deeper than {@value #MAX_DEPTH} levels by
 * {@value #COMPLEX}.
 */
public final class DataSanitizer {

    public static final String CIRCULAR = "[Circular Reference]";
    public static final String COMPLEX = "[Complex Object]";

    static final int MAX_DEPTH = 64;
    static final int LOG_MAX_STRING_LENGTH = 1000;

    private static final String ELLIPSIS = "...";
    private static final String HTTP = "http";
    private static final Pattern UNSAFE_CHARS = Pattern.compile("[\"'\\\\<>]");

    /** Applied on top of the current defaults for everything that is about to be logged. */
    private static final PolicyOverride LOG_OVERRIDE = PolicyOverride.none()
            .withSkipProperties(Set.of("stack"))
            .withTruncateUrls(true)
            .withMaxStringLength(LOG_MAX_STRING_LENGTH);

    private final SanitizationDefaults defaults;

    public DataSanitizer(SanitizationDefaults defaults) {
        this.defaults = Objects.requireNonNull(defaults, "defaults");
    }

    // ---------------- generic sanitization ----------------

    public Object sanitize(Object value) {
        return sanitize(value, defaults.current());
    }

    /** Same shape out as in; see the class docs for the rules. */
    public Object sanitize(Object value, SanitizationPolicy policy) {
        Objects.requireNonNull(policy, "policy");
        if (value == null) return null;
        if (value instanceof CharSequence cs) {
            return policy.hasMaxLength() ? truncate(cs.toString(), policy.maxStringLength()) : value;
        }
        if (!isContainer(value)) return value;
        return node(value, policy, newPath(), 0);
    }

    public Map<String, Object> sanitizeMap(Map<?, ?> map) {
        return sanitizeMap(map, defaults.current());
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> sanitizeMap(Map<?, ?> map, SanitizationPolicy policy) {
        if (map == null) return Map.of();
        Object out = sanitize(map, policy);
        return (out instanceof Map<?, ?>) ? (Map<String, Object>) out : Map.of();
    }

    /** Header maps are sanitized with the current defaults; anything that is not a map yields an empty map. */
    public Map<String, Object> sanitizeHeaders(Object headers) {
        if (!(headers instanceof Map<?, ?> m)) return Map.of();
        return sanitizeMap(m);
    }

    private Object node(Object value, SanitizationPolicy policy, Set<Object> path, int depth) {
        if (depth > MAX_DEPTH) return COMPLEX;
        if (!path.add(value)) return CIRCULAR;
        try {
            if (value instanceof Map<?, ?> m) return entries(m, policy, path, depth);
            List<Object> out = new ArrayList<>();
            for (Object el : elements(value)) {
                out.add(isContainer(el) ? node(el, policy, path, depth + 1) : el);
            }
            return out;
        } finally {
            path.remove(value);
        }
    }

    private Map<String, Object> entries(Map<?, ?> in, SanitizationPolicy policy, Set<Object> path, int depth) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<?, ?> e : in.entrySet()) {
            String key = String.valueOf(e.getKey());
            if (policy.isSkipped(key)) continue;
            if (policy.isSensitive(key)) {
                out.put(key, policy.maskValue());
                continue;
            }
            Object v = e.getValue();
            if (v instanceof CharSequence cs) {
                out.put(key, rewriteString(cs.toString(), policy));
            } else if (isContainer(v)) {
                out.put(key, node(v, policy, path, depth + 1));
            } else {
                out.put(key, v);
            }
        }
        return out;
    }

    // ---------------- pre-logging pass ----------------

    /**
     * Stricter pass used right before a structure is written to a log. On top of the current defaults it
     * always drops {@code stack*} keys, cleans string values with {@link MessageCleaner} before cutting
     * URLs and truncating to {@value #LOG_MAX_STRING_LENGTH} characters, never descends into {@code parent}
     * or {@code cause} objects, and turns a failure while sanitizing a nested value into {@value #COMPLEX}.
     */
    public Map<String, Object> sanitizeForLogging(Map<?, ?> map) {
        if (map == null) return Map.of();
        SanitizationPolicy policy = defaults.current().merge(LOG_OVERRIDE);
        return logEntries(map, policy, newPath(), 0);
    }

    private Map<String, Object> logEntries(Map<?, ?> in, SanitizationPolicy policy, Set<Object> path, int depth) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<?, ?> e : in.entrySet()) {
            String key = String.valueOf(e.getKey());
            if (policy.isSkipped(key) || key.toLowerCase(Locale.ROOT).contains("stack")) continue;
            if (policy.isSensitive(key)) {
                out.put(key, policy.maskValue());
                continue;
            }
            Object v = e.getValue();
            if (v instanceof CharSequence cs) {
                out.put(key, rewriteString(MessageCleaner.clean(cs.toString()), policy));
            } else if (isContainer(v)) {
                out.put(key, isBackReference(key) ? CIRCULAR : logNested(v, policy, path, depth + 1));
            } else {
                out.put(key, v);
            }
        }
        return out;
    }

    private Object logNested(Object value, SanitizationPolicy policy, Set<Object> path, int depth) {
        if (depth > MAX_DEPTH) return COMPLEX;
        if (!path.add(value)) return CIRCULAR;
        try {
            if (value instanceof Map<?, ?> m) return logEntries(m, policy, path, depth);
            List<Object> out = new ArrayList<>();
            for (Object el : elements(value)) {
                if (el instanceof CharSequence cs) {
                    out.add(rewriteString(MessageCleaner.clean(cs.toString()), policy));
                } else {
                    out.add(isContainer(el) ? logNested(el, policy, path, depth + 1) : el);
                }
            }
            return out;
        } catch (RuntimeException | StackOverflowError ex) {
            return COMPLEX;
        } finally {
            path.remove(value);
        }
    }

    private static boolean isBackReference(String key) {
        return "parent".equals(key) || "cause".equals(key);
    }

    // ---------------- path based masking ----------------

    public Map<String, Object> sanitizeByPaths(Map<String, ?> data, List<String> paths) {
        return sanitizeByPaths(data, paths, defaults.current().maskValue());
    }

    /**
     * Masks the leaf at each dot-separated path (e.g. {@code user.credentials.password}) in a deep copy of
     * {@code data}. Paths whose intermediate segments are missing or not maps, or whose leaf key does not
     * exist, are skipped.
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> sanitizeByPaths(Map<String, ?> data, List<String> paths, String maskValue) {
        if (data == null) return null;
        Map<String, Object> result = (Map<String, Object>) deepCopy(data, newPath(), 0);
        if (paths == null) return result;
        String mask = (maskValue == null) ? defaults.current().maskValue() : maskValue;

        for (String p : paths) {
            if (p == null || p.isEmpty()) continue;
            String[] parts = p.split("\\.");
            Map<String, Object> current = result;
            boolean reachedEnd = true;
            for (int i = 0; i < parts.length - 1; i++) {
                Object next = current.get(parts[i]);
                if (!(next instanceof Map<?, ?>)) {
                    reachedEnd = false;
                    break;
                }
                current = (Map<String, Object>) next;
            }
            String last = parts[parts.length - 1];
            if (reachedEnd && current.containsKey(last)) {
                current.put(last, mask);
            }
        }
        return result;
    }

    private static Object deepCopy(Object value, Set<Object> path, int depth) {
        if (!isContainer(value)) return value;
        if (depth > MAX_DEPTH) return COMPLEX;
        if (!path.add(value)) return CIRCULAR;
        try {
            if (value instanceof Map<?, ?> m) {
                Map<String, Object> out = new LinkedHashMap<>();
                m.forEach((k, v) -> out.put(String.valueOf(k), deepCopy(v, path, depth + 1)));
                return out;
            }
            List<Object> out = new ArrayList<>();
            for (Object el : elements(value)) out.add(deepCopy(el, path, depth + 1));
            return out;
        } finally {
            path.remove(value);
        }
    }

    // ---------------- strings ----------------

    /** Removes quotes, backslashes and angle brackets, then trims. */
    public static String sanitizeString(String value) {
        if (value == null || value.isEmpty()) return "";
        return UNSAFE_CHARS.matcher(value).replaceAll("").trim();
    }

    static String truncate(String value, int maxLength) {
        return value.length() > maxLength ? value.substring(0, maxLength) + ELLIPSIS : value;
    }

    /** Everything from the first {@code http} on is replaced by an ellipsis. */
    static String cutUrls(String value) {
        int idx = value.indexOf(HTTP);
        return idx > -1 ? value.substring(0, idx) + ELLIPSIS : value;
    }

    private static String rewriteString(String value, SanitizationPolicy policy) {
        String out = value;
        if (policy.truncateUrls()) out = cutUrls(out);
        if (policy.hasMaxLength()) out = truncate(out, policy.maxStringLength());
        return out;
    }

    // ---------------- containers ----------------

    private static boolean isContainer(Object v) {
        return v instanceof Map<?, ?>
                || v instanceof Collection<?>
                || (v != null && v.getClass().isArray() && !v.getClass().getComponentType().isPrimitive());
    }

    private static Iterable<?> elements(Object container) {
        if (container instanceof Collection<?> c) return c;
        int n = Array.getLength(container);
        List<Object> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) out.add(Array.get(container, i));
        return out;
    }

    private static Set<Object> newPath() {
        return Collections.newSetFromMap(new IdentityHashMap<>());
    }
}
