/*
 * Copyright (c) 2025 Errorflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.errorflow4j.core.classify;

import io.errorflow4j.core.api.model.ErrorCategory;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Ordered keyword table. Rules are tried top to bottom and the first rule with a keyword contained in the
 * lowercased message wins, so order matters: e.g. "timeout" resolves to TIMEOUT, never PERFORMANCE.
 */
public final class KeywordRules {

    public record Rule(ErrorCategory category, List<String> keywords) {
        public Rule {
            keywords = List.copyOf(keywords);
        }

        boolean matches(String lowerMessage) {
            for (String k : keywords) {
                if (lowerMessage.contains(k)) return true;
            }
            return false;
        }
    }

    private static final List<Rule> DEFAULT = List.of(
            rule(ErrorCategory.CONNECTION, "connection", "connect"),
            rule(ErrorCategory.QUERY, "query", "sql"),
            rule(ErrorCategory.TRANSACTION, "transaction"),
            rule(ErrorCategory.CONSTRAINT, "constraint", "duplicate"),
            rule(ErrorCategory.DATABASE, "database", "db"),
            rule(ErrorCategory.PERMISSION, "permission", "access", "denied"),
            rule(ErrorCategory.NOT_FOUND, "not found", "missing", "doesn't exist"),
            rule(ErrorCategory.CONFLICT, "conflict"),
            rule(ErrorCategory.AUTHENTICATION, "authentication", "login"),
            rule(ErrorCategory.AUTHORIZATION, "authorization", "forbidden"),
            rule(ErrorCategory.CONFIGURATION, "configuration", "config"),
            rule(ErrorCategory.NOT_IMPLEMENTED, "not_implemented", "unimplemented"),
            rule(ErrorCategory.SERVICE, "service", "unavailable"),
            rule(ErrorCategory.NETWORK, "network"),
            rule(ErrorCategory.TIMEOUT, "timeout", "gateway", "retry"),
            rule(ErrorCategory.UI, "ui", "interface", "view", "render"),
            rule(ErrorCategory.ELEMENT, "element", "component", "dom"),
            rule(ErrorCategory.NAVIGATION, "navigation", "route", "redirect"),
            rule(ErrorCategory.SELECTOR, "selector", "locator", "xpath", "css"),
            rule(ErrorCategory.ASSERTION, "assertion", "expect", "should"),
            rule(ErrorCategory.VALIDATION, "validation", "invalid", "schema"),
            rule(ErrorCategory.IO, "i/o", "input/output"),
            rule(ErrorCategory.PARSING, "parse", "parsing"),
            rule(ErrorCategory.SERIALIZATION, "serialize", "serialization"),
            rule(ErrorCategory.SETUP, "setup", "before", "beforeall"),
            rule(ErrorCategory.TEARDOWN, "teardown", "after", "afterall"),
            rule(ErrorCategory.TEST, "test failed", "test error"),
            rule(ErrorCategory.FIXTURE, "fixture"),
            rule(ErrorCategory.PERFORMANCE, "performance", "slow", "timeout"),
            rule(ErrorCategory.MEMORY, "memory", "out of memory", "heap"),
            rule(ErrorCategory.RESOURCE_LIMIT, "resource limit", "quota"),
            rule(ErrorCategory.ENVIRONMENT, "environment", "env", "variable"),
            rule(ErrorCategory.DEPENDENCY, "dependency", "module", "import"),
            rule(ErrorCategory.FILE_NOT_FOUND, "file not found", "no such file", "doesn't exist"),
            rule(
                    ErrorCategory.PATH_IS_DIRECTORY,
                    "is a directory",
                    "cannot write to directory",
                    "cannot read directory as file"),
            rule(ErrorCategory.NOT_A_DIRECTORY, "not a directory"),
            rule(ErrorCategory.DIRECTORY_NOT_EMPTY, "directory not empty"),
            rule(ErrorCategory.FILE_EXISTS, "file already exists", "already exists"),
            rule(ErrorCategory.ACCESS_DENIED, "permission denied", "access denied"),
            rule(ErrorCategory.NO_SPACE, "no space", "disk full"),
            rule(ErrorCategory.FILE_TOO_LARGE, "file too large"));

    private final List<Rule> rules;

    public KeywordRules(List<Rule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static KeywordRules defaults() {
        return new KeywordRules(DEFAULT);
    }

    public List<Rule> rules() {
        return rules;
    }

    public Optional<ErrorCategory> match(String message) {
        if (message == null || message.isEmpty()) return Optional.empty();
        String lower = message.toLowerCase(Locale.ROOT);
        for (Rule r : rules) {
            if (r.matches(lower)) return Optional.of(r.category());
        }
        return Optional.empty();
    }

    private static Rule rule(ErrorCategory category, String... keywords) {
        return new Rule(category, List.of(keywords));
    }
}
