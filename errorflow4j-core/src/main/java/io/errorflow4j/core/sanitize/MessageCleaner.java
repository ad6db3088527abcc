/*
 * Copyright (c) 2025 Errorflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.errorflow4j.core.sanitize;

import java.util.regex.Pattern;

/**
 * Normalizes raw message text into a single safe line:
 * strips quoting characters, ANSI colour/control sequences and an {@code 'Error: } prefix,
 * then keeps only the first line so stack traces collapse to their header.
 */
public final class MessageCleaner {

    private static final char ESC = '\u001B';

    // ESC[1;31m colour codes, then ESC[2J / ESC?25h style control sequences
    private static final Pattern ANSI =
            Pattern.compile(ESC + "\\[\\d+(?:;\\d+)*m|" + ESC + "\\[?\\??[0-9;]*[A-Za-z]");

    private static final Pattern ERROR_PREFIX = Pattern.compile("^'Error: |^'|'$");
    private static final Pattern LINE_BREAK = Pattern.compile("\\R");

    private MessageCleaner() {}

    public static String clean(String message) {
        if (message == null || message.isEmpty()) return "";

        String cleaned = DataSanitizer.sanitizeString(message);
        cleaned = ANSI.matcher(cleaned).replaceAll("");
        cleaned = cleaned.replace(String.valueOf(ESC), "");
        cleaned = ERROR_PREFIX.matcher(cleaned).replaceAll("");

        return LINE_BREAK.split(cleaned, 2)[0];
    }
}
