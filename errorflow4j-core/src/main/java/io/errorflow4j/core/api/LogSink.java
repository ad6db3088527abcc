/*
 * Copyright (c) 2025 Errorflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.errorflow4j.core.api;

/** Fire-and-forget destination for already formatted log lines. */
public interface LogSink {
    void info(String line);

    void warn(String line);

    void error(String line);
}
