/*
 * Copyright (c) 2025 Errorflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.errorflow4j.core.handler;

import io.errorflow4j.core.api.LogSink;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** {@link LogSink} backed by an SLF4J logger. The binding (Logback in practice) decides where lines go. */
public final class Slf4jLogSink implements LogSink {

    public static final String DEFAULT_LOGGER_NAME = "errorflow4j.errors";

    private final Logger logger;

    public Slf4jLogSink() {
        this(DEFAULT_LOGGER_NAME);
    }

    public Slf4jLogSink(String loggerName) {
        this(LoggerFactory.getLogger(Objects.requireNonNull(loggerName, "loggerName")));
    }

    public Slf4jLogSink(Logger logger) {
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    @Override
    public void info(String line) {
        logger.info(line);
    }

    @Override
    public void warn(String line) {
        logger.warn(line);
    }

    @Override
    public void error(String line) {
        logger.error(line);
    }

    public String name() {
        return logger.getName();
    }
}
