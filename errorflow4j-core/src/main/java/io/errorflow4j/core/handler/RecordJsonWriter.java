/*
 * Copyright (c) 2025 Errorflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.errorflow4j.core.handler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.util.Map;
import java.util.Objects;

/** Renders sanitized maps as indented JSON, one log line per map. */
public final class RecordJsonWriter {

    private final ObjectWriter writer;

    public RecordJsonWriter(ObjectMapper mapper) {
        this.writer = Objects.requireNonNull(mapper, "mapper").writerWithDefaultPrettyPrinter();
    }

    public String write(Map<String, ?> value) throws JsonProcessingException {
        return writer.writeValueAsString(value);
    }
}
