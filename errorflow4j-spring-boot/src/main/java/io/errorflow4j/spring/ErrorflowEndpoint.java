/*
 * Copyright (c) 2025 Errorflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.errorflow4j.spring;

import io.errorflow4j.core.handler.ErrorHandler;
import io.errorflow4j.core.report.Reporter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.actuate.endpoint.annotation.DeleteOperation;
import org.springframework.boot.actuate.endpoint.annotation.Endpoint;
import org.springframework.boot.actuate.endpoint.annotation.ReadOperation;

@Endpoint(id = "errorflow")
public class ErrorflowEndpoint {

    private final ErrorHandler handler;
    private final Reporter reporter;

    public ErrorflowEndpoint(ErrorHandler handler, Reporter reporter) {
        this.handler = handler;
        this.reporter = reporter;
    }

    @ReadOperation
    public Map<String, Object> info() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("status", "OK");
        m.put("cacheSize", handler.cacheSize());
        m.put("recentEvents", (reporter instanceof MicrometerReporter mr) ? mr.recentEvents() : List.of());
        return m;
    }

    /** Forgets every fingerprint so previously seen errors are logged again. */
    @DeleteOperation
    public void reset() {
        handler.resetCache();
        if (reporter instanceof MicrometerReporter mr) mr.clear();
    }
}
