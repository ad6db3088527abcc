/*
 * Copyright (c) 2025 Errorflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.errorflow4j.core.api.shape;

import io.errorflow4j.core.api.model.ErrorCategory;
import java.util.LinkedHashMap;
import java.util.Map;

public class CategorizedException extends RuntimeException implements CategorizedError {
    private static final long serialVersionUID = 1L;

    private final ErrorCategory category;
    private final transient Map<String, Object> details;

    public CategorizedException(ErrorCategory category, String message) {
        this(category, message, null);
    }

    public CategorizedException(ErrorCategory category, String message, Map<String, Object> details) {
        super(message);
        this.category = category;
        this.details = (details == null) ? Map.of() : new LinkedHashMap<>(details);
    }

    @Override
    public ErrorCategory getCategory() {
        return category;
    }

    @Override
    public Map<String, Object> getDetails() {
        return details;
    }
}
