/*
 * Copyright (c) 2025 Errorflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.errorflow4j.core.api.shape;

import io.errorflow4j.core.api.model.ErrorCategory;
import java.util.Map;

/**
 * Application failure that already knows its category. The category is honored only when
 * neither the OS code tier nor the keyword tier matched the message.
 */
public interface CategorizedError {
    ErrorCategory getCategory();

    Map<String, Object> getDetails();
}
