/*
 * Copyright (c) 2025 Errorflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.errorflow4j.core.api.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatNullPointerException;

import java.util.Map;
import org.junit.jupiter.api.Test;

class ErrorRecordTest {

    @Test
    void defaultsAreApplied() {
        ErrorRecord record = new ErrorRecord("svc", " ", null, null, null, null, null);

        assertThat(record.context()).isEqualTo(ErrorRecord.DEFAULT_CONTEXT);
        assertThat(record.message()).isEmpty();
        assertThat(record.category()).isEqualTo(ErrorCategory.UNKNOWN);
    }

    @Test
    void sourceIsMandatory() {
        assertThatNullPointerException().isThrownBy(() -> ErrorRecord.of(null, "c", "m", ErrorCategory.IO));
    }

    @Test
    void toMapKeepsOrderAndOmitsAbsentFields() {
        ErrorRecord bare = ErrorRecord.of("svc", "ctx", "msg", ErrorCategory.PARSING);
        ErrorRecord full = new ErrorRecord("api", "ctx", "msg", ErrorCategory.NOT_FOUND, 404, "/x", Map.of("k", 1));

        assertThat(bare.toMap()).containsOnlyKeys("source", "context", "message", "category");
        assertThat(bare.toMap().get("category")).isEqualTo("PARSING");
        assertThat(full.toMap().keySet())
                .containsExactly("source", "context", "message", "category", "statusCode", "url", "details");
    }

    @Test
    void categoriesBelongToAGroup() {
        assertThat(ErrorCategory.values()).hasSize(47).allSatisfy(c -> assertThat(c.group()).isNotNull());
        assertThat(ErrorCategory.READ_ONLY_FILE_SYSTEM.group()).isEqualTo(ErrorCategory.Group.FILESYSTEM);
    }
}
