/*
 * Copyright (c) 2025 Errorflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.errorflow4j.core.classify;

import static org.assertj.core.api.Assertions.assertThat;

import io.errorflow4j.core.api.model.ErrorCategory;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("KeywordRules")
class KeywordRulesTest {

    @Test
    @DisplayName("overlapping keywords resolve to the earlier rule")
    void firstRuleWins() {
        KeywordRules rules = KeywordRules.defaults();

        assertThat(rules.match("operation timeout")).contains(ErrorCategory.TIMEOUT);
        assertThat(rules.match("File doesn't exist")).contains(ErrorCategory.NOT_FOUND);
        assertThat(rules.match("file already exists")).contains(ErrorCategory.FILE_EXISTS);
    }

    @Test
    @DisplayName("matching is case-insensitive")
    void caseInsensitive() {
        assertThat(KeywordRules.defaults().match("FIXTURE crashed")).contains(ErrorCategory.FIXTURE);
    }

    @Test
    @DisplayName("blank messages and unmatched text yield nothing")
    void noMatch() {
        KeywordRules rules = KeywordRules.defaults();

        assertThat(rules.match(null)).isEmpty();
        assertThat(rules.match("")).isEmpty();
        assertThat(rules.match("xyz")).isEmpty();
    }

    @Test
    @DisplayName("a custom table is used as given")
    void customTable() {
        KeywordRules rules = new KeywordRules(List.of(
                new KeywordRules.Rule(ErrorCategory.SERVICE, List.of("upstream")),
                new KeywordRules.Rule(ErrorCategory.NETWORK, List.of("upstream", "socket"))));

        assertThat(rules.match("Upstream reset")).contains(ErrorCategory.SERVICE);
        assertThat(rules.match("socket closed")).contains(ErrorCategory.NETWORK);
        assertThat(rules.rules()).hasSize(2);
    }
}
