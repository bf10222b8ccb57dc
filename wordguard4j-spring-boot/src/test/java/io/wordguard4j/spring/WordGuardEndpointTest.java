/*
 * Copyright (c) 2025 Wordguard4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.wordguard4j.spring;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.wordguard4j.core.api.SensitiveWordFilter;
import io.wordguard4j.core.api.model.SensitiveWord;
import io.wordguard4j.core.api.model.Severity;
import io.wordguard4j.core.api.model.Strictness;
import io.wordguard4j.core.api.model.WhitelistEntry;
import io.wordguard4j.core.preset.FilterOptions;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class WordGuardEndpointTest {

    @Test
    void exposesStateAndRecentMatches() {
        MicrometerReporter reporter = new MicrometerReporter(new SimpleMeterRegistry(), 20);
        SensitiveWordFilter filter = new SensitiveWordFilter(
                FilterOptions.builder().strictness(Strictness.HIGH).build(),
                List.of(SensitiveWord.of("damn", Severity.MILD)),
                List.of(WhitelistEntry.of("heck")),
                reporter);
        filter.detect("oh damn");

        Map<String, Object> info = new WordGuardEndpoint(filter, reporter).info();

        assertThat(info)
                .containsEntry("status", "OK")
                .containsEntry("words", 1)
                .containsEntry("whitelist", 1)
                .containsEntry("strictness", Strictness.HIGH)
                .containsEntry("fuzzy", false);
        assertThat(info.get("recentMatches")).isEqualTo(reporter.recentMatches());
        assertThat(reporter.recentMatches()).hasSize(1);
    }
}
