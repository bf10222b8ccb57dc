/*
 * Copyright (c) 2025 Wordguard4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.wordguard4j.spring.config;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.wordguard4j.core.api.SensitiveWordFilter;
import io.wordguard4j.core.api.model.Strictness;
import io.wordguard4j.core.report.NoopReporter;
import io.wordguard4j.core.report.Reporter;
import io.wordguard4j.spring.MicrometerReporter;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

class WordGuardAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(WordGuardAutoConfiguration.class))
            .withPropertyValues(
                    "wordguard4j.words[0].word=damn",
                    "wordguard4j.words[0].severity=1",
                    "wordguard4j.words[1].word=fuck",
                    "wordguard4j.words[1].severity=4",
                    "wordguard4j.words[1].category=profanity");

    @Test
    void buildsFilterFromProperties() {
        runner.withPropertyValues(
                        "wordguard4j.options.strictness=paranoid",
                        "wordguard4j.options.enable-fuzzy-matching=true",
                        "wordguard4j.whitelist[0].word=damn")
                .run(context -> {
                    assertThat(context).hasSingleBean(SensitiveWordFilter.class);
                    assertThat(context).doesNotHaveBean(MicrometerReporter.class);
                    assertThat(context.getBean(Reporter.class)).isSameAs(NoopReporter.INSTANCE);

                    SensitiveWordFilter filter = context.getBean(SensitiveWordFilter.class);
                    assertThat(filter.getOptions().strictness()).isEqualTo(Strictness.PARANOID);
                    assertThat(filter.getWords()).hasSize(2);
                    assertThat(filter.hasMatch("f@ck")).isTrue();
                    assertThat(filter.hasMatch("damn")).isFalse();
                });
    }

    @Test
    void reportsToMicrometerWhenRegistryPresent() {
        runner.withBean(MeterRegistry.class, SimpleMeterRegistry::new).run(context -> {
            assertThat(context).hasSingleBean(MicrometerReporter.class);
            assertThat(context.getBean(Reporter.class)).isInstanceOf(MicrometerReporter.class);

            context.getBean(SensitiveWordFilter.class).detect("oh damn");

            MeterRegistry registry = context.getBean(MeterRegistry.class);
            assertThat(registry.get(MicrometerReporter.METER_NAME)
                            .tag("severity", "mild")
                            .counter()
                            .count())
                    .isEqualTo(1.0);
        });
    }

    @Test
    void keepsUserReporter() {
        Reporter custom = matches -> {};
        runner.withBean(Reporter.class, () -> custom).run(context -> {
            assertThat(context.getBean(Reporter.class)).isSameAs(custom);
            assertThat(context).hasSingleBean(SensitiveWordFilter.class);
        });
    }

    @Test
    void disabledByProperty() {
        runner.withPropertyValues("wordguard4j.enabled=false")
                .run(context -> assertThat(context).doesNotHaveBean(SensitiveWordFilter.class));
    }

    @Test
    void invalidWordFailsStartup() {
        runner.withPropertyValues("wordguard4j.words[2].word=heck", "wordguard4j.words[2].severity=7")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void invalidOptionsFailStartup() {
        runner.withPropertyValues("wordguard4j.options.max-edit-distance=-1")
                .run(context -> assertThat(context).hasFailed());
    }
}
