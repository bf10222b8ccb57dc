/*
 * Copyright (c) 2025 Wordguard4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.wordguard4j.spring.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.wordguard4j.core.api.SensitiveWordFilter;
import io.wordguard4j.core.report.NoopReporter;
import io.wordguard4j.core.report.Reporter;
import io.wordguard4j.spring.MicrometerReporter;
import io.wordguard4j.spring.WordGuardEndpoint;
import io.wordguard4j.spring.WordGuardProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.autoconfigure.endpoint.condition.ConditionalOnAvailableEndpoint;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.*;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds a {@link SensitiveWordFilter} from {@code wordguard4j.*} properties and wires match
 * reporting to Micrometer when a {@link MeterRegistry} is present (no-op otherwise).
 */
@Slf4j
@AutoConfiguration(
        afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@EnableConfigurationProperties(WordGuardProperties.class)
@ConditionalOnProperty(prefix = "wordguard4j", name = "enabled", havingValue = "true", matchIfMissing = true)
public class WordGuardAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(Reporter.class)
    public Reporter wordGuardReporter(ObjectProvider<MicrometerReporter> mic) {
        Reporter r = mic.getIfAvailable();
        return (r != null) ? r : NoopReporter.INSTANCE;
    }

    @Bean
    @ConditionalOnMissingBean
    public SensitiveWordFilter sensitiveWordFilter(WordGuardProperties props, Reporter reporter) {
        var filter = new SensitiveWordFilter(
                props.getOptions().toFilterOptions(), props.toSensitiveWords(), props.toWhitelistEntries(), reporter);
        log.info(
                "Wordguard4J filter ready: {} words, {} whitelist entries, strictness={}",
                props.getWords().size(),
                props.getWhitelist().size(),
                props.getOptions().getStrictness());
        return filter;
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(MeterRegistry.class)
    @ConditionalOnBean(MeterRegistry.class)
    static class MicrometerConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public MicrometerReporter wordGuardMicrometerReporter(MeterRegistry registry, WordGuardProperties props) {
            return new MicrometerReporter(registry, props.getReporter().getRecentCapacity());
        }

        @Bean
        @ConditionalOnClass(name = "org.springframework.boot.actuate.endpoint.annotation.Endpoint")
        @ConditionalOnAvailableEndpoint(endpoint = WordGuardEndpoint.class)
        public WordGuardEndpoint wordGuardEndpoint(SensitiveWordFilter filter, MicrometerReporter reporter) {
            return new WordGuardEndpoint(filter, reporter);
        }
    }
}
