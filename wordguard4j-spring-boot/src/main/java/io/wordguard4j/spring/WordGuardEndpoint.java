/*
 * Copyright (c) 2025 Wordguard4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.wordguard4j.spring;

import io.wordguard4j.core.api.SensitiveWordFilter;
import io.wordguard4j.core.preset.FilterOptions;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.actuate.endpoint.annotation.Endpoint;
import org.springframework.boot.actuate.endpoint.annotation.ReadOperation;

@Endpoint(id = "wordguard")
public class WordGuardEndpoint {

    private final SensitiveWordFilter filter;
    private final MicrometerReporter reporter;

    public WordGuardEndpoint(SensitiveWordFilter filter, MicrometerReporter reporter) {
        this.filter = filter;
        this.reporter = reporter;
    }

    @ReadOperation
    public Map<String, Object> info() {
        FilterOptions options = filter.getOptions();
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("status", "OK");
        m.put("words", filter.getWords().size());
        m.put("whitelist", filter.getWhitelist().size());
        m.put("strictness", options.strictness());
        m.put("fuzzy", options.enableFuzzyMatching());
        m.put("recentMatches", reporter.recentMatches());
        return m;
    }
}
