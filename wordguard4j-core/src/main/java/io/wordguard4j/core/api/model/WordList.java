/*
 * Copyright (c) 2025 Wordguard4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.wordguard4j.core.api.model;

import java.util.List;

/** In-memory payload for bulk import/export of custom words. */
public record WordList(String version, List<SensitiveWord> words) {
    public static final String CURRENT_VERSION = "1.0.0";

    public static WordList of(List<SensitiveWord> words) {
        return new WordList(CURRENT_VERSION, List.copyOf(words));
    }
}
