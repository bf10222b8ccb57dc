/*
 * Copyright (c) 2025 Wordguard4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.wordguard4j.core.api.model;

import io.wordguard4j.core.api.InvalidPatternException;

/**
 * A word (or phrase) the filter looks for. Validated on construction, immutable afterwards.
 *
 * @param category free-form grouping label; blank becomes {@value #DEFAULT_CATEGORY}
 */
public record SensitiveWord(String word, Severity severity, String category, Language language) {

    public static final String DEFAULT_CATEGORY = "custom";

    public SensitiveWord {
        if (word == null || word.isBlank()) {
            throw new InvalidPatternException("Word must not be blank");
        }
        if (severity == null) {
            throw new InvalidPatternException("Severity is required for '" + word + "'");
        }
        category = (category == null || category.isBlank()) ? DEFAULT_CATEGORY : category;
        language = (language == null) ? Language.EN : language;
    }

    public static SensitiveWord of(String word, Severity severity) {
        return new SensitiveWord(word, severity, DEFAULT_CATEGORY, Language.EN);
    }

    public static SensitiveWord of(String word, Severity severity, String category) {
        return new SensitiveWord(word, severity, category, Language.EN);
    }

    /** Raw-value factory used by configuration layers; every field is validated. */
    public static SensitiveWord of(String word, int severity, String category, String language) {
        Language lang = (language == null || language.isBlank()) ? Language.EN : Language.fromTag(language);
        return new SensitiveWord(word, Severity.of(severity), category, lang);
    }
}
