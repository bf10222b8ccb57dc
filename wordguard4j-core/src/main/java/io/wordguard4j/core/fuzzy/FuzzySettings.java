/*
 * Copyright (c) 2025 Wordguard4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.wordguard4j.core.fuzzy;

import io.wordguard4j.core.api.model.Strictness;
import io.wordguard4j.core.preset.FilterOptions;
import java.util.Objects;

/** The subset of {@link FilterOptions} the fuzzy matcher looks at. */
public record FuzzySettings(
        Strictness strictness,
        int maxEditDistance,
        boolean detectSymbolReplacement,
        boolean detectSpaceInsertion,
        boolean detectRepeatedLetters,
        boolean detectLanguageMixing) {

    public FuzzySettings {
        Objects.requireNonNull(strictness, "strictness");
        if (maxEditDistance < 0) {
            throw new IllegalArgumentException("maxEditDistance must be >= 0, got " + maxEditDistance);
        }
    }

    public static FuzzySettings from(FilterOptions o) {
        return new FuzzySettings(
                o.strictness(),
                o.maxEditDistance(),
                o.detectSymbolReplacement(),
                o.detectSpaceInsertion(),
                o.detectRepeatedLetters(),
                o.detectLanguageMixing());
    }

    /** All techniques on. */
    public static FuzzySettings of(Strictness strictness, int maxEditDistance) {
        return new FuzzySettings(strictness, maxEditDistance, true, true, true, true);
    }

    FilterOptions toFilterOptions() {
        return FilterOptions.builder()
                .strictness(strictness)
                .maxEditDistance(maxEditDistance)
                .detectSymbolReplacement(detectSymbolReplacement)
                .detectSpaceInsertion(detectSpaceInsertion)
                .detectRepeatedLetters(detectRepeatedLetters)
                .detectLanguageMixing(detectLanguageMixing)
                .build();
    }
}
