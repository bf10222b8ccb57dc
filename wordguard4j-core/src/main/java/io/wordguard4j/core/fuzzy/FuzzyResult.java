/*
 * Copyright (c) 2025 Wordguard4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.wordguard4j.core.fuzzy;

import io.wordguard4j.core.api.model.EvasionTechnique;
import java.util.Set;

/** Outcome of comparing one candidate string against one pattern. */
public record FuzzyResult(boolean matched, double confidence, String normalizedText, Set<EvasionTechnique> techniques) {
    public FuzzyResult {
        techniques = Set.copyOf(techniques);
    }

    static FuzzyResult noMatch(String normalizedText) {
        return new FuzzyResult(false, 0.0, normalizedText, Set.of());
    }
}
