/*
 * Copyright (c) 2025 Wordguard4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.wordguard4j.core.fuzzy;

import io.wordguard4j.core.api.model.EvasionTechnique;
import io.wordguard4j.core.api.model.SensitiveWord;
import java.util.Set;

/**
 * A fuzzy match located in the caller's text.
 *
 * @param position offset in the original text
 * @param length length of the original span
 */
public record FuzzyHit(SensitiveWord word, int position, int length, double confidence, Set<EvasionTechnique> techniques) {
    public FuzzyHit {
        techniques = Set.copyOf(techniques);
    }
}
