/*
 * Copyright (c) 2025 Wordguard4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.wordguard4j.core.api.model;

import java.util.Set;

/**
 * A single reported occurrence. {@code position} and {@code length} always address the original
 * (caller supplied) text, whatever normalization the match was found in.
 *
 * @param confidence 0..1 for fuzzy and maximum-recall matches, null for automaton matches
 */
public record Match(
        String word,
        Severity severity,
        String category,
        int position,
        int length,
        Double confidence, // nullable
        Set<EvasionTechnique> evasionTechniques,
        MatchSource source) {

    public Match {
        evasionTechniques = (evasionTechniques == null) ? Set.of() : Set.copyOf(evasionTechniques);
    }

    public int end() {
        return position + length;
    }
}
