/*
 * Copyright (c) 2025 Wordguard4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.wordguard4j.core.api.model;

/** How hard the filter tries to see through obfuscated text. */
public enum Strictness {
    LOW(1), // exact (case-insensitive) matches only
    MEDIUM(2), // evasion normalization, equality after folding
    HIGH(3), // MEDIUM + bounded edit distance
    PARANOID(4); // lossy maximum-recall normalization, relaxed thresholds

    private final int level;

    Strictness(int level) {
        this.level = level;
    }

    public int level() {
        return level;
    }
}
