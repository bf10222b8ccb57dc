/*
 * Copyright (c) 2025 Wordguard4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.wordguard4j.core.api.model;

import io.wordguard4j.core.api.InvalidPatternException;

/** Severity of a sensitive word, ordered from mildest to most extreme. */
public enum Severity {
    MILD(1),
    MODERATE(2),
    SEVERE(3),
    EXTREME(4);

    private final int level;

    Severity(int level) {
        this.level = level;
    }

    public int level() {
        return level;
    }

    public static Severity of(int level) {
        for (Severity s : values()) {
            if (s.level == level) return s;
        }
        throw new InvalidPatternException("Severity must be within 1..4, got " + level);
    }
}
