/*
 * Copyright (c) 2025 Wordguard4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.wordguard4j.core.automaton;

import io.wordguard4j.core.api.model.SensitiveWord;

/**
 * One pattern occurrence found by {@link PatternAutomaton#search}.
 *
 * @param start inclusive offset in the searched text
 * @param end exclusive offset in the searched text
 * @param key the normalized key that matched
 * @param word the pattern the key was inserted for
 */
public record AutomatonHit(int start, int end, String key, SensitiveWord word) {
    public int length() {
        return end - start;
    }
}
