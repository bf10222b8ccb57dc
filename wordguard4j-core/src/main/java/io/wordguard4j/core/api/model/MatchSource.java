/*
 * Copyright (c) 2025 Wordguard4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.wordguard4j.core.api.model;

/** Which detection path produced a {@link Match}. */
public enum MatchSource {
    AUTOMATON,
    FUZZY,
    MAXIMUM_RECALL
}
