/*
 * Copyright (c) 2025 Wordguard4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.wordguard4j.core.preset;

import java.util.Locale;
import java.util.Set;

/**
 * Benign words that happen to contain a short offensive pattern ("class" contains "ass",
 * "scunthorpe" contains a slur). Used by context-aware suppression.
 */
public final class ContextSafeWords {
    private static final ContextSafeWords DEFAULTS = new ContextSafeWords(Set.of(
            // ass
            "assessment", "assassin", "assign", "assist", "assume", "associate", "assemble",
            "class", "classic", "mass", "massive", "pass", "passage", "passenger", "passion",
            "compass", "embassy", "harass", "brass", "grass", "glass", "bypass", "trespass",
            "cassette", "bassoon", "lasso", "molasses", "sassafras", "ambassador", "embarrass",
            // hell
            "hello", "shell", "shellfish", "michelle", "seashell", "nutshell", "eggshell",
            // damn
            "goddamn", "amsterdam",
            // cock
            "cocktail", "peacock", "hancock", "cockpit", "cockatoo", "cocoon", "weathercock",
            // dick
            "dickens", "dictate", "dictionary", "predict", "verdict", "addiction", "benediction",
            // cum
            "document", "cucumber", "accumulate", "circumstance", "circumference", "incumbent",
            // sex
            "sextant", "sextet", "essex", "sussex", "middlesex",
            // tit
            "title", "entitled", "institution", "constitution", "attitude", "gratitude",
            "competitive", "repetitive", "appetizer", "titanium", "titan",
            // piss
            "mississippi",
            // anal
            "analysis", "analyze", "analyst", "analytical", "canal", "banal", "final", "signal",
            // nig
            "night", "nightmare", "knight", "ignite", "significant", "benign", "malignant",
            "fagot",
            // ho
            "honest", "honor", "horse", "hospital", "host", "hotel", "hope", "horizon",
            // crap, scum
            "scrap", "scrape", "scumble",
            // place names
            "scunthorpe", "penistone", "shitterton", "cockermouth", "clitheroe", "lightwater",
            "arsenal"));

    private final Set<String> words;

    public ContextSafeWords(Set<String> words) {
        this.words = Set.copyOf(words);
    }

    public static ContextSafeWords defaults() {
        return DEFAULTS;
    }

    public boolean isSafe(String token) {
        return token != null && words.contains(token.toLowerCase(Locale.ROOT));
    }

    public Set<String> words() {
        return words;
    }
}
