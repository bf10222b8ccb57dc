/*
 * Copyright (c) 2025 Wordguard4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.wordguard4j.core.fuzzy;

import io.wordguard4j.core.api.model.EvasionTechnique;
import io.wordguard4j.core.preset.FoldTables;
import java.util.EnumSet;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Best-effort tagging of the obfuscation techniques visible in a piece of original (not normalized)
 * text. The result says nothing about whether the text matched anything.
 */
public final class EvasionClassifier {
    private static final Pattern SYMBOLS = Pattern.compile("[@$!*#]");
    private static final Pattern SPACING = Pattern.compile("\\s{2,}|[._\\-|]|\\S\\s\\S");
    private static final Pattern REPEATS = Pattern.compile("(.)\\1{3,}");
    private static final Pattern DIGITS = Pattern.compile("[0-9]");
    private static final Pattern ARABIC = Pattern.compile("[\\u0600-\\u06FF]");
    private static final Pattern LATIN = Pattern.compile("[a-zA-Z]");

    private final FoldTables tables;

    public EvasionClassifier(FoldTables tables) {
        this.tables = tables;
    }

    public EvasionClassifier() {
        this(FoldTables.defaults());
    }

    public Set<EvasionTechnique> classify(String original) {
        EnumSet<EvasionTechnique> found = EnumSet.noneOf(EvasionTechnique.class);
        if (original == null || original.isEmpty()) return found;
        if (SYMBOLS.matcher(original).find()) found.add(EvasionTechnique.SYMBOL_REPLACEMENT);
        if (SPACING.matcher(original).find()) found.add(EvasionTechnique.SPACE_INSERTION);
        if (REPEATS.matcher(original).find()) found.add(EvasionTechnique.REPEATED_LETTERS);
        if (DIGITS.matcher(original).find()) found.add(EvasionTechnique.LEET_SPEAK);
        if (ARABIC.matcher(original).find() && LATIN.matcher(original).find()) {
            found.add(EvasionTechnique.LANGUAGE_MIXING);
        }
        if (hasSubstitute(original)) found.add(EvasionTechnique.CHARACTER_SUBSTITUTION);
        return found;
    }

    private boolean hasSubstitute(String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (tables.confusables().containsKey(c)) return true;
            if (c >= '\uFF01' && c <= '\uFF5E') return true; // fullwidth forms
        }
        return false;
    }
}
