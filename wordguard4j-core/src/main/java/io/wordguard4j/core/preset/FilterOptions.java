/*
 * Copyright (c) 2025 Wordguard4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.wordguard4j.core.preset;

import io.wordguard4j.core.api.model.Language;
import io.wordguard4j.core.api.model.SensitiveWord;
import io.wordguard4j.core.api.model.Severity;
import io.wordguard4j.core.api.model.Strictness;
import java.util.*;

/**
 * Fully defaulted, validated filter configuration. Instances are immutable; use
 * {@link #toBuilder()} to derive a changed copy.
 *
 * @param categories categories to check; empty means all
 */
public record FilterOptions(
        boolean normalize,
        boolean partialMatch,
        boolean replaceMatches,
        char replacementChar,
        boolean enableFuzzyMatching,
        Strictness strictness,
        int maxEditDistance,
        boolean detectSymbolReplacement,
        boolean detectSpaceInsertion,
        boolean detectRepeatedLetters,
        boolean detectLanguageMixing,
        boolean contextAware,
        Severity minSeverity,
        Severity maxSeverity,
        Set<Language> languages,
        Set<String> categories) {

    public FilterOptions {
        Objects.requireNonNull(strictness, "strictness");
        Objects.requireNonNull(minSeverity, "minSeverity");
        Objects.requireNonNull(maxSeverity, "maxSeverity");
        if (maxEditDistance < 0) {
            throw new IllegalArgumentException("maxEditDistance must be >= 0, got " + maxEditDistance);
        }
        if (minSeverity.level() > maxSeverity.level()) {
            throw new IllegalArgumentException("minSeverity " + minSeverity + " is above maxSeverity " + maxSeverity);
        }
        if (languages == null || languages.isEmpty()) {
            throw new IllegalArgumentException("At least one language must be enabled");
        }
        if (Character.isWhitespace(replacementChar) || Character.isISOControl(replacementChar)) {
            throw new IllegalArgumentException("replacementChar must be printable");
        }
        languages = Collections.unmodifiableSet(EnumSet.copyOf(languages));
        categories = (categories == null) ? Set.of() : Set.copyOf(categories);
    }

    public static FilterOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .normalize(normalize)
                .partialMatch(partialMatch)
                .replaceMatches(replaceMatches)
                .replacementChar(replacementChar)
                .enableFuzzyMatching(enableFuzzyMatching)
                .strictness(strictness)
                .maxEditDistance(maxEditDistance)
                .detectSymbolReplacement(detectSymbolReplacement)
                .detectSpaceInsertion(detectSpaceInsertion)
                .detectRepeatedLetters(detectRepeatedLetters)
                .detectLanguageMixing(detectLanguageMixing)
                .contextAware(contextAware)
                .minSeverity(minSeverity)
                .maxSeverity(maxSeverity)
                .languages(languages)
                .categories(categories);
    }

    /** True when the word passes the severity, language and category filters. */
    public boolean accepts(SensitiveWord w) {
        int level = w.severity().level();
        if (level < minSeverity.level() || level > maxSeverity.level()) return false;
        if (!languages.contains(w.language())) return false;
        return categories.isEmpty() || categories.contains(w.category());
    }

    public static final class Builder {
        private boolean normalize = true;
        private boolean partialMatch = false;
        private boolean replaceMatches = false;
        private char replacementChar = '*';
        private boolean enableFuzzyMatching = false;
        private Strictness strictness = Strictness.MEDIUM;
        private int maxEditDistance = 2;
        private boolean detectSymbolReplacement = true;
        private boolean detectSpaceInsertion = true;
        private boolean detectRepeatedLetters = true;
        private boolean detectLanguageMixing = true;
        private boolean contextAware = false;
        private Severity minSeverity = Severity.MILD;
        private Severity maxSeverity = Severity.EXTREME;
        private Set<Language> languages = EnumSet.allOf(Language.class);
        private Set<String> categories = Set.of();

        private Builder() {}

        public Builder normalize(boolean v) {
            this.normalize = v;
            return this;
        }

        public Builder partialMatch(boolean v) {
            this.partialMatch = v;
            return this;
        }

        public Builder replaceMatches(boolean v) {
            this.replaceMatches = v;
            return this;
        }

        public Builder replacementChar(char v) {
            this.replacementChar = v;
            return this;
        }

        public Builder enableFuzzyMatching(boolean v) {
            this.enableFuzzyMatching = v;
            return this;
        }

        public Builder strictness(Strictness v) {
            this.strictness = v;
            return this;
        }

        public Builder maxEditDistance(int v) {
            this.maxEditDistance = v;
            return this;
        }

        public Builder detectSymbolReplacement(boolean v) {
            this.detectSymbolReplacement = v;
            return this;
        }

        public Builder detectSpaceInsertion(boolean v) {
            this.detectSpaceInsertion = v;
            return this;
        }

        public Builder detectRepeatedLetters(boolean v) {
            this.detectRepeatedLetters = v;
            return this;
        }

        public Builder detectLanguageMixing(boolean v) {
            this.detectLanguageMixing = v;
            return this;
        }

        public Builder contextAware(boolean v) {
            this.contextAware = v;
            return this;
        }

        public Builder minSeverity(Severity v) {
            this.minSeverity = v;
            return this;
        }

        public Builder maxSeverity(Severity v) {
            this.maxSeverity = v;
            return this;
        }

        public Builder languages(Collection<Language> v) {
            this.languages = (v == null || v.isEmpty()) ? Set.of() : EnumSet.copyOf(v);
            return this;
        }

        public Builder categories(Collection<String> v) {
            this.categories = (v == null) ? Set.of() : new HashSet<>(v);
            return this;
        }

        public FilterOptions build() {
            return new FilterOptions(
                    normalize,
                    partialMatch,
                    replaceMatches,
                    replacementChar,
                    enableFuzzyMatching,
                    strictness,
                    maxEditDistance,
                    detectSymbolReplacement,
                    detectSpaceInsertion,
                    detectRepeatedLetters,
                    detectLanguageMixing,
                    contextAware,
                    minSeverity,
                    maxSeverity,
                    languages,
                    categories);
        }
    }
}
