/*
 * Copyright (c) 2025 Wordguard4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.wordguard4j.spring;

import io.wordguard4j.core.api.model.Language;
import io.wordguard4j.core.api.model.SensitiveWord;
import io.wordguard4j.core.api.model.Severity;
import io.wordguard4j.core.api.model.Strictness;
import io.wordguard4j.core.api.model.WhitelistEntry;
import io.wordguard4j.core.preset.FilterOptions;
import java.util.*;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@ConfigurationProperties(prefix = "wordguard4j")
public class WordGuardProperties {

    @Setter
    private boolean enabled = true;

    private Options options = new Options();
    private List<Word> words = new ArrayList<>();
    private List<Entry> whitelist = new ArrayList<>();
    private Report reporter = new Report();

    public void setOptions(Options options) {
        this.options = (options == null) ? new Options() : options;
    }

    public List<Word> getWords() {
        return Collections.unmodifiableList(words);
    }

    public void setWords(List<Word> words) {
        this.words = new ArrayList<>(Objects.requireNonNullElse(words, List.of()));
    }

    public List<Entry> getWhitelist() {
        return Collections.unmodifiableList(whitelist);
    }

    public void setWhitelist(List<Entry> whitelist) {
        this.whitelist = new ArrayList<>(Objects.requireNonNullElse(whitelist, List.of()));
    }

    public void setReporter(Report reporter) {
        this.reporter = (reporter == null) ? new Report() : reporter;
    }

    /** Configured words, validated; an invalid entry fails context startup. */
    public List<SensitiveWord> toSensitiveWords() {
        List<SensitiveWord> out = new ArrayList<>(words.size());
        for (Word w : words) {
            out.add(SensitiveWord.of(w.getWord(), w.getSeverity(), w.getCategory(), w.getLanguage()));
        }
        return out;
    }

    public List<WhitelistEntry> toWhitelistEntries() {
        List<WhitelistEntry> out = new ArrayList<>(whitelist.size());
        for (Entry e : whitelist) {
            out.add(new WhitelistEntry(e.getWord(), e.isCaseSensitive(), e.isWholeWord()));
        }
        return out;
    }

    // ---- nested: options ----
    @Getter
    @Setter
    public static final class Options {
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
        private List<Language> languages = new ArrayList<>(EnumSet.allOf(Language.class));
        private List<String> categories = new ArrayList<>();

        public FilterOptions toFilterOptions() {
            return FilterOptions.builder()
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
                    .categories(categories)
                    .build();
        }
    }

    // ---- nested: words[] ----
    @Getter
    @Setter
    public static final class Word {
        private String word;
        private int severity = Severity.MODERATE.level();
        private String category = SensitiveWord.DEFAULT_CATEGORY;
        private String language = Language.EN.tag();
    }

    // ---- nested: whitelist[] ----
    @Getter
    @Setter
    public static final class Entry {
        private String word;
        private boolean caseSensitive = false;
        private boolean wholeWord = true;
    }

    // ---- nested: reporter ----
    @Getter
    @Setter
    public static final class Report {
        private int recentCapacity = 200;
    }
}
