/*
 * Copyright (c) 2025 Wordguard4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.wordguard4j.core.api;

import io.wordguard4j.core.api.model.*;
import io.wordguard4j.core.automaton.AutomatonHit;
import io.wordguard4j.core.automaton.PatternAutomaton;
import io.wordguard4j.core.fuzzy.EvasionClassifier;
import io.wordguard4j.core.fuzzy.FuzzyHit;
import io.wordguard4j.core.fuzzy.FuzzyMatcher;
import io.wordguard4j.core.fuzzy.FuzzySettings;
import io.wordguard4j.core.normalize.NormalizedText;
import io.wordguard4j.core.normalize.Normalizer;
import io.wordguard4j.core.preset.ContextSafeWords;
import io.wordguard4j.core.preset.FilterOptions;
import io.wordguard4j.core.reconcile.MatchReconciler;
import io.wordguard4j.core.reconcile.Whitelist;
import io.wordguard4j.core.report.NoopReporter;
import io.wordguard4j.core.report.Reporter;
import java.util.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point: owns the word list, the whitelist and the options, and answers detection calls
 * against an immutable {@link PatternIndex} built from them.
 *
 * <p>Detection is lock-free and may run on any number of threads. Every mutation rebuilds the whole
 * index under the instance monitor and publishes it through a volatile field; a detection that
 * started before the swap finishes against the old index.
 */
public final class SensitiveWordFilter {
    private static final Logger log = LoggerFactory.getLogger(SensitiveWordFilter.class);

    private final Reporter reporter;
    private final EvasionClassifier classifier = new EvasionClassifier();
    private final ContextSafeWords safeWords;

    // guarded by this
    private final List<SensitiveWord> words = new ArrayList<>();
    private final List<WhitelistEntry> whitelist = new ArrayList<>();
    private FilterOptions options;

    private volatile PatternIndex index;

    public SensitiveWordFilter() {
        this(FilterOptions.defaults(), List.of(), List.of(), NoopReporter.INSTANCE);
    }

    public SensitiveWordFilter(FilterOptions options) {
        this(options, List.of(), List.of(), NoopReporter.INSTANCE);
    }

    public SensitiveWordFilter(
            FilterOptions options,
            Collection<SensitiveWord> initialWords,
            Collection<WhitelistEntry> initialWhitelist,
            Reporter reporter) {
        this(options, initialWords, initialWhitelist, reporter, ContextSafeWords.defaults());
    }

    public SensitiveWordFilter(
            FilterOptions options,
            Collection<SensitiveWord> initialWords,
            Collection<WhitelistEntry> initialWhitelist,
            Reporter reporter,
            ContextSafeWords safeWords) {
        this.options = Objects.requireNonNull(options, "options");
        this.reporter = Objects.requireNonNull(reporter, "reporter");
        this.safeWords = Objects.requireNonNull(safeWords, "safeWords");
        requireNoNulls(initialWords);
        for (WhitelistEntry e : initialWhitelist) Objects.requireNonNull(e, "whitelist entry");
        this.words.addAll(initialWords);
        this.whitelist.addAll(initialWhitelist);
        synchronized (this) {
            rebuild("init");
        }
    }

    // ---------------- detection ----------------

    public DetectionResult detect(String text) {
        PatternIndex idx = index;
        return idx.detect(text, idx.options.replaceMatches());
    }

    public boolean hasMatch(String text) {
        PatternIndex idx = index;
        return idx.detect(text, false).hasMatch();
    }

    /** Returns {@code text} with every match masked, whatever {@code replaceMatches} says. */
    public String clean(String text) {
        if (text == null || text.isEmpty()) return text;
        DetectionResult r = index.detect(text, true);
        return r.cleanedText() != null ? r.cleanedText() : text;
    }

    // ---------------- words ----------------

    public synchronized void addWord(SensitiveWord word) {
        if (word == null) throw new InvalidPatternException("Word must not be null");
        words.add(word);
        rebuild("addWord");
    }

    /** Adds all words or none: the batch is validated before anything changes. */
    public synchronized void addWords(Collection<SensitiveWord> batch) {
        requireNoNulls(batch);
        words.addAll(batch);
        rebuild("addWords");
    }

    /** @return true when at least one entry with exactly this word was removed */
    public synchronized boolean removeWord(String word) {
        boolean removed = words.removeIf(w -> w.word().equals(word));
        if (removed) rebuild("removeWord");
        return removed;
    }

    public synchronized void clearWords() {
        words.clear();
        rebuild("clearWords");
    }

    public synchronized List<SensitiveWord> getWords() {
        return List.copyOf(words);
    }

    /**
     * Loads a word list. With {@code replace} the current words are dropped; otherwise words whose
     * text is already present (ignoring case) are skipped.
     *
     * @throws MalformedImportException if the payload lacks a version or words, or has null entries
     */
    public synchronized void importWords(WordList list, boolean replace) {
        if (list == null) throw new MalformedImportException("Word list is missing");
        if (list.version() == null || list.version().isBlank()) {
            throw new MalformedImportException("Word list has no version");
        }
        if (list.words() == null) throw new MalformedImportException("Word list has no words");
        for (SensitiveWord w : list.words()) {
            if (w == null) throw new MalformedImportException("Word list contains a null entry");
        }
        if (replace) {
            words.clear();
            words.addAll(list.words());
        } else {
            Set<String> present = new HashSet<>();
            for (SensitiveWord w : words) present.add(w.word().toLowerCase(Locale.ROOT));
            for (SensitiveWord w : list.words()) {
                if (present.add(w.word().toLowerCase(Locale.ROOT))) words.add(w);
            }
        }
        rebuild("importWords");
    }

    public synchronized WordList exportWords() {
        return WordList.of(words);
    }

    // ---------------- whitelist ----------------

    public void addToWhitelist(String word) {
        addToWhitelist(WhitelistEntry.of(word));
    }

    public synchronized void addToWhitelist(WhitelistEntry entry) {
        Objects.requireNonNull(entry, "entry");
        whitelist.add(entry);
        rebuild("addToWhitelist");
    }

    public synchronized void addAllToWhitelist(Collection<WhitelistEntry> entries) {
        for (WhitelistEntry e : entries) Objects.requireNonNull(e, "whitelist entry");
        whitelist.addAll(entries);
        rebuild("addAllToWhitelist");
    }

    /** Removes every entry equal to {@code word} ignoring case. */
    public synchronized boolean removeFromWhitelist(String word) {
        if (word == null) return false;
        boolean removed = whitelist.removeIf(e -> e.word().equalsIgnoreCase(word));
        if (removed) rebuild("removeFromWhitelist");
        return removed;
    }

    public synchronized void clearWhitelist() {
        whitelist.clear();
        rebuild("clearWhitelist");
    }

    public synchronized List<WhitelistEntry> getWhitelist() {
        return List.copyOf(whitelist);
    }

    public boolean isWhitelisted(String word) {
        return index.whitelist.suppresses(word);
    }

    // ---------------- options ----------------

    public synchronized void setOptions(FilterOptions newOptions) {
        this.options = Objects.requireNonNull(newOptions, "options");
        rebuild("setOptions");
    }

    public FilterOptions getOptions() {
        return index.options;
    }

    // ---------------- internals ----------------

    private static void requireNoNulls(Collection<SensitiveWord> batch) {
        if (batch == null) throw new InvalidPatternException("Word batch must not be null");
        int i = 0;
        for (SensitiveWord w : batch) {
            if (w == null) throw new InvalidPatternException("Word at index " + i + " is null");
            i++;
        }
    }

    private void rebuild(String reason) {
        PatternIndex next = new PatternIndex(options, words, Whitelist.of(whitelist));
        this.index = next;
        if (log.isDebugEnabled()) {
            log.debug(
                    "Rebuilt pattern index ({}): {} active of {} words, {} automaton nodes, strictness={}",
                    reason,
                    next.active.size(),
                    words.size(),
                    next.automaton.nodeCount(),
                    options.strictness());
        }
    }

    /** Everything a detection needs, built in one go and never modified afterwards. */
    private final class PatternIndex {
        final FilterOptions options;
        final List<SensitiveWord> active;
        final Whitelist whitelist;
        final Normalizer normalizer;
        final PatternAutomaton automaton;
        final PatternAutomaton recallAutomaton; // null below PARANOID
        final FuzzyMatcher fuzzy; // null unless fuzzy matching is on
        final MatchReconciler reconciler;

        PatternIndex(FilterOptions options, List<SensitiveWord> allWords, Whitelist whitelist) {
            this.options = options;
            this.whitelist = whitelist;
            this.normalizer = Normalizer.forOptions(options);
            List<SensitiveWord> accepted = new ArrayList<>();
            for (SensitiveWord w : allWords) {
                if (options.accepts(w)) accepted.add(w);
            }
            this.active = List.copyOf(accepted);

            this.automaton = new PatternAutomaton();
            Map<String, SensitiveWord> keys = new LinkedHashMap<>();
            for (SensitiveWord w : active) {
                String key = normalizer.normalize(w.word());
                if (key.isBlank()) {
                    log.debug("Skipping '{}': nothing left after normalization", w.word());
                    continue;
                }
                keys.remove(key); // re-insert so the last definition wins
                keys.put(key, w);
            }
            automaton.insertAll(keys);
            automaton.buildFailureLinks();

            if (options.strictness() == Strictness.PARANOID) {
                this.recallAutomaton = new PatternAutomaton();
                for (SensitiveWord w : active) {
                    String key = normalizer.maximumRecall(w.word());
                    if (key.length() >= 3) recallAutomaton.insert(key, w);
                }
                recallAutomaton.buildFailureLinks();
            } else {
                this.recallAutomaton = null;
            }
            this.fuzzy = options.enableFuzzyMatching() ? new FuzzyMatcher(FuzzySettings.from(options), classifier) : null;
            this.reconciler = new MatchReconciler(whitelist, safeWords);
        }

        DetectionResult detect(String text, boolean replace) {
            if (text == null || text.isEmpty() || active.isEmpty()) {
                String t = text == null ? "" : text;
                return new DetectionResult(false, List.of(), t, replace ? t : null);
            }
            NormalizedText normalized = normalizer.normalizeTracked(text);
            List<Match> exact = new ArrayList<>();
            for (AutomatonHit hit : automaton.search(normalized.text(), options.partialMatch())) {
                exact.add(toMatch(text, normalized.toOriginal(hit.start(), hit.end()), hit.word(), null, MatchSource.AUTOMATON));
            }

            List<Match> approximate = new ArrayList<>();
            if (fuzzy != null) {
                for (FuzzyHit hit : fuzzy.findAll(text, active)) {
                    SensitiveWord w = hit.word();
                    approximate.add(new Match(
                            w.word(),
                            w.severity(),
                            w.category(),
                            hit.position(),
                            hit.length(),
                            hit.confidence(),
                            hit.techniques(),
                            MatchSource.FUZZY));
                }
            }

            List<Match> recall = new ArrayList<>();
            if (recallAutomaton != null) {
                NormalizedText squeezed = normalizer.maximumRecallTracked(text);
                for (AutomatonHit hit : recallAutomaton.search(squeezed.text(), true)) {
                    recall.add(toMatch(
                            text, squeezed.toOriginal(hit.start(), hit.end()), hit.word(), null, MatchSource.MAXIMUM_RECALL));
                }
            }

            List<Match> matches = reconciler.reconcile(text, exact, approximate, recall, options.contextAware());
            if (log.isTraceEnabled()) {
                log.trace(
                        "Detection over {} chars: {} automaton, {} fuzzy, {} recall, {} kept",
                        text.length(),
                        exact.size(),
                        approximate.size(),
                        recall.size(),
                        matches.size());
            }
            if (matches.isEmpty()) {
                return new DetectionResult(false, List.of(), text, replace ? text : null);
            }
            reporter.report(matches);
            String cleaned = replace ? MatchReconciler.mask(text, matches, options.replacementChar()) : null;
            return new DetectionResult(true, matches, text, cleaned);
        }

        private Match toMatch(String text, int[] span, SensitiveWord w, Double confidence, MatchSource source) {
            return new Match(
                    w.word(),
                    w.severity(),
                    w.category(),
                    span[0],
                    span[1] - span[0],
                    confidence,
                    classifier.classify(text.substring(span[0], span[1])),
                    source);
        }
    }
}
