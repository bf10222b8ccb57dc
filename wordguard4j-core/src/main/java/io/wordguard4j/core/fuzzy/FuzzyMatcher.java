/*
 * Copyright (c) 2025 Wordguard4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.wordguard4j.core.fuzzy;

import io.wordguard4j.core.api.model.EvasionTechnique;
import io.wordguard4j.core.api.model.SensitiveWord;
import io.wordguard4j.core.api.model.Strictness;
import io.wordguard4j.core.normalize.NormalizedText;
import io.wordguard4j.core.normalize.Normalizer;
import java.util.*;

/**
 * Approximate matcher for words the automaton misses because of obfuscation.
 *
 * <p>Behaviour per strictness:
 * <ul>
 *   <li>{@code LOW}: case-insensitive equality only (confidence 1.0).</li>
 *   <li>{@code MEDIUM}: equality after evasion normalization (0.95).</li>
 *   <li>{@code HIGH}: as MEDIUM, plus edit distance within {@code maxEditDistance}, kept when the
 *       confidence {@code 1 - d / max(len)} is at least 0.7.</li>
 *   <li>{@code PARANOID}: maximum-recall normalization; equality (0.99), containment (0.95) or edit
 *       distance within {@code max(maxEditDistance, ceil(0.4 * len))} with confidence at least 0.5.</li>
 * </ul>
 * Containment and edit distance are never tried for patterns shorter than three normalized chars.
 */
public final class FuzzyMatcher {
    static final int MIN_APPROXIMATE_LENGTH = 3;

    private static final double EXACT = 1.0;
    private static final double EVADED_EQUAL = 0.95;
    private static final double EVADED_CONTAINED = 0.9;
    private static final double HIGH_THRESHOLD = 0.7;
    private static final double RECALL_EQUAL = 0.99;
    private static final double RECALL_CONTAINED = 0.95;
    private static final double RECALL_THRESHOLD = 0.5;

    private final FuzzySettings settings;
    private final Normalizer evasion;
    private final EvasionClassifier classifier;

    public FuzzyMatcher(FuzzySettings settings, EvasionClassifier classifier) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.evasion = Normalizer.evasion(settings.toFilterOptions());
        this.classifier = Objects.requireNonNull(classifier, "classifier");
    }

    public FuzzyMatcher(FuzzySettings settings) {
        this(settings, new EvasionClassifier());
    }

    public FuzzySettings settings() {
        return settings;
    }

    /** Compares a single candidate (typically one token) against one pattern. */
    public FuzzyResult match(String candidate, String pattern) {
        if (candidate == null || pattern == null) return FuzzyResult.noMatch("");
        if (settings.strictness() == Strictness.LOW) {
            String c = candidate.toLowerCase(Locale.ROOT);
            boolean same = c.equals(pattern.toLowerCase(Locale.ROOT));
            return same
                    ? new FuzzyResult(true, EXACT, c, classifier.classify(candidate))
                    : FuzzyResult.noMatch(c);
        }
        boolean recall = settings.strictness() == Strictness.PARANOID;
        String nc = recall ? evasion.maximumRecall(candidate) : evasion.normalize(candidate);
        String np = recall ? evasion.maximumRecall(pattern) : evasion.normalize(pattern);
        double confidence = score(nc, np);
        return confidence > 0
                ? new FuzzyResult(true, confidence, nc, classifier.classify(candidate))
                : FuzzyResult.noMatch(nc);
    }

    /**
     * Scores an already normalized candidate against an already normalized pattern.
     *
     * @return the confidence, or 0 when the pair does not match at the configured strictness
     */
    double score(String nc, String np) {
        if (nc.isEmpty() || np.isEmpty()) return 0.0;
        Strictness s = settings.strictness();
        if (s == Strictness.PARANOID) {
            if (nc.equals(np)) return RECALL_EQUAL;
            if (np.length() < MIN_APPROXIMATE_LENGTH) return 0.0;
            if (nc.contains(np)) return RECALL_CONTAINED;
            int allowed = Math.max(settings.maxEditDistance(), (int) Math.ceil(np.length() * 0.4));
            int d = Levenshtein.distance(nc, np);
            double confidence = 1.0 - (double) d / Math.max(nc.length(), np.length());
            return d <= allowed && confidence >= RECALL_THRESHOLD ? confidence : 0.0;
        }
        if (nc.equals(np)) return EVADED_EQUAL;
        if (s == Strictness.HIGH && np.length() >= MIN_APPROXIMATE_LENGTH) {
            int d = Levenshtein.distance(nc, np);
            double confidence = 1.0 - (double) d / Math.max(nc.length(), np.length());
            if (d <= settings.maxEditDistance() && confidence >= HIGH_THRESHOLD) return confidence;
        }
        return 0.0;
    }

    /**
     * Looks for every pattern in {@code text}: first token by token, then as a substring of the
     * whole normalized text. At most one hit is returned per pattern, positioned in the original text.
     */
    public List<FuzzyHit> findAll(String text, Collection<SensitiveWord> words) {
        if (text == null || text.isBlank() || words.isEmpty()) return List.of();
        if (settings.strictness() == Strictness.LOW) return findExactTokens(text, words);

        boolean recall = settings.strictness() == Strictness.PARANOID;
        NormalizedText evaded = evasion.normalizeTracked(text);
        NormalizedText recallText = recall ? evasion.maximumRecallTracked(text) : null;
        List<int[]> tokens = tokens(evaded.text());

        List<FuzzyHit> hits = new ArrayList<>();
        for (SensitiveWord word : words) {
            String np = recall ? evasion.maximumRecall(word.word()) : evasion.normalize(word.word());
            if (np.isEmpty()) continue;
            FuzzyHit hit = findInTokens(text, evaded, tokens, word, np, recall);
            if (hit == null) {
                hit = recall ? findContained(text, recallText, word, np, RECALL_EQUAL, RECALL_CONTAINED)
                        : findContained(text, evaded, word, np, EVADED_EQUAL, EVADED_CONTAINED);
            }
            if (hit != null) hits.add(hit);
        }
        return hits;
    }

    private FuzzyHit findInTokens(
            String text, NormalizedText evaded, List<int[]> tokens, SensitiveWord word, String np, boolean recall) {
        for (int[] t : tokens) {
            String token = evaded.text().substring(t[0], t[1]);
            String nc = recall ? evasion.maximumRecall(token) : token;
            double confidence = score(nc, np);
            if (confidence > 0) {
                return hitAt(text, evaded.toOriginal(t[0], t[1]), word, confidence);
            }
        }
        return null;
    }

    private FuzzyHit findContained(
            String text, NormalizedText normalized, SensitiveWord word, String np, double equal, double contained) {
        String haystack = normalized.text();
        if (haystack.equals(np)) {
            return hitAt(text, normalized.toOriginal(0, haystack.length()), word, equal);
        }
        if (np.length() < MIN_APPROXIMATE_LENGTH) return null;
        int idx = haystack.indexOf(np);
        if (idx < 0) return null;
        return hitAt(text, normalized.toOriginal(idx, idx + np.length()), word, contained);
    }

    private List<FuzzyHit> findExactTokens(String text, Collection<SensitiveWord> words) {
        List<FuzzyHit> hits = new ArrayList<>();
        List<int[]> tokens = tokens(text);
        for (SensitiveWord word : words) {
            String wanted = word.word().toLowerCase(Locale.ROOT);
            for (int[] t : tokens) {
                if (text.substring(t[0], t[1]).toLowerCase(Locale.ROOT).equals(wanted)) {
                    hits.add(hitAt(text, t, word, EXACT));
                    break;
                }
            }
        }
        return hits;
    }

    private FuzzyHit hitAt(String text, int[] span, SensitiveWord word, double confidence) {
        Set<EvasionTechnique> techniques = classifier.classify(text.substring(span[0], span[1]));
        return new FuzzyHit(word, span[0], span[1] - span[0], confidence, techniques);
    }

    /** Whitespace-delimited {@code [start,end)} ranges. */
    private static List<int[]> tokens(String s) {
        List<int[]> out = new ArrayList<>();
        int i = 0;
        while (i < s.length()) {
            while (i < s.length() && Character.isWhitespace(s.charAt(i))) i++;
            int start = i;
            while (i < s.length() && !Character.isWhitespace(s.charAt(i))) i++;
            if (i > start) out.add(new int[] {start, i});
        }
        return out;
    }
}
