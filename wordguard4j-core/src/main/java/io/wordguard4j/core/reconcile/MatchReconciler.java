/*
 * Copyright (c) 2025 Wordguard4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.wordguard4j.core.reconcile;

import io.wordguard4j.core.api.model.Match;
import io.wordguard4j.core.automaton.WordChars;
import io.wordguard4j.core.preset.ContextSafeWords;
import java.util.*;

/**
 * Merges the outputs of the automaton, the fuzzy matcher and the maximum-recall pass into one
 * ordered match list, then drops whitelisted and context-safe matches.
 */
public final class MatchReconciler {
    private static final Comparator<Match> BY_POSITION = Comparator.comparingInt(Match::position)
            .thenComparing(Comparator.comparingInt(Match::length).reversed());

    private final Whitelist whitelist;
    private final ContextSafeWords safeWords;

    public MatchReconciler(Whitelist whitelist, ContextSafeWords safeWords) {
        this.whitelist = Objects.requireNonNull(whitelist, "whitelist");
        this.safeWords = Objects.requireNonNull(safeWords, "safeWords");
    }

    /**
     * @param automaton every automaton occurrence, all kept
     * @param fuzzy fuzzy hits, merged only for words not reported yet
     * @param recall maximum-recall hits, merged only for words not reported yet
     */
    public List<Match> reconcile(
            String original, List<Match> automaton, List<Match> fuzzy, List<Match> recall, boolean contextAware) {
        List<Match> merged = new ArrayList<>(automaton);
        Set<String> seen = new HashSet<>();
        for (Match m : automaton) seen.add(key(m));
        mergeNew(merged, seen, fuzzy);
        mergeNew(merged, seen, recall);

        List<Match> kept = new ArrayList<>(merged.size());
        for (Match m : merged) {
            if (whitelist.suppresses(m.word())) continue;
            if (contextAware && isOnlyInSafeContext(original, m.word())) continue;
            kept.add(m);
        }
        kept.sort(BY_POSITION);
        return List.copyOf(kept);
    }

    private static void mergeNew(List<Match> into, Set<String> seen, List<Match> extra) {
        for (Match m : extra) {
            if (seen.add(key(m))) into.add(m);
        }
    }

    private static String key(Match m) {
        return m.word().toLowerCase(Locale.ROOT);
    }

    /**
     * True when {@code word} occurs in {@code text} only inside known benign words. A word that
     * occurs standalone, inside an unknown word, or not literally at all (an obfuscated hit) is not
     * safe.
     */
    boolean isOnlyInSafeContext(String text, String word) {
        String lowerText = text.toLowerCase(Locale.ROOT);
        String lowerWord = word.toLowerCase(Locale.ROOT);
        if (lowerWord.isEmpty()) return false;
        int idx = lowerText.indexOf(lowerWord);
        if (idx < 0) return false;
        while (idx >= 0) {
            int end = idx + lowerWord.length();
            if (WordChars.isBounded(lowerText, idx, end)) return false;
            int from = idx;
            int to = end;
            while (from > 0 && Character.isLetterOrDigit(lowerText.charAt(from - 1))) from--;
            while (to < lowerText.length() && Character.isLetterOrDigit(lowerText.charAt(to))) to++;
            if (!safeWords.isSafe(lowerText.substring(from, to))) return false;
            idx = lowerText.indexOf(lowerWord, idx + 1);
        }
        return true;
    }

    /**
     * Replaces every match span with {@code replacement} repeated to the span length. Spans are
     * merged first and applied right to left, so offsets stay valid and overlaps are masked once.
     */
    public static String mask(String original, List<Match> matches, char replacement) {
        if (original == null || original.isEmpty() || matches.isEmpty()) return original;
        List<int[]> spans = new ArrayList<>(matches.size());
        for (Match m : matches) {
            int s = Math.max(0, m.position());
            int e = Math.min(original.length(), m.end());
            if (e > s) spans.add(new int[] {s, e});
        }
        spans.sort(Comparator.comparingInt((int[] a) -> a[0]).thenComparingInt(a -> -a[1]));
        List<int[]> merged = new ArrayList<>();
        for (int[] s : spans) {
            int[] last = merged.isEmpty() ? null : merged.get(merged.size() - 1);
            if (last != null && s[0] <= last[1]) {
                last[1] = Math.max(last[1], s[1]);
            } else {
                merged.add(new int[] {s[0], s[1]});
            }
        }
        StringBuilder out = new StringBuilder(original);
        for (int i = merged.size() - 1; i >= 0; i--) {
            int[] s = merged.get(i);
            out.replace(s[0], s[1], String.valueOf(replacement).repeat(s[1] - s[0]));
        }
        return out.toString();
    }
}
