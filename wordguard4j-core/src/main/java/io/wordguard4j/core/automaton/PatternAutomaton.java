/*
 * Copyright (c) 2025 Wordguard4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.wordguard4j.core.automaton;

import io.wordguard4j.core.api.InvalidPatternException;
import io.wordguard4j.core.api.model.SensitiveWord;
import java.util.*;

/**
 * Aho-Corasick automaton over normalized keys.
 *
 * <p>Nodes live in parallel arrays indexed by slot number; slot 0 is the root. Each slot keeps its
 * outgoing edges as a sorted {@code char[]} with matching target slots. After all keys are inserted
 * {@link #buildFailureLinks()} computes failure and dictionary links and seals the automaton; from
 * then on it is read-only and may be searched from any number of threads.
 */
public final class PatternAutomaton {
    private static final int ROOT = 0;
    private static final int NONE = -1;
    private static final char[] NO_CHARS = new char[0];
    private static final int[] NO_SLOTS = new int[0];

    private char[][] edgeChars = new char[16][];
    private int[][] edgeTargets = new int[16][];
    private int[] edgeCount = new int[16];
    private int[] depth = new int[16];
    private int[] fail = new int[16];
    private int[] dictLink = new int[16];
    private String[] keys = new String[16];
    private SensitiveWord[] words = new SensitiveWord[16];
    private int slots;
    private int patterns;
    private boolean sealed;

    public PatternAutomaton() {
        newSlot(0);
    }

    /**
     * Adds {@code key} for {@code origin}. A key inserted twice keeps the last origin.
     *
     * @throws InvalidPatternException if the key is blank
     * @throws IllegalStateException if the automaton has already been built
     */
    public void insert(String key, SensitiveWord origin) {
        checkKey(key);
        Objects.requireNonNull(origin, "origin");
        if (sealed) throw new IllegalStateException("Automaton is already built; insert is not allowed");
        int node = ROOT;
        for (int i = 0; i < key.length(); i++) {
            char c = key.charAt(i);
            int next = child(node, c);
            if (next == NONE) {
                next = newSlot(depth[node] + 1);
                addEdge(node, c, next);
            }
            node = next;
        }
        if (keys[node] == null) patterns++;
        keys[node] = key;
        words[node] = origin;
    }

    /** Validates every key first, then inserts them in iteration order. */
    public void insertAll(Map<String, SensitiveWord> entries) {
        for (Map.Entry<String, SensitiveWord> e : entries.entrySet()) {
            checkKey(e.getKey());
            Objects.requireNonNull(e.getValue(), "origin");
        }
        entries.forEach(this::insert);
    }

    /** Computes failure and dictionary links breadth first and seals the automaton. Idempotent. */
    public void buildFailureLinks() {
        if (sealed) return;
        fail[ROOT] = ROOT;
        dictLink[ROOT] = NONE;
        ArrayDeque<Integer> queue = new ArrayDeque<>();
        for (int e = 0; e < edgeCount[ROOT]; e++) {
            int s = edgeTargets[ROOT][e];
            fail[s] = ROOT;
            dictLink[s] = NONE;
            queue.add(s);
        }
        while (!queue.isEmpty()) {
            int node = queue.poll();
            for (int e = 0; e < edgeCount[node]; e++) {
                char c = edgeChars[node][e];
                int s = edgeTargets[node][e];
                int f = fail[node];
                while (f != ROOT && child(f, c) == NONE) {
                    f = fail[f];
                }
                int target = child(f, c);
                fail[s] = (target == NONE || target == s) ? ROOT : target;
                dictLink[s] = keys[fail[s]] != null ? fail[s] : dictLink[fail[s]];
                queue.add(s);
            }
        }
        sealed = true;
    }

    public boolean isBuilt() {
        return sealed;
    }

    /**
     * Scans {@code text} once and reports every key occurrence, overlapping ones included, in
     * order of end offset. Unless {@code partialMatch} is set, hits must be bounded by non-word chars
     * (see {@link WordChars}).
     *
     * @throws IllegalStateException if {@link #buildFailureLinks()} has not been called
     */
    public List<AutomatonHit> search(String text, boolean partialMatch) {
        if (!sealed) throw new IllegalStateException("buildFailureLinks() must be called before search");
        if (text == null || text.isEmpty() || patterns == 0) return List.of();
        List<AutomatonHit> hits = new ArrayList<>();
        int node = ROOT;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            int next = child(node, c);
            while (next == NONE && node != ROOT) {
                node = fail[node];
                next = child(node, c);
            }
            node = next == NONE ? ROOT : next;
            int out = keys[node] != null ? node : dictLink[node];
            while (out != NONE) {
                int start = i + 1 - depth[out];
                if (partialMatch || WordChars.isBounded(text, start, i + 1)) {
                    hits.add(new AutomatonHit(start, i + 1, keys[out], words[out]));
                }
                out = dictLink[out];
            }
        }
        return hits;
    }

    /** Number of distinct keys. */
    public int size() {
        return patterns;
    }

    public int nodeCount() {
        return slots;
    }

    private static void checkKey(String key) {
        if (key == null || key.isBlank()) {
            throw new InvalidPatternException("Pattern key must not be blank");
        }
    }

    private int child(int node, char c) {
        int idx = Arrays.binarySearch(edgeChars[node], 0, edgeCount[node], c);
        return idx >= 0 ? edgeTargets[node][idx] : NONE;
    }

    private void addEdge(int node, char c, int target) {
        int n = edgeCount[node];
        char[] cs = edgeChars[node];
        int[] ts = edgeTargets[node];
        if (n == cs.length) {
            int cap = Math.max(2, n * 2);
            cs = Arrays.copyOf(cs, cap);
            ts = Arrays.copyOf(ts, cap);
        }
        int pos = -(Arrays.binarySearch(cs, 0, n, c) + 1);
        System.arraycopy(cs, pos, cs, pos + 1, n - pos);
        System.arraycopy(ts, pos, ts, pos + 1, n - pos);
        cs[pos] = c;
        ts[pos] = target;
        edgeChars[node] = cs;
        edgeTargets[node] = ts;
        edgeCount[node] = n + 1;
    }

    private int newSlot(int d) {
        if (slots == depth.length) {
            int cap = slots * 2;
            edgeChars = Arrays.copyOf(edgeChars, cap);
            edgeTargets = Arrays.copyOf(edgeTargets, cap);
            edgeCount = Arrays.copyOf(edgeCount, cap);
            depth = Arrays.copyOf(depth, cap);
            fail = Arrays.copyOf(fail, cap);
            dictLink = Arrays.copyOf(dictLink, cap);
            keys = Arrays.copyOf(keys, cap);
            words = Arrays.copyOf(words, cap);
        }
        int s = slots++;
        edgeChars[s] = NO_CHARS;
        edgeTargets[s] = NO_SLOTS;
        depth[s] = d;
        fail[s] = ROOT;
        dictLink[s] = NONE;
        return s;
    }
}
