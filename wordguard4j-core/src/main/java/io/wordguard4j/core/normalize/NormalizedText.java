/*
 * Copyright (c) 2025 Wordguard4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.wordguard4j.core.normalize;

/**
 * Result of a tracked normalization: the normalized string plus, for every normalized char, the
 * {@code [start,end)} span of the original text it was derived from.
 */
public final class NormalizedText {
    private final String original;
    private final String text;
    private final int[] starts;
    private final int[] ends;

    NormalizedText(String original, String text, int[] starts, int[] ends) {
        this.original = original;
        this.text = text;
        this.starts = starts;
        this.ends = ends;
    }

    /** Identity mapping, used when no stage is enabled. */
    static NormalizedText identity(String s) {
        int[] st = new int[s.length()];
        int[] en = new int[s.length()];
        for (int i = 0; i < st.length; i++) {
            st[i] = i;
            en[i] = i + 1;
        }
        return new NormalizedText(s, s, st, en);
    }

    public String original() {
        return original;
    }

    public String text() {
        return text;
    }

    public int length() {
        return text.length();
    }

    public boolean isEmpty() {
        return text.isEmpty();
    }

    /**
     * Maps the normalized range {@code [start,end)} back to the original text.
     *
     * @return {@code {originalStart, originalEnd}}
     */
    public int[] toOriginal(int start, int end) {
        if (start < 0 || end > text.length() || start >= end) {
            throw new IndexOutOfBoundsException("Bad normalized range [" + start + "," + end + ") for length "
                    + text.length());
        }
        int s = starts[start];
        int e = ends[end - 1];
        // stages never reorder, but a multi-char fold may share one source span
        for (int i = start; i < end; i++) {
            s = Math.min(s, starts[i]);
            e = Math.max(e, ends[i]);
        }
        return new int[] {s, e};
    }

    int startAt(int i) {
        return starts[i];
    }

    int endAt(int i) {
        return ends[i];
    }

    @Override
    public String toString() {
        return text;
    }
}
