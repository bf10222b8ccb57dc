/*
 * Copyright (c) 2025 Wordguard4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.wordguard4j.core.reconcile;

import io.wordguard4j.core.api.model.WhitelistEntry;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/** Immutable snapshot of whitelist entries, queried once per surviving match. */
public final class Whitelist {
    private static final Whitelist EMPTY = new Whitelist(List.of());

    private final List<WhitelistEntry> entries;

    private Whitelist(List<WhitelistEntry> entries) {
        this.entries = entries;
    }

    public static Whitelist of(Collection<WhitelistEntry> entries) {
        return entries.isEmpty() ? EMPTY : new Whitelist(List.copyOf(entries));
    }

    public static Whitelist empty() {
        return EMPTY;
    }

    /**
     * True when a match on {@code word} must be suppressed. Case-sensitive entries compare exactly;
     * entries with {@code wholeWord == false} also cover words that contain them.
     */
    public boolean suppresses(String word) {
        if (word == null) return false;
        String lower = word.toLowerCase(Locale.ROOT);
        for (WhitelistEntry e : entries) {
            String w = e.caseSensitive() ? word : lower;
            String entry = e.caseSensitive() ? e.word() : e.word().toLowerCase(Locale.ROOT);
            if (w.equals(entry)) return true;
            if (!e.wholeWord() && w.contains(entry)) return true;
        }
        return false;
    }

    public List<WhitelistEntry> entries() {
        return entries;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
