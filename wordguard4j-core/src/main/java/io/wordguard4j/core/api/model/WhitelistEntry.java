/*
 * Copyright (c) 2025 Wordguard4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.wordguard4j.core.api.model;

import java.util.Objects;

/**
 * A word that must never be reported.
 *
 * @param caseSensitive compare exactly instead of ignoring case
 * @param wholeWord when false the entry also suppresses matches whose word contains it
 */
public record WhitelistEntry(String word, boolean caseSensitive, boolean wholeWord) {

    public WhitelistEntry {
        Objects.requireNonNull(word, "word");
    }

    public static WhitelistEntry of(String word) {
        return new WhitelistEntry(word, false, true);
    }
}
