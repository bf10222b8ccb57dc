/*
 * Copyright (c) 2025 Wordguard4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.wordguard4j.core.api.model;

import io.wordguard4j.core.api.InvalidPatternException;
import java.util.Locale;

/** Languages the bundled fold tables and word-boundary rules know about. */
public enum Language {
    EN("en"),
    AR("ar");

    private final String tag;

    Language(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    public static Language fromTag(String tag) {
        if (tag != null) {
            String t = tag.trim().toLowerCase(Locale.ROOT);
            for (Language l : values()) {
                if (l.tag.equals(t)) return l;
            }
        }
        throw new InvalidPatternException("Unsupported language tag: " + tag);
    }
}
