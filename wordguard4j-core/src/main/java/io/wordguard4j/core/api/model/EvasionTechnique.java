/*
 * Copyright (c) 2025 Wordguard4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.wordguard4j.core.api.model;

/** Best-effort labels for the obfuscation tricks seen in a piece of text. */
public enum EvasionTechnique {
    SYMBOL_REPLACEMENT, // f@ck, $hit
    SPACE_INSERTION, // f u c k, f.u.c.k
    REPEATED_LETTERS, // fuuuuck
    LEET_SPEAK, // 5h1t
    LANGUAGE_MIXING, // Latin and Arabic letters in one text
    CHARACTER_SUBSTITUTION // look-alike letters from the substitution table
}
