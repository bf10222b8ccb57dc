/*
 * Copyright (c) 2025 Wordguard4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.wordguard4j.core.automaton;

/** Characters that count as part of a word for whole-word boundary checks. */
public final class WordChars {
    private WordChars() {}

    public static boolean isWordChar(char c) {
        return (c >= 'a' && c <= 'z')
                || (c >= 'A' && c <= 'Z')
                || (c >= '0' && c <= '9')
                || c == '_'
                || (c >= '\u0600' && c <= '\u06FF')
                || (c >= '\u0750' && c <= '\u077F')
                || (c >= '\u08A0' && c <= '\u08FF');
    }

    /** True when {@code [start,end)} is not glued to word chars on either side. */
    public static boolean isBounded(CharSequence text, int start, int end) {
        boolean left = start == 0 || !isWordChar(text.charAt(start - 1));
        boolean right = end >= text.length() || !isWordChar(text.charAt(end));
        return left && right;
    }
}
