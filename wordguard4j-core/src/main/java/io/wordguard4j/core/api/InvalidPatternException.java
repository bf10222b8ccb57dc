/*
 * Copyright (c) 2025 Wordguard4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.wordguard4j.core.api;

/** Thrown for a blank word, a severity outside 1..4 or an unsupported language tag. */
public class InvalidPatternException extends IllegalArgumentException {
    public InvalidPatternException(String message) {
        super(message);
    }
}
