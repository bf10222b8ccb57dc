/*
 * Copyright (c) 2025 Wordguard4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.wordguard4j.core.normalize;

/**
 * Normalization stages in the order they run. The order decides which evasions are caught
 * (invisible characters must go before anything that looks at lengths or neighbours), so
 * {@link Normalizer} always applies enabled stages in declaration order.
 */
public enum NormalizationStage {
    INVISIBLE,
    BIDI_AND_ELONGATION,
    SCRIPT_VARIANTS,
    DIACRITICS,
    CONFUSABLES,
    PHONETIC, // mixed-script input only
    SYMBOLS,
    SEPARATORS,
    REPEATS,
    CASE_AND_WHITESPACE
}
