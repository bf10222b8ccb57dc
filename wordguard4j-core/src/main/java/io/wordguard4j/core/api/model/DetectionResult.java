/*
 * Copyright (c) 2025 Wordguard4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.wordguard4j.core.api.model;

import java.util.List;

public record DetectionResult(
        boolean hasMatch,
        List<Match> matches,
        String originalText,
        String cleanedText // null unless replacement was requested
        ) {}
