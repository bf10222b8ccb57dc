/*
 * Copyright (c) 2025 Wordguard4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.wordguard4j.core.report;

import io.wordguard4j.core.api.model.Match;
import java.util.List;

/**
 * Receives the final matches of every detection that found something. Called on the detecting
 * thread; implementations must be thread-safe and must not throw.
 */
public interface Reporter {
    void report(List<Match> matches);
}
