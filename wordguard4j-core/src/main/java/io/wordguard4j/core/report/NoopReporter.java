/*
 * Copyright (c) 2025 Wordguard4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.wordguard4j.core.report;

import io.wordguard4j.core.api.model.Match;
import java.util.List;

public final class NoopReporter implements Reporter {
    public static final NoopReporter INSTANCE = new NoopReporter();

    @Override
    public void report(List<Match> matches) {
        /* no-op */
    }
}
