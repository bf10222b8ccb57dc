/*
 * Copyright (c) 2025 Wordguard4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.wordguard4j.spring;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.MeterRegistry;
import io.wordguard4j.core.api.model.Match;
import io.wordguard4j.core.report.Reporter;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/** Counts matches per category, severity and source, and keeps the most recent ones for the endpoint. */
public final class MicrometerReporter implements Reporter {
    public static final String METER_NAME = "wordguard4j_matches_total";

    private final MeterRegistry registry;
    private final Deque<Match> ring = new ArrayDeque<>();
    private final int capacity;

    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP2",
            justification = "MeterRegistry is a framework-managed, thread-safe component; "
                    + "keeping a reference is required for metrics reporting and it is not exposed via accessors.")
    public MicrometerReporter(MeterRegistry registry, int capacity) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.capacity = Math.max(10, capacity);
    }

    @Override
    public synchronized void report(List<Match> matches) {
        if (matches == null || matches.isEmpty()) return;
        for (Match m : matches) {
            registry.counter(
                            METER_NAME,
                            "category", m.category(),
                            "severity", m.severity().name().toLowerCase(Locale.ROOT),
                            "source", m.source().name().toLowerCase(Locale.ROOT))
                    .increment();
            if (ring.size() >= capacity) ring.removeFirst();
            ring.addLast(m);
        }
    }

    /** Returns an unmodifiable snapshot of the recent matches, oldest first. */
    public synchronized List<Match> recentMatches() {
        return List.copyOf(ring);
    }

    public int capacity() {
        return capacity;
    }
}
