/*
 * Copyright (c) 2025 Wordguard4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.wordguard4j.core.reconcile;

import static org.junit.jupiter.api.Assertions.*;

import io.wordguard4j.core.api.model.Match;
import io.wordguard4j.core.api.model.MatchSource;
import io.wordguard4j.core.api.model.Severity;
import io.wordguard4j.core.api.model.WhitelistEntry;
import io.wordguard4j.core.preset.ContextSafeWords;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class MatchReconcilerTest {

    private final MatchReconciler plain = new MatchReconciler(Whitelist.empty(), ContextSafeWords.defaults());

    private static Match match(String word, int position, int length, MatchSource source) {
        return new Match(word, Severity.MODERATE, "custom", position, length, null, Set.of(), source);
    }

    @Test
    void fuzzyAndRecallOnlyAddUnseenWords() {
        List<Match> out = plain.reconcile(
                "damn it damn",
                List.of(match("damn", 0, 4, MatchSource.AUTOMATON), match("damn", 8, 4, MatchSource.AUTOMATON)),
                List.of(match("DAMN", 8, 4, MatchSource.FUZZY), match("it", 5, 2, MatchSource.FUZZY)),
                List.of(match("it", 5, 2, MatchSource.MAXIMUM_RECALL)),
                false);

        assertEquals(3, out.size());
        assertEquals(List.of(0, 5, 8), out.stream().map(Match::position).toList());
        assertEquals(MatchSource.FUZZY, out.get(1).source());
    }

    @Test
    void ordersByPositionThenLongerFirst() {
        List<Match> out = plain.reconcile(
                "assassin",
                List.of(match("ass", 3, 3, MatchSource.AUTOMATON), match("ass", 0, 3, MatchSource.AUTOMATON),
                        match("assassin", 0, 8, MatchSource.AUTOMATON)),
                List.of(),
                List.of(),
                false);

        assertEquals("assassin", out.get(0).word());
        assertEquals(0, out.get(1).position());
        assertEquals(3, out.get(2).position());
    }

    @Test
    void dropsWhitelistedWords() {
        MatchReconciler r = new MatchReconciler(
                Whitelist.of(List.of(WhitelistEntry.of("damn"))), ContextSafeWords.defaults());
        List<Match> out = r.reconcile(
                "damn hell",
                List.of(match("damn", 0, 4, MatchSource.AUTOMATON), match("hell", 5, 4, MatchSource.AUTOMATON)),
                List.of(),
                List.of(),
                false);

        assertEquals(1, out.size());
        assertEquals("hell", out.get(0).word());
    }

    @Test
    void contextAwareDropsOnlySafeOccurrences() {
        assertTrue(plain.isOnlyInSafeContext("a classic assessment", "ass"));
        assertTrue(plain.isOnlyInSafeContext("Hello there", "hell"));
        assertFalse(plain.isOnlyInSafeContext("you ass", "ass"));
        assertFalse(plain.isOnlyInSafeContext("class ass", "ass"));
        assertFalse(plain.isOnlyInSafeContext("badass", "ass"));
        assertFalse(plain.isOnlyInSafeContext("f@ck", "fuck"));

        List<Match> out = plain.reconcile(
                "class", List.of(match("ass", 2, 3, MatchSource.AUTOMATON)), List.of(), List.of(), true);
        assertTrue(out.isEmpty());
    }

    @Test
    void masksSpansWithReplacementChar() {
        assertEquals("X **** Y", MatchReconciler.mask("X damn Y", List.of(match("damn", 2, 4, MatchSource.AUTOMATON)), '*'));
        assertEquals(
                "########",
                MatchReconciler.mask(
                        "assassin",
                        List.of(match("ass", 0, 3, MatchSource.AUTOMATON), match("ass", 3, 3, MatchSource.AUTOMATON),
                                match("assassin", 0, 8, MatchSource.AUTOMATON)),
                        '#'));
        assertEquals("oh ******* off", MatchReconciler.mask("oh f.u.c.k off", List.of(match("fuck", 3, 7, MatchSource.AUTOMATON)), '*'));
        assertEquals("same", MatchReconciler.mask("same", List.of(), '*'));
    }
}
