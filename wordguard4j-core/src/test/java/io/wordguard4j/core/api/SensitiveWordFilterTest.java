/*
 * Copyright (c) 2025 Wordguard4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.wordguard4j.core.api;

import static org.junit.jupiter.api.Assertions.*;

import io.wordguard4j.core.api.model.*;
import io.wordguard4j.core.preset.FilterOptions;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class SensitiveWordFilterTest {

    private static final List<SensitiveWord> WORDS = List.of(
            SensitiveWord.of("fuck", Severity.EXTREME, "profanity"),
            SensitiveWord.of("damn", Severity.MILD),
            SensitiveWord.of("ass", Severity.MODERATE, "insult"));

    private static SensitiveWordFilter filter(FilterOptions options) {
        return new SensitiveWordFilter(options, WORDS, List.of(), matches -> {});
    }

    private static SensitiveWordFilter filter() {
        return filter(FilterOptions.defaults());
    }

    @Test
    void findsWordSurroundedByWhitespace() {
        DetectionResult r = filter().detect("you are an ass");

        assertTrue(r.hasMatch());
        assertEquals(1, r.matches().size());
        Match m = r.matches().get(0);
        assertEquals("ass", m.word());
        assertEquals(11, m.position());
        assertEquals(3, m.length());
        assertEquals(Severity.MODERATE, m.severity());
        assertEquals("insult", m.category());
        assertEquals(MatchSource.AUTOMATON, m.source());
        assertNull(m.confidence());
    }

    @Test
    void noMatchIsAnEmptyResult() {
        DetectionResult r = filter().detect("what a lovely day");
        assertFalse(r.hasMatch());
        assertTrue(r.matches().isEmpty());
        assertEquals("what a lovely day", r.originalText());
        assertNull(r.cleanedText());

        assertFalse(filter().detect(null).hasMatch());
        assertFalse(filter().hasMatch(""));
    }

    @Test
    void wholeWordByDefault() {
        SensitiveWordFilter f = filter();
        assertFalse(f.hasMatch("assessment"));
        assertFalse(f.hasMatch("class"));
        assertTrue(f.hasMatch("ass"));
    }

    @Test
    void contextAwareSuppressesSafeWordsInPartialMode() {
        SensitiveWordFilter partial = filter(FilterOptions.builder().partialMatch(true).build());
        assertTrue(partial.hasMatch("assessment"));

        SensitiveWordFilter aware = filter(FilterOptions.builder().partialMatch(true).contextAware(true).build());
        assertFalse(aware.hasMatch("assessment"));
        assertFalse(aware.hasMatch("class"));
        assertTrue(aware.hasMatch("ass"));
        assertTrue(aware.hasMatch("what a class ass"));
    }

    @Test
    void spaceInsideAWordIsOnlySeenByParanoid() {
        FilterOptions.Builder fuzzy = FilterOptions.builder().enableFuzzyMatching(true);
        assertFalse(filter(fuzzy.strictness(Strictness.MEDIUM).build()).hasMatch("fu ck"));
        assertFalse(filter(fuzzy.strictness(Strictness.HIGH).build()).hasMatch("fu ck"));

        DetectionResult r = filter(fuzzy.strictness(Strictness.PARANOID).build()).detect("fu ck");
        assertTrue(r.matches().stream().anyMatch(m -> m.word().equals("fuck") && m.position() == 0));
    }

    @Test
    void arabicTextWithSymbolsIsNotReadAsLatin() {
        SensitiveWordFilter f = filter(FilterOptions.builder()
                .strictness(Strictness.PARANOID)
                .enableFuzzyMatching(true)
                .build());

        assertFalse(f.hasMatch("\u0645\u0631\u062D\u0628\u0627 @\u0633\u0633"));
        assertFalse(f.hasMatch("\u0645\u0631\u062D\u0628\u0627 @\u0627\u062D\u0645\u062F"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"f u c k", "f.u.c.k", "f@ck", "fuuuuck", "fu\u200Bck", "FUCK"})
    void paranoidCatchesEvasions(String text) {
        SensitiveWordFilter f = filter(FilterOptions.builder()
                .strictness(Strictness.PARANOID)
                .enableFuzzyMatching(true)
                .build());

        DetectionResult r = f.detect(text);
        assertTrue(r.hasMatch(), () -> "expected a match for '" + text + "'");
        assertTrue(r.matches().stream().anyMatch(m -> m.word().equals("fuck")));
    }

    @ParameterizedTest
    @ValueSource(strings = {"f u c k", "f.u.c.k", "f@ck", "fuuuuck", "fu\u200Bck", "f\u00FCck"})
    void lowMatchesOnlyExactWords(String text) {
        SensitiveWordFilter f = filter(FilterOptions.builder()
                .strictness(Strictness.LOW)
                .enableFuzzyMatching(true)
                .build());

        assertFalse(f.hasMatch(text), () -> "unexpected match for '" + text + "'");
        assertTrue(f.hasMatch("FUCK"));
        assertTrue(f.hasMatch("oh fuck"));
    }

    @Test
    void fuzzyMatchCarriesConfidenceAndTechniques() {
        SensitiveWordFilter f = filter(FilterOptions.builder()
                .strictness(Strictness.HIGH)
                .enableFuzzyMatching(true)
                .build());

        DetectionResult r = f.detect("what the f@ck");
        assertEquals(1, r.matches().size());
        Match m = r.matches().get(0);
        assertEquals(MatchSource.FUZZY, m.source());
        assertEquals(9, m.position());
        assertEquals(4, m.length());
        assertEquals(0.75, m.confidence(), 1e-9);
        assertTrue(m.evasionTechniques().contains(EvasionTechnique.SYMBOL_REPLACEMENT));
    }

    @Test
    void whitelistToggle() {
        SensitiveWordFilter f = filter();
        assertTrue(f.hasMatch("damn"));

        f.addToWhitelist("damn");
        assertFalse(f.hasMatch("damn"));
        assertTrue(f.isWhitelisted("DAMN"));

        assertTrue(f.removeFromWhitelist("DAMN"));
        assertTrue(f.hasMatch("damn"));
        assertTrue(f.getWhitelist().isEmpty());
    }

    @Test
    void cleanMasksOnlyTheMatch() {
        assertEquals("X **** Y", filter().clean("X damn Y"));
        assertEquals("nothing here", filter().clean("nothing here"));
    }

    @Test
    void cleanMasksOriginalSpanOfEvasion() {
        SensitiveWordFilter f = filter(FilterOptions.builder().strictness(Strictness.PARANOID).build());
        assertEquals("oh ******* off", f.clean("oh f.u.c.k off"));
    }

    @Test
    void replaceMatchesOptionFillsCleanedText() {
        SensitiveWordFilter f = filter(FilterOptions.builder().replaceMatches(true).replacementChar('#').build());
        DetectionResult r = f.detect("damn you ass");
        assertEquals("#### you ###", r.cleanedText());
        assertEquals(List.of(0, 9), r.matches().stream().map(Match::position).toList());
    }

    @Test
    void addWordsIsAllOrNothing() {
        SensitiveWordFilter f = filter();
        List<SensitiveWord> batch = Arrays.asList(SensitiveWord.of("heck", Severity.MILD), null);

        assertThrows(InvalidPatternException.class, () -> f.addWords(batch));
        assertEquals(3, f.getWords().size());
        assertFalse(f.hasMatch("heck"));

        f.addWords(List.of(SensitiveWord.of("heck", Severity.MILD)));
        assertTrue(f.hasMatch("heck"));
    }

    @Test
    void invalidWordsAreRejected() {
        assertThrows(InvalidPatternException.class, () -> SensitiveWord.of("  ", Severity.MILD));
        assertThrows(InvalidPatternException.class, () -> SensitiveWord.of("word", 5, "custom", "en"));
        assertThrows(InvalidPatternException.class, () -> SensitiveWord.of("word", 1, "custom", "fr"));
    }

    @Test
    void removeAndClearWords() {
        SensitiveWordFilter f = filter();
        assertTrue(f.removeWord("damn"));
        assertFalse(f.removeWord("damn"));
        assertFalse(f.hasMatch("damn"));

        f.clearWords();
        assertTrue(f.getWords().isEmpty());
        assertFalse(f.hasMatch("fuck"));
    }

    @Test
    void malformedImportChangesNothing() {
        SensitiveWordFilter f = filter();
        List<SensitiveWord> one = List.of(SensitiveWord.of("heck", Severity.MILD));

        assertThrows(MalformedImportException.class, () -> f.importWords(new WordList(null, one), true));
        assertThrows(MalformedImportException.class, () -> f.importWords(new WordList("1.0.0", null), true));
        assertThrows(
                MalformedImportException.class,
                () -> f.importWords(new WordList("1.0.0", Arrays.asList(SensitiveWord.of("x", Severity.MILD), null)), false));
        assertThrows(MalformedImportException.class, () -> f.importWords(null, false));
        assertEquals(WORDS, f.getWords());
    }

    @Test
    void importMergesAndReplaces() {
        SensitiveWordFilter f = filter();
        f.importWords(WordList.of(List.of(SensitiveWord.of("DAMN", Severity.SEVERE), SensitiveWord.of("hell", Severity.MILD))), false);
        assertEquals(4, f.getWords().size());
        assertTrue(f.hasMatch("hell"));

        f.importWords(WordList.of(List.of(SensitiveWord.of("hell", Severity.MILD))), true);
        assertEquals(1, f.getWords().size());
        assertFalse(f.hasMatch("damn"));

        WordList exported = f.exportWords();
        assertEquals(WordList.CURRENT_VERSION, exported.version());
        assertEquals("hell", exported.words().get(0).word());
    }

    @Test
    void optionChangeRebuildsIndex() {
        SensitiveWordFilter f = filter();
        assertFalse(f.hasMatch("assessment"));

        f.setOptions(f.getOptions().toBuilder().partialMatch(true).build());
        assertTrue(f.getOptions().partialMatch());
        assertTrue(f.hasMatch("assessment"));
    }

    @Test
    void severityAndCategoryFilters() {
        SensitiveWordFilter severe = filter(FilterOptions.builder().minSeverity(Severity.SEVERE).build());
        assertFalse(severe.hasMatch("damn"));
        assertTrue(severe.hasMatch("fuck"));

        SensitiveWordFilter insults = filter(FilterOptions.builder().categories(List.of("insult")).build());
        assertTrue(insults.hasMatch("ass"));
        assertFalse(insults.hasMatch("fuck"));
    }

    @Test
    void invalidOptionsFailAtBuild() {
        assertThrows(IllegalArgumentException.class, () -> FilterOptions.builder().maxEditDistance(-1).build());
        assertThrows(
                IllegalArgumentException.class,
                () -> FilterOptions.builder().minSeverity(Severity.EXTREME).maxSeverity(Severity.MILD).build());
        assertThrows(IllegalArgumentException.class, () -> FilterOptions.builder().languages(List.of()).build());
    }

    @Test
    void reporterReceivesFinalMatches() {
        List<Match> reported = new CopyOnWriteArrayList<>();
        SensitiveWordFilter f = new SensitiveWordFilter(
                FilterOptions.defaults(), WORDS, List.of(WhitelistEntry.of("ass")), reported::addAll);

        f.detect("damn ass");
        f.detect("all clear");

        assertEquals(1, reported.size());
        assertEquals("damn", reported.get(0).word());
    }

    @Test
    void concurrentReadersSeeConsistentResults() throws InterruptedException {
        SensitiveWordFilter f = filter();
        List<Thread> threads = new ArrayList<>();
        List<Throwable> failures = new CopyOnWriteArrayList<>();
        for (int t = 0; t < 4; t++) {
            Thread th = new Thread(() -> {
                try {
                    for (int i = 0; i < 200; i++) {
                        if (!f.hasMatch("oh damn")) throw new AssertionError("lost match");
                    }
                } catch (Throwable e) {
                    failures.add(e);
                }
            });
            threads.add(th);
            th.start();
        }
        for (int i = 0; i < 20; i++) f.addWord(SensitiveWord.of("extra" + i, Severity.MILD));
        for (Thread th : threads) th.join();
        assertTrue(failures.isEmpty(), failures::toString);
    }
}
