/*
 * Copyright (c) 2025 Wordguard4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.wordguard4j.core.normalize;

import io.wordguard4j.core.preset.FilterOptions;
import io.wordguard4j.core.preset.FoldTables;
import java.util.*;

/**
 * Deterministic, stateless text canonicalization. Enabled {@link NormalizationStage}s always run in
 * declaration order; every output char remembers the original span it came from so matches found
 * in normalized text can be reported against the caller's text.
 *
 * <p>Instances are immutable and safe to share between threads.
 */
public final class Normalizer {

    private static final EnumSet<NormalizationStage> BASIC = EnumSet.of(
            NormalizationStage.SCRIPT_VARIANTS, NormalizationStage.DIACRITICS, NormalizationStage.CASE_AND_WHITESPACE);

    private final FoldTables tables;
    private final Set<NormalizationStage> stages;
    private final boolean tashkeelOnly;

    public Normalizer(FoldTables tables, Set<NormalizationStage> stages) {
        this(tables, stages, false);
    }

    private Normalizer(FoldTables tables, Set<NormalizationStage> stages, boolean tashkeelOnly) {
        this.tables = Objects.requireNonNull(tables, "tables");
        this.stages = stages.isEmpty()
                ? Set.of()
                : Collections.unmodifiableSet(EnumSet.copyOf(stages));
        this.tashkeelOnly = tashkeelOnly;
    }

    /** All ten stages with the default tables. */
    public static Normalizer full() {
        return new Normalizer(FoldTables.defaults(), EnumSet.allOf(NormalizationStage.class));
    }

    /**
     * Script variants, Arabic tashkeel and case/whitespace only: no evasion folding. Latin accents are
     * kept, so {@code "f\u00FCck"} does not become {@code "fuck"}.
     */
    public static Normalizer basic() {
        return new Normalizer(FoldTables.defaults(), BASIC, true);
    }

    /** Lowercase and whitespace collapsing only; used when normalization is switched off. */
    public static Normalizer caseOnly() {
        return new Normalizer(FoldTables.defaults(), EnumSet.of(NormalizationStage.CASE_AND_WHITESPACE));
    }

    /** All stages, with phonetic/symbol/separator/repeat folding following the technique toggles. */
    public static Normalizer standard(FilterOptions o) {
        return new Normalizer(FoldTables.defaults(), withToggles(EnumSet.allOf(NormalizationStage.class), o));
    }

    /** Evasion pipeline used by fuzzy matching: stages from script variants onward, toggled per technique. */
    public static Normalizer evasion(FilterOptions o) {
        EnumSet<NormalizationStage> s = EnumSet.range(NormalizationStage.SCRIPT_VARIANTS, NormalizationStage.CASE_AND_WHITESPACE);
        return new Normalizer(FoldTables.defaults(), withToggles(s, o));
    }

    /** Normalizer used for automaton keys and searched text under the given options. */
    public static Normalizer forOptions(FilterOptions o) {
        if (!o.normalize()) return caseOnly();
        return switch (o.strictness()) {
            case LOW -> basic();
            case MEDIUM, HIGH, PARANOID -> standard(o);
        };
    }

    private static EnumSet<NormalizationStage> withToggles(EnumSet<NormalizationStage> s, FilterOptions o) {
        if (!o.detectLanguageMixing()) s.remove(NormalizationStage.PHONETIC);
        if (!o.detectSymbolReplacement()) s.remove(NormalizationStage.SYMBOLS);
        if (!o.detectSpaceInsertion()) s.remove(NormalizationStage.SEPARATORS);
        if (!o.detectRepeatedLetters()) s.remove(NormalizationStage.REPEATS);
        return s;
    }

    public Set<NormalizationStage> stages() {
        return stages;
    }

    public String normalize(String text) {
        return normalizeTracked(text).text();
    }

    public NormalizedText normalizeTracked(String text) {
        if (text == null || text.isEmpty()) return NormalizedText.identity(text == null ? "" : text);
        Trail t = Trail.of(text);
        for (NormalizationStage stage : NormalizationStage.values()) {
            if (!stages.contains(stage)) continue;
            t = switch (stage) {
                case INVISIBLE -> stripInvisible(t);
                case BIDI_AND_ELONGATION -> stripBidi(t);
                case SCRIPT_VARIANTS -> foldScriptVariants(t);
                case DIACRITICS -> stripDiacritics(t);
                case CONFUSABLES -> foldConfusables(t);
                case PHONETIC -> foldPhonetic(t);
                case SYMBOLS -> foldSymbols(t);
                case SEPARATORS -> collapseSeparators(t);
                case REPEATS -> collapseRepeats(t);
                case CASE_AND_WHITESPACE -> lowercaseAndTrim(t);
            };
        }
        return t.toNormalized(text);
    }

    /**
     * Lossy maximum-recall variant: the configured pipeline, then everything that is not a letter or
     * digit is dropped and every run of identical chars becomes a single char. Not for display.
     */
    public String maximumRecall(String text) {
        return maximumRecallTracked(text).text();
    }

    public NormalizedText maximumRecallTracked(String text) {
        NormalizedText n = normalizeTracked(text);
        Trail in = Trail.of(n);
        Trail out = new Trail(in.size());
        for (int i = 0; i < in.size(); i++) {
            char c = in.charAt(i);
            if (Character.isHighSurrogate(c) && i + 1 < in.size() && Character.isLowSurrogate(in.charAt(i + 1))) {
                if (Character.isLetterOrDigit(Character.toCodePoint(c, in.charAt(i + 1)))) {
                    out.copy(in, i);
                    out.copy(in, i + 1);
                }
                i++;
                continue;
            }
            if (!Character.isLetterOrDigit(c)) continue;
            if (out.size() > 0 && out.charAt(out.size() - 1) == c) {
                out.widenLast(in.endAt(i));
                continue;
            }
            out.copy(in, i);
        }
        return out.toNormalized(text == null ? "" : text);
    }

    // ---------------- stages ----------------

    private Trail stripInvisible(Trail in) {
        Trail out = new Trail(in.size());
        for (int i = 0; i < in.size(); i++) {
            char c = in.charAt(i);
            if (tables.zeroWidth().contains(c)) continue;
            if (Character.getType(c) == Character.CONTROL && !Character.isWhitespace(c)) continue;
            out.copy(in, i);
        }
        return out;
    }

    private Trail stripBidi(Trail in) {
        Trail out = new Trail(in.size());
        for (int i = 0; i < in.size(); i++) {
            if (!tables.bidiMarks().contains(in.charAt(i))) out.copy(in, i);
        }
        return out;
    }

    private Trail foldScriptVariants(Trail in) {
        Trail out = new Trail(in.size());
        for (int i = 0; i < in.size(); i++) {
            char c = in.charAt(i);
            if (isArabicPresentationForm(c)) {
                String nfkc = java.text.Normalizer.normalize(String.valueOf(c), java.text.Normalizer.Form.NFKC);
                for (int k = 0; k < nfkc.length(); k++) {
                    char f = nfkc.charAt(k);
                    String v = tables.scriptVariants().get(f);
                    out.append(v != null ? v : String.valueOf(f), in.startAt(i), in.endAt(i));
                }
                continue;
            }
            String v = tables.scriptVariants().get(c);
            if (v != null) out.append(v, in.startAt(i), in.endAt(i));
            else out.copy(in, i);
        }
        return out;
    }

    private Trail stripDiacritics(Trail in) {
        Trail out = new Trail(in.size());
        for (int i = 0; i < in.size(); i++) {
            char c = in.charAt(i);
            if (tashkeelOnly) {
                if (!isTashkeel(c)) out.copy(in, i);
                continue;
            }
            if (isStrippableMark(c)) continue;
            if (c > 0x7F && Character.isLetter(c)) {
                String nfd = java.text.Normalizer.normalize(String.valueOf(c), java.text.Normalizer.Form.NFD);
                if (nfd.length() > 1) {
                    StringBuilder base = new StringBuilder(nfd.length());
                    for (int k = 0; k < nfd.length(); k++) {
                        if (!isStrippableMark(nfd.charAt(k))) base.append(nfd.charAt(k));
                    }
                    // only replace when a mark was actually removed (keeps Hangul syllables intact)
                    if (base.length() > 0 && base.length() < nfd.length()) {
                        out.append(base.toString(), in.startAt(i), in.endAt(i));
                        continue;
                    }
                }
            }
            out.copy(in, i);
        }
        return out;
    }

    private Trail foldConfusables(Trail in) {
        Trail out = new Trail(in.size());
        for (int i = 0; i < in.size(); i++) {
            char c = in.charAt(i);
            if (c <= 0x7F) {
                out.copy(in, i);
                continue;
            }
            int cp = c;
            int units = 1;
            if (Character.isHighSurrogate(c) && i + 1 < in.size() && Character.isLowSurrogate(in.charAt(i + 1))) {
                cp = Character.toCodePoint(c, in.charAt(i + 1));
                units = 2;
            }
            int start = in.startAt(i);
            int end = in.endAt(i + units - 1);
            String folded = foldConfusable(cp);
            if (folded != null) {
                out.append(folded, start, end);
            } else {
                for (int k = 0; k < units; k++) out.copy(in, i + k);
            }
            i += units - 1;
        }
        return out;
    }

    private String foldConfusable(int cp) {
        if (cp < Character.MIN_SUPPLEMENTARY_CODE_POINT) {
            char c = (char) cp;
            String v = tables.confusables().get(c);
            if (v == null) v = tables.confusables().get(Character.toLowerCase(c));
            if (v != null) return v;
        }
        // negative circled, negative squared and regional indicator letters have no NFKC mapping
        if (cp >= 0x1F150 && cp <= 0x1F169) return String.valueOf((char) ('a' + (cp - 0x1F150)));
        if (cp >= 0x1F170 && cp <= 0x1F189) return String.valueOf((char) ('a' + (cp - 0x1F170)));
        if (cp >= 0x1F1E6 && cp <= 0x1F1FF) return String.valueOf((char) ('a' + (cp - 0x1F1E6)));
        String raw = new String(Character.toChars(cp));
        String nfkc = java.text.Normalizer.normalize(raw, java.text.Normalizer.Form.NFKC);
        if (!nfkc.equals(raw) && isAsciiGraphic(nfkc)) return nfkc;
        return null;
    }

    private Trail foldPhonetic(Trail in) {
        if (!isMixedScript(in)) return in;
        Trail out = new Trail(in.size());
        for (int i = 0; i < in.size(); i++) {
            String v = tables.phonetic().get(in.charAt(i));
            if (v != null) out.append(v, in.startAt(i), in.endAt(i));
            else out.copy(in, i);
        }
        return out;
    }

    private Trail foldSymbols(Trail in) {
        Trail out = new Trail(in.size());
        int n = in.size();
        int i = 0;
        while (i < n) {
            if (Character.isWhitespace(in.charAt(i))) {
                out.copy(in, i++);
                continue;
            }
            int tokenEnd = i;
            boolean hasLetter = false;
            boolean latin = false;
            boolean otherScript = false;
            while (tokenEnd < n && !Character.isWhitespace(in.charAt(tokenEnd))) {
                char c = in.charAt(tokenEnd);
                hasLetter |= Character.isLetter(c);
                latin |= isAsciiLetter(c);
                otherScript |= isOtherScriptLetter(c);
                tokenEnd++;
            }
            if (!hasLetter) {
                for (int k = i; k < tokenEnd; k++) out.copy(in, k);
            } else {
                // leet chars glued to a non-Latin word stay as they are
                foldToken(in, i, tokenEnd, out, latin && !otherScript);
            }
            i = tokenEnd;
        }
        return out;
    }

    private void foldToken(Trail in, int from, int to, Trail out, boolean foldLeet) {
        for (int k = from; k < to; k++) {
            char c = in.charAt(k);
            if (!foldLeet && tables.leet().containsKey(c)) {
                out.copy(in, k);
            } else if (c == '!') {
                boolean between = k > from && k + 1 < to
                        && isLetterLike(in.charAt(k - 1)) && isLetterLike(in.charAt(k + 1));
                if (between) out.append(tables.leet().get('!'), in.startAt(k), in.endAt(k));
                else out.copy(in, k);
            } else if (tables.leet().containsKey(c)) {
                out.append(tables.leet().get(c), in.startAt(k), in.endAt(k));
            } else if (tables.decorative().contains(c)) {
                int runEnd = k;
                while (runEnd < to && tables.decorative().contains(in.charAt(runEnd))) runEnd++;
                boolean wedged = k > from && runEnd < to
                        && isLetterLike(in.charAt(k - 1)) && isLetterLike(in.charAt(runEnd));
                if (!wedged) {
                    for (int r = k; r < runEnd; r++) out.copy(in, r);
                }
                k = runEnd - 1;
            } else {
                out.copy(in, k);
            }
        }
    }

    private boolean isLetterLike(char c) {
        return Character.isLetter(c) || (c != '!' && tables.leet().containsKey(c));
    }

    private Trail collapseSeparators(Trail in) {
        Trail out = new Trail(in.size());
        int n = in.size();
        int i = 0;
        while (i < n) {
            if (!isIsolatedLetter(in, i)) {
                out.copy(in, i++);
                continue;
            }
            // collect a chain: letter (separators letter)*
            List<Integer> letters = new ArrayList<>();
            letters.add(i);
            int cursor = i + 1;
            while (true) {
                int sepEnd = cursor;
                while (sepEnd < n && tables.isSeparator(in.charAt(sepEnd))) sepEnd++;
                if (sepEnd == cursor || sepEnd >= n || !isIsolatedLetter(in, sepEnd)) break;
                letters.add(sepEnd);
                cursor = sepEnd + 1;
            }
            if (letters.size() >= 3) {
                for (int idx : letters) out.copy(in, idx);
                i = letters.get(letters.size() - 1) + 1;
            } else {
                out.copy(in, i++);
            }
        }
        return out;
    }

    private static boolean isIsolatedLetter(Trail t, int i) {
        if (!Character.isLetter(t.charAt(i))) return false;
        boolean leftFree = i == 0 || !Character.isLetterOrDigit(t.charAt(i - 1));
        boolean rightFree = i + 1 >= t.size() || !Character.isLetterOrDigit(t.charAt(i + 1));
        return leftFree && rightFree;
    }

    private static Trail collapseRepeats(Trail in) {
        Trail out = new Trail(in.size());
        int n = in.size();
        int i = 0;
        while (i < n) {
            char c = Character.toLowerCase(in.charAt(i));
            int runEnd = i + 1;
            while (runEnd < n && Character.toLowerCase(in.charAt(runEnd)) == c) runEnd++;
            int runLength = runEnd - i;
            if (runLength >= 3) {
                out.copy(in, i);
                out.copy(in, i + 1);
                // the kept pair absorbs the span of the dropped tail
                out.widenLast(in.endAt(runEnd - 1));
            } else {
                for (int k = i; k < runEnd; k++) out.copy(in, k);
            }
            i = runEnd;
        }
        return out;
    }

    private static Trail lowercaseAndTrim(Trail in) {
        Trail out = new Trail(in.size());
        boolean pendingSpace = false;
        int spaceStart = 0;
        int spaceEnd = 0;
        for (int i = 0; i < in.size(); i++) {
            char c = in.charAt(i);
            if (Character.isWhitespace(c) || Character.isSpaceChar(c)) {
                if (!pendingSpace) spaceStart = in.startAt(i);
                pendingSpace = true;
                spaceEnd = in.endAt(i);
                continue;
            }
            if (pendingSpace && out.size() > 0) out.append(" ", spaceStart, spaceEnd);
            pendingSpace = false;
            if (Character.isHighSurrogate(c) && i + 1 < in.size() && Character.isLowSurrogate(in.charAt(i + 1))) {
                int lower = Character.toLowerCase(Character.toCodePoint(c, in.charAt(i + 1)));
                out.append(new String(Character.toChars(lower)), in.startAt(i), in.endAt(i + 1));
                i++;
                continue;
            }
            out.append(String.valueOf(Character.toLowerCase(c)), in.startAt(i), in.endAt(i));
        }
        return out;
    }

    // ---------------- helpers ----------------

    private static boolean isStrippableMark(char c) {
        int type = Character.getType(c);
        return type == Character.NON_SPACING_MARK || type == Character.ENCLOSING_MARK;
    }

    private static boolean isTashkeel(char c) {
        return (c >= '\u064B' && c <= '\u065F') || c == '\u0670';
    }

    private static boolean isArabicPresentationForm(char c) {
        return (c >= '\uFB50' && c <= '\uFDFF') || (c >= '\uFE70' && c <= '\uFEFC');
    }

    private static boolean isAsciiGraphic(String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < 0x21 || c > 0x7E) return false;
        }
        return !s.isEmpty();
    }

    private static boolean isMixedScript(Trail t) {
        boolean latin = false;
        boolean other = false;
        for (int i = 0; i < t.size() && !(latin && other); i++) {
            char c = t.charAt(i);
            latin |= isAsciiLetter(c);
            other |= isOtherScriptLetter(c);
        }
        return latin && other;
    }

    private static boolean isAsciiLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isOtherScriptLetter(char c) {
        if (c <= 0x7F || !Character.isLetter(c)) return false;
        Character.UnicodeScript script = Character.UnicodeScript.of(c);
        return script != Character.UnicodeScript.LATIN
                && script != Character.UnicodeScript.COMMON
                && script != Character.UnicodeScript.INHERITED;
    }

    /** Growable char buffer where each char carries its original {@code [start,end)} span. */
    private static final class Trail {
        private final StringBuilder chars;
        private int[] starts;
        private int[] ends;

        Trail(int capacity) {
            int cap = Math.max(16, capacity);
            this.chars = new StringBuilder(cap);
            this.starts = new int[cap];
            this.ends = new int[cap];
        }

        static Trail of(String s) {
            Trail t = new Trail(s.length());
            for (int i = 0; i < s.length(); i++) t.append(s.charAt(i), i, i + 1);
            return t;
        }

        static Trail of(NormalizedText n) {
            Trail t = new Trail(n.length());
            for (int i = 0; i < n.length(); i++) t.append(n.text().charAt(i), n.startAt(i), n.endAt(i));
            return t;
        }

        int size() {
            return chars.length();
        }

        char charAt(int i) {
            return chars.charAt(i);
        }

        int startAt(int i) {
            return starts[i];
        }

        int endAt(int i) {
            return ends[i];
        }

        void copy(Trail from, int i) {
            append(from.charAt(i), from.startAt(i), from.endAt(i));
        }

        void append(String s, int start, int end) {
            for (int k = 0; k < s.length(); k++) append(s.charAt(k), start, end);
        }

        void append(char c, int start, int end) {
            int n = chars.length();
            if (n == starts.length) {
                starts = Arrays.copyOf(starts, n * 2);
                ends = Arrays.copyOf(ends, n * 2);
            }
            chars.append(c);
            starts[n] = start;
            ends[n] = end;
        }

        void widenLast(int end) {
            int last = chars.length() - 1;
            ends[last] = Math.max(ends[last], end);
        }

        NormalizedText toNormalized(String original) {
            int n = chars.length();
            return new NormalizedText(original, chars.toString(), Arrays.copyOf(starts, n), Arrays.copyOf(ends, n));
        }
    }
}
