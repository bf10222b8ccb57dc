/*
 * Copyright (c) 2025 Wordguard4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.wordguard4j.core.preset;

import java.util.*;

/**
 * Character substitution tables used by the normalizer. Built once, immutable, and handed to
 * {@link io.wordguard4j.core.normalize.Normalizer} instead of being read from global state.
 *
 * @param zeroWidth invisible code units removed by the first stage
 * @param bidiMarks directional marks and elongation characters
 * @param scriptVariants many-to-one folding of alternative letterforms (Arabic alef/yeh/teh marbuta...)
 * @param confusables look-alike glyphs that NFKC does not fold (Cyrillic, Greek, stroked Latin)
 * @param phonetic cross-script phonetic equivalents, used only on mixed-script text
 * @param leet symbols and digits standing in for letters
 * @param decorative symbols dropped when wedged between letters
 * @param separators characters used as artificial word spacing
 */
public record FoldTables(
        Set<Character> zeroWidth,
        Set<Character> bidiMarks,
        Map<Character, String> scriptVariants,
        Map<Character, String> confusables,
        Map<Character, String> phonetic,
        Map<Character, Character> leet,
        Set<Character> decorative,
        Set<Character> separators) {

    private static final FoldTables DEFAULTS = createDefaults();

    public FoldTables {
        zeroWidth = Set.copyOf(zeroWidth);
        bidiMarks = Set.copyOf(bidiMarks);
        scriptVariants = Map.copyOf(scriptVariants);
        confusables = Map.copyOf(confusables);
        phonetic = Map.copyOf(phonetic);
        leet = Map.copyOf(leet);
        decorative = Set.copyOf(decorative);
        separators = Set.copyOf(separators);
    }

    public static FoldTables defaults() {
        return DEFAULTS;
    }

    public boolean isSeparator(char c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c) || separators.contains(c);
    }

    private static FoldTables createDefaults() {
        Set<Character> zeroWidth = Set.of('\u200B', '\u200C', '\u200D', '\u2060', '\uFEFF', '\u00AD', '\u180E');

        Set<Character> bidi = Set.of(
                '\u200E', '\u200F', '\u061C', '\u202A', '\u202B', '\u202C', '\u202D', '\u202E', '\u2066',
                '\u2067', '\u2068', '\u2069', '\u0640' /* tatweel */);

        Map<Character, String> variants = new HashMap<>();
        // alef with hamza above/below, madda, wasla -> bare alef
        for (char c : new char[] {'آ', 'أ', 'إ', 'ٱ'}) variants.put(c, "ا");
        variants.put('ة', "ه"); // teh marbuta -> heh
        variants.put('ى', "ي"); // alef maksura -> yeh
        variants.put('ئ', "ي"); // yeh with hamza -> yeh
        variants.put('ی', "ي"); // farsi yeh -> yeh
        variants.put('ؤ', "و"); // waw with hamza -> waw
        variants.put('ک', "ك"); // keheh -> kaf
        variants.put('ہ', "ه"); // heh goal -> heh

        Map<Character, String> conf = new HashMap<>();
        putPairs(conf, "а", "a", "в", "b", "е", "e", "ё", "e", "к", "k", "м", "m", "н", "h", "о", "o", "р", "p");
        putPairs(conf, "с", "c", "т", "t", "у", "y", "х", "x", "і", "i", "ј", "j", "ѕ", "s", "ԁ", "d", "ԛ", "q");
        putPairs(conf, "ԝ", "w", "ү", "y", "һ", "h", "я", "r", "ь", "b");
        putPairs(conf, "А", "A", "В", "B", "Е", "E", "К", "K", "М", "M", "Н", "H", "О", "O", "Р", "P", "С", "C");
        putPairs(conf, "Т", "T", "Х", "X", "І", "I", "Ј", "J", "Ѕ", "S");
        putPairs(conf, "α", "a", "β", "b", "ε", "e", "ι", "i", "κ", "k", "ν", "v", "ο", "o", "ρ", "p", "τ", "t");
        putPairs(conf, "υ", "u", "χ", "x", "ω", "w", "Α", "A", "Β", "B", "Ε", "E", "Ζ", "Z", "Η", "H", "Ι", "I");
        putPairs(conf, "Κ", "K", "Μ", "M", "Ν", "N", "Ο", "O", "Ρ", "P", "Τ", "T", "Υ", "Y", "Χ", "X");
        // stroked / special Latin letters NFD leaves alone
        putPairs(conf, "ł", "l", "Ł", "L", "đ", "d", "Đ", "D", "ħ", "h", "ı", "i", "ø", "o", "Ø", "O", "þ", "p");
        putPairs(conf, "ƒ", "f", "ß", "b", "×", "x", "†", "t");

        Map<Character, String> phon = new HashMap<>();
        putPairs(phon, "ا", "a", "ب", "b", "ت", "t", "ث", "th", "ج", "j", "ح", "h", "خ", "kh", "د", "d");
        putPairs(phon, "ذ", "th", "ر", "r", "ز", "z", "س", "s", "ش", "sh", "ص", "s", "ض", "d", "ط", "t");
        putPairs(phon, "ظ", "z", "ع", "a", "غ", "gh", "ف", "f", "ق", "q", "ك", "k", "ل", "l", "م", "m");
        putPairs(phon, "ن", "n", "ه", "h", "و", "w", "ي", "y");

        Map<Character, Character> leet = new HashMap<>();
        leet.put('@', 'a');
        leet.put('4', 'a');
        leet.put('$', 's');
        leet.put('5', 's');
        leet.put('0', 'o');
        leet.put('1', 'i');
        leet.put('!', 'i');
        leet.put('3', 'e');
        leet.put('€', 'e');
        leet.put('7', 't');
        leet.put('8', 'b');
        leet.put('9', 'g');

        return new FoldTables(
                zeroWidth, bidi, variants, conf, phon, leet, Set.of('*', '~', '^'), Set.of('.', '-', '_', '|', '/'));
    }

    private static void putPairs(Map<Character, String> target, String... pairs) {
        for (int i = 0; i < pairs.length; i += 2) {
            target.put(pairs[i].charAt(0), pairs[i + 1]);
        }
    }
}
