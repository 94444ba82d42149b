package com.darkyen.libgdx.paragraph.hyphenation;

import com.badlogic.gdx.utils.IntArray;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 *
 */
public class LanguageHyphenatorTests {

    private static LanguageHyphenator english() {
        final LanguageHyphenator hyphenator = LanguageRegistry.lookup("en");
        assertNotNull(hyphenator);
        return hyphenator;
    }

    private static IntArray breaks(LanguageHyphenator hyphenator, String word) {
        return hyphenator.breakIndexes(Codepoints.decode(word));
    }

    @Test
    public void englishRespectsMinimalLengths() {
        final LanguageHyphenator en = english();
        assertEquals(3, en.minPrefix());
        assertEquals(3, en.minSuffix());

        assertEquals(IntArray.with(6), breaks(en, "hyphenation"));
        assertEquals(IntArray.with(3), breaks(en, "computer"));
        assertEquals(IntArray.with(5, 7), breaks(en, "development"));
        assertEquals(IntArray.with(4), breaks(en, "algorithm"));
    }

    @Test
    public void shorterPrefixAllowsMoreBreaks() {
        final LanguageHyphenator en = english();
        final LanguageHyphenator relaxed = new LanguageHyphenator(en.getPatterns(),
                Codepoints::isLatinLetter, Codepoints::toLowerCase, 2, 3);
        assertEquals(IntArray.with(2, 6), breaks(relaxed, "hyphenation"));

        final LanguageHyphenator loose = new LanguageHyphenator(en.getPatterns(),
                Codepoints::isLatinLetter, Codepoints::toLowerCase, 2, 2);
        assertEquals(IntArray.with(3, 6), breaks(loose, "computer"));
    }

    @Test
    public void uppercaseIsFolded() {
        assertEquals(IntArray.with(6), breaks(english(), "Hyphenation"));
        assertEquals(IntArray.with(6), breaks(english(), "HYPHENATION"));
    }

    @Test
    public void noBreaksInShortOrForeignWords() {
        final LanguageHyphenator en = english();
        assertEquals(0, breaks(en, "cat").size);
        assertEquals(0, breaks(en, "").size);
        assertEquals(0, breaks(en, "hyph3nation").size);
        assertEquals(0, breaks(en, "\u043C\u043E\u043B\u043E\u043A\u043E").size);
    }

    @Test
    public void exceptionsOverridePatterns() {
        final LanguageHyphenator en = english();
        // "ta-ble" is an exception, but its only break is filtered by the minimal prefix
        assertEquals(0, breaks(en, "table").size);

        final LanguageHyphenator loose = new LanguageHyphenator(en.getPatterns(),
                Codepoints::isLatinLetter, Codepoints::toLowerCase, 2, 2);
        assertEquals(IntArray.with(2), breaks(loose, "table"));
        assertEquals(IntArray.with(2), breaks(loose, "Table"));
    }

    @Test
    public void customPatterns() {
        final PatternTrie patterns = new PatternTrie();
        patterns.addPattern("a1b");
        final LanguageHyphenator hyphenator = new LanguageHyphenator(patterns, Codepoints::isLatinLetter, Codepoints::toLowerCase);
        assertEquals(LanguageHyphenator.DEFAULT_MIN_PREFIX, hyphenator.minPrefix());
        assertEquals(IntArray.with(4), breaks(hyphenator, "xaxabab"));
        // Breaks after the first and before the last letter are too close to the edges
        assertEquals(IntArray.with(3), breaks(hyphenator, "ababab"));
    }

    @Test
    public void invalidArguments() {
        final PatternTrie patterns = new PatternTrie();
        assertThrows(NullPointerException.class,
                () -> new LanguageHyphenator(null, Codepoints::isLatinLetter, Codepoints::toLowerCase));
        assertThrows(IllegalArgumentException.class,
                () -> new LanguageHyphenator(patterns, Codepoints::isLatinLetter, Codepoints::toLowerCase, 0, 2));
    }

    @Test
    public void otherLanguages() {
        final LanguageHyphenator fr = LanguageRegistry.lookup("fr");
        assertEquals(IntArray.with(3), breaks(fr, "maison"));
        assertEquals(IntArray.with(2, 4), breaks(fr, "r\u00E9publique"));
        // Mute final syllable is not split off
        assertEquals(IntArray.with(2), breaks(fr, "famille"));

        final LanguageHyphenator de = LanguageRegistry.lookup("de");
        assertEquals(IntArray.with(3), breaks(de, "Kinder"));
        assertEquals(IntArray.with(4), breaks(de, "Fenster"));
        // ck and sch stay together
        assertEquals(IntArray.with(2), breaks(de, "Zucker"));
        assertEquals(IntArray.with(2, 8), breaks(de, "Geschichte"));
        assertEquals(IntArray.with(4), breaks(de, "Stra\u00DFe"));

        final LanguageHyphenator ru = LanguageRegistry.lookup("ru");
        assertEquals(IntArray.with(2, 4), breaks(ru, "\u043C\u043E\u043B\u043E\u043A\u043E"));
        assertEquals(IntArray.with(2, 4), breaks(ru, "\u0441\u043E\u0431\u0430\u043A\u0430"));
        // Soft sign stays with the preceding consonant
        assertEquals(IntArray.with(4), breaks(ru, "\u043F\u0438\u0441\u044C\u043C\u043E"));
        assertEquals(0, breaks(ru, "milk").size);
    }
}
