package com.darkyen.libgdx.paragraph.hyphenation;

import com.badlogic.gdx.Gdx;
import com.badlogic.gdx.utils.Array;
import com.badlogic.gdx.utils.IntArray;

/**
 * Resolves where a word may be split when laying out a line.
 *
 * Holds the language used for pattern based breaks. Explicit hyphens in the text always win over patterns,
 * and patterns win over positional fallback breaks.
 *
 * Not thread safe, but different instances may be used concurrently with different languages.
 */
public class Hyphenator {

    private static final String TAG = "Hyphenator";

    private LanguageHyphenator languageHyphenator;

    public Hyphenator() {
    }

    /** @param languageHyphenator may be null for fallback-only mode */
    public Hyphenator(LanguageHyphenator languageHyphenator) {
        this.languageHyphenator = languageHyphenator;
    }

    /**
     * Select the language of pattern based breaks.
     * Empty or unsupported tags clear the language, so only explicit and fallback breaks are found.
     * @param languageTag BCP-47 tag, e.g. "en-US", may be null
     * @return true if a hyphenator for the language was found
     */
    public boolean setPreferredLanguage(String languageTag) {
        final String primaryTag = LanguageRegistry.primaryTagOf(languageTag);
        final LanguageHyphenator hyphenator = primaryTag.isEmpty() ? null : LanguageRegistry.lookup(primaryTag);
        if (hyphenator == null && Gdx.app != null) {
            Gdx.app.debug(TAG, "No hyphenation patterns for '" + languageTag + "', using fallback breaks only");
        }
        this.languageHyphenator = hyphenator;
        return hyphenator != null;
    }

    /** @param languageHyphenator may be null for fallback-only mode */
    public void setLanguageHyphenator(LanguageHyphenator languageHyphenator) {
        this.languageHyphenator = languageHyphenator;
    }

    /** @return currently used language hyphenator, null in fallback-only mode */
    public LanguageHyphenator getLanguageHyphenator() {
        return languageHyphenator;
    }

    /**
     * Find positions where the word may be split.
     * @param word not null
     * @param includeFallback when true and no explicit or pattern break exists,
     *                        return every position allowed by the minimal prefix and suffix length
     * @return ascending break points, never at offset 0 or word.length()
     */
    public Array<BreakPoint> breakOffsets(String word, boolean includeFallback) {
        final Array<BreakPoint> breaks = new Array<>(BreakPoint.class);
        if (word.isEmpty()) {
            return breaks;
        }

        final CodepointSequence cps = Codepoints.decode(word);
        Codepoints.trimSurroundingPunctuationAndFootnote(cps);
        final LanguageHyphenator hyphenator = this.languageHyphenator;

        addExplicitBreaks(cps, breaks, word.length());
        if (breaks.size > 0) {
            return breaks;
        }

        IntArray indexes = null;
        if (hyphenator != null) {
            indexes = hyphenator.breakIndexes(cps);
        }

        if (includeFallback && (indexes == null || indexes.size == 0)) {
            final int minPrefix = hyphenator != null ? hyphenator.minPrefix() : LanguageHyphenator.DEFAULT_MIN_PREFIX;
            final int minSuffix = hyphenator != null ? hyphenator.minSuffix() : LanguageHyphenator.DEFAULT_MIN_SUFFIX;
            indexes = new IntArray();
            for (int index = minPrefix; index + minSuffix <= cps.size(); index++) {
                indexes.add(index);
            }
        }

        if (indexes == null) {
            return breaks;
        }
        for (int i = 0; i < indexes.size; i++) {
            final int offset = cps.offsetForIndex(indexes.items[i]);
            if (offset > 0 && offset < word.length()) {
                breaks.add(new BreakPoint(offset, true));
            }
        }
        return breaks;
    }

    /** Explicit hyphens surrounded by letters. The break starts the remainder right after the marker. */
    private static void addExplicitBreaks(CodepointSequence cps, Array<BreakPoint> breaks, int wordLength) {
        for (int i = 1; i + 1 < cps.size(); i++) {
            final int cp = cps.valueAt(i);
            if (!Codepoints.isExplicitHyphen(cp)
                    || !Codepoints.isAlphabetic(cps.valueAt(i - 1))
                    || !Codepoints.isAlphabetic(cps.valueAt(i + 1))) {
                continue;
            }
            final int offset = cps.offsetAt(i + 1);
            if (offset > 0 && offset < wordLength) {
                breaks.add(new BreakPoint(offset, Codepoints.isSoftHyphen(cp)));
            }
        }
    }

    /**
     * Find pattern based breaks of the word with the current language, ignoring explicit hyphens and fallback.
     * @return codepoint indices into the word with surrounding punctuation removed, empty in fallback-only mode
     */
    public IntArray hyphenate(String word) {
        final LanguageHyphenator hyphenator = this.languageHyphenator;
        if (hyphenator == null) {
            return new IntArray();
        }
        return hyphenateWith(word, hyphenator);
    }

    /** @see #hyphenate(String) */
    public static IntArray hyphenateWith(String word, LanguageHyphenator hyphenator) {
        final CodepointSequence cps = Codepoints.decode(word);
        Codepoints.trimSurroundingPunctuationAndFootnote(cps);
        return hyphenator.breakIndexes(cps);
    }
}
