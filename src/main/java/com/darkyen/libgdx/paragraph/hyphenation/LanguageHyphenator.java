package com.darkyen.libgdx.paragraph.hyphenation;

import com.badlogic.gdx.utils.IntArray;

import java.util.function.IntPredicate;
import java.util.function.IntUnaryOperator;

/**
 * Finds hyphenation points of words in one language, using Liang's pattern algorithm.
 *
 * Immutable, may be shared.
 */
public final class LanguageHyphenator {

    public static final int DEFAULT_MIN_PREFIX = 2;
    public static final int DEFAULT_MIN_SUFFIX = 2;

    private final PatternTrie patterns;
    private final IntPredicate alphabetic;
    private final IntUnaryOperator toLowerCase;
    private final int minPrefix, minSuffix;

    public LanguageHyphenator(PatternTrie patterns, IntPredicate alphabetic, IntUnaryOperator toLowerCase) {
        this(patterns, alphabetic, toLowerCase, DEFAULT_MIN_PREFIX, DEFAULT_MIN_SUFFIX);
    }

    /**
     * @param patterns not null
     * @param alphabetic codepoints of the language, a word with any other codepoint is never hyphenated
     * @param toLowerCase fold applied before pattern matching
     * @param minPrefix minimal amount of codepoints before a break, at least 1
     * @param minSuffix minimal amount of codepoints after a break, at least 1
     */
    public LanguageHyphenator(PatternTrie patterns, IntPredicate alphabetic, IntUnaryOperator toLowerCase, int minPrefix, int minSuffix) {
        if (patterns == null) throw new NullPointerException("patterns");
        if (alphabetic == null) throw new NullPointerException("alphabetic");
        if (toLowerCase == null) throw new NullPointerException("toLowerCase");
        if (minPrefix < 1) throw new IllegalArgumentException("minPrefix = " + minPrefix + ", must be >= 1");
        if (minSuffix < 1) throw new IllegalArgumentException("minSuffix = " + minSuffix + ", must be >= 1");
        this.patterns = patterns;
        this.alphabetic = alphabetic;
        this.toLowerCase = toLowerCase;
        this.minPrefix = minPrefix;
        this.minSuffix = minSuffix;
    }

    /**
     * Find the legal breaks of a word.
     * @param codepoints of the word, already trimmed of surrounding punctuation
     * @return ascending codepoint indices m, where the word may be split into [0, m) and [m, size),
     * such that the prefix has at least {@link #minPrefix()} and the suffix at least {@link #minSuffix()} codepoints
     */
    public IntArray breakIndexes(CodepointSequence codepoints) {
        final IntArray result = new IntArray();
        final int length = codepoints.size();
        if (length < minPrefix + minSuffix) {
            return result;
        }

        // .word.
        final int[] word = new int[length + 2];
        word[0] = PatternTrie.WORD_BOUNDARY;
        word[length + 1] = PatternTrie.WORD_BOUNDARY;
        for (int i = 0; i < length; i++) {
            final int cp = codepoints.valueAt(i);
            if (!alphabetic.test(cp)) {
                return result;
            }
            word[i + 1] = toLowerCase.applyAsInt(cp);
        }

        final IntArray exception = patterns.getException(new String(word, 1, length));
        if (exception != null) {
            for (int i = 0; i < exception.size; i++) {
                final int index = exception.items[i];
                if (index >= minPrefix && index <= length - minSuffix) {
                    result.add(index);
                }
            }
            return result;
        }

        final byte[] gapWeights = new byte[word.length + 1];
        patterns.matchPatterns(word, word.length, gapWeights);

        // Gap before letter m of the word is before word[m + 1]
        for (int m = minPrefix; m <= length - minSuffix; m++) {
            if ((gapWeights[m + 1] & 1) == 1) {
                result.add(m);
            }
        }
        return result;
    }

    public int minPrefix() {
        return minPrefix;
    }

    public int minSuffix() {
        return minSuffix;
    }

    public PatternTrie getPatterns() {
        return patterns;
    }
}
