package com.darkyen.libgdx.paragraph.hyphenation;

import com.badlogic.gdx.Gdx;

import java.util.function.IntPredicate;
import java.util.function.IntUnaryOperator;

/**
 * Supported language of the {@link LanguageRegistry}.
 * Its patterns are loaded from the classpath on first use of {@link #getHyphenator()}.
 */
public final class LanguageEntry {

    private static final String TAG = "LanguageRegistry";

    /** Human readable name, also used by tooling to select the language. */
    public final String displayName;
    /** Lowercase primary BCP-47 subtag, e.g. "en". */
    public final String primaryTag;

    private final IntPredicate alphabetic;
    private final IntUnaryOperator toLowerCase;
    private final int minPrefix, minSuffix;

    private LanguageHyphenator hyphenator;

    LanguageEntry(String displayName, String primaryTag, IntPredicate alphabetic, IntUnaryOperator toLowerCase, int minPrefix, int minSuffix) {
        this.displayName = displayName;
        this.primaryTag = primaryTag;
        this.alphabetic = alphabetic;
        this.toLowerCase = toLowerCase;
        this.minPrefix = minPrefix;
        this.minSuffix = minSuffix;
    }

    /** Classpath resource with the patterns, relative to this class. */
    public String getPatternResource() {
        return "hyph-" + primaryTag + ".pat";
    }

    /**
     * @return hyphenator of this language, never null
     * @throws com.badlogic.gdx.utils.GdxRuntimeException when the bundled patterns can't be loaded
     */
    public synchronized LanguageHyphenator getHyphenator() {
        LanguageHyphenator hyphenator = this.hyphenator;
        if (hyphenator == null) {
            final String resource = getPatternResource();
            final PatternTrie patterns = PatternTrie.load(LanguageEntry.class.getResourceAsStream(resource), resource);
            if (Gdx.app != null) {
                Gdx.app.debug(TAG, "Loaded " + patterns.getPatternCount() + " patterns and "
                        + patterns.getExceptionCount() + " exceptions for " + displayName);
            }
            hyphenator = this.hyphenator = new LanguageHyphenator(patterns, alphabetic, toLowerCase, minPrefix, minSuffix);
        }
        return hyphenator;
    }

    @Override
    public String toString() {
        return displayName + " (" + primaryTag + ")";
    }
}
