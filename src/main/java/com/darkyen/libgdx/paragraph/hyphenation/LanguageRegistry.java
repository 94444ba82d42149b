package com.darkyen.libgdx.paragraph.hyphenation;

import com.badlogic.gdx.utils.Array;

/**
 * Fixed table of languages with hyphenation support.
 */
public final class LanguageRegistry {

    private static final LanguageEntry[] ENTRIES = {
            new LanguageEntry("english", "en", Codepoints::isLatinLetter, Codepoints::toLowerCase, 3, 3),
            new LanguageEntry("french", "fr", Codepoints::isLatinLetter, Codepoints::toLowerCase,
                    LanguageHyphenator.DEFAULT_MIN_PREFIX, LanguageHyphenator.DEFAULT_MIN_SUFFIX),
            new LanguageEntry("german", "de", Codepoints::isLatinLetter, Codepoints::toLowerCase,
                    LanguageHyphenator.DEFAULT_MIN_PREFIX, LanguageHyphenator.DEFAULT_MIN_SUFFIX),
            new LanguageEntry("russian", "ru", Codepoints::isCyrillicLetter, Codepoints::toLowerCase,
                    LanguageHyphenator.DEFAULT_MIN_PREFIX, LanguageHyphenator.DEFAULT_MIN_SUFFIX),
    };

    private LanguageRegistry() {
    }

    /**
     * @param primaryTag lowercase primary subtag, e.g. "en"
     * @return entry, or null if the language is not supported
     */
    public static LanguageEntry findEntry(String primaryTag) {
        if (primaryTag == null) return null;
        for (LanguageEntry entry : ENTRIES) {
            if (entry.primaryTag.equals(primaryTag)) {
                return entry;
            }
        }
        return null;
    }

    /**
     * @param primaryTag lowercase primary subtag, e.g. "en"
     * @return hyphenator of the language, or null if the language is not supported
     */
    public static LanguageHyphenator lookup(String primaryTag) {
        final LanguageEntry entry = findEntry(primaryTag);
        return entry == null ? null : entry.getHyphenator();
    }

    /**
     * Normalize a BCP-47 language tag into its lowercase primary subtag.
     * "en-US" and "EN_us" both become "en".
     * @param languageTag may be null
     * @return primary subtag, empty if there is none
     */
    public static String primaryTagOf(String languageTag) {
        if (languageTag == null) return "";
        final StringBuilder primary = new StringBuilder(languageTag.length());
        for (int i = 0; i < languageTag.length(); i++) {
            char c = languageTag.charAt(i);
            if (c == '-' || c == '_') break;
            if (c >= 'A' && c <= 'Z') c = (char) (c - 'A' + 'a');
            primary.append(c);
        }
        return primary.toString();
    }

    /** @return all supported languages, modifications of the returned array do not affect the registry */
    public static Array<LanguageEntry> getEntries() {
        return new Array<>(ENTRIES);
    }
}
