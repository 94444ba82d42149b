package com.darkyen.libgdx.paragraph.hyphenation;

import com.badlogic.gdx.utils.Array;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 *
 */
public class LanguageRegistryTests {

    @Test
    public void primaryTags() {
        assertEquals("en", LanguageRegistry.primaryTagOf("en"));
        assertEquals("en", LanguageRegistry.primaryTagOf("en-US"));
        assertEquals("en", LanguageRegistry.primaryTagOf("EN_gb"));
        assertEquals("de", LanguageRegistry.primaryTagOf("de-CH-1996"));
        assertEquals("", LanguageRegistry.primaryTagOf(""));
        assertEquals("", LanguageRegistry.primaryTagOf("-US"));
        assertEquals("", LanguageRegistry.primaryTagOf(null));
    }

    @Test
    public void lookup() {
        for (String tag : new String[]{"en", "fr", "de", "ru"}) {
            assertNotNull(LanguageRegistry.lookup(tag), tag);
        }
        assertNull(LanguageRegistry.lookup("xx"));
        assertNull(LanguageRegistry.lookup(""));
        assertNull(LanguageRegistry.lookup(null));
        // Only normalized tags are accepted
        assertNull(LanguageRegistry.lookup("en-US"));
    }

    @Test
    public void hyphenatorsAreLoadedOnce() {
        assertSame(LanguageRegistry.lookup("fr"), LanguageRegistry.lookup("fr"));
        final LanguageEntry entry = LanguageRegistry.findEntry("fr");
        assertSame(entry.getHyphenator(), LanguageRegistry.lookup("fr"));
    }

    @Test
    public void entries() {
        final Array<LanguageEntry> entries = LanguageRegistry.getEntries();
        assertEquals(4, entries.size);
        assertEquals("english", entries.first().displayName);
        assertEquals("hyph-en.pat", entries.first().getPatternResource());

        entries.clear();
        assertEquals(4, LanguageRegistry.getEntries().size);
    }

    @Test
    public void bundledPatternsAreNotEmpty() {
        for (LanguageEntry entry : LanguageRegistry.getEntries()) {
            final PatternTrie patterns = entry.getHyphenator().getPatterns();
            assertTrue(patterns.getPatternCount() > 0, entry.toString());
        }
    }
}
