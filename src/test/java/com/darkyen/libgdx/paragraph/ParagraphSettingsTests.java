package com.darkyen.libgdx.paragraph;

import com.badlogic.gdx.utils.Align;
import com.badlogic.gdx.utils.GdxRuntimeException;
import com.darkyen.libgdx.paragraph.hyphenation.Hyphenator;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 *
 */
public class ParagraphSettingsTests {

    @Test
    public void defaults() {
        final ParagraphSettings settings = new ParagraphSettings();
        assertEquals(TextAlignment.JUSTIFIED, settings.getAlignment());
        assertFalse(settings.isHyphenationEnabled());
        assertTrue(settings.isExtraParagraphSpacing());
        assertEquals(0, settings.getViewportWidth());
        assertEquals("", settings.getLanguage());
        assertNull(settings.createHyphenator().getLanguageHyphenator());
    }

    @Test
    public void setters() {
        final ParagraphSettings settings = new ParagraphSettings()
                .setAlignment(TextAlignment.CENTER)
                .setHyphenationEnabled(true)
                .setExtraParagraphSpacing(false)
                .setViewportWidth(320)
                .setLanguage(null);
        assertEquals(TextAlignment.CENTER, settings.getAlignment());
        assertTrue(settings.isHyphenationEnabled());
        assertFalse(settings.isExtraParagraphSpacing());
        assertEquals(320, settings.getViewportWidth());
        assertEquals("", settings.getLanguage());

        assertThrows(NullPointerException.class, () -> settings.setAlignment(null));
        assertThrows(IllegalArgumentException.class, () -> settings.setViewportWidth(-1));
    }

    @Test
    public void loadJson() {
        final ParagraphSettings settings = ParagraphSettings.fromJson("{\n" +
                "  \"alignment\": \"Justify\",\n" +
                "  \"hyphenation\": true,\n" +
                "  \"extraParagraphSpacing\": false,\n" +
                "  \"viewportWidth\": 480,\n" +
                "  \"language\": \"de-AT\"\n" +
                "}");
        assertEquals(TextAlignment.JUSTIFIED, settings.getAlignment());
        assertTrue(settings.isHyphenationEnabled());
        assertFalse(settings.isExtraParagraphSpacing());
        assertEquals(480, settings.getViewportWidth());
        assertEquals("de-AT", settings.getLanguage());

        final Hyphenator hyphenator = settings.createHyphenator();
        assertNotNull(hyphenator.getLanguageHyphenator());
        assertEquals(3, hyphenator.hyphenate("Kinder").get(0));
    }

    @Test
    public void missingKeysKeepValues() {
        final ParagraphSettings settings = ParagraphSettings.fromJson("{\"alignment\": \"left\"}");
        assertEquals(TextAlignment.LEFT, settings.getAlignment());
        assertFalse(settings.isHyphenationEnabled());
        assertTrue(settings.isExtraParagraphSpacing());
        assertEquals(0, settings.getViewportWidth());
        assertEquals("", settings.getLanguage());
    }

    @Test
    public void invalidJson() {
        assertThrows(GdxRuntimeException.class, () -> ParagraphSettings.fromJson("{\"alignment\": \"diagonal\"}"));
        assertThrows(GdxRuntimeException.class, () -> ParagraphSettings.fromJson("{\"viewportWidth\": -5}"));
        assertThrows(GdxRuntimeException.class, () -> ParagraphSettings.fromJson("[1, 2]"));
    }

    @Test
    public void alignmentNames() {
        assertEquals(TextAlignment.RIGHT, TextAlignment.forName("RIGHT"));
        assertEquals(TextAlignment.CENTER, TextAlignment.forName("center"));
        assertEquals(TextAlignment.JUSTIFIED, TextAlignment.forName("justified"));
        assertEquals(TextAlignment.JUSTIFIED, TextAlignment.forName("justify"));
        assertNull(TextAlignment.forName("middle"));
        assertNull(TextAlignment.forName(null));
    }

    @Test
    public void alignmentToAlign() {
        assertEquals(Align.left, TextAlignment.LEFT.toAlign());
        assertEquals(Align.right, TextAlignment.RIGHT.toAlign());
        assertEquals(Align.center, TextAlignment.CENTER.toAlign());
        assertEquals(Align.left, TextAlignment.JUSTIFIED.toAlign());
    }

    @Test
    public void fontStyles() {
        assertEquals(FontStyle.REGULAR, FontStyle.of(false, false));
        assertEquals(FontStyle.BOLD_ITALIC, FontStyle.of(true, true));
        assertTrue(FontStyle.of(true, false).isBold());
        assertFalse(FontStyle.of(true, false).isItalic());
        assertTrue(FontStyle.ITALIC.isItalic());
    }
}
