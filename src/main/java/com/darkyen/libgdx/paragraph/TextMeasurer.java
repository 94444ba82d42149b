package com.darkyen.libgdx.paragraph;

/**
 * Measures rendered width of text, so that {@link ParagraphLayout} does not need to know anything about fonts.
 *
 * Implementations must be deterministic for the same font, text and style,
 * because the same word may be measured multiple times during a single layout.
 *
 * @param <F> font handle used by the renderer
 */
public interface TextMeasurer<F> {

    /**
     * @param font not null
     * @param text to measure, never contains soft hyphens
     * @param style of the text
     * @return width of the text in layout units, never negative
     */
    int getTextWidth(F font, String text, FontStyle style);

    /** @return width of a single inter-word space of the font, in layout units */
    int getSpaceWidth(F font);
}
