package com.darkyen.libgdx.paragraph;

import com.badlogic.gdx.utils.ObjectIntMap;
import com.badlogic.gdx.utils.ObjectMap;

/**
 * Remembers widths measured by another {@link TextMeasurer}, for measurers where measurement is expensive.
 * The cache is never evicted on its own, call {@link #clear()} when changing the fonts.
 */
public class CachingTextMeasurer<F> implements TextMeasurer<F> {

    private final TextMeasurer<F> measurer;
    /** Font -> cache for each {@link FontStyle} ordinal */
    private final ObjectMap<F, ObjectIntMap<String>[]> widths = new ObjectMap<>();
    private final ObjectIntMap<F> spaceWidths = new ObjectIntMap<>();

    public CachingTextMeasurer(TextMeasurer<F> measurer) {
        if (measurer == null) throw new NullPointerException("measurer");
        this.measurer = measurer;
    }

    @Override
    @SuppressWarnings("unchecked")
    public int getTextWidth(F font, String text, FontStyle style) {
        ObjectIntMap<String>[] fontWidths = widths.get(font);
        if (fontWidths == null) {
            fontWidths = new ObjectIntMap[FontStyle.values().length];
            widths.put(font, fontWidths);
        }
        ObjectIntMap<String> styleWidths = fontWidths[style.ordinal()];
        if (styleWidths == null) {
            styleWidths = fontWidths[style.ordinal()] = new ObjectIntMap<>();
        }

        int width = styleWidths.get(text, -1);
        if (width < 0) {
            width = measurer.getTextWidth(font, text, style);
            styleWidths.put(text, width);
        }
        return width;
    }

    @Override
    public int getSpaceWidth(F font) {
        int width = spaceWidths.get(font, -1);
        if (width < 0) {
            width = measurer.getSpaceWidth(font);
            spaceWidths.put(font, width);
        }
        return width;
    }

    /** Forget all remembered widths. */
    public void clear() {
        widths.clear();
        spaceWidths.clear();
    }
}
