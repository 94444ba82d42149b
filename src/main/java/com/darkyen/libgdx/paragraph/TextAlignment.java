package com.darkyen.libgdx.paragraph;

import com.badlogic.gdx.utils.Align;

/**
 * Horizontal alignment of paragraph lines.
 */
public enum TextAlignment {
    LEFT,
    RIGHT,
    CENTER,
    /** Lines are stretched to the full width, except for the last line of the paragraph, which is aligned left. */
    JUSTIFIED;

    /**
     * Convert to one of {@link Align} horizontal constants, for renderers built on them.
     * {@link #JUSTIFIED} lines have their positions already distributed, so they are drawn as left aligned.
     */
    public int toAlign() {
        switch (this) {
            case RIGHT:
                return Align.right;
            case CENTER:
                return Align.center;
            default:
                return Align.left;
        }
    }

    /**
     * @param name case insensitive name of the alignment, "justify" is accepted as well
     * @return alignment or null if the name is not known
     */
    public static TextAlignment forName(String name) {
        if (name == null) return null;
        for (TextAlignment alignment : values()) {
            if (alignment.name().equalsIgnoreCase(name)) {
                return alignment;
            }
        }
        if ("justify".equalsIgnoreCase(name)) {
            return JUSTIFIED;
        }
        return null;
    }
}
