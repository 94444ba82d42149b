package com.darkyen.libgdx.paragraph;

/**
 * Style of a word, selects the face of the font family used to measure and draw it.
 */
public enum FontStyle {
    REGULAR,
    BOLD,
    ITALIC,
    BOLD_ITALIC;

    /** @return style with both given traits */
    public static FontStyle of(boolean bold, boolean italic) {
        if (bold) {
            return italic ? BOLD_ITALIC : BOLD;
        } else {
            return italic ? ITALIC : REGULAR;
        }
    }

    public boolean isBold() {
        return this == BOLD || this == BOLD_ITALIC;
    }

    public boolean isItalic() {
        return this == ITALIC || this == BOLD_ITALIC;
    }
}
