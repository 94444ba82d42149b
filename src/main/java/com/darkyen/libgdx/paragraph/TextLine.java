package com.darkyen.libgdx.paragraph;

import java.util.Arrays;

/**
 * Single finished line of a paragraph, ready to be drawn.
 * Words are drawn at their X positions relative to the left edge of the line, with soft hyphens already removed.
 *
 * Immutable.
 */
public final class TextLine {

    private final String[] words;
    private final int[] xPositions;
    private final FontStyle[] styles;
    private final TextAlignment alignment;
    private final int wordWidthSum;
    private final int spacing;

    TextLine(String[] words, int[] xPositions, FontStyle[] styles, TextAlignment alignment, int wordWidthSum, int spacing) {
        assert words.length == xPositions.length && words.length == styles.length;
        this.words = words;
        this.xPositions = xPositions;
        this.styles = styles;
        this.alignment = alignment;
        this.wordWidthSum = wordWidthSum;
        this.spacing = spacing;
    }

    public int getWordCount() {
        return words.length;
    }

    public String getWord(int index) {
        return words[index];
    }

    /** @return X coordinate of the left edge of the word at index */
    public int getX(int index) {
        return xPositions[index];
    }

    public FontStyle getStyle(int index) {
        return styles[index];
    }

    /** Alignment of the paragraph this line belongs to. */
    public TextAlignment getAlignment() {
        return alignment;
    }

    /** @return sum of widths of all words, without any spacing */
    public int getWordWidthSum() {
        return wordWidthSum;
    }

    /** @return space between two consecutive words of this line */
    public int getSpacing() {
        return spacing;
    }

    /** @return words joined by a single space */
    public String getText() {
        final StringBuilder sb = new StringBuilder();
        for (int i = 0; i < words.length; i++) {
            if (i > 0) sb.append(' ');
            sb.append(words[i]);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "TextLine{" + alignment + " " + Arrays.toString(words) + " @ " + Arrays.toString(xPositions) + '}';
    }
}
