package com.darkyen.libgdx.paragraph;

/**
 * Receives finished lines from {@link ParagraphLayout}, in reading order.
 */
public interface LineProcessor {

    /** @param line is owned by the receiver from now on */
    void processLine(TextLine line);
}
