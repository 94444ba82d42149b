package com.darkyen.libgdx.paragraph;

import com.badlogic.gdx.Gdx;
import com.badlogic.gdx.utils.Array;
import com.badlogic.gdx.utils.IntArray;
import com.darkyen.libgdx.paragraph.hyphenation.BreakPoint;
import com.darkyen.libgdx.paragraph.hyphenation.Codepoints;
import com.darkyen.libgdx.paragraph.hyphenation.Hyphenator;

/**
 * Breaks a paragraph of styled words into lines of given width and positions the words on each line.
 *
 * <p>Words are added with {@link #addWord(String, FontStyle)} and then consumed by
 * {@link #layoutAndExtractLines(Object, int, LineProcessor, boolean)}, which hands each finished line to a
 * {@link LineProcessor}. Words that do not fit may be split at hyphenation points, in which case the remainder
 * is inserted right after the prefix as a new word with the same style.
 *
 * <p>Two line breaking strategies are available:
 * <ul>
 *     <li>Without hyphenation, line breaks minimize the sum of squared free space at the end of each line
 *     (except the last one). Only words wider than the whole line are split.</li>
 *     <li>With hyphenation, lines are filled greedily and the word that would overflow the line is split
 *     at the widest break which still fits.</li>
 * </ul>
 *
 * <p>Layout never fails because of the content: a word that can't be split and does not fit is put on a line by itself.
 *
 * <b>NOT THREAD SAFE and not reentrant.</b>
 *
 * @param <F> font handle understood by the {@link TextMeasurer}
 */
public class ParagraphLayout<F> {

    private static final String TAG = "ParagraphLayout";

    /** EM SPACE, prepended to the first word when paragraphs are indented. */
    public static final char INDENT = '\u2003';

    /** Cost of a configuration with no valid line breaks. */
    private static final int MAX_COST = Integer.MAX_VALUE;

    private final TextMeasurer<F> measurer;
    private final Hyphenator hyphenator;

    private final TextAlignment alignment;
    private final boolean extraParagraphSpacing;
    private final boolean hyphenationEnabled;
    /** From {@link ParagraphSettings#getViewportWidth()}, 0 when not given. */
    private int viewportWidth = 0;

    /** Words of the paragraph. Never contains empty strings. */
    private final Array<String> words = new Array<>(true, 32, String.class);
    /** Style of each word in {@link #words}, always of the same size. */
    private final Array<FontStyle> wordStyles = new Array<>(true, 32, FontStyle.class);
    /** Measured width of each word in {@link #words}, valid (and of the same size) only during layout. */
    private final IntArray wordWidths = new IntArray(true, 32);
    /** Index of the first word in {@link #words} which has not been emitted yet, during layout. */
    private int readCursor = 0;

    private boolean indentApplied = false;

    /**
     * @param measurer not null
     * @param hyphenator provides split points, not null (may be in fallback-only mode)
     * @param settings alignment, hyphenation and indentation are read once
     */
    public ParagraphLayout(TextMeasurer<F> measurer, Hyphenator hyphenator, ParagraphSettings settings) {
        this(measurer, hyphenator, settings.getAlignment(), settings.isExtraParagraphSpacing(), settings.isHyphenationEnabled());
        this.viewportWidth = settings.getViewportWidth();
    }

    /** Layouts created this way have no viewport width, so it must be passed to
     * {@link #layoutAndExtractLines(Object, int, LineProcessor, boolean)}. */
    public ParagraphLayout(TextMeasurer<F> measurer, Hyphenator hyphenator,
                           TextAlignment alignment, boolean extraParagraphSpacing, boolean hyphenationEnabled) {
        if (measurer == null) throw new NullPointerException("measurer");
        if (hyphenator == null) throw new NullPointerException("hyphenator");
        if (alignment == null) throw new NullPointerException("alignment");
        this.measurer = measurer;
        this.hyphenator = hyphenator;
        this.alignment = alignment;
        this.extraParagraphSpacing = extraParagraphSpacing;
        this.hyphenationEnabled = hyphenationEnabled;
    }

    /**
     * Append a word to the paragraph.
     * @param word null or empty words are ignored
     * @param style not null
     */
    public void addWord(String word, FontStyle style) {
        if (style == null) throw new NullPointerException("style");
        if (word == null || word.isEmpty()) return;

        words.add(word);
        wordStyles.add(style);
        assert words.size == wordStyles.size;
    }

    /** @return amount of words which were not yet emitted as a part of some line */
    public int getWordCount() {
        return words.size;
    }

    public boolean isEmpty() {
        return words.size == 0;
    }

    /** @return pending word at index, as it would be measured (including the inserted hyphen of split words) */
    public String getWord(int index) {
        return words.get(index);
    }

    public FontStyle getStyle(int index) {
        return wordStyles.get(index);
    }

    public TextAlignment getAlignment() {
        return alignment;
    }

    /** Viewport width used by {@link #layoutAndExtractLines(Object, LineProcessor, boolean)}, 0 when not set. */
    public int getViewportWidth() {
        return viewportWidth;
    }

    /**
     * Like {@link #layoutAndExtractLines(Object, int, LineProcessor, boolean)}, with the viewport width
     * of the {@link ParagraphSettings} this layout was created with.
     * @throws IllegalStateException when the layout has no viewport width
     */
    public void layoutAndExtractLines(F font, LineProcessor processor, boolean includeLastLine) {
        if (viewportWidth <= 0) throw new IllegalStateException("No viewport width, pass it explicitly or set it in ParagraphSettings");
        layoutAndExtractLines(font, viewportWidth, processor, includeLastLine);
    }

    /**
     * Lay out all words into lines and hand the lines to the processor, removing their words from this paragraph.
     *
     * @param font used for measurement
     * @param viewportWidth width of each line
     * @param processor receives finished lines in reading order
     * @param includeLastLine when false, words of the last line are kept in this paragraph and not emitted,
     *                        so that more words can be added and laid out later
     */
    public void layoutAndExtractLines(F font, int viewportWidth, LineProcessor processor, boolean includeLastLine) {
        if (font == null) throw new NullPointerException("font");
        if (processor == null) throw new NullPointerException("processor");
        if (words.size == 0) {
            return;
        }

        applyParagraphIndent();

        final int pageWidth = viewportWidth;
        final int spaceWidth = measurer.getSpaceWidth(font);
        calculateWordWidths(font);

        final IntArray lineBreakIndices;
        if (hyphenationEnabled) {
            lineBreakIndices = computeHyphenatedLineBreaks(font, pageWidth, spaceWidth);
        } else {
            lineBreakIndices = computeLineBreaks(font, pageWidth, spaceWidth);
        }
        final int lineCount = includeLastLine ? lineBreakIndices.size : lineBreakIndices.size - 1;

        readCursor = 0;
        try {
            for (int i = 0; i < lineCount; i++) {
                extractLine(i, pageWidth, spaceWidth, lineBreakIndices, processor);
            }
        } finally {
            releaseConsumedWords();
        }
    }

    /** Drop words which were already emitted and the measured widths. */
    private void releaseConsumedWords() {
        final int consumed = readCursor;
        if (consumed > 0) {
            words.removeRange(0, consumed - 1);
            wordStyles.removeRange(0, consumed - 1);
        }
        readCursor = 0;
        wordWidths.clear();
        assert words.size == wordStyles.size;
    }

    private void applyParagraphIndent() {
        if (indentApplied || extraParagraphSpacing || words.size == 0) {
            return;
        }
        indentApplied = true;

        if (alignment == TextAlignment.JUSTIFIED || alignment == TextAlignment.LEFT) {
            words.set(0, INDENT + words.first());
        }
    }

    private void calculateWordWidths(F font) {
        final IntArray wordWidths = this.wordWidths;
        wordWidths.clear();
        wordWidths.ensureCapacity(words.size);

        final String[] words = this.words.items;
        final FontStyle[] styles = this.wordStyles.items;
        for (int i = 0; i < this.words.size; i++) {
            wordWidths.add(measureWordWidth(font, words[i], styles[i], false));
        }
        assert assertWidthsAligned();
    }

    /** Width of the word without soft hyphens, optionally with a visible hyphen appended. */
    private int measureWordWidth(F font, String word, FontStyle style, boolean appendHyphen) {
        final boolean hasSoftHyphen = Codepoints.containsSoftHyphen(word);
        if (!hasSoftHyphen && !appendHyphen) {
            return measurer.getTextWidth(font, word, style);
        }

        String sanitized = hasSoftHyphen ? Codepoints.stripSoftHyphens(word) : word;
        if (appendHyphen) {
            sanitized = sanitized + Codepoints.HYPHEN;
        }
        return measurer.getTextWidth(font, sanitized, style);
    }

    /**
     * Line breaks which minimize the badness of the paragraph.
     * @return for each line, index of the word after its last word
     */
    private IntArray computeLineBreaks(F font, int pageWidth, int spaceWidth) {
        final IntArray wordWidths = this.wordWidths;

        // Words that would overflow even as the only word on a line are split, using fallback breaks if needed
        for (int i = 0; i < wordWidths.size; i++) {
            while (wordWidths.items[i] > pageWidth) {
                if (!hyphenateWordAtIndex(i, pageWidth, font, true)) {
                    break;
                }
            }
        }

        final int totalWordCount = wordWidths.size;
        final int[] widths = wordWidths.items;

        // Minimal cost of lines starting at word i
        final int[] dp = new int[totalWordCount];
        // Index of the last word of the best line starting at word i
        final int[] ans = new int[totalWordCount];

        dp[totalWordCount - 1] = 0;
        ans[totalWordCount - 1] = totalWordCount - 1;

        for (int i = totalWordCount - 2; i >= 0; i--) {
            int currentLength = -spaceWidth;
            dp[i] = MAX_COST;

            for (int j = i; j < totalWordCount; j++) {
                currentLength += widths[j] + spaceWidth;
                if (currentLength > pageWidth) {
                    break;
                }

                final int cost;
                if (j == totalWordCount - 1) {
                    // Last line is never penalized
                    cost = 0;
                } else {
                    final long remainingSpace = pageWidth - currentLength;
                    final long longCost = remainingSpace * remainingSpace + dp[j + 1];
                    cost = longCost > MAX_COST ? MAX_COST : (int) longCost;
                }

                if (cost < dp[i]) {
                    dp[i] = cost;
                    ans[i] = j;
                }
            }

            if (dp[i] == MAX_COST) {
                // Nothing fits, force the word onto its own line and keep the cost of the rest,
                // so that one oversized word does not make all preceding lines invalid
                ans[i] = i;
                dp[i] = dp[i + 1];
                if (Gdx.app != null) {
                    Gdx.app.debug(TAG, "Word '" + words.get(i) + "' (" + widths[i] + ") does not fit into " + pageWidth);
                }
            }
        }

        final IntArray lineBreakIndices = new IntArray();
        int currentWordIndex = 0;
        while (currentWordIndex < totalWordCount) {
            int nextBreakIndex = ans[currentWordIndex] + 1;
            if (nextBreakIndex <= currentWordIndex) {
                nextBreakIndex = currentWordIndex + 1;
            }
            lineBreakIndices.add(nextBreakIndex);
            currentWordIndex = nextBreakIndex;
        }
        return lineBreakIndices;
    }

    /**
     * Greedy line breaks, splitting the word which would overflow the line when a prefix of it fits.
     * @return for each line, index of the word after its last word
     */
    private IntArray computeHyphenatedLineBreaks(F font, int pageWidth, int spaceWidth) {
        final IntArray wordWidths = this.wordWidths;
        final IntArray lineBreakIndices = new IntArray();
        int currentIndex = 0;

        while (currentIndex < wordWidths.size) {
            final int lineStart = currentIndex;
            int lineWidth = 0;

            while (currentIndex < wordWidths.size) {
                final boolean isFirstWord = currentIndex == lineStart;
                final int spacing = isFirstWord ? 0 : spaceWidth;
                final int candidateWidth = spacing + wordWidths.items[currentIndex];

                if (lineWidth + candidateWidth <= pageWidth) {
                    lineWidth += candidateWidth;
                    currentIndex++;
                    continue;
                }

                // Overflow, try to fit a prefix of the word (fallback breaks only for the first word on the line)
                final int availableWidth = pageWidth - lineWidth - spacing;
                if (availableWidth > 0 && hyphenateWordAtIndex(currentIndex, availableWidth, font, isFirstWord)) {
                    lineWidth += spacing + wordWidths.items[currentIndex];
                    currentIndex++;
                    break;
                }

                // Can't split, but there must be at least one word per line
                if (currentIndex == lineStart) {
                    lineWidth += candidateWidth;
                    currentIndex++;
                }
                break;
            }

            lineBreakIndices.add(currentIndex);
        }
        return lineBreakIndices;
    }

    /**
     * Split the word at index into a prefix which is as wide as possible while fitting into availableWidth,
     * and a remainder, which is inserted after it.
     * @return true if the word was split
     */
    private boolean hyphenateWordAtIndex(int wordIndex, int availableWidth, F font, boolean allowFallbackBreaks) {
        if (availableWidth <= 0 || wordIndex >= words.size) {
            return false;
        }

        final String word = words.get(wordIndex);
        final FontStyle style = wordStyles.get(wordIndex);

        final Array<BreakPoint> breakPoints = hyphenator.breakOffsets(word, allowFallbackBreaks);
        if (breakPoints.size == 0) {
            return false;
        }

        int chosenOffset = 0;
        int chosenWidth = -1;
        boolean chosenNeedsHyphen = true;

        for (BreakPoint breakPoint : breakPoints) {
            final int offset = breakPoint.offset;
            if (offset <= 0 || offset >= word.length()) {
                continue;
            }

            final boolean needsHyphen = breakPoint.requiresInsertedHyphen;
            final int prefixWidth = measureWordWidth(font, word.substring(0, offset), style, needsHyphen);
            if (prefixWidth > availableWidth || prefixWidth <= chosenWidth) {
                continue;
            }

            chosenWidth = prefixWidth;
            chosenOffset = offset;
            chosenNeedsHyphen = needsHyphen;
        }

        if (chosenWidth < 0) {
            return false;
        }

        final String remainder = word.substring(chosenOffset);
        final String prefix = chosenNeedsHyphen ? word.substring(0, chosenOffset) + Codepoints.HYPHEN : word.substring(0, chosenOffset);

        words.set(wordIndex, prefix);
        words.insert(wordIndex + 1, remainder);
        wordStyles.insert(wordIndex + 1, style);

        wordWidths.set(wordIndex, chosenWidth);
        wordWidths.insert(wordIndex + 1, measureWordWidth(font, remainder, style, false));
        assert assertWidthsAligned();
        return true;
    }

    private void extractLine(int breakIndex, int pageWidth, int spaceWidth, IntArray lineBreakIndices, LineProcessor processor) {
        final int lineBreak = lineBreakIndices.get(breakIndex);
        final int lastBreakAt = breakIndex > 0 ? lineBreakIndices.get(breakIndex - 1) : 0;
        final int lineWordCount = lineBreak - lastBreakAt;
        assert lastBreakAt == readCursor;

        final int[] widths = wordWidths.items;
        int lineWordWidthSum = 0;
        for (int i = lastBreakAt; i < lineBreak; i++) {
            lineWordWidthSum += widths[i];
        }

        final int spareSpace = pageWidth - lineWordWidthSum;

        int spacing = spaceWidth;
        final boolean isLastLine = breakIndex == lineBreakIndices.size - 1;
        if (alignment == TextAlignment.JUSTIFIED && !isLastLine && lineWordCount >= 2) {
            // Remainder of the division is left as a gap at the right edge
            spacing = spareSpace / (lineWordCount - 1);
        }

        int x = 0;
        if (alignment == TextAlignment.RIGHT) {
            x = spareSpace - (lineWordCount - 1) * spaceWidth;
        } else if (alignment == TextAlignment.CENTER) {
            x = (spareSpace - (lineWordCount - 1) * spaceWidth) / 2;
        }
        if (x < 0) {
            // Line is already wider than the page
            x = 0;
        }

        final String[] lineWords = new String[lineWordCount];
        final int[] lineX = new int[lineWordCount];
        final FontStyle[] lineStyles = new FontStyle[lineWordCount];
        for (int i = 0; i < lineWordCount; i++) {
            final int wordIndex = lastBreakAt + i;
            lineWords[i] = Codepoints.stripSoftHyphens(words.items[wordIndex]);
            lineStyles[i] = wordStyles.items[wordIndex];
            lineX[i] = x;
            x += widths[wordIndex] + spacing;

            // Emitted words are owned by the line now
            words.items[wordIndex] = null;
        }
        readCursor = lineBreak;

        processor.processLine(new TextLine(lineWords, lineX, lineStyles, alignment, lineWordWidthSum, spacing));
    }

    private boolean assertWidthsAligned() {
        assert words.size == wordStyles.size : words.size + " words, " + wordStyles.size + " styles";
        assert words.size == wordWidths.size : words.size + " words, " + wordWidths.size + " widths";
        return true;
    }
}
