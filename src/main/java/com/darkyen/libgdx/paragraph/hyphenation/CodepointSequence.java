package com.darkyen.libgdx.paragraph.hyphenation;

import com.badlogic.gdx.utils.IntArray;

/**
 * Decoded codepoints of a single word, each paired with the offset of its first unit in the source text.
 * Offsets are char offsets for {@link Codepoints#decode(CharSequence)} and byte offsets for
 * {@link Codepoints#decodeUtf8(byte[], int, int)}.
 *
 * Produced fresh for each hyphenation query, may be trimmed in place.
 */
public final class CodepointSequence {

    /** Codepoint values. Size is always equal to {@link #offsets} size. */
    final IntArray values = new IntArray(true, 16);
    /** Offset of the first unit of each codepoint, strictly ascending. */
    final IntArray offsets = new IntArray(true, 16);

    void add(int codepoint, int offset) {
        assert offsets.size == 0 || offsets.peek() < offset;
        values.add(codepoint);
        offsets.add(offset);
    }

    /** @return amount of codepoints */
    public int size() {
        return values.size;
    }

    public boolean isEmpty() {
        return values.size == 0;
    }

    /** @return codepoint at given index */
    public int valueAt(int index) {
        return values.get(index);
    }

    /** @return offset of the codepoint at given index in the source text */
    public int offsetAt(int index) {
        return offsets.get(index);
    }

    /**
     * Translate codepoint index into offset in the source text.
     * Index equal to {@link #size()} maps to the offset of the last codepoint.
     * @return offset, or 0 when empty
     */
    public int offsetForIndex(int index) {
        if (index < values.size) {
            return offsets.items[index];
        }
        return values.size == 0 ? 0 : offsets.items[values.size - 1];
    }

    /** Remove codepoints from the front and back.
     * @param fromStart amount of codepoints to drop at the start
     * @param fromEnd amount of codepoints to drop at the end */
    void trim(int fromStart, int fromEnd) {
        final int size = values.size;
        if (fromStart + fromEnd >= size) {
            values.clear();
            offsets.clear();
            return;
        }
        if (fromEnd > 0) {
            values.truncate(size - fromEnd);
            offsets.truncate(size - fromEnd);
        }
        if (fromStart > 0) {
            values.removeRange(0, fromStart - 1);
            offsets.removeRange(0, fromStart - 1);
        }
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder(values.size);
        for (int i = 0; i < values.size; i++) {
            sb.appendCodePoint(values.items[i]);
        }
        return sb.toString();
    }
}
