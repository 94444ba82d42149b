package com.darkyen.libgdx.paragraph.hyphenation;

/**
 * Position in a word where it may be split.
 */
public final class BreakPoint {

    /** Char offset into the word where the remainder starts, in (0, word.length()). */
    public final int offset;
    /** Whether the prefix must be followed by an inserted visible hyphen. */
    public final boolean requiresInsertedHyphen;

    public BreakPoint(int offset, boolean requiresInsertedHyphen) {
        this.offset = offset;
        this.requiresInsertedHyphen = requiresInsertedHyphen;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BreakPoint that = (BreakPoint) o;
        return offset == that.offset && requiresInsertedHyphen == that.requiresInsertedHyphen;
    }

    @Override
    public int hashCode() {
        return offset * 31 + (requiresInsertedHyphen ? 1 : 0);
    }

    @Override
    public String toString() {
        return requiresInsertedHyphen ? offset + "+hyphen" : Integer.toString(offset);
    }
}
