package com.darkyen.libgdx.paragraph.hyphenation;

/**
 * Decoding of words into codepoints and the codepoint classes used by hyphenation.
 */
public final class Codepoints {

    /** Zero-width optional break, rendered as '-' only when the line breaks there. */
    public static final char SOFT_HYPHEN = '\u00AD';
    /** Visible hyphen, also the glyph inserted when a word is split. */
    public static final char HYPHEN = '-';
    /** Unicode HYPHEN, treated the same as {@link #HYPHEN} when looking for explicit break markers. */
    public static final char UNICODE_HYPHEN = '\u2010';

    private static final int REPLACEMENT_CHARACTER = 0xFFFD;

    private Codepoints() {
    }

    /**
     * Decode UTF-16 text into codepoints with their char offsets.
     * Unpaired surrogates decode into U+FFFD.
     * @param text not null
     */
    public static CodepointSequence decode(CharSequence text) {
        final CodepointSequence result = new CodepointSequence();
        final int length = text.length();
        int i = 0;
        while (i < length) {
            final char c = text.charAt(i);
            final int start = i++;
            if (Character.isHighSurrogate(c) && i < length && Character.isLowSurrogate(text.charAt(i))) {
                result.add(Character.toCodePoint(c, text.charAt(i++)), start);
            } else if (Character.isSurrogate(c)) {
                // Either unexpected low surrogate or incomplete high surrogate
                result.add(REPLACEMENT_CHARACTER, start);
            } else {
                result.add(c, start);
            }
        }
        return result;
    }

    /**
     * Decode UTF-8 bytes into codepoints with their byte offsets.
     * Malformed, overlong or truncated sequences decode into U+FFFD and consume a single byte.
     * @param bytes not null
     * @param start first byte (inclusive)
     * @param end last byte (exclusive)
     */
    public static CodepointSequence decodeUtf8(byte[] bytes, int start, int end) {
        if (bytes == null) throw new NullPointerException("bytes");
        if (start < 0 || start > end || end > bytes.length) {
            throw new IndexOutOfBoundsException("[" + start + ", " + end + ") not in [0, " + bytes.length + ")");
        }
        final CodepointSequence result = new CodepointSequence();
        int i = start;
        while (i < end) {
            final int b0 = bytes[i] & 0xFF;
            final int length;
            int codepoint;
            int min;
            if (b0 < 0x80) {
                result.add(b0, i++);
                continue;
            } else if ((b0 & 0xE0) == 0xC0) {
                length = 2;
                codepoint = b0 & 0x1F;
                min = 0x80;
            } else if ((b0 & 0xF0) == 0xE0) {
                length = 3;
                codepoint = b0 & 0x0F;
                min = 0x800;
            } else if ((b0 & 0xF8) == 0xF0) {
                length = 4;
                codepoint = b0 & 0x07;
                min = 0x10000;
            } else {
                result.add(REPLACEMENT_CHARACTER, i++);
                continue;
            }

            boolean valid = i + length <= end;
            for (int k = 1; valid && k < length; k++) {
                final int b = bytes[i + k] & 0xFF;
                if ((b & 0xC0) != 0x80) {
                    valid = false;
                } else {
                    codepoint = (codepoint << 6) | (b & 0x3F);
                }
            }
            if (valid && codepoint >= min && codepoint <= Character.MAX_CODE_POINT
                    && !(codepoint >= Character.MIN_SURROGATE && codepoint <= Character.MAX_SURROGATE)) {
                result.add(codepoint, i);
                i += length;
            } else {
                result.add(REPLACEMENT_CHARACTER, i++);
            }
        }
        return result;
    }

    /**
     * Remove leading whitespace or punctuation and trailing punctuation or footnote markers, in place.
     * Leading whitespace covers the paragraph indent which the layout prepends to the first word.
     * Only for hyphenation analysis, widths are always measured on the untrimmed word.
     */
    public static void trimSurroundingPunctuationAndFootnote(CodepointSequence codepoints) {
        final int size = codepoints.size();
        int start = 0;
        while (start < size) {
            final int cp = codepoints.valueAt(start);
            if (!isWhitespace(cp) && !isPunctuation(cp)) {
                break;
            }
            start++;
        }
        int end = size;
        while (end > start) {
            final int cp = codepoints.valueAt(end - 1);
            if (!isPunctuation(cp) && !isFootnoteMarker(cp)) {
                break;
            }
            end--;
        }
        codepoints.trim(start, size - end);
    }

    /** @return true for any Unicode space separator (including EM SPACE) or Java whitespace */
    public static boolean isWhitespace(int codepoint) {
        return Character.isWhitespace(codepoint) || Character.getType(codepoint) == Character.SPACE_SEPARATOR;
    }

    public static boolean isPunctuation(int codepoint) {
        switch (Character.getType(codepoint)) {
            case Character.CONNECTOR_PUNCTUATION:
            case Character.DASH_PUNCTUATION:
            case Character.START_PUNCTUATION:
            case Character.END_PUNCTUATION:
            case Character.INITIAL_QUOTE_PUNCTUATION:
            case Character.FINAL_QUOTE_PUNCTUATION:
            case Character.OTHER_PUNCTUATION:
                return true;
            default:
                return false;
        }
    }

    /** Digits, superscript digits and reference symbols that trail a word which has a footnote. */
    public static boolean isFootnoteMarker(int codepoint) {
        return (codepoint >= '0' && codepoint <= '9')
                || codepoint == 0x00B9 || codepoint == 0x00B2 || codepoint == 0x00B3
                || (codepoint >= 0x2070 && codepoint <= 0x2079)
                || codepoint == '*'
                || codepoint == 0x2020 // DAGGER
                || codepoint == 0x2021; // DOUBLE DAGGER
    }

    public static boolean isAlphabetic(int codepoint) {
        return Character.isLetter(codepoint);
    }

    public static boolean isLatinLetter(int codepoint) {
        return Character.isLetter(codepoint) && Character.UnicodeScript.of(codepoint) == Character.UnicodeScript.LATIN;
    }

    public static boolean isCyrillicLetter(int codepoint) {
        return Character.isLetter(codepoint) && Character.UnicodeScript.of(codepoint) == Character.UnicodeScript.CYRILLIC;
    }

    public static boolean isSoftHyphen(int codepoint) {
        return codepoint == SOFT_HYPHEN;
    }

    public static boolean isExplicitHyphen(int codepoint) {
        return codepoint == HYPHEN || codepoint == UNICODE_HYPHEN || codepoint == SOFT_HYPHEN;
    }

    public static int toLowerCase(int codepoint) {
        return Character.toLowerCase(codepoint);
    }

    /** @return true if the text contains {@link #SOFT_HYPHEN} */
    public static boolean containsSoftHyphen(CharSequence text) {
        for (int i = 0, length = text.length(); i < length; i++) {
            if (text.charAt(i) == SOFT_HYPHEN) {
                return true;
            }
        }
        return false;
    }

    /** @return text without any {@link #SOFT_HYPHEN}, the same instance if there are none */
    public static String stripSoftHyphens(String text) {
        if (text.indexOf(SOFT_HYPHEN) < 0) {
            return text;
        }
        final StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0, length = text.length(); i < length; i++) {
            final char c = text.charAt(i);
            if (c != SOFT_HYPHEN) {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
