package com.darkyen.libgdx.paragraph.hyphenation;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 *
 */
public class CodepointsTests {

    private static void assertCodepoints(CodepointSequence sequence, int[] values, int[] offsets) {
        assertEquals(values.length, sequence.size(), "size of " + sequence);
        for (int i = 0; i < values.length; i++) {
            assertEquals(values[i], sequence.valueAt(i), "value at " + i);
            assertEquals(offsets[i], sequence.offsetAt(i), "offset at " + i);
        }
    }

    @Test
    public void decodeSurrogatePairs() {
        final CodepointSequence cps = Codepoints.decode("a\uD83D\uDE00b");
        assertCodepoints(cps, new int[]{'a', 0x1F600, 'b'}, new int[]{0, 1, 3});
    }

    @Test
    public void decodeUnpairedSurrogates() {
        assertCodepoints(Codepoints.decode("a\uD800b"), new int[]{'a', 0xFFFD, 'b'}, new int[]{0, 1, 2});
        assertCodepoints(Codepoints.decode("\uDC00"), new int[]{0xFFFD}, new int[]{0});
        assertCodepoints(Codepoints.decode("x\uD83D"), new int[]{'x', 0xFFFD}, new int[]{0, 1});
    }

    @Test
    public void decodeEmpty() {
        final CodepointSequence cps = Codepoints.decode("");
        assertTrue(cps.isEmpty());
        assertEquals(0, cps.offsetForIndex(0));
    }

    @Test
    public void offsetForIndexPastEnd() {
        final CodepointSequence cps = Codepoints.decode("abc");
        assertEquals(1, cps.offsetForIndex(1));
        assertEquals(2, cps.offsetForIndex(3));
        assertEquals(2, cps.offsetForIndex(10));
    }

    @Test
    public void decodeUtf8() {
        final byte[] bytes = "a\u00E9\u20AC\uD83D\uDE00".getBytes(StandardCharsets.UTF_8);
        assertEquals(10, bytes.length);
        final CodepointSequence cps = Codepoints.decodeUtf8(bytes, 0, bytes.length);
        assertCodepoints(cps, new int[]{'a', 0xE9, 0x20AC, 0x1F600}, new int[]{0, 1, 3, 6});
    }

    @Test
    public void decodeUtf8Range() {
        final byte[] bytes = "xx\u00E9yy".getBytes(StandardCharsets.UTF_8);
        final CodepointSequence cps = Codepoints.decodeUtf8(bytes, 2, 5);
        assertCodepoints(cps, new int[]{0xE9, 'y'}, new int[]{2, 4});
    }

    @Test
    public void decodeMalformedUtf8() {
        // Invalid continuation byte
        assertCodepoints(Codepoints.decodeUtf8(new byte[]{0x61, (byte) 0xC3, 0x28}, 0, 3),
                new int[]{'a', 0xFFFD, '('}, new int[]{0, 1, 2});
        // Overlong encoding of '/'
        assertCodepoints(Codepoints.decodeUtf8(new byte[]{(byte) 0xC0, (byte) 0xAF}, 0, 2),
                new int[]{0xFFFD, 0xFFFD}, new int[]{0, 1});
        // Truncated sequence
        assertCodepoints(Codepoints.decodeUtf8(new byte[]{(byte) 0xE2, (byte) 0x82}, 0, 2),
                new int[]{0xFFFD, 0xFFFD}, new int[]{0, 1});
        // Encoded surrogate
        assertCodepoints(Codepoints.decodeUtf8(new byte[]{(byte) 0xED, (byte) 0xA0, (byte) 0x80}, 0, 3),
                new int[]{0xFFFD, 0xFFFD, 0xFFFD}, new int[]{0, 1, 2});
    }

    @Test
    public void decodeUtf8InvalidArguments() {
        assertThrows(NullPointerException.class, () -> Codepoints.decodeUtf8(null, 0, 0));
        assertThrows(IndexOutOfBoundsException.class, () -> Codepoints.decodeUtf8(new byte[2], 2, 1));
        assertThrows(IndexOutOfBoundsException.class, () -> Codepoints.decodeUtf8(new byte[2], 0, 3));
        assertTrue(Codepoints.decodeUtf8(new byte[2], 1, 1).isEmpty());
    }

    private static String trimmed(String word) {
        final CodepointSequence cps = Codepoints.decode(word);
        Codepoints.trimSurroundingPunctuationAndFootnote(cps);
        return cps.toString();
    }

    @Test
    public void trimPunctuationAndFootnotes() {
        assertEquals("Hello", trimmed("\u00ABHello!\u00BB"));
        assertEquals("word", trimmed("word\u00B9"));
        assertEquals("word", trimmed("word,2"));
        assertEquals("word", trimmed("(word)*"));
        assertEquals("well-known", trimmed("\"well-known\""));
        assertEquals("", trimmed("..."));
        // Leading digits are a part of the word
        assertEquals("3rd", trimmed("3rd."));
    }

    @Test
    public void trimKeepsOffsets() {
        final CodepointSequence cps = Codepoints.decode("(abc),");
        Codepoints.trimSurroundingPunctuationAndFootnote(cps);
        assertCodepoints(cps, new int[]{'a', 'b', 'c'}, new int[]{1, 2, 3});

        final CodepointSequence indented = Codepoints.decode("\u2003\u201Cab");
        Codepoints.trimSurroundingPunctuationAndFootnote(indented);
        assertCodepoints(indented, new int[]{'a', 'b'}, new int[]{2, 3});
    }

    @Test
    public void whitespace() {
        assertTrue(Codepoints.isWhitespace(' '));
        assertTrue(Codepoints.isWhitespace('\u2003'));
        assertTrue(Codepoints.isWhitespace('\u00A0'));
        assertFalse(Codepoints.isWhitespace('a'));
        assertFalse(Codepoints.isWhitespace('\u00AD'));
    }

    @Test
    public void letterClasses() {
        assertTrue(Codepoints.isLatinLetter('a'));
        assertTrue(Codepoints.isLatinLetter(0xE9));
        assertFalse(Codepoints.isLatinLetter(0x0436));
        assertTrue(Codepoints.isCyrillicLetter(0x0436));
        assertFalse(Codepoints.isCyrillicLetter('z'));
        assertFalse(Codepoints.isAlphabetic('3'));
        assertTrue(Codepoints.isExplicitHyphen('-'));
        assertTrue(Codepoints.isExplicitHyphen(Codepoints.SOFT_HYPHEN));
        assertTrue(Codepoints.isExplicitHyphen(Codepoints.UNICODE_HYPHEN));
        assertFalse(Codepoints.isExplicitHyphen(0x2014));
    }

    @Test
    public void softHyphens() {
        final String plain = "coop";
        assertSame(plain, Codepoints.stripSoftHyphens(plain));
        assertFalse(Codepoints.containsSoftHyphen(plain));

        final String soft = "co\u00ADop\u00AD";
        assertTrue(Codepoints.containsSoftHyphen(soft));
        assertEquals("coop", Codepoints.stripSoftHyphens(soft));
    }
}
