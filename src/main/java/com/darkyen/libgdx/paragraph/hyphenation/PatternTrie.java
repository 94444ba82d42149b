package com.darkyen.libgdx.paragraph.hyphenation;

import com.badlogic.gdx.files.FileHandle;
import com.badlogic.gdx.utils.GdxRuntimeException;
import com.badlogic.gdx.utils.IntArray;
import com.badlogic.gdx.utils.IntMap;
import com.badlogic.gdx.utils.ObjectMap;
import com.badlogic.gdx.utils.StreamUtils;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;

/**
 * Compiled table of Liang hyphenation patterns.
 *
 * <h4>Source format</h4>
 * <p>TeX-like plain text. Tokens are separated by whitespace, <code>%</code> starts a comment that runs to the end of the line.
 * A pattern token consists of letters, digits and <code>.</code> (word boundary),
 * where a digit specifies the weight of the gap in which it appears, for example <code>.hy3ph</code>.
 * Patterns are matched against lowercase words, so letters must be lowercase.
 * <p>A token which contains <code>-</code> is an exception, a whole word with all of its allowed breaks spelled out,
 * for example <code>ta-ble</code>. Exceptions replace the pattern result for that word.
 * <p>The TeX pattern files can be loaded directly: tokens inside <code>\patterns{...}</code> are patterns,
 * tokens inside <code>\hyphenation{...}</code> are exceptions (even those without any <code>-</code>, which never break),
 * and other lines starting with a TeX command outside of these blocks are skipped.
 */
public final class PatternTrie {

    /** Marks the start and end of a word in patterns. */
    public static final int WORD_BOUNDARY = '.';

    private static final String PATTERNS_COMMAND = "\\patterns{";
    private static final String HYPHENATION_COMMAND = "\\hyphenation{";
    private static final int BLOCK_NONE = 0;
    private static final int BLOCK_PATTERNS = 1;
    private static final int BLOCK_EXCEPTIONS = 2;

    private final Node root = new Node();
    /** Lowercase word -> codepoint indices of its breaks */
    private final ObjectMap<String, IntArray> exceptions = new ObjectMap<>();
    private int patternCount = 0;

    /**
     * Add a single pattern.
     * @param pattern e.g. <code>hen5at</code>
     * @throws IllegalArgumentException when the pattern has no letters or contains invalid characters
     */
    public void addPattern(String pattern) {
        final IntArray letters = new IntArray(true, pattern.length());
        final IntArray weights = new IntArray(true, pattern.length() + 1);
        weights.add(0);
        for (int i = 0; i < pattern.length(); ) {
            final int cp = pattern.codePointAt(i);
            i += Character.charCount(cp);

            if (cp >= '0' && cp <= '9') {
                weights.set(weights.size - 1, cp - '0');
            } else if (cp == WORD_BOUNDARY || Character.isLetter(cp)) {
                letters.add(cp);
                weights.add(0);
            } else {
                throw new IllegalArgumentException("Invalid character '" + new String(Character.toChars(cp)) + "' in pattern " + pattern);
            }
        }
        if (letters.size == 0) {
            throw new IllegalArgumentException("Pattern has no letters: " + pattern);
        }

        Node node = root;
        for (int i = 0; i < letters.size; i++) {
            final int cp = letters.items[i];
            Node child = node.children.get(cp);
            if (child == null) {
                child = new Node();
                node.children.put(cp, child);
            }
            node = child;
        }

        final byte[] values = new byte[weights.size];
        for (int i = 0; i < weights.size; i++) {
            values[i] = (byte) weights.items[i];
        }
        if (node.weights == null) {
            patternCount++;
        }
        node.weights = values;
    }

    /**
     * Add an exception word.
     * @param hyphenated lowercase word with <code>-</code> at each allowed break, e.g. <code>ta-ble</code>
     */
    public void addException(String hyphenated) {
        final StringBuilder word = new StringBuilder(hyphenated.length());
        final IntArray breaks = new IntArray();
        int codepointIndex = 0;
        for (int i = 0; i < hyphenated.length(); ) {
            final int cp = hyphenated.codePointAt(i);
            i += Character.charCount(cp);
            if (cp == '-') {
                if (codepointIndex > 0 && (breaks.size == 0 || breaks.peek() != codepointIndex)) {
                    breaks.add(codepointIndex);
                }
            } else {
                word.appendCodePoint(cp);
                codepointIndex++;
            }
        }
        if (breaks.size > 0 && breaks.peek() == codepointIndex) {
            breaks.pop();
        }
        if (codepointIndex == 0) {
            throw new IllegalArgumentException("Exception has no letters: " + hyphenated);
        }
        exceptions.put(word.toString(), breaks);
    }

    /** @return amount of distinct patterns */
    public int getPatternCount() {
        return patternCount;
    }

    /** @return amount of exception words */
    public int getExceptionCount() {
        return exceptions.size;
    }

    /**
     * @param word lowercase word, without boundary markers
     * @return break indices of the exception for this word, or null when it has no exception. Do not modify.
     */
    public IntArray getException(String word) {
        return exceptions.get(word);
    }

    /**
     * Apply all patterns that match anywhere in the word and keep the maximum weight for each gap.
     * @param word codepoints, including the {@link #WORD_BOUNDARY} at both ends
     * @param length of the word
     * @param gapWeights of size at least length+1, gapWeights[i] is the weight of the gap before word[i]
     */
    public void matchPatterns(int[] word, int length, byte[] gapWeights) {
        assert gapWeights.length >= length + 1;
        for (int start = 0; start < length; start++) {
            Node node = root;
            for (int i = start; i < length; i++) {
                node = node.children.get(word[i]);
                if (node == null) {
                    break;
                }
                final byte[] weights = node.weights;
                if (weights != null) {
                    for (int k = 0; k < weights.length; k++) {
                        final int gap = start + k;
                        if (weights[k] > gapWeights[gap]) {
                            gapWeights[gap] = weights[k];
                        }
                    }
                }
            }
        }
    }

    /** Parse patterns and exceptions from the source format into this trie.
     * @param reader closed by this method */
    public void load(Reader reader) throws IOException {
        final BufferedReader in = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
        try {
            int block = BLOCK_NONE;
            String line;
            int lineNumber = 0;
            while ((line = in.readLine()) != null) {
                lineNumber++;
                final int comment = line.indexOf('%');
                if (comment >= 0) {
                    line = line.substring(0, comment);
                }
                line = line.trim();
                if (block == BLOCK_NONE && line.startsWith("\\")
                        && !line.startsWith(PATTERNS_COMMAND) && !line.startsWith(HYPHENATION_COMMAND)) {
                    // \message, \lccode and other TeX setup
                    continue;
                }

                for (String token : line.split("\\s+")) {
                    if (token.startsWith(PATTERNS_COMMAND)) {
                        block = BLOCK_PATTERNS;
                        token = token.substring(PATTERNS_COMMAND.length());
                    } else if (token.startsWith(HYPHENATION_COMMAND)) {
                        block = BLOCK_EXCEPTIONS;
                        token = token.substring(HYPHENATION_COMMAND.length());
                    }

                    boolean closesBlock = false;
                    if (token.endsWith("}")) {
                        if (block == BLOCK_NONE) {
                            throw new GdxRuntimeException("Unexpected '}' on line " + lineNumber);
                        }
                        closesBlock = true;
                        token = token.substring(0, token.length() - 1);
                    }

                    if (!token.isEmpty()) {
                        try {
                            if (block == BLOCK_EXCEPTIONS || (block == BLOCK_NONE && token.indexOf('-') >= 0)) {
                                addException(token);
                            } else {
                                addPattern(token);
                            }
                        } catch (IllegalArgumentException e) {
                            throw new GdxRuntimeException("Invalid token on line " + lineNumber + ": " + token, e);
                        }
                    }

                    if (closesBlock) {
                        block = BLOCK_NONE;
                    }
                }
            }
            if (block != BLOCK_NONE) {
                throw new GdxRuntimeException("Unterminated " + (block == BLOCK_PATTERNS ? PATTERNS_COMMAND : HYPHENATION_COMMAND) + " block");
            }
        } finally {
            StreamUtils.closeQuietly(in);
        }
    }

    /** Load patterns from a file in the source format.
     * @throws GdxRuntimeException when the file can't be read or is malformed */
    public static PatternTrie load(FileHandle file) {
        final PatternTrie trie = new PatternTrie();
        try {
            trie.load(file.reader(1024, "UTF-8"));
        } catch (IOException ex) {
            throw new GdxRuntimeException("Error loading patterns: " + file, ex);
        }
        return trie;
    }

    /** Load patterns from a UTF-8 stream in the source format.
     * @param in closed by this method
     * @param name of the source, for error messages
     * @throws GdxRuntimeException when the stream can't be read or is malformed */
    public static PatternTrie load(InputStream in, String name) {
        if (in == null) throw new GdxRuntimeException("Patterns not found: " + name);
        final PatternTrie trie = new PatternTrie();
        try {
            trie.load(new InputStreamReader(in, StandardCharsets.UTF_8));
        } catch (IOException ex) {
            throw new GdxRuntimeException("Error loading patterns: " + name, ex);
        }
        return trie;
    }

    private static final class Node {
        final IntMap<Node> children = new IntMap<>(4);
        /** Weights of gaps before each letter of the pattern that ends in this node and after its last letter.
         * Null if no pattern ends here. */
        byte[] weights;
    }
}
