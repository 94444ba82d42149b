package com.darkyen.libgdx.paragraph.eval;

import com.badlogic.gdx.files.FileHandle;
import com.badlogic.gdx.utils.Array;
import com.badlogic.gdx.utils.GdxRuntimeException;
import com.badlogic.gdx.utils.IntArray;
import com.badlogic.gdx.utils.StreamUtils;
import com.darkyen.libgdx.paragraph.hyphenation.Hyphenator;
import com.darkyen.libgdx.paragraph.hyphenation.LanguageEntry;
import com.darkyen.libgdx.paragraph.hyphenation.LanguageHyphenator;
import com.darkyen.libgdx.paragraph.hyphenation.LanguageRegistry;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.function.Function;

/**
 * Measures how well the bundled hyphenation patterns agree with reference hyphenations.
 *
 * <h4>Data format</h4>
 * One sample per line: <code>word|hyphenated|frequency</code>, where hyphenated is the word with <code>=</code>
 * at each expected break, e.g. <code>hyphenation|hy=phen=ation|12</code>. Empty lines and lines starting with
 * <code>#</code> are skipped.
 *
 * <h4>Usage</h4>
 * <code>HyphenationEvaluation [language|all] [data directory]</code>.
 * Without arguments, prints one summary line per language. With a language, prints a detailed report.
 * Data of language <code>english</code> is read from <code>english_hyphenation_tests.txt</code> in the data directory,
 * or from the copy bundled next to this class when no directory is given.
 */
public final class HyphenationEvaluation {

    /** Weight of an incorrect break in {@link WordScore#weightedScore}. */
    public static final double FALSE_POSITIVE_PENALTY = 2.0;
    /** Weight of a missed break in {@link WordScore#weightedScore}. */
    public static final double FALSE_NEGATIVE_PENALTY = 1.0;

    private HyphenationEvaluation() {
    }

    /** Single reference word. */
    public static final class Sample {
        public final String word;
        public final String hyphenated;
        public final int frequency;
        /** Codepoint indices of breaks in {@link #word}. */
        public final IntArray expectedPositions;

        public Sample(String word, String hyphenated, int frequency) {
            this.word = word;
            this.hyphenated = hyphenated;
            this.frequency = frequency;
            this.expectedPositions = expectedPositionsFromAnnotatedWord(hyphenated);
        }

        @Override
        public String toString() {
            return word + " (" + hyphenated + ")";
        }
    }

    /** Agreement of hyphenator output with one {@link Sample}. */
    public static final class WordScore {
        public int truePositives, falsePositives, falseNegatives;
        public double precision, recall, f1Score, weightedScore;

        public boolean isPerfect() {
            return weightedScore >= 0.999999;
        }
    }

    /** Aggregated scores of all samples of a language. */
    public static final class Report {
        public final Array<Sample> samples = new Array<>(Sample.class);
        public final Array<WordScore> scores = new Array<>(WordScore.class);
        public int perfectMatches, partialMatches, completeMisses;
        public int totalTruePositives, totalFalsePositives, totalFalseNegatives;
        public double totalPrecision, totalRecall, totalF1, totalWeighted;

        void add(Sample sample, WordScore score) {
            samples.add(sample);
            scores.add(score);

            totalTruePositives += score.truePositives;
            totalFalsePositives += score.falsePositives;
            totalFalseNegatives += score.falseNegatives;
            totalPrecision += score.precision;
            totalRecall += score.recall;
            totalF1 += score.f1Score;
            totalWeighted += score.weightedScore;

            if (score.f1Score == 1.0) {
                perfectMatches++;
            } else if (score.f1Score > 0.0) {
                partialMatches++;
            } else {
                completeMisses++;
            }
        }

        /** @return F1 score averaged over words, in [0, 1] */
        public double averageF1() {
            return samples.size == 0 ? 0.0 : totalF1 / samples.size;
        }

        /** @return precision over all breaks of all words, in [0, 1] */
        public double overallPrecision() {
            final int found = totalTruePositives + totalFalsePositives;
            return found > 0 ? (double) totalTruePositives / found : 0.0;
        }

        /** @return recall over all breaks of all words, in [0, 1] */
        public double overallRecall() {
            final int expected = totalTruePositives + totalFalseNegatives;
            return expected > 0 ? (double) totalTruePositives / expected : 0.0;
        }

        public double overallF1() {
            final double precision = overallPrecision();
            final double recall = overallRecall();
            return precision + recall > 0 ? 2 * precision * recall / (precision + recall) : 0.0;
        }

        /** @return indices into {@link #samples} of samples with imperfect score, the worst first */
        public IntArray imperfectIndices() {
            final IntArray indices = new IntArray();
            for (int i = 0; i < scores.size; i++) {
                if (!scores.get(i).isPerfect()) {
                    indices.add(i);
                }
            }

            // Stable insertion sort by weighted score
            final int[] items = indices.items;
            for (int i = 1; i < indices.size; i++) {
                final int index = items[i];
                final double score = scores.get(index).weightedScore;
                int j = i - 1;
                while (j >= 0 && scores.get(items[j]).weightedScore > score) {
                    items[j + 1] = items[j];
                    j--;
                }
                items[j + 1] = index;
            }
            return indices;
        }
    }

    /**
     * @param annotated word with <code>=</code> at each break
     * @return codepoint indices of the breaks, relative to the word without the markers
     */
    public static IntArray expectedPositionsFromAnnotatedWord(String annotated) {
        final IntArray positions = new IntArray();
        int codepointIndex = 0;
        for (int i = 0; i < annotated.length(); ) {
            final int cp = annotated.codePointAt(i);
            i += Character.charCount(cp);
            if (cp == '=') {
                positions.add(codepointIndex);
            } else {
                codepointIndex++;
            }
        }
        return positions;
    }

    /**
     * Inverse of {@link #expectedPositionsFromAnnotatedWord(String)}.
     * @param positions codepoint indices, in any order
     * @return word with <code>=</code> inserted before the codepoint at each position
     */
    public static String positionsToHyphenated(String word, IntArray positions) {
        final IntArray sorted = new IntArray(positions);
        sorted.sort();

        final StringBuilder result = new StringBuilder(word.length() + sorted.size);
        int codepointIndex = 0;
        int positionIndex = 0;
        for (int i = 0; i < word.length(); ) {
            while (positionIndex < sorted.size && sorted.items[positionIndex] == codepointIndex) {
                result.append('=');
                positionIndex++;
            }
            final int cp = word.codePointAt(i);
            i += Character.charCount(cp);
            result.appendCodePoint(cp);
            codepointIndex++;
        }
        while (positionIndex < sorted.size && sorted.items[positionIndex] == codepointIndex) {
            result.append('=');
            positionIndex++;
        }
        return result.toString();
    }

    /** Parse samples from the data format.
     * @param reader closed by this method
     * @throws GdxRuntimeException on malformed lines */
    public static Array<Sample> loadSamples(Reader reader) {
        final Array<Sample> samples = new Array<>(Sample.class);
        final BufferedReader in = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
        try {
            String line;
            int lineNumber = 0;
            while ((line = in.readLine()) != null) {
                lineNumber++;
                if (line.isEmpty() || line.charAt(0) == '#') {
                    continue;
                }
                final String[] parts = line.split("\\|");
                if (parts.length < 3) {
                    throw new GdxRuntimeException("Line " + lineNumber + ": expected word|hyphenated|frequency, got " + line);
                }
                final int frequency;
                try {
                    frequency = Integer.parseInt(parts[2].trim());
                } catch (NumberFormatException ex) {
                    throw new GdxRuntimeException("Line " + lineNumber + ": invalid frequency " + parts[2], ex);
                }
                samples.add(new Sample(parts[0], parts[1], frequency));
            }
        } catch (IOException ex) {
            throw new GdxRuntimeException("Error reading samples", ex);
        } finally {
            StreamUtils.closeQuietly(in);
        }
        return samples;
    }

    /** @see #loadSamples(Reader) */
    public static Array<Sample> loadSamples(FileHandle file) {
        return loadSamples(file.reader(1024, "UTF-8"));
    }

    /**
     * Load the bundled reference data of the language.
     * @return null when there is no bundled data for it
     */
    public static Array<Sample> loadBundledSamples(LanguageEntry language) {
        final InputStream in = HyphenationEvaluation.class.getResourceAsStream(dataFileName(language));
        if (in == null) {
            return null;
        }
        return loadSamples(new InputStreamReader(in, StandardCharsets.UTF_8));
    }

    /** @return name of the reference data file of the language */
    public static String dataFileName(LanguageEntry language) {
        return language.displayName + "_hyphenation_tests.txt";
    }

    /** Score the breaks found for the sample word against the expected ones. */
    public static WordScore evaluateWord(Sample sample, Function<String, IntArray> hyphenate) {
        final WordScore result = new WordScore();

        final IntArray expected = sample.expectedPositions;
        final IntArray actual = hyphenate.apply(sample.word);

        for (int i = 0; i < actual.size; i++) {
            if (expected.contains(actual.items[i])) {
                result.truePositives++;
            } else {
                result.falsePositives++;
            }
        }
        for (int i = 0; i < expected.size; i++) {
            if (!actual.contains(expected.items[i])) {
                result.falseNegatives++;
            }
        }

        if (result.truePositives + result.falsePositives > 0) {
            result.precision = (double) result.truePositives / (result.truePositives + result.falsePositives);
        }
        if (result.truePositives + result.falseNegatives > 0) {
            result.recall = (double) result.truePositives / (result.truePositives + result.falseNegatives);
        }
        if (result.precision + result.recall > 0) {
            result.f1Score = 2 * result.precision * result.recall / (result.precision + result.recall);
        }

        // Words without any breaks in both are a perfect match
        if (expected.size == 0 && actual.size == 0) {
            result.precision = 1.0;
            result.recall = 1.0;
            result.f1Score = 1.0;
        }

        final double totalErrors = result.falsePositives * FALSE_POSITIVE_PENALTY + result.falseNegatives * FALSE_NEGATIVE_PENALTY;
        final double totalPossible = expected.size * FALSE_POSITIVE_PENALTY;
        if (totalPossible > 0) {
            result.weightedScore = Math.max(0.0, 1.0 - totalErrors / totalPossible);
        } else if (result.falsePositives == 0) {
            result.weightedScore = 1.0;
        }
        return result;
    }

    /** Score all samples. */
    public static Report evaluate(Array<Sample> samples, Function<String, IntArray> hyphenate) {
        final Report report = new Report();
        for (Sample sample : samples) {
            report.add(sample, evaluateWord(sample, hyphenate));
        }
        return report;
    }

    /** Score all samples with the language hyphenator. */
    public static Report evaluate(Array<Sample> samples, LanguageHyphenator hyphenator) {
        return evaluate(samples, word -> Hyphenator.hyphenateWith(word, hyphenator));
    }

    /**
     * @param selection display name of a language, or "all"
     * @return matching languages, empty if none matches
     */
    public static Array<LanguageEntry> resolveLanguages(String selection) {
        final Array<LanguageEntry> entries = LanguageRegistry.getEntries();
        if ("all".equals(selection)) {
            return entries;
        }
        final Array<LanguageEntry> result = new Array<>(LanguageEntry.class);
        for (LanguageEntry entry : entries) {
            if (entry.displayName.equals(selection)) {
                result.add(entry);
            }
        }
        return result;
    }

    public static void printReport(PrintStream out, String language, Report report, LanguageHyphenator hyphenator) {
        final int count = report.samples.size;
        final String title = language.isEmpty() ? language : Character.toUpperCase(language.charAt(0)) + language.substring(1);
        final String rule = "================================================================================";

        out.println(rule);
        out.println(title + " HYPHENATION EVALUATION RESULTS");
        out.println(rule);
        out.println();
        out.println("Total test cases:   " + count);
        out.println("Perfect matches:    " + report.perfectMatches + " (" + percent(report.perfectMatches, count) + ")");
        out.println("Partial matches:    " + report.partialMatches);
        out.println("Complete misses:    " + report.completeMisses);
        out.println();

        out.println("--- Overall Metrics (averaged per word) ---");
        out.println("Average Precision:       " + percent(report.totalPrecision, count));
        out.println("Average Recall:          " + percent(report.totalRecall, count));
        out.println("Average F1 Score:        " + percent(report.totalF1, count));
        out.println("Average Weighted Score:  " + percent(report.totalWeighted, count) + " (FP penalty: 2x)");
        out.println();

        out.println("--- Overall Metrics (total counts) ---");
        out.println("True Positives:          " + report.totalTruePositives);
        out.println("False Positives:         " + report.totalFalsePositives + " (incorrect hyphenation points)");
        out.println("False Negatives:         " + report.totalFalseNegatives + " (missed hyphenation points)");
        out.println("Overall Precision:       " + percent(report.overallPrecision(), 1));
        out.println("Overall Recall:          " + percent(report.overallRecall(), 1));
        out.println("Overall F1 Score:        " + percent(report.overallF1(), 1));
        out.println();

        final IntArray worst = report.imperfectIndices();
        out.println("--- Worst Cases (lowest weighted scores) ---");
        for (int i = 0; i < Math.min(10, worst.size); i++) {
            final Sample sample = report.samples.get(worst.get(i));
            final WordScore score = report.scores.get(worst.get(i));
            out.println("Word: " + sample.word + " (freq: " + sample.frequency + ")");
            out.println("  Expected:  " + sample.hyphenated);
            out.println("  Got:       " + positionsToHyphenated(sample.word, Hyphenator.hyphenateWith(sample.word, hyphenator)));
            out.println("  Precision: " + percent(score.precision, 1) + "  Recall: " + percent(score.recall, 1)
                    + "  F1: " + percent(score.f1Score, 1) + "  Weighted: " + percent(score.weightedScore, 1));
            out.println("  TP: " + score.truePositives + "  FP: " + score.falsePositives + "  FN: " + score.falseNegatives);
            out.println();
        }

        final int compactCount = Math.min(100, worst.size);
        if (compactCount > 0) {
            out.println("--- Compact Worst Cases (" + compactCount + ") ---");
            for (int i = 0; i < compactCount; i++) {
                final Sample sample = report.samples.get(worst.get(i));
                out.println(sample.word + " | exp:" + sample.hyphenated
                        + " | got:" + positionsToHyphenated(sample.word, Hyphenator.hyphenateWith(sample.word, hyphenator)));
            }
            out.println();
        }
    }

    private static String percent(double total, int count) {
        if (count <= 0) return "0.00%";
        return String.format(Locale.ROOT, "%.2f%%", total / count * 100.0);
    }

    /**
     * Run the evaluation.
     * @return process exit code
     */
    public static int run(String[] args, PrintStream out, PrintStream err) {
        final boolean summaryMode = args.length == 0;
        final String selection = summaryMode ? "all" : args[0];
        final FileHandle dataDirectory = args.length > 1 ? new FileHandle(args[1]) : null;

        final Array<LanguageEntry> languages = resolveLanguages(selection);
        if (languages.size == 0) {
            err.println("Unknown language: " + selection);
            return 1;
        }

        for (LanguageEntry language : languages) {
            final LanguageHyphenator hyphenator = language.getHyphenator();
            final Array<Sample> samples;
            if (dataDirectory == null) {
                samples = loadBundledSamples(language);
                if (samples == null) {
                    err.println("No bundled test data for " + language.displayName + ". Skipping.");
                    continue;
                }
                if (!summaryMode) {
                    out.println("Loading bundled test data: " + dataFileName(language));
                }
            } else {
                final FileHandle dataFile = dataDirectory.child(dataFileName(language));
                if (!dataFile.exists()) {
                    err.println("No test data for " + language.displayName + " at " + dataFile.path() + ". Skipping.");
                    continue;
                }
                if (!summaryMode) {
                    out.println("Loading test data from: " + dataFile.path());
                }
                samples = loadSamples(dataFile);
            }
            if (samples.size == 0) {
                err.println("No test cases loaded for " + language.displayName + ". Skipping.");
                continue;
            }

            final Report report = evaluate(samples, hyphenator);
            if (summaryMode) {
                out.println(language.displayName + ": " + percent(report.averageF1(), 1));
            } else {
                out.println("Loaded " + samples.size + " test cases for " + language.displayName);
                out.println();
                printReport(out, language.displayName, report, hyphenator);
            }
        }
        return 0;
    }

    public static void main(String[] args) {
        final int exitCode = run(args, System.out, System.err);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }
}
