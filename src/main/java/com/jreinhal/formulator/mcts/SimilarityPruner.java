package com.jreinhal.formulator.mcts;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Drops near-duplicate candidate texts.
 *
 * Similarity is the Ratcliff/Obershelp ratio {@code 2 * M / T} over the lower-cased
 * first {@value #COMPARED_PREFIX} characters, where {@code M} is the number of
 * characters in matching blocks and {@code T} the combined length.
 *
 * <p>Like difflib's {@code SequenceMatcher} with its default auto-junk, when the
 * second text has {@value #POPULAR_MIN_LENGTH} or more characters, characters that
 * make up more than 1% of it cannot start a matching block. They still join a block
 * that grows into them from a neighbouring match.
 */
public class SimilarityPruner {

    static final int COMPARED_PREFIX = 300;
    static final int POPULAR_MIN_LENGTH = 200;

    private final double threshold;

    public SimilarityPruner(double threshold) {
        if (threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("Similarity threshold must be within [0, 1]: " + threshold);
        }
        this.threshold = threshold;
    }

    public double similarity(String a, String b) {
        return ratio(normalize(a), normalize(b));
    }

    /**
     * Keep a candidate only if it is no more similar than the threshold to every
     * candidate kept before it. Never returns an empty list for non-empty input.
     */
    public List<String> prune(List<String> candidates) {
        List<String> kept = new ArrayList<>();
        for (String candidate : candidates) {
            if (!isDuplicate(candidate, kept)) {
                kept.add(candidate);
            }
        }
        if (kept.isEmpty() && !candidates.isEmpty()) {
            kept.add(candidates.get(0));
        }
        return kept;
    }

    public boolean isDuplicate(String candidate, Collection<String> existing) {
        for (String other : existing) {
            if (similarity(candidate, other) > threshold) {
                return true;
            }
        }
        return false;
    }

    public double getThreshold() {
        return threshold;
    }

    private static String normalize(String text) {
        String lower = text == null ? "" : text.toLowerCase(Locale.ROOT);
        return lower.length() > COMPARED_PREFIX ? lower.substring(0, COMPARED_PREFIX) : lower;
    }

    static double ratio(String a, String b) {
        int total = a.length() + b.length();
        if (total == 0) {
            return 1.0;
        }
        return 2.0 * matchingCharacters(a, b) / total;
    }

    /**
     * Sum of matching block sizes: take the longest common block, then recurse into
     * the unmatched regions on either side of it. Regions are kept on an explicit stack.
     */
    private static int matchingCharacters(String a, String b) {
        boolean[] popular = popularPositions(b);
        int matched = 0;
        Deque<int[]> regions = new ArrayDeque<>();
        regions.push(new int[] {0, a.length(), 0, b.length()});
        while (!regions.isEmpty()) {
            int[] region = regions.pop();
            int aLo = region[0];
            int aHi = region[1];
            int bLo = region[2];
            int bHi = region[3];
            int[] block = longestMatch(a, aLo, aHi, b, bLo, bHi, popular);
            int size = block[2];
            if (size == 0) {
                continue;
            }
            matched += size;
            int aStart = block[0];
            int bStart = block[1];
            if (aLo < aStart && bLo < bStart) {
                regions.push(new int[] {aLo, aStart, bLo, bStart});
            }
            if (aStart + size < aHi && bStart + size < bHi) {
                regions.push(new int[] {aStart + size, aHi, bStart + size, bHi});
            }
        }
        return matched;
    }

    /**
     * Marks the positions of {@code b} holding a character that occurs more than
     * {@code length / 100 + 1} times. Nothing is popular in texts shorter than
     * {@value #POPULAR_MIN_LENGTH}.
     */
    private static boolean[] popularPositions(String b) {
        boolean[] popular = new boolean[b.length()];
        if (b.length() < POPULAR_MIN_LENGTH) {
            return popular;
        }
        Map<Character, Integer> counts = new HashMap<>();
        for (int j = 0; j < b.length(); j++) {
            counts.merge(b.charAt(j), 1, Integer::sum);
        }
        int limit = b.length() / 100 + 1;
        for (int j = 0; j < b.length(); j++) {
            popular[j] = counts.get(b.charAt(j)) > limit;
        }
        return popular;
    }

    /**
     * Longest common substring of {@code a[aLo, aHi)} and {@code b[bLo, bHi)} that
     * avoids popular characters, as {@code {aStart, bStart, size}}; the earliest block
     * wins ties. The block is then widened over equal neighbours on both sides,
     * popular or not.
     */
    private static int[] longestMatch(String a, int aLo, int aHi, String b, int bLo, int bHi, boolean[] popular) {
        int width = bHi - bLo;
        int[] previous = new int[width + 1];
        int[] current = new int[width + 1];
        int bestA = aLo;
        int bestB = bLo;
        int bestSize = 0;
        for (int i = aLo; i < aHi; i++) {
            char ch = a.charAt(i);
            for (int j = bLo; j < bHi; j++) {
                int column = j - bLo + 1;
                if (ch == b.charAt(j) && !popular[j]) {
                    int length = previous[column - 1] + 1;
                    current[column] = length;
                    if (length > bestSize) {
                        bestSize = length;
                        bestA = i - length + 1;
                        bestB = j - length + 1;
                    }
                } else {
                    current[column] = 0;
                }
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        while (bestA > aLo && bestB > bLo && a.charAt(bestA - 1) == b.charAt(bestB - 1)) {
            bestA--;
            bestB--;
            bestSize++;
        }
        while (bestA + bestSize < aHi && bestB + bestSize < bHi
                && a.charAt(bestA + bestSize) == b.charAt(bestB + bestSize)) {
            bestSize++;
        }
        return new int[] {bestA, bestB, bestSize};
    }
}
