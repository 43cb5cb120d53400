package com.example.guardianintake.service.extraction;

import org.apache.commons.text.similarity.LevenshteinDistance;

import java.util.Optional;

/**
 * Finds a phrase in OCR text allowing a few character edits. Matching is case-insensitive,
 * stays within one line, starts on a word boundary, and returns the best-scoring occurrence
 * (earliest on ties).
 */
public class FuzzyAnchorMatcher {

    private final double maxEditRatio;
    private final double scoreFloor;

    public FuzzyAnchorMatcher(double maxEditRatio, double scoreFloor) {
        if (maxEditRatio < 0 || maxEditRatio >= 1) {
            throw new IllegalArgumentException("maxEditRatio must be in [0, 1): " + maxEditRatio);
        }
        this.maxEditRatio = maxEditRatio;
        this.scoreFloor = scoreFloor;
    }

    public Optional<AnchorMatch> find(String text, String phrase) {
        return find(text, phrase, 0, text == null ? 0 : text.length());
    }

    /**
     * Searches {@code text[from, to)} for {@code phrase}.
     */
    public Optional<AnchorMatch> find(String text, String phrase, int from, int to) {
        if (text == null || phrase == null || phrase.isBlank()) {
            return Optional.empty();
        }
        String needle = lower(phrase.trim());
        int length = needle.length();
        int allowed = allowedEdits(length);
        String haystack = lower(text);
        int limit = Math.min(to, haystack.length());
        LevenshteinDistance distance = new LevenshteinDistance(allowed);
        boolean needleEndsInWord = Character.isLetterOrDigit(needle.charAt(length - 1));

        AnchorMatch best = null;
        for (int i = Math.max(0, from); i < limit; i++) {
            char c = haystack.charAt(i);
            if (Character.isWhitespace(c)) {
                continue;
            }
            if (i > 0 && Character.isLetterOrDigit(haystack.charAt(i - 1)) && Character.isLetterOrDigit(c)) {
                continue;
            }
            for (int len = Math.max(1, length - allowed); len <= length + allowed; len++) {
                int end = i + len;
                if (end > limit) {
                    break;
                }
                String window = haystack.substring(i, end);
                if (window.indexOf('\n') >= 0) {
                    break;
                }
                if (needleEndsInWord && end < haystack.length()
                    && Character.isLetterOrDigit(haystack.charAt(end))
                    && Character.isLetterOrDigit(haystack.charAt(end - 1))) {
                    continue;
                }
                int edits = distance.apply(needle, window);
                if (edits < 0) {
                    continue;
                }
                double score = 1.0 - (double) edits / length;
                if (score < scoreFloor) {
                    continue;
                }
                if (best == null || score > best.getScore()
                    || (score == best.getScore() && i == best.getStart()
                        && Math.abs(len - length) < Math.abs(best.getEnd() - best.getStart() - length))) {
                    best = new AnchorMatch(i, end, score);
                }
            }
            if (best != null && best.getScore() == 1.0) {
                break;
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * Similarity of two short strings in [0, 1], case-insensitive.
     */
    public static double similarity(String a, String b) {
        if (a == null || b == null) {
            return 0.0;
        }
        String left = lower(a.trim());
        String right = lower(b.trim());
        int longest = Math.max(left.length(), right.length());
        if (longest == 0) {
            return 1.0;
        }
        return 1.0 - (double) LevenshteinDistance.getDefaultInstance().apply(left, right) / longest;
    }

    int allowedEdits(int length) {
        return (int) Math.floor(length * maxEditRatio);
    }

    // char-wise so offsets stay aligned with the original text
    private static String lower(String s) {
        char[] chars = s.toCharArray();
        for (int i = 0; i < chars.length; i++) {
            chars[i] = Character.toLowerCase(chars[i]);
        }
        return new String(chars);
    }

    public static final class AnchorMatch {
        private final int start;
        private final int end;
        private final double score;

        public AnchorMatch(int start, int end, double score) {
            this.start = start;
            this.end = end;
            this.score = score;
        }

        public int getStart() {
            return start;
        }

        public int getEnd() {
            return end;
        }

        public double getScore() {
            return score;
        }
    }
}
