package com.example.guardianintake.service.extraction;

import org.apache.commons.lang3.StringUtils;

import java.util.Collection;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finding and normalizing probate cause numbers. The canonical form is "NN-NNNNNN":
 * the two-digit year and the zero-filled six-digit sequence of "C-1-PB-NN-NNNNNN".
 */
public final class CauseNumbers {

    private static final Pattern FULL = Pattern.compile(
        "(?i)C\\s*-?\\s*1\\s*-?\\s*PB\\s*-?\\s*(\\d{2})\\s*-\\s*(\\d{3,6})\\b");

    private static final Pattern LABELLED = Pattern.compile(
        "(?i)Cause\\s*No\\.?\\s*:?\\s*(?:C-1-PB-)?(\\d{2})\\s*-\\s*(\\d{3,6})\\b");

    private static final Pattern LOOSE_SIX = Pattern.compile("\\b(\\d{2})-?(\\d{6})\\b");

    private static final Pattern LOOSE_FIVE = Pattern.compile("\\b(\\d{2})-(\\d{5})\\b");

    private static final Pattern CANONICAL = Pattern.compile("(\\d{2})-(\\d{1,6})");

    // File stamps at the top of the page carry unrelated numbers
    private static final int STAMP_LINES = 5;

    private CauseNumbers() {
    }

    public static Optional<String> find(String text) {
        if (StringUtils.isBlank(text)) {
            return Optional.empty();
        }
        for (Pattern pattern : new Pattern[] {FULL, LABELLED}) {
            Matcher m = pattern.matcher(text);
            if (m.find()) {
                return Optional.of(canonical(m.group(1), m.group(2)));
            }
        }

        String body = skipLines(text, STAMP_LINES);
        for (Pattern pattern : new Pattern[] {LOOSE_SIX, LOOSE_FIVE}) {
            Matcher m = pattern.matcher(body);
            if (m.find()) {
                return Optional.of(canonical(m.group(1), m.group(2)));
            }
        }
        return Optional.empty();
    }

    /**
     * Normalizes any accepted spelling to "NN-NNNNNN", or returns null.
     */
    public static String normalize(String value) {
        if (StringUtils.isBlank(value)) {
            return null;
        }
        Optional<String> found = find(value);
        if (found.isPresent()) {
            return found.get();
        }
        Matcher m = CANONICAL.matcher(value.replaceAll("\\s+", ""));
        return m.find() ? canonical(m.group(1), m.group(2)) : null;
    }

    /**
     * Two cause numbers with the same year whose sequences differ in at most one digit.
     */
    public static boolean nearMatch(String a, String b) {
        String left = normalize(a);
        String right = normalize(b);
        if (left == null || right == null || !left.substring(0, 2).equals(right.substring(0, 2))) {
            return false;
        }
        int differences = 0;
        for (int i = 3; i < left.length(); i++) {
            if (left.charAt(i) != right.charAt(i)) {
                differences++;
            }
        }
        return differences <= 1;
    }

    /**
     * The single candidate within one digit of {@code cause}, if exactly one exists.
     */
    public static Optional<String> nearest(String cause, Collection<String> candidates) {
        String match = null;
        for (String candidate : candidates) {
            if (nearMatch(cause, candidate)) {
                if (match != null && !match.equals(normalize(candidate))) {
                    return Optional.empty();
                }
                match = normalize(candidate);
            }
        }
        return Optional.ofNullable(match);
    }

    private static String canonical(String year, String sequence) {
        return year + "-" + StringUtils.leftPad(sequence, 6, '0');
    }

    private static String skipLines(String text, int lines) {
        int index = 0;
        for (int i = 0; i < lines; i++) {
            int next = text.indexOf('\n', index);
            if (next < 0) {
                // short text: nothing but the stamp area, search it all
                return text;
            }
            index = next + 1;
        }
        return text.substring(index);
    }
}
