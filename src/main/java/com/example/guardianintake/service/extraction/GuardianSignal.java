package com.example.guardianintake.service.extraction;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * How much readable content surrounds the word "guardian" in a page text. Used to choose
 * between two OCR readings of the same page when the guardian fields are in question.
 */
public final class GuardianSignal {

    private static final Pattern GUARDIAN = Pattern.compile("(?i)guardian");
    private static final int BEFORE = 250;
    private static final int AFTER = 600;

    private GuardianSignal() {
    }

    /**
     * Letters, digits and '@' within the windows around each occurrence.
     */
    public static int score(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        boolean[] counted = new boolean[text.length()];
        Matcher m = GUARDIAN.matcher(text);
        int score = 0;
        while (m.find()) {
            int from = Math.max(0, m.start() - BEFORE);
            int to = Math.min(text.length(), m.end() + AFTER);
            for (int i = from; i < to; i++) {
                char c = text.charAt(i);
                if (!counted[i] && (Character.isLetterOrDigit(c) || c == '@')) {
                    counted[i] = true;
                    score++;
                }
            }
        }
        return score;
    }
}
