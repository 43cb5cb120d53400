package com.example.guardianintake.service.extraction;

import org.apache.commons.lang3.StringUtils;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Dates that are stated in running text rather than in a labelled field:
 * the judge's signature date on an order and the clerk's filing stamp.
 */
public final class DocumentDates {

    private static final String NUMERIC = "(\\d{1,2}\\s*[-/.]\\s*\\d{1,2}\\s*[-/.]\\s*\\d{2,4})";
    private static final String MONTH_NAME = "([A-Za-z]{3,9}\\.?\\s+\\d{1,2}(?:st|nd|rd|th)?,?\\s+\\d{4})";

    private static final Pattern SIGNED_NUMERIC = Pattern.compile("(?i)Signed\\s+(?:on\\s*)?:?\\s*" + NUMERIC);

    private static final Pattern SIGNED_MONTH_NAME = Pattern.compile("(?i)Signed\\s+(?:on\\s*)?:?\\s*" + MONTH_NAME);

    private static final Pattern SIGNED_DAY_OF = Pattern.compile(
        "(?i)Signed\\s+(?:on\\s+)?(?:this\\s+)?(?:the\\s+)?(\\d{1,2})(?:st|nd|rd|th)?\\s+day\\s+of\\s+([A-Za-z]{3,9}),?\\s+(\\d{4})");

    private static final Pattern JUDGE = Pattern.compile("(?i)\\bJudge\\b");

    private static final Pattern FILED_NUMERIC = Pattern.compile(
        "(?i)(?:Filed(?:\\s+for\\s+Record)?|Entered)\\s*:?\\s*(?:on\\s*)?" + NUMERIC);

    private static final Pattern FILED_MONTH_NAME = Pattern.compile(
        "(?i)(?:Filed(?:\\s+for\\s+Record)?|Entered)\\s*:?\\s*(?:on\\s*)?" + MONTH_NAME);

    // Clerk stamps: "Filed 2023 Mar 14 AM 10:02"
    private static final Pattern FILED_YEAR_FIRST = Pattern.compile(
        "(?i)(?:Filed|Entered)\\D{0,20}?(\\d{4})\\s+([A-Za-z]{3,9})\\.?\\s+(\\d{1,2})\\b");

    private DocumentDates() {
    }

    /**
     * Date the order was signed, from "Signed on ..." phrasing, or a date just before the
     * judge's signature line.
     */
    public static Optional<String> findSignedDate(String text) {
        if (StringUtils.isBlank(text)) {
            return Optional.empty();
        }
        Matcher dayOf = SIGNED_DAY_OF.matcher(text);
        if (dayOf.find()) {
            String date = ValueNormalizer.normalizeDate(dayOf.group(2) + " " + dayOf.group(1) + ", " + dayOf.group(3));
            if (date != null) {
                return Optional.of(date);
            }
        }
        Optional<String> signed = firstDate(text, SIGNED_NUMERIC, SIGNED_MONTH_NAME);
        if (signed.isPresent()) {
            return signed;
        }

        Matcher judge = JUDGE.matcher(text);
        while (judge.find()) {
            String before = text.substring(Math.max(0, judge.start() - 200), judge.start());
            Optional<String> near = lastDate(before);
            if (near.isPresent()) {
                return near;
            }
        }
        return Optional.empty();
    }

    /**
     * Date from the clerk's "Filed" or "Entered" stamp.
     */
    public static Optional<String> findFiledDate(String text) {
        if (StringUtils.isBlank(text)) {
            return Optional.empty();
        }
        Optional<String> filed = firstDate(text, FILED_NUMERIC, FILED_MONTH_NAME);
        if (filed.isPresent()) {
            return filed;
        }
        Matcher yearFirst = FILED_YEAR_FIRST.matcher(text);
        while (yearFirst.find()) {
            String date = ValueNormalizer.normalizeDate(
                yearFirst.group(2) + " " + yearFirst.group(3) + ", " + yearFirst.group(1));
            if (date != null) {
                return Optional.of(date);
            }
        }
        return Optional.empty();
    }

    private static Optional<String> firstDate(String text, Pattern... patterns) {
        for (Pattern pattern : patterns) {
            Matcher m = pattern.matcher(text);
            while (m.find()) {
                String date = ValueNormalizer.normalizeDate(m.group(1));
                if (date != null) {
                    return Optional.of(date);
                }
            }
        }
        return Optional.empty();
    }

    private static Optional<String> lastDate(String text) {
        String last = null;
        Matcher numeric = ValueNormalizer.NUMERIC_DATE.matcher(text);
        while (numeric.find()) {
            String date = ValueNormalizer.normalizeDate(numeric.group());
            if (date != null) {
                last = date;
            }
        }
        if (last == null) {
            Matcher named = ValueNormalizer.MONTH_NAME_DATE.matcher(text);
            while (named.find()) {
                String date = ValueNormalizer.normalizeDate(named.group());
                if (date != null) {
                    last = date;
                }
            }
        }
        return Optional.ofNullable(last);
    }
}
