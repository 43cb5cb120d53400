package com.example.guardianintake.service.extraction;

import org.apache.commons.lang3.StringUtils;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.Year;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Canonical forms for phones, dates, emails, relationships and addresses.
 * Each method returns null when the input cannot be read as the expected shape.
 */
public final class ValueNormalizer {

    static final Pattern NUMERIC_DATE = Pattern.compile("(\\d{1,2})\\s*[-/.]\\s*(\\d{1,2})\\s*[-/.]\\s*(\\d{4}|\\d{2})");

    static final Pattern MONTH_NAME_DATE = Pattern.compile(
        "(?i)\\b(jan|feb|mar|apr|may|jun|jul|aug|sep|sept|oct|nov|dec)[a-z]*\\.?\\s+(\\d{1,2})(?:st|nd|rd|th)?,?\\s+(\\d{4})");

    private static final Pattern EMAIL = Pattern.compile("[A-Za-z0-9._%+\\-]+@[A-Za-z0-9.\\-]+\\.[A-Za-z]{2,}");

    private static final Pattern ZIP = Pattern.compile("\\b\\d{5}(?:-\\d{4})?\\b");

    private static final Pattern STATE = Pattern.compile("\\b(TX|Texas)\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern STREET_NUMBER = Pattern.compile("(?:^|[\\s,;/&])\\d{1,6}\\s+[A-Za-z]");

    private static final Map<String, Integer> MONTHS = new LinkedHashMap<>();

    private static final Map<Pattern, String> ROLES = new LinkedHashMap<>();

    static {
        String[] names = {"jan", "feb", "mar", "apr", "may", "jun", "jul", "aug", "sep", "oct", "nov", "dec"};
        for (int i = 0; i < names.length; i++) {
            MONTHS.put(names[i], i + 1);
        }

        ROLES.put(Pattern.compile("(?i)\\bpublic\\s+guardian"), "Public Guardian");
        ROLES.put(Pattern.compile("(?i)\\bstep\\s*-?\\s*(mother|father|parent)\\b"), "Step-parent");
        ROLES.put(Pattern.compile("(?i)\\bgrand\\s*(mother|father|parent)s?\\b"), "Grandparent");
        ROLES.put(Pattern.compile("(?i)\\bgrand\\s*(son|daughter|child)(ren|s)?\\b"), "Grandchild");
        ROLES.put(Pattern.compile("(?i)\\b(father\\s*/\\s*mother|mother\\s*/\\s*father|parents?)\\b"), "Parent");
        ROLES.put(Pattern.compile("(?i)\\b(mother|mom)\\b"), "Mother");
        ROLES.put(Pattern.compile("(?i)\\b(father|dad)\\b"), "Father");
        ROLES.put(Pattern.compile("(?i)\\b(sister|brother|sibling)\\b"), "Sibling");
        ROLES.put(Pattern.compile("(?i)\\b(wife|husband|spouse)\\b"), "Spouse");
        ROLES.put(Pattern.compile("(?i)\\bson\\b"), "Son");
        ROLES.put(Pattern.compile("(?i)\\bdaughter\\b"), "Daughter");
        ROLES.put(Pattern.compile("(?i)\\b(aunt|uncle)\\b"), "Aunt/Uncle");
        ROLES.put(Pattern.compile("(?i)\\b(niece|nephew)\\b"), "Niece/Nephew");
        ROLES.put(Pattern.compile("(?i)\\bcousin\\b"), "Cousin");
        ROLES.put(Pattern.compile("(?i)\\bfriend\\b"), "Friend");
    }

    private ValueNormalizer() {
    }

    /**
     * "(xxx) xxx-xxxx"; a leading country code 1 is dropped.
     */
    public static String normalizePhone(String value) {
        if (StringUtils.isBlank(value)) {
            return null;
        }
        String digits = value.replaceAll("\\D", "");
        if (digits.length() == 11 && digits.startsWith("1")) {
            digits = digits.substring(1);
        }
        if (digits.length() != 10) {
            return null;
        }
        return String.format("(%s) %s-%s", digits.substring(0, 3), digits.substring(3, 6), digits.substring(6));
    }

    /**
     * MM/DD/YYYY. Two-digit years below 50 are read as 20xx, others as 19xx; years outside
     * 1900-2100 are rejected and years after the current one are clamped to it.
     */
    public static String normalizeDate(String value) {
        if (StringUtils.isBlank(value)) {
            return null;
        }
        Matcher numeric = NUMERIC_DATE.matcher(value);
        if (numeric.find()) {
            return format(Integer.parseInt(numeric.group(1)), Integer.parseInt(numeric.group(2)),
                numeric.group(3));
        }
        Matcher named = MONTH_NAME_DATE.matcher(value);
        if (named.find()) {
            Integer month = MONTHS.get(named.group(1).substring(0, 3).toLowerCase(Locale.ROOT));
            return format(month, Integer.parseInt(named.group(2)), named.group(3));
        }
        return null;
    }

    /**
     * Builds MM/DD/YYYY from parts, or null when they do not form a real date.
     */
    public static String format(int month, int day, String yearText) {
        int year = Integer.parseInt(yearText);
        if (yearText.length() == 2) {
            year += year < 50 ? 2000 : 1900;
        }
        if (year < 1900 || year > 2100) {
            return null;
        }
        int currentYear = Year.now().getValue();
        if (year > currentYear) {
            year = currentYear;
        }
        try {
            LocalDate date = LocalDate.of(year, month, day);
            return String.format("%02d/%02d/%04d", date.getMonthValue(), date.getDayOfMonth(), date.getYear());
        } catch (DateTimeException e) {
            return null;
        }
    }

    public static String normalizeEmail(String value) {
        if (StringUtils.isBlank(value)) {
            return null;
        }
        Matcher m = EMAIL.matcher(value.replaceAll("\\s+", ""));
        return m.find() ? m.group().toLowerCase(Locale.ROOT) : null;
    }

    /**
     * Maps free-text relationship wording onto the role vocabulary; unknown wording is
     * kept as written.
     */
    public static String normalizeRelationship(String value) {
        if (StringUtils.isBlank(value)) {
            return null;
        }
        String trimmed = value.trim();
        for (Map.Entry<Pattern, String> role : ROLES.entrySet()) {
            if (role.getKey().matcher(trimmed).find()) {
                return role.getValue();
            }
        }
        return trimmed.matches(".*[A-Za-z].*") ? NameHeuristics.normalizeCase(trimmed) : null;
    }

    /**
     * Removes leftover labels and joins address lines with ", ".
     */
    public static String cleanAddress(String value) {
        if (StringUtils.isBlank(value)) {
            return null;
        }
        String s = value
            .replaceAll("(?i)\\(?\\s*no\\s*P\\.?\\s*O\\.?\\s*box(es)?\\s*\\)?", " ")
            .replaceAll("(?i)\\b(mailing\\s+)?address(es)?\\s*:?", " ")
            .replaceAll("(?i)city\\s*/?\\s*,?\\s*state\\s*/?\\s*,?\\s*zip(\\s*code)?\\s*:?", ", ")
            .replaceAll("\\s*\\n\\s*", ", ")
            .replaceAll("\\s+", " ")
            .replaceAll("\\s*,\\s*(,\\s*)+", ", ")
            .replaceAll("\\s+,", ",")
            .trim();
        s = StringUtils.strip(s, " ,;:-");
        return s.matches(".*[A-Za-z0-9].*") ? s : null;
    }

    /**
     * Two ZIP codes, two street numbers around a separator, or two state names.
     */
    public static boolean looksLikeTwoAddresses(String value) {
        if (StringUtils.isBlank(value)) {
            return false;
        }
        if (count(ZIP, value) >= 2) {
            return true;
        }
        boolean separator = value.matches("(?s).*(\\s/\\s|;|\\s&\\s|\\sand\\s).*");
        if (separator && count(STREET_NUMBER, value) >= 2) {
            return true;
        }
        return count(STATE, value) >= 2;
    }

    private static int count(Pattern pattern, String value) {
        Matcher m = pattern.matcher(value);
        int n = 0;
        while (m.find()) {
            n++;
        }
        return n;
    }
}
