package com.example.guardianintake.service.extraction;

import com.example.guardianintake.dto.extraction.FieldShape;
import com.example.guardianintake.dto.extraction.SplitResult;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decides whether a captured value holds one guardian's data or two. Pure: no I/O and
 * no state beyond the separator list it was built with.
 */
public class DualSubjectSplitter {

    private static final String ADJACENT_PUNCTUATION = "[\\s;,:]*";

    private static final Pattern DATE_TOKEN = Pattern.compile(
        "\\d{1,2}[-/.]\\d{1,2}[-/.](?:\\d{4}|\\d{2})"
        + "|(?i:(?:jan|feb|mar|apr|may|jun|jul|aug|sep|oct|nov|dec)[a-z]*\\.?\\s+\\d{1,2},?\\s+\\d{4})");

    private static final Pattern PHONE_TOKEN = Pattern.compile("(?:\\b1[\\s.\\-]*)?\\(?\\d{3}\\)?[\\s.\\-]*\\d{3}[\\s.\\-]*\\d{4}\\b");

    private static final Pattern EMAIL_TOKEN = Pattern.compile("[A-Za-z0-9._%+\\-]+@[A-Za-z0-9.\\-]+\\.[A-Za-z]{2,}");

    private static final Pattern ZIP_CODE = Pattern.compile("\\b\\d{5}(?:-\\d{4})?\\b");

    private final Map<String, Pattern> separators = new LinkedHashMap<>();

    public DualSubjectSplitter(List<String> separatorPriority) {
        for (String separator : separatorPriority) {
            separators.put(separator, separatorPattern(separator));
        }
    }

    /**
     * @param raw the captured value
     * @param shape the field's value shape
     * @param knownSecondaryName the secondary guardian's name was already found elsewhere,
     *                           so a name value is not split
     */
    public SplitResult split(String raw, FieldShape shape, boolean knownSecondaryName) {
        if (StringUtils.isBlank(raw)) {
            return SplitResult.single("");
        }
        String value = raw.trim();

        if (shape == FieldShape.NAME && knownSecondaryName) {
            return SplitResult.single(value);
        }

        switch (shape) {
            case DATE:
                return splitByToken(value, DATE_TOKEN);
            case PHONE:
                return splitByToken(value, PHONE_TOKEN);
            case EMAIL:
                return splitByToken(value, EMAIL_TOKEN);
            case ADDRESS:
                return splitAddress(value);
            default:
                return splitBySeparator(value);
        }
    }

    /**
     * Values with a recognizable token shape are split on the tokens themselves, since
     * a date like 7/22/60 contains the slash separator.
     */
    private SplitResult splitByToken(String value, Pattern token) {
        Matcher m = token.matcher(value);
        List<String> found = new ArrayList<>();
        List<int[]> positions = new ArrayList<>();
        while (m.find() && found.size() < 2) {
            found.add(m.group().trim());
            positions.add(new int[] {m.start(), m.end()});
        }
        if (found.size() == 2) {
            String between = value.substring(positions.get(0)[1], positions.get(1)[0]).trim();
            return SplitResult.pair(found.get(0), found.get(1), between.isEmpty() ? " " : between, List.of());
        }
        if (found.size() == 1) {
            return SplitResult.single(found.get(0));
        }
        return splitBySeparator(value);
    }

    private SplitResult splitAddress(String value) {
        if (!ValueNormalizer.looksLikeTwoAddresses(value)) {
            return SplitResult.single(value);
        }
        Matcher zips = ZIP_CODE.matcher(value);
        if (zips.find()) {
            int cut = zips.end();
            String left = value.substring(0, cut).trim();
            String right = StringUtils.stripStart(value.substring(cut), " ,;/&").trim();
            right = right.replaceFirst("(?i)^and\\s+", "");
            if (!right.isEmpty() && ZIP_CODE.matcher(right).find()) {
                return SplitResult.pair(left, right, "zip", List.of());
            }
        }
        return splitBySeparator(value);
    }

    /**
     * Splits on the first occurrence of the highest-priority separator present. Punctuation
     * touching the separator is consumed with it.
     */
    SplitResult splitBySeparator(String value) {
        for (Map.Entry<String, Pattern> entry : separators.entrySet()) {
            Matcher m = entry.getValue().matcher(value);
            if (!m.find()) {
                continue;
            }
            String left = strip(value.substring(0, m.start()));
            String right = strip(value.substring(m.end()));
            if (left.isEmpty() || right.isEmpty()) {
                return SplitResult.unresolved(value, entry.getKey());
            }
            return SplitResult.pair(left, right, entry.getKey(), otherSeparators(entry.getKey(), left + " " + right));
        }
        return SplitResult.single(strip(value));
    }

    private List<String> otherSeparators(String used, String remainder) {
        List<String> others = new ArrayList<>();
        for (Map.Entry<String, Pattern> entry : separators.entrySet()) {
            if (!entry.getKey().equals(used) && entry.getValue().matcher(remainder).find()) {
                others.add(entry.getKey());
            }
        }
        return others;
    }

    private static Pattern separatorPattern(String separator) {
        String quoted = Pattern.quote(separator);
        if (separator.chars().allMatch(Character::isLetter)) {
            return Pattern.compile(ADJACENT_PUNCTUATION + "\\b" + quoted + "\\b" + ADJACENT_PUNCTUATION,
                Pattern.CASE_INSENSITIVE);
        }
        return Pattern.compile(ADJACENT_PUNCTUATION + quoted + ADJACENT_PUNCTUATION);
    }

    private static String strip(String s) {
        return StringUtils.strip(s.trim(), " ;,:");
    }
}
