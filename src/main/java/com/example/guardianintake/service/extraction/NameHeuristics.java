package com.example.guardianintake.service.extraction;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.text.WordUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Shape checks and splitting for personal names read off the forms.
 */
public final class NameHeuristics {

    private static final Pattern NEVER_NAME = Pattern.compile(
        "(?i)\\b(names?|address(es)?|city|state|zip|phone|tele(phone)?|cell|e-?mail|dob|date|birth|age"
        + "|relationship|guardians?(hip)?|ward|mother|father|parents?|son|daughter|sister|brother|spouse|wife"
        + "|husband|aunt|uncle|grand\\w*|cousin|friend|court|probate|county|texas|tx|austin|cause|order"
        + "|signed|judge|yes|no|none|n/a|same|above|information|section|application|review|placement"
        + "|reside|resides|with|the|of|for|filed|clerk|deputy|page)\\b");

    private static final Set<String> STREET_WORDS = new HashSet<>(Arrays.asList(
        "st", "street", "rd", "road", "dr", "drive", "ln", "lane", "ct", "ave", "avenue", "blvd",
        "boulevard", "pkwy", "parkway", "ter", "terrace", "pl", "place", "way", "loop", "trail", "trl",
        "pass", "cove", "cv", "cir", "circle", "hwy", "highway", "box", "apt", "suite", "ste"));

    private static final Set<String> SUFFIXES = new HashSet<>(Arrays.asList(
        "jr", "sr", "ii", "iii", "iv", "v"));

    private static final Pattern NAME_TOKEN = Pattern.compile("[A-Za-z][A-Za-z'\\-.]*");

    private static final Pattern QUALIFIER_TAIL = Pattern.compile(
        "(?i)[,\\s]*\\b(an?\\s+)?(alleged\\s+)?(incapacitated\\s+(person|adult)|minor|adult)\\b.*$");

    private static final Pattern QUALIFIER_HEAD = Pattern.compile(
        "(?i)^\\s*(the\\s+)?((person\\s+and\\s+)?estate\\s+of|person\\s+of)\\s+");

    private NameHeuristics() {
    }

    /**
     * True for one to four alphabetic words that are capitalized like a name and are not
     * form vocabulary or street words.
     */
    public static boolean looksLikeHumanName(String value) {
        if (StringUtils.isBlank(value)) {
            return false;
        }
        String s = value.trim().replaceAll("\\s+", " ");
        if (s.matches(".*[\\d@#$%^*=+<>\\[\\]{}|\\\\/:;_].*")) {
            return false;
        }
        if (NEVER_NAME.matcher(s).find()) {
            return false;
        }

        List<String> tokens = tokens(s);
        if (tokens.isEmpty() || tokens.size() > 4) {
            return false;
        }

        int capitalized = 0;
        for (String token : tokens) {
            if (!NAME_TOKEN.matcher(token).matches()) {
                return false;
            }
            String bare = StringUtils.stripEnd(token, ".").toLowerCase(Locale.ROOT);
            if (STREET_WORDS.contains(bare)) {
                return false;
            }
            if (Character.isUpperCase(token.charAt(0))) {
                capitalized++;
            }
        }
        if (tokens.size() == 1) {
            return capitalized == 1 && tokens.get(0).length() >= 2;
        }
        return capitalized >= 2;
    }

    /**
     * Drops "an incapacitated person", "a minor", "estate of" and similar captions.
     */
    public static String stripQualifiers(String name) {
        if (name == null) {
            return null;
        }
        String s = QUALIFIER_HEAD.matcher(name).replaceFirst("");
        s = QUALIFIER_TAIL.matcher(s).replaceFirst("");
        return s.replaceAll("\\s+", " ").trim();
    }

    /**
     * Title-cases all-caps or all-lower names; mixed case is left alone.
     */
    public static String normalizeCase(String name) {
        if (StringUtils.isBlank(name)) {
            return name;
        }
        String trimmed = name.trim().replaceAll("\\s+", " ");
        if (trimmed.equals(trimmed.toUpperCase(Locale.ROOT)) || trimmed.equals(trimmed.toLowerCase(Locale.ROOT))) {
            return WordUtils.capitalizeFully(trimmed, ' ', '-', '\'');
        }
        return trimmed;
    }

    /**
     * Splits a full name into first, middle and last. Handles "Last, First Middle"
     * and keeps generational suffixes with the last name.
     */
    public static String[] splitFirstMiddleLast(String fullName) {
        String[] parts = {"", "", ""};
        if (StringUtils.isBlank(fullName)) {
            return parts;
        }
        String s = fullName.trim().replaceAll("\\s+", " ");

        String suffix = "";
        List<String> tokens;
        if (s.contains(",")) {
            String last = s.substring(0, s.indexOf(',')).trim();
            List<String> rest = tokens(s.substring(s.indexOf(',') + 1));
            if (!rest.isEmpty() && isSuffix(rest.get(0))) {
                // "Smith, Jr., John"
                suffix = rest.remove(0);
            }
            if (!rest.isEmpty() && isSuffix(rest.get(rest.size() - 1))) {
                suffix = rest.remove(rest.size() - 1);
            }
            tokens = new ArrayList<>(rest);
            tokens.add(last);
        } else {
            tokens = tokens(s);
            if (tokens.size() > 1 && isSuffix(tokens.get(tokens.size() - 1))) {
                suffix = tokens.remove(tokens.size() - 1);
            }
        }

        if (tokens.isEmpty()) {
            return parts;
        }
        if (tokens.size() == 1) {
            parts[0] = tokens.get(0);
        } else {
            parts[0] = tokens.get(0);
            parts[2] = tokens.get(tokens.size() - 1);
            parts[1] = String.join(" ", tokens.subList(1, tokens.size() - 1));
        }
        if (!suffix.isEmpty()) {
            parts[2] = (parts[2] + " " + suffix).trim();
        }
        return parts;
    }

    /**
     * Last word of a name, ignoring generational suffixes.
     */
    public static String surnameOf(String fullName) {
        List<String> tokens = tokens(fullName == null ? "" : fullName);
        while (tokens.size() > 1 && isSuffix(tokens.get(tokens.size() - 1))) {
            tokens.remove(tokens.size() - 1);
        }
        return tokens.isEmpty() ? "" : tokens.get(tokens.size() - 1);
    }

    static boolean isSuffix(String token) {
        return SUFFIXES.contains(StringUtils.strip(token, ".,").toLowerCase(Locale.ROOT));
    }

    static List<String> tokens(String s) {
        List<String> result = new ArrayList<>();
        for (String token : s.replace(",", " ").trim().split("\\s+")) {
            if (!token.isEmpty()) {
                result.add(token);
            }
        }
        return result;
    }
}
