package com.example.guardianintake.service.extraction;

import com.example.guardianintake.dto.extraction.FieldCapture;
import com.example.guardianintake.dto.extraction.FieldSpec;
import com.example.guardianintake.dto.extraction.SectionSpan;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.text.similarity.LevenshteinDistance;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Label-anchored capture of a single field inside a section, followed by correction
 * rules and punctuation cleanup. Two-person values are captured whole; splitting them
 * is the splitter's job.
 */
public class FieldExtractor {

    public static final String SURNAME_RULE = "surname-matches-ward";

    private final CorrectionRuleApplier corrections;
    private final List<FieldSpec> knownLabels;
    private final int surnameMaxEditDistance;

    public FieldExtractor(CorrectionRuleApplier corrections, List<FieldSpec> knownLabels, int surnameMaxEditDistance) {
        this.corrections = corrections;
        this.knownLabels = List.copyOf(knownLabels);
        this.surnameMaxEditDistance = surnameMaxEditDistance;
    }

    /**
     * Captures and cleans {@code spec} inside {@code span}.
     *
     * @return empty when the label is absent; a capture without a value when the label
     *         is there but nothing follows it
     */
    public Optional<FieldCapture> extract(String text, SectionSpan span, FieldSpec spec) {
        if (span == null || span.isEmpty()) {
            return Optional.empty();
        }
        String section = span.slice(text);
        Matcher label = spec.getLabel().matcher(section);
        if (!label.find()) {
            return Optional.empty();
        }

        String raw = captureAfter(section, label.end(), spec.getMaxLines());
        FieldCapture capture = new FieldCapture(spec.getName(), raw, null, span.getStart() + label.start(),
            new ArrayList<>());
        if (StringUtils.isBlank(raw)) {
            return Optional.of(capture);
        }

        CorrectionRuleApplier.Corrected corrected = corrections.applyToField(raw, spec.getScope());
        capture.setValue(corrected.getValue());
        capture.getCorrections().addAll(corrected.getFired());
        return Optional.of(capture);
    }

    /**
     * Text from {@code from} up to the next known label, at most {@code maxLines} lines.
     * A label with nothing after it on its own line takes its value from the next line.
     */
    String captureAfter(String section, int from, int maxLines) {
        int start = from;
        int firstBreak = section.indexOf('\n', start);
        String restOfLine = firstBreak < 0 ? section.substring(start) : section.substring(start, firstBreak);
        if (restOfLine.isBlank() && firstBreak >= 0) {
            start = firstBreak + 1;
        }

        int end = start;
        int lines = 0;
        while (end < section.length() && lines < maxLines) {
            int next = section.indexOf('\n', end);
            end = next < 0 ? section.length() : next + 1;
            lines++;
        }
        end = Math.min(end, nextLabel(section, start));
        return section.substring(start, Math.max(start, end)).replaceAll("\\s*\\n\\s*", "\n").trim();
    }

    private int nextLabel(String section, int from) {
        int earliest = section.length();
        for (FieldSpec spec : knownLabels) {
            Matcher m = spec.getLabel().matcher(section);
            if (m.find(from) && m.start() < earliest) {
                earliest = m.start();
            }
        }
        return earliest;
    }

    /**
     * Replaces a guardian's surname with the ward's spelling when the two have the same length,
     * differ by substituted letters within the configured edit distance, and nothing in
     * {@code evidence} spells the guardian's version a second time. Added or dropped letters
     * ("Parks", "Par") make a different surname and are left alone.
     */
    public SurnameCheck correctSurname(String guardianName, String wardSurname, String evidence) {
        if (StringUtils.isAnyBlank(guardianName, wardSurname)) {
            return new SurnameCheck(guardianName, false);
        }
        String surname = NameHeuristics.surnameOf(guardianName);
        if (surname.isEmpty() || surname.equalsIgnoreCase(wardSurname) || surname.length() < 3) {
            return new SurnameCheck(guardianName, false);
        }
        if (surname.length() != wardSurname.length()
            || Character.toLowerCase(surname.charAt(0)) != Character.toLowerCase(wardSurname.charAt(0))) {
            return new SurnameCheck(guardianName, false);
        }

        int distance = LevenshteinDistance.getDefaultInstance().apply(
            surname.toLowerCase(Locale.ROOT), wardSurname.toLowerCase(Locale.ROOT));
        if (distance > surnameMaxEditDistance) {
            return new SurnameCheck(guardianName, false);
        }
        if (occurrences(evidence, surname) > 1) {
            // the same spelling written twice is deliberate, not a misread
            return new SurnameCheck(guardianName, false);
        }

        int at = guardianName.lastIndexOf(surname);
        String corrected = guardianName.substring(0, at) + wardSurname + guardianName.substring(at + surname.length());
        return new SurnameCheck(corrected, true);
    }

    private static int occurrences(String text, String word) {
        if (text == null) {
            return 0;
        }
        Matcher m = Pattern.compile("\\b" + Pattern.quote(word) + "\\b", Pattern.CASE_INSENSITIVE).matcher(text);
        int count = 0;
        while (m.find()) {
            count++;
        }
        return count;
    }

    public static final class SurnameCheck {
        private final String name;
        private final boolean corrected;

        public SurnameCheck(String name, boolean corrected) {
            this.name = name;
            this.corrected = corrected;
        }

        public String getName() {
            return name;
        }

        public boolean isCorrected() {
            return corrected;
        }
    }
}
