package com.example.guardianintake.service.extraction;

import com.example.guardianintake.dto.DocumentType;
import com.example.guardianintake.dto.extraction.AnchorType;
import com.example.guardianintake.dto.extraction.ExtractedCase;
import com.example.guardianintake.dto.extraction.FieldCapture;
import com.example.guardianintake.dto.extraction.FieldShape;
import com.example.guardianintake.dto.extraction.FieldSpec;
import com.example.guardianintake.dto.extraction.GuardianIdentity;
import com.example.guardianintake.dto.extraction.MissingReason;
import com.example.guardianintake.dto.extraction.SectionSpan;
import com.example.guardianintake.dto.extraction.SegmentedText;
import com.example.guardianintake.dto.extraction.SplitResult;
import com.example.guardianintake.dto.extraction.WardIdentity;
import com.example.guardianintake.dto.rules.ExtractionRules;
import com.example.guardianintake.model.CaseField;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the Application for Review of Placement: ward details, up to two guardians,
 * the lives-with answer and the filing stamp.
 */
public class IntakeFormParser extends DocumentParser {

    static final String MIRRORED_ADDRESS = "mirrored-primary-address";
    static final String SHARED_SURNAME = "shared-surname";

    // "Michael and Joslyn Mogonye": both guardians carry the last name
    private static final Pattern FIRST_AND_FULL_NAME = Pattern.compile(
        "^\\s*([A-Z][a-z]+)\\s+(?:&|and)\\s+([A-Z][a-z]+)\\s+([A-Z][A-Za-z'\\-]+)\\s*$");

    private static final Pattern LIVES_WITH = Pattern.compile(
        "(?is)(?:reside|live)s?\\s+with\\s+(?:the\\s+)?ward\\??(.{0,60})");

    private static final Pattern CHECKED_BEFORE = Pattern.compile(
        "(?i)(?:\\[\\s*[x✓✔]\\s*\\]|☒|☑|\\(\\s*x\\s*\\)|\\bx\\b)\\s*(yes|no)\\b");

    private static final Pattern CHECKED_AFTER = Pattern.compile(
        "(?i)\\b(yes|no)\\s*(?:\\[\\s*[x✓✔]\\s*\\]|☒|☑|\\(\\s*x\\s*\\))");

    private static final Pattern YES_OR_NO = Pattern.compile("(?i)\\b(yes|no)\\b");

    private final DualSubjectSplitter splitter;
    private final List<String> coResidencySignals;

    public IntakeFormParser(CorrectionRuleApplier corrections, SectionSegmenter segmenter, FieldExtractor extractor,
                            DualSubjectSplitter splitter, ExtractionRules rules) {
        super(corrections, segmenter, extractor);
        this.splitter = splitter;
        this.coResidencySignals = rules.getCoResidencySignals();
    }

    @Override
    public DocumentType getDocumentType() {
        return DocumentType.ARP;
    }

    @Override
    protected void parseBody(String text, SegmentedText segmented, ExtractedCase result, ProvenanceTracker tracker) {
        parseWardDetails(text, segmented.ward().orElse(null), result.getWard(), tracker);
        parseGuardians(text, segmented.guardian().orElse(null), result, tracker);
        parseLivesWith(text, result, tracker);

        Optional<String> filed = DocumentDates.findFiledDate(text);
        if (filed.isPresent()) {
            result.setDateArpFiled(filed.get());
            tracker.extracted(CaseField.DATE_ARP_FILED, AnchorType.DOCUMENT, "Filed", List.of());
        } else {
            tracker.missing(CaseField.DATE_ARP_FILED, MissingReason.LABEL_NOT_FOUND);
        }
    }

    private void parseWardDetails(String text, SectionSpan span, WardIdentity ward, ProvenanceTracker tracker) {
        if (span == null) {
            tracker.missing(CaseField.WARD_DOB, MissingReason.SECTION_NOT_FOUND);
            tracker.missing(CaseField.WARD_PHONE, MissingReason.SECTION_NOT_FOUND);
            tracker.missing(CaseField.WARD_ADDRESS, MissingReason.SECTION_NOT_FOUND);
            return;
        }
        single(text, span, FieldSpecs.DATE_OF_BIRTH, ValueNormalizer::normalizeDate, CaseField.WARD_DOB,
            ward::setDateOfBirth, tracker);
        single(text, span, FieldSpecs.PHONE, ValueNormalizer::normalizePhone, CaseField.WARD_PHONE,
            ward::setPhone, tracker);

        Optional<String> address = rawAddress(text, span, new ArrayList<>());
        String cleaned = address.map(ValueNormalizer::cleanAddress).orElse(null);
        if (cleaned != null) {
            ward.setAddress(cleaned);
            tracker.extracted(CaseField.WARD_ADDRESS, span.getAnchorType(), span.getAnchorLabel(), List.of());
        } else {
            tracker.missing(CaseField.WARD_ADDRESS, address.isPresent() ? MissingReason.EMPTY_VALUE
                : MissingReason.LABEL_NOT_FOUND);
        }
    }

    private void parseGuardians(String text, SectionSpan span, ExtractedCase result, ProvenanceTracker tracker) {
        GuardianIdentity primary = result.getPrimaryGuardian();
        GuardianIdentity secondary = result.getSecondaryGuardian();
        if (span == null) {
            for (CaseField field : guardianFields()) {
                tracker.missing(field, MissingReason.SECTION_NOT_FOUND);
            }
            return;
        }
        String section = span.slice(text);
        String wardSurname = result.getWard().getLastName();

        parseGuardianNames(text, span, section, wardSurname, primary, secondary, tracker);

        shared(text, span, FieldSpecs.DATE_OF_BIRTH, ValueNormalizer::normalizeDate,
            CaseField.GUARDIAN1_DOB, primary::setDateOfBirth, CaseField.GUARDIAN2_DOB, secondary::setDateOfBirth,
            tracker);
        shared(text, span, FieldSpecs.PHONE, ValueNormalizer::normalizePhone,
            CaseField.GUARDIAN1_PHONE, primary::setPhone, CaseField.GUARDIAN2_PHONE, secondary::setPhone, tracker);
        shared(text, span, FieldSpecs.EMAIL, ValueNormalizer::normalizeEmail,
            CaseField.GUARDIAN1_EMAIL, primary::setEmail, CaseField.GUARDIAN2_EMAIL, secondary::setEmail, tracker);
        shared(text, span, FieldSpecs.RELATIONSHIP, ValueNormalizer::normalizeRelationship,
            CaseField.GUARDIAN1_RELATIONSHIP, primary::setRelationship,
            CaseField.GUARDIAN2_RELATIONSHIP, secondary::setRelationship, tracker);

        parseGuardianAddresses(text, span, section, primary, secondary, tracker);
    }

    private void parseGuardianNames(String text, SectionSpan span, String section, String wardSurname,
                                    GuardianIdentity primary, GuardianIdentity secondary, ProvenanceTracker tracker) {
        Optional<FieldCapture> capture = extractor.extract(text, span, FieldSpecs.NAME);
        Optional<String> preAnchor = preAnchorName(section);

        List<String> primaryCorrections = new ArrayList<>();
        List<String> secondaryCorrections = new ArrayList<>();
        capture.ifPresent(c -> primaryCorrections.addAll(c.getCorrections()));
        String value = capture.filter(FieldCapture::hasValue).map(FieldCapture::getValue).orElse(null);

        String primaryName = null;
        String secondaryName = null;
        AnchorType secondaryAnchor = span.getAnchorType();
        String secondaryLabel = span.getAnchorLabel();

        if (preAnchor.isPresent()) {
            secondaryName = preAnchor.get();
            secondaryAnchor = AnchorType.SHAPE_HEURISTIC;
            secondaryLabel = "name line above Name(s)";
            if (value != null) {
                primaryName = splitter.split(value, FieldShape.NAME, true).getPrimary();
                tracker.note("secondary guardian name '" + secondaryName + "' found above the Name(s) label");
            } else {
                // blank Name(s) line: the name above it is the only guardian
                primaryName = secondaryName;
                secondaryName = null;
                primaryCorrections.clear();
            }
        } else if (value != null) {
            Matcher shared = FIRST_AND_FULL_NAME.matcher(value);
            if (shared.matches()) {
                primaryName = shared.group(1) + " " + shared.group(3);
                secondaryName = shared.group(2) + " " + shared.group(3);
                primaryCorrections.add(SHARED_SURNAME);
                secondaryCorrections.add(SHARED_SURNAME);
            } else {
                SplitResult split = splitter.split(value, FieldShape.NAME,
                    false);
                logAmbiguity(tracker, "guardian name", split);
                if (split.getKind() == SplitResult.Kind.UNRESOLVED) {
                    primaryName = value.replaceAll("(?i)^\\s*(and|&)\\s+|\\s+(and|&)\\s*$", "").trim();
                    tracker.note("guardian name '" + value + "' has a dangling '" + split.getSeparator()
                        + "'; kept as one name");
                } else {
                    primaryName = split.getPrimary();
                    secondaryName = split.getSecondary();
                }
            }
        }

        primaryName = finishName(primaryName, wardSurname, section, primaryCorrections);
        secondaryName = finishName(secondaryName, wardSurname, section, secondaryCorrections);

        if (primaryName != null) {
            primary.setName(primaryName);
            tracker.extracted(CaseField.GUARDIAN1_NAME, span.getAnchorType(), span.getAnchorLabel(),
                primaryCorrections);
        } else {
            tracker.missing(CaseField.GUARDIAN1_NAME, capture.isPresent() ? MissingReason.EMPTY_VALUE
                : MissingReason.LABEL_NOT_FOUND);
        }
        if (secondaryName != null) {
            secondary.setName(secondaryName);
            tracker.extracted(CaseField.GUARDIAN2_NAME, secondaryAnchor, secondaryLabel, secondaryCorrections);
        } else {
            tracker.missing(CaseField.GUARDIAN2_NAME, MissingReason.NOT_ON_DOCUMENT);
        }
    }

    private String finishName(String name, String wardSurname, String evidence, List<String> fired) {
        if (StringUtils.isBlank(name)) {
            return null;
        }
        String cleaned = NameHeuristics.normalizeCase(NameHeuristics.stripQualifiers(name));
        if (StringUtils.isBlank(cleaned) || !cleaned.matches(".*[A-Za-z].*")) {
            return null;
        }
        FieldExtractor.SurnameCheck check = extractor.correctSurname(cleaned, wardSurname, evidence);
        if (check.isCorrected()) {
            fired.add(FieldExtractor.SURNAME_RULE);
        }
        return check.getName();
    }

    /**
     * A name-shaped line sitting directly above the "Name(s)" label line.
     */
    Optional<String> preAnchorName(String section) {
        String[] lines = section.split("\n");
        String previous = null;
        for (String line : lines) {
            if (line.isBlank()) {
                continue;
            }
            if (previous != null && segmenter.startsWithLabel(line, "Name(s)")
                && NameHeuristics.looksLikeHumanName(previous.trim())) {
                return Optional.of(previous.trim());
            }
            previous = line;
        }
        return Optional.empty();
    }

    private void parseGuardianAddresses(String text, SectionSpan span, String section, GuardianIdentity primary,
                                        GuardianIdentity secondary, ProvenanceTracker tracker) {
        List<String> fired = new ArrayList<>();
        Optional<String> raw = rawAddress(text, span, fired);
        if (raw.isEmpty()) {
            tracker.missing(CaseField.GUARDIAN1_ADDRESS, MissingReason.LABEL_NOT_FOUND);
            tracker.missing(CaseField.GUARDIAN2_ADDRESS, MissingReason.LABEL_NOT_FOUND);
            return;
        }

        SplitResult split = splitter.split(raw.get(), FieldShape.ADDRESS,
            false);
        String first = ValueNormalizer.cleanAddress(split.getPrimary());
        String second = split.isPair() ? ValueNormalizer.cleanAddress(split.getSecondary()) : null;

        if (first != null) {
            primary.setAddress(first);
            tracker.extracted(CaseField.GUARDIAN1_ADDRESS, span.getAnchorType(), span.getAnchorLabel(), fired);
        } else {
            tracker.missing(CaseField.GUARDIAN1_ADDRESS, MissingReason.EMPTY_VALUE);
        }

        if (second != null) {
            secondary.setAddress(second);
            tracker.extracted(CaseField.GUARDIAN2_ADDRESS, span.getAnchorType(), span.getAnchorLabel(), fired);
        } else if (first != null && secondary.hasName() && hasCoResidencySignal(section)) {
            secondary.setAddress(first);
            List<String> mirrored = new ArrayList<>(fired);
            mirrored.add(MIRRORED_ADDRESS);
            tracker.extracted(CaseField.GUARDIAN2_ADDRESS, span.getAnchorType(), span.getAnchorLabel(), mirrored);
        } else {
            tracker.missing(CaseField.GUARDIAN2_ADDRESS, MissingReason.NOT_ON_DOCUMENT);
        }
    }

    boolean hasCoResidencySignal(String section) {
        String flat = section.toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
        for (String signal : coResidencySignals) {
            if (flat.contains(signal.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    /**
     * Street line plus the City/State/Zip line, still unnormalized.
     */
    private Optional<String> rawAddress(String text, SectionSpan span, List<String> fired) {
        Optional<FieldCapture> street = extractor.extract(text, span, FieldSpecs.ADDRESS);
        Optional<FieldCapture> city = extractor.extract(text, span, FieldSpecs.CITY_STATE_ZIP);
        if (street.isEmpty() && city.isEmpty()) {
            return Optional.empty();
        }
        StringBuilder combined = new StringBuilder();
        street.filter(FieldCapture::hasValue).ifPresent(c -> {
            combined.append(c.getValue());
            fired.addAll(c.getCorrections());
        });
        city.filter(FieldCapture::hasValue).ifPresent(c -> {
            if (combined.length() > 0) {
                combined.append(", ");
            }
            combined.append(c.getValue());
            fired.addAll(c.getCorrections());
        });
        return Optional.of(combined.toString());
    }

    private void parseLivesWith(String text, ExtractedCase result, ProvenanceTracker tracker) {
        Matcher question = LIVES_WITH.matcher(text);
        if (!question.find()) {
            tracker.missing(CaseField.LIVES_WITH, MissingReason.LABEL_NOT_FOUND);
            return;
        }
        String answerArea = question.group(1);
        String answer = null;
        for (Pattern marked : new Pattern[] {CHECKED_BEFORE, CHECKED_AFTER}) {
            Matcher m = marked.matcher(answerArea);
            if (m.find()) {
                answer = m.group(1);
                break;
            }
        }
        if (answer == null) {
            // a lone YES or NO with the other option struck out or missing
            Matcher plain = YES_OR_NO.matcher(answerArea);
            List<String> words = new ArrayList<>();
            while (plain.find()) {
                words.add(plain.group(1).toLowerCase(Locale.ROOT));
            }
            if (words.size() == 1) {
                answer = words.get(0);
            }
        }
        if (answer == null) {
            tracker.missing(CaseField.LIVES_WITH, MissingReason.EMPTY_VALUE);
            return;
        }
        result.setLivesWith(StringUtils.capitalize(answer.toLowerCase(Locale.ROOT)));
        tracker.extracted(CaseField.LIVES_WITH, AnchorType.DOCUMENT, "reside with the ward", List.of());
    }

    private void single(String text, SectionSpan span, FieldSpec spec, Function<String, String> normalizer,
                        CaseField field, Consumer<String> setter, ProvenanceTracker tracker) {
        Optional<FieldCapture> capture = extractor.extract(text, span, spec);
        if (capture.isEmpty()) {
            tracker.missing(field, MissingReason.LABEL_NOT_FOUND);
            return;
        }
        if (!capture.get().hasValue()) {
            tracker.missing(field, MissingReason.EMPTY_VALUE);
            return;
        }
        SplitResult split = splitter.split(capture.get().getValue(), spec.getShape(), false);
        String value = normalizer.apply(split.getPrimary());
        if (value == null) {
            tracker.missing(field, MissingReason.INVALID_SHAPE);
            return;
        }
        setter.accept(value);
        tracker.extracted(field, span.getAnchorType(), span.getAnchorLabel(), capture.get().getCorrections());
    }

    /**
     * A field that may carry both guardians' values in one cell.
     */
    private void shared(String text, SectionSpan span, FieldSpec spec, Function<String, String> normalizer,
                        CaseField primaryField, Consumer<String> primarySetter,
                        CaseField secondaryField, Consumer<String> secondarySetter,
                        ProvenanceTracker tracker) {
        Optional<FieldCapture> capture = extractor.extract(text, span, spec);
        if (capture.isEmpty() || !capture.get().hasValue()) {
            MissingReason reason = capture.isEmpty() ? MissingReason.LABEL_NOT_FOUND : MissingReason.EMPTY_VALUE;
            tracker.missing(primaryField, reason);
            tracker.missing(secondaryField, reason);
            return;
        }

        SplitResult split = splitter.split(capture.get().getValue(), spec.getShape(), false);
        logAmbiguity(tracker, spec.getName(), split);
        List<String> fired = capture.get().getCorrections();

        assign(normalizer.apply(split.getPrimary()), primaryField, primarySetter, span, fired, tracker);
        if (split.isPair()) {
            assign(normalizer.apply(split.getSecondary()), secondaryField, secondarySetter, span, fired, tracker);
        } else {
            tracker.missing(secondaryField, MissingReason.NOT_ON_DOCUMENT);
        }
    }

    private void assign(String value, CaseField field, Consumer<String> setter, SectionSpan span,
                        List<String> fired, ProvenanceTracker tracker) {
        if (value == null) {
            tracker.missing(field, MissingReason.INVALID_SHAPE);
            return;
        }
        setter.accept(value);
        tracker.extracted(field, span.getAnchorType(), span.getAnchorLabel(), fired);
    }

    private void logAmbiguity(ProvenanceTracker tracker, String what, SplitResult split) {
        if (split.isAmbiguous()) {
            tracker.note(what + " split on '" + split.getSeparator() + "' (also saw " + split.getOtherSeparators() + ")");
        }
    }

    private static CaseField[] guardianFields() {
        return new CaseField[] {
            CaseField.GUARDIAN1_NAME, CaseField.GUARDIAN1_DOB, CaseField.GUARDIAN1_PHONE, CaseField.GUARDIAN1_EMAIL,
            CaseField.GUARDIAN1_RELATIONSHIP, CaseField.GUARDIAN1_ADDRESS,
            CaseField.GUARDIAN2_NAME, CaseField.GUARDIAN2_DOB, CaseField.GUARDIAN2_PHONE, CaseField.GUARDIAN2_EMAIL,
            CaseField.GUARDIAN2_RELATIONSHIP, CaseField.GUARDIAN2_ADDRESS
        };
    }
}
