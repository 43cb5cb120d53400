package com.example.guardianintake.service.extraction;

import com.example.guardianintake.dto.DocumentType;
import com.example.guardianintake.dto.extraction.AnchorType;
import com.example.guardianintake.dto.extraction.ExtractedCase;
import com.example.guardianintake.dto.extraction.FieldCapture;
import com.example.guardianintake.dto.extraction.MissingReason;
import com.example.guardianintake.dto.extraction.SectionSpan;
import com.example.guardianintake.dto.extraction.SegmentedText;
import com.example.guardianintake.dto.extraction.WardIdentity;
import com.example.guardianintake.dto.rules.CorrectionScope;
import com.example.guardianintake.model.CaseField;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsing steps shared by both intake documents: page corrections, cause number and
 * ward name.
 */
public abstract class DocumentParser {

    private static final Pattern CAPTION = Pattern.compile(
        "(?i)In\\s+the\\s+(?:Matter\\s+of\\s+the\\s+)?Guardianship\\s+of(?:\\s+the)?"
        + "(?:\\s+(?:Person|Estate)(?:\\s+and\\s+(?:Person|Estate))?\\s+of)?[ \\t]*:?[ \\t]*([^\\n]*)(?:\\n[ \\t]*([^\\n]*))?");

    private static final Pattern COURT_TAIL = Pattern.compile("(?i)\\s*(?:§|\\bIn\\s+(?:the\\s+)?Probate\\s+Court\\b|\\bProbate\\s+Court\\b|\\bNo\\.\\s).*$");

    protected final CorrectionRuleApplier corrections;
    protected final SectionSegmenter segmenter;
    protected final FieldExtractor extractor;

    protected DocumentParser(CorrectionRuleApplier corrections, SectionSegmenter segmenter, FieldExtractor extractor) {
        this.corrections = corrections;
        this.segmenter = segmenter;
        this.extractor = extractor;
    }

    public abstract DocumentType getDocumentType();

    /**
     * Parses one page text into a case. Never throws on a missing field.
     *
     * @param causeNumberHint expected cause number, used only when the text yields none
     */
    public ExtractedCase parse(String rawText, String documentName, String engine, String causeNumberHint) {
        ProvenanceTracker tracker = new ProvenanceTracker(documentName, engine);
        ExtractedCase result = new ExtractedCase();
        result.setDocumentType(getDocumentType());
        result.setEngine(engine);

        CorrectionRuleApplier.Corrected page = corrections.applyToPage(rawText == null ? "" : rawText);
        result.setPageCorrections(new ArrayList<>(page.getFired()));
        String text = page.getValue();
        SegmentedText segmented = segmenter.segment(text);

        resolveCauseNumber(text, causeNumberHint, result, tracker);
        resolveWardName(text, segmented, result, tracker);
        parseBody(text, segmented, result, tracker);

        result.setProvenance(tracker.getFields());
        result.setNotes(tracker.getNotes());
        return result;
    }

    protected abstract void parseBody(String text, SegmentedText segmented, ExtractedCase result,
                                      ProvenanceTracker tracker);

    void resolveCauseNumber(String text, String hint, ExtractedCase result, ProvenanceTracker tracker) {
        Optional<String> found = CauseNumbers.find(text);
        if (found.isEmpty()) {
            CorrectionRuleApplier.Corrected digits = corrections.apply(text, CorrectionScope.CAUSE_NUMBER);
            found = CauseNumbers.find(digits.getValue());
            if (found.isPresent()) {
                tracker.note("cause number read after digit corrections " + digits.getFired());
            }
        }

        String normalizedHint = CauseNumbers.normalize(hint);
        if (found.isPresent()) {
            result.setCauseNumber(found.get());
            result.setCauseNumberSource(AnchorType.DOCUMENT);
            if (normalizedHint != null && !normalizedHint.equals(found.get())) {
                result.setCauseNumberMismatch(true);
                tracker.note("cause number " + found.get() + " differs from expected " + normalizedHint
                    + (CauseNumbers.nearMatch(found.get(), normalizedHint) ? " by one digit" : ""));
            }
        } else if (normalizedHint != null) {
            result.setCauseNumber(normalizedHint);
            result.setCauseNumberSource(AnchorType.HINT);
            tracker.note("cause number not found in text; using expected " + normalizedHint);
        } else {
            tracker.note("cause number not found");
        }
    }

    void resolveWardName(String text, SegmentedText segmented, ExtractedCase result, ProvenanceTracker tracker) {
        List<WardNameCandidate> candidates = new ArrayList<>();

        Optional<SectionSpan> wardSpan = segmented.ward();
        if (wardSpan.isPresent()) {
            Optional<FieldCapture> labelled = extractor.extract(text, wardSpan.get(), FieldSpecs.NAME);
            if (labelled.isPresent() && labelled.get().hasValue()) {
                addCandidate(candidates, labelled.get().getValue(), wardSpan.get().getAnchorType(),
                    wardSpan.get().getAnchorLabel(), labelled.get().getCorrections());
            }
        }

        Matcher caption = CAPTION.matcher(text);
        if (caption.find()) {
            String sameLine = COURT_TAIL.matcher(StringUtils.defaultString(caption.group(1))).replaceFirst("");
            String nextLine = COURT_TAIL.matcher(StringUtils.defaultString(caption.group(2))).replaceFirst("");
            String name = StringUtils.isNotBlank(sameLine) ? sameLine : nextLine;
            CorrectionRuleApplier.Corrected cleaned = corrections.applyToField(name, CorrectionScope.NAME);
            addCandidate(candidates, cleaned.getValue(), AnchorType.DOCUMENT, "In the Guardianship of",
                cleaned.getFired());
        }

        Optional<WardNameCandidate> best = candidates.stream()
            .max(Comparator.comparing((WardNameCandidate c) -> c.name.contains(","))
                .thenComparing(c -> -Math.abs(NameHeuristics.tokens(c.name).size() - 3))
                .thenComparing(c -> c.name.length()));

        WardIdentity ward = result.getWard();
        if (best.isEmpty()) {
            tracker.missing(CaseField.WARD_LAST, wardSpan.isPresent() ? MissingReason.LABEL_NOT_FOUND
                : MissingReason.SECTION_NOT_FOUND);
            tracker.missing(CaseField.WARD_FIRST, wardSpan.isPresent() ? MissingReason.LABEL_NOT_FOUND
                : MissingReason.SECTION_NOT_FOUND);
            return;
        }

        WardNameCandidate chosen = best.get();
        String[] parts = NameHeuristics.splitFirstMiddleLast(NameHeuristics.normalizeCase(chosen.name));
        ward.setFirstName(StringUtils.trimToNull(parts[0]));
        ward.setMiddleName(StringUtils.trimToNull(parts[1]));
        ward.setLastName(StringUtils.trimToNull(parts[2]));

        recordName(tracker, CaseField.WARD_FIRST, ward.getFirstName(), chosen);
        recordName(tracker, CaseField.WARD_MIDDLE, ward.getMiddleName(), chosen);
        recordName(tracker, CaseField.WARD_LAST, ward.getLastName(), chosen);
    }

    private void recordName(ProvenanceTracker tracker, CaseField field, String value, WardNameCandidate source) {
        if (value != null) {
            tracker.extracted(field, source.anchorType, source.anchorLabel, source.corrections);
        } else {
            tracker.missing(field, MissingReason.EMPTY_VALUE);
        }
    }

    private void addCandidate(List<WardNameCandidate> candidates, String raw, AnchorType anchorType,
                              String anchorLabel, List<String> fired) {
        String name = NameHeuristics.stripQualifiers(raw);
        if (NameHeuristics.looksLikeHumanName(name)) {
            candidates.add(new WardNameCandidate(name, anchorType, anchorLabel, fired));
        }
    }

    private static final class WardNameCandidate {
        private final String name;
        private final AnchorType anchorType;
        private final String anchorLabel;
        private final List<String> corrections;

        WardNameCandidate(String name, AnchorType anchorType, String anchorLabel, List<String> corrections) {
            this.name = name;
            this.anchorType = anchorType;
            this.anchorLabel = anchorLabel;
            this.corrections = corrections;
        }
    }
}
