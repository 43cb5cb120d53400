package com.example.guardianintake.service.extraction;

import com.example.guardianintake.dto.DocumentType;
import com.example.guardianintake.dto.extraction.AnchorType;
import com.example.guardianintake.dto.extraction.ExtractedCase;
import com.example.guardianintake.dto.extraction.MissingReason;
import com.example.guardianintake.dto.extraction.SegmentedText;
import com.example.guardianintake.model.CaseField;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the court's order appointing a guardian. The order carries the cause number,
 * the ward's caption name, the appointment date and usually the appointed guardian.
 */
public class CourtOrderParser extends DocumentParser {

    private static final Pattern APPOINTED = Pattern.compile(
        "(?i)\\bappoint(?:s|ed)?\\s+([A-Z][A-Za-z'.\\-]+(?:\\s+[A-Z][A-Za-z'.\\-]+){1,3})\\s*,?\\s+"
        + "(?:is\\s+|be\\s+)?(?:hereby\\s+)?(?:appointed\\s+)?as\\s+(?:the\\s+)?(?:permanent\\s+|temporary\\s+)?Guardian");

    public CourtOrderParser(CorrectionRuleApplier corrections, SectionSegmenter segmenter, FieldExtractor extractor) {
        super(corrections, segmenter, extractor);
    }

    @Override
    public DocumentType getDocumentType() {
        return DocumentType.ORDER;
    }

    @Override
    protected void parseBody(String text, SegmentedText segmented, ExtractedCase result, ProvenanceTracker tracker) {
        Optional<String> signed = DocumentDates.findSignedDate(text);
        if (signed.isPresent()) {
            result.setDateAppointed(signed.get());
            tracker.extracted(CaseField.DATE_APPOINTED, AnchorType.DOCUMENT, "Signed", List.of());
        } else {
            tracker.missing(CaseField.DATE_APPOINTED, MissingReason.LABEL_NOT_FOUND);
        }

        Optional<String> guardian = appointedGuardian(text);
        if (guardian.isPresent()) {
            result.getPrimaryGuardian().setName(guardian.get());
            tracker.extracted(CaseField.GUARDIAN1_NAME, AnchorType.DOCUMENT, "appoints ... as Guardian", List.of());
        } else {
            tracker.missing(CaseField.GUARDIAN1_NAME, MissingReason.NOT_ON_DOCUMENT);
        }
    }

    Optional<String> appointedGuardian(String text) {
        Matcher m = APPOINTED.matcher(text);
        while (m.find()) {
            String name = NameHeuristics.stripQualifiers(m.group(1).replaceAll("\\s+", " ").trim());
            if (NameHeuristics.looksLikeHumanName(name)) {
                return Optional.of(NameHeuristics.normalizeCase(name));
            }
        }
        return Optional.empty();
    }
}
