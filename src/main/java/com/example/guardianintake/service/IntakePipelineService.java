package com.example.guardianintake.service;

import com.example.guardianintake.config.IntakeProperties;
import com.example.guardianintake.dto.BatchIntakeResponse;
import com.example.guardianintake.dto.DocumentType;
import com.example.guardianintake.dto.IntakeDocument;
import com.example.guardianintake.dto.IntakeResultSummary;
import com.example.guardianintake.dto.IntakeResultSummary.Outcome;
import com.example.guardianintake.dto.extraction.ExtractedCase;
import com.example.guardianintake.dto.extraction.FieldProvenance;
import com.example.guardianintake.dto.ocr.CascadeResult;
import com.example.guardianintake.dto.store.MergeOutcome;
import com.example.guardianintake.service.extraction.CauseNumbers;
import com.example.guardianintake.service.extraction.CourtOrderParser;
import com.example.guardianintake.service.extraction.DocumentParser;
import com.example.guardianintake.service.extraction.GuardianSignal;
import com.example.guardianintake.service.extraction.IntakeFormParser;
import com.example.guardianintake.service.ocr.OcrCascadeService;
import com.example.guardianintake.service.store.CaseStoreLock;
import com.example.guardianintake.service.store.RecordAssemblerService;
import com.example.guardianintake.service.store.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Runs one document through the whole intake: routing, OCR cascade, parsing, optional
 * escalation, then the locked upsert into the case store.
 */
@Service
public class IntakePipelineService {

    private static final Logger logger = LoggerFactory.getLogger(IntakePipelineService.class);

    private static final List<String> SKIP_TOKENS = List.of("approval", "approved", "approvals");

    private static final Pattern ORDER_TEXT = Pattern.compile(
        "(?i)\\bORDER\\s+(?:APPOINTING|GRANTING|ON)\\b|\\bIT\\s+IS\\s+(?:THEREFORE\\s+)?ORDERED\\b");

    @Autowired
    private OcrCascadeService cascade;

    @Autowired
    private IntakeFormParser intakeFormParser;

    @Autowired
    private CourtOrderParser courtOrderParser;

    @Autowired
    private RecordAssemblerService recordAssembler;

    @Autowired
    private CaseStoreLock storeLock;

    @Autowired
    private IntakeProperties intakeProperties;

    public IntakeResultSummary process(IntakeDocument document) {
        return process(document, List.of());
    }

    /**
     * @param knownCauseNumbers cause numbers already read from companion orders in the
     *                          same batch, used as hints within one digit
     */
    public IntakeResultSummary process(IntakeDocument document, Collection<String> knownCauseNumbers) {
        IntakeResultSummary summary = new IntakeResultSummary();
        summary.setFileName(document.getFileName());

        if (shouldSkip(document.getFileName())) {
            logger.info("⏭️ Skipping {} (approval)", document.getFileName());
            summary.setDocumentType(DocumentType.UNKNOWN);
            summary.setOutcome(Outcome.SKIPPED);
            return summary;
        }
        if (document.getDocumentType() == null || document.getDocumentType() == DocumentType.UNKNOWN) {
            document.setDocumentType(classifyByName(document.getFileName()));
        }

        logger.info("📄 Processing {} ({})", document.getFileName(), document.getDocumentType());
        CascadeResult ocr = cascade.run(document);
        summary.setAttempts(ocr.getAttempts());
        if (!ocr.hasText()) {
            summary.setDocumentType(document.getDocumentType());
            return fail(summary, "No OCR engine produced text");
        }

        if (document.getDocumentType() == DocumentType.UNKNOWN) {
            document.setDocumentType(classifyByText(ocr.getText()));
        }
        summary.setDocumentType(document.getDocumentType());
        DocumentParser parser = parserFor(document.getDocumentType());

        String hint = resolveHint(document, ocr.getText(), knownCauseNumbers);
        ExtractedCase extracted = parser.parse(ocr.getText(), document.getFileName(), ocr.getEngineName(), hint);
        extracted.setLowConfidence(ocr.isLowConfidence());

        if (document.getDocumentType() == DocumentType.ARP && !extracted.hasAnyGuardianName()
            && intakeProperties.getCascade().isEscalationEnabled()) {
            Optional<ExtractedCase> better = escalate(document, parser, ocr, extracted, hint);
            if (better.isPresent()) {
                extracted = better.get();
                summary.setEscalated(true);
            }
        }

        fillSummary(summary, extracted);

        if (!extracted.hasCauseNumber()) {
            logger.warn("⚠️ {}: no cause number; not stored, flagged for manual review", document.getFileName());
            summary.setFlaggedForReview(true);
            summary.setOutcome(Outcome.REVIEW_REQUIRED);
            return summary;
        }

        try (CaseStoreLock.Handle ignored = storeLock.acquire()) {
            MergeOutcome merge = recordAssembler.upsert(extracted, document.getFileName());
            summary.setCreated(merge.isCreated());
            summary.setFieldsWritten(merge.getFieldsWritten());
            summary.setFieldsProtected(merge.getFieldsProtected());
            summary.setFlaggedForReview(merge.isFlaggedForReview());
            summary.setOutcome(merge.isFlaggedForReview() ? Outcome.REVIEW_REQUIRED : Outcome.PROCESSED);
        } catch (StoreUnavailableException e) {
            logger.error("❌ {}: case store unavailable, nothing written: {}", document.getFileName(), e.getMessage());
            summary.setOutcome(Outcome.STORE_UNAVAILABLE);
            summary.setErrorMessage(e.getMessage());
            return summary;
        } catch (RuntimeException e) {
            logger.error("❌ {}: failed to store case {}", document.getFileName(), extracted.getCauseNumber(), e);
            return fail(summary, "Store write failed: " + e.getMessage());
        }

        logger.info("📊 {}: case {} via {} - {} extracted, {} missing{}", document.getFileName(),
                   summary.getCauseNumber(), summary.getEngine(), summary.getExtractedFields().size(),
                   summary.getMissingFields().size(), summary.isFlaggedForReview() ? ", needs review" : "");
        return summary;
    }

    /**
     * Processes documents strictly one after another. Orders go first so their cause numbers
     * can serve as hints for the applications.
     */
    public BatchIntakeResponse processBatch(List<IntakeDocument> documents) {
        List<IntakeDocument> ordered = new ArrayList<>(documents);
        for (IntakeDocument document : ordered) {
            if (document.getDocumentType() == null || document.getDocumentType() == DocumentType.UNKNOWN) {
                document.setDocumentType(classifyByName(document.getFileName()));
            }
        }
        ordered.sort(Comparator.comparing((IntakeDocument d) -> d.getDocumentType() != DocumentType.ORDER)
            .thenComparing(IntakeDocument::getFileName));

        BatchIntakeResponse response = new BatchIntakeResponse();
        Set<String> orderCauseNumbers = new LinkedHashSet<>();
        for (IntakeDocument document : ordered) {
            IntakeResultSummary summary;
            try {
                summary = process(document, orderCauseNumbers);
            } catch (RuntimeException e) {
                logger.error("❌ Unexpected failure on {}", document.getFileName(), e);
                summary = new IntakeResultSummary();
                summary.setFileName(document.getFileName());
                summary.setDocumentType(document.getDocumentType());
                fail(summary, e.getMessage());
            }
            if (summary.getDocumentType() == DocumentType.ORDER && summary.getCauseNumber() != null) {
                orderCauseNumbers.add(summary.getCauseNumber());
            }
            response.add(summary);
        }

        logger.info("📦 Batch complete: {} processed, {} need review, {} skipped, {} failed",
                   response.getTotalProcessed(), response.getTotalReviewRequired(), response.getTotalSkipped(),
                   response.getTotalFailed());
        return response;
    }

    /**
     * Processes every PDF in the configured inbox directory.
     */
    public BatchIntakeResponse processInbox() throws IOException {
        Path inbox = Paths.get(intakeProperties.getInbox().getDir());
        if (!Files.isDirectory(inbox)) {
            throw new IOException("Inbox directory not found: " + inbox.toAbsolutePath());
        }

        List<Path> pdfs;
        try (Stream<Path> files = Files.list(inbox)) {
            pdfs = files.filter(Files::isRegularFile)
                .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".pdf"))
                .sorted()
                .collect(Collectors.toList());
        }
        logger.info("📂 Inbox {}: {} PDF files", inbox.toAbsolutePath(), pdfs.size());

        List<IntakeDocument> documents = new ArrayList<>();
        BatchIntakeResponse unreadable = new BatchIntakeResponse();
        for (Path pdf : pdfs) {
            try {
                documents.add(new IntakeDocument(pdf.getFileName().toString(), Files.readAllBytes(pdf), null,
                    DocumentType.UNKNOWN));
            } catch (IOException e) {
                logger.error("❌ Could not read {}: {}", pdf, e.getMessage());
                IntakeResultSummary summary = new IntakeResultSummary();
                summary.setFileName(pdf.getFileName().toString());
                unreadable.add(fail(summary, "Could not read file: " + e.getMessage()));
            }
        }

        BatchIntakeResponse response = processBatch(documents);
        for (IntakeResultSummary failed : unreadable.getResults()) {
            response.add(failed);
        }
        return response;
    }

    private Optional<ExtractedCase> escalate(IntakeDocument document, DocumentParser parser, CascadeResult first,
                                             ExtractedCase firstCase, String hint) {
        Optional<CascadeResult> escalated = cascade.escalate(document, first);
        if (escalated.isEmpty() || !escalated.get().hasText()) {
            return Optional.empty();
        }
        CascadeResult second = escalated.get();
        ExtractedCase secondCase = parser.parse(second.getText(), document.getFileName(), second.getEngineName(),
            hint);
        secondCase.setLowConfidence(second.isLowConfidence());

        int firstScore = GuardianSignal.score(first.getText());
        int secondScore = GuardianSignal.score(second.getText());
        boolean gainedName = secondCase.hasAnyGuardianName() && !firstCase.hasAnyGuardianName();
        if (secondScore > firstScore || gainedName) {
            logger.info("⬆️ {}: using {} text (guardian signal {} vs {})", document.getFileName(),
                       second.getEngineName(), secondScore, firstScore);
            secondCase.getNotes().add("escalated from " + first.getEngineName() + " to " + second.getEngineName());
            return Optional.of(secondCase);
        }
        logger.info("{}: keeping {} text (guardian signal {} vs {})", document.getFileName(),
                   first.getEngineName(), firstScore, secondScore);
        return Optional.empty();
    }

    String resolveHint(IntakeDocument document, String text, Collection<String> knownCauseNumbers) {
        String hint = CauseNumbers.normalize(document.getCauseNumberHint());
        if (hint != null) {
            return hint;
        }
        if (knownCauseNumbers.isEmpty()) {
            return null;
        }
        return CauseNumbers.find(text)
            .flatMap(found -> CauseNumbers.nearest(found, knownCauseNumbers))
            .orElse(null);
    }

    private DocumentParser parserFor(DocumentType type) {
        return type == DocumentType.ORDER ? courtOrderParser : intakeFormParser;
    }

    private void fillSummary(IntakeResultSummary summary, ExtractedCase extracted) {
        summary.setCauseNumber(extracted.getCauseNumber());
        summary.setEngine(extracted.getEngine());
        summary.setLowConfidence(extracted.isLowConfidence());
        summary.setNotes(extracted.getNotes());

        Set<String> corrections = new LinkedHashSet<>(extracted.getPageCorrections());
        for (FieldProvenance provenance : extracted.getProvenance().values()) {
            if (provenance.isExtracted()) {
                summary.getExtractedFields().add(provenance.getField());
                corrections.addAll(provenance.getCorrections());
            } else {
                summary.getMissingFields().put(provenance.getField(), provenance.getMissingReason());
            }
        }
        summary.setCorrectionsApplied(new ArrayList<>(corrections));
    }

    private static IntakeResultSummary fail(IntakeResultSummary summary, String message) {
        summary.setOutcome(Outcome.FAILED);
        summary.setErrorMessage(message);
        return summary;
    }

    static boolean shouldSkip(String fileName) {
        String name = fileName == null ? "" : fileName.toLowerCase(Locale.ROOT);
        return SKIP_TOKENS.stream().anyMatch(name::contains);
    }

    static DocumentType classifyByName(String fileName) {
        String name = fileName == null ? "" : fileName.toLowerCase(Locale.ROOT);
        if (name.contains("order")) {
            return DocumentType.ORDER;
        }
        if (name.contains("arp")) {
            return DocumentType.ARP;
        }
        return DocumentType.UNKNOWN;
    }

    static DocumentType classifyByText(String text) {
        return ORDER_TEXT.matcher(text).find() ? DocumentType.ORDER : DocumentType.ARP;
    }
}
