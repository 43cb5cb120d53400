package com.example.guardianintake.service.store;

import com.example.guardianintake.dto.extraction.ExtractedCase;
import com.example.guardianintake.dto.store.MergeOutcome;
import com.example.guardianintake.model.CaseField;
import com.example.guardianintake.model.CaseRecord;
import com.example.guardianintake.model.CaseRecord.FieldStatus;
import com.example.guardianintake.repository.CaseRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;
import java.util.Objects;

/**
 * Upserts extracted cases into the store, one row per cause number.
 *
 * <p>Merge rules per field: verified values are never replaced; missing and needs-review
 * fields take any new value; extracted values are replaced by a new non-blank value unless
 * the new text was low confidence. Collaborator status columns are never touched. Callers
 * hold {@link CaseStoreLock} around every write.</p>
 */
@Service
public class RecordAssemblerService {

    private static final Logger logger = LoggerFactory.getLogger(RecordAssemblerService.class);

    @Autowired
    private CaseRecordRepository caseRecordRepository;

    @Transactional
    public MergeOutcome upsert(ExtractedCase extracted, String sourceFile) {
        if (!extracted.hasCauseNumber()) {
            throw new IllegalArgumentException("Cannot store a case without a cause number");
        }
        String causeNumber = extracted.getCauseNumber();

        CaseRecord record = caseRecordRepository.findByCauseNumber(causeNumber).orElse(null);
        boolean created = record == null;
        if (created) {
            record = new CaseRecord();
            record.setCauseNumber(causeNumber);
        }

        MergeOutcome outcome = new MergeOutcome();
        outcome.setCauseNumber(causeNumber);
        outcome.setCreated(created);

        Map<CaseField, String> values = extracted.toFieldValues();
        for (CaseField field : CaseField.values()) {
            mergeField(record, field, values.get(field), extracted.isLowConfidence(), outcome);
        }

        if (created || !outcome.getFieldsWritten().isEmpty()) {
            record.setLastSourceFile(sourceFile);
            record.setLastEngine(extracted.getEngine());
            record.setLowConfidence(extracted.isLowConfidence());
        }

        boolean review = refreshReviewFlag(record, outcome) || extracted.isCauseNumberMismatch();
        record.setNeedsReview(review);
        outcome.setFlaggedForReview(review);

        caseRecordRepository.save(record);

        if (created) {
            logger.info("🆕 Case {} created with {} fields from {}", causeNumber, outcome.getFieldsWritten().size(),
                       sourceFile);
        } else {
            logger.info("🔁 Case {} merged from {}: {} written, {} protected", causeNumber, sourceFile,
                       outcome.getFieldsWritten().size(), outcome.getFieldsProtected().size());
        }
        if (review) {
            logger.warn("⚠️ Case {} needs review (missing critical: {})", causeNumber, outcome.getMissingCritical());
        }
        return outcome;
    }

    private void mergeField(CaseRecord record, CaseField field, String newValue, boolean lowConfidence,
                            MergeOutcome outcome) {
        FieldStatus status = record.statusOf(field);
        String current = field.read(record);

        switch (status) {
            case VERIFIED:
                if (newValue != null && !newValue.equals(current)) {
                    outcome.getFieldsProtected().add(field);
                }
                if (!record.getFieldStatuses().containsKey(field)) {
                    record.getFieldStatuses().put(field, FieldStatus.VERIFIED);
                }
                return;
            case EXTRACTED:
                if (newValue != null && !lowConfidence && !newValue.equals(current)) {
                    field.write(record, newValue);
                    outcome.getFieldsWritten().add(field);
                }
                return;
            case MISSING:
            case NEEDS_REVIEW:
            default:
                if (newValue != null) {
                    if (!Objects.equals(newValue, current)) {
                        field.write(record, newValue);
                        outcome.getFieldsWritten().add(field);
                    }
                    record.getFieldStatuses().put(field, FieldStatus.EXTRACTED);
                } else if (status == FieldStatus.MISSING) {
                    record.getFieldStatuses().put(field, FieldStatus.MISSING);
                }
        }
    }

    /**
     * Moves a field to VERIFIED, optionally replacing its value first. This is the human
     * action; extraction never produces VERIFIED.
     */
    @Transactional
    public CaseRecord verifyField(String causeNumber, CaseField field, String correctedValue) {
        CaseRecord record = caseRecordRepository.findByCauseNumber(causeNumber)
            .orElseThrow(() -> new CaseNotFoundException(causeNumber));
        if (correctedValue != null) {
            field.write(record, correctedValue.trim());
        }
        record.getFieldStatuses().put(field, FieldStatus.VERIFIED);
        record.setNeedsReview(refreshReviewFlag(record, new MergeOutcome()));
        logger.info("✅ Case {}: {} verified", causeNumber, field.getHeader());
        return caseRecordRepository.save(record);
    }

    /**
     * Marks a field for re-extraction; the next run may replace it.
     */
    @Transactional
    public CaseRecord flagField(String causeNumber, CaseField field) {
        CaseRecord record = caseRecordRepository.findByCauseNumber(causeNumber)
            .orElseThrow(() -> new CaseNotFoundException(causeNumber));
        record.getFieldStatuses().put(field, FieldStatus.NEEDS_REVIEW);
        record.setNeedsReview(true);
        logger.info("🚩 Case {}: {} flagged for review", causeNumber, field.getHeader());
        return caseRecordRepository.save(record);
    }

    private boolean refreshReviewFlag(CaseRecord record, MergeOutcome outcome) {
        boolean review = false;
        for (CaseField field : CaseField.values()) {
            FieldStatus status = record.statusOf(field);
            if (field.isCritical() && status == FieldStatus.MISSING) {
                outcome.getMissingCritical().add(field);
                review = true;
            }
            if (status == FieldStatus.NEEDS_REVIEW) {
                review = true;
            }
        }
        return review;
    }
}
