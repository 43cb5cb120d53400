package com.example.guardianintake.dto;

import com.example.guardianintake.dto.extraction.MissingReason;
import com.example.guardianintake.dto.ocr.ExtractionAttempt;
import com.example.guardianintake.model.CaseField;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-document result reported to the operator.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class IntakeResultSummary {

    public enum Outcome {
        PROCESSED,
        REVIEW_REQUIRED,
        SKIPPED,
        STORE_UNAVAILABLE,
        FAILED
    }

    private String fileName;
    private DocumentType documentType;
    private Outcome outcome;
    private String causeNumber;
    private String engine;
    private boolean lowConfidence;
    private boolean escalated;
    private List<CaseField> extractedFields = new ArrayList<>();
    private Map<CaseField, MissingReason> missingFields = new LinkedHashMap<>();
    private List<String> correctionsApplied = new ArrayList<>();
    private List<String> notes = new ArrayList<>();
    private boolean flaggedForReview;
    private boolean created;
    private List<CaseField> fieldsWritten = new ArrayList<>();
    private List<CaseField> fieldsProtected = new ArrayList<>();
    private List<ExtractionAttempt> attempts = new ArrayList<>();
    private String errorMessage;
}
