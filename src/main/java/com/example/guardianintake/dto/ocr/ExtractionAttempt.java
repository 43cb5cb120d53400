package com.example.guardianintake.dto.ocr;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One engine invocation within a cascade run. Lives only as long as the document's processing.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ExtractionAttempt {

    private String engineName;
    private int charCount;
    private Instant timestamp;
    private AttemptStatus status;
    private String message;
    private boolean retried;

    public enum AttemptStatus {
        SUCCESS,
        INSUFFICIENT,
        ERROR
    }
}
