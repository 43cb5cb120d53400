package com.example.guardianintake.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BatchIntakeResponse {
    private int totalProcessed;
    private int totalReviewRequired;
    private int totalSkipped;
    private int totalFailed;
    private List<IntakeResultSummary> results = new ArrayList<>();
    private List<IntakeError> errors = new ArrayList<>();

    public void add(IntakeResultSummary summary) {
        results.add(summary);
        switch (summary.getOutcome()) {
            case PROCESSED:
                totalProcessed++;
                break;
            case REVIEW_REQUIRED:
                totalReviewRequired++;
                break;
            case SKIPPED:
                totalSkipped++;
                break;
            default:
                totalFailed++;
                errors.add(new IntakeError(summary.getFileName(), summary.getErrorMessage()));
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class IntakeError {
        private String fileName;
        private String errorMessage;
    }
}
