package com.example.guardianintake.dto.store;

import com.example.guardianintake.model.CaseField;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * What one upsert did to the stored case.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MergeOutcome {
    private String causeNumber;
    private boolean created;
    /** Fields whose stored value changed. */
    private List<CaseField> fieldsWritten = new ArrayList<>();
    /** Fields with a new value that was not applied because the stored one is verified. */
    private List<CaseField> fieldsProtected = new ArrayList<>();
    private List<CaseField> missingCritical = new ArrayList<>();
    private boolean flaggedForReview;
}
