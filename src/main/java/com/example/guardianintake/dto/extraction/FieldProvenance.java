package com.example.guardianintake.dto.extraction;

import com.example.guardianintake.model.CaseField;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Audit trail for one field: where its value came from, or why there is none.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FieldProvenance {
    private CaseField field;
    private boolean extracted;
    private String engine;
    private AnchorType anchorType;
    private String anchorLabel;
    private List<String> corrections = new ArrayList<>();
    private MissingReason missingReason;
}
