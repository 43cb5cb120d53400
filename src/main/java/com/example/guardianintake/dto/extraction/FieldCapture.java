package com.example.guardianintake.dto.extraction;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A value captured after a field label: the raw run, the cleaned value and the
 * rules that fired while cleaning it.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FieldCapture {
    private String fieldName;
    private String raw;
    private String value;
    /** Offset of the label within the page text. */
    private int labelPosition;
    private List<String> corrections = new ArrayList<>();

    public boolean hasValue() {
        return value != null && !value.isBlank();
    }
}
