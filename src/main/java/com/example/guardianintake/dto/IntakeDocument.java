package com.example.guardianintake.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * A PDF handed to the pipeline, with the optional expected cause number.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class IntakeDocument {
    private String fileName;
    @ToString.Exclude
    private byte[] content;
    private String causeNumberHint;
    private DocumentType documentType = DocumentType.UNKNOWN;
}
