package com.example.guardianintake.dto.rules;

/**
 * Where a correction rule is allowed to fire.
 */
public enum CorrectionScope {
    /** Whole page text, before segmentation. */
    PAGE,
    /** Every captured field value. */
    GLOBAL,
    NAME,
    SURNAME,
    DATE,
    PHONE,
    EMAIL,
    ADDRESS,
    RELATIONSHIP,
    CAUSE_NUMBER,
    /** Leading and trailing noise, applied last to every field value. */
    PUNCTUATION
}
