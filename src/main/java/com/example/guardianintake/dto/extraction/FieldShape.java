package com.example.guardianintake.dto.extraction;

/**
 * The expected form of a field's value.
 */
public enum FieldShape {
    NAME,
    DATE,
    PHONE,
    EMAIL,
    ADDRESS,
    RELATIONSHIP,
    TEXT
}
