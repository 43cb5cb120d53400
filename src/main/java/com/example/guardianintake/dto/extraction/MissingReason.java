package com.example.guardianintake.dto.extraction;

/**
 * Why a field came out empty.
 */
public enum MissingReason {
    SECTION_NOT_FOUND,
    LABEL_NOT_FOUND,
    EMPTY_VALUE,
    INVALID_SHAPE,
    NOT_ON_DOCUMENT
}
