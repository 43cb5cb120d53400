package com.example.guardianintake.dto.extraction;

/**
 * How a value's location was established.
 */
public enum AnchorType {
    PRIMARY,
    FALLBACK,
    /** A name-shaped line above a field label rather than a header phrase. */
    SHAPE_HEURISTIC,
    /** Found in the document as a whole (caption, stamp), not inside a section. */
    DOCUMENT,
    /** Supplied by the caller because the document did not yield it. */
    HINT
}
