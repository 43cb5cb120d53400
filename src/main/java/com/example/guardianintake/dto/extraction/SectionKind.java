package com.example.guardianintake.dto.extraction;

public enum SectionKind {
    WARD,
    GUARDIAN
}
