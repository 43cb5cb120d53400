package com.example.guardianintake.dto;

public enum DocumentType {
    /** Application for Review of Placement, the guardian's intake form. */
    ARP,
    /** Court order appointing the guardian. */
    ORDER,
    UNKNOWN
}
