package com.example.guardianintake.dto.extraction;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Optional;

/**
 * Ward and guardian spans found in one page text; either may be absent.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SegmentedText {
    private String text;
    private SectionSpan wardSpan;
    private SectionSpan guardianSpan;

    public Optional<SectionSpan> ward() {
        return Optional.ofNullable(wardSpan);
    }

    public Optional<SectionSpan> guardian() {
        return Optional.ofNullable(guardianSpan);
    }
}
