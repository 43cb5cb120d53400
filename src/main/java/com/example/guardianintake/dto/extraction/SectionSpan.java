package com.example.guardianintake.dto.extraction;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Offsets of one section inside the page text. {@code anchorStart} is where the
 * anchor itself begins; the section content starts at {@code start}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SectionSpan {
    private SectionKind kind;
    private int anchorStart;
    private int start;
    private int end;
    private AnchorType anchorType;
    private String anchorLabel;

    public String slice(String text) {
        int from = Math.max(0, Math.min(start, text.length()));
        int to = Math.max(from, Math.min(end, text.length()));
        return text.substring(from, to);
    }

    public boolean isEmpty() {
        return end <= start;
    }
}
