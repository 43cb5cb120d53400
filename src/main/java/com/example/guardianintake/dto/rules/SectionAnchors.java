package com.example.guardianintake.dto.rules;

import java.util.List;

/**
 * Ordered anchor lists for one section. Primary anchors are tried before fallbacks;
 * end markers close the section.
 */
public final class SectionAnchors {

    private final List<AnchorDefinition> primary;
    private final List<AnchorDefinition> fallback;
    private final List<AnchorDefinition> end;

    public SectionAnchors(List<AnchorDefinition> primary, List<AnchorDefinition> fallback,
                          List<AnchorDefinition> end) {
        this.primary = List.copyOf(primary);
        this.fallback = List.copyOf(fallback);
        this.end = List.copyOf(end);
    }

    public static SectionAnchors empty() {
        return new SectionAnchors(List.of(), List.of(), List.of());
    }

    public List<AnchorDefinition> getPrimary() {
        return primary;
    }

    public List<AnchorDefinition> getFallback() {
        return fallback;
    }

    public List<AnchorDefinition> getEnd() {
        return end;
    }
}
