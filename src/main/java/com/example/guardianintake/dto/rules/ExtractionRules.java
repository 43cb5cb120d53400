package com.example.guardianintake.dto.rules;

import com.example.guardianintake.dto.extraction.SectionKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * The externally editable tables the extraction components consult: correction rules,
 * section anchors, separator priority and co-residency phrases. Read-only after loading.
 */
public final class ExtractionRules {

    private final List<CorrectionRule> corrections;
    private final Map<SectionKind, SectionAnchors> anchors;
    private final List<String> separators;
    private final List<String> coResidencySignals;

    public ExtractionRules(List<CorrectionRule> corrections, Map<SectionKind, SectionAnchors> anchors,
                           List<String> separators, List<String> coResidencySignals) {
        this.corrections = List.copyOf(corrections);
        EnumMap<SectionKind, SectionAnchors> copy = new EnumMap<>(SectionKind.class);
        copy.putAll(anchors);
        this.anchors = Collections.unmodifiableMap(copy);
        this.separators = List.copyOf(separators);
        this.coResidencySignals = List.copyOf(coResidencySignals);
    }

    public List<CorrectionRule> getCorrections() {
        return corrections;
    }

    /**
     * Rules for one scope, in table order.
     */
    public List<CorrectionRule> rulesFor(CorrectionScope scope) {
        List<CorrectionRule> result = new ArrayList<>();
        for (CorrectionRule rule : corrections) {
            if (rule.getScope() == scope) {
                result.add(rule);
            }
        }
        return result;
    }

    public SectionAnchors anchorsFor(SectionKind kind) {
        return anchors.getOrDefault(kind, SectionAnchors.empty());
    }

    public List<String> getSeparators() {
        return separators;
    }

    public List<String> getCoResidencySignals() {
        return coResidencySignals;
    }
}
