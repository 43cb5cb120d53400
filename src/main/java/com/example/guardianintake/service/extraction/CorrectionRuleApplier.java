package com.example.guardianintake.service.extraction;

import com.example.guardianintake.dto.rules.CorrectionRule;
import com.example.guardianintake.dto.rules.CorrectionScope;
import com.example.guardianintake.dto.rules.ExtractionRules;

import java.util.ArrayList;
import java.util.List;

/**
 * Applies the correction table by scope and reports which rules changed the value.
 */
public class CorrectionRuleApplier {

    private final ExtractionRules rules;

    public CorrectionRuleApplier(ExtractionRules rules) {
        this.rules = rules;
    }

    /**
     * Page-level rules, run on the whole text before segmentation.
     */
    public Corrected applyToPage(String text) {
        return apply(text, CorrectionScope.PAGE);
    }

    /**
     * Global rules, then the field's own scope, then punctuation cleanup.
     */
    public Corrected applyToField(String value, CorrectionScope fieldScope) {
        List<CorrectionScope> scopes = new ArrayList<>();
        scopes.add(CorrectionScope.GLOBAL);
        if (fieldScope != null && fieldScope != CorrectionScope.GLOBAL && fieldScope != CorrectionScope.PUNCTUATION) {
            scopes.add(fieldScope);
        }
        scopes.add(CorrectionScope.PUNCTUATION);
        return apply(value, scopes.toArray(new CorrectionScope[0]));
    }

    public Corrected apply(String value, CorrectionScope... scopes) {
        String current = value;
        List<String> fired = new ArrayList<>();
        for (CorrectionScope scope : scopes) {
            for (CorrectionRule rule : rules.rulesFor(scope)) {
                String next = rule.apply(current);
                if (next != null && !next.equals(current)) {
                    fired.add(rule.getId());
                    current = next;
                }
            }
        }
        return new Corrected(current, fired);
    }

    public static final class Corrected {
        private final String value;
        private final List<String> fired;

        public Corrected(String value, List<String> fired) {
            this.value = value;
            this.fired = List.copyOf(fired);
        }

        public String getValue() {
            return value;
        }

        public List<String> getFired() {
            return fired;
        }
    }
}
