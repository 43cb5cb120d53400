package com.example.guardianintake.dto.extraction;

import com.example.guardianintake.dto.rules.CorrectionScope;

import java.util.regex.Pattern;

/**
 * How to find and clean one field: its label, value shape and correction scope.
 */
public final class FieldSpec {

    private final String name;
    private final Pattern label;
    private final FieldShape shape;
    private final CorrectionScope scope;
    private final int maxLines;

    public FieldSpec(String name, Pattern label, FieldShape shape, CorrectionScope scope, int maxLines) {
        this.name = name;
        this.label = label;
        this.shape = shape;
        this.scope = scope;
        this.maxLines = maxLines;
    }

    public String getName() {
        return name;
    }

    public Pattern getLabel() {
        return label;
    }

    public FieldShape getShape() {
        return shape;
    }

    public CorrectionScope getScope() {
        return scope;
    }

    public int getMaxLines() {
        return maxLines;
    }

    @Override
    public String toString() {
        return name;
    }
}
