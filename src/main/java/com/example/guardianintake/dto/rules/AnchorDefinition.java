package com.example.guardianintake.dto.rules;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A section boundary marker: a literal phrase matched with edit-distance tolerance,
 * a regular expression, or the name-line shape heuristic.
 */
public final class AnchorDefinition {

    public enum Kind {
        LITERAL,
        REGEX,
        /** A line that looks like a person's name directly above the given label. */
        NAME_LINE_BEFORE_LABEL
    }

    private final Kind kind;
    private final String value;
    private final Pattern pattern;
    /** The anchor is itself a field label ("Ward Name"), so the section starts at the anchor. */
    private final boolean labelInSpan;

    public AnchorDefinition(Kind kind, String value) {
        this(kind, value, false);
    }

    public AnchorDefinition(Kind kind, String value, boolean labelInSpan) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.value = Objects.requireNonNull(value, "value");
        this.pattern = kind == Kind.REGEX ? Pattern.compile(value) : null;
        this.labelInSpan = labelInSpan;
    }

    public static AnchorDefinition literal(String phrase) {
        return new AnchorDefinition(Kind.LITERAL, phrase);
    }

    public static AnchorDefinition label(String phrase) {
        return new AnchorDefinition(Kind.LITERAL, phrase, true);
    }

    public static AnchorDefinition regex(String regex) {
        return new AnchorDefinition(Kind.REGEX, regex);
    }

    public static AnchorDefinition nameLineBefore(String label) {
        return new AnchorDefinition(Kind.NAME_LINE_BEFORE_LABEL, label);
    }

    public Kind getKind() {
        return kind;
    }

    public String getValue() {
        return value;
    }

    public Pattern getPattern() {
        return pattern;
    }

    public boolean isLabelInSpan() {
        return labelInSpan;
    }

    @Override
    public String toString() {
        return kind + ":" + value;
    }
}
