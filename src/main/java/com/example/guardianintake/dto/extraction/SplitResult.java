package com.example.guardianintake.dto.extraction;

import java.util.List;

/**
 * Outcome of splitting a field that may hold two guardians' values.
 */
public final class SplitResult {

    public enum Kind {
        /** One value; it belongs to the primary guardian. */
        SINGLE_VALUE,
        /** Two values: left for the primary guardian, right for the secondary. */
        SPLIT_PAIR,
        /** A separator was found but one side was empty. */
        UNRESOLVED
    }

    private final Kind kind;
    private final String primary;
    private final String secondary;
    private final String separator;
    private final List<String> otherSeparators;

    private SplitResult(Kind kind, String primary, String secondary, String separator, List<String> otherSeparators) {
        this.kind = kind;
        this.primary = primary;
        this.secondary = secondary;
        this.separator = separator;
        this.otherSeparators = List.copyOf(otherSeparators);
    }

    public static SplitResult single(String value) {
        return new SplitResult(Kind.SINGLE_VALUE, value, null, null, List.of());
    }

    public static SplitResult pair(String primary, String secondary, String separator, List<String> otherSeparators) {
        return new SplitResult(Kind.SPLIT_PAIR, primary, secondary, separator, otherSeparators);
    }

    public static SplitResult unresolved(String raw, String separator) {
        return new SplitResult(Kind.UNRESOLVED, raw, null, separator, List.of());
    }

    public Kind getKind() {
        return kind;
    }

    public String getPrimary() {
        return primary;
    }

    public String getSecondary() {
        return secondary;
    }

    public String getSeparator() {
        return separator;
    }

    /** Lower-priority separators also present; non-empty means the split was ambiguous. */
    public List<String> getOtherSeparators() {
        return otherSeparators;
    }

    public boolean isAmbiguous() {
        return !otherSeparators.isEmpty();
    }

    public boolean isPair() {
        return kind == Kind.SPLIT_PAIR;
    }

    @Override
    public String toString() {
        return kind + "[" + primary + (secondary != null ? " | " + secondary : "") + "]";
    }
}
