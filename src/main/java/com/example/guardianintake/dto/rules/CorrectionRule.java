package com.example.guardianintake.dto.rules;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One OCR misread substitution. Immutable once loaded.
 */
public final class CorrectionRule {

    private final String id;
    private final Pattern pattern;
    private final String replacement;
    private final CorrectionScope scope;
    private final String description;

    public CorrectionRule(String id, String regex, String replacement, CorrectionScope scope,
                          boolean ignoreCase, String description) {
        this.id = Objects.requireNonNull(id, "id");
        this.pattern = Pattern.compile(regex, ignoreCase ? Pattern.CASE_INSENSITIVE : 0);
        this.replacement = replacement == null ? "" : replacement;
        this.scope = Objects.requireNonNull(scope, "scope");
        this.description = description;
    }

    /**
     * Applies the rule, returning the input unchanged when the pattern does not match.
     */
    public String apply(String value) {
        if (value == null || value.isEmpty()) {
            return value;
        }
        Matcher matcher = pattern.matcher(value);
        if (!matcher.find()) {
            return value;
        }
        return matcher.replaceAll(replacement);
    }

    public String getId() {
        return id;
    }

    public Pattern getPattern() {
        return pattern;
    }

    public String getReplacement() {
        return replacement;
    }

    public CorrectionScope getScope() {
        return scope;
    }

    public String getDescription() {
        return description;
    }

    @Override
    public String toString() {
        return id + " [" + scope + "]";
    }
}
