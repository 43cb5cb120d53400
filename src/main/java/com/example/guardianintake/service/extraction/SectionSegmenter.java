package com.example.guardianintake.service.extraction;

import com.example.guardianintake.dto.extraction.AnchorType;
import com.example.guardianintake.dto.extraction.SectionKind;
import com.example.guardianintake.dto.extraction.SectionSpan;
import com.example.guardianintake.dto.extraction.SegmentedText;
import com.example.guardianintake.dto.rules.AnchorDefinition;
import com.example.guardianintake.dto.rules.ExtractionRules;
import com.example.guardianintake.dto.rules.SectionAnchors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;

/**
 * Locates the ward and guardian sections of a page. Primary anchors are tried first, then
 * fallbacks in order; the first match wins. The guardian search starts after the ward
 * anchor so ward text is never taken for guardian text.
 */
public class SectionSegmenter {

    private static final Logger logger = LoggerFactory.getLogger(SectionSegmenter.class);

    private final ExtractionRules rules;
    private final FuzzyAnchorMatcher matcher;

    public SectionSegmenter(ExtractionRules rules, FuzzyAnchorMatcher matcher) {
        this.rules = rules;
        this.matcher = matcher;
    }

    public SegmentedText segment(String text) {
        String page = text == null ? "" : text;

        SectionSpan ward = locate(SectionKind.WARD, page, 0).orElse(null);
        int guardianFrom = ward != null ? ward.getStart() : 0;
        SectionSpan guardian = locate(SectionKind.GUARDIAN, page, guardianFrom).orElse(null);

        if (ward != null && guardian != null && guardian.getAnchorStart() >= ward.getStart()
            && guardian.getAnchorStart() < ward.getEnd()) {
            ward.setEnd(guardian.getAnchorStart());
        }

        if (ward == null) {
            logger.debug("Ward section not found");
        }
        if (guardian == null) {
            logger.warn("⚠️ Guardian section not found; guardian fields will be reported missing");
        } else {
            logger.debug("Guardian section [{}, {}) via {} anchor '{}'", guardian.getStart(), guardian.getEnd(),
                        guardian.getAnchorType(), guardian.getAnchorLabel());
        }
        return new SegmentedText(page, ward, guardian);
    }

    Optional<SectionSpan> locate(SectionKind kind, String text, int from) {
        SectionAnchors anchors = rules.anchorsFor(kind);

        Optional<SectionSpan> span = firstMatch(kind, anchors.getPrimary(), text, from, AnchorType.PRIMARY);
        if (span.isEmpty()) {
            span = firstMatch(kind, anchors.getFallback(), text, from, AnchorType.FALLBACK);
        }
        span.ifPresent(s -> s.setEnd(findEnd(anchors.getEnd(), text, s.getStart())));
        return span;
    }

    private Optional<SectionSpan> firstMatch(SectionKind kind, List<AnchorDefinition> anchors, String text,
                                             int from, AnchorType type) {
        for (AnchorDefinition anchor : anchors) {
            Optional<int[]> bounds = match(anchor, text, from);
            if (bounds.isPresent()) {
                int anchorStart = bounds.get()[0];
                int contentStart = bounds.get()[1];
                AnchorType actual = anchor.getKind() == AnchorDefinition.Kind.NAME_LINE_BEFORE_LABEL
                    ? AnchorType.SHAPE_HEURISTIC : type;
                return Optional.of(new SectionSpan(kind, anchorStart, contentStart, text.length(), actual,
                    anchor.getValue()));
            }
        }
        return Optional.empty();
    }

    /**
     * Returns {anchor start, content start} for the anchor's first match at or after {@code from}.
     * Content starts at the anchor itself when the anchor is a field label.
     */
    private Optional<int[]> match(AnchorDefinition anchor, String text, int from) {
        boolean keepLabel = anchor.isLabelInSpan();
        switch (anchor.getKind()) {
            case LITERAL:
                return matcher.find(text, anchor.getValue(), from, text.length())
                    .map(m -> new int[] {m.getStart(), keepLabel ? m.getStart() : skipColon(text, m.getEnd())});
            case REGEX:
                Matcher m = anchor.getPattern().matcher(text);
                if (m.find(from)) {
                    return Optional.of(new int[] {m.start(), keepLabel ? m.start() : skipColon(text, m.end())});
                }
                return Optional.empty();
            case NAME_LINE_BEFORE_LABEL:
                return findNameLineBeforeLabel(text, anchor.getValue(), from)
                    .map(lineStart -> new int[] {lineStart, lineStart});
            default:
                return Optional.empty();
        }
    }

    /**
     * Start offset of a name-shaped line sitting directly above a line that begins with
     * {@code label}.
     */
    Optional<Integer> findNameLineBeforeLabel(String text, String label, int from) {
        int previousStart = -1;
        String previousLine = null;
        int lineStart = lineStartAtOrAfter(text, from);
        while (lineStart < text.length()) {
            int lineEnd = text.indexOf('\n', lineStart);
            if (lineEnd < 0) {
                lineEnd = text.length();
            }
            String line = text.substring(lineStart, lineEnd);
            if (!line.isBlank()) {
                if (previousLine != null && startsWithLabel(line, label)
                    && NameHeuristics.looksLikeHumanName(previousLine.trim())) {
                    return Optional.of(previousStart);
                }
                previousLine = line;
                previousStart = lineStart;
            }
            lineStart = lineEnd + 1;
        }
        return Optional.empty();
    }

    /**
     * True when {@code line}, ignoring leading whitespace, begins with {@code label}.
     */
    boolean startsWithLabel(String line, String label) {
        int offset = 0;
        while (offset < line.length() && Character.isWhitespace(line.charAt(offset))) {
            offset++;
        }
        final int labelStart = offset;
        int window = Math.min(line.length(), labelStart + label.length() + matcher.allowedEdits(label.length()));
        return matcher.find(line, label, labelStart, window)
            .map(m -> m.getStart() == labelStart)
            .orElse(false);
    }

    private int findEnd(List<AnchorDefinition> endMarkers, String text, int from) {
        int end = text.length();
        for (AnchorDefinition marker : endMarkers) {
            Optional<int[]> bounds = match(marker, text, from);
            if (bounds.isPresent() && bounds.get()[0] >= from && bounds.get()[0] < end) {
                end = bounds.get()[0];
            }
        }
        return end;
    }

    private static int skipColon(String text, int index) {
        int i = index;
        while (i < text.length() && (text.charAt(i) == ' ' || text.charAt(i) == '\t')) {
            i++;
        }
        if (i < text.length() && text.charAt(i) == ':') {
            return i + 1;
        }
        return index;
    }

    private static int lineStartAtOrAfter(String text, int from) {
        if (from <= 0) {
            return 0;
        }
        int newline = text.lastIndexOf('\n', from - 1);
        return newline + 1;
    }
}
