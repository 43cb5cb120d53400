package com.example.guardianintake.config;

import com.example.guardianintake.dto.extraction.SectionKind;
import com.example.guardianintake.dto.rules.AnchorDefinition;
import com.example.guardianintake.dto.rules.CorrectionRule;
import com.example.guardianintake.dto.rules.CorrectionScope;
import com.example.guardianintake.dto.rules.ExtractionRules;
import com.example.guardianintake.dto.rules.SectionAnchors;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.PatternSyntaxException;

/**
 * Reads the rules JSON into an immutable {@link ExtractionRules}.
 */
public class ExtractionRulesLoader {

    private final ObjectMapper objectMapper;

    public ExtractionRulesLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ExtractionRules read(InputStream in) {
        JsonNode root;
        try {
            root = objectMapper.readTree(in);
        } catch (IOException e) {
            throw new IntakeRulesException("Could not parse extraction rules: " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new IntakeRulesException("Extraction rules must be a JSON object");
        }

        List<CorrectionRule> corrections = new ArrayList<>();
        for (JsonNode node : root.path("corrections")) {
            corrections.add(readRule(node));
        }

        Map<SectionKind, SectionAnchors> anchors = new EnumMap<>(SectionKind.class);
        JsonNode anchorsNode = root.path("anchors");
        for (SectionKind kind : SectionKind.values()) {
            JsonNode section = anchorsNode.path(kind.name());
            if (section.isMissingNode()) {
                throw new IntakeRulesException("No anchors configured for section " + kind);
            }
            anchors.put(kind, new SectionAnchors(
                readAnchors(section.path("primary")),
                readAnchors(section.path("fallback")),
                readAnchors(section.path("end"))));
        }

        List<String> separators = readStrings(root.path("separators"));
        if (separators.isEmpty()) {
            throw new IntakeRulesException("Separator priority list is empty");
        }

        return new ExtractionRules(corrections, anchors, separators, readStrings(root.path("coResidencySignals")));
    }

    private CorrectionRule readRule(JsonNode node) {
        String id = node.path("id").asText(null);
        String pattern = node.path("pattern").asText(null);
        if (id == null || pattern == null) {
            throw new IntakeRulesException("Correction rule needs an id and a pattern: " + node);
        }
        CorrectionScope scope;
        try {
            scope = CorrectionScope.valueOf(node.path("scope").asText("GLOBAL"));
        } catch (IllegalArgumentException e) {
            throw new IntakeRulesException("Unknown scope on rule " + id + ": " + node.path("scope").asText(), e);
        }
        try {
            return new CorrectionRule(id, pattern, node.path("replacement").asText(""), scope,
                node.path("ignoreCase").asBoolean(false), node.path("description").asText(null));
        } catch (PatternSyntaxException e) {
            throw new IntakeRulesException("Invalid pattern on rule " + id + ": " + e.getDescription(), e);
        }
    }

    private List<AnchorDefinition> readAnchors(JsonNode array) {
        List<AnchorDefinition> result = new ArrayList<>();
        for (JsonNode node : array) {
            String value = node.path("value").asText(null);
            if (value == null || value.isBlank()) {
                throw new IntakeRulesException("Anchor without a value: " + node);
            }
            try {
                AnchorDefinition.Kind kind = AnchorDefinition.Kind.valueOf(node.path("kind").asText("LITERAL"));
                result.add(new AnchorDefinition(kind, value, node.path("labelInSpan").asBoolean(false)));
            } catch (IllegalArgumentException e) {
                throw new IntakeRulesException("Invalid anchor " + node + ": " + e.getMessage(), e);
            }
        }
        return result;
    }

    private List<String> readStrings(JsonNode array) {
        List<String> result = new ArrayList<>();
        for (JsonNode node : array) {
            String value = node.asText("").trim();
            if (!value.isEmpty()) {
                result.add(value);
            }
        }
        return result;
    }
}
