package com.example.guardianintake.service.extraction;

import com.example.guardianintake.dto.extraction.AnchorType;
import com.example.guardianintake.dto.extraction.FieldProvenance;
import com.example.guardianintake.dto.extraction.MissingReason;
import com.example.guardianintake.model.CaseField;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects per-field provenance for one document. Recording never affects what was
 * extracted; a field marked missing is logged and processing moves on.
 */
public class ProvenanceTracker {

    private static final Logger logger = LoggerFactory.getLogger(ProvenanceTracker.class);

    private final String documentName;
    private final String engine;
    private final Map<CaseField, FieldProvenance> fields = new EnumMap<>(CaseField.class);
    private final List<String> notes = new ArrayList<>();

    public ProvenanceTracker(String documentName, String engine) {
        this.documentName = documentName;
        this.engine = engine;
    }

    public void extracted(CaseField field, AnchorType anchorType, String anchorLabel, List<String> corrections) {
        FieldProvenance provenance = new FieldProvenance(field, true, engine, anchorType, anchorLabel,
            new ArrayList<>(corrections), null);
        fields.put(field, provenance);
        logger.debug("{}: {} from {} via {} anchor '{}'{}", documentName, field, engine, anchorType, anchorLabel,
                    corrections.isEmpty() ? "" : " corrections " + corrections);
    }

    /**
     * Records a missing field unless a value for it was already recorded.
     */
    public void missing(CaseField field, MissingReason reason) {
        FieldProvenance existing = fields.get(field);
        if (existing != null && existing.isExtracted()) {
            return;
        }
        fields.put(field, new FieldProvenance(field, false, engine, null, null, new ArrayList<>(), reason));
        logger.debug("{}: {} missing ({})", documentName, field, reason);
    }

    public void note(String message) {
        notes.add(message);
        logger.info("📝 {}: {}", documentName, message);
    }

    public boolean isExtracted(CaseField field) {
        FieldProvenance provenance = fields.get(field);
        return provenance != null && provenance.isExtracted();
    }

    public Map<CaseField, FieldProvenance> getFields() {
        return new LinkedHashMap<>(fields);
    }

    public List<String> getNotes() {
        return new ArrayList<>(notes);
    }
}
