package com.example.guardianintake.dto.extraction;

import com.example.guardianintake.dto.DocumentType;
import com.example.guardianintake.model.CaseField;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything parsed from one document, ready for the record assembler.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ExtractedCase {

    private DocumentType documentType;
    private String causeNumber;
    private AnchorType causeNumberSource;
    /** The text's cause number differs from the expected one. */
    private boolean causeNumberMismatch;
    private WardIdentity ward = new WardIdentity();
    private GuardianIdentity primaryGuardian = new GuardianIdentity();
    private GuardianIdentity secondaryGuardian = new GuardianIdentity();
    private String livesWith;
    private String dateArpFiled;
    private String dateAppointed;

    private String engine;
    private boolean lowConfidence;
    private Map<CaseField, FieldProvenance> provenance = new LinkedHashMap<>();
    private List<String> pageCorrections = new ArrayList<>();
    private List<String> notes = new ArrayList<>();

    public boolean hasCauseNumber() {
        return causeNumber != null && !causeNumber.isBlank();
    }

    public boolean hasAnyGuardianName() {
        return primaryGuardian.hasName() || secondaryGuardian.hasName();
    }

    /**
     * Flattens the identities into store columns; blank values are left out.
     */
    public Map<CaseField, String> toFieldValues() {
        Map<CaseField, String> values = new EnumMap<>(CaseField.class);
        put(values, CaseField.WARD_LAST, ward.getLastName());
        put(values, CaseField.WARD_FIRST, ward.getFirstName());
        put(values, CaseField.WARD_MIDDLE, ward.getMiddleName());
        put(values, CaseField.WARD_PHONE, ward.getPhone());
        put(values, CaseField.WARD_ADDRESS, ward.getAddress());
        put(values, CaseField.WARD_DOB, ward.getDateOfBirth());
        put(values, CaseField.LIVES_WITH, livesWith);

        put(values, CaseField.GUARDIAN1_NAME, primaryGuardian.getName());
        put(values, CaseField.GUARDIAN1_ADDRESS, primaryGuardian.getAddress());
        put(values, CaseField.GUARDIAN1_EMAIL, primaryGuardian.getEmail());
        put(values, CaseField.GUARDIAN1_PHONE, primaryGuardian.getPhone());
        put(values, CaseField.GUARDIAN1_RELATIONSHIP, primaryGuardian.getRelationship());
        put(values, CaseField.GUARDIAN1_DOB, primaryGuardian.getDateOfBirth());

        put(values, CaseField.GUARDIAN2_NAME, secondaryGuardian.getName());
        put(values, CaseField.GUARDIAN2_ADDRESS, secondaryGuardian.getAddress());
        put(values, CaseField.GUARDIAN2_EMAIL, secondaryGuardian.getEmail());
        put(values, CaseField.GUARDIAN2_PHONE, secondaryGuardian.getPhone());
        put(values, CaseField.GUARDIAN2_RELATIONSHIP, secondaryGuardian.getRelationship());
        put(values, CaseField.GUARDIAN2_DOB, secondaryGuardian.getDateOfBirth());

        put(values, CaseField.DATE_ARP_FILED, dateArpFiled);
        put(values, CaseField.DATE_APPOINTED, dateAppointed);
        return values;
    }

    private static void put(Map<CaseField, String> values, CaseField field, String value) {
        if (value != null && !value.isBlank()) {
            values.put(field, value.trim());
        }
    }
}
