package com.example.guardianintake.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

/**
 * One row of the case store, keyed by cause number. Column names follow the
 * intake spreadsheet the downstream tools read.
 */
@Entity
@Table(name = "case_records", uniqueConstraints = @UniqueConstraint(name = "uk_case_records_causeno",
    columnNames = "causeno"))
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CaseRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "causeno", nullable = false, updatable = false, length = 32)
    private String causeNumber;

    // Ward
    @Column(name = "wardlast")
    private String wardLast;

    @Column(name = "wardfirst")
    private String wardFirst;

    @Column(name = "wardmiddle")
    private String wardMiddle;

    @Column(name = "wtele")
    private String wardPhone;

    @Column(name = "liveswith")
    private String livesWith;

    @Column(name = "waddress", length = 512)
    private String wardAddress;

    @Column(name = "wdob")
    private String wardDob;

    // Primary guardian
    @Column(name = "guardian1")
    private String guardian1Name;

    @Column(name = "gaddress", length = 512)
    private String guardian1Address;

    @Column(name = "gemail")
    private String guardian1Email;

    @Column(name = "gtele")
    private String guardian1Phone;

    @Column(name = "relationship")
    private String guardian1Relationship;

    @Column(name = "gdob")
    private String guardian1Dob;

    // Secondary guardian
    @Column(name = "guardian2")
    private String guardian2Name;

    @Column(name = "g2address", length = 512)
    private String guardian2Address;

    @Column(name = "g2email")
    private String guardian2Email;

    @Column(name = "g2tele")
    private String guardian2Phone;

    @Column(name = "g2relationship")
    private String guardian2Relationship;

    @Column(name = "g2dob")
    private String guardian2Dob;

    // Dates
    @Column(name = "datearpfiled")
    private String dateArpFiled;

    @Column(name = "dateappointed")
    private String dateAppointed;

    // Columns owned by downstream tools; never written by the intake pipeline
    @Column(name = "visitdate")
    private String visitDate;

    @Column(name = "visittime")
    private String visitTime;

    @Column(name = "datesubmitted")
    private String dateSubmitted;

    @Column(name = "miles")
    private String miles;

    @Column(name = "expense_submitted")
    private String expenseSubmitted;

    @Column(name = "expensepd")
    private String expensePaid;

    @Column(name = "comments", columnDefinition = "TEXT")
    private String comments;

    @Column(name = "cvr_created")
    private String cvrCreated;

    @Column(name = "emailsent")
    private String emailSent;

    @Column(name = "appt_confirmed")
    private String appointmentConfirmed;

    @Column(name = "contact_added")
    private String contactAdded;

    // Intake bookkeeping
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "case_field_status", joinColumns = @JoinColumn(name = "case_record_id"))
    @MapKeyEnumerated(EnumType.STRING)
    @MapKeyColumn(name = "field_name")
    @Enumerated(EnumType.STRING)
    @Column(name = "status")
    private Map<CaseField, FieldStatus> fieldStatuses = new HashMap<>();

    @Column(name = "needs_review")
    private Boolean needsReview = false;

    @Column(name = "low_confidence")
    private Boolean lowConfidence = false;

    @Column(name = "last_source_file")
    private String lastSourceFile;

    @Column(name = "last_engine")
    private String lastEngine;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "last_updated")
    private LocalDateTime lastUpdated;

    /**
     * Status of a field; a populated field without a recorded status was entered by hand.
     */
    public FieldStatus statusOf(CaseField field) {
        FieldStatus status = fieldStatuses.get(field);
        if (status != null) {
            return status;
        }
        String value = field.read(this);
        return value == null || value.isBlank() ? FieldStatus.MISSING : FieldStatus.VERIFIED;
    }

    public enum FieldStatus {
        MISSING,
        EXTRACTED,
        NEEDS_REVIEW,
        VERIFIED
    }
}
