package com.example.guardianintake.model;

import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * The case record columns the intake pipeline may fill. Cause number and the
 * downstream status columns are deliberately absent.
 */
public enum CaseField {
    WARD_LAST("wardlast", CaseRecord::getWardLast, CaseRecord::setWardLast, true),
    WARD_FIRST("wardfirst", CaseRecord::getWardFirst, CaseRecord::setWardFirst, true),
    WARD_MIDDLE("wardmiddle", CaseRecord::getWardMiddle, CaseRecord::setWardMiddle, false),
    WARD_PHONE("wtele", CaseRecord::getWardPhone, CaseRecord::setWardPhone, false),
    LIVES_WITH("liveswith", CaseRecord::getLivesWith, CaseRecord::setLivesWith, false),
    WARD_ADDRESS("waddress", CaseRecord::getWardAddress, CaseRecord::setWardAddress, false),
    WARD_DOB("wdob", CaseRecord::getWardDob, CaseRecord::setWardDob, false),

    GUARDIAN1_NAME("guardian1", CaseRecord::getGuardian1Name, CaseRecord::setGuardian1Name, false),
    GUARDIAN1_ADDRESS("gaddress", CaseRecord::getGuardian1Address, CaseRecord::setGuardian1Address, false),
    GUARDIAN1_EMAIL("gemail", CaseRecord::getGuardian1Email, CaseRecord::setGuardian1Email, false),
    GUARDIAN1_PHONE("gtele", CaseRecord::getGuardian1Phone, CaseRecord::setGuardian1Phone, false),
    GUARDIAN1_RELATIONSHIP("Relationship", CaseRecord::getGuardian1Relationship,
        CaseRecord::setGuardian1Relationship, false),
    GUARDIAN1_DOB("gdob", CaseRecord::getGuardian1Dob, CaseRecord::setGuardian1Dob, false),

    GUARDIAN2_NAME("Guardian2", CaseRecord::getGuardian2Name, CaseRecord::setGuardian2Name, false),
    GUARDIAN2_ADDRESS("g2 address", CaseRecord::getGuardian2Address, CaseRecord::setGuardian2Address, false),
    GUARDIAN2_EMAIL("g2eamil", CaseRecord::getGuardian2Email, CaseRecord::setGuardian2Email, false),
    GUARDIAN2_PHONE("g2tele", CaseRecord::getGuardian2Phone, CaseRecord::setGuardian2Phone, false),
    GUARDIAN2_RELATIONSHIP("g2Relationship", CaseRecord::getGuardian2Relationship,
        CaseRecord::setGuardian2Relationship, false),
    GUARDIAN2_DOB("g2dob", CaseRecord::getGuardian2Dob, CaseRecord::setGuardian2Dob, false),

    DATE_ARP_FILED("DateARPfiled", CaseRecord::getDateArpFiled, CaseRecord::setDateArpFiled, false),
    DATE_APPOINTED("Dateappointed", CaseRecord::getDateAppointed, CaseRecord::setDateAppointed, false);

    private final String header;
    private final Function<CaseRecord, String> getter;
    private final BiConsumer<CaseRecord, String> setter;
    private final boolean critical;

    CaseField(String header, Function<CaseRecord, String> getter, BiConsumer<CaseRecord, String> setter,
              boolean critical) {
        this.header = header;
        this.getter = getter;
        this.setter = setter;
        this.critical = critical;
    }

    /** Column header in the exported spreadsheet. */
    public String getHeader() {
        return header;
    }

    /** Ward name parts; a record missing one is flagged for manual review. */
    public boolean isCritical() {
        return critical;
    }

    public String read(CaseRecord record) {
        return getter.apply(record);
    }

    public void write(CaseRecord record, String value) {
        setter.accept(record, value);
    }

    /**
     * Case-insensitive lookup by enum name or spreadsheet header.
     */
    public static CaseField fromName(String name) {
        for (CaseField field : values()) {
            if (field.name().equalsIgnoreCase(name) || field.header.equalsIgnoreCase(name)) {
                return field;
            }
        }
        throw new IllegalArgumentException("Unknown case field: " + name);
    }
}
