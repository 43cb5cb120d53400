package com.example.guardianintake.service.extraction;

import com.example.guardianintake.dto.DocumentType;
import com.example.guardianintake.dto.extraction.AnchorType;
import com.example.guardianintake.dto.extraction.ExtractedCase;
import com.example.guardianintake.dto.extraction.FieldProvenance;
import com.example.guardianintake.dto.extraction.MissingReason;
import com.example.guardianintake.model.CaseField;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class IntakeFormParserTest {

    private IntakeFormParser parser;

    @BeforeEach
    void setUp() {
        parser = ExtractionFixtures.intakeFormParser();
    }

    @Nested
    @DisplayName("Standard layout with both guardians")
    class StandardLayout {

        private ExtractedCase result;

        @BeforeEach
        void parse() {
            result = parser.parse(ExtractionFixtures.fixture("arp-standard.txt"), "23-001234 ARP.pdf",
                "native-text-layer", null);
        }

        @Test
        void readsCauseNumberAndWard() {
            assertThat(result.getDocumentType()).isEqualTo(DocumentType.ARP);
            assertThat(result.getCauseNumber()).isEqualTo("23-001234");
            assertThat(result.getCauseNumberSource()).isEqualTo(AnchorType.DOCUMENT);
            assertThat(result.getWard().getFirstName()).isEqualTo("Harold");
            assertThat(result.getWard().getMiddleName()).isEqualTo("James");
            assertThat(result.getWard().getLastName()).isEqualTo("Park");
            assertThat(result.getWard().getDateOfBirth()).isEqualTo("04/15/1948");
            assertThat(result.getWard().getPhone()).isEqualTo("(512) 555-0100");
            assertThat(result.getWard().getAddress()).isEqualTo("100 Oak Lane, Austin, TX 78701");
        }

        @Test
        void splitsGuardianNamesOnConjunctionWithAdjacentSemicolon() {
            assertThat(result.getPrimaryGuardian().getName()).isEqualTo("Mary Park");
            assertThat(result.getSecondaryGuardian().getName()).isEqualTo("Derek Park");
        }

        @Test
        @DisplayName("secondary surname one edit from the ward's takes the ward's spelling")
        void correctsSecondarySurname() {
            FieldProvenance provenance = result.getProvenance().get(CaseField.GUARDIAN2_NAME);
            assertThat(provenance.getCorrections()).contains(FieldExtractor.SURNAME_RULE);
            assertThat(provenance.getAnchorType()).isEqualTo(AnchorType.PRIMARY);
        }

        @Test
        void splitsSharedPhoneDateAndRelationship() {
            assertThat(result.getPrimaryGuardian().getPhone()).isEqualTo("(512) 555-0101");
            assertThat(result.getSecondaryGuardian().getPhone()).isEqualTo("(512) 555-0102");
            assertThat(result.getPrimaryGuardian().getDateOfBirth()).isEqualTo("07/22/1960");
            assertThat(result.getSecondaryGuardian().getDateOfBirth()).isEqualTo("03/23/1956");
            assertThat(result.getPrimaryGuardian().getRelationship()).isEqualTo("Daughter");
            assertThat(result.getSecondaryGuardian().getRelationship()).isEqualTo("Son");
        }

        @Test
        void singleEmailStaysWithPrimary() {
            assertThat(result.getPrimaryGuardian().getEmail()).isEqualTo("mary.park@example.com");
            assertThat(result.getSecondaryGuardian().getEmail()).isNull();
            assertThat(result.getProvenance().get(CaseField.GUARDIAN2_EMAIL).getMissingReason())
                .isEqualTo(MissingReason.NOT_ON_DOCUMENT);
        }

        @Test
        @DisplayName("co-residency phrase copies the primary address to the secondary guardian")
        void mirrorsAddress() {
            assertThat(result.getPrimaryGuardian().getAddress()).isEqualTo("200 Elm Street, Austin, TX 78702");
            assertThat(result.getSecondaryGuardian().getAddress()).isEqualTo("200 Elm Street, Austin, TX 78702");
            assertThat(result.getProvenance().get(CaseField.GUARDIAN2_ADDRESS).getCorrections())
                .contains(IntakeFormParser.MIRRORED_ADDRESS);
        }

        @Test
        void readsLivesWithAndFilingStamp() {
            assertThat(result.getLivesWith()).isEqualTo("Yes");
            assertThat(result.getDateArpFiled()).isEqualTo("03/14/2023");
        }

        @Test
        void recordsEngineOnEveryExtractedField() {
            assertThat(result.getProvenance().values())
                .filteredOn(FieldProvenance::isExtracted)
                .allSatisfy(p -> assertThat(p.getEngine()).isEqualTo("native-text-layer"));
        }
    }

    @Nested
    @DisplayName("Secondary guardian named above the Name(s) label")
    class PreAnchor {

        private ExtractedCase result;

        @BeforeEach
        void parse() {
            result = parser.parse(ExtractionFixtures.fixture("arp-pre-anchor.txt"), "arp.pdf", "tesseract", null);
        }

        @Test
        void nameLineAboveLabelIsSecondaryGuardian() {
            assertThat(result.getPrimaryGuardian().getName()).isEqualTo("Michael Mogonye");
            assertThat(result.getSecondaryGuardian().getName()).isEqualTo("Joslyn Mogonye");
            assertThat(result.getProvenance().get(CaseField.GUARDIAN2_NAME).getAnchorType())
                .isEqualTo(AnchorType.SHAPE_HEURISTIC);
        }

        @Test
        void sharedFieldsStillSplitAcrossBoth() {
            assertThat(result.getPrimaryGuardian().getPhone()).isEqualTo("(512) 555-0111");
            assertThat(result.getSecondaryGuardian().getPhone()).isEqualTo("(512) 555-0112");
            assertThat(result.getPrimaryGuardian().getDateOfBirth()).isEqualTo("07/22/1960");
            assertThat(result.getSecondaryGuardian().getDateOfBirth()).isEqualTo("03/23/1956");
        }

        @Test
        void addressWithoutSignalIsNotGuessed() {
            assertThat(result.getSecondaryGuardian().getAddress()).isNull();
        }
    }

    @Nested
    @DisplayName("Reflowed layout without numbered headers")
    class Reflowed {

        private ExtractedCase result;

        @BeforeEach
        void parse() {
            result = parser.parse(ExtractionFixtures.fixture("arp-reflowed.txt"), "arp.pdf", "google-vision", null);
        }

        @Test
        void fallbackAnchorsLocateBothSections() {
            assertThat(result.getWard().getFirstName()).isEqualTo("Louise");
            assertThat(result.getWard().getLastName()).isEqualTo("Carter");
            assertThat(result.getProvenance().get(CaseField.GUARDIAN1_NAME).getAnchorType())
                .isEqualTo(AnchorType.FALLBACK);
        }

        @Test
        void sharedSurnameGoesToBothGuardians() {
            assertThat(result.getPrimaryGuardian().getName()).isEqualTo("Michael Grant");
            assertThat(result.getSecondaryGuardian().getName()).isEqualTo("Joslyn Grant");
        }

        @Test
        void repairsOcrDamageInEmail() {
            assertThat(result.getPrimaryGuardian().getEmail()).isEqualTo("m.grant@example.com");
            assertThat(result.getProvenance().get(CaseField.GUARDIAN1_EMAIL).getCorrections())
                .contains("email-spaces", "email-comma-tld");
        }

        @Test
        void leavesUnansweredFieldsMissing() {
            assertThat(result.getLivesWith()).isNull();
            assertThat(result.getDateArpFiled()).isNull();
            assertThat(result.getSecondaryGuardian().getAddress()).isNull();
            assertThat(result.getProvenance().get(CaseField.LIVES_WITH).isExtracted()).isFalse();
        }

        @Test
        void normalizesRelationship() {
            assertThat(result.getPrimaryGuardian().getRelationship()).isEqualTo("Niece/Nephew");
        }
    }

    @Nested
    @DisplayName("Fallback anchors that are field labels")
    class LabelAnchors {

        @Test
        void wardNameAndGuardianNamesAnchorsKeepTheirNames() {
            String text = "Cause No. 23-001234\nWard Name: Harold James Park\nDOB: 01/02/1940\n\n"
                + "Guardian Name(s): Mary Park and Derek Hall\nDOB: 7/22/60 and 3/23/56\n"
                + "Phone: 512-555-0101 and 512-555-0102\n";
            ExtractedCase result = parser.parse(text, "arp.pdf", "native-text-layer", null);

            assertThat(result.getWard().getFirstName()).isEqualTo("Harold");
            assertThat(result.getWard().getLastName()).isEqualTo("Park");
            assertThat(result.getWard().getDateOfBirth()).isEqualTo("01/02/1940");
            assertThat(result.getPrimaryGuardian().getName()).isEqualTo("Mary Park");
            assertThat(result.getSecondaryGuardian().getName()).isEqualTo("Derek Hall");
            assertThat(result.getPrimaryGuardian().getDateOfBirth()).isEqualTo("07/22/1960");
            assertThat(result.getSecondaryGuardian().getPhone()).isEqualTo("(512) 555-0102");
            assertThat(result.getProvenance().get(CaseField.GUARDIAN1_NAME).getAnchorType())
                .isEqualTo(AnchorType.FALLBACK);
        }

        @Test
        void guardianNamesAnchorAfterNumberedWardSection() {
            String text = "Cause No. 23-001234\n1. WARD\nName: Harold Park\n\n"
                + "Guardian Name(s): Mary Park\nPhone: 512-555-0101\n";
            ExtractedCase result = parser.parse(text, "arp.pdf", "native-text-layer", null);

            assertThat(result.getWard().getLastName()).isEqualTo("Park");
            assertThat(result.getPrimaryGuardian().getName()).isEqualTo("Mary Park");
            assertThat(result.getPrimaryGuardian().getPhone()).isEqualTo("(512) 555-0101");
            assertThat(result.getProvenance().get(CaseField.GUARDIAN1_NAME).getAnchorLabel())
                .isEqualTo("Guardian Name(s)");
        }
    }

    @Nested
    @DisplayName("Missing guardian section")
    class NoGuardianSection {

        @Test
        void reportsGuardianFieldsMissingInsteadOfReadingWardText() {
            String text = "Cause No. 23-001234\n\n1. WARD\nName: Harold Park\nPhone: 512-555-0100\n"
                + "Address: 100 Oak Lane\n";
            ExtractedCase result = parser.parse(text, "arp.pdf", "native-text-layer", null);

            assertThat(result.getWard().getLastName()).isEqualTo("Park");
            assertThat(result.hasAnyGuardianName()).isFalse();
            assertThat(result.getPrimaryGuardian().getPhone()).isNull();
            assertThat(result.getProvenance().get(CaseField.GUARDIAN1_NAME).getMissingReason())
                .isEqualTo(MissingReason.SECTION_NOT_FOUND);
            assertThat(result.getProvenance().get(CaseField.GUARDIAN1_PHONE).getMissingReason())
                .isEqualTo(MissingReason.SECTION_NOT_FOUND);
        }
    }

    @Nested
    @DisplayName("Cause number hint")
    class CauseHint {

        @Test
        void hintFillsCauseNumberOnlyWhenTextHasNone() {
            String text = "1. WARD\nName: Harold Park\n";
            ExtractedCase result = parser.parse(text, "arp.pdf", "tesseract", "C-1-PB-23-1234");

            assertThat(result.getCauseNumber()).isEqualTo("23-001234");
            assertThat(result.getCauseNumberSource()).isEqualTo(AnchorType.HINT);
        }

        @Test
        void hintNeverReplacesExtractedNumber() {
            ExtractedCase result = parser.parse(ExtractionFixtures.fixture("arp-standard.txt"), "arp.pdf",
                "native-text-layer", "23-001235");

            assertThat(result.getCauseNumber()).isEqualTo("23-001234");
            assertThat(result.isCauseNumberMismatch()).isTrue();
            assertThat(result.getNotes()).anyMatch(n -> n.contains("differs from expected 23-001235 by one digit"));
        }
    }

    @Test
    void danglingConjunctionKeepsSingleName() {
        String text = "Cause No. 23-001234\n1. WARD\nName: Harold Park\n\n2. GUARDIAN(s)\nName(s): Mary Park and\n";
        ExtractedCase result = parser.parse(text, "arp.pdf", "native-text-layer", null);

        assertThat(result.getPrimaryGuardian().getName()).isEqualTo("Mary Park");
        assertThat(result.getSecondaryGuardian().getName()).isNull();
    }
}
