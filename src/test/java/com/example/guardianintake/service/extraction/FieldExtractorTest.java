package com.example.guardianintake.service.extraction;

import com.example.guardianintake.dto.extraction.AnchorType;
import com.example.guardianintake.dto.extraction.FieldCapture;
import com.example.guardianintake.dto.extraction.SectionKind;
import com.example.guardianintake.dto.extraction.SectionSpan;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class FieldExtractorTest {

    private final FieldExtractor extractor = ExtractionFixtures.extractor();

    private static SectionSpan whole(String text) {
        return new SectionSpan(SectionKind.GUARDIAN, 0, 0, text.length(), AnchorType.PRIMARY, "2. GUARDIAN(s)");
    }

    @Nested
    @DisplayName("Label capture")
    class Capture {

        @Test
        void capturesValueUpToNextLabelOnSameLine() {
            String text = "Name(s): Mary Park Phone: 512-555-0101\n";
            Optional<FieldCapture> name = extractor.extract(text, whole(text), FieldSpecs.NAME);

            assertThat(name).isPresent();
            assertThat(name.get().getValue()).isEqualTo("Mary Park");
        }

        @Test
        void labelAloneOnItsLineTakesNextLine() {
            String text = "Name(s):\nMary Park\nPhone: 512-555-0101\n";
            Optional<FieldCapture> name = extractor.extract(text, whole(text), FieldSpecs.NAME);

            assertThat(name.get().getValue()).isEqualTo("Mary Park");
        }

        @Test
        void addressCapturesTwoLinesUntilCityLabel() {
            String text = "Address: 200 Elm Street\nApt 4\nCity/State/Zip: Austin, TX 78702\n";
            Optional<FieldCapture> address = extractor.extract(text, whole(text), FieldSpecs.ADDRESS);

            assertThat(address.get().getValue()).isEqualTo("200 Elm Street\nApt 4");
        }

        @Test
        void emptyValueIsReportedSeparatelyFromMissingLabel() {
            String text = "Email:\nRelationship: Mother\n";

            Optional<FieldCapture> email = extractor.extract(text, whole(text), FieldSpecs.EMAIL);
            assertThat(email).isPresent();
            assertThat(email.get().hasValue()).isFalse();

            assertThat(extractor.extract(text, whole(text), FieldSpecs.PHONE)).isEmpty();
        }

        @Test
        void labelPositionIsAbsoluteInPage() {
            String page = "HEADER\nName(s): Mary Park\n";
            SectionSpan span = new SectionSpan(SectionKind.GUARDIAN, 0, 7, page.length(), AnchorType.PRIMARY, "x");

            assertThat(extractor.extract(page, span, FieldSpecs.NAME).get().getLabelPosition()).isEqualTo(7);
        }

        @Test
        void searchesOnlyInsideSpan() {
            String page = "Name: Harold Park\nPhone: 512-555-0100\n";
            SectionSpan span = new SectionSpan(SectionKind.GUARDIAN, 18, 18, page.length(), AnchorType.PRIMARY, "x");

            assertThat(extractor.extract(page, span, FieldSpecs.NAME)).isEmpty();
            assertThat(extractor.extract(page, null, FieldSpecs.NAME)).isEmpty();
        }

        @Test
        void appliesFieldScopedCorrections() {
            String text = "Phone: 5l2-555-OlOO\n";
            FieldCapture phone = extractor.extract(text, whole(text), FieldSpecs.PHONE).get();

            assertThat(phone.getValue()).isEqualTo("512-555-0100");
            assertThat(phone.getCorrections()).contains("phone-letter-o", "phone-letter-l");
        }
    }

    @Nested
    @DisplayName("Surname correction against the ward")
    class Surname {

        @Test
        void oneEditAwayTakesWardSpelling() {
            FieldExtractor.SurnameCheck check = extractor.correctSurname("Derek Pack", "Park", "Name(s): Derek Pack");

            assertThat(check.isCorrected()).isTrue();
            assertThat(check.getName()).isEqualTo("Derek Park");
        }

        @Test
        void middleNameIsKeptWhenSurnameIsCorrected() {
            FieldExtractor.SurnameCheck check = extractor.correctSurname("Randal Michael Pack", "Park",
                "Name(s): Randal Michael Pack");

            assertThat(check.isCorrected()).isTrue();
            assertThat(check.getName()).isEqualTo("Randal Michael Park");
        }

        @Test
        @DisplayName("an added or dropped letter is a different surname, not a misread")
        void lengthChangeIsLeftAlone() {
            assertThat(extractor.correctSurname("Mary Parks", "Park", "Name(s): Mary Parks").getName())
                .isEqualTo("Mary Parks");
            assertThat(extractor.correctSurname("Mary Parr", "Parry", "Name(s): Mary Parr").isCorrected())
                .isFalse();
        }

        @Test
        void differentFirstLetterIsLeftAlone() {
            FieldExtractor.SurnameCheck check = extractor.correctSurname("Derek Bark", "Park", "Derek Bark");

            assertThat(check.isCorrected()).isFalse();
            assertThat(check.getName()).isEqualTo("Derek Bark");
        }

        @Test
        void spellingRepeatedInEvidenceIsDeliberate() {
            FieldExtractor.SurnameCheck check = extractor.correctSurname("Derek Pack", "Park",
                "Name(s): Derek Pack\nEmail: derek PACK family");

            assertThat(check.isCorrected()).isFalse();
        }

        @Test
        void distantSurnameIsLeftAlone() {
            assertThat(extractor.correctSurname("Derek Pritchard", "Park", "").isCorrected()).isFalse();
        }

        @Test
        void missingWardSurnameChangesNothing() {
            assertThat(extractor.correctSurname("Derek Pack", null, "").getName()).isEqualTo("Derek Pack");
        }
    }
}
