package com.example.guardianintake.service.extraction;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DocumentDatesTest {

    @Nested
    @DisplayName("Signed date")
    class Signed {

        @Test
        void dayOfPhrasing() {
            assertThat(DocumentDates.findSignedDate("Signed on this the 14th day of March, 2023."))
                .contains("03/14/2023");
        }

        @Test
        void numericAfterSigned() {
            assertThat(DocumentDates.findSignedDate("Signed on 3/14/2023")).contains("03/14/2023");
        }

        @Test
        void dateBeforeJudgeLine() {
            String text = "IT IS SO ORDERED.\n04/02/2022\n\n\nJUDGE PRESIDING";

            assertThat(DocumentDates.findSignedDate(text)).contains("04/02/2022");
        }

        @Test
        void noDate() {
            assertThat(DocumentDates.findSignedDate("IT IS SO ORDERED.")).isEmpty();
        }
    }

    @Nested
    @DisplayName("Filed date")
    class Filed {

        @Test
        void clerkStampYearFirst() {
            assertThat(DocumentDates.findFiledDate("FILED 2023 Mar 14 AM 10:02")).contains("03/14/2023");
        }

        @Test
        void numericFiled() {
            assertThat(DocumentDates.findFiledDate("Filed: 01/05/2024")).contains("01/05/2024");
        }

        @Test
        void noStamp() {
            assertThat(DocumentDates.findFiledDate("Application for Guardianship")).isEmpty();
        }
    }
}
