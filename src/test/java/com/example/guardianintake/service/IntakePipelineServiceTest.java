package com.example.guardianintake.service;

import com.example.guardianintake.config.IntakeProperties;
import com.example.guardianintake.dto.BatchIntakeResponse;
import com.example.guardianintake.dto.DocumentType;
import com.example.guardianintake.dto.IntakeDocument;
import com.example.guardianintake.dto.IntakeResultSummary;
import com.example.guardianintake.dto.IntakeResultSummary.Outcome;
import com.example.guardianintake.dto.extraction.ExtractedCase;
import com.example.guardianintake.dto.ocr.CascadeResult;
import com.example.guardianintake.dto.store.MergeOutcome;
import com.example.guardianintake.model.CaseField;
import com.example.guardianintake.service.extraction.ExtractionFixtures;
import com.example.guardianintake.service.extraction.FieldExtractor;
import com.example.guardianintake.service.ocr.OcrCascadeService;
import com.example.guardianintake.service.store.CaseStoreLock;
import com.example.guardianintake.service.store.RecordAssemblerService;
import com.example.guardianintake.service.store.StoreUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.springframework.test.util.ReflectionTestUtils;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class IntakePipelineServiceTest {

    private static final String NO_GUARDIAN_NAMES = "Cause No. C-1-PB-23-001234\n"
        + "APPLICATION FOR REVIEW OF PLACEMENT\n"
        + "1. WARD\n"
        + "Name: Harold James Park\n"
        + "2. GUARDIAN(s)\n"
        + "Name(s):\n";

    private OcrCascadeService cascade;
    private RecordAssemblerService recordAssembler;
    private CaseStoreLock storeLock;
    private IntakeProperties properties;
    private IntakePipelineService pipeline;

    private final Map<String, String> pageTexts = new HashMap<>();
    private final List<String> causesStored = new ArrayList<>();

    @BeforeEach
    void setUp() {
        cascade = mock(OcrCascadeService.class);
        recordAssembler = mock(RecordAssemblerService.class);
        storeLock = mock(CaseStoreLock.class);
        properties = new IntakeProperties();

        pipeline = new IntakePipelineService();
        ReflectionTestUtils.setField(pipeline, "cascade", cascade);
        ReflectionTestUtils.setField(pipeline, "intakeFormParser", ExtractionFixtures.intakeFormParser());
        ReflectionTestUtils.setField(pipeline, "courtOrderParser", ExtractionFixtures.courtOrderParser());
        ReflectionTestUtils.setField(pipeline, "recordAssembler", recordAssembler);
        ReflectionTestUtils.setField(pipeline, "storeLock", storeLock);
        ReflectionTestUtils.setField(pipeline, "intakeProperties", properties);

        when(cascade.run(any())).thenAnswer(invocation -> {
            IntakeDocument document = invocation.getArgument(0);
            return reading(pageTexts.getOrDefault(document.getFileName(), ""), "native-text");
        });
        when(cascade.escalate(any(), any())).thenReturn(Optional.empty());
        when(recordAssembler.upsert(any(), anyString())).thenAnswer(invocation -> {
            ExtractedCase extracted = invocation.getArgument(0);
            causesStored.add(extracted.getCauseNumber());
            MergeOutcome outcome = new MergeOutcome();
            outcome.setCauseNumber(extracted.getCauseNumber());
            outcome.setCreated(true);
            outcome.setFlaggedForReview(extracted.isCauseNumberMismatch());
            return outcome;
        });
    }

    private static CascadeResult reading(String text, String engine) {
        CascadeResult result = new CascadeResult();
        result.setText(text);
        result.setEngineName(text.isEmpty() ? null : engine);
        result.setCharCount(text.length());
        result.setLowConfidence(text.length() < 80);
        return result;
    }

    private IntakeDocument document(String fileName, String text) {
        pageTexts.put(fileName, text);
        return new IntakeDocument(fileName, new byte[] {1}, null, DocumentType.UNKNOWN);
    }

    private ExtractedCase storedCase() {
        ArgumentCaptor<ExtractedCase> captor = ArgumentCaptor.forClass(ExtractedCase.class);
        verify(recordAssembler).upsert(captor.capture(), anyString());
        return captor.getValue();
    }

    @Nested
    @DisplayName("Single document")
    class SingleDocument {

        @Test
        void storesApplication() {
            IntakeResultSummary summary = pipeline.process(
                document("23-001234 ARP.pdf", ExtractionFixtures.fixture("arp-standard.txt")));

            assertThat(summary.getOutcome()).isEqualTo(Outcome.PROCESSED);
            assertThat(summary.getDocumentType()).isEqualTo(DocumentType.ARP);
            assertThat(summary.getCauseNumber()).isEqualTo("23-001234");
            assertThat(summary.getEngine()).isEqualTo("native-text");
            assertThat(summary.isCreated()).isTrue();
            assertThat(summary.getExtractedFields()).contains(CaseField.WARD_LAST, CaseField.GUARDIAN2_NAME);
            assertThat(summary.getCorrectionsApplied()).contains(FieldExtractor.SURNAME_RULE);
            assertThat(storedCase().getPrimaryGuardian().getName()).isEqualTo("Mary Park");
            verify(storeLock).acquire();
        }

        @Test
        void classifiesOrderByText() {
            IntakeResultSummary summary = pipeline.process(
                document("scan-0001.pdf", ExtractionFixtures.fixture("order-standard.txt")));

            assertThat(summary.getDocumentType()).isEqualTo(DocumentType.ORDER);
            assertThat(storedCase().getDateAppointed()).isEqualTo("03/14/2023");
        }

        @Test
        void skipsApprovalLetters() {
            IntakeResultSummary summary = pipeline.process(document("23-001234 Approved.pdf", "anything"));

            assertThat(summary.getOutcome()).isEqualTo(Outcome.SKIPPED);
            verify(cascade, never()).run(any());
        }

        @Test
        void noTextFails() {
            IntakeResultSummary summary = pipeline.process(document("23-001234 ARP.pdf", ""));

            assertThat(summary.getOutcome()).isEqualTo(Outcome.FAILED);
            verify(recordAssembler, never()).upsert(any(), anyString());
        }

        @Test
        void missingCauseNumberIsNotStored() {
            String text = "APPLICATION FOR REVIEW OF PLACEMENT\n1. WARD\nName: Harold James Park\n";

            IntakeResultSummary summary = pipeline.process(document("scan.pdf", text));

            assertThat(summary.getOutcome()).isEqualTo(Outcome.REVIEW_REQUIRED);
            assertThat(summary.isFlaggedForReview()).isTrue();
            verify(storeLock, never()).acquire();
            verify(recordAssembler, never()).upsert(any(), anyString());
        }

        @Test
        void callerHintFillsMissingCauseNumber() {
            IntakeDocument document = document("scan.pdf",
                "APPLICATION FOR REVIEW OF PLACEMENT\n1. WARD\nName: Harold James Park\n");
            document.setCauseNumberHint("C-1-PB-23-001234");

            IntakeResultSummary summary = pipeline.process(document);

            assertThat(summary.getCauseNumber()).isEqualTo("23-001234");
            assertThat(causesStored).containsExactly("23-001234");
        }
    }

    @Nested
    @DisplayName("Store failures")
    class StoreFailures {

        @Test
        void lockedStoreWritesNothing() {
            when(storeLock.acquire()).thenThrow(new StoreUnavailableException("Case store is locked by another writer"));

            IntakeResultSummary summary = pipeline.process(
                document("23-001234 ARP.pdf", ExtractionFixtures.fixture("arp-standard.txt")));

            assertThat(summary.getOutcome()).isEqualTo(Outcome.STORE_UNAVAILABLE);
            assertThat(summary.getErrorMessage()).contains("locked");
            verify(recordAssembler, never()).upsert(any(), anyString());
        }

        @Test
        void writeErrorFailsDocument() {
            doThrow(new IllegalStateException("disk full")).when(recordAssembler).upsert(any(), anyString());

            IntakeResultSummary summary = pipeline.process(
                document("23-001234 ARP.pdf", ExtractionFixtures.fixture("arp-standard.txt")));

            assertThat(summary.getOutcome()).isEqualTo(Outcome.FAILED);
            assertThat(summary.getErrorMessage()).contains("disk full");
            assertThat(causesStored).isEmpty();
            verify(recordAssembler).upsert(any(), anyString());
        }
    }

    @Nested
    @DisplayName("Escalation")
    class Escalation {

        @Test
        void keepsEscalatedReadingThatFindsGuardians() {
            when(cascade.escalate(any(), any()))
                .thenReturn(Optional.of(reading(ExtractionFixtures.fixture("arp-standard.txt"), "google-vision")));

            IntakeResultSummary summary = pipeline.process(document("23-001234 ARP.pdf", NO_GUARDIAN_NAMES));

            assertThat(summary.isEscalated()).isTrue();
            assertThat(summary.getEngine()).isEqualTo("google-vision");
            assertThat(storedCase().getPrimaryGuardian().getName()).isEqualTo("Mary Park");
        }

        @Test
        void keepsFirstReadingWhenEscalationAddsNothing() {
            when(cascade.escalate(any(), any())).thenReturn(Optional.of(reading("~~ ..", "google-vision")));

            IntakeResultSummary summary = pipeline.process(document("23-001234 ARP.pdf", NO_GUARDIAN_NAMES));

            assertThat(summary.isEscalated()).isFalse();
            assertThat(summary.getEngine()).isEqualTo("native-text");
        }

        @Test
        void disabledEscalationIsNotAttempted() {
            properties.getCascade().setEscalationEnabled(false);

            pipeline.process(document("23-001234 ARP.pdf", NO_GUARDIAN_NAMES));

            verify(cascade, never()).escalate(any(), any());
        }

        @Test
        void ordersAreNotEscalated() {
            pipeline.process(document("23-001234 Order.pdf", "Cause No. 23-001234\nIT IS ORDERED.\n"));

            verify(cascade, never()).escalate(any(), any());
        }
    }

    @Nested
    @DisplayName("Batches")
    class Batches {

        @Test
        void ordersRunFirstAndHintTheApplications() {
            String arpWithTypo = ExtractionFixtures.fixture("arp-standard.txt")
                .replace("C-1-PB-23-001234", "C-1-PB-23-001284");
            IntakeDocument arp = document("23-001284 ARP.pdf", arpWithTypo);
            IntakeDocument order = document("23-001234 Order.pdf", ExtractionFixtures.fixture("order-standard.txt"));

            BatchIntakeResponse response = pipeline.processBatch(List.of(arp, order));

            assertThat(response.getResults()).extracting(IntakeResultSummary::getFileName)
                .containsExactly("23-001234 Order.pdf", "23-001284 ARP.pdf");
            assertThat(causesStored).containsExactly("23-001234", "23-001284");
            assertThat(response.getResults().get(1).getNotes()).anyMatch(note -> note.contains("by one digit"));
            assertThat(response.getTotalProcessed()).isEqualTo(1);
            assertThat(response.getTotalReviewRequired()).isEqualTo(1);
        }

        @Test
        void oneFailureDoesNotStopTheBatch() {
            IntakeDocument empty = document("23-000001 ARP.pdf", "");
            IntakeDocument good = document("23-001234 ARP.pdf", ExtractionFixtures.fixture("arp-standard.txt"));
            IntakeDocument approval = document("23-001234 approval.pdf", "ignored");

            BatchIntakeResponse response = pipeline.processBatch(List.of(empty, good, approval));

            assertThat(response.getTotalFailed()).isEqualTo(1);
            assertThat(response.getTotalProcessed()).isEqualTo(1);
            assertThat(response.getTotalSkipped()).isEqualTo(1);
            assertThat(response.getErrors()).extracting(BatchIntakeResponse.IntakeError::getFileName)
                .containsExactly("23-000001 ARP.pdf");
        }
    }

    @Nested
    @DisplayName("Inbox")
    class Inbox {

        @TempDir
        Path inbox;

        @Test
        void processesOnlyPdfFiles() throws Exception {
            Files.write(inbox.resolve("23-001234 ARP.pdf"), new byte[] {1});
            Files.write(inbox.resolve("23-001234 Approval.pdf"), new byte[] {1});
            Files.writeString(inbox.resolve("notes.txt"), "call the clerk");
            pageTexts.put("23-001234 ARP.pdf", ExtractionFixtures.fixture("arp-standard.txt"));
            properties.getInbox().setDir(inbox.toString());

            BatchIntakeResponse response = pipeline.processInbox();

            assertThat(response.getResults()).hasSize(2);
            assertThat(response.getTotalProcessed()).isEqualTo(1);
            assertThat(response.getTotalSkipped()).isEqualTo(1);
            verify(cascade, times(1)).run(any());
        }

        @Test
        void missingInboxIsAnError() {
            properties.getInbox().setDir(inbox.resolve("absent").toString());

            assertThatThrownBy(() -> pipeline.processInbox()).isInstanceOf(java.io.IOException.class);
        }
    }

    @Test
    void routingByFileName() {
        assertThat(IntakePipelineService.shouldSkip("23-001234 APPROVALS.pdf")).isTrue();
        assertThat(IntakePipelineService.classifyByName("23-001234 Order Appointing.pdf")).isEqualTo(DocumentType.ORDER);
        assertThat(IntakePipelineService.classifyByName("23-001234 ARP.pdf")).isEqualTo(DocumentType.ARP);
        assertThat(IntakePipelineService.classifyByName("scan.pdf")).isEqualTo(DocumentType.UNKNOWN);
    }
}
