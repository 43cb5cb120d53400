package com.example.guardianintake.controller;

import com.example.guardianintake.dto.BatchIntakeResponse;
import com.example.guardianintake.dto.DocumentType;
import com.example.guardianintake.dto.IntakeDocument;
import com.example.guardianintake.dto.IntakeResultSummary;
import com.example.guardianintake.dto.IntakeResultSummary.Outcome;
import com.example.guardianintake.service.IntakePipelineService;
import com.example.guardianintake.service.ocr.OcrCascadeService;
import com.example.guardianintake.service.ocr.OcrEngine;
import com.example.guardianintake.service.ocr.RateLimiterService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(IntakeController.class)
class IntakeControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private IntakePipelineService intakePipelineService;

    @MockBean
    private OcrCascadeService ocrCascadeService;

    @MockBean
    private RateLimiterService rateLimiterService;

    private static MockMultipartFile pdf(String name) {
        return new MockMultipartFile("file", name, "application/pdf", new byte[] {'%', 'P', 'D', 'F'});
    }

    private static IntakeResultSummary summary(Outcome outcome) {
        IntakeResultSummary summary = new IntakeResultSummary();
        summary.setFileName("23-001234 ARP.pdf");
        summary.setDocumentType(DocumentType.ARP);
        summary.setOutcome(outcome);
        summary.setCauseNumber("23-001234");
        return summary;
    }

    @Test
    void processesUploadedPdfWithHint() throws Exception {
        when(intakePipelineService.process(any(IntakeDocument.class))).thenReturn(summary(Outcome.PROCESSED));

        mockMvc.perform(multipart("/api/intake/documents").file(pdf("23-001234 ARP.pdf"))
                .param("causeNumberHint", "23-001234"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.outcome").value("PROCESSED"))
            .andExpect(jsonPath("$.causeNumber").value("23-001234"));

        ArgumentCaptor<IntakeDocument> captor = ArgumentCaptor.forClass(IntakeDocument.class);
        verify(intakePipelineService).process(captor.capture());
        assertThat(captor.getValue().getFileName()).isEqualTo("23-001234 ARP.pdf");
        assertThat(captor.getValue().getCauseNumberHint()).isEqualTo("23-001234");
    }

    @Test
    void rejectsNonPdfUpload() throws Exception {
        MockMultipartFile text = new MockMultipartFile("file", "notes.txt", "text/plain", "hello".getBytes());

        mockMvc.perform(multipart("/api/intake/documents").file(text))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("File must be a PDF"));

        verify(intakePipelineService, never()).process(any(IntakeDocument.class));
    }

    @Test
    void rejectsEmptyUpload() throws Exception {
        MockMultipartFile empty = new MockMultipartFile("file", "empty.pdf", "application/pdf", new byte[0]);

        mockMvc.perform(multipart("/api/intake/documents").file(empty))
            .andExpect(status().isBadRequest());
    }

    @Test
    void lockedStoreIsConflict() throws Exception {
        when(intakePipelineService.process(any(IntakeDocument.class))).thenReturn(summary(Outcome.STORE_UNAVAILABLE));

        mockMvc.perform(multipart("/api/intake/documents").file(pdf("23-001234 ARP.pdf")))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.outcome").value("STORE_UNAVAILABLE"));
    }

    @Test
    void failedDocumentIsUnprocessable() throws Exception {
        when(intakePipelineService.process(any(IntakeDocument.class))).thenReturn(summary(Outcome.FAILED));

        mockMvc.perform(multipart("/api/intake/documents").file(pdf("23-001234 ARP.pdf")))
            .andExpect(status().isUnprocessableEntity());
    }

    @Test
    void reviewRequiredIsStillOk() throws Exception {
        when(intakePipelineService.process(any(IntakeDocument.class))).thenReturn(summary(Outcome.REVIEW_REQUIRED));

        mockMvc.perform(multipart("/api/intake/documents").file(pdf("23-001234 ARP.pdf")))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.outcome").value("REVIEW_REQUIRED"));
    }

    @Test
    void runsInbox() throws Exception {
        BatchIntakeResponse response = new BatchIntakeResponse();
        response.add(summary(Outcome.PROCESSED));
        when(intakePipelineService.processInbox()).thenReturn(response);

        mockMvc.perform(post("/api/intake/inbox/run"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.totalProcessed").value(1))
            .andExpect(jsonPath("$.results[0].fileName").value("23-001234 ARP.pdf"));
    }

    @Test
    void missingInboxIsBadRequest() throws Exception {
        when(intakePipelineService.processInbox()).thenThrow(new IOException("Inbox directory not found: /nowhere"));

        mockMvc.perform(post("/api/intake/inbox/run"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Inbox directory not found: /nowhere"));
    }

    @Test
    void listsEnginesWithStatisticsAndQuota() throws Exception {
        OcrEngine engine = mock(OcrEngine.class);
        when(engine.getName()).thenReturn("google-vision");
        when(engine.getPriority()).thenReturn(30);
        when(engine.isEnabled()).thenReturn(true);
        when(engine.isAvailable()).thenReturn(false);
        when(ocrCascadeService.getEngines()).thenReturn(List.of(engine));
        when(ocrCascadeService.getStatistics()).thenReturn(Map.of("documents", 3));
        when(rateLimiterService.remainingToday()).thenReturn(Map.of("google-vision", 0));

        mockMvc.perform(get("/api/intake/engines"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.engines[0].name").value("google-vision"))
            .andExpect(jsonPath("$.engines[0].available").value(false))
            .andExpect(jsonPath("$.statistics.documents").value(3))
            .andExpect(jsonPath("$.quotaRemainingToday['google-vision']").value(0));
    }
}
