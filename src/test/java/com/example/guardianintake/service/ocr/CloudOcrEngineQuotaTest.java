package com.example.guardianintake.service.ocr;

import com.example.guardianintake.dto.DocumentType;
import com.example.guardianintake.dto.IntakeDocument;
import com.example.guardianintake.dto.ocr.EngineOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("Cloud engines with a spent quota")
class CloudOcrEngineQuotaTest {

    private PdfPageRenderer pageRenderer;
    private RateLimiterService rateLimiter;
    private final IntakeDocument document = new IntakeDocument("arp.pdf", new byte[] {1}, null, DocumentType.ARP);

    @BeforeEach
    void setUp() throws IOException {
        pageRenderer = mock(PdfPageRenderer.class);
        when(pageRenderer.renderPages(any())).thenReturn(List.of(new BufferedImage(10, 10,
            BufferedImage.TYPE_BYTE_GRAY)));

        rateLimiter = new RateLimiterService();
        ReflectionTestUtils.setField(rateLimiter, "enabled", true);
        ReflectionTestUtils.setField(rateLimiter, "requestsPerMinute", 0);
        ReflectionTestUtils.setField(rateLimiter, "requestsPerDay", 500);
    }

    private void wire(Object engine) {
        ReflectionTestUtils.setField(engine, "apiKey", "test-key");
        ReflectionTestUtils.setField(engine, "enabled", true);
        ReflectionTestUtils.setField(engine, "pageRenderer", pageRenderer);
        ReflectionTestUtils.setField(engine, "rateLimiter", rateLimiter);
    }

    @Test
    void googleVisionReportsSpentQuotaAsTransient() throws IOException {
        GoogleVisionOcrEngine engine = new GoogleVisionOcrEngine();
        wire(engine);

        EngineOutcome outcome = engine.attempt(document);

        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.isTransientFailure()).isTrue();
        assertThat(outcome.getMessage()).contains("quota");
        verify(pageRenderer, never()).toPng(any());
    }

    @Test
    void geminiReportsSpentQuotaAsTransient() throws IOException {
        GeminiVisionOcrEngine engine = new GeminiVisionOcrEngine();
        wire(engine);

        EngineOutcome outcome = engine.attempt(document);

        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.isTransientFailure()).isTrue();
        assertThat(outcome.getMessage()).contains("quota");
        verify(pageRenderer, never()).toPng(any());
    }
}
