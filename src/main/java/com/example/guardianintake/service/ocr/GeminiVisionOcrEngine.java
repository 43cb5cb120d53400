package com.example.guardianintake.service.ocr;

import com.example.guardianintake.dto.IntakeDocument;
import com.example.guardianintake.dto.ocr.EngineOutcome;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import jakarta.annotation.PostConstruct;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.time.Duration;
import java.util.Base64;
import java.util.List;

/**
 * Gemini vision transcription of rendered pages. Most expensive tier; reads handwriting best.
 */
@Component
public class GeminiVisionOcrEngine implements OcrEngine {

    private static final Logger logger = LoggerFactory.getLogger(GeminiVisionOcrEngine.class);

    public static final String NAME = "gemini-vision";

    private static final String TRANSCRIBE_PROMPT =
        "Transcribe all text on this scanned court form exactly as written, including handwriting. "
        + "Keep the original line breaks and field labels. Do not summarize, correct or add anything.";

    @Value("${gemini.api.key:}")
    private String apiKey;

    @Value("${gemini.api.enabled:false}")
    private boolean enabled;

    @Value("${gemini.api.url:https://generativelanguage.googleapis.com/v1beta/models}")
    private String apiUrl;

    @Value("${gemini.api.model:gemini-2.5-flash}")
    private String model;

    @Value("${gemini.priority:40}")
    private int priority;

    @Value("${ocr.cloud.timeout-seconds:30}")
    private int timeoutSeconds;

    @Autowired
    private PdfPageRenderer pageRenderer;

    @Autowired
    private RateLimiterService rateLimiter;

    @Autowired
    private ObjectMapper objectMapper;

    private WebClient webClient;

    @PostConstruct
    public void initialize() {
        webClient = WebClient.builder()
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(20 * 1024 * 1024))
            .build();
        if (isEnabled()) {
            logger.info("✅ Gemini vision OCR engine configured (model: {})", model);
        } else {
            logger.info("ℹ️ Gemini vision OCR engine is disabled or has no API key");
        }
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int getPriority() {
        return priority;
    }

    @Override
    public boolean isEnabled() {
        return enabled && apiKey != null && !apiKey.isEmpty();
    }

    @Override
    public boolean isAvailable() {
        return rateLimiter.wouldAllow(NAME);
    }

    @Override
    public EngineOutcome attempt(IntakeDocument document) {
        List<BufferedImage> pages;
        try {
            pages = pageRenderer.renderPages(document.getContent());
        } catch (IOException e) {
            return EngineOutcome.error("Could not render pages: " + e.getMessage(), false);
        }

        String url = String.format("%s/%s:generateContent?key=%s", apiUrl, model, apiKey);
        StringBuilder text = new StringBuilder();
        for (BufferedImage page : pages) {
            if (!rateLimiter.acquire(NAME)) {
                return EngineOutcome.error("Gemini quota exhausted", true);
            }
            try {
                String base64 = Base64.getEncoder().encodeToString(pageRenderer.toPng(page));
                String response = webClient.post()
                    .uri(url)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(buildVisionRequestJson(base64))
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofSeconds(timeoutSeconds))
                    .block();
                text.append(parseResponse(response)).append('\n');
            } catch (Exception e) {
                boolean retryable = CloudErrors.isTransient(e);
                logger.warn("⚠️ Gemini vision call failed for {} (transient: {}): {}",
                           document.getFileName(), retryable, CloudErrors.describe(e));
                return EngineOutcome.error("Gemini error: " + CloudErrors.describe(e), retryable);
            }
        }
        return EngineOutcome.text(text.toString());
    }

    private String buildVisionRequestJson(String base64Image) {
        ObjectNode root = objectMapper.createObjectNode();
        ArrayNode parts = root.putArray("contents").addObject().putArray("parts");
        parts.addObject().put("text", TRANSCRIBE_PROMPT);
        ObjectNode inline = parts.addObject().putObject("inline_data");
        inline.put("mime_type", "image/png");
        inline.put("data", base64Image);
        root.putObject("generationConfig").put("temperature", 0);
        return root.toString();
    }

    String parseResponse(String response) throws IOException {
        if (response == null || response.isEmpty()) {
            return "";
        }
        JsonNode root = objectMapper.readTree(response);
        if (root.has("error")) {
            throw new IOException("Gemini API error: " + root.path("error").path("message").asText("unknown"));
        }
        StringBuilder text = new StringBuilder();
        for (JsonNode part : root.path("candidates").path(0).path("content").path("parts")) {
            JsonNode value = part.path("text");
            if (value.isTextual()) {
                text.append(value.asText());
            }
        }
        return text.toString().trim();
    }
}
