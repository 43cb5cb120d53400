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
 * Google Cloud Vision DOCUMENT_TEXT_DETECTION over rendered pages. First cloud tier.
 */
@Component
public class GoogleVisionOcrEngine implements OcrEngine {

    private static final Logger logger = LoggerFactory.getLogger(GoogleVisionOcrEngine.class);

    public static final String NAME = "google-vision";

    @Value("${google.vision.api.key:}")
    private String apiKey;

    @Value("${google.vision.api.enabled:false}")
    private boolean enabled;

    @Value("${google.vision.api.url:https://vision.googleapis.com/v1/images:annotate}")
    private String apiUrl;

    @Value("${google.vision.priority:30}")
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
            logger.info("✅ Google Vision OCR engine configured");
        } else {
            logger.info("ℹ️ Google Vision OCR engine is disabled or has no API key");
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

        StringBuilder text = new StringBuilder();
        for (BufferedImage page : pages) {
            if (!rateLimiter.acquire(NAME)) {
                return EngineOutcome.error("Google Vision quota exhausted", true);
            }
            try {
                String base64 = Base64.getEncoder().encodeToString(pageRenderer.toPng(page));
                String response = webClient.post()
                    .uri(apiUrl + "?key=" + apiKey)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(buildRequestJson(base64))
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofSeconds(timeoutSeconds))
                    .block();
                text.append(parseResponse(response)).append('\n');
            } catch (Exception e) {
                boolean retryable = CloudErrors.isTransient(e);
                logger.warn("⚠️ Google Vision call failed for {} (transient: {}): {}",
                           document.getFileName(), retryable, CloudErrors.describe(e));
                return EngineOutcome.error("Google Vision error: " + CloudErrors.describe(e), retryable);
            }
        }
        return EngineOutcome.text(text.toString());
    }

    private String buildRequestJson(String base64Image) {
        ObjectNode root = objectMapper.createObjectNode();
        ArrayNode requests = root.putArray("requests");
        ObjectNode request = requests.addObject();
        request.putObject("image").put("content", base64Image);
        request.putArray("features").addObject().put("type", "DOCUMENT_TEXT_DETECTION");
        request.putObject("imageContext").putArray("languageHints").add("en");
        return root.toString();
    }

    String parseResponse(String response) throws IOException {
        if (response == null || response.isEmpty()) {
            return "";
        }
        JsonNode first = objectMapper.readTree(response).path("responses").path(0);
        if (first.has("error")) {
            throw new IOException("Vision API error: " + first.path("error").path("message").asText("unknown"));
        }
        JsonNode fullText = first.path("fullTextAnnotation").path("text");
        if (fullText.isTextual()) {
            return fullText.asText();
        }
        // Older responses only carry textAnnotations; the first entry is the whole page
        return first.path("textAnnotations").path(0).path("description").asText("");
    }
}
