package com.example.guardianintake.controller;

import com.example.guardianintake.dto.BatchIntakeResponse;
import com.example.guardianintake.dto.DocumentType;
import com.example.guardianintake.dto.IntakeDocument;
import com.example.guardianintake.dto.IntakeResultSummary;
import com.example.guardianintake.service.IntakePipelineService;
import com.example.guardianintake.service.ocr.OcrCascadeService;
import com.example.guardianintake.service.ocr.OcrEngine;
import com.example.guardianintake.service.ocr.RateLimiterService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@RestController
@RequestMapping("/api/intake")
public class IntakeController {

    private static final Logger logger = LoggerFactory.getLogger(IntakeController.class);

    @Autowired
    private IntakePipelineService intakePipelineService;

    @Autowired
    private OcrCascadeService ocrCascadeService;

    @Autowired
    private RateLimiterService rateLimiterService;

    @PostMapping("/documents")
    public ResponseEntity<?> processDocument(
            @RequestParam("file") MultipartFile file,
            @RequestParam(value = "causeNumberHint", required = false) String causeNumberHint) {
        try {
            if (file.isEmpty()) {
                throw new IllegalArgumentException("File is empty");
            }
            String name = file.getOriginalFilename() != null ? file.getOriginalFilename() : "upload.pdf";
            boolean pdf = "application/pdf".equals(file.getContentType())
                || name.toLowerCase(Locale.ROOT).endsWith(".pdf");
            if (!pdf) {
                throw new IllegalArgumentException("File must be a PDF");
            }

            IntakeDocument document = new IntakeDocument(name, file.getBytes(), causeNumberHint, DocumentType.UNKNOWN);
            IntakeResultSummary summary = intakePipelineService.process(document);

            switch (summary.getOutcome()) {
                case STORE_UNAVAILABLE:
                    return ResponseEntity.status(HttpStatus.CONFLICT).body(summary);
                case FAILED:
                    return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(summary);
                default:
                    return ResponseEntity.ok(summary);
            }
        } catch (IllegalArgumentException e) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Map.of("error", e.getMessage() != null ? e.getMessage() : "Invalid request"));
        } catch (Exception e) {
            logger.error("Error processing uploaded document", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("error", e.getMessage() != null ? e.getMessage() : "Internal server error"));
        }
    }

    @PostMapping("/inbox/run")
    public ResponseEntity<?> runInbox() {
        try {
            BatchIntakeResponse response = intakePipelineService.processInbox();
            return ResponseEntity.ok(response);
        } catch (IOException e) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            logger.error("Error running inbox batch", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("error", e.getMessage() != null ? e.getMessage() : "Internal server error"));
        }
    }

    @GetMapping("/engines")
    public ResponseEntity<Map<String, Object>> getEngines() {
        List<Map<String, Object>> engines = new ArrayList<>();
        for (OcrEngine engine : ocrCascadeService.getEngines()) {
            Map<String, Object> info = new LinkedHashMap<>();
            info.put("name", engine.getName());
            info.put("priority", engine.getPriority());
            info.put("enabled", engine.isEnabled());
            info.put("available", engine.isAvailable());
            engines.add(info);
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("engines", engines);
        body.put("statistics", ocrCascadeService.getStatistics());
        body.put("quotaRemainingToday", rateLimiterService.remainingToday());
        return ResponseEntity.ok(body);
    }
}
