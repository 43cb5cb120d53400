package com.example.guardianintake.service.ocr;

import com.example.guardianintake.dto.IntakeDocument;
import com.example.guardianintake.dto.ocr.EngineOutcome;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Reads the PDF's embedded text layer. Free and exact when the form was filled in digitally.
 */
@Component
public class NativeTextLayerEngine implements OcrEngine {

    private static final Logger logger = LoggerFactory.getLogger(NativeTextLayerEngine.class);

    public static final String NAME = "native-text-layer";

    @Value("${ocr.native.enabled:true}")
    private boolean enabled;

    @Value("${ocr.native.priority:10}")
    private int priority;

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
        return enabled;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public EngineOutcome attempt(IntakeDocument document) {
        try (PDDocument pdf = Loader.loadPDF(document.getContent())) {
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(true);
            String text = stripper.getText(pdf);
            logger.debug("Text layer of {} yielded {} characters over {} pages",
                        document.getFileName(), text.length(), pdf.getNumberOfPages());
            return EngineOutcome.text(text);
        } catch (IOException e) {
            logger.warn("⚠️ Could not read text layer of {}: {}", document.getFileName(), e.getMessage());
            return EngineOutcome.error("Unreadable PDF: " + e.getMessage(), false);
        }
    }
}
