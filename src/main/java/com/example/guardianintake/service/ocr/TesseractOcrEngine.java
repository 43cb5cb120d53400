package com.example.guardianintake.service.ocr;

import com.example.guardianintake.dto.IntakeDocument;
import com.example.guardianintake.dto.ocr.EngineOutcome;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.TesseractException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.concurrent.Semaphore;

/**
 * Local Tesseract OCR over rendered pages. Each page is read with two segmentation
 * modes (single column and uniform block) and the longer reading is kept.
 */
@Component
public class TesseractOcrEngine implements OcrEngine {

    private static final Logger logger = LoggerFactory.getLogger(TesseractOcrEngine.class);

    public static final String NAME = "tesseract";

    private static final int PSM_SINGLE_COLUMN = 4;
    private static final int PSM_UNIFORM_BLOCK = 6;

    // Tesseract instances are not thread-safe
    private static final ThreadLocal<Tesseract> tesseractThreadLocal = new ThreadLocal<>();

    @Value("${ocr.tesseract.enabled:true}")
    private boolean enabled;

    @Value("${ocr.tesseract.priority:20}")
    private int priority;

    @Value("${tesseract.datapath:}")
    private String tesseractDataPath;

    @Value("${tesseract.language:eng}")
    private String language;

    @Autowired
    private PdfPageRenderer pageRenderer;

    private final Semaphore ocrSemaphore = new Semaphore(1);

    private String resolvedDataPath;

    @PostConstruct
    public void initialize() {
        resolvedDataPath = resolveDataPath();
        if (!enabled) {
            logger.info("ℹ️ Tesseract OCR engine is disabled");
        } else if (resolvedDataPath == null) {
            logger.warn("⚠️ Tesseract data path not found. Set 'tesseract.datapath' if local OCR fails");
        } else {
            logger.info("✅ Tesseract OCR engine ready (tessdata: {})", resolvedDataPath);
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
        return enabled;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public EngineOutcome attempt(IntakeDocument document) {
        List<BufferedImage> pages;
        try {
            pages = pageRenderer.renderPages(document.getContent());
        } catch (IOException e) {
            return EngineOutcome.error("Could not render pages: " + e.getMessage(), false);
        }

        try {
            ocrSemaphore.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return EngineOutcome.error("Interrupted while waiting for Tesseract", true);
        }

        try {
            Tesseract tesseract = getTesseractInstance();
            StringBuilder text = new StringBuilder();
            for (BufferedImage page : pages) {
                BufferedImage gray = pageRenderer.toGrayscale(page);
                String columnReading = read(tesseract, gray, PSM_SINGLE_COLUMN);
                String blockReading = read(tesseract, gray, PSM_UNIFORM_BLOCK);
                String best = blockReading.length() > columnReading.length() ? blockReading : columnReading;
                text.append(best).append('\n');
            }
            logger.debug("Tesseract read {} characters from {} pages of {}",
                        text.length(), pages.size(), document.getFileName());
            return EngineOutcome.text(text.toString());
        } catch (TesseractException e) {
            logger.warn("⚠️ Tesseract OCR error on {}: {}", document.getFileName(), e.getMessage());
            return EngineOutcome.error("Tesseract error: " + e.getMessage(), false);
        } catch (UnsatisfiedLinkError | NoClassDefFoundError e) {
            logger.error("❌ Tesseract native library unavailable: {}", e.getMessage());
            return EngineOutcome.error("Tesseract native library unavailable", false);
        } finally {
            ocrSemaphore.release();
        }
    }

    private String read(Tesseract tesseract, BufferedImage image, int pageSegMode) throws TesseractException {
        tesseract.setPageSegMode(pageSegMode);
        String text = tesseract.doOCR(image);
        return text == null ? "" : text.trim();
    }

    private Tesseract getTesseractInstance() {
        Tesseract instance = tesseractThreadLocal.get();
        if (instance == null) {
            instance = new Tesseract();
            // 1 = LSTM only
            instance.setOcrEngineMode(1);
            if (resolvedDataPath != null) {
                instance.setDatapath(resolvedDataPath);
            }
            instance.setLanguage(language);
            tesseractThreadLocal.set(instance);
        }
        return instance;
    }

    private String resolveDataPath() {
        if (tesseractDataPath != null && !tesseractDataPath.isEmpty()) {
            return tesseractDataPath;
        }
        String[] candidates = {
            System.getenv("TESSDATA_PREFIX"),
            "C:/Program Files/Tesseract-OCR/tessdata",
            "/usr/share/tesseract-ocr/5/tessdata",
            "/usr/share/tesseract-ocr/4.00/tessdata",
            "/usr/local/share/tessdata",
            "/opt/homebrew/share/tessdata",
            "./tessdata"
        };
        for (String path : candidates) {
            if (path != null && new File(path).isDirectory()) {
                return path;
            }
        }
        return null;
    }
}
