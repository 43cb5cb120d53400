package com.example.guardianintake.service.ocr;

import com.example.guardianintake.dto.IntakeDocument;
import com.example.guardianintake.dto.ocr.EngineOutcome;

/**
 * Uniform contract over one OCR backend: document in, text out.
 */
public interface OcrEngine {

    /**
     * Stable identifier recorded in provenance.
     */
    String getName();

    /**
     * Position in the cascade (lower number = cheaper, tried first).
     */
    int getPriority();

    /**
     * Whether the engine is switched on and configured.
     */
    boolean isEnabled();

    /**
     * Whether the engine has quota left right now.
     */
    boolean isAvailable();

    /**
     * Extracts the document's text. Must not throw; failures are reported in the outcome.
     *
     * @param document the PDF to read
     * @return the text produced, or an error outcome
     */
    EngineOutcome attempt(IntakeDocument document);
}
