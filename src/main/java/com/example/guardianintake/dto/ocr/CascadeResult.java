package com.example.guardianintake.dto.ocr;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Text chosen by the cascade, the engine that produced it and every attempt made.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CascadeResult {

    private String text = "";
    private String engineName;
    private int charCount;
    private boolean lowConfidence;
    private List<ExtractionAttempt> attempts = new ArrayList<>();
    private Set<String> triedEngines = new LinkedHashSet<>();

    public boolean hasText() {
        return text != null && !text.isBlank();
    }
}
