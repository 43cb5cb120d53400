package com.example.guardianintake.service.ocr;

import com.example.guardianintake.config.IntakeProperties;
import com.example.guardianintake.dto.IntakeDocument;
import com.example.guardianintake.dto.ocr.CascadeResult;
import com.example.guardianintake.dto.ocr.EngineOutcome;
import com.example.guardianintake.dto.ocr.ExtractionAttempt;
import com.example.guardianintake.dto.ocr.ExtractionAttempt.AttemptStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs OCR engines cheapest first and stops at the first one whose output is long enough.
 * When none is, the longest output is returned flagged as low confidence.
 */
@Service
public class OcrCascadeService {

    private static final Logger logger = LoggerFactory.getLogger(OcrCascadeService.class);

    @Autowired(required = false)
    private List<OcrEngine> engines;

    @Autowired
    private IntakeProperties intakeProperties;

    private List<OcrEngine> sortedEngines;

    private final AtomicInteger documentCounter = new AtomicInteger(0);
    private final AtomicInteger lowConfidenceCounter = new AtomicInteger(0);
    private final AtomicInteger escalationCounter = new AtomicInteger(0);
    private final Map<String, AtomicInteger> selectionCounters = new ConcurrentHashMap<>();

    @PostConstruct
    public void initialize() {
        if (engines == null || engines.isEmpty()) {
            logger.warn("⚠️ No OCR engines found. Documents will produce no text.");
            sortedEngines = new ArrayList<>();
            return;
        }

        sortedEngines = new ArrayList<>(engines);
        sortedEngines.sort(Comparator.comparingInt(OcrEngine::getPriority));

        logger.info("🔎 OCR cascade initialized with {} engines (threshold: {} chars):",
                   sortedEngines.size(), intakeProperties.getCascade().getSufficiencyThreshold());
        for (OcrEngine engine : sortedEngines) {
            String status = engine.isEnabled() ? "✅" : "❌";
            logger.info("   {} {} (priority: {})", status, engine.getName(), engine.getPriority());
        }
    }

    /**
     * Tries each enabled engine in cost order until one meets the sufficiency threshold.
     */
    public CascadeResult run(IntakeDocument document) {
        documentCounter.incrementAndGet();
        CascadeResult result = new CascadeResult();
        int threshold = intakeProperties.getCascade().getSufficiencyThreshold();

        String bestText = "";
        String bestEngine = null;
        int bestCount = -1;

        for (OcrEngine engine : usableEngines()) {
            EngineOutcome outcome = invokeWithRetry(engine, document, result);
            if (!outcome.isSuccess()) {
                continue;
            }

            int count = countSignificant(outcome.getText());
            if (count > bestCount) {
                bestText = outcome.getText();
                bestEngine = engine.getName();
                bestCount = count;
            }
            if (count >= threshold) {
                logger.info("✅ {}: {} produced {} characters", document.getFileName(), engine.getName(), count);
                select(result, outcome.getText(), engine.getName(), count, false);
                return result;
            }
        }

        if (bestEngine == null) {
            logger.warn("⚠️ {}: every OCR engine failed", document.getFileName());
            select(result, "", null, 0, true);
        } else {
            logger.warn("⚠️ {}: no engine reached {} characters; using {} ({} chars) as low confidence",
                       document.getFileName(), threshold, bestEngine, bestCount);
            select(result, bestText, bestEngine, bestCount, true);
        }
        lowConfidenceCounter.incrementAndGet();
        return result;
    }

    /**
     * Re-enters the cascade above the engine already chosen, skipping every engine tried
     * for this document. Attempts are appended to {@code previous}.
     *
     * @return the best new reading, or empty when no untried higher-tier engine produced text
     */
    public Optional<CascadeResult> escalate(IntakeDocument document, CascadeResult previous) {
        int floor = priorityOf(previous.getEngineName());
        int threshold = intakeProperties.getCascade().getSufficiencyThreshold();

        CascadeResult best = null;
        for (OcrEngine engine : usableEngines()) {
            if (engine.getPriority() <= floor || previous.getTriedEngines().contains(engine.getName())) {
                continue;
            }
            logger.info("⬆️ {}: escalating to {}", document.getFileName(), engine.getName());
            EngineOutcome outcome = invokeWithRetry(engine, document, previous);
            if (!outcome.isSuccess()) {
                continue;
            }

            int count = countSignificant(outcome.getText());
            if (best == null || count > best.getCharCount()) {
                best = new CascadeResult();
                best.setText(outcome.getText());
                best.setEngineName(engine.getName());
                best.setCharCount(count);
                best.setLowConfidence(count < threshold);
            }
            if (count >= threshold) {
                break;
            }
        }

        if (best == null) {
            return Optional.empty();
        }
        escalationCounter.incrementAndGet();
        best.setAttempts(previous.getAttempts());
        best.setTriedEngines(previous.getTriedEngines());
        return Optional.of(best);
    }

    private EngineOutcome invokeWithRetry(OcrEngine engine, IntakeDocument document, CascadeResult result) {
        result.getTriedEngines().add(engine.getName());
        EngineOutcome outcome = invoke(engine, document);
        record(result, engine, outcome, false);

        if (!outcome.isSuccess() && outcome.isTransientFailure()) {
            long backoff = intakeProperties.getCascade().getRetryBackoffMs();
            logger.debug("Retrying {} after {}ms: {}", engine.getName(), backoff, outcome.getMessage());
            if (backoff > 0) {
                try {
                    Thread.sleep(backoff);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return outcome;
                }
            }
            outcome = invoke(engine, document);
            record(result, engine, outcome, true);
        }
        return outcome;
    }

    private EngineOutcome invoke(OcrEngine engine, IntakeDocument document) {
        try {
            EngineOutcome outcome = engine.attempt(document);
            return outcome != null ? outcome : EngineOutcome.error("Engine returned nothing", false);
        } catch (RuntimeException e) {
            logger.warn("⚠️ Engine {} threw: {}", engine.getName(), e.getMessage());
            return EngineOutcome.error(e.getMessage(), false);
        }
    }

    private void record(CascadeResult result, OcrEngine engine, EngineOutcome outcome, boolean retried) {
        int count = outcome.isSuccess() ? countSignificant(outcome.getText()) : 0;
        AttemptStatus status;
        if (!outcome.isSuccess()) {
            status = AttemptStatus.ERROR;
        } else if (count >= intakeProperties.getCascade().getSufficiencyThreshold()) {
            status = AttemptStatus.SUCCESS;
        } else {
            status = AttemptStatus.INSUFFICIENT;
        }
        result.getAttempts().add(new ExtractionAttempt(engine.getName(), count, Instant.now(), status,
            outcome.getMessage(), retried));
        logger.debug("   {} -> {} ({} chars{})", engine.getName(), status, count, retried ? ", retry" : "");
    }

    private void select(CascadeResult result, String text, String engineName, int count, boolean lowConfidence) {
        result.setText(text);
        result.setEngineName(engineName);
        result.setCharCount(count);
        result.setLowConfidence(lowConfidence);
        if (engineName != null) {
            selectionCounters.computeIfAbsent(engineName, k -> new AtomicInteger()).incrementAndGet();
        }
    }

    private List<OcrEngine> usableEngines() {
        List<OcrEngine> usable = new ArrayList<>();
        if (sortedEngines == null) {
            return usable;
        }
        for (OcrEngine engine : sortedEngines) {
            if (engine.isEnabled() && engine.isAvailable()) {
                usable.add(engine);
            }
        }
        return usable;
    }

    private int priorityOf(String engineName) {
        if (engineName == null || sortedEngines == null) {
            return Integer.MIN_VALUE;
        }
        for (OcrEngine engine : sortedEngines) {
            if (engine.getName().equals(engineName)) {
                return engine.getPriority();
            }
        }
        return Integer.MIN_VALUE;
    }

    /**
     * Number of non-whitespace characters, the cascade's measure of output size.
     */
    public static int countSignificant(String text) {
        if (text == null) {
            return 0;
        }
        int count = 0;
        for (int i = 0; i < text.length(); i++) {
            if (!Character.isWhitespace(text.charAt(i))) {
                count++;
            }
        }
        return count;
    }

    public List<OcrEngine> getEngines() {
        return sortedEngines == null ? List.of() : List.copyOf(sortedEngines);
    }

    /**
     * Usage counters since startup.
     */
    public Map<String, Object> getStatistics() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("documents", documentCounter.get());
        stats.put("lowConfidence", lowConfidenceCounter.get());
        stats.put("escalations", escalationCounter.get());
        Map<String, Integer> selections = new LinkedHashMap<>();
        selectionCounters.forEach((name, counter) -> selections.put(name, counter.get()));
        stats.put("selectedEngine", selections);
        return stats;
    }
}
