package com.example.guardianintake.controller;

import com.example.guardianintake.model.CaseField;
import com.example.guardianintake.model.CaseRecord;
import com.example.guardianintake.repository.CaseRecordRepository;
import com.example.guardianintake.service.extraction.CauseNumbers;
import com.example.guardianintake.service.store.CaseNotFoundException;
import com.example.guardianintake.service.store.CaseStoreLock;
import com.example.guardianintake.service.store.RecordAssemblerService;
import com.example.guardianintake.service.store.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/cases")
public class CaseController {

    private static final Logger logger = LoggerFactory.getLogger(CaseController.class);

    @Autowired
    private CaseRecordRepository caseRecordRepository;

    @Autowired
    private RecordAssemblerService recordAssembler;

    @Autowired
    private CaseStoreLock storeLock;

    @GetMapping
    public ResponseEntity<List<CaseRecord>> getAllCases() {
        return ResponseEntity.ok(caseRecordRepository.findAllByOrderByLastUpdatedDesc());
    }

    @GetMapping("/review")
    public ResponseEntity<List<CaseRecord>> getCasesNeedingReview() {
        return ResponseEntity.ok(caseRecordRepository.findByNeedsReviewTrue());
    }

    @GetMapping("/{causeNumber}")
    public ResponseEntity<?> getCase(@PathVariable String causeNumber) {
        String normalized = CauseNumbers.normalize(causeNumber);
        if (normalized == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "Not a cause number: " + causeNumber));
        }
        return caseRecordRepository.findByCauseNumber(normalized)
            .<ResponseEntity<?>>map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(Map.of("error", "No case with cause number " + normalized)));
    }

    /**
     * Marks a field as checked by a person, optionally with a corrected value in the body
     * ({@code {"value": "..."}}). Verified fields are never overwritten by extraction.
     */
    @PutMapping("/{causeNumber}/fields/{field}/verify")
    public ResponseEntity<?> verifyField(@PathVariable String causeNumber, @PathVariable String field,
                                         @RequestBody(required = false) Map<String, String> body) {
        return withStore(causeNumber, field, (cause, caseField) ->
            recordAssembler.verifyField(cause, caseField, body != null ? body.get("value") : null));
    }

    /**
     * Flags a field so the next extraction may replace it.
     */
    @PutMapping("/{causeNumber}/fields/{field}/review")
    public ResponseEntity<?> flagField(@PathVariable String causeNumber, @PathVariable String field) {
        return withStore(causeNumber, field, recordAssembler::flagField);
    }

    private ResponseEntity<?> withStore(String causeNumber, String field, FieldAction action) {
        try {
            String normalized = CauseNumbers.normalize(causeNumber);
            if (normalized == null) {
                throw new IllegalArgumentException("Not a cause number: " + causeNumber);
            }
            CaseField caseField = CaseField.fromName(field);
            try (CaseStoreLock.Handle ignored = storeLock.acquire()) {
                return ResponseEntity.ok(action.apply(normalized, caseField));
            }
        } catch (IllegalArgumentException e) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of("error", e.getMessage()));
        } catch (CaseNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        } catch (StoreUnavailableException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            logger.error("Error updating case {}", causeNumber, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("error", e.getMessage() != null ? e.getMessage() : "Internal server error"));
        }
    }

    @FunctionalInterface
    private interface FieldAction {
        CaseRecord apply(String causeNumber, CaseField field);
    }
}
