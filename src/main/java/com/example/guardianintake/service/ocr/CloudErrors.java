package com.example.guardianintake.service.ocr;

import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.concurrent.TimeoutException;

/**
 * Classifies cloud call failures as transient (worth one retry) or permanent.
 */
final class CloudErrors {

    private CloudErrors() {
    }

    static boolean isTransient(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof TimeoutException || current instanceof WebClientRequestException) {
                return true;
            }
            if (current instanceof WebClientResponseException) {
                int status = ((WebClientResponseException) current).getStatusCode().value();
                return status == 429 || status >= 500;
            }
            current = current.getCause();
        }
        return false;
    }

    static String describe(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
