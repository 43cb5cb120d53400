package com.example.guardianintake.config;

/**
 * The rules table could not be read or contains an invalid entry.
 */
public class IntakeRulesException extends RuntimeException {

    public IntakeRulesException(String message) {
        super(message);
    }

    public IntakeRulesException(String message, Throwable cause) {
        super(message, cause);
    }
}
