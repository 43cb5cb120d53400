package com.example.guardianintake.dto.ocr;

/**
 * What a single engine invocation produced. Engines report failure through this type
 * instead of throwing.
 */
public final class EngineOutcome {

    public enum Status {
        SUCCESS,
        ERROR
    }

    private final Status status;
    private final String text;
    private final String message;
    private final boolean transientFailure;

    private EngineOutcome(Status status, String text, String message, boolean transientFailure) {
        this.status = status;
        this.text = text == null ? "" : text;
        this.message = message;
        this.transientFailure = transientFailure;
    }

    public static EngineOutcome text(String text) {
        return new EngineOutcome(Status.SUCCESS, text, null, false);
    }

    public static EngineOutcome error(String message, boolean transientFailure) {
        return new EngineOutcome(Status.ERROR, "", message, transientFailure);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public Status getStatus() {
        return status;
    }

    public String getText() {
        return text;
    }

    public String getMessage() {
        return message;
    }

    /** Network trouble, timeouts, spent quotas and server-side errors; worth one retry. */
    public boolean isTransientFailure() {
        return transientFailure;
    }
}
