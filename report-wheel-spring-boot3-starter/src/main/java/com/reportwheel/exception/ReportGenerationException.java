package com.reportwheel.exception;

public class ReportGenerationException extends CollaboratorFailureException {

    public ReportGenerationException(String message, boolean retryable) {
        super("GENERATION_FAILED", message, retryable, null);
    }

    public ReportGenerationException(String message, boolean retryable, Throwable cause) {
        super("GENERATION_FAILED", message, retryable, cause);
    }
}
