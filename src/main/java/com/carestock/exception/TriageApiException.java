package com.carestock.exception;

public class TriageApiException extends CareStockException {
    public TriageApiException(String message) {
        super("TRIAGE_ERROR", message);
    }
    public TriageApiException(String message, Throwable cause) {
        super("TRIAGE_ERROR", message, cause);
    }
}
