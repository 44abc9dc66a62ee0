package com.carestock.exception;

public class TriageUnavailableException extends CareStockException {
    public TriageUnavailableException(Throwable cause) {
        super("TRIAGE_UNAVAILABLE",
              "The triage assistant is currently unavailable. Please try again later.",
              cause);
    }
}
