package com.carestock.exception;

public class StockValidationException extends CareStockException {
    public StockValidationException(String message) {
        super("VALIDATION_ERROR", message);
    }
}
