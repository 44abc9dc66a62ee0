package com.carestock.exception;

import lombok.Getter;

@Getter
public abstract class CareStockException extends RuntimeException {
    private final String errorCode;
    protected CareStockException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    protected CareStockException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
