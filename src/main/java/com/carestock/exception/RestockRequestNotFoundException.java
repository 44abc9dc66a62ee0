package com.carestock.exception;

public class RestockRequestNotFoundException extends CareStockException {
    public RestockRequestNotFoundException(Long requestId) {
        super("RESTOCK_REQUEST_NOT_FOUND", "Restock request with id '" + requestId + "' not found.");
    }
}
