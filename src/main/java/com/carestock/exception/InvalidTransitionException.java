package com.carestock.exception;

import com.carestock.dto.RestockStatus;

public class InvalidTransitionException extends CareStockException {
    public InvalidTransitionException(Long requestId, RestockStatus from, RestockStatus to) {
        super("INVALID_TRANSITION",
              "Restock request '" + requestId + "' cannot move from " + from + " to " + to + ".");
    }
}
