package com.carestock.exception;

import lombok.Getter;

@Getter
public class DuplicateOpenRequestException extends CareStockException {
    private final Long itemId;
    private final Long openRequestId;

    public DuplicateOpenRequestException(Long itemId, Long openRequestId) {
        super("DUPLICATE_OPEN_REQUEST",
              "Item '" + itemId + "' already has open restock request '" + openRequestId + "'.");
        this.itemId = itemId;
        this.openRequestId = openRequestId;
    }
}
