package com.carestock.exception;

public class ItemNotFoundException extends CareStockException {
    public ItemNotFoundException(Long itemId) {
        super("ITEM_NOT_FOUND", "Inventory item with id '" + itemId + "' not found.");
    }
}
