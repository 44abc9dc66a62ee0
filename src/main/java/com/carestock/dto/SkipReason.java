package com.carestock.dto;

public enum SkipReason {
    UNKNOWN_USAGE,
    BELOW_TRIGGER,
    OPEN_REQUEST_EXISTS,
    ITEM_REMOVED
}
