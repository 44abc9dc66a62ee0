package com.carestock.dto;

import java.util.EnumSet;
import java.util.Set;

public enum RestockStatus {
    PENDING,
    APPROVED,
    DECLINED,
    FULFILLED;

    public static final Set<RestockStatus> OPEN = EnumSet.of(PENDING, APPROVED);

    public boolean isOpen() {
        return OPEN.contains(this);
    }
}
