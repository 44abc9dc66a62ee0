package com.carestock.dto;

public enum SweepMode {
    PREVIEW,
    COMMIT
}
