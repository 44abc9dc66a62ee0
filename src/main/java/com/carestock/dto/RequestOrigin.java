package com.carestock.dto;

public enum RequestOrigin {
    AUTOMATIC,
    MANUAL
}
