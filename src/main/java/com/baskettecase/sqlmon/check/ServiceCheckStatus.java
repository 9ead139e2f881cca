package com.baskettecase.sqlmon.check;

public enum ServiceCheckStatus {
    OK,
    CRITICAL
}
