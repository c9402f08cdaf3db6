package com.storeflow.common.model;

public enum LedgerPaymentStatus {
    PAID,
    PENDING,
    PARTIAL
}
