package com.storeflow.common.model;

public enum PaymentStatus {
    COMPLETED,
    PENDING,
    FAILED,
    SENT,
    RECEIVED,
    PARTIAL
}
