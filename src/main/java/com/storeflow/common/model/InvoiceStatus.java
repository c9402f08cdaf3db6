package com.storeflow.common.model;

public enum InvoiceStatus {
    PENDING,
    PARTIALLY_PAID,
    PAID,
    OVERDUE,
    CANCELLED
}
