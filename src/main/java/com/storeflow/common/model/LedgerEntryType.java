package com.storeflow.common.model;

public enum LedgerEntryType {
    SALE,
    PURCHASE
}
