package com.storeflow.common.model;

public enum LedgerEntityType {
    CUSTOMER,
    SELLER,
    UNKNOWN_CUSTOMER
}
