package com.storeflow.common.model;

public enum PaymentType {
    CUSTOMER,
    SUPPLIER
}
