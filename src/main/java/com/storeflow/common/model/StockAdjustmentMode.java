package com.storeflow.common.model;

public enum StockAdjustmentMode {
    SET,
    ADD,
    SUBTRACT
}
