package com.storeflow.billingservice.exception;

import lombok.Value;

/**
 * One product that cannot cover the stock a commit asked of it.
 * {@code requested} is the quantity the commit would take out; {@code available} is what is on hand.
 */
@Value
public class StockShortfall {
    String productId;
    int requested;
    int available;

    public int getShortfall() {
        return requested - available;
    }
}
