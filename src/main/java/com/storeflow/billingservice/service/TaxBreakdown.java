package com.storeflow.billingservice.service;

import com.storeflow.common.util.Money;
import lombok.Value;

import java.math.BigDecimal;

/**
 * GST split for one bill. Either {@code cgst + sgst} or {@code igst} is non-zero, never both.
 */
@Value
public class TaxBreakdown {
    BigDecimal cgst;
    BigDecimal sgst;
    BigDecimal igst;

    public static TaxBreakdown none() {
        return new TaxBreakdown(Money.ZERO, Money.ZERO, Money.ZERO);
    }

    public BigDecimal getTotal() {
        return cgst.add(sgst).add(igst);
    }
}
