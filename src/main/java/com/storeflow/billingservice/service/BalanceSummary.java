package com.storeflow.billingservice.service;

import com.storeflow.common.model.InvoiceStatus;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class BalanceSummary {
    BigDecimal grandTotal;
    BigDecimal amountPaid;
    BigDecimal remainingBalance;
    int countedPayments;
    InvoiceStatus derivedStatus;
}
