package com.storeflow.billingservice.service;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Payment totals across every recorded payment, and the same totals restricted to one day.
 */
@Value
@Builder
public class PaymentMetrics {
    BigDecimal totalReceived;
    BigDecimal totalSent;
    BigDecimal pendingFromCustomers;
    BigDecimal pendingToSuppliers;
    long failedCount;

    BigDecimal receivedToday;
    BigDecimal sentToday;
    BigDecimal pendingFromCustomersToday;
    BigDecimal pendingToSuppliersToday;
    long failedToday;
}
