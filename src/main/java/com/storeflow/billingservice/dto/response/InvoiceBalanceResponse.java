package com.storeflow.billingservice.dto.response;

import com.storeflow.common.model.InvoiceStatus;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;

/**
 * Balance of one invoice, recomputed from its payments on every request.
 */
@Data
@Builder
public class InvoiceBalanceResponse {
    private String invoiceId;
    private String invoiceNumber;
    private BigDecimal grandTotal;
    private BigDecimal amountPaid;
    private BigDecimal remainingBalance;
    private int paymentCount;
    private InvoiceStatus status;          // as stored
    private InvoiceStatus projectedStatus; // what the payments justify
}
