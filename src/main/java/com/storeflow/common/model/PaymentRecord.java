package com.storeflow.common.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PaymentRecord {
    private String paymentId;
    private PaymentType type;
    private String relatedInvoiceId;
    private String counterpartyName;
    private BigDecimal amountPaid;

    // Snapshots taken when the payment was recorded. Never read back for balance decisions.
    private BigDecimal originalAmount;
    private BigDecimal remainingBalance;

    private String method;
    private PaymentStatus status;
    private String isoDate;
    private String createdBy;
}
