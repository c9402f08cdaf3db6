package com.storeflow.common.repository;

import com.storeflow.common.model.PaymentRecord;
import com.storeflow.common.model.PaymentStatus;
import com.storeflow.common.model.PaymentType;
import lombok.Builder;
import lombok.Value;

/**
 * Criteria for listing payments. Null fields match everything; {@code isoDate} matches on the
 * calendar date part of the payment's ISO timestamp.
 */
@Value
@Builder
public class PaymentFilter {
    PaymentType type;
    PaymentStatus status;
    String relatedInvoiceId;
    String isoDate;

    public static PaymentFilter all() {
        return PaymentFilter.builder().build();
    }

    public boolean matches(PaymentRecord payment) {
        return (type == null || type == payment.getType())
                && (status == null || status == payment.getStatus())
                && (relatedInvoiceId == null || relatedInvoiceId.equals(payment.getRelatedInvoiceId()))
                && (isoDate == null || (payment.getIsoDate() != null && payment.getIsoDate().startsWith(isoDate)));
    }
}
