package com.storeflow.billingservice.service;

import com.storeflow.common.model.InvoiceLine;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Everything needed to create or edit one bill.
 * <p>
 * {@code invoiceId} is null for a new bill. {@code expectedPreviousLines}, when present, are the
 * lines the caller loaded before editing; if the stored bill no longer has them the commit is
 * rejected as stale. A target line's {@code unitPrice} may be null, in which case a price is
 * looked up.
 */
@Value
@Builder
public class BillCommand {
    String invoiceId;
    String customerId;
    List<InvoiceLine> expectedPreviousLines;
    List<InvoiceLine> targetLines;
    TaxInputs taxInputs;
    String userId;
}
