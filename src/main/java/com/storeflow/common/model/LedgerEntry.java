package com.storeflow.common.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class LedgerEntry {
    private String entryId;
    private String date;
    private LedgerEntryType type;
    private LedgerEntityType entityType;
    private String entityId;
    private String entityName;
    private List<InvoiceLine> items;
    private BigDecimal subTotal;
    private BigDecimal taxAmount;
    private BigDecimal grandTotal;
    private String paymentMethod;
    private LedgerPaymentStatus paymentStatus;
    private String notes;
    private String createdBy;
    private String createdIsoDate;
}
