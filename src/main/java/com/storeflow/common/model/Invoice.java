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
public class Invoice {
    private String invoiceId;
    private String invoiceNumber;
    private String customerId;
    private String customerName;
    private List<InvoiceLine> lines;

    private BigDecimal subTotal;
    private BigDecimal cgst;
    private BigDecimal sgst;
    private BigDecimal igst;
    private BigDecimal grandTotal;

    private InvoiceStatus status;
    private String createdIsoDate;
    private String updatedIsoDate;
    private String createdBy;
}
