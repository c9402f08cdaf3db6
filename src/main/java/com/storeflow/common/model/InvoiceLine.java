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
public class InvoiceLine {
    private String productId;
    private String name;
    private String unitOfMeasure;
    private int quantity;
    // Price snapshot taken when the line was billed.
    private BigDecimal unitPrice;
    private BigDecimal lineTotal;
}
