package com.storeflow.billingservice.dto.request;

import com.storeflow.common.model.InvoiceLine;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BillItemDto {
    @NotBlank(message = "Every bill item must reference a product.")
    private String productId;

    public static final int MAX_QUANTITY = 1_000_000;

    // Items with a quantity of zero or less are ignored.
    @Max(value = MAX_QUANTITY, message = "Quantity cannot exceed " + MAX_QUANTITY + ".")
    private int quantity;

    // Optional. When absent the price already on the bill, or else the catalog price, is used.
    @DecimalMin(value = "0.00", message = "Unit price cannot be negative.")
    @Digits(integer = 12, fraction = 2)
    private BigDecimal unitPrice;

    public InvoiceLine toLine() {
        return InvoiceLine.builder()
                .productId(productId)
                .quantity(quantity)
                .unitPrice(unitPrice)
                .build();
    }
}
